package com.z254.lighthouse.beacon.config;

import com.z254.lighthouse.beacon.domain.model.AlertType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BeaconPropertiesTest {

    private static BeaconProperties bind(Map<String, String> source) {
        Binder binder = new Binder(new MapConfigurationPropertySource(source));
        return binder.bindOrCreate("beacon", Bindable.of(BeaconProperties.class));
    }

    @Test
    @DisplayName("unconfigured detectors use built-in thresholds and the global window")
    void defaultsForUnconfiguredType() {
        AlertConfig config = new BeaconProperties().getDetection().configFor(AlertType.CTR_DROP);

        assertThat(config.getType()).isEqualTo(AlertType.CTR_DROP);
        assertThat(config.isEnabled()).isTrue();
        assertThat(config.getThresholds().getMinVolume()).isEqualTo(1000d);
        assertThat(config.getThresholds().getChangeFactor()).isEqualTo(0.6);
        assertThat(config.getThresholds().getBaselineDays()).isEqualTo(14);
        assertThat(config.getThresholds().getCurrentDays()).isEqualTo(3);
        assertThat(config.getNoiseControl().getConsecutiveChecks()).isEqualTo(2);
    }

    @Test
    @DisplayName("partial detector config binds from kebab-case keys and keeps the other defaults")
    void partialOverride() {
        BeaconProperties properties = bind(Map.of(
                "beacon.detection.default-window.baseline-days", "21",
                "beacon.detection.detectors.cpc-jump.thresholds.change-factor", "1.5",
                "beacon.detection.detectors.spend-drop.enabled", "false"));

        AlertConfig cpc = properties.getDetection().configFor(AlertType.CPC_JUMP);

        assertThat(cpc.getThresholds().getChangeFactor()).isEqualTo(1.5);
        assertThat(cpc.getThresholds().getMinVolume()).isEqualTo(50d);
        assertThat(cpc.getThresholds().getSeverityBands().getCritical()).isEqualTo(1.0);
        assertThat(cpc.getThresholds().getBaselineDays()).isEqualTo(21);
        assertThat(properties.getDetection().configFor(AlertType.SPEND_DROP).isEnabled()).isFalse();
    }

    @Test
    @DisplayName("landing page detector keeps its own noise control and short windows")
    void landingPageOverrides() {
        BeaconProperties properties = bind(Map.of(
                "beacon.detection.noise-control.consecutive-checks", "3"));

        AlertConfig lp = properties.getDetection().configFor(AlertType.LP_REGRESSION);
        AlertConfig ctr = properties.getDetection().configFor(AlertType.CTR_DROP);

        assertThat(lp.getNoiseControl().getConsecutiveChecks()).isEqualTo(1);
        assertThat(lp.getNoiseControl().cooldown().toHours()).isEqualTo(1);
        assertThat(lp.getThresholds().getCurrentDays()).isEqualTo(1);
        assertThat(ctr.getNoiseControl().getConsecutiveChecks()).isEqualTo(3);
    }

    @Test
    @DisplayName("threshold guardrails bind as a list")
    void guardrailDefinitions() {
        BeaconProperties properties = bind(Map.of(
                "beacon.remediation.guardrails[0].name", "bid_cost_ceiling",
                "beacon.remediation.guardrails[0].type", "reduce_bids",
                "beacon.remediation.guardrails[0].threshold", "500",
                "beacon.remediation.guardrails[0].critical", "false"));

        assertThat(properties.getRemediation().getGuardrails()).singleElement().satisfies(definition -> {
            assertThat(definition.getName()).isEqualTo("bid_cost_ceiling");
            assertThat(definition.getThreshold()).isEqualTo(500d);
            assertThat(definition.isCritical()).isFalse();
        });
        assertThat(properties.getRemediation().isDryRunDefault()).isTrue();
    }
}
