package com.z254.lighthouse.beacon.config;

import com.z254.lighthouse.beacon.domain.model.AlertType;
import com.z254.lighthouse.beacon.domain.model.TimeWindow;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for BEACON.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Detection windows, per-detector thresholds and noise control</li>
 *     <li>Remediation defaults and configured guardrails</li>
 *     <li>Kafka topics for alert and remediation events</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "beacon")
public class BeaconProperties {

    private final Detection detection = new Detection();
    private final Remediation remediation = new Remediation();
    private final Kafka kafka = new Kafka();

    /**
     * Detector configuration.
     */
    @Data
    public static class Detection {
        private final Window defaultWindow = new Window();

        private NoiseControlConfig noiseControl = new NoiseControlConfig();

        /** Keyed by alert type code, kebab-case in YAML (cpc-jump, ctr-drop...) */
        private Map<String, AlertConfig> detectors = new HashMap<>();

        /**
         * Effective configuration for a detector. Unset thresholds come from the built-in
         * defaults, unset windows from the default window and an unset noise control from
         * the global one.
         */
        public AlertConfig configFor(AlertType type) {
            AlertConfig configured = detectors.entrySet().stream()
                    .filter(e -> AlertType.fromCode(e.getKey()) == type)
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElseGet(AlertConfig::new);
            configured.setType(type);
            configured.fillFrom(AlertConfig.defaultsFor(type));

            AlertConfig.Thresholds thresholds = configured.getThresholds();
            if (thresholds.getBaselineDays() == null) {
                thresholds.setBaselineDays(defaultWindow.getBaselineDays());
            }
            if (thresholds.getCurrentDays() == null) {
                thresholds.setCurrentDays(defaultWindow.getCurrentDays());
            }
            if (configured.getNoiseControl() == null) {
                configured.setNoiseControl(noiseControl.copy());
            }
            return configured;
        }

        @Data
        public static class Window {
            @Positive
            private int baselineDays = 14;
            @Positive
            private int currentDays = 3;

            public TimeWindow toTimeWindow() {
                return TimeWindow.of(baselineDays, currentDays);
            }
        }
    }

    /**
     * Remediation defaults and guardrail policy.
     */
    @Data
    public static class Remediation {
        /** Plans are proposed but not applied unless a caller opts out */
        private boolean dryRunDefault = true;

        private boolean allowBidChangesDefault = false;

        /** Run the orchestrator for every surfaced alert */
        private boolean autoRemediate = false;

        /** Largest relative bid change allowed without a warning */
        @PositiveOrZero
        private double maxBidChange = 0.2;

        /** Largest absolute budget increase allowed */
        @PositiveOrZero
        private double maxBudgetIncrease = 100.0;

        /** Relative bid increase above which the safety guardrail warns */
        @PositiveOrZero
        private double maxBidIncreaseWarning = 0.1;

        private List<String> trademarkTerms = new ArrayList<>();

        private List<String> prohibitedTerms = new ArrayList<>(
                List.of("guaranteed", "100%", "risk-free", "no risk"));

        /** Threshold guardrails on estimated cost per step */
        private List<GuardrailDefinition> guardrails = new ArrayList<>();
    }

    /**
     * A cost ceiling for one action type.
     */
    @Data
    public static class GuardrailDefinition {
        @NotBlank
        private String name;
        /** Action type the guardrail watches */
        @NotBlank
        private String type;
        private double threshold;
        private boolean critical = true;
        private String message;
    }

    @Data
    public static class Kafka {
        private final Topics topics = new Topics();
        private boolean enabled = true;

        @Data
        public static class Topics {
            private String alertsSurfaced = "beacon.alerts.surfaced";
            private String alertBatches = "beacon.alerts.batches";
            private String remediationsApplied = "beacon.remediations.applied";
        }
    }
}
