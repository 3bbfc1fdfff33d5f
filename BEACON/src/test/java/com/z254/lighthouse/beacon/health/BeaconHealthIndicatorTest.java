package com.z254.lighthouse.beacon.health;

import com.z254.lighthouse.beacon.config.AlertConfig;
import com.z254.lighthouse.beacon.config.BeaconProperties;
import com.z254.lighthouse.beacon.detection.Detector;
import com.z254.lighthouse.beacon.detection.DetectorRegistry;
import com.z254.lighthouse.beacon.domain.model.AlertState;
import com.z254.lighthouse.beacon.domain.model.AlertStatus;
import com.z254.lighthouse.beacon.domain.model.AlertType;
import com.z254.lighthouse.beacon.domain.repository.AlertStore;
import com.z254.lighthouse.beacon.domain.repository.InMemoryAlertStore;
import com.z254.lighthouse.beacon.remediation.InMemoryRemediationLog;
import com.z254.lighthouse.beacon.remediation.PlaybookRegistry;
import com.z254.lighthouse.beacon.remediation.playbooks.CpcJumpPlaybook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BeaconHealthIndicatorTest {

    private static final Instant NOW = Instant.parse("2024-03-20T12:00:00Z");

    @Mock
    private Detector detector;

    @Mock
    private AlertStore failingStore;

    private BeaconHealthIndicator indicator(List<Detector> detectors, AlertStore store) {
        return new BeaconHealthIndicator(new DetectorRegistry(detectors),
                new PlaybookRegistry(List.of(new CpcJumpPlaybook())), store, new InMemoryRemediationLog(),
                new BeaconProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void enabledDetector() {
        lenient().when(detector.getType()).thenReturn(AlertType.CPC_JUMP);
        lenient().when(detector.getConfig()).thenReturn(AlertConfig.defaultsFor(AlertType.CPC_JUMP));
    }

    @Test
    @DisplayName("should be up with alert counts")
    void up() {
        enabledDetector();
        InMemoryAlertStore store = new InMemoryAlertStore();
        store.upsertState("a-1", s -> AlertState.builder().alertId("a-1").build());
        store.upsertState("a-2", s -> AlertState.builder().alertId("a-2").status(AlertStatus.CLOSED).build());

        StepVerifier.create(indicator(List.of(detector), store).health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("detectorsEnabled", 1)
                            .containsEntry("playbooks", 1)
                            .containsEntry("trackedAlerts", 2)
                            .containsEntry("activeAlerts", 1L)
                            .containsEntry("dryRunDefault", true);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should be down without enabled detectors")
    void noDetectors() {
        StepVerifier.create(indicator(List.of(), new InMemoryAlertStore()).health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("detection.error", "No detectors enabled");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should be down when the alert store fails")
    void storeFailure() {
        enabledDetector();
        when(failingStore.findAllStates()).thenThrow(new IllegalStateException("store offline"));

        StepVerifier.create(indicator(List.of(detector), failingStore).health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails())
                            .containsEntry("alertStore.error", "Failed to read alert store: store offline");
                })
                .verifyComplete();
    }
}
