package com.z254.lighthouse.beacon.health;

import com.z254.lighthouse.beacon.config.BeaconProperties;
import com.z254.lighthouse.beacon.detection.DetectorRegistry;
import com.z254.lighthouse.beacon.domain.model.AlertState;
import com.z254.lighthouse.beacon.domain.repository.AlertStore;
import com.z254.lighthouse.beacon.remediation.PlaybookRegistry;
import com.z254.lighthouse.beacon.remediation.RemediationLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for BEACON.
 * <p>
 * Reports detector and playbook coverage, tracked alert counts and remediation defaults.
 * Down when no detector is enabled or the alert store cannot be read.
 */
@Slf4j
@Component
public class BeaconHealthIndicator implements ReactiveHealthIndicator {

    private final DetectorRegistry detectorRegistry;
    private final PlaybookRegistry playbookRegistry;
    private final AlertStore alertStore;
    private final RemediationLog remediationLog;
    private final BeaconProperties beaconProperties;
    private final Clock clock;

    public BeaconHealthIndicator(DetectorRegistry detectorRegistry,
                                 PlaybookRegistry playbookRegistry,
                                 AlertStore alertStore,
                                 RemediationLog remediationLog,
                                 BeaconProperties beaconProperties,
                                 Clock clock) {
        this.detectorRegistry = detectorRegistry;
        this.playbookRegistry = playbookRegistry;
        this.alertStore = alertStore;
        this.remediationLog = remediationLog;
        this.beaconProperties = beaconProperties;
        this.clock = clock;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();
        boolean healthy = true;

        int enabledDetectors = detectorRegistry.enabled().size();
        details.put("detectorsEnabled", enabledDetectors);
        details.put("playbooks", playbookRegistry.listPlaybooks().size());
        if (enabledDetectors == 0) {
            healthy = false;
            details.put("detection.error", "No detectors enabled");
        }

        try {
            Instant now = clock.instant();
            List<AlertState> states = alertStore.findAllStates();
            details.put("trackedAlerts", states.size());
            details.put("activeAlerts", states.stream().filter(s -> s.isActiveAt(now)).count());
            details.put("remediationsLogged", remediationLog.findAll().size());
        } catch (RuntimeException e) {
            healthy = false;
            details.put("alertStore.error", "Failed to read alert store: " + e.getMessage());
            log.error("Health check failed for alert store", e);
        }

        details.put("autoRemediate", beaconProperties.getRemediation().isAutoRemediate());
        details.put("dryRunDefault", beaconProperties.getRemediation().isDryRunDefault());

        if (healthy) {
            return Health.up()
                    .withDetails(details)
                    .build();
        } else {
            return Health.down()
                    .withDetails(details)
                    .build();
        }
    }
}
