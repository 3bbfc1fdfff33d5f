package com.z254.lighthouse.beacon.detection;

import com.z254.lighthouse.beacon.config.BeaconProperties;
import com.z254.lighthouse.beacon.domain.model.Alert;
import com.z254.lighthouse.beacon.domain.model.AlertBatch;
import com.z254.lighthouse.beacon.domain.model.AlertHistoryEntry;
import com.z254.lighthouse.beacon.domain.model.Entity;
import com.z254.lighthouse.beacon.domain.model.Severity;
import com.z254.lighthouse.beacon.domain.model.TimeWindow;
import com.z254.lighthouse.beacon.domain.repository.AlertStore;
import com.z254.lighthouse.beacon.kafka.AlertEventProducer;
import com.z254.lighthouse.beacon.observability.BeaconMetrics;
import com.z254.lighthouse.beacon.observability.BeaconStructuredLogger;
import com.z254.lighthouse.beacon.remediation.PlaybookOptions;
import com.z254.lighthouse.beacon.remediation.RemediationOrchestrator;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every enabled detector over a set of entities and assembles the resulting batch.
 * <p>
 * A failing detector or entity never aborts the run. Alerts are de-duplicated by identifier,
 * keeping the critical one when two collide. Surfaced alerts and the batch are published, and
 * each alert is handed to the remediation orchestrator when auto-remediation is on.
 */
@Slf4j
@Service
public class AlertEngine {

    static final Duration PERSISTENT_AFTER = Duration.ofHours(24);

    private final DetectorRegistry detectorRegistry;
    private final AlertStore alertStore;
    private final AlertEventProducer eventProducer;
    private final RemediationOrchestrator orchestrator;
    private final BeaconProperties properties;
    private final BeaconMetrics metrics;
    private final BeaconStructuredLogger logger;
    private final Clock clock;

    public AlertEngine(DetectorRegistry detectorRegistry,
                       AlertStore alertStore,
                       AlertEventProducer eventProducer,
                       RemediationOrchestrator orchestrator,
                       BeaconProperties properties,
                       BeaconMetrics metrics,
                       BeaconStructuredLogger logger,
                       Clock clock) {
        this.detectorRegistry = detectorRegistry;
        this.alertStore = alertStore;
        this.eventProducer = eventProducer;
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.metrics = metrics;
        this.logger = logger;
        this.clock = clock;
    }

    /**
     * Scan entities for a product.
     *
     * @param window comparison windows, or null to let each detector use its own
     */
    public AlertBatch checkProduct(String product, List<Entity> entities, TimeWindow window) {
        Timer.Sample sample = metrics.startScanTimer();
        Map<String, Alert> alerts = new LinkedHashMap<>();

        try (var scope = logger.withProduct(product)) {
            for (Entity entity : entities) {
                for (Detector detector : detectorRegistry.enabled()) {
                    DetectorResult result = runDetector(detector, entity, window);
                    if (result.isTriggered() && result.getAlert() != null) {
                        merge(alerts, result.getAlert());
                    }
                }
            }

            List<Alert> surfaced = new ArrayList<>(alerts.values());
            AlertBatch batch = AlertBatch.builder()
                    .generatedAt(clock.instant())
                    .product(product)
                    .alerts(surfaced)
                    .summary(summarize(surfaced))
                    .build();

            Instant now = clock.instant();
            metrics.updateActiveAlerts((int) alertStore.findAllStates().stream()
                    .filter(s -> s.isActiveAt(now)).count());
            log.info("Scan for {} finished: {} entities, {} alerts", product, entities.size(), surfaced.size());

            surfaced.forEach(eventProducer::publishAlert);
            eventProducer.publishBatch(batch);
            if (properties.getRemediation().isAutoRemediate()) {
                surfaced.forEach(this::triggerRemediation);
            }
            return batch;
        } finally {
            metrics.recordScanCompleted(sample);
        }
    }

    private DetectorResult runDetector(Detector detector, Entity entity, TimeWindow window) {
        try {
            return detector.detect(entity, window);
        } catch (RuntimeException e) {
            log.error("Detector {} failed for entity {}", detector.getType(), entity.getId(), e);
            metrics.recordDetectorError();
            return DetectorResult.notTriggered("Detection error: " + e.getMessage());
        }
    }

    private static void merge(Map<String, Alert> alerts, Alert alert) {
        Alert existing = alerts.get(alert.getId());
        if (existing == null
                || (alert.getSeverity() == Severity.CRITICAL && existing.getSeverity() != Severity.CRITICAL)) {
            alerts.put(alert.getId(), alert);
        }
    }

    private AlertBatch.Summary summarize(List<Alert> alerts) {
        Instant cutoff = clock.instant().minus(PERSISTENT_AFTER);
        AlertBatch.Summary summary = new AlertBatch.Summary();
        summary.setTotal(alerts.size());
        for (Alert alert : alerts) {
            switch (alert.getSeverity()) {
                case CRITICAL -> summary.setCritical(summary.getCritical() + 1);
                case HIGH -> summary.setHigh(summary.getHigh() + 1);
                case MEDIUM -> summary.setMedium(summary.getMedium() + 1);
                case LOW -> summary.setLow(summary.getLow() + 1);
            }
            boolean persistent = alertStore.getHistory(alert.getId()).stream()
                    .map(AlertHistoryEntry::getSeenAt)
                    .anyMatch(seenAt -> seenAt.isBefore(cutoff));
            if (persistent) {
                summary.setPersistent(summary.getPersistent() + 1);
            } else {
                summary.setNewAlerts(summary.getNewAlerts() + 1);
            }
        }
        return summary;
    }

    private void triggerRemediation(Alert alert) {
        PlaybookOptions options = PlaybookOptions.builder()
                .dryRun(properties.getRemediation().isDryRunDefault())
                .allowBidChanges(properties.getRemediation().isAllowBidChangesDefault())
                .build();

        orchestrator.remediate(alert, options)
                .subscribe(
                        remediation -> log.info("Auto-remediation for {} finished: guardrailsPassed={}, steps={}",
                                alert.getId(), remediation.isGuardrailsPassed(), remediation.getSteps().size()),
                        error -> log.error("Auto-remediation failed for {}", alert.getId(), error));
    }
}
