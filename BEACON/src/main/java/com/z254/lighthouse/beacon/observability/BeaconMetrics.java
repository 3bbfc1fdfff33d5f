package com.z254.lighthouse.beacon.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for BEACON.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Detector runs, surfaced and suppressed alerts, detector errors</li>
 *     <li>Alert lifecycle transitions</li>
 *     <li>Remediation outcomes and guardrail blocks</li>
 * </ul>
 */
@Component
public class BeaconMetrics {

    private final MeterRegistry meterRegistry;

    // Detection metrics
    @Getter
    private final Counter detectorRuns;
    @Getter
    private final Counter alertsSurfaced;
    @Getter
    private final Counter alertsSuppressed;
    @Getter
    private final Counter detectorErrors;
    private final Timer scanLatency;
    private final Map<String, Counter> surfacedByType = new ConcurrentHashMap<>();

    // Lifecycle metrics
    private final AtomicInteger activeAlerts;
    private final Map<String, Counter> transitionsByStatus = new ConcurrentHashMap<>();

    // Remediation metrics
    @Getter
    private final Counter remediationsStarted;
    @Getter
    private final Counter remediationsCompleted;
    @Getter
    private final Counter remediationsFailed;
    @Getter
    private final Counter remediationsGuardrailBlocked;
    @Getter
    private final Counter stepsSkipped;
    private final Timer remediationDuration;
    private final Map<String, Counter> blocksByGuardrail = new ConcurrentHashMap<>();

    public BeaconMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.detectorRuns = Counter.builder("beacon.detection.runs")
                .description("Detector evaluations")
                .register(meterRegistry);
        this.alertsSurfaced = Counter.builder("beacon.alerts.surfaced")
                .description("Alerts surfaced after noise control")
                .register(meterRegistry);
        this.alertsSuppressed = Counter.builder("beacon.alerts.suppressed")
                .description("Detections suppressed by noise control")
                .register(meterRegistry);
        this.detectorErrors = Counter.builder("beacon.detection.errors")
                .description("Detector evaluations that failed")
                .register(meterRegistry);
        this.scanLatency = Timer.builder("beacon.detection.scan.latency")
                .description("Duration of a full product scan")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        this.activeAlerts = meterRegistry.gauge("beacon.alerts.active", new AtomicInteger(0));

        this.remediationsStarted = Counter.builder("beacon.remediations.started")
                .description("Remediations started")
                .register(meterRegistry);
        this.remediationsCompleted = Counter.builder("beacon.remediations.completed")
                .description("Remediations finished with every guardrail passed")
                .register(meterRegistry);
        this.remediationsFailed = Counter.builder("beacon.remediations.failed")
                .description("Remediations aborted by an execution error")
                .register(meterRegistry);
        this.remediationsGuardrailBlocked = Counter.builder("beacon.remediations.guardrail_blocked")
                .description("Remediations with at least one blocked step")
                .register(meterRegistry);
        this.stepsSkipped = Counter.builder("beacon.remediations.steps.skipped")
                .description("Remediation steps skipped by guardrails")
                .register(meterRegistry);
        this.remediationDuration = Timer.builder("beacon.remediations.duration")
                .description("Remediation planning and evaluation duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
    }

    // ========== Detection Methods ==========

    public void recordDetectorRun() {
        detectorRuns.increment();
    }

    public void recordAlertSurfaced(String alertType) {
        alertsSurfaced.increment();
        surfacedByType.computeIfAbsent(alertType, type ->
                Counter.builder("beacon.alerts.surfaced.by_type")
                        .tag("alert_type", type)
                        .description("Surfaced alerts by type")
                        .register(meterRegistry))
                .increment();
    }

    public void recordAlertSuppressed() {
        alertsSuppressed.increment();
    }

    public void recordDetectorError() {
        detectorErrors.increment();
    }

    public Timer.Sample startScanTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordScanCompleted(Timer.Sample sample) {
        sample.stop(scanLatency);
    }

    // ========== Lifecycle Methods ==========

    public void recordStateTransition(String status) {
        transitionsByStatus.computeIfAbsent(status, s ->
                Counter.builder("beacon.alerts.transitions")
                        .tag("status", s)
                        .description("Alert lifecycle transitions by target status")
                        .register(meterRegistry))
                .increment();
    }

    public void updateActiveAlerts(int count) {
        activeAlerts.set(count);
    }

    public int getActiveAlerts() {
        return activeAlerts.get();
    }

    // ========== Remediation Methods ==========

    public Timer.Sample startRemediationTimer() {
        remediationsStarted.increment();
        return Timer.start(meterRegistry);
    }

    public void recordRemediationCompleted(Timer.Sample sample, boolean guardrailsPassed, int skippedSteps) {
        sample.stop(remediationDuration);
        if (guardrailsPassed) {
            remediationsCompleted.increment();
        } else {
            remediationsGuardrailBlocked.increment();
        }
        if (skippedSteps > 0) {
            stepsSkipped.increment(skippedSteps);
        }
    }

    public void recordGuardrailBlock(String guardrail) {
        blocksByGuardrail.computeIfAbsent(guardrail, name ->
                Counter.builder("beacon.guardrails.blocks")
                        .tag("guardrail", name)
                        .description("Steps blocked by guardrail")
                        .register(meterRegistry))
                .increment();
    }

    public void recordRemediationFailed(Timer.Sample sample) {
        sample.stop(remediationDuration);
        remediationsFailed.increment();
    }
}
