package com.z254.lighthouse.beacon.detection;

import com.z254.lighthouse.beacon.config.AlertConfig;
import com.z254.lighthouse.beacon.detection.source.Metric;
import com.z254.lighthouse.beacon.detection.source.MetricSource;
import com.z254.lighthouse.beacon.detection.stats.BaselineEvaluator;
import com.z254.lighthouse.beacon.detection.stats.CurrentPeriodEvaluator;
import com.z254.lighthouse.beacon.detection.stats.SeverityClassifier;
import com.z254.lighthouse.beacon.domain.model.Alert;
import com.z254.lighthouse.beacon.domain.model.AlertMetrics;
import com.z254.lighthouse.beacon.domain.model.BaselineData;
import com.z254.lighthouse.beacon.domain.model.CurrentData;
import com.z254.lighthouse.beacon.domain.model.Detection;
import com.z254.lighthouse.beacon.domain.model.Entity;
import com.z254.lighthouse.beacon.domain.model.Period;
import com.z254.lighthouse.beacon.domain.model.Severity;
import com.z254.lighthouse.beacon.domain.model.TimeWindow;
import com.z254.lighthouse.beacon.domain.repository.AlertStore;
import com.z254.lighthouse.beacon.observability.BeaconMetrics;
import com.z254.lighthouse.beacon.observability.BeaconStructuredLogger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Pipeline pieces shared by every detector: window arithmetic, evaluators, alert assembly,
 * noise control and history recording.
 * <p>
 * Windows are inclusive and do not overlap. The current window is the last
 * {@code currentDays} days ending today; the baseline is the {@code baselineDays} days
 * immediately before it.
 */
@Component
public class DetectionSupport {

    private final BaselineEvaluator baselineEvaluator;
    private final CurrentPeriodEvaluator currentEvaluator;
    private final SeverityClassifier severityClassifier;
    private final NoiseController noiseController;
    private final AlertStore alertStore;
    private final BeaconMetrics metrics;
    private final BeaconStructuredLogger logger;
    private final Clock clock;

    public DetectionSupport(BaselineEvaluator baselineEvaluator,
                            CurrentPeriodEvaluator currentEvaluator,
                            SeverityClassifier severityClassifier,
                            NoiseController noiseController,
                            AlertStore alertStore,
                            BeaconMetrics metrics,
                            BeaconStructuredLogger logger,
                            Clock clock) {
        this.baselineEvaluator = baselineEvaluator;
        this.currentEvaluator = currentEvaluator;
        this.severityClassifier = severityClassifier;
        this.noiseController = noiseController;
        this.alertStore = alertStore;
        this.metrics = metrics;
        this.logger = logger;
        this.clock = clock;
    }

    /**
     * Run a detector body, converting any failure into a non-triggered result.
     */
    public DetectorResult guarded(AlertConfig config, Entity entity, Supplier<DetectorResult> body) {
        metrics.recordDetectorRun();
        try {
            DetectorResult result = body.get();
            if (!result.isTriggered()) {
                logger.logDetectionEvent(null, config.getType().getCode(), entity.getId(),
                        BeaconStructuredLogger.DetectionEventType.NOT_TRIGGERED, "Detector did not trigger",
                        Map.of("reason", String.valueOf(result.getReason())));
            }
            return result;
        } catch (RuntimeException e) {
            metrics.recordDetectorError();
            logger.logDetectionEvent(null, config.getType().getCode(), entity.getId(),
                    BeaconStructuredLogger.DetectionEventType.ERROR, "Detector failed",
                    Map.of("error", String.valueOf(e.getMessage()),
                            "errorType", e.getClass().getSimpleName()));
            return DetectorResult.notTriggered("Detection error: " + e.getMessage());
        }
    }

    public TimeWindow resolveWindow(AlertConfig config, TimeWindow requested) {
        if (requested != null && requested.getBaselineDays() > 0 && requested.getCurrentDays() > 0) {
            return requested;
        }
        return TimeWindow.of(config.getThresholds().getBaselineDays(), config.getThresholds().getCurrentDays());
    }

    public Period currentPeriod(TimeWindow window) {
        LocalDate today = LocalDate.now(clock);
        return Period.of(today.minusDays(window.getCurrentDays() - 1L), today);
    }

    public Period baselinePeriod(TimeWindow window) {
        LocalDate end = currentPeriod(window).getStart().minusDays(1);
        return Period.of(end.minusDays(window.getBaselineDays() - 1L), end);
    }

    public BaselineData baseline(MetricSource source, Metric metric, Entity entity, TimeWindow window) {
        Period period = baselinePeriod(window);
        List<Double> samples = source.fetchMetrics(metric, entity, period.getStart(), period.getEnd());
        return baselineEvaluator.evaluate(samples, period);
    }

    public CurrentData current(MetricSource source, Metric metric, Entity entity, TimeWindow window) {
        Period period = currentPeriod(window);
        List<Double> samples = source.fetchMetrics(metric, entity, period.getStart(), period.getEnd());
        return currentEvaluator.evaluate(samples, period);
    }

    /**
     * Total of a volume metric over the current window.
     */
    public double currentVolume(MetricSource source, Metric metric, Entity entity, TimeWindow window) {
        Period period = currentPeriod(window);
        return source.fetchTotal(metric, entity, period.getStart(), period.getEnd());
    }

    /**
     * Current over baseline mean, or 1 when the baseline has no positive mean.
     */
    public double ratio(BaselineData baseline, CurrentData current) {
        return baseline.getMean() > 0 ? current.getValue() / baseline.getMean() : 1.0;
    }

    public double zScore(BaselineData baseline, double value) {
        return baseline.getStdDev() > 0 ? (value - baseline.getMean()) / baseline.getStdDev() : 0;
    }

    public Severity classify(AlertConfig config, BaselineData baseline, CurrentData current, Double ratio) {
        return severityClassifier.classify(zScore(baseline, current.getValue()), ratio,
                config.getThresholds().getSeverityBands());
    }

    public Severity classifyScore(AlertConfig config, double score) {
        return severityClassifier.classifyScore(score, config.getThresholds().getSeverityBands());
    }

    /**
     * Assemble an alert without detection bookkeeping; {@link #surface} fills that in.
     */
    public Alert buildAlert(AlertConfig config, Entity entity, TimeWindow window, BaselineData baseline,
                            CurrentData current, Severity severity, String why, Map<String, Object> additional) {
        double changeAbsolute = current.getValue() - baseline.getMean();
        double changePercentage = baseline.getMean() > 0 ? changeAbsolute / baseline.getMean() * 100 : 0;

        AlertMetrics alertMetrics = AlertMetrics.builder()
                .baseline(baseline)
                .current(current)
                .changeAbsolute(changeAbsolute)
                .changePercentage(changePercentage)
                .zScore(zScore(baseline, current.getValue()))
                .additional(additional != null ? new LinkedHashMap<>(additional) : new LinkedHashMap<>())
                .build();

        return Alert.builder()
                .id(AlertIdentity.of(config.getType(), entity))
                .type(config.getType())
                .severity(severity)
                .entity(entity)
                .window(window)
                .metrics(alertMetrics)
                .why(why)
                .playbook(config.getType().defaultPlaybookId())
                .build();
    }

    /**
     * Pass the alert through noise control. Surfaced alerts get their detection bookkeeping
     * from the stored state and are appended to the history.
     */
    public DetectorResult surface(AlertConfig config, Alert alert) {
        Instant now = clock.instant();
        NoiseDecision decision = noiseController.evaluate(alert.getId(), config.getNoiseControl(),
                alert.getSeverity(), now);

        if (!decision.surfaced()) {
            metrics.recordAlertSuppressed();
            logger.logDetectionEvent(alert.getId(), alert.getType().getCode(), alert.getEntity().getId(),
                    BeaconStructuredLogger.DetectionEventType.SUPPRESSED, "Detection suppressed",
                    Map.of("reason", decision.reason()));
            return DetectorResult.notTriggered(decision.reason());
        }

        alert.setDetection(Detection.fromState(decision.state()));
        alertStore.appendHistory(alert.getId(), alert, now);
        metrics.recordAlertSurfaced(alert.getType().getCode());
        logger.logDetectionEvent(alert.getId(), alert.getType().getCode(), alert.getEntity().getId(),
                BeaconStructuredLogger.DetectionEventType.SURFACED, "Alert surfaced",
                Map.of("severity", alert.getSeverity().getCode(),
                        "occurrences", decision.state().getConsecutive()));
        return DetectorResult.triggered(alert);
    }

    public Instant now() {
        return clock.instant();
    }
}
