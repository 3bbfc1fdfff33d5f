package com.z254.lighthouse.beacon.detection.detectors;

import com.z254.lighthouse.beacon.config.AlertConfig;
import com.z254.lighthouse.beacon.config.BeaconProperties;
import com.z254.lighthouse.beacon.detection.DetectionSupport;
import com.z254.lighthouse.beacon.detection.Detector;
import com.z254.lighthouse.beacon.detection.DetectorResult;
import com.z254.lighthouse.beacon.detection.source.Metric;
import com.z254.lighthouse.beacon.detection.source.MetricSource;
import com.z254.lighthouse.beacon.domain.model.Alert;
import com.z254.lighthouse.beacon.domain.model.AlertType;
import com.z254.lighthouse.beacon.domain.model.BaselineData;
import com.z254.lighthouse.beacon.domain.model.CurrentData;
import com.z254.lighthouse.beacon.domain.model.Entity;
import com.z254.lighthouse.beacon.domain.model.Severity;
import com.z254.lighthouse.beacon.domain.model.SuggestedAction;
import com.z254.lighthouse.beacon.domain.model.TimeWindow;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags daily spend that either multiplies past the change factor or grows by more than the
 * absolute minimum over its baseline.
 */
@Component
public class SpendSpikeDetector implements Detector {

    private final DetectionSupport support;
    private final MetricSource metricSource;
    private final AlertConfig config;

    public SpendSpikeDetector(DetectionSupport support, MetricSource metricSource, BeaconProperties properties) {
        this.support = support;
        this.metricSource = metricSource;
        this.config = properties.getDetection().configFor(AlertType.SPEND_SPIKE);
    }

    @Override
    public AlertType getType() {
        return AlertType.SPEND_SPIKE;
    }

    @Override
    public AlertConfig getConfig() {
        return config;
    }

    @Override
    public DetectorResult detect(Entity entity, TimeWindow window) {
        return support.guarded(config, entity, () -> evaluate(entity, support.resolveWindow(config, window)));
    }

    private DetectorResult evaluate(Entity entity, TimeWindow window) {
        BaselineData baseline = support.baseline(metricSource, Metric.SPEND, entity, window);
        CurrentData current = support.current(metricSource, Metric.SPEND, entity, window);

        double clicks = support.currentVolume(metricSource, Metric.CLICKS, entity, window);
        double minClicks = config.getThresholds().getMinVolume();
        if (clicks < minClicks) {
            return DetectorResult.notTriggered(String.format("Insufficient clicks: %.0f < %.0f", clicks, minClicks));
        }

        double factor = config.getThresholds().getChangeFactor();
        Double minAbsolute = config.getThresholds().getMinAbsoluteChange();
        boolean factorExceeded = current.getValue() >= baseline.getMean() * factor;
        boolean absoluteExceeded = minAbsolute != null
                && current.getValue() >= baseline.getMean() + minAbsolute;
        if (!factorExceeded && !absoluteExceeded) {
            return DetectorResult.notTriggered(String.format("Spend %.2f within limits of baseline %.2f",
                    current.getValue(), baseline.getMean()));
        }

        Double ratio = baseline.getMean() > 0 ? current.getValue() / baseline.getMean() : null;
        double changeDollar = current.getValue() - baseline.getMean();

        Map<String, Object> additional = new LinkedHashMap<>();
        additional.put("spend_baseline", baseline.getMean());
        additional.put("spend_current", current.getValue());
        additional.put("clicks", clicks);
        additional.put("change_dollar", changeDollar);

        Severity severity = support.classify(config, baseline, current, ratio);
        String why = ratio != null
                ? String.format("Spend increased %.1f%% (+$%.2f) with %.0f clicks", (ratio - 1) * 100, changeDollar, clicks)
                : String.format("Spend rose to $%.2f from no baseline spend with %.0f clicks", current.getValue(), clicks);
        Alert alert = support.buildAlert(config, entity, window, baseline, current, severity, why, additional);
        alert.setSuggestedActions(List.of(
                SuggestedAction.of("review_search_terms", Map.of("sort_by", "cost", "limit", 20)),
                SuggestedAction.of("adjust_bids", Map.of("change", -0.1, "target", "high_cost_keywords"))));

        return support.surface(config, alert);
    }
}
