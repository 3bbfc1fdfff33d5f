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
 * Flags cost-per-click rising well above its baseline on meaningful click volume.
 */
@Component
public class CpcJumpDetector implements Detector {

    private final DetectionSupport support;
    private final MetricSource metricSource;
    private final AlertConfig config;

    public CpcJumpDetector(DetectionSupport support, MetricSource metricSource, BeaconProperties properties) {
        this.support = support;
        this.metricSource = metricSource;
        this.config = properties.getDetection().configFor(AlertType.CPC_JUMP);
    }

    @Override
    public AlertType getType() {
        return AlertType.CPC_JUMP;
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
        BaselineData baseline = support.baseline(metricSource, Metric.CPC, entity, window);
        CurrentData current = support.current(metricSource, Metric.CPC, entity, window);

        double clicks = support.currentVolume(metricSource, Metric.CLICKS, entity, window);
        double minClicks = config.getThresholds().getMinVolume();
        if (clicks < minClicks) {
            return DetectorResult.notTriggered(String.format("Insufficient clicks: %.0f < %.0f", clicks, minClicks));
        }

        double ratio = support.ratio(baseline, current);
        double factor = config.getThresholds().getChangeFactor();
        if (ratio < factor) {
            return DetectorResult.notTriggered(String.format("CPC ratio %.2f below threshold %.2f", ratio, factor));
        }

        Map<String, Object> additional = new LinkedHashMap<>();
        additional.put("cpc_baseline", baseline.getMean());
        additional.put("cpc_current", current.getValue());
        additional.put("clicks", clicks);
        additional.put("cost_impact", (current.getValue() - baseline.getMean()) * clicks);
        additional.put("ratio", ratio);

        Severity severity = support.classify(config, baseline, current, ratio);
        Alert alert = support.buildAlert(config, entity, window, baseline, current, severity,
                String.format("CPC increased %.1f%% on %.0f clicks", (ratio - 1) * 100, clicks), additional);
        alert.setSuggestedActions(List.of(
                SuggestedAction.of("identify_waste_ngrams", Map.of("min_cost", 10, "max_conversions", 0)),
                SuggestedAction.of("reduce_bids", Map.of("change", -0.15)),
                SuggestedAction.of("review_competitor_density", Map.of("source", "auction_insights"))));

        return support.surface(config, alert);
    }
}
