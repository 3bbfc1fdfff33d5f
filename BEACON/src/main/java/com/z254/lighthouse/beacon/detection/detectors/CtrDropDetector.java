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
 * Flags click-through rate falling below a fraction of its baseline.
 */
@Component
public class CtrDropDetector implements Detector {

    private final DetectionSupport support;
    private final MetricSource metricSource;
    private final AlertConfig config;

    public CtrDropDetector(DetectionSupport support, MetricSource metricSource, BeaconProperties properties) {
        this.support = support;
        this.metricSource = metricSource;
        this.config = properties.getDetection().configFor(AlertType.CTR_DROP);
    }

    @Override
    public AlertType getType() {
        return AlertType.CTR_DROP;
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
        BaselineData baseline = support.baseline(metricSource, Metric.CTR, entity, window);
        CurrentData current = support.current(metricSource, Metric.CTR, entity, window);

        double impressions = support.currentVolume(metricSource, Metric.IMPRESSIONS, entity, window);
        double minImpressions = config.getThresholds().getMinVolume();
        if (impressions < minImpressions) {
            return DetectorResult.notTriggered(String.format("Insufficient impressions: %.0f < %.0f",
                    impressions, minImpressions));
        }

        double ratio = support.ratio(baseline, current);
        double factor = config.getThresholds().getChangeFactor();
        if (ratio > factor) {
            return DetectorResult.notTriggered(String.format("CTR ratio %.2f above threshold %.2f", ratio, factor));
        }

        Map<String, Object> additional = new LinkedHashMap<>();
        additional.put("impressions", impressions);
        additional.put("ratio", ratio);

        Severity severity = support.classify(config, baseline, current, ratio);
        Alert alert = support.buildAlert(config, entity, window, baseline, current, severity,
                String.format("CTR fell %.1f%% on %.0f impressions", (1 - ratio) * 100, impressions), additional);
        alert.setSuggestedActions(List.of(
                SuggestedAction.of("generate_rsa_variants", Map.of("count", 3, "focus", "headline_relevance")),
                SuggestedAction.of("add_sitelinks", Map.of("items", List.of("top_features", "pricing")))));

        return support.surface(config, alert);
    }
}
