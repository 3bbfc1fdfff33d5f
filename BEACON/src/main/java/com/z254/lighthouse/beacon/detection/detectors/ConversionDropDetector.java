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
import com.z254.lighthouse.beacon.domain.model.EntityType;
import com.z254.lighthouse.beacon.domain.model.Severity;
import com.z254.lighthouse.beacon.domain.model.SuggestedAction;
import com.z254.lighthouse.beacon.domain.model.TimeWindow;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags conversion rate falling below a fraction of its baseline. URL entities get
 * page-level follow-ups, everything else gets query and tracking checks.
 */
@Component
public class ConversionDropDetector implements Detector {

    private final DetectionSupport support;
    private final MetricSource metricSource;
    private final AlertConfig config;

    public ConversionDropDetector(DetectionSupport support, MetricSource metricSource, BeaconProperties properties) {
        this.support = support;
        this.metricSource = metricSource;
        this.config = properties.getDetection().configFor(AlertType.CONVERSION_DROP);
    }

    @Override
    public AlertType getType() {
        return AlertType.CONVERSION_DROP;
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
        BaselineData baseline = support.baseline(metricSource, Metric.CONVERSION_RATE, entity, window);
        CurrentData current = support.current(metricSource, Metric.CONVERSION_RATE, entity, window);

        double clicks = support.currentVolume(metricSource, Metric.CLICKS, entity, window);
        double minClicks = config.getThresholds().getMinVolume();
        if (clicks < minClicks) {
            return DetectorResult.notTriggered(String.format("Insufficient clicks: %.0f < %.0f", clicks, minClicks));
        }

        double ratio = support.ratio(baseline, current);
        double factor = config.getThresholds().getChangeFactor();
        if (ratio > factor) {
            return DetectorResult.notTriggered(String.format("Conversion rate ratio %.2f above threshold %.2f",
                    ratio, factor));
        }

        Map<String, Object> additional = new LinkedHashMap<>();
        additional.put("clicks", clicks);
        additional.put("ratio", ratio);

        Severity severity = support.classify(config, baseline, current, ratio);
        Alert alert = support.buildAlert(config, entity, window, baseline, current, severity,
                String.format("Conversion rate fell %.1f%% from %.2f%% to %.2f%%",
                        (1 - ratio) * 100, baseline.getMean() * 100, current.getValue() * 100),
                additional);
        alert.setSuggestedActions(suggestedActions(entity));

        return support.surface(config, alert);
    }

    private static List<SuggestedAction> suggestedActions(Entity entity) {
        if (entity.getType() == EntityType.URL) {
            return List.of(
                    SuggestedAction.of("check_page_health",
                            Map.of("checks", List.of("loading_speed", "mobile_friendly", "form_errors"))),
                    SuggestedAction.of("analyze_user_flow", Map.of("focus", "drop_off_points")));
        }
        return List.of(
                SuggestedAction.of("analyze_search_terms", Map.of("filter", "zero_conversions", "min_clicks", 10)),
                SuggestedAction.of("review_landing_pages", Map.of("metric", "bounce_rate")),
                SuggestedAction.of("check_conversion_tracking", Map.of("verify", "tag_firing")));
    }
}
