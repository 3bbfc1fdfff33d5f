package com.z254.lighthouse.beacon.detection.detectors;

import com.z254.lighthouse.beacon.config.AlertConfig;
import com.z254.lighthouse.beacon.config.BeaconProperties;
import com.z254.lighthouse.beacon.detection.DetectionSupport;
import com.z254.lighthouse.beacon.detection.Detector;
import com.z254.lighthouse.beacon.detection.DetectorResult;
import com.z254.lighthouse.beacon.detection.source.KeywordQuality;
import com.z254.lighthouse.beacon.detection.source.KeywordQuality.ComponentRating;
import com.z254.lighthouse.beacon.detection.source.QualityScoreSource;
import com.z254.lighthouse.beacon.domain.model.Alert;
import com.z254.lighthouse.beacon.domain.model.AlertType;
import com.z254.lighthouse.beacon.domain.model.BaselineData;
import com.z254.lighthouse.beacon.domain.model.CurrentData;
import com.z254.lighthouse.beacon.domain.model.Entity;
import com.z254.lighthouse.beacon.domain.model.Severity;
import com.z254.lighthouse.beacon.domain.model.SuggestedAction;
import com.z254.lighthouse.beacon.domain.model.TimeWindow;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Flags keywords whose quality score sits below the configured threshold. Severity follows
 * the worst score found.
 */
@Component
public class QualityScoreDetector implements Detector {

    /** Quality score treated as the healthy reference point */
    static final double NOMINAL_SCORE = 7.0;

    private final DetectionSupport support;
    private final QualityScoreSource qualityScoreSource;
    private final AlertConfig config;

    public QualityScoreDetector(DetectionSupport support, QualityScoreSource qualityScoreSource,
                                BeaconProperties properties) {
        this.support = support;
        this.qualityScoreSource = qualityScoreSource;
        this.config = properties.getDetection().configFor(AlertType.QUALITY_SCORE);
    }

    @Override
    public AlertType getType() {
        return AlertType.QUALITY_SCORE;
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
        double minImpressions = config.getThresholds().getMinVolume();
        List<KeywordQuality> eligible = qualityScoreSource.fetchKeywordQuality(entity).stream()
                .filter(k -> k.getImpressions() >= minImpressions)
                .toList();
        if (eligible.isEmpty()) {
            return DetectorResult.notTriggered("No quality score data available");
        }

        double threshold = config.getThresholds().getScoreThreshold();
        List<KeywordQuality> issues = eligible.stream()
                .filter(k -> k.getQualityScore() < threshold)
                .sorted(Comparator.comparingInt(KeywordQuality::getQualityScore)
                        .thenComparing(Comparator.comparingDouble(KeywordQuality::getCost).reversed()))
                .toList();
        if (issues.isEmpty()) {
            return DetectorResult.notTriggered(String.format("All quality scores at or above %.0f", threshold));
        }

        double averageScore = issues.stream().mapToInt(KeywordQuality::getQualityScore).average().orElse(0);
        int worstScore = issues.get(0).getQualityScore();
        double costAtRisk = issues.stream().mapToDouble(KeywordQuality::getCost).sum();

        BaselineData baseline = BaselineData.builder()
                .mean(NOMINAL_SCORE)
                .stdDev(1.0)
                .median(NOMINAL_SCORE)
                .count(eligible.size())
                .min(NOMINAL_SCORE - 1)
                .max(NOMINAL_SCORE + 1)
                .period(support.baselinePeriod(window))
                .build();
        CurrentData current = CurrentData.builder()
                .value(averageScore)
                .count(issues.size())
                .period(support.currentPeriod(window))
                .build();

        Map<String, Long> breakdown = new LinkedHashMap<>();
        breakdown.put("ad_relevance", countBelowAverage(issues, KeywordQuality::getAdRelevance));
        breakdown.put("expected_ctr", countBelowAverage(issues, KeywordQuality::getExpectedCtr));
        breakdown.put("landing_page_experience",
                countBelowAverage(issues, KeywordQuality::getLandingPageExperience));

        Map<String, Object> additional = new LinkedHashMap<>();
        additional.put("total_affected_keywords", issues.size());
        additional.put("total_cost_at_risk", costAtRisk);
        additional.put("component_breakdown", breakdown);
        additional.put("affected_keywords", issues.stream().limit(10).map(KeywordQuality::getKeyword).toList());

        Severity severity = support.classifyScore(config, worstScore);
        Alert alert = support.buildAlert(config, entity, window, baseline, current, severity,
                String.format("%d keywords with quality score below threshold (avg: %.1f, spending $%.2f)",
                        issues.size(), averageScore, costAtRisk),
                additional);
        alert.setSuggestedActions(suggestedActions(breakdown, issues));

        return support.surface(config, alert);
    }

    private static long countBelowAverage(List<KeywordQuality> issues,
                                          Function<KeywordQuality, ComponentRating> component) {
        return issues.stream().filter(k -> component.apply(k) == ComponentRating.BELOW_AVERAGE).count();
    }

    private static List<SuggestedAction> suggestedActions(Map<String, Long> breakdown, List<KeywordQuality> issues) {
        List<SuggestedAction> actions = new ArrayList<>();
        if (breakdown.get("ad_relevance") > 0) {
            actions.add(SuggestedAction.of("improve_ad_relevance",
                    Map.of("keywords", breakdown.get("ad_relevance"), "tactic", "tighter_ad_groups")));
        }
        if (breakdown.get("expected_ctr") > 0) {
            actions.add(SuggestedAction.of("improve_expected_ctr",
                    Map.of("keywords", breakdown.get("expected_ctr"), "tactic", "rsa_variants")));
        }
        if (breakdown.get("landing_page_experience") > 0) {
            actions.add(SuggestedAction.of("improve_landing_page_experience",
                    Map.of("keywords", breakdown.get("landing_page_experience"), "tactic", "page_speed")));
        }
        List<String> lowest = issues.stream()
                .filter(k -> k.getQualityScore() <= 3)
                .map(KeywordQuality::getKeyword)
                .toList();
        if (!lowest.isEmpty()) {
            actions.add(SuggestedAction.of("pause_low_quality_keywords", Map.of("keywords", lowest)));
        }
        return actions;
    }
}
