package com.z254.lighthouse.beacon.remediation.playbooks;

import com.z254.lighthouse.beacon.domain.model.Alert;
import com.z254.lighthouse.beacon.remediation.EstimatedImpact;
import com.z254.lighthouse.beacon.remediation.Playbook;
import com.z254.lighthouse.beacon.remediation.PlaybookOptions;
import com.z254.lighthouse.beacon.remediation.PlaybookPlan;
import com.z254.lighthouse.beacon.remediation.RemediationStep;
import com.z254.lighthouse.beacon.remediation.StepStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Works through the quality score components flagged on the alert, then triages the weakest
 * keywords.
 */
@Component
public class QualityScorePlaybook implements Playbook {

    @Override
    public String getId() {
        return "pb_quality_score";
    }

    @Override
    public String getDescription() {
        return "Raise quality scores through relevance, CTR and landing page work";
    }

    @Override
    public PlaybookPlan execute(Alert alert, PlaybookOptions options) {
        StepStatus immediate = StepStatus.immediate(options.isDryRun());
        Map<String, Object> additional = alert.getMetrics().getAdditional();
        Map<?, ?> breakdown = additional.get("component_breakdown") instanceof Map<?, ?> m ? m : Map.of();
        List<RemediationStep> steps = new ArrayList<>();

        if (count(breakdown, "ad_relevance") > 0) {
            steps.add(RemediationStep.of("improve_ad_relevance", Map.of(
                    "keywords", count(breakdown, "ad_relevance"),
                    "tactics", List.of("split_ad_groups", "keyword_in_headline")), StepStatus.PENDING));
        }
        if (count(breakdown, "expected_ctr") > 0) {
            steps.add(RemediationStep.of("improve_expected_ctr", Map.of(
                    "keywords", count(breakdown, "expected_ctr"),
                    "tactics", List.of("stronger_cta", "assets")), StepStatus.PENDING));
            RemediationStep copy = RemediationStep.of("create_ad_copy_variants",
                    Map.of("count", 3), immediate);
            copy.setOutput("ad-copy-variants.csv");
            steps.add(copy);
        }
        if (count(breakdown, "landing_page_experience") > 0) {
            steps.add(RemediationStep.of("improve_landing_page_experience", Map.of(
                    "keywords", count(breakdown, "landing_page_experience")), StepStatus.PENDING));
            steps.add(RemediationStep.of("optimize_page_speed",
                    Map.of("targets", List.of("lcp", "cls")), StepStatus.PENDING));
        }

        steps.add(RemediationStep.of("manage_low_quality_keywords", Map.of(
                "keywords", additional.getOrDefault("affected_keywords", List.of()),
                "rules", List.of("<=2: pause", "3-4: optimize first", "5-6: monitor")), StepStatus.PENDING));

        steps.add(RemediationStep.of("setup_quality_score_monitoring",
                Map.of("frequency", "daily"), immediate));

        Object costAtRisk = additional.get("total_cost_at_risk");
        Double cost = costAtRisk instanceof Number n ? -n.doubleValue() * 0.2 : null;
        return PlaybookPlan.builder()
                .steps(steps)
                .estimatedImpact(EstimatedImpact.builder().cost(cost).build())
                .build();
    }

    private static long count(Map<?, ?> breakdown, String component) {
        return breakdown.get(component) instanceof Number n ? n.longValue() : 0;
    }
}
