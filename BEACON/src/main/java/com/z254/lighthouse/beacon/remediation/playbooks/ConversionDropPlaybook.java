package com.z254.lighthouse.beacon.remediation.playbooks;

import com.z254.lighthouse.beacon.domain.model.Alert;
import com.z254.lighthouse.beacon.domain.model.Entity;
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
 * Recovers conversion rate by analysing pages and funnel, testing page variants and excluding
 * low-converting queries.
 */
@Component
public class ConversionDropPlaybook implements Playbook {

    @Override
    public String getId() {
        return "pb_conversion_drop";
    }

    @Override
    public String getDescription() {
        return "Recover conversion rates through landing page and funnel optimization";
    }

    @Override
    public PlaybookPlan execute(Alert alert, PlaybookOptions options) {
        StepStatus immediate = StepStatus.immediate(options.isDryRun());
        Entity entity = alert.getEntity();
        List<RemediationStep> steps = new ArrayList<>();

        RemediationStep pages = RemediationStep.of("analyze_landing_pages", Map.of(
                "entity_type", entity.getType().getCode(),
                "entity_id", entity.getId(),
                "metrics", List.of("conversion_rate", "bounce_rate", "time_on_page")), StepStatus.PENDING);
        pages.setOutput("landing-page-analysis.csv");
        steps.add(pages);

        RemediationStep funnel = RemediationStep.of("analyze_conversion_funnel", Map.of(
                "steps", List.of("landing", "form_start", "form_complete", "thank_you"),
                "drop_off_threshold", 0.5), StepStatus.PENDING);
        funnel.setOutput("funnel-analysis.json");
        steps.add(funnel);

        if (options.isAllowBidChanges()) {
            RemediationStep variants = RemediationStep.of("create_landing_page_variants", Map.of(
                    "url", entity.getUrl() != null ? entity.getUrl() : "/",
                    "variants", List.of("simplified_form", "social_proof", "urgency"),
                    "traffic_split", 25), immediate);
            variants.setOutput("ab-test-setup.json");
            steps.add(variants);
        }

        RemediationStep terms = RemediationStep.of("analyze_low_converting_terms", Map.of(
                "min_clicks", 20,
                "max_conversion_rate", alert.getMetrics().getCurrent().getValue() * 0.5,
                "sort_by", "cost"), StepStatus.PENDING);
        terms.setOutput("low-converting-terms.csv");
        steps.add(terms);

        steps.add(RemediationStep.of("add_negative_keywords", Map.of(
                "source", "low_converting_terms",
                "min_cost_threshold", 25,
                "conversion_rate_threshold", 0.01), immediate));

        return PlaybookPlan.builder()
                .steps(steps)
                .estimatedImpact(EstimatedImpact.builder()
                        .conversions((double) Math.round(alert.getMetrics().getCurrent().getCount() * 0.3))
                        .build())
                .build();
    }
}
