package com.z254.lighthouse.beacon.remediation.playbooks;

import com.z254.lighthouse.beacon.domain.model.Alert;
import com.z254.lighthouse.beacon.domain.model.AlertType;
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
import java.util.Set;

/**
 * Handles both spend directions. Spikes get query review, bid trims and a daily cap at 120%
 * of baseline; drops get diagnostics only.
 */
@Component
public class SpendAnomalyPlaybook implements Playbook {

    static final double BUDGET_CAP_FACTOR = 1.2;

    @Override
    public String getId() {
        return "pb_spend_spike";
    }

    @Override
    public Set<String> getAliases() {
        return Set.of("pb_spend_drop");
    }

    @Override
    public String getDescription() {
        return "Contain spend spikes and diagnose spend drops";
    }

    @Override
    public PlaybookPlan execute(Alert alert, PlaybookOptions options) {
        if (alert.getType() == AlertType.SPEND_DROP) {
            return diagnoseDrop();
        }
        return containSpike(alert, options);
    }

    private PlaybookPlan containSpike(Alert alert, PlaybookOptions options) {
        StepStatus immediate = StepStatus.immediate(options.isDryRun());
        double baselineSpend = alert.getMetrics().getBaseline().getMean();
        List<RemediationStep> steps = new ArrayList<>();

        RemediationStep review = RemediationStep.of("review_search_terms",
                Map.of("sort_by", "cost", "limit", 20), StepStatus.PENDING);
        review.setOutput("high-cost-terms.csv");
        steps.add(review);

        if (options.isAllowBidChanges()) {
            steps.add(RemediationStep.of("adjust_bids",
                    Map.of("change", -0.1, "target", "high_cost_keywords"), immediate));
        }

        steps.add(RemediationStep.of("set_budget_cap",
                Map.of("daily_limit", baselineSpend * BUDGET_CAP_FACTOR), immediate));

        double excess = Math.max(0, alert.getMetrics().getChangeAbsolute()) * alert.getMetrics().getCurrent().getCount();
        return PlaybookPlan.builder()
                .steps(steps)
                .estimatedImpact(EstimatedImpact.builder().cost(-excess).build())
                .build();
    }

    private PlaybookPlan diagnoseDrop() {
        List<RemediationStep> steps = new ArrayList<>();
        steps.add(RemediationStep.of("check_budget_limits",
                Map.of("check", "daily_budget_exhaustion"), StepStatus.PENDING));
        steps.add(RemediationStep.of("review_bid_strategy",
                Map.of("check", "target_settings"), StepStatus.PENDING));
        steps.add(RemediationStep.of("check_ad_disapprovals",
                Map.of("scope", "entity"), StepStatus.PENDING));
        return PlaybookPlan.builder()
                .steps(steps)
                .estimatedImpact(EstimatedImpact.none())
                .build();
    }
}
