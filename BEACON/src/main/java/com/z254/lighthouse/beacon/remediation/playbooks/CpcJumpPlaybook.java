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
 * Brings CPC back down by cutting waste queries and, when allowed, capping bids at the
 * baseline CPC.
 */
@Component
public class CpcJumpPlaybook implements Playbook {

    @Override
    public String getId() {
        return "pb_cpc_jump";
    }

    @Override
    public String getDescription() {
        return "Reduce CPC through bid optimization and negatives";
    }

    @Override
    public PlaybookPlan execute(Alert alert, PlaybookOptions options) {
        StepStatus immediate = StepStatus.immediate(options.isDryRun());
        List<RemediationStep> steps = new ArrayList<>();

        RemediationStep waste = RemediationStep.of("identify_waste_ngrams",
                Map.of("min_cost", 10, "min_clicks", 5, "zero_conversion", true), immediate);
        waste.setOutput("waste-analysis.csv");
        steps.add(waste);

        if (options.isAllowBidChanges()) {
            steps.add(RemediationStep.of("reduce_bids", Map.of(
                    "change", -0.1,
                    "apply_cap", true,
                    "target_cpc", alert.getMetrics().getBaseline().getMean()), immediate));
        }

        RemediationStep negatives = RemediationStep.of("add_negatives_from_waste",
                Map.of("source", "high_cost_zero_conversion", "match_type", "phrase"), immediate);
        negatives.setOutput("negatives.csv");
        steps.add(negatives);

        steps.add(RemediationStep.of("analyze_auction_insights",
                Map.of("check_overlap", true, "check_position", true), StepStatus.PENDING));

        double savings = -alert.getMetrics().getChangeAbsolute() * alert.getMetrics().getCurrent().getCount();
        return PlaybookPlan.builder()
                .steps(steps)
                .estimatedImpact(EstimatedImpact.builder().cost(savings).build())
                .build();
    }
}
