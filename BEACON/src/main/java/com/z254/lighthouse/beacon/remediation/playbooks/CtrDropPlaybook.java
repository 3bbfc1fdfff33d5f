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
 * Restores click-through with fresh ad copy and assets, trimming irrelevant traffic.
 */
@Component
public class CtrDropPlaybook implements Playbook {

    /** Expected relative CTR recovery from new copy and assets */
    static final double CTR_RECOVERY = 0.3;

    @Override
    public String getId() {
        return "pb_ctr_drop";
    }

    @Override
    public String getDescription() {
        return "Recover CTR through new RSA variants, assets and negatives";
    }

    @Override
    public PlaybookPlan execute(Alert alert, PlaybookOptions options) {
        StepStatus immediate = StepStatus.immediate(options.isDryRun());
        List<RemediationStep> steps = new ArrayList<>();

        RemediationStep variants = RemediationStep.of("create_rsa_variants",
                Map.of("count", 3, "strategy", "keyword_insertion", "pin_brand_headline", true), immediate);
        variants.setOutput("rsa-variants.csv");
        steps.add(variants);

        steps.add(RemediationStep.of("add_assets",
                Map.of("sitelinks", List.of("top_features", "pricing"), "callouts", 4), immediate));

        if (options.isAllowBidChanges()) {
            steps.add(RemediationStep.of("adjust_bid", Map.of("change", 0.05, "reason", "regain_position"),
                    immediate));
        }

        steps.add(RemediationStep.of("add_negatives",
                Map.of("level", "ad_group", "match_type", "phrase", "source", "low_ctr_queries"), immediate));

        double lostRate = Math.max(0, -alert.getMetrics().getChangeAbsolute());
        Object impressions = alert.getMetrics().getAdditional().get("impressions");
        Double clicks = impressions instanceof Number n ? lostRate * n.doubleValue() * CTR_RECOVERY : null;
        return PlaybookPlan.builder()
                .steps(steps)
                .estimatedImpact(EstimatedImpact.builder().clicks(clicks).cost(0d).build())
                .build();
    }
}
