package com.z254.lighthouse.beacon.remediation.guardrail;

import com.z254.lighthouse.beacon.config.BeaconProperties;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Blocks destructive structural changes and warns on aggressive bid increases.
 */
@Component
public class SafetyGuardrail implements Guardrail {

    static final Set<String> DESTRUCTIVE_ACTIONS = Set.of("pause_campaign", "pause_ad_group", "remove_keyword");

    private final double maxBidIncrease;

    public SafetyGuardrail(BeaconProperties properties) {
        this.maxBidIncrease = properties.getRemediation().getMaxBidIncreaseWarning();
    }

    @Override
    public String getName() {
        return "safety";
    }

    @Override
    public boolean isCritical() {
        return false;
    }

    @Override
    public GuardrailResult check(ProposedAction action) {
        if (DESTRUCTIVE_ACTIONS.contains(action.type())) {
            return GuardrailResult.block("Action " + action.type() + " requires manual review");
        }
        if (BudgetGuardrail.isBidChange(action.type())) {
            Double change = action.numericParam("change");
            if (change != null && change > maxBidIncrease) {
                return GuardrailResult.warn(String.format("Bid increase of %.0f%% is aggressive", change * 100));
            }
        }
        return GuardrailResult.pass();
    }
}
