package com.z254.lighthouse.beacon.remediation.guardrail;

import com.z254.lighthouse.beacon.config.BeaconProperties;
import org.springframework.stereotype.Component;

/**
 * Caps budget increases and flags large bid moves.
 */
@Component
public class BudgetGuardrail implements Guardrail {

    private final double maxBudgetIncrease;
    private final double maxBidChange;

    public BudgetGuardrail(BeaconProperties properties) {
        this.maxBudgetIncrease = properties.getRemediation().getMaxBudgetIncrease();
        this.maxBidChange = properties.getRemediation().getMaxBidChange();
    }

    @Override
    public String getName() {
        return "budget";
    }

    @Override
    public boolean isCritical() {
        return true;
    }

    @Override
    public GuardrailResult check(ProposedAction action) {
        if ("increase_budget".equals(action.type())) {
            Double amount = action.numericParam("amount");
            if (amount != null && amount > maxBudgetIncrease) {
                return GuardrailResult.block(String.format("Budget increase %.2f exceeds limit %.2f",
                        amount, maxBudgetIncrease), "Split the increase across several days");
            }
        }
        if (isBidChange(action.type())) {
            Double change = action.numericParam("change");
            if (change != null && Math.abs(change) > maxBidChange) {
                return GuardrailResult.warn(String.format("Bid change %.0f%% exceeds %.0f%%",
                        Math.abs(change) * 100, maxBidChange * 100), "Apply the change in smaller increments");
            }
        }
        return GuardrailResult.pass();
    }

    static boolean isBidChange(String type) {
        return "bid_change".equals(type) || "adjust_bid".equals(type) || "adjust_bids".equals(type)
                || "reduce_bids".equals(type);
    }
}
