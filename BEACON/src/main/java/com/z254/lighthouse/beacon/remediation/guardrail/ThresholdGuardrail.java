package com.z254.lighthouse.beacon.remediation.guardrail;

import com.z254.lighthouse.beacon.config.BeaconProperties;

/**
 * Fails steps of one action type whose plan carries an estimated cost above a ceiling.
 * Built from {@code beacon.remediation.guardrails} entries.
 */
public class ThresholdGuardrail implements Guardrail {

    private final String name;
    private final String actionType;
    private final double threshold;
    private final boolean critical;
    private final String message;

    public ThresholdGuardrail(String name, String actionType, double threshold, boolean critical, String message) {
        this.name = name;
        this.actionType = actionType;
        this.threshold = threshold;
        this.critical = critical;
        this.message = message;
    }

    public static ThresholdGuardrail from(BeaconProperties.GuardrailDefinition definition) {
        return new ThresholdGuardrail(definition.getName(), definition.getType(), definition.getThreshold(),
                definition.isCritical(), definition.getMessage());
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isCritical() {
        return critical;
    }

    @Override
    public GuardrailResult check(ProposedAction action) {
        if (!actionType.equals(action.type()) || action.estimatedCost() == null) {
            return GuardrailResult.pass();
        }
        if (action.estimatedCost() > threshold) {
            String reason = message != null && !message.isBlank() ? message
                    : String.format("Estimated cost %.2f exceeds %.2f", action.estimatedCost(), threshold);
            return GuardrailResult.warn(reason);
        }
        return GuardrailResult.pass();
    }
}
