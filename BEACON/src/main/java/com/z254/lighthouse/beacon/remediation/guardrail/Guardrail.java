package com.z254.lighthouse.beacon.remediation.guardrail;

/**
 * Policy check run against every step of a remediation plan.
 * <p>
 * A failed check stops the step when the guardrail is critical or the result is a blocker.
 * Other failures are recorded as warnings.
 */
public interface Guardrail {

    String getName();

    boolean isCritical();

    GuardrailResult check(ProposedAction action);
}
