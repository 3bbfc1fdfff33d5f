package com.z254.lighthouse.beacon.remediation.guardrail;

import java.util.List;

/**
 * Verdict of a single guardrail on a single action.
 *
 * @param passed      whether the action is acceptable
 * @param blocker     whether a failure must stop the action even from a non-critical guardrail
 * @param reason      explanation for a failure
 * @param suggestions optional ways to make the action acceptable
 */
public record GuardrailResult(boolean passed, boolean blocker, String reason, List<String> suggestions) {

    public static GuardrailResult pass() {
        return new GuardrailResult(true, false, null, List.of());
    }

    public static GuardrailResult warn(String reason, String... suggestions) {
        return new GuardrailResult(false, false, reason, List.of(suggestions));
    }

    public static GuardrailResult block(String reason, String... suggestions) {
        return new GuardrailResult(false, true, reason, List.of(suggestions));
    }
}
