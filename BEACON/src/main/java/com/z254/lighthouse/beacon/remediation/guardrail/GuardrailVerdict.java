package com.z254.lighthouse.beacon.remediation.guardrail;

import java.util.List;

/**
 * Aggregate guardrail outcome for a plan, messages formatted as {@code "<guardrail>: <reason>"}.
 *
 * @param blockedBy name of the guardrail behind each blocker, in blocker order
 */
public record GuardrailVerdict(List<String> blockers, List<String> warnings, List<String> blockedBy) {

    public boolean passed() {
        return blockers.isEmpty();
    }
}
