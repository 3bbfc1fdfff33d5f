package com.z254.lighthouse.beacon.remediation;

import com.z254.lighthouse.beacon.domain.model.Alert;

import java.util.Set;

/**
 * Strategy that turns an alert into an ordered list of remediation steps.
 * <p>
 * Steps the playbook can carry out immediately are {@code applied}, or {@code pending} in a
 * dry run. Steps that need external work stay {@code pending}. Guardrails are applied by the
 * orchestrator afterwards.
 */
public interface Playbook {

    String getId();

    String getDescription();

    /**
     * Further identifiers this playbook answers to.
     */
    default Set<String> getAliases() {
        return Set.of();
    }

    PlaybookPlan execute(Alert alert, PlaybookOptions options);
}
