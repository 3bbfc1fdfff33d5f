package com.z254.lighthouse.beacon.remediation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Audit record of an applied remediation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemediationLogEntry {

    private String remediationId;

    private String alertId;

    private String playbook;

    @Builder.Default
    private List<RemediationStep> steps = new ArrayList<>();

    private boolean guardrailsPassed;

    @Builder.Default
    private List<String> blockers = new ArrayList<>();

    private EstimatedImpact estimatedImpact;

    private Instant appliedAt;

    public static RemediationLogEntry from(String remediationId, Remediation remediation) {
        return RemediationLogEntry.builder()
                .remediationId(remediationId)
                .alertId(remediation.getAlertId())
                .playbook(remediation.getPlaybook())
                .steps(new ArrayList<>(remediation.getSteps()))
                .guardrailsPassed(remediation.isGuardrailsPassed())
                .blockers(new ArrayList<>(remediation.getBlockers()))
                .estimatedImpact(remediation.getEstimatedImpact())
                .appliedAt(remediation.getAppliedAt())
                .build();
    }
}
