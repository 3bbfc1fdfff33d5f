package com.z254.lighthouse.beacon.remediation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of running a playbook for an alert.
 * <p>
 * {@code guardrailsPassed} is false whenever {@code blockers} is non-empty. Warnings are
 * guardrail failures that did not block anything.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Remediation {

    private String alertId;

    private String playbook;

    @Builder.Default
    private List<RemediationStep> steps = new ArrayList<>();

    private boolean guardrailsPassed;

    @Builder.Default
    private List<String> blockers = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    @Builder.Default
    private EstimatedImpact estimatedImpact = EstimatedImpact.none();

    private boolean dryRun;

    private Instant appliedAt;
}
