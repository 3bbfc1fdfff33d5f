package com.z254.lighthouse.beacon.remediation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered steps proposed by a playbook and their projected impact.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaybookPlan {

    @Builder.Default
    private List<RemediationStep> steps = new ArrayList<>();

    @Builder.Default
    private EstimatedImpact estimatedImpact = EstimatedImpact.none();
}
