package com.z254.lighthouse.beacon.remediation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Projected effect of a plan. Negative cost means savings. Null fields are unknown.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EstimatedImpact {

    private Double cost;

    private Double impressions;

    private Double clicks;

    private Double conversions;

    public static EstimatedImpact none() {
        return new EstimatedImpact();
    }
}
