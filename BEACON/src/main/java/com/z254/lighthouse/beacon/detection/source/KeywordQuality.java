package com.z254.lighthouse.beacon.detection.source;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Latest quality score snapshot for one keyword.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeywordQuality {

    private String keyword;

    /** 1 to 10 */
    private int qualityScore;

    private ComponentRating adRelevance;

    private ComponentRating expectedCtr;

    private ComponentRating landingPageExperience;

    private long impressions;

    private long clicks;

    private double cost;

    public enum ComponentRating {
        ABOVE_AVERAGE,
        AVERAGE,
        BELOW_AVERAGE
    }
}
