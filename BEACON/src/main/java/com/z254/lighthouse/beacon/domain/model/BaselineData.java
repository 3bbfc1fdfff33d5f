package com.z254.lighthouse.beacon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Robust statistical summary of the historical window.
 * <p>
 * {@code mean} and {@code stdDev} come from the trimmed sample, while {@code count},
 * {@code min} and {@code max} describe every observation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BaselineData {

    private double mean;

    private double stdDev;

    private double median;

    private int count;

    private double min;

    private double max;

    private Period period;

    public static BaselineData empty(Period period) {
        return BaselineData.builder().period(period).build();
    }
}
