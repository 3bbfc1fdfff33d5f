package com.z254.lighthouse.beacon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary of the current window: the arithmetic mean of its observations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurrentData {

    private double value;

    private int count;

    private Period period;
}
