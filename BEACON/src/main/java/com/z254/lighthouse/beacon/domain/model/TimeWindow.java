package com.z254.lighthouse.beacon.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Lengths of the historical and current comparison windows, in whole days.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TimeWindow {

    private int baselineDays;

    private int currentDays;

    public static TimeWindow of(int baselineDays, int currentDays) {
        return new TimeWindow(baselineDays, currentDays);
    }
}
