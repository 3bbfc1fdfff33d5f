package com.z254.lighthouse.beacon.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Occurrence bookkeeping copied from the persisted alert state at surfacing time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Detection {

    private Instant firstSeen;

    private Instant lastSeen;

    private int occurrences;

    private int consecutiveOccurrences;

    public static Detection fromState(AlertState state) {
        return Detection.builder()
                .firstSeen(state.getFirstSeen())
                .lastSeen(state.getLastSeen())
                .occurrences(state.getConsecutive())
                .consecutiveOccurrences(state.getConsecutive())
                .build();
    }
}
