package com.z254.lighthouse.beacon.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted lifecycle record for one alert identifier. Stores copy on write through
 * {@link #toBuilder()}, so a published instance is never mutated.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AlertState {

    private String alertId;

    @Builder.Default
    private AlertStatus status = AlertStatus.OPEN;

    private Instant snoozeUntil;

    private String owner;

    private String notes;

    private Instant firstSeen;

    private Instant lastSeen;

    /** Detections recorded for this identifier. Never reset. */
    private int consecutive;

    private Severity severity;

    /**
     * Whether the snooze still holds at the given instant.
     */
    public boolean isSnoozedAt(Instant now) {
        return status == AlertStatus.SNOOZED && (snoozeUntil == null || now.isBefore(snoozeUntil));
    }

    /**
     * Whether the alert should show up in active listings.
     */
    public boolean isActiveAt(Instant now) {
        return status != AlertStatus.CLOSED && !isSnoozedAt(now);
    }
}
