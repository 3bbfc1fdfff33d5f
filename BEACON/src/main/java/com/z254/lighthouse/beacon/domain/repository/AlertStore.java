package com.z254.lighthouse.beacon.domain.repository;

import com.z254.lighthouse.beacon.domain.model.Alert;
import com.z254.lighthouse.beacon.domain.model.AlertHistoryEntry;
import com.z254.lighthouse.beacon.domain.model.AlertState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Persistence for alert lifecycle state and surfaced-alert history.
 */
public interface AlertStore {

    Optional<AlertState> getState(String alertId);

    /**
     * Atomically read-modify-write the state for one identifier. The patch receives the
     * current state, or null when none exists, and returns the replacement. Returning null
     * for an absent state leaves the store untouched. Writes for the same identifier are
     * serialized; different identifiers do not block each other.
     *
     * @return the stored state after the patch, or null if nothing was stored
     */
    AlertState upsertState(String alertId, UnaryOperator<AlertState> patch);

    void appendHistory(String alertId, Alert payload, Instant seenAt);

    /**
     * History for one identifier, oldest first.
     */
    List<AlertHistoryEntry> getHistory(String alertId);

    Optional<Alert> getLatestAlert(String alertId);

    List<AlertState> findAllStates();
}
