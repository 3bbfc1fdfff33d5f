package com.z254.lighthouse.beacon.domain.repository;

import com.z254.lighthouse.beacon.domain.model.Alert;
import com.z254.lighthouse.beacon.domain.model.AlertHistoryEntry;
import com.z254.lighthouse.beacon.domain.model.AlertState;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * Basic in-memory store used until a durable alert database is wired up.
 */
@Repository
public class InMemoryAlertStore implements AlertStore {

    private final Map<String, AlertState> states = new ConcurrentHashMap<>();
    private final Map<String, List<AlertHistoryEntry>> history = new ConcurrentHashMap<>();

    @Override
    public Optional<AlertState> getState(String alertId) {
        return Optional.ofNullable(states.get(alertId));
    }

    @Override
    public AlertState upsertState(String alertId, UnaryOperator<AlertState> patch) {
        return states.compute(alertId, (id, current) -> {
            AlertState next = patch.apply(current);
            if (next != null && next.getAlertId() == null) {
                next.setAlertId(id);
            }
            return next;
        });
    }

    @Override
    public void appendHistory(String alertId, Alert payload, Instant seenAt) {
        history.computeIfAbsent(alertId, id -> new CopyOnWriteArrayList<>())
                .add(AlertHistoryEntry.builder()
                        .alertId(alertId)
                        .payload(payload)
                        .seenAt(seenAt)
                        .build());
    }

    @Override
    public List<AlertHistoryEntry> getHistory(String alertId) {
        List<AlertHistoryEntry> entries = history.get(alertId);
        return entries == null ? Collections.emptyList() : List.copyOf(entries);
    }

    @Override
    public Optional<Alert> getLatestAlert(String alertId) {
        List<AlertHistoryEntry> entries = history.get(alertId);
        if (entries == null || entries.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(entries.size() - 1).getPayload());
    }

    @Override
    public List<AlertState> findAllStates() {
        return new ArrayList<>(states.values());
    }
}
