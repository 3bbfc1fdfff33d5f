package com.z254.lighthouse.beacon.domain.service;

import com.z254.lighthouse.beacon.domain.model.Alert;
import com.z254.lighthouse.beacon.domain.model.AlertHistoryEntry;
import com.z254.lighthouse.beacon.domain.model.AlertState;
import com.z254.lighthouse.beacon.domain.model.AlertStatus;
import com.z254.lighthouse.beacon.domain.repository.AlertStore;
import com.z254.lighthouse.beacon.observability.BeaconMetrics;
import com.z254.lighthouse.beacon.observability.BeaconStructuredLogger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Operator-facing alert lifecycle: acknowledge, snooze, close and the listing views.
 * <p>
 * Transitions: {@code open <-> ack}, {@code open|ack -> snoozed}, any status {@code -> closed}.
 * Acknowledging or snoozing a closed alert is rejected. Repeating a transition is a no-op
 * apart from updated notes or snooze deadline.
 */
@Service
public class AlertStateService {

    private final AlertStore alertStore;
    private final BeaconMetrics metrics;
    private final BeaconStructuredLogger logger;
    private final Clock clock;

    public AlertStateService(AlertStore alertStore,
                             BeaconMetrics metrics,
                             BeaconStructuredLogger logger,
                             Clock clock) {
        this.alertStore = alertStore;
        this.metrics = metrics;
        this.logger = logger;
        this.clock = clock;
    }

    public Optional<AlertState> getState(String alertId) {
        return alertStore.getState(alertId);
    }

    public AlertState acknowledge(String alertId, String owner, String notes) {
        AlertState state = transition(alertId, "acknowledge", current -> {
            if (current.getStatus() == AlertStatus.CLOSED || current.getStatus() == AlertStatus.SNOOZED) {
                throw new AlertStateTransitionException(alertId, current.getStatus(), "acknowledge");
            }
            return current.toBuilder()
                    .status(AlertStatus.ACK)
                    .owner(owner != null ? owner : current.getOwner())
                    .notes(notes != null ? notes : current.getNotes())
                    .build();
        });
        record(alertId, BeaconStructuredLogger.AlertStateEventType.ACKNOWLEDGED, "Alert acknowledged", state,
                details("owner", owner));
        return state;
    }

    public AlertState unacknowledge(String alertId) {
        AlertState state = transition(alertId, "unacknowledge", current -> {
            if (current.getStatus() != AlertStatus.ACK && current.getStatus() != AlertStatus.OPEN) {
                throw new AlertStateTransitionException(alertId, current.getStatus(), "unacknowledge");
            }
            return current.toBuilder().status(AlertStatus.OPEN).build();
        });
        record(alertId, BeaconStructuredLogger.AlertStateEventType.UNACKNOWLEDGED, "Alert returned to open", state,
                Map.of());
        return state;
    }

    /**
     * Suppress surfacing until the given instant. The deadline must be in the future.
     */
    public AlertState snooze(String alertId, Instant until, String notes) {
        Objects.requireNonNull(until, "until");
        if (!until.isAfter(clock.instant())) {
            throw new IllegalArgumentException("Snooze deadline must be in the future: " + until);
        }
        AlertState state = transition(alertId, "snooze", current -> {
            if (current.getStatus() == AlertStatus.CLOSED) {
                throw new AlertStateTransitionException(alertId, current.getStatus(), "snooze");
            }
            return current.toBuilder()
                    .status(AlertStatus.SNOOZED)
                    .snoozeUntil(until)
                    .notes(notes != null ? notes : current.getNotes())
                    .build();
        });
        record(alertId, BeaconStructuredLogger.AlertStateEventType.SNOOZED, "Alert snoozed", state,
                details("until", until.toString()));
        return state;
    }

    public AlertState close(String alertId, String notes) {
        AlertState state = transition(alertId, "close", current -> current.toBuilder()
                .status(AlertStatus.CLOSED)
                .snoozeUntil(null)
                .notes(notes != null ? notes : current.getNotes())
                .build());
        record(alertId, BeaconStructuredLogger.AlertStateEventType.CLOSED, "Alert closed", state, Map.of());
        return state;
    }

    /**
     * Stored states, most recently seen first, optionally filtered by status.
     */
    public List<AlertState> listStates(AlertStatus status) {
        return alertStore.findAllStates().stream()
                .filter(s -> status == null || s.getStatus() == status)
                .sorted(Comparator.comparing(AlertState::getLastSeen,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    /**
     * Latest surfaced payload of every alert that is neither closed nor in a live snooze.
     */
    public List<Alert> listActiveAlerts(String product) {
        Instant now = clock.instant();
        return alertStore.findAllStates().stream()
                .filter(s -> s.isActiveAt(now))
                .map(s -> alertStore.getLatestAlert(s.getAlertId()))
                .flatMap(Optional::stream)
                .filter(a -> product == null || product.equals(a.getEntity().getProduct()))
                .sorted(Comparator.comparingInt((Alert a) -> a.getSeverity().getRank()))
                .toList();
    }

    public List<AlertHistoryEntry> getHistory(String alertId) {
        return alertStore.getHistory(alertId);
    }

    public Optional<Alert> getLatestAlert(String alertId) {
        return alertStore.getLatestAlert(alertId);
    }

    private AlertState transition(String alertId, String operation, UnaryOperator<AlertState> change) {
        try {
            AlertState updated = alertStore.upsertState(alertId, current -> current == null ? null : change.apply(current));
            if (updated == null) {
                throw new AlertNotFoundException(alertId);
            }
            return updated;
        } catch (AlertStateTransitionException e) {
            logger.logAlertStateEvent(alertId, BeaconStructuredLogger.AlertStateEventType.REJECTED,
                    "Alert transition rejected", Map.of("operation", operation, "error", e.getMessage()));
            throw e;
        }
    }

    private void record(String alertId, BeaconStructuredLogger.AlertStateEventType eventType, String message,
                        AlertState state, Map<String, Object> details) {
        metrics.recordStateTransition(state.getStatus().getCode());
        Instant now = clock.instant();
        metrics.updateActiveAlerts((int) alertStore.findAllStates().stream().filter(s -> s.isActiveAt(now)).count());
        Map<String, Object> data = new HashMap<>(details);
        data.put("status", state.getStatus().getCode());
        logger.logAlertStateEvent(alertId, eventType, message, data);
    }

    private static Map<String, Object> details(String key, Object value) {
        Map<String, Object> details = new HashMap<>();
        if (value != null) {
            details.put(key, value);
        }
        return details;
    }
}
