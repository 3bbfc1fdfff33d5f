package com.z254.lighthouse.beacon.detection;

import com.z254.lighthouse.beacon.config.NoiseControlConfig;
import com.z254.lighthouse.beacon.domain.model.AlertState;
import com.z254.lighthouse.beacon.domain.model.AlertStatus;
import com.z254.lighthouse.beacon.domain.model.Severity;
import com.z254.lighthouse.beacon.domain.repository.AlertStore;
import com.z254.lighthouse.beacon.observability.BeaconStructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Decides whether a detection is surfaced and records it on the alert state.
 * <p>
 * Rules, applied in order inside a single atomic update of the state:
 * <ol>
 *     <li>An expired snooze returns the alert to {@code open}.</li>
 *     <li>A live snooze records the occurrence and suppresses.</li>
 *     <li>Consecutive strategies suppress until the occurrence count, including this
 *         detection, reaches {@code consecutiveChecks}. The count is persisted.</li>
 *     <li>Cooldown strategies suppress while the persisted {@code lastSeen} is more recent
 *         than the cooldown, whether that detection surfaced or not. Nothing is written.</li>
 *     <li>Otherwise the detection surfaces: the count and {@code lastSeen} advance, the
 *         severity is overwritten and a closed alert reopens. Acknowledged alerts stay
 *         acknowledged.</li>
 * </ol>
 */
@Slf4j
@Component
public class NoiseController {

    private final AlertStore alertStore;
    private final BeaconStructuredLogger logger;

    public NoiseController(AlertStore alertStore, BeaconStructuredLogger logger) {
        this.alertStore = alertStore;
        this.logger = logger;
    }

    public NoiseDecision evaluate(String alertId, NoiseControlConfig config, Severity severity, Instant now) {
        AtomicReference<NoiseDecision> decision = new AtomicReference<>();
        AtomicReference<AlertStatus> expiredFrom = new AtomicReference<>();

        AlertState stored = alertStore.upsertState(alertId, current -> {
            AlertState state = current;
            if (state != null && state.getStatus() == AlertStatus.SNOOZED && !state.isSnoozedAt(now)) {
                expiredFrom.set(AlertStatus.SNOOZED);
                state = state.toBuilder().status(AlertStatus.OPEN).snoozeUntil(null).build();
            }

            int next = (state == null ? 0 : state.getConsecutive()) + 1;

            if (state != null && state.isSnoozedAt(now)) {
                AlertState recorded = recordOccurrence(alertId, state, next, severity, now);
                decision.set(NoiseDecision.suppress(recorded, "Snoozed until " + state.getSnoozeUntil()));
                return recorded;
            }

            if (config.getStrategy().usesConsecutive() && next < config.getConsecutiveChecks()) {
                AlertState recorded = recordOccurrence(alertId, state, next, severity, now);
                decision.set(NoiseDecision.suppress(recorded, String.format(
                        "Noise control: %d of %d consecutive detections", next, config.getConsecutiveChecks())));
                return recorded;
            }

            Instant lastSeen = state == null ? null : state.getLastSeen();
            if (config.getStrategy().usesCooldown() && lastSeen != null) {
                Duration sinceLast = Duration.between(lastSeen, now);
                if (sinceLast.compareTo(config.cooldown()) < 0) {
                    decision.set(NoiseDecision.suppress(state, "Cooldown active until "
                            + lastSeen.plus(config.cooldown())));
                    return state;
                }
            }

            AlertState surfaced = surface(alertId, state, next, severity, now);
            decision.set(NoiseDecision.surface(surfaced));
            return surfaced;
        });

        if (expiredFrom.get() != null) {
            logger.logAlertStateEvent(alertId, BeaconStructuredLogger.AlertStateEventType.SNOOZE_EXPIRED,
                    "Snooze expired, alert reopened", Map.of("at", now.toString()));
        }

        NoiseDecision result = decision.get();
        log.debug("Noise control for {}: surfaced={}, consecutive={}", alertId, result.surfaced(),
                stored != null ? stored.getConsecutive() : 0);
        return result;
    }

    private static AlertState recordOccurrence(String alertId, AlertState state, int next,
                                               Severity severity, Instant now) {
        if (state == null) {
            return AlertState.builder()
                    .alertId(alertId)
                    .status(AlertStatus.OPEN)
                    .firstSeen(now)
                    .lastSeen(now)
                    .consecutive(next)
                    .severity(severity)
                    .build();
        }
        return state.toBuilder()
                .consecutive(next)
                .lastSeen(now)
                .severity(severity)
                .build();
    }

    private static AlertState surface(String alertId, AlertState state, int next,
                                      Severity severity, Instant now) {
        if (state == null) {
            return recordOccurrence(alertId, null, next, severity, now);
        }
        AlertState.AlertStateBuilder builder = state.toBuilder()
                .consecutive(next)
                .lastSeen(now)
                .severity(severity);
        if (state.getFirstSeen() == null) {
            builder.firstSeen(now);
        }
        if (state.getStatus() == AlertStatus.CLOSED) {
            builder.status(AlertStatus.OPEN);
        }
        return builder.build();
    }
}
