package com.z254.lighthouse.beacon.detection;

import com.z254.lighthouse.beacon.domain.model.AlertState;

/**
 * Outcome of noise control for one detection.
 *
 * @param surfaced whether the alert should be emitted
 * @param state    the persisted state after evaluation, null only if nothing was stored
 * @param reason   why the detection was suppressed, null when surfaced
 */
public record NoiseDecision(boolean surfaced, AlertState state, String reason) {

    static NoiseDecision surface(AlertState state) {
        return new NoiseDecision(true, state, null);
    }

    static NoiseDecision suppress(AlertState state, String reason) {
        return new NoiseDecision(false, state, reason);
    }
}
