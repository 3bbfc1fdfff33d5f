package com.z254.lighthouse.beacon.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Suppression policy applied before an alert is surfaced.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NoiseControlConfig {

    private Strategy strategy = Strategy.CONSECUTIVE;

    /** Detections required before the first surface */
    private int consecutiveChecks = 2;

    /** Minimum gap between surfaces of the same alert */
    private double cooldownHours = 24;

    public Duration cooldown() {
        return Duration.ofMillis(Math.round(cooldownHours * 3_600_000d));
    }

    public NoiseControlConfig copy() {
        return new NoiseControlConfig(strategy, consecutiveChecks, cooldownHours);
    }

    public static NoiseControlConfig of(Strategy strategy, int consecutiveChecks, double cooldownHours) {
        return new NoiseControlConfig(strategy, consecutiveChecks, cooldownHours);
    }

    public enum Strategy {
        CONSECUTIVE,
        COOLDOWN,
        BOTH;

        public boolean usesConsecutive() {
            return this == CONSECUTIVE || this == BOTH;
        }

        public boolean usesCooldown() {
            return this == COOLDOWN || this == BOTH;
        }
    }
}
