package com.z254.lighthouse.beacon.detection.stats;

import com.z254.lighthouse.beacon.config.AlertConfig;
import com.z254.lighthouse.beacon.domain.model.Severity;
import org.springframework.stereotype.Component;

/**
 * Maps a deviation to a severity.
 * <p>
 * When ratio bands are configured and a ratio is available the first matching band wins,
 * evaluated critical, high, medium against {@code |1 - ratio|}. Unset or non-positive bands
 * are skipped. Anything that falls through is classified by the magnitude of the z-score.
 */
@Component
public class SeverityClassifier {

    static final double Z_CRITICAL = 3.0;
    static final double Z_HIGH = 2.5;
    static final double Z_MEDIUM = 1.5;

    public Severity classify(double zScore, Double ratio, AlertConfig.SeverityBands bands) {
        if (bands != null && ratio != null) {
            double deviation = Math.abs(1 - ratio);
            if (reaches(deviation, bands.getCritical())) {
                return Severity.CRITICAL;
            }
            if (reaches(deviation, bands.getHigh())) {
                return Severity.HIGH;
            }
            if (reaches(deviation, bands.getMedium())) {
                return Severity.MEDIUM;
            }
        }
        return classifyZScore(zScore);
    }

    public Severity classifyZScore(double zScore) {
        double magnitude = Math.abs(zScore);
        if (magnitude >= Z_CRITICAL) {
            return Severity.CRITICAL;
        }
        if (magnitude >= Z_HIGH) {
            return Severity.HIGH;
        }
        if (magnitude >= Z_MEDIUM) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    /**
     * Severity for "lower is worse" scores such as keyword quality. The bands are upper bounds.
     */
    public Severity classifyScore(double score, AlertConfig.SeverityBands bands) {
        if (bands == null) {
            return Severity.MEDIUM;
        }
        if (bands.getCritical() != null && score <= bands.getCritical()) {
            return Severity.CRITICAL;
        }
        if (bands.getHigh() != null && score <= bands.getHigh()) {
            return Severity.HIGH;
        }
        if (bands.getMedium() != null && score <= bands.getMedium()) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    private static boolean reaches(double deviation, Double band) {
        return band != null && band > 0 && deviation >= band;
    }
}
