package com.z254.lighthouse.beacon.config;

import com.z254.lighthouse.beacon.domain.model.AlertType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-detector configuration: thresholds plus an optional noise-control override.
 * <p>
 * Bound from {@code beacon.detection.detectors.<type>}. Types that are not configured
 * use {@link #defaultsFor(AlertType)}.
 */
@Data
public class AlertConfig {

    private AlertType type;

    private boolean enabled = true;

    private Thresholds thresholds = new Thresholds();

    /** Null means the global default applies */
    private NoiseControlConfig noiseControl;

    @Data
    public static class Thresholds {
        /** Null means the global default window applies */
        private Integer baselineDays;
        private Integer currentDays;

        /** Volume gate: impressions, clicks or per-keyword impressions depending on the detector */
        private Double minVolume;

        /** Ratio current/baseline that trips the detector */
        private Double changeFactor;

        /** Extra absolute gate for spend spikes */
        private Double minAbsoluteChange;

        /** Quality score below which a keyword is flagged */
        private Double scoreThreshold;

        private SeverityBands severityBands;
    }

    /**
     * Lower bounds of the critical/high/medium bands. For ratio detectors the bounds apply
     * to {@code |1 - ratio|}; for the quality score detector they are upper bounds on the score.
     * Unset bands are skipped.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SeverityBands {
        private Double critical;
        private Double high;
        private Double medium;
    }

    /**
     * Built-in thresholds per alert type.
     */
    public static AlertConfig defaultsFor(AlertType type) {
        AlertConfig config = new AlertConfig();
        config.setType(type);
        Thresholds t = config.getThresholds();
        switch (type) {
            case CTR_DROP -> {
                t.setMinVolume(1000d);
                t.setChangeFactor(0.6);
                t.setSeverityBands(new SeverityBands(0.6, 0.5, 0.4));
            }
            case CPC_JUMP -> {
                t.setMinVolume(50d);
                t.setChangeFactor(1.3);
                t.setSeverityBands(new SeverityBands(1.0, 0.6, 0.3));
            }
            case SPEND_SPIKE -> {
                t.setMinVolume(50d);
                t.setChangeFactor(2.0);
                t.setMinAbsoluteChange(100d);
                t.setSeverityBands(new SeverityBands(2.0, 1.0, 0.5));
            }
            case SPEND_DROP -> {
                t.setMinVolume(1000d);
                t.setChangeFactor(0.5);
                t.setSeverityBands(new SeverityBands(0.8, 0.65, 0.5));
            }
            case CONVERSION_DROP -> {
                t.setMinVolume(100d);
                t.setChangeFactor(0.7);
                t.setSeverityBands(new SeverityBands(0.6, 0.45, 0.3));
            }
            case QUALITY_SCORE -> {
                t.setBaselineDays(7);
                t.setCurrentDays(1);
                t.setMinVolume(100d);
                t.setScoreThreshold(5d);
                t.setSeverityBands(new SeverityBands(2d, 3d, 4d));
            }
            case LP_REGRESSION -> {
                t.setBaselineDays(7);
                t.setCurrentDays(1);
                config.setNoiseControl(NoiseControlConfig.of(NoiseControlConfig.Strategy.CONSECUTIVE, 1, 1));
            }
        }
        return config;
    }

    /**
     * Fill every unset threshold and the noise-control override from another configuration.
     */
    public AlertConfig fillFrom(AlertConfig defaults) {
        Thresholds d = defaults.getThresholds();
        Thresholds t = thresholds;
        if (t.getBaselineDays() == null) {
            t.setBaselineDays(d.getBaselineDays());
        }
        if (t.getCurrentDays() == null) {
            t.setCurrentDays(d.getCurrentDays());
        }
        if (t.getMinVolume() == null) {
            t.setMinVolume(d.getMinVolume());
        }
        if (t.getChangeFactor() == null) {
            t.setChangeFactor(d.getChangeFactor());
        }
        if (t.getMinAbsoluteChange() == null) {
            t.setMinAbsoluteChange(d.getMinAbsoluteChange());
        }
        if (t.getScoreThreshold() == null) {
            t.setScoreThreshold(d.getScoreThreshold());
        }
        if (t.getSeverityBands() == null) {
            t.setSeverityBands(d.getSeverityBands());
        }
        if (noiseControl == null && defaults.getNoiseControl() != null) {
            noiseControl = defaults.getNoiseControl().copy();
        }
        return this;
    }
}
