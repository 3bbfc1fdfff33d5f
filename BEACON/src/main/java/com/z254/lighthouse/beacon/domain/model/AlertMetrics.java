package com.z254.lighthouse.beacon.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Baseline versus current comparison carried on every alert.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AlertMetrics {

    private BaselineData baseline;

    private CurrentData current;

    /** 0 when the baseline mean is not positive */
    private double changePercentage;

    private double changeAbsolute;

    /** 0 when the baseline standard deviation is not positive */
    private double zScore;

    /** Detector specific figures (volume, ratio, affected keywords...) */
    @Builder.Default
    private Map<String, Object> additional = new LinkedHashMap<>();
}
