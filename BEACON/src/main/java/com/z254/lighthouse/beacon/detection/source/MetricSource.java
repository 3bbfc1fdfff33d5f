package com.z254.lighthouse.beacon.detection.source;

import com.z254.lighthouse.beacon.domain.model.Entity;

import java.time.LocalDate;
import java.util.List;

/**
 * Supplies daily metric observations for an entity.
 */
public interface MetricSource {

    /**
     * Daily observations in the inclusive range, one per day with data. Days without data are
     * omitted, so the list may be shorter than the range or empty.
     */
    List<Double> fetchMetrics(Metric metric, Entity entity, LocalDate startInclusive, LocalDate endInclusive);

    default double fetchTotal(Metric metric, Entity entity, LocalDate startInclusive, LocalDate endInclusive) {
        return fetchMetrics(metric, entity, startInclusive, endInclusive).stream()
                .mapToDouble(Double::doubleValue)
                .sum();
    }
}
