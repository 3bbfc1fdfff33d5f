package com.z254.lighthouse.beacon.detection.source;

import com.z254.lighthouse.beacon.domain.model.Entity;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Metric source backed by daily values pushed through {@link #record}. Serves as the default
 * source until an ads reporting connector is wired up.
 */
@Component
public class InMemoryMetricSource implements MetricSource {

    private final Map<String, NavigableMap<LocalDate, Double>> series = new ConcurrentHashMap<>();

    public void record(Metric metric, Entity entity, LocalDate day, double value) {
        series.computeIfAbsent(key(metric, entity), k -> new ConcurrentSkipListMap<>())
                .put(day, value);
    }

    /**
     * Record the same value for every day in the inclusive range.
     */
    public void recordRange(Metric metric, Entity entity, LocalDate startInclusive,
                            LocalDate endInclusive, double value) {
        for (LocalDate day = startInclusive; !day.isAfter(endInclusive); day = day.plusDays(1)) {
            record(metric, entity, day, value);
        }
    }

    @Override
    public List<Double> fetchMetrics(Metric metric, Entity entity, LocalDate startInclusive,
                                     LocalDate endInclusive) {
        NavigableMap<LocalDate, Double> values = series.get(key(metric, entity));
        if (values == null || startInclusive.isAfter(endInclusive)) {
            return List.of();
        }
        return new ArrayList<>(values.subMap(startInclusive, true, endInclusive, true).values());
    }

    private static String key(Metric metric, Entity entity) {
        return metric.name() + "|" + entity.getType() + "|" + entity.getId();
    }
}
