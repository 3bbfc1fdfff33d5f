package com.z254.lighthouse.beacon.detection.stats;

import com.z254.lighthouse.beacon.domain.model.CurrentData;
import com.z254.lighthouse.beacon.domain.model.Period;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Plain mean of the current window. No trimming.
 */
@Component
public class CurrentPeriodEvaluator {

    public CurrentData evaluate(List<Double> samples, Period period) {
        if (samples == null || samples.isEmpty()) {
            return CurrentData.builder().value(0).count(0).period(period).build();
        }
        double mean = samples.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        return CurrentData.builder()
                .value(mean)
                .count(samples.size())
                .period(period)
                .build();
    }
}
