package com.z254.lighthouse.beacon.detection.stats;

import com.z254.lighthouse.beacon.domain.model.BaselineData;
import com.z254.lighthouse.beacon.domain.model.Period;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Robust summary of a historical window.
 * <p>
 * The sample is sorted and {@code floor(n * 0.05)} observations are dropped from each end
 * before the mean and population standard deviation are taken. The median is the element at
 * index {@code floor(n / 2)} of the sorted untrimmed sample, so even-length samples take the
 * upper middle value.
 */
@Component
public class BaselineEvaluator {

    static final double TRIM_FRACTION = 0.05;

    public BaselineData evaluate(List<Double> samples, Period period) {
        if (samples == null || samples.isEmpty()) {
            return BaselineData.empty(period);
        }

        double[] sorted = samples.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        int n = sorted.length;
        int trim = (int) Math.floor(n * TRIM_FRACTION);

        double sum = 0;
        int kept = n - 2 * trim;
        for (int i = trim; i < n - trim; i++) {
            sum += sorted[i];
        }
        double mean = sum / kept;

        double squares = 0;
        for (int i = trim; i < n - trim; i++) {
            double d = sorted[i] - mean;
            squares += d * d;
        }
        double stdDev = Math.sqrt(squares / kept);

        return BaselineData.builder()
                .mean(mean)
                .stdDev(stdDev)
                .median(sorted[n / 2])
                .count(n)
                .min(sorted[0])
                .max(sorted[n - 1])
                .period(period)
                .build();
    }
}
