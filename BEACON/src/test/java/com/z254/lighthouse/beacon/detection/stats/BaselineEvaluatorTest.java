package com.z254.lighthouse.beacon.detection.stats;

import com.z254.lighthouse.beacon.domain.model.BaselineData;
import com.z254.lighthouse.beacon.domain.model.Period;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BaselineEvaluatorTest {

    private final BaselineEvaluator evaluator = new BaselineEvaluator();
    private final Period period = Period.of(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 20));

    @Test
    @DisplayName("should trim outliers from mean and deviation but keep them in min/max/count")
    void trimsOutliers() {
        List<Double> samples = new ArrayList<>(Collections.nCopies(19, 1.0));
        samples.add(100.0);

        BaselineData baseline = evaluator.evaluate(samples, period);

        assertThat(baseline.getMean()).isCloseTo(1.0, within(1e-9));
        assertThat(baseline.getStdDev()).isCloseTo(0.0, within(1e-9));
        assertThat(baseline.getCount()).isEqualTo(20);
        assertThat(baseline.getMin()).isEqualTo(1.0);
        assertThat(baseline.getMax()).isEqualTo(100.0);
        assertThat(baseline.getMedian()).isEqualTo(1.0);
        assertThat(baseline.getPeriod()).isEqualTo(period);
    }

    @Test
    @DisplayName("should not trim samples shorter than twenty observations")
    void keepsShortSamplesWhole() {
        BaselineData baseline = evaluator.evaluate(List.of(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0), period);

        assertThat(baseline.getMean()).isCloseTo(5.0, within(1e-9));
        assertThat(baseline.getStdDev()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    @DisplayName("should take the upper middle value as median of an even sample")
    void evenLengthMedian() {
        BaselineData baseline = evaluator.evaluate(List.of(4.0, 1.0, 3.0, 2.0), period);

        assertThat(baseline.getMedian()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("should return an all-zero baseline for an empty sample")
    void emptySample() {
        BaselineData baseline = evaluator.evaluate(List.of(), period);

        assertThat(baseline.getMean()).isZero();
        assertThat(baseline.getStdDev()).isZero();
        assertThat(baseline.getCount()).isZero();
        assertThat(baseline.getPeriod()).isEqualTo(period);
    }
}
