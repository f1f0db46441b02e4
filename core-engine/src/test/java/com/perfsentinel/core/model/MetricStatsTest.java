package com.perfsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link MetricStats}.
 */
class MetricStatsTest {

    @Test
    @DisplayName("Single sample has zero standard deviation and every percentile equal to it")
    void singleSample() {
        MetricStats stats = MetricStats.compute(new double[] { 42.0 }, 10);

        assertThat(stats.getCount()).isEqualTo(1);
        assertThat(stats.getStdDev()).isZero();
        assertThat(stats.getMedian()).isEqualTo(42.0);
        assertThat(stats.getP95()).isEqualTo(42.0);
        assertThat(stats.getP99()).isEqualTo(42.0);
        assertThat(stats.getRatePerSecond()).isEqualTo(0.1);
    }

    @Test
    @DisplayName("Median of an even count averages the two middle values")
    void evenMedian() {
        MetricStats stats = MetricStats.compute(new double[] { 4, 1, 3, 2 }, 1);

        assertThat(stats.getMedian()).isEqualTo(2.5);
        assertThat(stats.getMin()).isEqualTo(1);
        assertThat(stats.getMax()).isEqualTo(4);
    }

    @Test
    @DisplayName("Percentiles use nearest rank at floor(n*p)")
    void nearestRankPercentiles() {
        double[] values = new double[100];
        for (int i = 0; i < 100; i++) {
            values[i] = i + 1;
        }
        MetricStats stats = MetricStats.compute(values, 50);

        assertThat(stats.getP95()).isEqualTo(96);
        assertThat(stats.getP99()).isEqualTo(100);
        assertThat(stats.getMean()).isEqualTo(50.5);
        assertThat(stats.getStdDev()).isCloseTo(29.0115, within(1e-3));
        assertThat(stats.getRatePerSecond()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("p99 >= p95 >= median for arbitrary samples")
    void percentileOrdering() {
        Random random = new Random(7);
        for (int round = 0; round < 200; round++) {
            int n = 1 + random.nextInt(300);
            double[] values = new double[n];
            for (int i = 0; i < n; i++) {
                values[i] = random.nextGaussian() * 100;
            }
            MetricStats stats = MetricStats.compute(values, 60);

            assertThat(stats.getP99()).isGreaterThanOrEqualTo(stats.getP95());
            assertThat(stats.getP95()).isGreaterThanOrEqualTo(stats.getMedian());
        }
    }

    @Test
    @DisplayName("Empty samples are rejected")
    void emptyRejected() {
        assertThatThrownBy(() -> MetricStats.compute(new double[0], 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
