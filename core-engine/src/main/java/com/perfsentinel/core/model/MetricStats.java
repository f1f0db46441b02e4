package com.perfsentinel.core.model;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * Summary statistics over the samples of one metric inside a time window.
 *
 * <p>
 * Only ever created for a non-empty sample set; an empty window is expressed
 * by the absence of a {@code MetricStats} (see
 * {@link com.perfsentinel.core.recorder.MetricRecorder#stats(String, long)}).
 * </p>
 *
 * <h3>Definitions</h3>
 * <ul>
 * <li>{@code median}: middle value, or the mean of the two middle values for
 * an even count</li>
 * <li>{@code stdDev}: sample standard deviation (n&nbsp;−&nbsp;1), zero for a
 * single sample</li>
 * <li>{@code p95}/{@code p99}: nearest rank: the sorted value at index
 * {@code floor(n·p)}, clamped to {@code n − 1}</li>
 * <li>{@code ratePerSecond}: sample count divided by the window length</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class MetricStats implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int count;
    private final double min;
    private final double max;
    private final double mean;
    private final double median;
    private final double stdDev;
    private final double p95;
    private final double p99;
    private final double ratePerSecond;

    private MetricStats(int count, double min, double max, double mean, double median,
            double stdDev, double p95, double p99, double ratePerSecond) {
        this.count = count;
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.median = median;
        this.stdDev = stdDev;
        this.p95 = p95;
        this.p99 = p99;
        this.ratePerSecond = ratePerSecond;
    }

    /**
     * Compute statistics over a set of values.
     *
     * @param values        sample values; must not be {@code null} or empty.
     *                      The array is sorted in place.
     * @param windowSeconds window length used for the rate; must be &gt; 0
     * @return computed statistics
     * @throws IllegalArgumentException if {@code values} is empty or the window
     *                                  is not positive
     */
    public static MetricStats compute(double[] values, double windowSeconds) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot compute statistics over an empty sample set");
        }
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("windowSeconds must be > 0, got: " + windowSeconds);
        }

        Arrays.sort(values);
        int n = values.length;

        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        double mean = sum / n;

        double stdDev = 0;
        if (n > 1) {
            double sumSquaredDiff = 0;
            for (double v : values) {
                double diff = v - mean;
                sumSquaredDiff += diff * diff;
            }
            stdDev = Math.sqrt(sumSquaredDiff / (n - 1));
        }

        double median = (n % 2 == 1)
                ? values[n / 2]
                : (values[n / 2 - 1] + values[n / 2]) / 2.0;

        return new MetricStats(n, values[0], values[n - 1], mean, median, stdDev,
                nearestRank(values, 0.95), nearestRank(values, 0.99), n / windowSeconds);
    }

    /**
     * Nearest-rank percentile over sorted values.
     *
     * @param sorted     ascending values, non-empty
     * @param percentile fraction in [0, 1]
     * @return the value at {@code floor(n·p)}, clamped to the last index
     */
    static double nearestRank(double[] sorted, double percentile) {
        int index = (int) Math.floor(sorted.length * percentile);
        return sorted[Math.min(index, sorted.length - 1)];
    }

    public int getCount() {
        return count;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getMean() {
        return mean;
    }

    public double getMedian() {
        return median;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getP95() {
        return p95;
    }

    public double getP99() {
        return p99;
    }

    public double getRatePerSecond() {
        return ratePerSecond;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricStats that))
            return false;
        return count == that.count
                && Double.compare(min, that.min) == 0
                && Double.compare(max, that.max) == 0
                && Double.compare(mean, that.mean) == 0
                && Double.compare(median, that.median) == 0
                && Double.compare(stdDev, that.stdDev) == 0
                && Double.compare(p95, that.p95) == 0
                && Double.compare(p99, that.p99) == 0
                && Double.compare(ratePerSecond, that.ratePerSecond) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, min, max, mean, median, stdDev, p95, p99, ratePerSecond);
    }

    @Override
    public String toString() {
        return "MetricStats{" +
                "count=" + count +
                ", min=" + min +
                ", max=" + max +
                ", mean=" + mean +
                ", median=" + median +
                ", stdDev=" + stdDev +
                ", p95=" + p95 +
                ", p99=" + p99 +
                ", ratePerSecond=" + ratePerSecond +
                '}';
    }
}
