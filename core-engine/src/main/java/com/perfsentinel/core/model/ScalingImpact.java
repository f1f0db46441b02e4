package com.perfsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Advisory projection of what a capacity change would do.
 *
 * <p>
 * Derived purely from the capacity ratio {@code r = recommended / current};
 * nothing here is measured.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScalingImpact implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double throughputChangePercent;
    private final double latencyChangePercent;
    private final double costChangePercent;
    private final double reliabilityImprovement;

    public ScalingImpact(double throughputChangePercent, double latencyChangePercent,
            double costChangePercent, double reliabilityImprovement) {
        this.throughputChangePercent = throughputChangePercent;
        this.latencyChangePercent = latencyChangePercent;
        this.costChangePercent = costChangePercent;
        this.reliabilityImprovement = reliabilityImprovement;
    }

    /**
     * Project the impact of moving from {@code current} to {@code recommended}
     * capacity.
     *
     * <p>
     * A current capacity of zero is treated as a ratio equal to the
     * recommended capacity.
     * </p>
     */
    public static ScalingImpact estimate(int current, int recommended) {
        double ratio = current > 0 ? (double) recommended / current : recommended;
        double latency = ratio > 0 ? (1.0 / ratio - 1.0) * 100.0 : 0.0;
        return new ScalingImpact(
                (ratio - 1.0) * 100.0,
                latency,
                (ratio - 1.0) * 100.0,
                Math.min(ratio * 0.1, 0.5));
    }

    public double getThroughputChangePercent() {
        return throughputChangePercent;
    }

    public double getLatencyChangePercent() {
        return latencyChangePercent;
    }

    public double getCostChangePercent() {
        return costChangePercent;
    }

    public double getReliabilityImprovement() {
        return reliabilityImprovement;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScalingImpact that))
            return false;
        return Double.compare(throughputChangePercent, that.throughputChangePercent) == 0
                && Double.compare(latencyChangePercent, that.latencyChangePercent) == 0
                && Double.compare(costChangePercent, that.costChangePercent) == 0
                && Double.compare(reliabilityImprovement, that.reliabilityImprovement) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(throughputChangePercent, latencyChangePercent, costChangePercent,
                reliabilityImprovement);
    }

    @Override
    public String toString() {
        return "ScalingImpact{" +
                "throughput=" + throughputChangePercent + "%" +
                ", latency=" + latencyChangePercent + "%" +
                ", cost=" + costChangePercent + "%" +
                ", reliability=" + reliabilityImprovement +
                '}';
    }
}
