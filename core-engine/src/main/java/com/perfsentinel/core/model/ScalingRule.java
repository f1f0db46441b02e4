package com.perfsentinel.core.model;

import com.perfsentinel.core.config.ConfigurationException;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable auto-scaling rule for one resource type.
 *
 * <p>
 * The window mean of {@code metricName} is compared against the two
 * thresholds: above {@code scaleUpThreshold} recommends more capacity, below
 * {@code scaleDownThreshold} recommends less. Capacity is multiplied or
 * divided by {@code scalingFactor} and kept within
 * {@code [minCapacity, maxCapacity]}.
 * </p>
 *
 * <p>
 * {@link Builder#build()} throws a {@link ConfigurationException} if
 * {@code scaleUpThreshold <= scaleDownThreshold}, {@code scalingFactor <= 1},
 * {@code minCapacity < 0} or {@code maxCapacity < minCapacity}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScalingRule implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(300);

    private final String resourceType;
    private final String metricName;
    private final double scaleUpThreshold;
    private final double scaleDownThreshold;
    private final int minCapacity;
    private final int maxCapacity;
    private final double scalingFactor;
    private final Duration window;

    private ScalingRule(Builder b) {
        this.resourceType = b.resourceType;
        this.metricName = b.metricName;
        this.scaleUpThreshold = b.scaleUpThreshold;
        this.scaleDownThreshold = b.scaleDownThreshold;
        this.minCapacity = b.minCapacity;
        this.maxCapacity = b.maxCapacity;
        this.scalingFactor = b.scalingFactor;
        this.window = b.window;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getScaleUpThreshold() {
        return scaleUpThreshold;
    }

    public double getScaleDownThreshold() {
        return scaleDownThreshold;
    }

    public int getMinCapacity() {
        return minCapacity;
    }

    public int getMaxCapacity() {
        return maxCapacity;
    }

    public double getScalingFactor() {
        return scalingFactor;
    }

    public Duration getWindow() {
        return window;
    }

    /**
     * Fluent builder for {@link ScalingRule}.
     *
     * <p>
     * Defaults: capacity 1..10, scaling factor 1.5, window 300&nbsp;s.
     * </p>
     */
    public static class Builder {
        private String resourceType;
        private String metricName;
        private double scaleUpThreshold;
        private double scaleDownThreshold;
        private int minCapacity = 1;
        private int maxCapacity = 10;
        private double scalingFactor = 1.5;
        private Duration window = DEFAULT_WINDOW;

        public Builder resourceType(String resourceType) {
            this.resourceType = resourceType;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder scaleUpThreshold(double scaleUpThreshold) {
            this.scaleUpThreshold = scaleUpThreshold;
            return this;
        }

        public Builder scaleDownThreshold(double scaleDownThreshold) {
            this.scaleDownThreshold = scaleDownThreshold;
            return this;
        }

        public Builder minCapacity(int minCapacity) {
            this.minCapacity = minCapacity;
            return this;
        }

        public Builder maxCapacity(int maxCapacity) {
            this.maxCapacity = maxCapacity;
            return this;
        }

        public Builder scalingFactor(double scalingFactor) {
            this.scalingFactor = scalingFactor;
            return this;
        }

        public Builder window(Duration window) {
            this.window = window;
            return this;
        }

        /**
         * Validate and build the rule.
         *
         * @return a new immutable {@link ScalingRule}
         * @throws ConfigurationException if the definition is invalid
         */
        public ScalingRule build() {
            List<String> errors = new ArrayList<>();
            if (resourceType == null || resourceType.isBlank()) {
                errors.add("'resourceType' is required");
            }
            if (metricName == null || metricName.isBlank()) {
                errors.add("'metricName' is required");
            }
            if (!(scaleUpThreshold > scaleDownThreshold)) {
                errors.add("'scaleUpThreshold' (" + scaleUpThreshold
                        + ") must be greater than 'scaleDownThreshold' (" + scaleDownThreshold + ")");
            }
            if (minCapacity < 0) {
                errors.add("'minCapacity' must be >= 0, got: " + minCapacity);
            }
            if (maxCapacity < minCapacity) {
                errors.add("'maxCapacity' (" + maxCapacity + ") must be >= 'minCapacity' (" + minCapacity + ")");
            }
            if (!(scalingFactor > 1.0) || Double.isInfinite(scalingFactor)) {
                errors.add("'scalingFactor' must be > 1, got: " + scalingFactor);
            }
            if (window == null || window.isNegative() || window.isZero()) {
                errors.add("'window' must be > 0");
            }
            ConfigurationException.throwIfAny("Invalid ScalingRule '" + resourceType + "'", errors);
            return new ScalingRule(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScalingRule that))
            return false;
        return Double.compare(scaleUpThreshold, that.scaleUpThreshold) == 0
                && Double.compare(scaleDownThreshold, that.scaleDownThreshold) == 0
                && minCapacity == that.minCapacity
                && maxCapacity == that.maxCapacity
                && Double.compare(scalingFactor, that.scalingFactor) == 0
                && resourceType.equals(that.resourceType)
                && metricName.equals(that.metricName)
                && window.equals(that.window);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resourceType, metricName, scaleUpThreshold, scaleDownThreshold,
                minCapacity, maxCapacity, scalingFactor, window);
    }

    @Override
    public String toString() {
        return "ScalingRule{" +
                "resourceType='" + resourceType + '\'' +
                ", metricName='" + metricName + '\'' +
                ", scaleUpThreshold=" + scaleUpThreshold +
                ", scaleDownThreshold=" + scaleDownThreshold +
                ", capacity=[" + minCapacity + ", " + maxCapacity + ']' +
                ", scalingFactor=" + scalingFactor +
                ", window=" + window +
                '}';
    }
}
