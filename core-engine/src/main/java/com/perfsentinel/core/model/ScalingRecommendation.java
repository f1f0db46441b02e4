package com.perfsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable capacity recommendation emitted by the
 * {@link com.perfsentinel.core.scaling.AutoScaler}.
 *
 * <p>
 * Construct through the {@link Builder}; {@code id}, {@code action},
 * {@code resourceType} and {@code timestamp} are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScalingRecommendation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final ScalingAction action;
    private final String resourceType;
    private final String metricName;
    private final int currentCapacity;
    private final int recommendedCapacity;
    private final double confidence;
    private final String reasoning;
    private final ScalingImpact estimatedImpact;
    private final Instant timestamp;

    private ScalingRecommendation(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.action = Objects.requireNonNull(b.action, "action must not be null");
        this.resourceType = Objects.requireNonNull(b.resourceType, "resourceType must not be null");
        this.metricName = b.metricName;
        this.currentCapacity = b.currentCapacity;
        this.recommendedCapacity = b.recommendedCapacity;
        if (b.confidence < 0.0 || b.confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + b.confidence);
        }
        this.confidence = b.confidence;
        this.reasoning = b.reasoning;
        this.estimatedImpact = b.estimatedImpact;
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private ScalingAction action;
        private String resourceType;
        private String metricName;
        private int currentCapacity;
        private int recommendedCapacity;
        private double confidence;
        private String reasoning;
        private ScalingImpact estimatedImpact;
        private Instant timestamp;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder action(ScalingAction action) {
            this.action = action;
            return this;
        }

        public Builder resourceType(String resourceType) {
            this.resourceType = resourceType;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder currentCapacity(int currentCapacity) {
            this.currentCapacity = currentCapacity;
            return this;
        }

        public Builder recommendedCapacity(int recommendedCapacity) {
            this.recommendedCapacity = recommendedCapacity;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder reasoning(String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public Builder estimatedImpact(ScalingImpact estimatedImpact) {
            this.estimatedImpact = estimatedImpact;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public ScalingRecommendation build() {
            return new ScalingRecommendation(this);
        }
    }

    public String getId() {
        return id;
    }

    public ScalingAction getAction() {
        return action;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getMetricName() {
        return metricName;
    }

    public int getCurrentCapacity() {
        return currentCapacity;
    }

    public int getRecommendedCapacity() {
        return recommendedCapacity;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getReasoning() {
        return reasoning;
    }

    public ScalingImpact getEstimatedImpact() {
        return estimatedImpact;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScalingRecommendation that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "ScalingRecommendation{" +
                "id='" + id + '\'' +
                ", action=" + action +
                ", resourceType='" + resourceType + '\'' +
                ", currentCapacity=" + currentCapacity +
                ", recommendedCapacity=" + recommendedCapacity +
                ", confidence=" + confidence +
                '}';
    }
}
