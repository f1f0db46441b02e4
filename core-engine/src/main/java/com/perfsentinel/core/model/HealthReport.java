package com.perfsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time health report for a time range.
 *
 * <p>
 * Immutable; all collections are unmodifiable copies. Serializable to JSON
 * through its getters.
 * </p>
 *
 * @since 1.0.0
 */
public final class HealthReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final Instant startTime;
    private final Instant endTime;
    private final Instant generatedAt;
    private final Map<String, MetricStats> metricsSummary;
    private final List<Bottleneck> bottlenecks;
    private final List<ScalingRecommendation> recommendations;
    private final List<Alert> alerts;
    private final double healthScore;
    private final Map<String, Trend> trends;

    private HealthReport(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.startTime = Objects.requireNonNull(b.startTime, "startTime must not be null");
        this.endTime = Objects.requireNonNull(b.endTime, "endTime must not be null");
        this.generatedAt = Objects.requireNonNull(b.generatedAt, "generatedAt must not be null");
        this.metricsSummary = Collections.unmodifiableMap(new LinkedHashMap<>(b.metricsSummary));
        this.bottlenecks = List.copyOf(b.bottlenecks);
        this.recommendations = List.copyOf(b.recommendations);
        this.alerts = List.copyOf(b.alerts);
        if (b.healthScore < 0.0 || b.healthScore > 100.0) {
            throw new IllegalArgumentException("healthScore must be in [0, 100], got: " + b.healthScore);
        }
        this.healthScore = b.healthScore;
        this.trends = Collections.unmodifiableMap(new LinkedHashMap<>(b.trends));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private Instant startTime;
        private Instant endTime;
        private Instant generatedAt;
        private Map<String, MetricStats> metricsSummary = Map.of();
        private List<Bottleneck> bottlenecks = List.of();
        private List<ScalingRecommendation> recommendations = List.of();
        private List<Alert> alerts = List.of();
        private double healthScore = 100.0;
        private Map<String, Trend> trends = Map.of();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder generatedAt(Instant generatedAt) {
            this.generatedAt = generatedAt;
            return this;
        }

        public Builder metricsSummary(Map<String, MetricStats> metricsSummary) {
            this.metricsSummary = Objects.requireNonNull(metricsSummary);
            return this;
        }

        public Builder bottlenecks(List<Bottleneck> bottlenecks) {
            this.bottlenecks = Objects.requireNonNull(bottlenecks);
            return this;
        }

        public Builder recommendations(List<ScalingRecommendation> recommendations) {
            this.recommendations = Objects.requireNonNull(recommendations);
            return this;
        }

        public Builder alerts(List<Alert> alerts) {
            this.alerts = Objects.requireNonNull(alerts);
            return this;
        }

        public Builder healthScore(double healthScore) {
            this.healthScore = healthScore;
            return this;
        }

        public Builder trends(Map<String, Trend> trends) {
            this.trends = Objects.requireNonNull(trends);
            return this;
        }

        public HealthReport build() {
            return new HealthReport(this);
        }
    }

    public String getId() {
        return id;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public Map<String, MetricStats> getMetricsSummary() {
        return metricsSummary;
    }

    public List<Bottleneck> getBottlenecks() {
        return bottlenecks;
    }

    public List<ScalingRecommendation> getRecommendations() {
        return recommendations;
    }

    public List<Alert> getAlerts() {
        return alerts;
    }

    public double getHealthScore() {
        return healthScore;
    }

    public Map<String, Trend> getTrends() {
        return trends;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof HealthReport that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "HealthReport{" +
                "id='" + id + '\'' +
                ", range=[" + startTime + ", " + endTime + ']' +
                ", healthScore=" + healthScore +
                ", bottlenecks=" + bottlenecks.size() +
                ", recommendations=" + recommendations.size() +
                ", alerts=" + alerts.size() +
                '}';
    }
}
