package com.perfsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Alert raised when an {@link AlertRule} condition holds over its window.
 *
 * <p>
 * Alerts are immutable. Resolution produces a new instance via
 * {@link #resolve(Instant)} that keeps the same {@code id}, so history
 * entries can be matched and replaced.
 * </p>
 *
 * <h3>Identity</h3>
 * <p>
 * {@code ruleKey} is the deterministic identity of the rule that raised the
 * alert and is used to match a resolution to its trigger. {@code id} is
 * {@code ruleKey#occurrence}, distinct for every trigger of the same rule.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id}, {@code ruleKey}, {@code severity} and
 * {@code triggeredAt} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String ruleKey;
    private final String metricName;
    private final AlertSeverity severity;
    private final String message;
    private final double threshold;
    private final double currentValue;
    private final Instant triggeredAt;
    private final boolean resolved;
    private final Instant resolvedAt;

    private Alert(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.ruleKey = Objects.requireNonNull(builder.ruleKey, "ruleKey must not be null");
        this.metricName = builder.metricName;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.message = builder.message;
        this.threshold = builder.threshold;
        this.currentValue = builder.currentValue;
        this.triggeredAt = Objects.requireNonNull(builder.triggeredAt, "triggeredAt must not be null");
        this.resolved = builder.resolvedAt != null;
        this.resolvedAt = builder.resolvedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Return a resolved copy of this alert.
     *
     * @param at resolution instant; must not be {@code null}
     * @return a new alert with {@code resolved = true}
     * @throws IllegalStateException if this alert is already resolved
     */
    public Alert resolve(Instant at) {
        Objects.requireNonNull(at, "resolution instant must not be null");
        if (resolved) {
            throw new IllegalStateException("Alert " + id + " is already resolved");
        }
        return new Builder()
                .id(id)
                .ruleKey(ruleKey)
                .metricName(metricName)
                .severity(severity)
                .message(message)
                .threshold(threshold)
                .currentValue(currentValue)
                .triggeredAt(triggeredAt)
                .resolvedAt(at)
                .build();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String id;
        private String ruleKey;
        private String metricName;
        private AlertSeverity severity;
        private String message;
        private double threshold;
        private double currentValue;
        private Instant triggeredAt;
        private Instant resolvedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder ruleKey(String ruleKey) {
            this.ruleKey = ruleKey;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder severity(AlertSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder currentValue(double currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder triggeredAt(Instant triggeredAt) {
            this.triggeredAt = triggeredAt;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getRuleKey() {
        return ruleKey;
    }

    public String getMetricName() {
        return metricName;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public Instant getTriggeredAt() {
        return triggeredAt;
    }

    public boolean isResolved() {
        return resolved;
    }

    /**
     * @return resolution instant, or {@code null} while the alert is active
     */
    public Instant getResolvedAt() {
        return resolvedAt;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return id.equals(alert.id)
                && resolved == alert.resolved
                && Objects.equals(resolvedAt, alert.resolvedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, resolved, resolvedAt);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", severity=" + severity +
                ", message='" + message + '\'' +
                ", triggeredAt=" + triggeredAt +
                ", resolved=" + resolved +
                '}';
    }
}
