package com.perfsentinel.core.model;

import com.perfsentinel.core.config.ConfigurationException;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable alert rule evaluated by the
 * {@link com.perfsentinel.core.alerting.AlertEngine}.
 *
 * <p>
 * A rule is identified by its {@linkplain #getRuleKey() rule key}, derived
 * from {@code (metricName, condition, threshold)}. Registering a rule with an
 * existing key replaces the previous definition.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@link Builder#build()} validates every field and
 * throws a {@link ConfigurationException} listing all problems at once.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertRule implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final Duration DEFAULT_TIME_WINDOW = Duration.ofSeconds(300);
    public static final int DEFAULT_MIN_SAMPLES = 3;

    private final String metricName;
    private final double threshold;
    private final AlertCondition condition;
    private final AlertSeverity severity;
    private final Duration timeWindow;
    private final int minSamples;
    private final Duration cooldown;
    private final String ruleKey;

    private AlertRule(Builder b) {
        this.metricName = b.metricName;
        this.threshold = b.threshold;
        this.condition = b.condition;
        this.severity = b.severity;
        this.timeWindow = b.timeWindow;
        this.minSamples = b.minSamples;
        this.cooldown = b.cooldown;
        this.ruleKey = ruleKey(metricName, condition, threshold);
    }

    /**
     * Derive the identity key for a rule.
     *
     * @return e.g. {@code system.cpu.usage_percent_greater_than_80}
     */
    public static String ruleKey(String metricName, AlertCondition condition, double threshold) {
        return metricName + "_" + condition.getCode() + "_"
                + BigDecimal.valueOf(threshold).stripTrailingZeros().toPlainString();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getMetricName() {
        return metricName;
    }

    public double getThreshold() {
        return threshold;
    }

    public AlertCondition getCondition() {
        return condition;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public Duration getTimeWindow() {
        return timeWindow;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public Duration getCooldown() {
        return cooldown;
    }

    public String getRuleKey() {
        return ruleKey;
    }

    /**
     * Fluent builder for {@link AlertRule}.
     *
     * <p>
     * Defaults: condition {@code greater_than}, severity {@code warning},
     * window 300&nbsp;s, 3 minimum samples, no cooldown.
     * </p>
     */
    public static class Builder {
        private String metricName;
        private double threshold;
        private AlertCondition condition = AlertCondition.GREATER_THAN;
        private AlertSeverity severity = AlertSeverity.WARNING;
        private Duration timeWindow = DEFAULT_TIME_WINDOW;
        private int minSamples = DEFAULT_MIN_SAMPLES;
        private Duration cooldown = Duration.ZERO;

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder condition(AlertCondition condition) {
            this.condition = condition;
            return this;
        }

        public Builder severity(AlertSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder timeWindow(Duration timeWindow) {
            this.timeWindow = timeWindow;
            return this;
        }

        public Builder timeWindowSeconds(long seconds) {
            this.timeWindow = Duration.ofSeconds(seconds);
            return this;
        }

        public Builder minSamples(int minSamples) {
            this.minSamples = minSamples;
            return this;
        }

        public Builder cooldown(Duration cooldown) {
            this.cooldown = cooldown;
            return this;
        }

        /**
         * Validate and build the rule.
         *
         * @return a new immutable {@link AlertRule}
         * @throws ConfigurationException if any field is missing or out of range
         */
        public AlertRule build() {
            List<String> errors = new ArrayList<>();
            if (metricName == null || metricName.isBlank()) {
                errors.add("'metricName' is required");
            }
            if (Double.isNaN(threshold) || Double.isInfinite(threshold)) {
                errors.add("'threshold' must be finite");
            }
            if (condition == null) {
                errors.add("'condition' is required");
            }
            if (severity == null) {
                errors.add("'severity' is required");
            }
            if (timeWindow == null || timeWindow.isNegative() || timeWindow.isZero()) {
                errors.add("'timeWindow' must be > 0");
            }
            if (minSamples < 1) {
                errors.add("'minSamples' must be >= 1, got: " + minSamples);
            }
            if (cooldown == null || cooldown.isNegative()) {
                errors.add("'cooldown' must be >= 0");
            }
            ConfigurationException.throwIfAny("Invalid AlertRule '" + metricName + "'", errors);
            return new AlertRule(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertRule that))
            return false;
        return Double.compare(threshold, that.threshold) == 0
                && minSamples == that.minSamples
                && metricName.equals(that.metricName)
                && condition == that.condition
                && severity == that.severity
                && timeWindow.equals(that.timeWindow)
                && cooldown.equals(that.cooldown);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, threshold, condition, severity, timeWindow, minSamples, cooldown);
    }

    @Override
    public String toString() {
        return "AlertRule{" +
                "ruleKey='" + ruleKey + '\'' +
                ", severity=" + severity +
                ", timeWindow=" + timeWindow +
                ", minSamples=" + minSamples +
                ", cooldown=" + cooldown +
                '}';
    }
}
