package com.perfsentinel.core.config;

import com.perfsentinel.core.model.AlertCondition;
import com.perfsentinel.core.model.AlertRule;
import com.perfsentinel.core.model.AlertSeverity;

import java.time.Duration;

/**
 * YAML form of an {@link AlertRule}.
 *
 * <pre>
 * alertRules:
 *   - metricName: system.cpu.usage_percent
 *     condition: greater_than
 *     threshold: 80
 *     severity: warning
 *     timeWindowSeconds: 300
 *     minSamples: 3
 *     cooldownSeconds: 0
 * </pre>
 *
 * @since 1.0.0
 */
public class AlertRuleDefinition {

    private String metricName;
    private Double threshold;
    private String condition = AlertCondition.GREATER_THAN.getCode();
    private String severity = "warning";
    private long timeWindowSeconds = AlertRule.DEFAULT_TIME_WINDOW.toSeconds();
    private int minSamples = AlertRule.DEFAULT_MIN_SAMPLES;
    private long cooldownSeconds;

    /**
     * Convert to a validated {@link AlertRule}.
     *
     * @throws ConfigurationException if the definition is invalid
     */
    public AlertRule toRule() {
        if (threshold == null) {
            throw new ConfigurationException("Invalid AlertRule '" + metricName + "': 'threshold' is required");
        }
        if (cooldownSeconds < 0) {
            throw new ConfigurationException("Invalid AlertRule '" + metricName
                    + "': 'cooldownSeconds' must be >= 0, got: " + cooldownSeconds);
        }
        AlertCondition parsedCondition;
        AlertSeverity parsedSeverity;
        try {
            parsedCondition = AlertCondition.parse(condition);
            parsedSeverity = AlertSeverity.parse(severity);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid AlertRule '" + metricName + "': " + e.getMessage(), e);
        }
        return AlertRule.builder()
                .metricName(metricName)
                .threshold(threshold)
                .condition(parsedCondition)
                .severity(parsedSeverity)
                .timeWindowSeconds(timeWindowSeconds)
                .minSamples(minSamples)
                .cooldown(Duration.ofSeconds(cooldownSeconds))
                .build();
    }

    public String getMetricName() {
        return metricName;
    }

    public void setMetricName(String metricName) {
        this.metricName = metricName;
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public String getCondition() {
        return condition;
    }

    public void setCondition(String condition) {
        this.condition = condition;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public long getTimeWindowSeconds() {
        return timeWindowSeconds;
    }

    public void setTimeWindowSeconds(long timeWindowSeconds) {
        this.timeWindowSeconds = timeWindowSeconds;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public long getCooldownSeconds() {
        return cooldownSeconds;
    }

    public void setCooldownSeconds(long cooldownSeconds) {
        this.cooldownSeconds = cooldownSeconds;
    }

    @Override
    public String toString() {
        return "AlertRuleDefinition{metricName='" + metricName + "', condition=" + condition
                + ", threshold=" + threshold + ", severity=" + severity + '}';
    }
}
