package com.perfsentinel.core.config;

import com.perfsentinel.core.model.ScalingRule;

import java.time.Duration;

/**
 * YAML form of a {@link ScalingRule}.
 *
 * <pre>
 * scalingRules:
 *   - resourceType: model_workers
 *     metricName: system.cpu.usage_percent
 *     scaleUpThreshold: 80
 *     scaleDownThreshold: 30
 *     minCapacity: 1
 *     maxCapacity: 8
 *     scalingFactor: 1.5
 * </pre>
 *
 * @since 1.0.0
 */
public class ScalingRuleDefinition {

    private String resourceType;
    private String metricName;
    private Double scaleUpThreshold;
    private Double scaleDownThreshold;
    private int minCapacity = 1;
    private int maxCapacity = 10;
    private double scalingFactor = 1.5;
    private long windowSeconds = ScalingRule.DEFAULT_WINDOW.toSeconds();

    /**
     * Convert to a validated {@link ScalingRule}.
     *
     * @throws ConfigurationException if the definition is invalid
     */
    public ScalingRule toRule() {
        if (scaleUpThreshold == null || scaleDownThreshold == null) {
            throw new ConfigurationException("Invalid ScalingRule '" + resourceType
                    + "': 'scaleUpThreshold' and 'scaleDownThreshold' are required");
        }
        return ScalingRule.builder()
                .resourceType(resourceType)
                .metricName(metricName)
                .scaleUpThreshold(scaleUpThreshold)
                .scaleDownThreshold(scaleDownThreshold)
                .minCapacity(minCapacity)
                .maxCapacity(maxCapacity)
                .scalingFactor(scalingFactor)
                .window(Duration.ofSeconds(windowSeconds))
                .build();
    }

    public String getResourceType() {
        return resourceType;
    }

    public void setResourceType(String resourceType) {
        this.resourceType = resourceType;
    }

    public String getMetricName() {
        return metricName;
    }

    public void setMetricName(String metricName) {
        this.metricName = metricName;
    }

    public Double getScaleUpThreshold() {
        return scaleUpThreshold;
    }

    public void setScaleUpThreshold(Double scaleUpThreshold) {
        this.scaleUpThreshold = scaleUpThreshold;
    }

    public Double getScaleDownThreshold() {
        return scaleDownThreshold;
    }

    public void setScaleDownThreshold(Double scaleDownThreshold) {
        this.scaleDownThreshold = scaleDownThreshold;
    }

    public int getMinCapacity() {
        return minCapacity;
    }

    public void setMinCapacity(int minCapacity) {
        this.minCapacity = minCapacity;
    }

    public int getMaxCapacity() {
        return maxCapacity;
    }

    public void setMaxCapacity(int maxCapacity) {
        this.maxCapacity = maxCapacity;
    }

    public double getScalingFactor() {
        return scalingFactor;
    }

    public void setScalingFactor(double scalingFactor) {
        this.scalingFactor = scalingFactor;
    }

    public long getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(long windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    @Override
    public String toString() {
        return "ScalingRuleDefinition{resourceType='" + resourceType + "', metricName='" + metricName
                + "', up=" + scaleUpThreshold + ", down=" + scaleDownThreshold + '}';
    }
}
