package com.perfsentinel.core.config;

import com.perfsentinel.core.model.AlertRule;
import com.perfsentinel.core.model.ScalingRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top-level POJO for the rules YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * alertRules:
 *   - metricName: system.cpu.usage_percent
 *     condition: greater_than
 *     threshold: 80
 *     severity: warning
 * scalingRules:
 *   - resourceType: model_workers
 *     metricName: system.cpu.usage_percent
 *     scaleUpThreshold: 80
 *     scaleDownThreshold: 30
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every rule is valid.
 * </p>
 *
 * @since 1.0.0
 */
public class RulesConfig {

    private List<AlertRuleDefinition> alertRules = new ArrayList<>();
    private List<ScalingRuleDefinition> scalingRules = new ArrayList<>();

    public List<AlertRuleDefinition> getAlertRules() {
        return Collections.unmodifiableList(alertRules);
    }

    public void setAlertRules(List<AlertRuleDefinition> alertRules) {
        this.alertRules = alertRules != null ? new ArrayList<>(alertRules) : new ArrayList<>();
    }

    public List<ScalingRuleDefinition> getScalingRules() {
        return Collections.unmodifiableList(scalingRules);
    }

    public void setScalingRules(List<ScalingRuleDefinition> scalingRules) {
        this.scalingRules = scalingRules != null ? new ArrayList<>(scalingRules) : new ArrayList<>();
    }

    /**
     * Validate every rule, collecting all errors into a single exception.
     *
     * @throws ConfigurationException if one or more rules are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < alertRules.size(); i++) {
            AlertRuleDefinition def = alertRules.get(i);
            if (def == null) {
                errors.add("alertRules[" + i + "] is null");
                continue;
            }
            try {
                def.toRule();
            } catch (ConfigurationException e) {
                errors.add("alertRules[" + i + "]: " + e.getMessage());
            }
        }
        for (int i = 0; i < scalingRules.size(); i++) {
            ScalingRuleDefinition def = scalingRules.get(i);
            if (def == null) {
                errors.add("scalingRules[" + i + "] is null");
                continue;
            }
            try {
                def.toRule();
            } catch (ConfigurationException e) {
                errors.add("scalingRules[" + i + "]: " + e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            throw new ConfigurationException("Rules configuration validation failed:\n  - "
                    + String.join("\n  - ", errors));
        }
    }

    /**
     * @throws ConfigurationException if a definition is invalid
     */
    public List<AlertRule> toAlertRules() {
        List<AlertRule> rules = new ArrayList<>(alertRules.size());
        for (AlertRuleDefinition def : alertRules) {
            rules.add(def.toRule());
        }
        return rules;
    }

    /**
     * @throws ConfigurationException if a definition is invalid
     */
    public List<ScalingRule> toScalingRules() {
        List<ScalingRule> rules = new ArrayList<>(scalingRules.size());
        for (ScalingRuleDefinition def : scalingRules) {
            rules.add(def.toRule());
        }
        return rules;
    }

    @Override
    public String toString() {
        return "RulesConfig{alertRules=" + alertRules + ", scalingRules=" + scalingRules + '}';
    }
}
