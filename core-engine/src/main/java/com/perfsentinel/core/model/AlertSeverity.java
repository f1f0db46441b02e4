package com.perfsentinel.core.model;

import java.util.Locale;

/**
 * Alert severity levels, ordered from least to most severe.
 *
 * <p>
 * Each level carries the number of points an alert of that severity costs
 * the health score of a report.
 * </p>
 *
 * @since 1.0.0
 */
public enum AlertSeverity {
    INFO(0),
    WARNING(5),
    CRITICAL(15),
    EMERGENCY(25);

    private final int healthPenalty;

    AlertSeverity(int healthPenalty) {
        this.healthPenalty = healthPenalty;
    }

    public int getHealthPenalty() {
        return healthPenalty;
    }

    /**
     * Parse a severity name case-insensitively.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static AlertSeverity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Alert severity must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown alert severity: '" + value
                    + "'. Supported: info, warning, critical, emergency", e);
        }
    }
}
