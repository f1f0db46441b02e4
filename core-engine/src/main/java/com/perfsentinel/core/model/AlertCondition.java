package com.perfsentinel.core.model;

import java.util.Locale;

/**
 * Comparison applied between a metric's window mean and a rule threshold.
 *
 * @since 1.0.0
 */
public enum AlertCondition {
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    EQUALS("equals");

    /** Absolute tolerance used by {@link #EQUALS}. */
    public static final double EQUALS_TOLERANCE = 1e-3;

    private final String code;

    AlertCondition(String code) {
        this.code = code;
    }

    /**
     * @return the lowercase configuration name, e.g. {@code greater_than}
     */
    public String getCode() {
        return code;
    }

    /**
     * Decide whether {@code value} satisfies this condition against
     * {@code threshold}.
     */
    public boolean test(double value, double threshold) {
        return switch (this) {
            case GREATER_THAN -> value > threshold;
            case LESS_THAN -> value < threshold;
            case EQUALS -> Math.abs(value - threshold) < EQUALS_TOLERANCE;
        };
    }

    /**
     * Parse a condition from its configuration name (case-insensitive).
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static AlertCondition parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Alert condition must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AlertCondition condition : values()) {
            if (condition.code.equals(normalized)) {
                return condition;
            }
        }
        throw new IllegalArgumentException("Unknown alert condition: '" + value
                + "'. Supported: greater_than, less_than, equals");
    }
}
