package com.perfsentinel.core.model;

import java.util.Locale;

/**
 * Kind of a recorded metric.
 *
 * <ul>
 * <li>{@link #COUNTER}: increments accumulated into a running total</li>
 * <li>{@link #GAUGE}: point-in-time value, latest wins</li>
 * <li>{@link #HISTOGRAM}: distribution of observed values</li>
 * <li>{@link #TIMER}: distribution of durations in milliseconds</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum MetricKind {
    COUNTER,
    GAUGE,
    HISTOGRAM,
    TIMER;

    /**
     * Parse a kind name case-insensitively.
     *
     * @param value kind name, e.g. {@code "gauge"}
     * @return the matching kind
     * @throws IllegalArgumentException if the name is unknown
     */
    public static MetricKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Metric kind must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown metric kind: '" + value
                    + "'. Supported: counter, gauge, histogram, timer", e);
        }
    }
}
