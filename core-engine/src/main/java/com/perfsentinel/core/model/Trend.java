package com.perfsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Direction of a metric between the first and second half of a report window.
 *
 * @since 1.0.0
 */
public enum Trend {
    UP,
    DOWN,
    STABLE,
    INSUFFICIENT_DATA;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
