package com.perfsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;

/**
 * A resource whose utilisation or latency crossed a bottleneck threshold
 * during a report window.
 *
 * @since 1.0.0
 */
public final class Bottleneck implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Bottlenecked resource. */
    public enum Type {
        CPU, MEMORY, LATENCY;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /** How far past the threshold the resource is. */
    public enum Severity {
        MEDIUM, HIGH;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Type type;
    private final Severity severity;
    private final String description;
    private final String recommendation;

    public Bottleneck(Type type, Severity severity, String description, String recommendation) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.description = description;
        this.recommendation = recommendation;
    }

    public Type getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    public String getRecommendation() {
        return recommendation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Bottleneck that))
            return false;
        return type == that.type
                && severity == that.severity
                && Objects.equals(description, that.description)
                && Objects.equals(recommendation, that.recommendation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, severity, description, recommendation);
    }

    @Override
    public String toString() {
        return "Bottleneck{" + type.code() + "/" + severity.code() + ": " + description + '}';
    }
}
