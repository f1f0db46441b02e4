package com.perfsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single metric sample.
 *
 * <p>
 * Instances are immutable. {@code name}, {@code kind} and {@code timestamp}
 * are required; tags default to {@link MetricTags#empty()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Metric implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final MetricKind kind;
    private final double value;
    private final Instant timestamp;
    private final MetricTags tags;

    public Metric(String name, MetricKind kind, double value, Instant timestamp, MetricTags tags) {
        this.name = Objects.requireNonNull(name, "Metric name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Metric name must not be blank");
        }
        this.kind = Objects.requireNonNull(kind, "Metric kind must not be null");
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Metric '" + name + "' value must be finite, got: " + value);
        }
        this.value = value;
        this.timestamp = Objects.requireNonNull(timestamp, "Metric timestamp must not be null");
        this.tags = tags != null ? tags : MetricTags.empty();
    }

    public Metric(String name, MetricKind kind, double value, Instant timestamp) {
        this(name, kind, value, timestamp, MetricTags.empty());
    }

    public String getName() {
        return name;
    }

    public MetricKind getKind() {
        return kind;
    }

    public double getValue() {
        return value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public MetricTags getTags() {
        return tags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Metric that))
            return false;
        return Double.compare(value, that.value) == 0
                && name.equals(that.name)
                && kind == that.kind
                && timestamp.equals(that.timestamp)
                && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind, value, timestamp, tags);
    }

    @Override
    public String toString() {
        return "Metric{" +
                "name='" + name + '\'' +
                ", kind=" + kind +
                ", value=" + value +
                ", timestamp=" + timestamp +
                ", tags=" + tags +
                '}';
    }
}
