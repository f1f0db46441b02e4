package com.perfsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable, size-bounded set of string tags attached to a {@link Metric}.
 *
 * <p>
 * At most {@value #MAX_TAGS} entries are kept. Keys and values longer than
 * {@value #MAX_LENGTH} characters are truncated. Entries beyond the limit are
 * dropped (in key order) and a warning is logged, so an instrumented call site
 * with runaway tag cardinality cannot grow memory without bound.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricTags implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MetricTags.class);

    /** Maximum number of tags per metric. */
    public static final int MAX_TAGS = 16;

    /** Maximum length of a tag key or value. */
    public static final int MAX_LENGTH = 128;

    private static final MetricTags EMPTY = new MetricTags(Collections.emptyMap());

    private final Map<String, String> tags;

    private MetricTags(Map<String, String> tags) {
        this.tags = tags;
    }

    /**
     * @return the shared empty tag set
     */
    public static MetricTags empty() {
        return EMPTY;
    }

    /**
     * Build a tag set from an arbitrary map, enforcing the size bounds.
     *
     * @param source tag map; {@code null} or empty yields {@link #empty()}
     * @return bounded, immutable tags
     */
    public static MetricTags of(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, String> sorted = new TreeMap<>();
        int dropped = 0;
        for (Map.Entry<String, String> entry : source.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                dropped++;
            } else {
                sorted.put(entry.getKey(), entry.getValue());
            }
        }
        TreeMap<String, String> bounded = new TreeMap<>();
        for (Map.Entry<String, String> entry : sorted.entrySet()) {
            if (bounded.size() >= MAX_TAGS) {
                dropped++;
                continue;
            }
            bounded.put(truncate(entry.getKey()), truncate(entry.getValue()));
        }
        if (dropped > 0) {
            LOG.warn("Dropped {} tag(s) exceeding the limit of {} or carrying null values", dropped, MAX_TAGS);
        }
        return new MetricTags(Collections.unmodifiableMap(bounded));
    }

    /**
     * Convenience factory for a single tag.
     */
    public static MetricTags of(String key, String value) {
        return of(Map.of(key, value));
    }

    @JsonValue
    public Map<String, String> asMap() {
        return tags;
    }

    public String get(String key) {
        return tags.get(key);
    }

    public int size() {
        return tags.size();
    }

    public boolean isEmpty() {
        return tags.isEmpty();
    }

    private static String truncate(String s) {
        return s.length() > MAX_LENGTH ? s.substring(0, MAX_LENGTH) : s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricTags that))
            return false;
        return Objects.equals(tags, that.tags);
    }

    @Override
    public int hashCode() {
        return tags.hashCode();
    }

    @Override
    public String toString() {
        return tags.toString();
    }
}
