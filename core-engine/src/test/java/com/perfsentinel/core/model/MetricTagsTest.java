package com.perfsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MetricTags}.
 */
class MetricTagsTest {

    @Test
    @DisplayName("Tags beyond the limit are dropped")
    void dropsOverflow() {
        Map<String, String> source = new HashMap<>();
        for (int i = 0; i < 20; i++) {
            source.put(String.format("k%02d", i), "v" + i);
        }

        MetricTags tags = MetricTags.of(source);

        assertThat(tags.size()).isEqualTo(MetricTags.MAX_TAGS);
        assertThat(tags.get("k00")).isEqualTo("v0");
        assertThat(tags.get("k19")).isNull();
    }

    @Test
    @DisplayName("Long keys and values are truncated")
    void truncatesLongStrings() {
        String longValue = "x".repeat(500);

        MetricTags tags = MetricTags.of("endpoint", longValue);

        assertThat(tags.get("endpoint")).hasSize(MetricTags.MAX_LENGTH);
    }

    @Test
    @DisplayName("Null keys and values are ignored")
    void ignoresNulls() {
        Map<String, String> source = new HashMap<>();
        source.put(null, "a");
        source.put("b", null);
        source.put("c", "d");

        MetricTags tags = MetricTags.of(source);

        assertThat(tags.asMap()).containsExactly(Map.entry("c", "d"));
    }
}
