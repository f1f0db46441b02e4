package com.perfsentinel.service.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.perfsentinel.core.model.Alert;
import com.perfsentinel.core.model.AlertSeverity;
import com.perfsentinel.core.model.Metric;
import com.perfsentinel.core.model.MetricKind;
import com.perfsentinel.core.model.MetricTags;
import com.perfsentinel.core.model.ScalingAction;
import com.perfsentinel.core.model.ScalingImpact;
import com.perfsentinel.core.model.ScalingRecommendation;
import com.perfsentinel.core.persistence.PersistenceBatch;
import com.perfsentinel.core.persistence.PersistenceException;
import com.perfsentinel.service.JsonSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonLinesPersistenceSink}.
 */
class JsonLinesPersistenceSinkTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final ObjectMapper mapper = JsonSupport.newObjectMapper();

    @TempDir
    Path dir;

    @Test
    @DisplayName("Each table is appended as one JSON object per line")
    void writesTables() throws Exception {
        JsonLinesPersistenceSink sink = new JsonLinesPersistenceSink(dir.resolve("data"), mapper);
        Alert triggered = Alert.builder()
                .id("cpu_greater_than_80#1")
                .ruleKey("cpu_greater_than_80")
                .metricName("cpu")
                .severity(AlertSeverity.CRITICAL)
                .message("cpu greater_than 80.0 (current: 91.00)")
                .threshold(80)
                .currentValue(91)
                .triggeredAt(T0)
                .build();
        ScalingRecommendation rec = ScalingRecommendation.builder()
                .id("model_workers-1")
                .action(ScalingAction.SCALE_UP)
                .resourceType("model_workers")
                .metricName("cpu")
                .currentCapacity(2)
                .recommendedCapacity(3)
                .confidence(0.1875)
                .reasoning("cpu mean 95.00 above threshold 80.00")
                .estimatedImpact(ScalingImpact.estimate(2, 3))
                .timestamp(T0)
                .build();

        sink.write(new PersistenceBatch(
                List.of(new Metric("cpu", MetricKind.GAUGE, 91, T0, MetricTags.of("host", "a"))),
                List.of(triggered),
                List.of(rec),
                List.of()));
        sink.write(new PersistenceBatch(List.of(), List.of(triggered.resolve(T0.plusSeconds(60))),
                List.of(), List.of()));

        List<String> metrics = Files.readAllLines(dir.resolve("data").resolve(JsonLinesPersistenceSink.METRICS_FILE));
        assertThat(metrics).hasSize(1);
        JsonNode metric = mapper.readTree(metrics.get(0));
        assertThat(metric.get("kind").asText()).isEqualTo("gauge");
        assertThat(metric.get("ts").asText()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(metric.get("tags").get("host").asText()).isEqualTo("a");

        List<String> alerts = Files.readAllLines(dir.resolve("data").resolve(JsonLinesPersistenceSink.ALERTS_FILE));
        assertThat(alerts).hasSize(2);
        JsonNode resolved = mapper.readTree(alerts.get(1));
        assertThat(resolved.get("id").asText()).isEqualTo("cpu_greater_than_80#1");
        assertThat(resolved.get("resolved").asBoolean()).isTrue();
        assertThat(resolved.get("resolved_ts").asText()).isEqualTo("2024-01-01T00:01:00Z");

        JsonNode recommendation = mapper.readTree(Files.readAllLines(
                dir.resolve("data").resolve(JsonLinesPersistenceSink.RECOMMENDATIONS_FILE)).get(0));
        assertThat(recommendation.get("action").asText()).isEqualTo("scale_up");
        assertThat(recommendation.get("rec").asInt()).isEqualTo(3);
        assertThat(recommendation.get("applied").asBoolean()).isFalse();

        assertThat(dir.resolve("data").resolve(JsonLinesPersistenceSink.REPORTS_FILE)).doesNotExist();
    }

    @Test
    @DisplayName("An unwritable directory surfaces as PersistenceException")
    void unwritable() throws IOException {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        JsonLinesPersistenceSink sink = new JsonLinesPersistenceSink(blocker, mapper);

        assertThatThrownBy(() -> sink.write(new PersistenceBatch(
                List.of(new Metric("cpu", MetricKind.GAUGE, 1, T0)), List.of(), List.of(), List.of())))
                .isInstanceOf(PersistenceException.class);
    }
}
