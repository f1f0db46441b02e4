package com.perfsentinel.core.config;

import com.perfsentinel.core.model.AlertCondition;
import com.perfsentinel.core.model.AlertRule;
import com.perfsentinel.core.model.AlertSeverity;
import com.perfsentinel.core.model.ScalingRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RulesLoader}.
 */
class RulesLoaderTest {

    @Test
    @DisplayName("Should load test rules from classpath")
    void shouldLoadFromClasspath() {
        RulesConfig config = RulesLoader.fromClasspath("test-rules.yml");

        List<AlertRule> alertRules = config.toAlertRules();
        assertThat(alertRules).hasSize(2);

        AlertRule latency = alertRules.get(0);
        assertThat(latency.getMetricName()).isEqualTo("api.response_time_ms");
        assertThat(latency.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(latency.getTimeWindow()).isEqualTo(Duration.ofSeconds(60));
        assertThat(latency.getMinSamples()).isEqualTo(5);
        assertThat(latency.getCooldown()).isEqualTo(Duration.ofSeconds(120));

        AlertRule queue = alertRules.get(1);
        assertThat(queue.getCondition()).isEqualTo(AlertCondition.LESS_THAN);
        assertThat(queue.getSeverity()).isEqualTo(AlertSeverity.WARNING);
        assertThat(queue.getMinSamples()).isEqualTo(AlertRule.DEFAULT_MIN_SAMPLES);

        List<ScalingRule> scalingRules = config.toScalingRules();
        assertThat(scalingRules).singleElement().satisfies(r -> {
            assertThat(r.getResourceType()).isEqualTo("api_servers");
            assertThat(r.getMinCapacity()).isEqualTo(1);
            assertThat(r.getMaxCapacity()).isEqualTo(5);
            assertThat(r.getScalingFactor()).isEqualTo(2.0);
        });
    }

    @Test
    @DisplayName("Bundled defaults load and validate")
    void shouldLoadBundledDefaults() {
        RulesConfig config = RulesLoader.fromClasspath(RulesLoader.DEFAULT_RESOURCE);

        assertThat(config.toAlertRules()).hasSize(8);
        assertThat(config.toScalingRules()).extracting(ScalingRule::getResourceType)
                .containsExactly("model_workers", "api_servers");
    }

    @Test
    @DisplayName("Should collect every invalid rule into one error")
    void shouldRejectInvalidRules() {
        assertThatThrownBy(() -> RulesLoader.fromClasspath("invalid-rules.yml"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("alertRules[0]")
                .hasMessageContaining("alertRules[1]")
                .hasMessageContaining("scalingRules[0]");
    }

    @Test
    @DisplayName("Should load from a file and reject duplicate keys")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("rules.yml");
        Files.writeString(file, "alertRules:\n  - metricName: cpu\n    threshold: 80\n");
        assertThat(RulesLoader.fromFile(file).toAlertRules()).hasSize(1);

        Path duplicate = dir.resolve("duplicate.yml");
        Files.writeString(duplicate, "alertRules: []\nalertRules: []\n");
        assertThatThrownBy(() -> RulesLoader.fromFile(duplicate))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> RulesLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> RulesLoader.fromFile(Path.of("does-not-exist.yml")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }
}
