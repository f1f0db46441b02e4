package com.perfsentinel.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.perfsentinel.core.config.RulesLoader;
import com.perfsentinel.core.model.Alert;
import com.perfsentinel.core.model.AlertRule;
import com.perfsentinel.core.model.HealthReport;
import com.perfsentinel.core.model.MetricKind;
import com.perfsentinel.core.model.MetricNames;
import com.perfsentinel.core.model.ScalingRecommendation;
import com.perfsentinel.core.model.ScalingRule;
import com.perfsentinel.core.persistence.PersistenceBatch;
import com.perfsentinel.core.persistence.PersistenceSink;
import com.perfsentinel.core.sampling.ResourceSample;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link PerformanceMonitor}.
 */
class PerformanceMonitorTest {

    private static final MonitorConfig FAST = MonitorConfig.builder()
            .samplingIntervalMs(20)
            .evaluationIntervalMs(20)
            .flushIntervalMs(50)
            .samplerTimeoutMs(200)
            .build();

    private final List<PersistenceBatch> persisted = Collections.synchronizedList(new ArrayList<>());
    private final PersistenceSink sink = persisted::add;

    private MutableClock clock;
    private PerformanceMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-01-01T00:00:00Z");
        monitor = new PerformanceMonitor(FAST, clock, () -> new ResourceSample(85, 60, 40, 10, 20), sink);
    }

    @AfterEach
    void tearDown() {
        monitor.stop();
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    @Test
    @DisplayName("Loops sample, evaluate and flush until stopped")
    void loopsRun() throws InterruptedException {
        List<Alert> alerts = Collections.synchronizedList(new ArrayList<>());
        monitor.subscribe(alerts::add);
        monitor.addAlertRule(AlertRule.builder()
                .metricName(MetricNames.CPU_USAGE_PERCENT)
                .threshold(80)
                .minSamples(3)
                .build());

        monitor.start();
        assertThat(monitor.isRunning()).isTrue();

        awaitTrue(() -> !alerts.isEmpty());
        awaitTrue(() -> !persisted.isEmpty());
        assertThat(monitor.gaugeValue(MetricNames.CPU_USAGE_PERCENT)).hasValue(85);

        long started = System.currentTimeMillis();
        monitor.stop();
        assertThat(System.currentTimeMillis() - started).isLessThan(2_000);
        assertThat(monitor.isRunning()).isFalse();
        assertThat(monitor.getWriter().pendingCount()).isZero();

        assertThat(persisted).anySatisfy(b -> assertThat(b.getAlerts()).isNotEmpty());
        assertThat(persisted).anySatisfy(b -> assertThat(b.getMetrics()).isNotEmpty());
    }

    @Test
    @DisplayName("Stopping twice is harmless and restarting is refused")
    void stopIsIdempotent() {
        monitor.start();
        monitor.stop();
        monitor.stop();

        assertThatThrownBy(monitor::start).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Stop without start still flushes")
    void stopWithoutStartFlushes() {
        monitor.recordMetric("custom.metric", MetricKind.GAUGE, 1, Map.of("team", "core"));

        monitor.stop();

        assertThat(persisted).singleElement()
                .satisfies(b -> assertThat(b.getMetrics()).hasSize(1));
    }

    @Test
    @DisplayName("Model generation helper tracks latency, totals and error rate")
    void recordModelGeneration() {
        monitor.recordModelGeneration(1200, true, "gpt");
        monitor.recordModelGeneration(800, true, "gpt");
        monitor.recordModelGeneration(3000, false, "gpt");
        monitor.recordModelGeneration(1000, true, null);

        assertThat(monitor.counterTotal(MetricNames.GENERATION_TOTAL)).hasValue(4);
        assertThat(monitor.counterTotal(MetricNames.GENERATION_ERRORS)).hasValue(1);
        assertThat(monitor.gaugeValue(MetricNames.GENERATION_ERROR_RATE)).hasValue(0.25);
        assertThat(monitor.getStats(MetricNames.GENERATION_LATENCY_MS, 60))
                .hasValueSatisfying(s -> assertThat(s.getMean()).isEqualTo(1500));
    }

    @Test
    @DisplayName("API request helper derives requests per second from the last minute")
    void recordApiRequest() {
        for (int i = 0; i < 30; i++) {
            monitor.recordApiRequest("/generate", 120, 200);
        }
        assertThat(monitor.gaugeValue(MetricNames.API_REQUESTS_PER_SECOND)).hasValue(0.5);

        clock.advanceSeconds(61);
        monitor.recordApiRequest("/generate", 80, 500);

        assertThat(monitor.gaugeValue(MetricNames.API_REQUESTS_PER_SECOND).getAsDouble())
                .isCloseTo(1.0 / 60, within(1e-9));
        assertThat(monitor.counterTotal(MetricNames.API_REQUESTS_TOTAL)).hasValue(31);
    }

    @Test
    @DisplayName("Evaluation pass asks the capacity provider and queues recommendations")
    void capacityProviderDrivesScaling() {
        PerformanceMonitor scaling = new PerformanceMonitor(FAST, clock,
                () -> new ResourceSample(1, 1, 1, 0, 0), sink, () -> Map.of("model_workers", 2));
        scaling.addScalingRule(ScalingRule.builder()
                .resourceType("model_workers")
                .metricName(MetricNames.CPU_USAGE_PERCENT)
                .scaleUpThreshold(80)
                .scaleDownThreshold(30)
                .maxCapacity(8)
                .build());
        scaling.recordMetric(MetricNames.CPU_USAGE_PERCENT, MetricKind.GAUGE, 95);

        scaling.evaluateOnce();
        scaling.stop();

        assertThat(persisted).singleElement().satisfies(b -> assertThat(b.getRecommendations())
                .extracting(ScalingRecommendation::getRecommendedCapacity)
                .containsExactly(3));
    }

    @Test
    @DisplayName("Bundled rules load into the monitor and can be removed")
    void ruleManagement() {
        monitor.loadRules(RulesLoader.fromClasspath(RulesLoader.DEFAULT_RESOURCE));

        assertThat(monitor.listAlertRules()).hasSize(8);
        assertThat(monitor.listScalingRules()).hasSize(2);

        String key = monitor.listAlertRules().get(0).getRuleKey();
        assertThat(monitor.removeAlertRule(key)).isTrue();
        assertThat(monitor.removeScalingRule("api_servers")).isTrue();
        assertThat(monitor.listAlertRules()).hasSize(7);
        assertThat(monitor.listScalingRules()).hasSize(1);
    }

    @Test
    @DisplayName("Status reports active alerts and recent resource statistics")
    void currentStatus() {
        monitor.addAlertRule(AlertRule.builder()
                .metricName(MetricNames.MEMORY_USAGE_PERCENT)
                .threshold(50)
                .minSamples(1)
                .build());
        monitor.recordMetric(MetricNames.MEMORY_USAGE_PERCENT, MetricKind.GAUGE, 70);
        monitor.evaluateOnce();

        PerformanceStatus status = monitor.currentStatus();

        assertThat(status.getActiveAlertCount()).isEqualTo(1);
        assertThat(status.getMetrics()).containsOnlyKeys(MetricNames.MEMORY_USAGE_PERCENT);
        assertThat(status.isRunning()).isFalse();
        assertThat(monitor.activeAlerts()).hasSize(1);
    }

    @Test
    @DisplayName("Reports serialise to JSON with ISO dates and lowercase codes")
    void reportJson() throws Exception {
        Instant start = clock.instant();
        monitor.recordMetric(MetricNames.CPU_USAGE_PERCENT, MetricKind.GAUGE, 92);
        clock.advanceSeconds(60);

        HealthReport report = monitor.generateReport(start, clock.instant(), Map.of());
        ObjectMapper mapper = JsonSupport.newObjectMapper();
        JsonNode json = mapper.readTree(mapper.writeValueAsString(report));

        assertThat(json.get("startTime").asText()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(json.get("healthScore").asDouble()).isEqualTo(report.getHealthScore());
        assertThat(json.get("bottlenecks").get(0).get("type").asText()).isEqualTo("cpu");
        assertThat(json.get("bottlenecks").get(0).get("severity").asText()).isEqualTo("high");
        assertThat(json.get("trends").get("memory").asText()).isEqualTo("insufficient_data");
        assertThat(json.get("metricsSummary").get(MetricNames.CPU_USAGE_PERCENT).get("count").asInt())
                .isEqualTo(1);

        monitor.stop();
        assertThat(persisted).singleElement().satisfies(b -> assertThat(b.getReports()).hasSize(1));
    }
}
