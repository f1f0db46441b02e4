package com.perfsentinel.core.report;

import com.perfsentinel.core.MutableClock;
import com.perfsentinel.core.alerting.AlertEngine;
import com.perfsentinel.core.model.AlertRule;
import com.perfsentinel.core.model.AlertSeverity;
import com.perfsentinel.core.model.Bottleneck;
import com.perfsentinel.core.model.HealthReport;
import com.perfsentinel.core.model.MetricKind;
import com.perfsentinel.core.model.MetricNames;
import com.perfsentinel.core.model.ScalingRule;
import com.perfsentinel.core.model.Trend;
import com.perfsentinel.core.recorder.MetricRecorder;
import com.perfsentinel.core.scaling.AutoScaler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ReportGenerator}.
 */
class ReportGeneratorTest {

    private MutableClock clock;
    private MetricRecorder recorder;
    private AlertEngine alertEngine;
    private AutoScaler autoScaler;
    private ReportGenerator generator;
    private Instant start;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-01-01T00:00:00Z");
        recorder = new MetricRecorder(clock);
        alertEngine = new AlertEngine(recorder, clock);
        autoScaler = new AutoScaler(recorder, clock);
        generator = new ReportGenerator(recorder, alertEngine, autoScaler, clock);
        start = clock.instant();
    }

    /** Records one value in each half of a 60s window and leaves the clock at its end. */
    private void recordBothHalves(String metric, double first, double second) {
        clock.set(start.plusSeconds(10));
        recorder.record(metric, MetricKind.GAUGE, first);
        clock.set(start.plusSeconds(50));
        recorder.record(metric, MetricKind.GAUGE, second);
        clock.set(start.plusSeconds(60));
    }

    private HealthReport generate() {
        return generator.generate(start, start.plusSeconds(60), Map.of());
    }

    @Test
    @DisplayName("Healthy metrics and no alerts score 100 with no bottlenecks")
    void healthyReport() {
        recordBothHalves(MetricNames.CPU_USAGE_PERCENT, 50, 50);
        recordBothHalves(MetricNames.MEMORY_USAGE_PERCENT, 40, 40);
        recordBothHalves(MetricNames.GENERATION_LATENCY_MS, 1000, 1000);

        HealthReport report = generate();

        assertThat(report.getHealthScore()).isEqualTo(100.0);
        assertThat(report.getBottlenecks()).isEmpty();
        assertThat(report.getAlerts()).isEmpty();
        assertThat(report.getMetricsSummary()).containsOnlyKeys(
                MetricNames.CPU_USAGE_PERCENT, MetricNames.MEMORY_USAGE_PERCENT, MetricNames.GENERATION_LATENCY_MS);
        assertThat(report.getStartTime()).isEqualTo(start);
        assertThat(report.getGeneratedAt()).isEqualTo(start.plusSeconds(60));
    }

    @Test
    @DisplayName("Bottlenecks and utilisation penalties follow the fixed thresholds")
    void bottlenecksAndPenalties() {
        recordBothHalves(MetricNames.CPU_USAGE_PERCENT, 92, 92);
        recordBothHalves(MetricNames.MEMORY_USAGE_PERCENT, 88, 88);
        recordBothHalves(MetricNames.GENERATION_LATENCY_MS, 45_000, 45_000);

        HealthReport report = generate();

        assertThat(report.getBottlenecks())
                .extracting(Bottleneck::getType, Bottleneck::getSeverity)
                .containsExactly(
                        tuple(Bottleneck.Type.CPU, Bottleneck.Severity.HIGH),
                        tuple(Bottleneck.Type.MEMORY, Bottleneck.Severity.MEDIUM),
                        tuple(Bottleneck.Type.LATENCY, Bottleneck.Severity.MEDIUM));
        // 100 - 2*12 - 3*3 - 15
        assertThat(report.getHealthScore()).isCloseTo(52.0, within(1e-9));
    }

    @Test
    @DisplayName("Score never drops below zero")
    void scoreFloor() {
        recordBothHalves(MetricNames.CPU_USAGE_PERCENT, 100, 100);
        recordBothHalves(MetricNames.MEMORY_USAGE_PERCENT, 100, 100);
        recordBothHalves(MetricNames.GENERATION_LATENCY_MS, 200_000, 200_000);

        assertThat(generate().getHealthScore()).isZero();
    }

    @Test
    @DisplayName("Alerts triggered in range are attached and penalised by severity")
    void alertsInRange() {
        alertEngine.addRule(AlertRule.builder()
                .metricName("queue.depth")
                .threshold(10)
                .severity(AlertSeverity.CRITICAL)
                .minSamples(1)
                .build());
        clock.set(start.plusSeconds(20));
        recorder.record("queue.depth", MetricKind.GAUGE, 50);
        alertEngine.evaluate();
        clock.set(start.plusSeconds(60));

        HealthReport report = generate();

        assertThat(report.getAlerts()).hasSize(1);
        assertThat(report.getHealthScore()).isEqualTo(85.0);
        assertThat(generator.generate(start.plusSeconds(30), start.plusSeconds(60), Map.of()).getAlerts())
                .isEmpty();
    }

    @Test
    @DisplayName("Trends compare the two half-window means")
    void trends() {
        recordBothHalves(MetricNames.CPU_USAGE_PERCENT, 40, 60);
        recordBothHalves(MetricNames.MEMORY_USAGE_PERCENT, 50, 52);
        recordBothHalves(MetricNames.API_REQUESTS_PER_SECOND, 100, 50);

        Map<String, Trend> trends = generate().getTrends();

        assertThat(trends).containsEntry("cpu", Trend.UP)
                .containsEntry("memory", Trend.STABLE)
                .containsEntry("throughput", Trend.DOWN)
                .containsEntry("latency", Trend.INSUFFICIENT_DATA);
    }

    @Test
    @DisplayName("A zero first half is up when the second is positive")
    void zeroBaseline() {
        assertThat(ReportGenerator.classify(0, 5)).isEqualTo(Trend.UP);
        assertThat(ReportGenerator.classify(0, 0)).isEqualTo(Trend.STABLE);
    }

    @Test
    @DisplayName("Scaling recommendations for the given capacities are included")
    void includesRecommendations() {
        autoScaler.addRule(ScalingRule.builder()
                .resourceType("model_workers")
                .metricName(MetricNames.CPU_USAGE_PERCENT)
                .scaleUpThreshold(80)
                .scaleDownThreshold(30)
                .maxCapacity(8)
                .build());
        recordBothHalves(MetricNames.CPU_USAGE_PERCENT, 95, 95);

        HealthReport report = generator.generate(start, start.plusSeconds(60), Map.of("model_workers", 2));

        assertThat(report.getRecommendations()).hasSize(1);
    }

    @Test
    @DisplayName("Start after end is rejected")
    void invertedRange() {
        assertThatThrownBy(() -> generator.generate(start.plusSeconds(1), start, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Reports generated in the same millisecond get distinct ids")
    void distinctIdsAtSameInstant() {
        HealthReport first = generate();
        HealthReport second = generate();

        assertThat(first.getGeneratedAt()).isEqualTo(second.getGeneratedAt());
        assertThat(first.getId()).startsWith("report-" + clock.instant().toEpochMilli() + "-");
        assertThat(second.getId()).isNotEqualTo(first.getId());
    }
}
