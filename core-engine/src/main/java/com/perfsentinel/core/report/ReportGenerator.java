package com.perfsentinel.core.report;

import com.perfsentinel.core.alerting.AlertEngine;
import com.perfsentinel.core.model.Alert;
import com.perfsentinel.core.model.Bottleneck;
import com.perfsentinel.core.model.HealthReport;
import com.perfsentinel.core.model.MetricNames;
import com.perfsentinel.core.model.MetricStats;
import com.perfsentinel.core.model.ScalingRecommendation;
import com.perfsentinel.core.model.Trend;
import com.perfsentinel.core.recorder.MetricRecorder;
import com.perfsentinel.core.scaling.AutoScaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Composes recorder statistics, alerts and scaling recommendations into a
 * point-in-time {@link HealthReport}.
 *
 * <h3>Health score</h3>
 * <p>
 * Starts at 100 and loses {@code 2} points per CPU percent above 80,
 * {@code 3} per memory percent above 85, one per second of generation
 * latency p95 above 30s (at most 30), and the
 * {@link com.perfsentinel.core.model.AlertSeverity#getHealthPenalty() health
 * penalty} of every alert triggered in the range. The result is clamped to
 * {@code [0, 100]}.
 * </p>
 *
 * <h3>Trends</h3>
 * <p>
 * The range is split at its midpoint and the two half-means compared; a
 * relative change above 10% is {@code up} or {@code down}.
 * </p>
 *
 * @since 1.0.0
 */
public class ReportGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(ReportGenerator.class);

    /** Metrics summarised in every report. */
    public static final List<String> KEY_METRICS = List.of(
            MetricNames.CPU_USAGE_PERCENT,
            MetricNames.MEMORY_USAGE_PERCENT,
            MetricNames.GENERATION_LATENCY_MS,
            MetricNames.API_RESPONSE_TIME_MS,
            MetricNames.API_REQUESTS_PER_SECOND);

    static final double CPU_THRESHOLD = 80.0;
    static final double CPU_HIGH = 90.0;
    static final double MEMORY_THRESHOLD = 85.0;
    static final double MEMORY_HIGH = 95.0;
    static final double LATENCY_P95_THRESHOLD_MS = 30_000.0;
    static final double LATENCY_P95_HIGH_MS = 60_000.0;
    static final double MAX_LATENCY_PENALTY = 30.0;
    static final double TREND_CHANGE = 0.10;

    private final MetricRecorder recorder;
    private final AlertEngine alertEngine;
    private final AutoScaler autoScaler;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public ReportGenerator(MetricRecorder recorder, AlertEngine alertEngine, AutoScaler autoScaler, Clock clock) {
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.alertEngine = Objects.requireNonNull(alertEngine, "alertEngine must not be null");
        this.autoScaler = Objects.requireNonNull(autoScaler, "autoScaler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Build a report for the closed range {@code [start, end]}.
     *
     * @param currentCapacities capacities handed to the {@link AutoScaler}
     * @throws IllegalArgumentException if {@code start} is after {@code end}
     */
    public HealthReport generate(Instant start, Instant end, Map<String, Integer> currentCapacities) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Report start " + start + " is after end " + end);
        }

        Map<String, MetricStats> summary = new LinkedHashMap<>();
        for (String name : KEY_METRICS) {
            recorder.stats(name, start, end).ifPresent(s -> summary.put(name, s));
        }

        List<Alert> alerts = alertEngine.alertsBetween(start, end);
        List<ScalingRecommendation> recommendations = autoScaler.evaluate(currentCapacities);
        Instant generatedAt = clock.instant();

        HealthReport report = HealthReport.builder()
                .id("report-" + generatedAt.toEpochMilli() + "-" + sequence.incrementAndGet())
                .startTime(start)
                .endTime(end)
                .generatedAt(generatedAt)
                .metricsSummary(summary)
                .bottlenecks(identifyBottlenecks(summary))
                .recommendations(recommendations)
                .alerts(alerts)
                .healthScore(healthScore(summary, alerts))
                .trends(trends(start, end))
                .build();

        LOG.info("Generated health report {} for [{} .. {}]: score={} bottlenecks={} alerts={}",
                report.getId(), start, end, report.getHealthScore(),
                report.getBottlenecks().size(), alerts.size());
        return report;
    }

    // ---------------------------------------------------------------
    // Bottlenecks
    // ---------------------------------------------------------------

    static List<Bottleneck> identifyBottlenecks(Map<String, MetricStats> summary) {
        List<Bottleneck> bottlenecks = new ArrayList<>();

        MetricStats cpu = summary.get(MetricNames.CPU_USAGE_PERCENT);
        if (cpu != null && cpu.getMean() > CPU_THRESHOLD) {
            bottlenecks.add(new Bottleneck(
                    Bottleneck.Type.CPU,
                    cpu.getMean() > CPU_HIGH ? Bottleneck.Severity.HIGH : Bottleneck.Severity.MEDIUM,
                    String.format(Locale.ROOT, "High CPU usage: %.1f%%", cpu.getMean()),
                    "Scale up model workers or reduce CPU-intensive work"));
        }

        MetricStats memory = summary.get(MetricNames.MEMORY_USAGE_PERCENT);
        if (memory != null && memory.getMean() > MEMORY_THRESHOLD) {
            bottlenecks.add(new Bottleneck(
                    Bottleneck.Type.MEMORY,
                    memory.getMean() > MEMORY_HIGH ? Bottleneck.Severity.HIGH : Bottleneck.Severity.MEDIUM,
                    String.format(Locale.ROOT, "High memory usage: %.1f%%", memory.getMean()),
                    "Increase memory allocation or reduce memory usage"));
        }

        MetricStats latency = summary.get(MetricNames.GENERATION_LATENCY_MS);
        if (latency != null && latency.getP95() > LATENCY_P95_THRESHOLD_MS) {
            bottlenecks.add(new Bottleneck(
                    Bottleneck.Type.LATENCY,
                    latency.getP95() > LATENCY_P95_HIGH_MS ? Bottleneck.Severity.HIGH : Bottleneck.Severity.MEDIUM,
                    String.format(Locale.ROOT, "High generation latency: p95 %.0fms", latency.getP95()),
                    "Tune model parameters or switch to a faster model"));
        }
        return bottlenecks;
    }

    // ---------------------------------------------------------------
    // Score
    // ---------------------------------------------------------------

    static double healthScore(Map<String, MetricStats> summary, List<Alert> alerts) {
        double score = 100.0;

        MetricStats cpu = summary.get(MetricNames.CPU_USAGE_PERCENT);
        if (cpu != null && cpu.getMean() > CPU_THRESHOLD) {
            score -= 2.0 * (cpu.getMean() - CPU_THRESHOLD);
        }
        MetricStats memory = summary.get(MetricNames.MEMORY_USAGE_PERCENT);
        if (memory != null && memory.getMean() > MEMORY_THRESHOLD) {
            score -= 3.0 * (memory.getMean() - MEMORY_THRESHOLD);
        }
        MetricStats latency = summary.get(MetricNames.GENERATION_LATENCY_MS);
        if (latency != null && latency.getP95() > LATENCY_P95_THRESHOLD_MS) {
            score -= Math.min((latency.getP95() - LATENCY_P95_THRESHOLD_MS) / 1000.0, MAX_LATENCY_PENALTY);
        }
        for (Alert alert : alerts) {
            score -= alert.getSeverity().getHealthPenalty();
        }
        return Math.max(0.0, Math.min(100.0, score));
    }

    // ---------------------------------------------------------------
    // Trends
    // ---------------------------------------------------------------

    private Map<String, Trend> trends(Instant start, Instant end) {
        Instant mid = start.plus(Duration.between(start, end).dividedBy(2));
        Map<String, Trend> trends = new LinkedHashMap<>();
        trends.put("cpu", trend(MetricNames.CPU_USAGE_PERCENT, start, mid, end));
        trends.put("memory", trend(MetricNames.MEMORY_USAGE_PERCENT, start, mid, end));
        trends.put("latency", trend(MetricNames.GENERATION_LATENCY_MS, start, mid, end));
        trends.put("throughput", trend(MetricNames.API_REQUESTS_PER_SECOND, start, mid, end));
        return trends;
    }

    private Trend trend(String metric, Instant start, Instant mid, Instant end) {
        Optional<MetricStats> first = recorder.stats(metric, start, mid);
        // second half excludes the midpoint itself
        Instant secondStart = mid.plusNanos(1);
        Optional<MetricStats> second = secondStart.isAfter(end)
                ? Optional.empty()
                : recorder.stats(metric, secondStart, end);
        if (first.isEmpty() || second.isEmpty()) {
            return Trend.INSUFFICIENT_DATA;
        }
        return classify(first.get().getMean(), second.get().getMean());
    }

    static Trend classify(double firstMean, double secondMean) {
        if (firstMean == 0.0) {
            return secondMean > 0.0 ? Trend.UP : Trend.STABLE;
        }
        double change = (secondMean - firstMean) / Math.abs(firstMean);
        if (change > TREND_CHANGE) {
            return Trend.UP;
        }
        if (change < -TREND_CHANGE) {
            return Trend.DOWN;
        }
        return Trend.STABLE;
    }
}
