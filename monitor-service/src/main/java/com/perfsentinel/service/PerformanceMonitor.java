package com.perfsentinel.service;

import com.perfsentinel.core.alerting.AlertEngine;
import com.perfsentinel.core.alerting.AlertSubscriber;
import com.perfsentinel.core.config.RulesConfig;
import com.perfsentinel.core.model.Alert;
import com.perfsentinel.core.model.AlertRule;
import com.perfsentinel.core.model.HealthReport;
import com.perfsentinel.core.model.Metric;
import com.perfsentinel.core.model.MetricKind;
import com.perfsentinel.core.model.MetricNames;
import com.perfsentinel.core.model.MetricStats;
import com.perfsentinel.core.model.ScalingRecommendation;
import com.perfsentinel.core.model.ScalingRule;
import com.perfsentinel.core.persistence.BufferedPersistenceWriter;
import com.perfsentinel.core.persistence.PersistenceSink;
import com.perfsentinel.core.recorder.MetricRecorder;
import com.perfsentinel.core.report.ReportGenerator;
import com.perfsentinel.core.sampling.ResourceSampler;
import com.perfsentinel.core.scaling.AutoScaler;
import com.perfsentinel.service.sampling.ResourceSamplingTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Engine instance that owns the recorder, the alert engine, the auto-scaler,
 * the report generator and the persistence writer, and runs their loops.
 *
 * <h3>Loops</h3>
 * <p>
 * {@link #start()} schedules three independent fixed-delay tasks:
 * </p>
 * <ol>
 * <li>sampling: one {@link ResourceSampler} reading, bounded by the sampler
 * timeout</li>
 * <li>evaluation: alert rules, then scaling rules when a capacity provider is
 * configured</li>
 * <li>flush: pending history to the {@link PersistenceSink}</li>
 * </ol>
 * <p>
 * Each task catches and logs its own failures so the schedule survives.
 * {@link #stop()} cancels the schedule, lets in-flight runs finish and
 * performs a final flush.
 * </p>
 *
 * @since 1.0.0
 */
public class PerformanceMonitor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(PerformanceMonitor.class);

    /** Trailing window of {@link #currentStatus()}. */
    static final long STATUS_WINDOW_SECONDS = 300;

    /** Trailing window of the requests-per-second gauge. */
    static final long REQUEST_RATE_WINDOW_SECONDS = 60;

    private final MonitorConfig config;
    private final Clock clock;
    private final ResourceSampler sampler;
    private final Supplier<Map<String, Integer>> capacityProvider;

    private final MetricRecorder recorder;
    private final AlertEngine alertEngine;
    private final AutoScaler autoScaler;
    private final ReportGenerator reportGenerator;
    private final BufferedPersistenceWriter writer;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private ScheduledExecutorService scheduler;
    private ExecutorService samplerExecutor;

    /**
     * @param capacityProvider current capacities for the evaluation loop's
     *                         scaling pass; {@code null} disables scaling in
     *                         the loop
     */
    public PerformanceMonitor(MonitorConfig config, Clock clock, ResourceSampler sampler,
            PersistenceSink sink, Supplier<Map<String, Integer>> capacityProvider) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sampler = Objects.requireNonNull(sampler, "sampler must not be null");
        Objects.requireNonNull(sink, "sink must not be null");
        this.capacityProvider = capacityProvider;

        this.recorder = new MetricRecorder(config.getMetricBufferCapacity(), clock);
        this.alertEngine = new AlertEngine(recorder, clock, config.getAlertHistoryLimit());
        this.autoScaler = new AutoScaler(recorder, clock,
                Duration.ofSeconds(config.getMinScalingIntervalSeconds()), AutoScaler.DEFAULT_HISTORY_LIMIT);
        this.reportGenerator = new ReportGenerator(recorder, alertEngine, autoScaler, clock);
        this.writer = new BufferedPersistenceWriter(recorder, sink, config.getPersistenceMaxBuffered());

        alertEngine.subscribe(writer::enqueueAlert);
    }

    public PerformanceMonitor(MonitorConfig config, Clock clock, ResourceSampler sampler, PersistenceSink sink) {
        this(config, clock, sampler, sink, null);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start the three loops.
     *
     * @throws IllegalStateException if the monitor was already stopped
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("PerformanceMonitor cannot be restarted after stop()");
        }
        if (!running.compareAndSet(false, true)) {
            LOG.warn("PerformanceMonitor already running");
            return;
        }
        scheduler = Executors.newScheduledThreadPool(3, namedThreads("perf-sentinel-loop"));
        samplerExecutor = Executors.newSingleThreadExecutor(namedThreads("perf-sentinel-sampler"));

        ResourceSamplingTask samplingTask = new ResourceSamplingTask(sampler, recorder, samplerExecutor,
                config.getSamplerTimeoutMs());

        schedule("sampling", samplingTask, config.getSamplingIntervalMs());
        schedule("evaluation", this::evaluateOnce, config.getEvaluationIntervalMs());
        schedule("flush", this::flushOnce, config.getFlushIntervalMs());

        LOG.info("PerformanceMonitor started with config: {}", config);
    }

    /**
     * Stop the loops, wait for in-flight runs and flush once more. Safe to call
     * more than once.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (running.getAndSet(false)) {
            scheduler.shutdown();
            samplerExecutor.shutdownNow();
            long waitMs = Math.max(config.getSamplingIntervalMs(),
                    Math.max(config.getEvaluationIntervalMs(), config.getSamplerTimeoutMs()));
            try {
                if (!scheduler.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                    LOG.warn("Loops did not finish within {}ms – interrupting", waitMs);
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        flushOnce();
        LOG.info("PerformanceMonitor stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    private void schedule(String name, Runnable task, long intervalMs) {
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.error("Error in {} loop – continuing", name, e);
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * One pass of the evaluation loop.
     */
    void evaluateOnce() {
        alertEngine.evaluate();
        if (capacityProvider != null) {
            Map<String, Integer> capacities = capacityProvider.get();
            scalingRecommendations(capacities == null ? Map.of() : capacities);
        }
    }

    /**
     * One pass of the flush loop.
     */
    boolean flushOnce() {
        return writer.flush();
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    public Metric recordMetric(String name, MetricKind kind, double value, Map<String, String> tags) {
        return recorder.record(name, kind, value, tags);
    }

    public Metric recordMetric(String name, MetricKind kind, double value) {
        return recorder.record(name, kind, value);
    }

    /**
     * Record one model generation: its latency, the generation and error
     * counters, and the resulting error rate.
     */
    public void recordModelGeneration(double latencyMs, boolean success, String modelType) {
        Map<String, String> tags = modelType == null ? Map.of() : Map.of("model_type", modelType);
        recorder.record(MetricNames.GENERATION_LATENCY_MS, MetricKind.TIMER, latencyMs, tags);
        recorder.record(MetricNames.GENERATION_TOTAL, MetricKind.COUNTER, 1, tags);
        if (!success) {
            recorder.record(MetricNames.GENERATION_ERRORS, MetricKind.COUNTER, 1, tags);
        }
        double total = recorder.counterTotal(MetricNames.GENERATION_TOTAL).orElse(0);
        double errors = recorder.counterTotal(MetricNames.GENERATION_ERRORS).orElse(0);
        if (total > 0) {
            recorder.record(MetricNames.GENERATION_ERROR_RATE, MetricKind.GAUGE, errors / total);
        }
    }

    /**
     * Record one API request and refresh the requests-per-second gauge from
     * the requests of the last minute.
     */
    public void recordApiRequest(String endpoint, double responseTimeMs, int statusCode) {
        Map<String, String> tags = new LinkedHashMap<>();
        if (endpoint != null) {
            tags.put("endpoint", endpoint);
        }
        tags.put("status_code", Integer.toString(statusCode));
        recorder.record(MetricNames.API_REQUESTS_TOTAL, MetricKind.COUNTER, 1, tags);
        recorder.record(MetricNames.API_RESPONSE_TIME_MS, MetricKind.TIMER, responseTimeMs, tags);

        int recent = recorder.stats(MetricNames.API_REQUESTS_TOTAL, REQUEST_RATE_WINDOW_SECONDS)
                .map(MetricStats::getCount)
                .orElse(0);
        recorder.record(MetricNames.API_REQUESTS_PER_SECOND, MetricKind.GAUGE,
                (double) recent / REQUEST_RATE_WINDOW_SECONDS);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public Optional<MetricStats> getStats(String name, long windowSeconds) {
        return recorder.stats(name, windowSeconds);
    }

    public OptionalDouble counterTotal(String name) {
        return recorder.counterTotal(name);
    }

    public OptionalDouble gaugeValue(String name) {
        return recorder.gaugeValue(name);
    }

    /**
     * Active alert count plus cpu, memory and generation latency statistics
     * over the last five minutes.
     */
    public PerformanceStatus currentStatus() {
        Map<String, MetricStats> metrics = new LinkedHashMap<>();
        for (String name : List.of(MetricNames.CPU_USAGE_PERCENT, MetricNames.MEMORY_USAGE_PERCENT,
                MetricNames.GENERATION_LATENCY_MS)) {
            recorder.stats(name, STATUS_WINDOW_SECONDS).ifPresent(s -> metrics.put(name, s));
        }
        return new PerformanceStatus(clock.instant(), running.get(), alertEngine.activeAlerts().size(), metrics);
    }

    public List<Alert> activeAlerts() {
        return alertEngine.activeAlerts();
    }

    public List<Alert> alertHistory() {
        return alertEngine.alertHistory();
    }

    // ---------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------

    /**
     * Register every rule of a loaded configuration.
     *
     * @throws com.perfsentinel.core.config.ConfigurationException if a rule is
     *                                                             invalid
     */
    public void loadRules(RulesConfig rules) {
        Objects.requireNonNull(rules, "rules must not be null");
        rules.toAlertRules().forEach(alertEngine::addRule);
        rules.toScalingRules().forEach(autoScaler::addRule);
    }

    public void addAlertRule(AlertRule rule) {
        alertEngine.addRule(rule);
    }

    public boolean removeAlertRule(String ruleKey) {
        return alertEngine.removeRule(ruleKey);
    }

    public List<AlertRule> listAlertRules() {
        return alertEngine.listRules();
    }

    public void addScalingRule(ScalingRule rule) {
        autoScaler.addRule(rule);
    }

    public boolean removeScalingRule(String resourceType) {
        return autoScaler.removeRule(resourceType);
    }

    public List<ScalingRule> listScalingRules() {
        return autoScaler.listRules();
    }

    // ---------------------------------------------------------------
    // Notification, scaling, reporting
    // ---------------------------------------------------------------

    public void subscribe(AlertSubscriber subscriber) {
        alertEngine.subscribe(subscriber);
    }

    public boolean unsubscribe(AlertSubscriber subscriber) {
        return alertEngine.unsubscribe(subscriber);
    }

    /**
     * Evaluate the scaling rules now and queue the result for persistence.
     */
    public List<ScalingRecommendation> scalingRecommendations(Map<String, Integer> currentCapacities) {
        List<ScalingRecommendation> recommendations = autoScaler.evaluate(currentCapacities);
        recommendations.forEach(writer::enqueueRecommendation);
        return recommendations;
    }

    /**
     * Generate a health report for {@code [start, end]} and queue it, with
     * the recommendations it produced, for persistence.
     *
     * @throws IllegalArgumentException if {@code start} is after {@code end}
     */
    public HealthReport generateReport(Instant start, Instant end, Map<String, Integer> currentCapacities) {
        HealthReport report = reportGenerator.generate(start, end, currentCapacities);
        report.getRecommendations().forEach(writer::enqueueRecommendation);
        writer.enqueueReport(report);
        return report;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public MonitorConfig getConfig() {
        return config;
    }

    BufferedPersistenceWriter getWriter() {
        return writer;
    }
}
