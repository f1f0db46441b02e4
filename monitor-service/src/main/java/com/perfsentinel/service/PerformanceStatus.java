package com.perfsentinel.service;

import com.perfsentinel.core.model.MetricStats;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot returned by {@link PerformanceMonitor#currentStatus()}.
 *
 * <p>
 * {@code metrics} holds the trailing-window statistics of the metrics that
 * had samples; a metric without samples is absent rather than zero.
 * </p>
 *
 * @since 1.0.0
 */
public final class PerformanceStatus {

    private final Instant timestamp;
    private final boolean running;
    private final int activeAlertCount;
    private final Map<String, MetricStats> metrics;

    public PerformanceStatus(Instant timestamp, boolean running, int activeAlertCount,
            Map<String, MetricStats> metrics) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.running = running;
        this.activeAlertCount = activeAlertCount;
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean isRunning() {
        return running;
    }

    public int getActiveAlertCount() {
        return activeAlertCount;
    }

    public Map<String, MetricStats> getMetrics() {
        return metrics;
    }

    @Override
    public String toString() {
        return "PerformanceStatus{timestamp=" + timestamp + ", running=" + running
                + ", activeAlerts=" + activeAlertCount + ", metrics=" + metrics.keySet() + '}';
    }
}
