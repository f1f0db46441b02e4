package com.perfsentinel.core.persistence;

import com.perfsentinel.core.model.Alert;
import com.perfsentinel.core.model.HealthReport;
import com.perfsentinel.core.model.Metric;
import com.perfsentinel.core.model.MetricKind;
import com.perfsentinel.core.model.MetricNames;
import com.perfsentinel.core.model.ScalingRecommendation;
import com.perfsentinel.core.recorder.MetricRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Buffers monitoring history between flushes and hands it to a
 * {@link PersistenceSink} in batches.
 *
 * <h3>Sources</h3>
 * <p>
 * Metrics are pulled from the {@link MetricRecorder} at flush time: every
 * sample appended to a series since the previous pull, tracked by append
 * position rather than timestamp so late-stamped samples are not skipped.
 * Samples the recorder's ring buffer evicted before a pull are counted as
 * dropped. Alerts, recommendations and
 * reports are pushed with the {@code enqueue*} methods as they are produced.
 * </p>
 *
 * <h3>Failure and overflow</h3>
 * <p>
 * A batch the sink rejects stays buffered and is offered again, together with
 * anything newer, on the next flush. Once more than {@code maxBuffered} items
 * are pending, the oldest are dropped; every drop is counted, logged at WARN
 * and recorded as the counter
 * {@value com.perfsentinel.core.model.MetricNames#PERSISTENCE_DROPPED_ITEMS}.
 * </p>
 *
 * @since 1.0.0
 */
public class BufferedPersistenceWriter {

    private static final Logger LOG = LoggerFactory.getLogger(BufferedPersistenceWriter.class);

    public static final int DEFAULT_MAX_BUFFERED = 10_000;

    private final MetricRecorder recorder;
    private final PersistenceSink sink;
    private final int maxBuffered;

    // All guarded by "this"
    private final Deque<Metric> metrics = new ArrayDeque<>();
    private final Deque<Alert> alerts = new ArrayDeque<>();
    private final Deque<ScalingRecommendation> recommendations = new ArrayDeque<>();
    private final Deque<HealthReport> reports = new ArrayDeque<>();
    private final Map<String, Long> metricPositions = new HashMap<>();
    private long droppedTotal;

    public BufferedPersistenceWriter(MetricRecorder recorder, PersistenceSink sink, int maxBuffered) {
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        if (maxBuffered < 1) {
            throw new IllegalArgumentException("maxBuffered must be >= 1, got: " + maxBuffered);
        }
        this.maxBuffered = maxBuffered;
    }

    public BufferedPersistenceWriter(MetricRecorder recorder, PersistenceSink sink) {
        this(recorder, sink, DEFAULT_MAX_BUFFERED);
    }

    // ---------------------------------------------------------------
    // Enqueue
    // ---------------------------------------------------------------

    public synchronized void enqueueAlert(Alert alert) {
        alerts.addLast(Objects.requireNonNull(alert, "alert must not be null"));
        enforceBound();
    }

    public synchronized void enqueueRecommendation(ScalingRecommendation recommendation) {
        recommendations.addLast(Objects.requireNonNull(recommendation, "recommendation must not be null"));
        enforceBound();
    }

    public synchronized void enqueueReport(HealthReport report) {
        reports.addLast(Objects.requireNonNull(report, "report must not be null"));
        enforceBound();
    }

    // ---------------------------------------------------------------
    // Flush
    // ---------------------------------------------------------------

    /**
     * Pull new metric samples and write everything pending.
     *
     * @return {@code true} if the sink accepted the batch or nothing was
     *         pending; {@code false} if the batch was kept for a retry
     */
    public synchronized boolean flush() {
        pullMetrics();

        PersistenceBatch batch = new PersistenceBatch(
                new ArrayList<>(metrics), new ArrayList<>(alerts),
                new ArrayList<>(recommendations), new ArrayList<>(reports));
        if (batch.isEmpty()) {
            LOG.debug("Nothing to persist");
            return true;
        }

        try {
            sink.write(batch);
        } catch (PersistenceException | RuntimeException e) {
            LOG.error("Persisting {} failed – keeping {} item(s) for the next flush", batch, batch.size(), e);
            return false;
        }

        metrics.clear();
        alerts.clear();
        recommendations.clear();
        reports.clear();
        LOG.info("Persisted {}", batch);
        return true;
    }

    private void pullMetrics() {
        List<Metric> fresh = new ArrayList<>();
        long evicted = recorder.pullSince(metricPositions, fresh);
        if (evicted > 0) {
            reportDropped(evicted, "evicted from the recorder before a flush");
        }
        if (fresh.isEmpty()) {
            return;
        }
        metrics.addAll(fresh);
        enforceBound();
    }

    // ---------------------------------------------------------------
    // Overflow
    // ---------------------------------------------------------------

    private void enforceBound() {
        long dropped = 0;
        while (pendingCount() > maxBuffered) {
            dropOldest();
            dropped++;
        }
        if (dropped > 0) {
            reportDropped(dropped, "oldest, buffer over " + maxBuffered + " item(s)");
        }
    }

    private void reportDropped(long dropped, String reason) {
        droppedTotal += dropped;
        LOG.warn("Dropped {} item(s) from persistence: {} (total dropped {})", dropped, reason, droppedTotal);
        recorder.record(MetricNames.PERSISTENCE_DROPPED_ITEMS, MetricKind.COUNTER, dropped);
    }

    /** Drop the head of whichever queue holds the oldest item. */
    private void dropOldest() {
        Deque<?> oldest = null;
        Instant oldestAt = null;
        Instant at = headTime(metrics, Metric::getTimestamp);
        if (at != null) {
            oldest = metrics;
            oldestAt = at;
        }
        at = headTime(alerts, Alert::getTriggeredAt);
        if (at != null && (oldestAt == null || at.isBefore(oldestAt))) {
            oldest = alerts;
            oldestAt = at;
        }
        at = headTime(recommendations, ScalingRecommendation::getTimestamp);
        if (at != null && (oldestAt == null || at.isBefore(oldestAt))) {
            oldest = recommendations;
            oldestAt = at;
        }
        at = headTime(reports, HealthReport::getGeneratedAt);
        if (at != null && (oldestAt == null || at.isBefore(oldestAt))) {
            oldest = reports;
        }
        if (oldest != null) {
            oldest.removeFirst();
        }
    }

    private static <T> Instant headTime(Deque<T> queue, Function<T, Instant> time) {
        T head = queue.peekFirst();
        return head == null ? null : time.apply(head);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public synchronized int pendingCount() {
        return metrics.size() + alerts.size() + recommendations.size() + reports.size();
    }

    /**
     * @return items dropped on overflow since creation
     */
    public synchronized long droppedCount() {
        return droppedTotal;
    }
}
