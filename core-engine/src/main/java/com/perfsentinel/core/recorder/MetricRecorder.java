package com.perfsentinel.core.recorder;

import com.perfsentinel.core.model.Metric;
import com.perfsentinel.core.model.MetricKind;
import com.perfsentinel.core.model.MetricStats;
import com.perfsentinel.core.model.MetricTags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded, concurrent rolling storage of metric samples.
 *
 * <p>
 * Each metric name owns a {@link MetricSeries} ring buffer of
 * {@code capacity} samples (default {@value #DEFAULT_CAPACITY}); the oldest
 * sample is evicted first once the buffer is full.
 * </p>
 *
 * <h3>Statistics</h3>
 * <p>
 * {@link #stats(String, long)} aggregates the samples whose timestamp is no
 * older than {@code now - window}. A window without samples yields
 * {@link Optional#empty()}, never an exception. See {@link MetricStats} for
 * the exact definitions.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Safe for any number of concurrent writers and readers. Locking is per
 * metric name; there is no lock spanning names. Queries copy a snapshot under
 * the per-name lock and aggregate outside it, so they observe an eventually
 * consistent view and hold producers up only for the copy.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricRecorder {

    private static final Logger LOG = LoggerFactory.getLogger(MetricRecorder.class);

    /** Default number of samples retained per metric name. */
    public static final int DEFAULT_CAPACITY = 1000;

    private final Map<String, MetricSeries> series = new ConcurrentHashMap<>();
    private final int capacity;
    private final Clock clock;

    /**
     * @param capacity samples retained per metric name; must be &gt; 0
     * @param clock    time source for sample timestamps and windows
     */
    public MetricRecorder(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public MetricRecorder(Clock clock) {
        this(DEFAULT_CAPACITY, clock);
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * Append a sample to its metric's buffer.
     *
     * @param metric the sample; must not be {@code null}
     */
    public void record(Metric metric) {
        Objects.requireNonNull(metric, "Metric must not be null");
        series.computeIfAbsent(metric.getName(), name -> {
            LOG.debug("Registering new metric series '{}' (capacity {})", name, capacity);
            return new MetricSeries(capacity);
        }).append(metric);
    }

    /**
     * Record a sample stamped with the current time.
     *
     * @return the recorded metric
     */
    public Metric record(String name, MetricKind kind, double value, Map<String, String> tags) {
        Metric metric = new Metric(name, kind, value, clock.instant(), MetricTags.of(tags));
        record(metric);
        return metric;
    }

    public Metric record(String name, MetricKind kind, double value) {
        return record(name, kind, value, null);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * Statistics over the trailing window ending now.
     *
     * @param name          metric name
     * @param windowSeconds window length; must be &gt; 0
     * @return statistics, or empty when no sample falls inside the window
     * @throws IllegalArgumentException if {@code windowSeconds <= 0}
     */
    public Optional<MetricStats> stats(String name, long windowSeconds) {
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("windowSeconds must be > 0, got: " + windowSeconds);
        }
        return stats(name, Duration.ofSeconds(windowSeconds));
    }

    /**
     * Statistics over the trailing {@code window} ending now, at full
     * {@link Duration} precision.
     *
     * @throws IllegalArgumentException if {@code window} is zero or negative
     */
    public Optional<MetricStats> stats(String name, Duration window) {
        Objects.requireNonNull(window, "window must not be null");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be > 0, got: " + window);
        }
        Instant cutoff = clock.instant().minus(window);
        double[] values = valuesMatching(name, cutoff, null);
        if (values.length == 0) {
            return Optional.empty();
        }
        return Optional.of(MetricStats.compute(values, window.getSeconds() + window.getNano() / 1_000_000_000.0));
    }

    /**
     * Statistics over the closed range {@code [from, to]}.
     *
     * <p>
     * The rate is computed against the range length (at least one
     * millisecond).
     * </p>
     *
     * @throws IllegalArgumentException if {@code from} is after {@code to}
     */
    public Optional<MetricStats> stats(String name, Instant from, Instant to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Range start " + from + " is after end " + to);
        }
        double[] values = valuesMatching(name, from, to);
        if (values.length == 0) {
            return Optional.empty();
        }
        double windowSeconds = Math.max(Duration.between(from, to).toMillis(), 1L) / 1000.0;
        return Optional.of(MetricStats.compute(values, windowSeconds));
    }

    /**
     * Running total of every counter sample ever recorded under {@code name},
     * including evicted ones.
     */
    public OptionalDouble counterTotal(String name) {
        MetricSeries s = series.get(name);
        if (s == null) {
            return OptionalDouble.empty();
        }
        double total = s.counterTotal();
        return Double.isNaN(total) ? OptionalDouble.empty() : OptionalDouble.of(total);
    }

    /**
     * Latest gauge value recorded under {@code name}.
     */
    public OptionalDouble gaugeValue(String name) {
        MetricSeries s = series.get(name);
        if (s == null) {
            return OptionalDouble.empty();
        }
        double value = s.gaugeValue();
        return Double.isNaN(value) ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * @return number of samples currently buffered for {@code name}
     */
    public int bufferedCount(String name) {
        MetricSeries s = series.get(name);
        return s == null ? 0 : s.size();
    }

    /**
     * Buffered samples of {@code name}, oldest first.
     */
    public List<Metric> samples(String name) {
        MetricSeries s = series.get(name);
        if (s == null) {
            return List.of();
        }
        return List.of(s.snapshot());
    }

    /**
     * Collect every sample appended since the last pull, whatever its
     * timestamp.
     *
     * <p>
     * {@code positions} maps metric names to append positions; it is read as
     * the starting point and advanced in place. The samples added to
     * {@code into} are ordered by timestamp.
     * </p>
     *
     * @return number of samples appended since the last pull that the ring
     *         buffer evicted before they could be collected
     */
    public long pullSince(Map<String, Long> positions, List<Metric> into) {
        Objects.requireNonNull(positions, "positions must not be null");
        Objects.requireNonNull(into, "into must not be null");
        int first = into.size();
        long missed = 0;
        for (Map.Entry<String, MetricSeries> e : series.entrySet()) {
            long from = positions.getOrDefault(e.getKey(), 0L);
            int before = into.size();
            long next = e.getValue().copySince(from, into);
            missed += (next - from) - (into.size() - before);
            positions.put(e.getKey(), next);
        }
        into.subList(first, into.size()).sort(Comparator.comparing(Metric::getTimestamp));
        return missed;
    }

    /**
     * @return sorted, unmodifiable set of known metric names
     */
    public Set<String> metricNames() {
        return Collections.unmodifiableSet(new TreeSet<>(series.keySet()));
    }

    public int getCapacity() {
        return capacity;
    }

    public Clock getClock() {
        return clock;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private double[] valuesMatching(String name, Instant from, Instant to) {
        Objects.requireNonNull(name, "Metric name must not be null");
        MetricSeries s = series.get(name);
        if (s == null) {
            return new double[0];
        }
        Metric[] snapshot = s.snapshot();
        double[] values = new double[snapshot.length];
        int n = 0;
        for (Metric m : snapshot) {
            Instant ts = m.getTimestamp();
            if (ts.isBefore(from) || (to != null && ts.isAfter(to))) {
                continue;
            }
            values[n++] = m.getValue();
        }
        return n == values.length ? values : Arrays.copyOf(values, n);
    }
}
