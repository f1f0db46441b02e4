package com.perfsentinel.core.recorder;

import com.perfsentinel.core.model.Metric;
import com.perfsentinel.core.model.MetricKind;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity ring buffer of samples for a single metric name.
 *
 * <p>
 * Appends are O(1); once full, each append overwrites the oldest sample.
 * Besides the raw samples the series keeps the running counter total and the
 * latest gauge value.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Every access goes through the series' own lock, so writers of different
 * metric names never contend. Readers take a {@link #snapshot()} and compute
 * outside the lock.
 * </p>
 */
final class MetricSeries {

    private final ReentrantLock lock = new ReentrantLock();
    private final Metric[] ring;

    /** Index of the next write. */
    private int head;
    private int size;
    /** Samples ever appended, which is also the position of the next one. */
    private long appended;

    private double counterTotal;
    private double gaugeValue;
    private boolean hasCounter;
    private boolean hasGauge;

    MetricSeries(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Series capacity must be >= 1, got: " + capacity);
        }
        this.ring = new Metric[capacity];
    }

    void append(Metric metric) {
        lock.lock();
        try {
            ring[head] = metric;
            head = (head + 1) % ring.length;
            if (size < ring.length) {
                size++;
            }
            appended++;
            if (metric.getKind() == MetricKind.COUNTER) {
                counterTotal += metric.getValue();
                hasCounter = true;
            } else if (metric.getKind() == MetricKind.GAUGE) {
                gaugeValue = metric.getValue();
                hasGauge = true;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return buffered samples, oldest first
     */
    Metric[] snapshot() {
        lock.lock();
        try {
            Metric[] copy = new Metric[size];
            int start = (head - size + ring.length) % ring.length;
            for (int i = 0; i < size; i++) {
                copy[i] = ring[(start + i) % ring.length];
            }
            return copy;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy the still-buffered samples at append positions {@code >= from} into
     * {@code into}, oldest first.
     *
     * @return position of the next sample to be appended
     */
    long copySince(long from, List<Metric> into) {
        lock.lock();
        try {
            long oldestBuffered = appended - size;
            int start = (head - size + ring.length) % ring.length;
            for (long p = Math.max(from, oldestBuffered); p < appended; p++) {
                into.add(ring[(int) ((start + (p - oldestBuffered)) % ring.length)]);
            }
            return appended;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return running counter total, or {@code NaN} if no counter sample was
     *         ever recorded
     */
    double counterTotal() {
        lock.lock();
        try {
            return hasCounter ? counterTotal : Double.NaN;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return latest gauge value, or {@code NaN} if no gauge sample was ever
     *         recorded
     */
    double gaugeValue() {
        lock.lock();
        try {
            return hasGauge ? gaugeValue : Double.NaN;
        } finally {
            lock.unlock();
        }
    }
}
