package com.perfsentinel.core.persistence;

import com.perfsentinel.core.MutableClock;
import com.perfsentinel.core.model.Alert;
import com.perfsentinel.core.model.AlertSeverity;
import com.perfsentinel.core.model.Metric;
import com.perfsentinel.core.model.MetricKind;
import com.perfsentinel.core.model.MetricNames;
import com.perfsentinel.core.recorder.MetricRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BufferedPersistenceWriter}.
 */
class BufferedPersistenceWriterTest {

    /** Sink that records batches and can be told to fail. */
    private static final class CapturingSink implements PersistenceSink {
        final List<PersistenceBatch> attempts = new ArrayList<>();
        final List<PersistenceBatch> batches = new ArrayList<>();
        int failuresLeft;

        @Override
        public void write(PersistenceBatch batch) throws PersistenceException {
            attempts.add(batch);
            if (failuresLeft > 0) {
                failuresLeft--;
                throw new PersistenceException("store unavailable");
            }
            batches.add(batch);
        }
    }

    private MutableClock clock;
    private MetricRecorder recorder;
    private CapturingSink sink;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-01-01T00:00:00Z");
        recorder = new MetricRecorder(clock);
        sink = new CapturingSink();
    }

    private Alert alert(String id) {
        return Alert.builder()
                .id(id)
                .ruleKey("cpu_greater_than_80")
                .metricName("cpu")
                .severity(AlertSeverity.WARNING)
                .message("cpu greater_than 80.0 (current: 90.00)")
                .threshold(80)
                .currentValue(90)
                .triggeredAt(clock.instant())
                .build();
    }

    @Test
    @DisplayName("Flush writes new samples and queued alerts once")
    void flushesOnce() {
        BufferedPersistenceWriter writer = new BufferedPersistenceWriter(recorder, sink);
        recorder.record("cpu", MetricKind.GAUGE, 50);
        writer.enqueueAlert(alert("cpu_greater_than_80#1"));

        assertThat(writer.flush()).isTrue();
        assertThat(writer.flush()).isTrue();

        assertThat(sink.batches).hasSize(1);
        assertThat(sink.batches.get(0).getMetrics()).hasSize(1);
        assertThat(sink.batches.get(0).getAlerts()).hasSize(1);
        assertThat(writer.pendingCount()).isZero();
    }

    @Test
    @DisplayName("A failed batch is retried together with newer items")
    void retriesFailedBatch() {
        BufferedPersistenceWriter writer = new BufferedPersistenceWriter(recorder, sink);
        sink.failuresLeft = 1;
        recorder.record("cpu", MetricKind.GAUGE, 50);

        assertThat(writer.flush()).isFalse();
        assertThat(writer.pendingCount()).isEqualTo(1);

        clock.advanceSeconds(5);
        recorder.record("cpu", MetricKind.GAUGE, 60);
        assertThat(writer.flush()).isTrue();

        assertThat(sink.batches).singleElement()
                .satisfies(b -> assertThat(b.getMetrics()).extracting(Metric::getValue).containsExactly(50.0, 60.0));
    }

    @Test
    @DisplayName("Overflow drops the oldest items and records the drop count")
    void overflowDropsOldest() {
        BufferedPersistenceWriter writer = new BufferedPersistenceWriter(recorder, sink, 3);
        sink.failuresLeft = 1;
        for (int i = 1; i <= 5; i++) {
            recorder.record("cpu", MetricKind.GAUGE, i);
            clock.advanceSeconds(1);
        }

        assertThat(writer.flush()).isFalse();

        assertThat(writer.pendingCount()).isEqualTo(3);
        assertThat(writer.droppedCount()).isEqualTo(2);
        assertThat(recorder.counterTotal(MetricNames.PERSISTENCE_DROPPED_ITEMS)).hasValue(2);

        assertThat(sink.attempts).singleElement()
                .satisfies(b -> assertThat(b.getMetrics()).extracting(Metric::getValue)
                        .containsExactly(3.0, 4.0, 5.0));
    }

    @Test
    @DisplayName("A sample stamped earlier than already persisted ones is still written")
    void lateTimestampPersisted() {
        BufferedPersistenceWriter writer = new BufferedPersistenceWriter(recorder, sink);
        Instant start = clock.instant();
        recorder.record(new Metric("a", MetricKind.GAUGE, 1, start.plusSeconds(20)));
        assertThat(writer.flush()).isTrue();

        recorder.record(new Metric("b", MetricKind.GAUGE, 2, start.plusSeconds(10)));
        assertThat(writer.flush()).isTrue();

        assertThat(sink.batches).hasSize(2);
        assertThat(sink.batches.get(1).getMetrics()).extracting(Metric::getName).containsExactly("b");
        assertThat(writer.droppedCount()).isZero();
    }

    @Test
    @DisplayName("Samples evicted by the recorder before a flush count as dropped")
    void recorderEvictionCounted() {
        MetricRecorder small = new MetricRecorder(2, clock);
        BufferedPersistenceWriter writer = new BufferedPersistenceWriter(small, sink);
        for (int i = 1; i <= 5; i++) {
            small.record("cpu", MetricKind.GAUGE, i);
        }

        assertThat(writer.flush()).isTrue();

        assertThat(writer.droppedCount()).isEqualTo(3);
        assertThat(small.counterTotal(MetricNames.PERSISTENCE_DROPPED_ITEMS)).hasValue(3);
        assertThat(sink.batches).singleElement()
                .satisfies(b -> assertThat(b.getMetrics()).extracting(Metric::getValue).containsExactly(4.0, 5.0));
    }
}
