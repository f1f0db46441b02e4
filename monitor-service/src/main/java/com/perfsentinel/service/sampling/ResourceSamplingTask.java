package com.perfsentinel.service.sampling;

import com.perfsentinel.core.model.MetricKind;
import com.perfsentinel.core.model.MetricNames;
import com.perfsentinel.core.recorder.MetricRecorder;
import com.perfsentinel.core.sampling.ResourceSample;
import com.perfsentinel.core.sampling.ResourceSampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One tick of the sampling loop: take a {@link ResourceSample} and record it.
 *
 * <p>
 * The sampler runs on its own executor so a slow or hung sampler never holds
 * up the scheduling thread. A call that exceeds {@code timeoutMs} is
 * cancelled, logged at WARN and its reading dropped.
 * </p>
 *
 * <p>
 * Recorded metrics: cpu, memory and disk percentages as gauges, network
 * bytes sent and received as counters. The sample's network values are
 * cumulative, so each counter increment is the difference from the previous
 * reading; the first reading only sets the baseline and a reading below the
 * previous one (interface counters reset) counts in full.
 * </p>
 *
 * @since 1.0.0
 */
public class ResourceSamplingTask implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(ResourceSamplingTask.class);

    private final ResourceSampler sampler;
    private final MetricRecorder recorder;
    private final ExecutorService samplerExecutor;
    private final long timeoutMs;

    // Guarded by "this"
    private double lastBytesSent = Double.NaN;
    private double lastBytesRecv = Double.NaN;

    public ResourceSamplingTask(ResourceSampler sampler, MetricRecorder recorder,
            ExecutorService samplerExecutor, long timeoutMs) {
        this.sampler = Objects.requireNonNull(sampler, "sampler must not be null");
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.samplerExecutor = Objects.requireNonNull(samplerExecutor, "samplerExecutor must not be null");
        if (timeoutMs < 1) {
            throw new IllegalArgumentException("timeoutMs must be >= 1, got: " + timeoutMs);
        }
        this.timeoutMs = timeoutMs;
    }

    @Override
    public void run() {
        sampleOnce();
    }

    /**
     * @return {@code true} if a sample was taken and recorded
     */
    public boolean sampleOnce() {
        Future<ResourceSample> future;
        try {
            future = samplerExecutor.submit(sampler::sample);
        } catch (RejectedExecutionException e) {
            LOG.debug("Sampler executor is shut down – skipping sample");
            return false;
        }

        ResourceSample sample;
        try {
            sample = future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Resource sampler did not respond within {}ms – sample dropped", timeoutMs);
            return false;
        } catch (ExecutionException e) {
            LOG.warn("Resource sampler failed – sample dropped", e.getCause());
            return false;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            LOG.debug("Interrupted while waiting for resource sample");
            return false;
        }

        if (sample == null) {
            LOG.warn("Resource sampler returned no sample – dropped");
            return false;
        }
        record(sample);
        return true;
    }

    private synchronized void record(ResourceSample sample) {
        recorder.record(MetricNames.CPU_USAGE_PERCENT, MetricKind.GAUGE, sample.getCpuPercent());
        recorder.record(MetricNames.MEMORY_USAGE_PERCENT, MetricKind.GAUGE, sample.getMemoryPercent());
        recorder.record(MetricNames.DISK_USAGE_PERCENT, MetricKind.GAUGE, sample.getDiskPercent());
        recorder.record(MetricNames.NETWORK_BYTES_SENT, MetricKind.COUNTER,
                increment(lastBytesSent, sample.getNetworkBytesSent()));
        recorder.record(MetricNames.NETWORK_BYTES_RECV, MetricKind.COUNTER,
                increment(lastBytesRecv, sample.getNetworkBytesRecv()));
        lastBytesSent = sample.getNetworkBytesSent();
        lastBytesRecv = sample.getNetworkBytesRecv();
        LOG.trace("Recorded {}", sample);
    }

    static double increment(double previous, double current) {
        if (Double.isNaN(previous)) {
            return 0.0;
        }
        return current >= previous ? current - previous : current;
    }
}
