package com.perfsentinel.core.model;

/**
 * Well-known metric names shared by samplers, instrumentation helpers and the
 * report generator.
 *
 * @since 1.0.0
 */
public final class MetricNames {

    public static final String CPU_USAGE_PERCENT = "system.cpu.usage_percent";
    public static final String MEMORY_USAGE_PERCENT = "system.memory.usage_percent";
    public static final String DISK_USAGE_PERCENT = "system.disk.usage_percent";
    public static final String NETWORK_BYTES_SENT = "system.network.bytes_sent";
    public static final String NETWORK_BYTES_RECV = "system.network.bytes_recv";

    public static final String GENERATION_LATENCY_MS = "model.generation.latency_ms";
    public static final String GENERATION_TOTAL = "model.generation.total";
    public static final String GENERATION_ERRORS = "model.generation.errors";
    /** Gauge: generation errors over generations, both running totals. */
    public static final String GENERATION_ERROR_RATE = "model.generation.error_rate";

    public static final String API_REQUESTS_TOTAL = "api.requests_total";
    public static final String API_RESPONSE_TIME_MS = "api.response_time_ms";
    public static final String API_REQUESTS_PER_SECOND = "api.requests_per_second";

    /** Items dropped by the persistence writer on buffer overflow. */
    public static final String PERSISTENCE_DROPPED_ITEMS = "perf_sentinel.persistence.dropped_items";

    private MetricNames() {
        // constants holder
    }
}
