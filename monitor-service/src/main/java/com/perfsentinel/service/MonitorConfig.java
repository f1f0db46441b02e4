package com.perfsentinel.service;

import java.nio.file.Path;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Typed, immutable configuration for the {@link PerformanceMonitor}.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the
 * service is configurable from a container manifest or a shell alone.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitorConfig {

    // ---------------------------------------------------------------
    // Loops
    // ---------------------------------------------------------------
    private final long samplingIntervalMs;
    private final long evaluationIntervalMs;
    private final long flushIntervalMs;
    private final long samplerTimeoutMs;

    // ---------------------------------------------------------------
    // Engine bounds
    // ---------------------------------------------------------------
    private final long minScalingIntervalSeconds;
    private final int metricBufferCapacity;
    private final int alertHistoryLimit;
    private final int persistenceMaxBuffered;

    // ---------------------------------------------------------------
    // Paths
    // ---------------------------------------------------------------
    private final Path persistenceDir;
    private final String rulesConfigPath;

    private MonitorConfig(Builder b) {
        this.samplingIntervalMs = b.samplingIntervalMs;
        this.evaluationIntervalMs = b.evaluationIntervalMs;
        this.flushIntervalMs = b.flushIntervalMs;
        this.samplerTimeoutMs = b.samplerTimeoutMs;
        this.minScalingIntervalSeconds = b.minScalingIntervalSeconds;
        this.metricBufferCapacity = b.metricBufferCapacity;
        this.alertHistoryLimit = b.alertHistoryLimit;
        this.persistenceMaxBuffered = b.persistenceMaxBuffered;
        this.persistenceDir = b.persistenceDir;
        this.rulesConfigPath = b.rulesConfigPath;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link MonitorConfig} from environment variables.
     *
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static MonitorConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static MonitorConfig fromEnvironment(UnaryOperator<String> env) {
        try {
            return new Builder()
                    .samplingIntervalMs(parseLong(env, "SAMPLING_INTERVAL_MS", "5000"))
                    .evaluationIntervalMs(parseLong(env, "EVALUATION_INTERVAL_MS", "30000"))
                    .flushIntervalMs(parseLong(env, "FLUSH_INTERVAL_MS", "300000"))
                    .samplerTimeoutMs(parseLong(env, "SAMPLER_TIMEOUT_MS", "2000"))
                    .minScalingIntervalSeconds(parseLong(env, "MIN_SCALING_INTERVAL_SECONDS", "300"))
                    .metricBufferCapacity(parseInt(env, "METRIC_BUFFER_CAPACITY", "1000"))
                    .alertHistoryLimit(parseInt(env, "ALERT_HISTORY_LIMIT", "10000"))
                    .persistenceMaxBuffered(parseInt(env, "PERSISTENCE_MAX_BUFFERED", "10000"))
                    .persistenceDir(Path.of(value(env, "PERSISTENCE_DIR", "perf-data")))
                    .rulesConfigPath(value(env, "RULES_CONFIG_PATH", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public long getSamplingIntervalMs() {
        return samplingIntervalMs;
    }

    public long getEvaluationIntervalMs() {
        return evaluationIntervalMs;
    }

    public long getFlushIntervalMs() {
        return flushIntervalMs;
    }

    public long getSamplerTimeoutMs() {
        return samplerTimeoutMs;
    }

    public long getMinScalingIntervalSeconds() {
        return minScalingIntervalSeconds;
    }

    public int getMetricBufferCapacity() {
        return metricBufferCapacity;
    }

    public int getAlertHistoryLimit() {
        return alertHistoryLimit;
    }

    public int getPersistenceMaxBuffered() {
        return persistenceMaxBuffered;
    }

    public Path getPersistenceDir() {
        return persistenceDir;
    }

    /**
     * @return rules file path, or an empty string to use the classpath
     *         defaults
     */
    public String getRulesConfigPath() {
        return rulesConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link MonitorConfig}.
     *
     * <p>
     * {@link #build()} requires every interval, timeout and bound to be
     * positive (the scaling interval may be zero) and the persistence
     * directory to be set.
     * </p>
     */
    public static class Builder {
        private long samplingIntervalMs = 5_000;
        private long evaluationIntervalMs = 30_000;
        private long flushIntervalMs = 300_000;
        private long samplerTimeoutMs = 2_000;
        private long minScalingIntervalSeconds = 300;
        private int metricBufferCapacity = 1_000;
        private int alertHistoryLimit = 10_000;
        private int persistenceMaxBuffered = 10_000;
        private Path persistenceDir = Path.of("perf-data");
        private String rulesConfigPath = "";

        public Builder samplingIntervalMs(long v) {
            this.samplingIntervalMs = v;
            return this;
        }

        public Builder evaluationIntervalMs(long v) {
            this.evaluationIntervalMs = v;
            return this;
        }

        public Builder flushIntervalMs(long v) {
            this.flushIntervalMs = v;
            return this;
        }

        public Builder samplerTimeoutMs(long v) {
            this.samplerTimeoutMs = v;
            return this;
        }

        public Builder minScalingIntervalSeconds(long v) {
            this.minScalingIntervalSeconds = v;
            return this;
        }

        public Builder metricBufferCapacity(int v) {
            this.metricBufferCapacity = v;
            return this;
        }

        public Builder alertHistoryLimit(int v) {
            this.alertHistoryLimit = v;
            return this;
        }

        public Builder persistenceMaxBuffered(int v) {
            this.persistenceMaxBuffered = v;
            return this;
        }

        public Builder persistenceDir(Path v) {
            this.persistenceDir = v;
            return this;
        }

        public Builder rulesConfigPath(String v) {
            this.rulesConfigPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @throws IllegalArgumentException if any value is invalid
         */
        public MonitorConfig build() {
            requirePositive(samplingIntervalMs, "samplingIntervalMs");
            requirePositive(evaluationIntervalMs, "evaluationIntervalMs");
            requirePositive(flushIntervalMs, "flushIntervalMs");
            requirePositive(samplerTimeoutMs, "samplerTimeoutMs");
            requirePositive(metricBufferCapacity, "metricBufferCapacity");
            requirePositive(alertHistoryLimit, "alertHistoryLimit");
            requirePositive(persistenceMaxBuffered, "persistenceMaxBuffered");
            if (minScalingIntervalSeconds < 0) {
                throw new IllegalArgumentException(
                        "minScalingIntervalSeconds must be >= 0, got: " + minScalingIntervalSeconds);
            }
            Objects.requireNonNull(persistenceDir, "persistenceDir required");
            if (rulesConfigPath == null) {
                rulesConfigPath = "";
            }
            return new MonitorConfig(this);
        }

        private static void requirePositive(long value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(UnaryOperator<String> env, String name, String defaultValue) {
        String value = env.apply(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static int parseInt(UnaryOperator<String> env, String name, String defaultValue) {
        return Integer.parseInt(value(env, name, defaultValue));
    }

    private static long parseLong(UnaryOperator<String> env, String name, String defaultValue) {
        return Long.parseLong(value(env, name, defaultValue));
    }

    @Override
    public String toString() {
        return "MonitorConfig{" +
                "samplingIntervalMs=" + samplingIntervalMs +
                ", evaluationIntervalMs=" + evaluationIntervalMs +
                ", flushIntervalMs=" + flushIntervalMs +
                ", samplerTimeoutMs=" + samplerTimeoutMs +
                ", minScalingIntervalSeconds=" + minScalingIntervalSeconds +
                ", metricBufferCapacity=" + metricBufferCapacity +
                ", alertHistoryLimit=" + alertHistoryLimit +
                ", persistenceMaxBuffered=" + persistenceMaxBuffered +
                ", persistenceDir=" + persistenceDir +
                ", rulesConfigPath='" + rulesConfigPath + '\'' +
                '}';
    }
}
