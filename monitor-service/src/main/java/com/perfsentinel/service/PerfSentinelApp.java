package com.perfsentinel.service;

import com.perfsentinel.core.config.RulesConfig;
import com.perfsentinel.core.config.RulesLoader;
import com.perfsentinel.service.persistence.JsonLinesPersistenceSink;
import com.perfsentinel.service.sampling.JvmResourceSampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point: runs a {@link PerformanceMonitor} on the JVM's own
 * resources until the process is terminated.
 *
 * <h3>Configuration</h3>
 * <p>
 * Runtime settings come from environment variables via {@link MonitorConfig};
 * rules from {@code RULES_CONFIG_PATH} or the bundled {@code rules.yml}.
 * </p>
 *
 * @since 1.0.0
 */
public final class PerfSentinelApp {

    private static final Logger LOG = LoggerFactory.getLogger(PerfSentinelApp.class);

    private PerfSentinelApp() {
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        MonitorConfig config = MonitorConfig.fromEnvironment();
        LOG.info("Starting Perf Sentinel with config: {}", config);

        // 2. Load rules
        RulesConfig rules = config.getRulesConfigPath().isBlank()
                ? RulesLoader.load()
                : RulesLoader.fromFile(Path.of(config.getRulesConfigPath()));

        // 3. Wire and start the monitor
        PerformanceMonitor monitor = new PerformanceMonitor(
                config,
                Clock.systemUTC(),
                new JvmResourceSampler(),
                new JsonLinesPersistenceSink(config.getPersistenceDir(), JsonSupport.newObjectMapper()));
        monitor.loadRules(rules);
        monitor.subscribe(alert -> LOG.warn("ALERT {} [{}] {}", alert.isResolved() ? "resolved" : "triggered",
                alert.getSeverity(), alert.getMessage()));

        CountDownLatch terminated = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown signal received – stopping Perf Sentinel");
            monitor.stop();
            terminated.countDown();
        }, "perf-sentinel-shutdown"));

        monitor.start();
        terminated.await();
    }
}
