package com.perfsentinel.service.sampling;

import com.perfsentinel.core.sampling.ResourceSample;
import com.perfsentinel.core.sampling.ResourceSampler;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Best-effort {@link ResourceSampler} backed by the platform
 * {@link com.sun.management.OperatingSystemMXBean}.
 *
 * <p>
 * CPU is the system-wide load, memory the share of physical memory in use and
 * disk the share of the file store holding {@code diskPath} in use. The JVM
 * exposes no network counters, so both are reported as {@code 0}.
 * </p>
 */
public class JvmResourceSampler implements ResourceSampler {

    private final com.sun.management.OperatingSystemMXBean os;
    private final Path diskPath;

    public JvmResourceSampler(Path diskPath) {
        this.os = (com.sun.management.OperatingSystemMXBean) ManagementFactory.getOperatingSystemMXBean();
        this.diskPath = diskPath.toAbsolutePath();
    }

    public JvmResourceSampler() {
        this(Path.of("."));
    }

    @Override
    public ResourceSample sample() throws IOException {
        double cpuLoad = os.getCpuLoad();
        // negative when the platform cannot tell yet
        double cpuPercent = cpuLoad < 0 ? 0.0 : cpuLoad * 100.0;

        long totalMemory = os.getTotalMemorySize();
        double memoryPercent = totalMemory > 0
                ? (totalMemory - os.getFreeMemorySize()) * 100.0 / totalMemory
                : 0.0;

        FileStore store = Files.getFileStore(diskPath);
        long totalSpace = store.getTotalSpace();
        double diskPercent = totalSpace > 0
                ? (totalSpace - store.getUsableSpace()) * 100.0 / totalSpace
                : 0.0;

        return new ResourceSample(percent(cpuPercent), percent(memoryPercent), percent(diskPercent), 0.0, 0.0);
    }

    private static double percent(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }
}
