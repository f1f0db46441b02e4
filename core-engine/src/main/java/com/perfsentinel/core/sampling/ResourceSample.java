package com.perfsentinel.core.sampling;

import java.util.Objects;

/**
 * One resource reading. Percentages are in {@code [0, 100]}; network values
 * are cumulative byte counts as reported by the interface counters, not
 * per-reading increments.
 *
 * @since 1.0.0
 */
public final class ResourceSample {

    private final double cpuPercent;
    private final double memoryPercent;
    private final double diskPercent;
    private final double networkBytesSent;
    private final double networkBytesRecv;

    public ResourceSample(double cpuPercent, double memoryPercent, double diskPercent,
            double networkBytesSent, double networkBytesRecv) {
        this.cpuPercent = requirePercent("cpuPercent", cpuPercent);
        this.memoryPercent = requirePercent("memoryPercent", memoryPercent);
        this.diskPercent = requirePercent("diskPercent", diskPercent);
        this.networkBytesSent = requireNonNegative("networkBytesSent", networkBytesSent);
        this.networkBytesRecv = requireNonNegative("networkBytesRecv", networkBytesRecv);
    }

    private static double requirePercent(String field, double value) {
        if (!(value >= 0.0 && value <= 100.0)) {
            throw new IllegalArgumentException(field + " must be in [0, 100], got: " + value);
        }
        return value;
    }

    private static double requireNonNegative(String field, double value) {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(field + " must be a finite value >= 0, got: " + value);
        }
        return value;
    }

    public double getCpuPercent() {
        return cpuPercent;
    }

    public double getMemoryPercent() {
        return memoryPercent;
    }

    public double getDiskPercent() {
        return diskPercent;
    }

    public double getNetworkBytesSent() {
        return networkBytesSent;
    }

    public double getNetworkBytesRecv() {
        return networkBytesRecv;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ResourceSample))
            return false;
        ResourceSample that = (ResourceSample) o;
        return Double.compare(cpuPercent, that.cpuPercent) == 0
                && Double.compare(memoryPercent, that.memoryPercent) == 0
                && Double.compare(diskPercent, that.diskPercent) == 0
                && Double.compare(networkBytesSent, that.networkBytesSent) == 0
                && Double.compare(networkBytesRecv, that.networkBytesRecv) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cpuPercent, memoryPercent, diskPercent, networkBytesSent, networkBytesRecv);
    }

    @Override
    public String toString() {
        return "ResourceSample{cpu=" + cpuPercent + "%, memory=" + memoryPercent + "%, disk=" + diskPercent
                + "%, sent=" + networkBytesSent + ", recv=" + networkBytesRecv + '}';
    }
}
