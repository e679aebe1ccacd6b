package com.acme.fleet.admission.resource;

/**
 * Raw counter readings produced by a {@link ResourceSampler}.
 *
 * <p>A counter that could not be read is reported as {@link Double#NaN} (percentages)
 * or {@link #UNAVAILABLE} (counts); consumers keep their last known value for it.</p>
 */
public record ResourceSample(
    double cpuUsagePercent,
    double memoryUsagePercent,
    int activeConnections,
    int maxConnections,
    int activeWorkers,
    long sampledAtNanos
) {
    public static final int UNAVAILABLE = -1;

    public static ResourceSample unavailable(long nowNanos) {
        return new ResourceSample(Double.NaN, Double.NaN, UNAVAILABLE, UNAVAILABLE, UNAVAILABLE, nowNanos);
    }

    public boolean hasCpu() {
        return !Double.isNaN(cpuUsagePercent);
    }

    public boolean hasMemory() {
        return !Double.isNaN(memoryUsagePercent);
    }

    public boolean hasConnections() {
        return activeConnections != UNAVAILABLE && maxConnections != UNAVAILABLE;
    }

    public boolean hasActiveWorkers() {
        return activeWorkers != UNAVAILABLE;
    }

    public int failedCounters() {
        int failed = 0;
        if (!hasCpu()) failed++;
        if (!hasMemory()) failed++;
        if (!hasConnections()) failed++;
        if (!hasActiveWorkers()) failed++;
        return failed;
    }
}
