package com.acme.fleet.admission.resource;

/**
 * Immutable view of host load, rebuilt on every sample.
 *
 * @param cpuUsagePercent    smoothed CPU usage, 0..100
 * @param memoryUsagePercent smoothed memory usage, 0..100
 * @param activeConnections  connections currently checked out of the shared pool
 * @param maxConnections     pool size; 0 when the host has no bounded pool
 * @param activeWorkers      workers currently online
 * @param timestampNanos     monotonic time of the sample
 */
public record ResourceMetrics(
    double cpuUsagePercent,
    double memoryUsagePercent,
    int activeConnections,
    int maxConnections,
    int activeWorkers,
    long timestampNanos
) {
    public static final ResourceMetrics EMPTY = new ResourceMetrics(0.0d, 0.0d, 0, 0, 0, 0L);

    public double connectionUsagePercent() {
        if (maxConnections <= 0) {
            return 0.0d;
        }
        return Math.min(100.0d, activeConnections * 100.0d / maxConnections);
    }

    public boolean connectionPoolExhausted() {
        return maxConnections > 0 && activeConnections >= maxConnections;
    }
}
