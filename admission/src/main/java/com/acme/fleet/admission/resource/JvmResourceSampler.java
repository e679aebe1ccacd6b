package com.acme.fleet.admission.resource;

import com.acme.fleet.admission.util.MonotonicClock;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.util.Objects;
import java.util.function.IntSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Samples CPU and heap usage from the platform MXBeans; connection pool and worker counts
 * come from owner-supplied gauges.
 */
public final class JvmResourceSampler implements ResourceSampler {
    private static final Logger LOG = Logger.getLogger(JvmResourceSampler.class.getName());

    private final OperatingSystemMXBean osBean;
    private final MemoryMXBean memoryBean;
    private final IntSupplier activeConnections;
    private final IntSupplier maxConnections;
    private final IntSupplier activeWorkers;
    private final MonotonicClock clock;

    public JvmResourceSampler(IntSupplier activeConnections,
                              IntSupplier maxConnections,
                              IntSupplier activeWorkers) {
        this(ManagementFactory.getOperatingSystemMXBean(), ManagementFactory.getMemoryMXBean(),
            activeConnections, maxConnections, activeWorkers, MonotonicClock.SYSTEM);
    }

    JvmResourceSampler(OperatingSystemMXBean osBean,
                       MemoryMXBean memoryBean,
                       IntSupplier activeConnections,
                       IntSupplier maxConnections,
                       IntSupplier activeWorkers,
                       MonotonicClock clock) {
        this.osBean = Objects.requireNonNull(osBean, "osBean");
        this.memoryBean = Objects.requireNonNull(memoryBean, "memoryBean");
        this.activeConnections = activeConnections == null ? () -> 0 : activeConnections;
        this.maxConnections = maxConnections == null ? () -> 0 : maxConnections;
        this.activeWorkers = activeWorkers == null ? () -> 0 : activeWorkers;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public ResourceSample sample() {
        return new ResourceSample(
            readCpuPercent(),
            readHeapPercent(),
            readCount(activeConnections, "activeConnections"),
            readCount(maxConnections, "maxConnections"),
            readCount(activeWorkers, "activeWorkers"),
            clock.nanoTime()
        );
    }

    private double readCpuPercent() {
        try {
            double load = -1.0d;
            if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
                load = sunBean.getCpuLoad();
            }
            if (load < 0.0d) {
                // Fall back to the load average normalised by core count.
                double avg = osBean.getSystemLoadAverage();
                int cpus = Math.max(1, osBean.getAvailableProcessors());
                if (avg < 0.0d) {
                    return Double.NaN;
                }
                return Math.min(100.0d, avg / cpus * 100.0d);
            }
            return load * 100.0d;
        } catch (RuntimeException e) {
            LOG.log(Level.FINE, "cpu counter read failed", e);
            return Double.NaN;
        }
    }

    private double readHeapPercent() {
        try {
            MemoryUsage heap = memoryBean.getHeapMemoryUsage();
            long max = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
            if (max <= 0) {
                return Double.NaN;
            }
            return heap.getUsed() * 100.0d / max;
        } catch (RuntimeException e) {
            LOG.log(Level.FINE, "heap counter read failed", e);
            return Double.NaN;
        }
    }

    private static int readCount(IntSupplier gauge, String name) {
        try {
            return Math.max(0, gauge.getAsInt());
        } catch (RuntimeException e) {
            LOG.log(Level.FINE, "gauge read failed: " + name, e);
            return ResourceSample.UNAVAILABLE;
        }
    }
}
