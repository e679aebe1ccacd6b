package com.acme.fleet.admission.resource;

import com.acme.fleet.admission.util.AdmissionDefaults;
import com.acme.fleet.admission.util.MonotonicClock;
import com.acme.fleet.admission.util.RateLimitedLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Smoothed view of host pressure.
 *
 * <p>{@link #update(long)} is driven by the tick thread only. Every read accessor goes
 * through one published immutable {@link View}, so callers on other threads (telemetry,
 * the owner) never observe a snapshot mixed from two samples.</p>
 */
public final class ResourceMonitor {
    private static final Logger LOG = Logger.getLogger(ResourceMonitor.class.getName());

    private final ResourceSampler sampler;
    private final MonotonicClock clock;
    private final long sampleIntervalMs;
    private volatile ResourceThresholds thresholds;

    private final MovingAverage cpuShort = new MovingAverage(AdmissionDefaults.SHORT_WINDOW_SAMPLES);
    private final MovingAverage cpuMedium = new MovingAverage(AdmissionDefaults.MEDIUM_WINDOW_SAMPLES);
    private final MovingAverage cpuLong = new MovingAverage(AdmissionDefaults.LONG_WINDOW_SAMPLES);
    private final MovingAverage memoryShort = new MovingAverage(AdmissionDefaults.SHORT_WINDOW_SAMPLES);
    private final MovingAverage memoryMedium = new MovingAverage(AdmissionDefaults.MEDIUM_WINDOW_SAMPLES);
    private final MovingAverage memoryLong = new MovingAverage(AdmissionDefaults.LONG_WINDOW_SAMPLES);

    private final ResourceMetrics[] history = new ResourceMetrics[AdmissionDefaults.HISTORY_CAPACITY];
    private int historyNext;
    private int historyCount;

    // last known raw readings, kept when a counter read fails
    private double lastCpu;
    private double lastMemory;
    private int lastActiveConnections;
    private int lastMaxConnections;
    private int lastActiveWorkers;

    private long sinceLastSampleMs;
    private boolean sampledOnce;

    private final AtomicReference<View> view = new AtomicReference<>(View.INITIAL);
    private final LongAdder samples = new LongAdder();
    private final LongAdder sampleFailures = new LongAdder();
    private final LongAdder levelChanges = new LongAdder();
    private final RateLimitedLog sampleFailureLog;

    public ResourceMonitor(ResourceSampler sampler, ResourceThresholds thresholds, long sampleIntervalMs) {
        this(sampler, thresholds, sampleIntervalMs, MonotonicClock.SYSTEM);
    }

    public ResourceMonitor(ResourceSampler sampler,
                           ResourceThresholds thresholds,
                           long sampleIntervalMs,
                           MonotonicClock clock) {
        this.sampler = Objects.requireNonNull(sampler, "sampler");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds").validated();
        this.sampleIntervalMs = Math.max(0L, sampleIntervalMs);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sampleFailureLog = new RateLimitedLog(LOG, AdmissionDefaults.DIAGNOSTIC_LOG_INTERVAL_MS, clock);
    }

    /**
     * Advances the sampling timer and takes a sample when the interval has elapsed.
     * The first call always samples.
     */
    public void update(long deltaTimeMs) {
        sinceLastSampleMs += Math.max(0L, deltaTimeMs);
        if (sampledOnce && sinceLastSampleMs < sampleIntervalMs) {
            return;
        }
        sinceLastSampleMs = 0L;
        sampledOnce = true;
        sampleNow();
    }

    private void sampleNow() {
        long now = clock.nanoTime();
        ResourceSample raw;
        try {
            raw = sampler.sample();
        } catch (RuntimeException e) {
            sampleFailures.increment();
            sampleFailureLog.log(Level.WARNING, () -> "resource sampler failed, keeping last known values: " + e);
            raw = ResourceSample.unavailable(now);
        }
        if (raw == null) {
            raw = ResourceSample.unavailable(now);
        }
        int failed = raw.failedCounters();
        if (failed > 0) {
            sampleFailures.add(failed);
            ResourceSample failedSample = raw;
            sampleFailureLog.log(Level.WARNING, () -> "resource counters unavailable"
                + " cpu=" + failedSample.hasCpu()
                + " memory=" + failedSample.hasMemory()
                + " connections=" + failedSample.hasConnections()
                + " workers=" + failedSample.hasActiveWorkers()
                + ", keeping last known values");
        }
        if (raw.hasCpu()) {
            lastCpu = clampPercent(raw.cpuUsagePercent());
        }
        if (raw.hasMemory()) {
            lastMemory = clampPercent(raw.memoryUsagePercent());
        }
        if (raw.hasConnections()) {
            lastActiveConnections = Math.max(0, raw.activeConnections());
            lastMaxConnections = Math.max(0, raw.maxConnections());
        }
        if (raw.hasActiveWorkers()) {
            lastActiveWorkers = Math.max(0, raw.activeWorkers());
        }

        cpuShort.add(lastCpu);
        cpuMedium.add(lastCpu);
        cpuLong.add(lastCpu);
        memoryShort.add(lastMemory);
        memoryMedium.add(lastMemory);
        memoryLong.add(lastMemory);
        samples.increment();

        ResourceMetrics metrics = new ResourceMetrics(
            cpuShort.average(),
            memoryShort.average(),
            lastActiveConnections,
            lastMaxConnections,
            lastActiveWorkers,
            now
        );
        appendHistory(metrics);
        publish(metrics);
    }

    private void publish(ResourceMetrics metrics) {
        View previous = view.get();
        ResourceThresholds t = thresholds;
        PressureLevel cpuLevel = t.classifyCpu(metrics.cpuUsagePercent(), previous.cpuLevel());
        PressureLevel memoryLevel = t.classifyMemory(metrics.memoryUsagePercent(), previous.memoryLevel());
        PressureLevel connectionLevel = t.classifyConnections(metrics);
        PressureLevel combined = PressureLevel.max(PressureLevel.max(cpuLevel, memoryLevel), connectionLevel);
        view.set(new View(metrics, cpuLevel, memoryLevel, connectionLevel, combined,
            cpuMedium.average(), cpuLong.average(), memoryMedium.average(), memoryLong.average()));

        if (combined != previous.level()) {
            levelChanges.increment();
            LOG.info(() -> "pressure level " + previous.level() + " -> " + combined
                + String.format(" cpu=%.1f%% memory=%.1f%% connections=%d/%d",
                    metrics.cpuUsagePercent(), metrics.memoryUsagePercent(),
                    metrics.activeConnections(), metrics.maxConnections()));
        }
    }

    private void appendHistory(ResourceMetrics metrics) {
        history[historyNext] = metrics;
        historyNext = (historyNext + 1) % history.length;
        if (historyCount < history.length) {
            historyCount++;
        }
    }

    /**
     * Returns the current immutable snapshot. Safe from any thread.
     */
    public ResourceMetrics getCurrentMetrics() {
        return view.get().metrics();
    }

    public PressureLevel getPressureLevel() {
        return view.get().level();
    }

    public boolean isSpawningSafe() {
        return getPressureLevel() != PressureLevel.CRITICAL;
    }

    /**
     * Advisory multiplier in {@code [0.0, 1.0]}; never a gate by itself.
     */
    public double getRecommendedSpawnRateMultiplier() {
        return getPressureLevel().spawnRateMultiplier();
    }

    /**
     * Oldest-first copy of the retained samples. Tick thread only.
     */
    public List<ResourceMetrics> history() {
        List<ResourceMetrics> out = new ArrayList<>(historyCount);
        int start = (historyNext - historyCount + history.length) % history.length;
        for (int i = 0; i < historyCount; i++) {
            out.add(history[(start + i) % history.length]);
        }
        return out;
    }

    public void reconfigure(ResourceThresholds newThresholds) {
        this.thresholds = Objects.requireNonNull(newThresholds, "newThresholds").validated();
        LOG.info(() -> "resource thresholds reconfigured: " + newThresholds);
    }

    public ResourceThresholds thresholds() {
        return thresholds;
    }

    public Snapshot getMetrics() {
        View v = view.get();
        return new Snapshot(
            v.metrics(),
            v.level(),
            v.cpuLevel(),
            v.memoryLevel(),
            v.connectionLevel(),
            v.cpuMedium(),
            v.cpuLong(),
            v.memoryMedium(),
            v.memoryLong(),
            samples.sum(),
            sampleFailures.sum(),
            levelChanges.sum()
        );
    }

    private static double clampPercent(double v) {
        if (v < 0.0d) return 0.0d;
        return Math.min(v, 100.0d);
    }

    private record View(ResourceMetrics metrics,
                        PressureLevel cpuLevel,
                        PressureLevel memoryLevel,
                        PressureLevel connectionLevel,
                        PressureLevel level,
                        double cpuMedium,
                        double cpuLong,
                        double memoryMedium,
                        double memoryLong) {
        static final View INITIAL = new View(ResourceMetrics.EMPTY,
            PressureLevel.NORMAL, PressureLevel.NORMAL, PressureLevel.NORMAL, PressureLevel.NORMAL,
            0.0d, 0.0d, 0.0d, 0.0d);
    }

    public record Snapshot(ResourceMetrics current,
                           PressureLevel level,
                           PressureLevel cpuLevel,
                           PressureLevel memoryLevel,
                           PressureLevel connectionLevel,
                           double cpuMediumAverage,
                           double cpuLongAverage,
                           double memoryMediumAverage,
                           double memoryLongAverage,
                           long samples,
                           long sampleFailures,
                           long levelChanges) {}
}
