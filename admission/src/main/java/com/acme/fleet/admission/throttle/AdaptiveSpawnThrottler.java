package com.acme.fleet.admission.throttle;

import com.acme.fleet.admission.breaker.CircuitState;
import com.acme.fleet.admission.breaker.SpawnCircuitBreaker;
import com.acme.fleet.admission.queue.SpawnRequest;
import com.acme.fleet.admission.resource.ResourceMonitor;
import com.acme.fleet.admission.util.MonotonicClock;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Logger;

/**
 * Admission decision engine.
 *
 * <p>{@link #canSpawnNow()} is the cheap gate and is always checked first: it answers
 * "no" under critical pressure or an open breaker without computing a batch size. Once it
 * is open, {@link #getCurrentBatchSize()} combines the load signals:</p>
 *
 * <pre>
 * batch = round(base * aggressiveness * resource * phase * failure), clamped to [min, max]
 * </pre>
 *
 * <p>where {@code resource} is the monitor's advisory multiplier, {@code phase} the
 * active startup phase multiplier and {@code failure} falls smoothly from 1.0 towards 0.1
 * as the breaker's failure rate approaches its open threshold.</p>
 *
 * <p>Owns only its config and counters. {@link #update(long)} and the release path are
 * driven by the tick thread; outcome recording is safe from owner threads.</p>
 */
public final class AdaptiveSpawnThrottler {
    private static final Logger LOG = Logger.getLogger(AdaptiveSpawnThrottler.class.getName());

    static final double MIN_FAILURE_MULTIPLIER = 0.1d;

    private final ResourceMonitor resourceMonitor;
    private final SpawnCircuitBreaker circuitBreaker;
    private final MonotonicClock clock;
    private final BurstLimiter burstLimiter;
    private volatile ThrottleConfig config;
    private volatile double phaseMultiplier = 1.0d;

    // Long.MAX_VALUE until the first batch so the gate starts open.
    private volatile long sinceLastBatchMs = Long.MAX_VALUE;

    private final LongAdder released = new LongAdder();
    private final LongAdder successes = new LongAdder();
    private final LongAdder failures = new LongAdder();
    private final LongAdder batches = new LongAdder();
    private volatile int lastBatchSize;
    private final Map<SpawnFailureReason, LongAdder> failuresByReason = new EnumMap<>(SpawnFailureReason.class);
    private final Map<ThrottleReason, LongAdder> gateDenials = new EnumMap<>(ThrottleReason.class);

    public AdaptiveSpawnThrottler(ThrottleConfig config,
                                  ResourceMonitor resourceMonitor,
                                  SpawnCircuitBreaker circuitBreaker) {
        this(config, resourceMonitor, circuitBreaker, MonotonicClock.SYSTEM);
    }

    public AdaptiveSpawnThrottler(ThrottleConfig config,
                                  ResourceMonitor resourceMonitor,
                                  SpawnCircuitBreaker circuitBreaker,
                                  MonotonicClock clock) {
        this.config = Objects.requireNonNull(config, "config").validated();
        this.resourceMonitor = Objects.requireNonNull(resourceMonitor, "resourceMonitor");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.burstLimiter = new BurstLimiter(config.burstWindowSeconds(), config.burstWindowMaxRequests());
        for (SpawnFailureReason reason : SpawnFailureReason.values()) {
            failuresByReason.put(reason, new LongAdder());
        }
        for (ThrottleReason reason : ThrottleReason.values()) {
            gateDenials.put(reason, new LongAdder());
        }
    }

    /**
     * Advances internal timers only.
     */
    public void update(long deltaTimeMs) {
        long since = sinceLastBatchMs;
        if (since != Long.MAX_VALUE) {
            long next = since + Math.max(0L, deltaTimeMs);
            sinceLastBatchMs = next < since ? Long.MAX_VALUE : next;
        }
    }

    /**
     * Counted gate check. A breaker refusal here is also recorded as a breaker rejection.
     */
    public boolean canSpawnNow() {
        ThrottleReason reason = gate(true);
        if (reason != ThrottleReason.NONE) {
            gateDenials.get(reason).increment();
            return false;
        }
        return true;
    }

    /**
     * First reason the gate is closed, or {@link ThrottleReason#NONE}. Does not count as a
     * gate check.
     */
    public ThrottleReason evaluateGate() {
        return gate(false);
    }

    private ThrottleReason gate(boolean admitting) {
        if (!resourceMonitor.isSpawningSafe()) {
            return ThrottleReason.CRITICAL_PRESSURE;
        }
        ThrottleConfig c = config;
        if (c.enableCircuitBreaker()) {
            boolean allowed = admitting ? circuitBreaker.allowSpawn() : circuitBreaker.remainingAdmissions() > 0;
            if (!allowed) {
                return circuitBreaker.getState() == CircuitState.OPEN
                    ? ThrottleReason.CIRCUIT_OPEN
                    : ThrottleReason.PROBE_BUDGET_SPENT;
            }
        }
        if (sinceLastBatchMs < currentIntervalMs()) {
            return ThrottleReason.BATCH_INTERVAL;
        }
        if (c.enableBurstPrevention() && burstLimiter.remaining(clock.nanoTime()) == 0) {
            return ThrottleReason.BURST_LIMIT;
        }
        return ThrottleReason.NONE;
    }

    /**
     * Batch size from the current load signals, always within {@code [minBatchSize, maxBatchSize]}.
     */
    public int getCurrentBatchSize() {
        ThrottleConfig c = config;
        if (!c.enableAdaptive()) {
            return computeBatchSize(c, 1.0d, 1.0d, 1.0d);
        }
        return computeBatchSize(c,
            resourceMonitor.getRecommendedSpawnRateMultiplier(),
            phaseMultiplier,
            failureMultiplier());
    }

    /**
     * {@link #getCurrentBatchSize()} further limited by the breaker's probe budget and the
     * remaining burst allowance. This is what a release may actually dequeue; it can be 0.
     */
    public int getReleasableBatchSize() {
        int size = getCurrentBatchSize();
        ThrottleConfig c = config;
        if (c.enableCircuitBreaker()) {
            size = Math.min(size, circuitBreaker.remainingAdmissions());
        }
        if (c.enableBurstPrevention()) {
            size = Math.min(size, burstLimiter.remaining(clock.nanoTime()));
        }
        return Math.max(0, size);
    }

    static int computeBatchSize(ThrottleConfig c,
                                double resourceMultiplier,
                                double phaseMultiplier,
                                double failureMultiplier) {
        double raw = c.baseBatchSize() * c.aggressivenessMultiplier()
            * sanitize(resourceMultiplier) * sanitize(phaseMultiplier) * sanitize(failureMultiplier);
        long rounded = Math.round(raw);
        if (rounded < c.minBatchSize()) return c.minBatchSize();
        return (int) Math.min(rounded, c.maxBatchSize());
    }

    private static double sanitize(double multiplier) {
        if (Double.isNaN(multiplier) || multiplier < 0.0d) {
            return 0.0d;
        }
        return Math.min(multiplier, 1_000.0d);
    }

    /**
     * 1.0 with no recent failures, easing down to {@link #MIN_FAILURE_MULTIPLIER} as the
     * breaker's failure rate reaches its open threshold.
     */
    public double failureMultiplier() {
        return failureMultiplier(circuitBreaker.getFailureRate(), circuitBreaker.config().openThresholdPercent());
    }

    static double failureMultiplier(double failureRatePercent, double openThresholdPercent) {
        if (!(failureRatePercent > 0.0d) || !(openThresholdPercent > 0.0d)) {
            return 1.0d;
        }
        double x = Math.min(1.0d, failureRatePercent / openThresholdPercent);
        return 1.0d - (1.0d - MIN_FAILURE_MULTIPLIER) * x * x;
    }

    /**
     * Current spacing between batches: the base interval stretched by resource pressure.
     */
    public long currentIntervalMs() {
        ThrottleConfig c = config;
        if (!c.enableAdaptive()) {
            return c.baseBatchIntervalMs();
        }
        double multiplier = resourceMonitor.getRecommendedSpawnRateMultiplier();
        if (!(multiplier > 0.0d)) {
            return c.maxBatchIntervalMs();
        }
        long stretched = Math.round(c.baseBatchIntervalMs() / Math.min(1.0d, multiplier));
        return Math.min(stretched, c.maxBatchIntervalMs());
    }

    /**
     * Milliseconds until the next batch may be released.
     */
    public long getRecommendedSpawnDelay() {
        ThrottleConfig c = config;
        if (c.enableCircuitBreaker() && circuitBreaker.getState() == CircuitState.OPEN) {
            return Math.max(circuitBreaker.cooldownRemainingMillis(), currentIntervalMs());
        }
        long interval = currentIntervalMs();
        if (!resourceMonitor.isSpawningSafe()) {
            return interval;
        }
        long since = sinceLastBatchMs;
        return since >= interval ? 0L : interval - since;
    }

    /**
     * Records that {@code count} requests were handed to the owner as one batch.
     */
    public void recordBatchReleased(int count) {
        if (count <= 0) {
            return;
        }
        sinceLastBatchMs = 0L;
        lastBatchSize = count;
        batches.increment();
        released.add(count);
        circuitBreaker.recordAttempts(count);
        if (config.enableBurstPrevention()) {
            burstLimiter.record(clock.nanoTime(), count);
        }
    }

    public void recordSpawnSuccess(SpawnRequest request) {
        successes.increment();
        circuitBreaker.recordSuccess();
    }

    public void recordSpawnFailure(SpawnRequest request, SpawnFailureReason reason) {
        SpawnFailureReason r = SpawnFailureReason.orUnknown(reason);
        failures.increment();
        failuresByReason.get(r).increment();
        circuitBreaker.recordFailure();
        LOG.fine(() -> "spawn failed requestId=" + (request == null ? "?" : request.requestId()) + " reason=" + r);
    }

    public void setPhaseMultiplier(double multiplier) {
        this.phaseMultiplier = multiplier > 0.0d ? multiplier : 1.0d;
    }

    public double phaseMultiplier() {
        return phaseMultiplier;
    }

    public ThrottleConfig config() {
        return config;
    }

    public void reconfigure(ThrottleConfig newConfig) {
        ThrottleConfig validated = Objects.requireNonNull(newConfig, "newConfig").validated();
        burstLimiter.configure(validated.burstWindowSeconds(), validated.burstWindowMaxRequests());
        this.config = validated;
        LOG.info(() -> "spawn throttle reconfigured: " + validated);
    }

    /**
     * Clears cumulative counters; timers and configuration are kept.
     */
    public void resetMetrics() {
        released.reset();
        successes.reset();
        failures.reset();
        batches.reset();
        lastBatchSize = 0;
        failuresByReason.values().forEach(LongAdder::reset);
        gateDenials.values().forEach(LongAdder::reset);
    }

    public ThrottleMetrics getMetrics() {
        Map<SpawnFailureReason, Long> byReason = new EnumMap<>(SpawnFailureReason.class);
        failuresByReason.forEach((k, v) -> {
            long n = v.sum();
            if (n > 0) {
                byReason.put(k, n);
            }
        });
        Map<ThrottleReason, Long> denials = new EnumMap<>(ThrottleReason.class);
        gateDenials.forEach((k, v) -> {
            long n = v.sum();
            if (n > 0) {
                denials.put(k, n);
            }
        });
        return new ThrottleMetrics(
            released.sum(),
            successes.sum(),
            failures.sum(),
            batches.sum(),
            lastBatchSize,
            getCurrentBatchSize(),
            currentIntervalMs(),
            phaseMultiplier,
            failureMultiplier(),
            Map.copyOf(byReason),
            Map.copyOf(denials)
        );
    }
}
