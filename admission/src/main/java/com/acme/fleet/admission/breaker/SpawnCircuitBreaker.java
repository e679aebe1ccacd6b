package com.acme.fleet.admission.breaker;

import com.acme.fleet.admission.util.MonotonicClock;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Three-state breaker that turns a burst of downstream spawn failures into a temporary
 * global stop.
 *
 * <ul>
 *   <li>{@code CLOSED}: spawns allowed. Opens once the failure rate over the last
 *       {@code failureWindowSeconds} exceeds {@code openThresholdPercent} with at least
 *       {@code minimumSampleSize} outcomes in the window.</li>
 *   <li>{@code OPEN}: spawns refused for {@code cooldownSeconds}, then half-open.
 *       Outcomes recorded meanwhile cannot shorten the cooldown.</li>
 *   <li>{@code HALF_OPEN}: up to {@code halfOpenMaxProbes} attempts admitted. Any failure
 *       reopens with a fresh cooldown. Once {@code recoveryWindowSeconds} have passed, at
 *       least one admitted attempt has finished and none is still outstanding, a failure
 *       rate below {@code closeThresholdPercent} closes the breaker. Until then it stays
 *       half-open, however long that takes.</li>
 * </ul>
 *
 * <p>Time-driven transitions are applied lazily on every query. All entry points are
 * synchronized and none of them throw.</p>
 */
public final class SpawnCircuitBreaker {
    private static final Logger LOG = Logger.getLogger(SpawnCircuitBreaker.class.getName());

    private final MonotonicClock clock;
    private volatile CircuitBreakerConfig config;

    private final ArrayDeque<Outcome> window = new ArrayDeque<>();
    private int windowFailures;

    private CircuitState state = CircuitState.CLOSED;
    private long stateSinceNanos;
    private int probeAttempts;
    private int probeSuccesses;
    private int probeFailures;

    private long attempts;
    private long successes;
    private long failures;
    private long rejections;
    private long timesOpened;

    public SpawnCircuitBreaker(CircuitBreakerConfig config) {
        this(config, MonotonicClock.SYSTEM);
    }

    public SpawnCircuitBreaker(CircuitBreakerConfig config, MonotonicClock clock) {
        this.config = Objects.requireNonNull(config, "config").validated();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.stateSinceNanos = clock.nanoTime();
    }

    public synchronized void recordAttempt() {
        recordAttempts(1);
    }

    public synchronized void recordAttempts(int count) {
        if (count <= 0) {
            return;
        }
        long now = clock.nanoTime();
        advance(now);
        attempts += count;
        if (state == CircuitState.HALF_OPEN) {
            probeAttempts += count;
        }
    }

    public synchronized void recordSuccess() {
        long now = clock.nanoTime();
        advance(now);
        successes++;
        append(now, false);
        if (state == CircuitState.HALF_OPEN) {
            probeSuccesses++;
        }
    }

    public synchronized void recordFailure() {
        long now = clock.nanoTime();
        advance(now);
        failures++;
        append(now, true);
        switch (state) {
            case CLOSED -> {
                CircuitBreakerConfig c = config;
                int total = window.size();
                if (total >= c.minimumSampleSize() && ratePercent(windowFailures, total) > c.openThresholdPercent()) {
                    trip(now, "failure rate " + formatRate(windowFailures, total)
                        + " over " + total + " outcomes exceeded " + c.openThresholdPercent() + "%");
                }
            }
            case HALF_OPEN -> {
                probeFailures++;
                trip(now, "probe failed while half-open");
            }
            case OPEN -> {
                // already open; the cooldown is not extended by late outcomes
            }
        }
    }

    /**
     * Whether a spawn may be admitted now. Half-open admits until the probe budget is spent.
     */
    public synchronized boolean allowSpawn() {
        advance(clock.nanoTime());
        boolean allowed = switch (state) {
            case CLOSED -> true;
            case HALF_OPEN -> probeAttempts < config.halfOpenMaxProbes();
            case OPEN -> false;
        };
        if (!allowed) {
            rejections++;
        }
        return allowed;
    }

    /**
     * Number of spawns that may still be admitted before the breaker must be queried again:
     * unbounded when closed, the unused probe budget when half-open, zero when open.
     */
    public synchronized int remainingAdmissions() {
        advance(clock.nanoTime());
        return switch (state) {
            case CLOSED -> Integer.MAX_VALUE;
            case HALF_OPEN -> Math.max(0, config.halfOpenMaxProbes() - probeAttempts);
            case OPEN -> 0;
        };
    }

    public synchronized CircuitState getState() {
        advance(clock.nanoTime());
        return state;
    }

    /**
     * Failure rate in percent over the rolling failure window; 0 when the window is empty.
     */
    public synchronized double getFailureRate() {
        advance(clock.nanoTime());
        return ratePercent(windowFailures, window.size());
    }

    /**
     * Milliseconds until an open breaker starts probing; 0 in any other state.
     */
    public synchronized long cooldownRemainingMillis() {
        long now = clock.nanoTime();
        advance(now);
        if (state != CircuitState.OPEN) {
            return 0L;
        }
        long remaining = config.cooldownNanos() - (now - stateSinceNanos);
        return Math.max(0L, (remaining + 999_999L) / 1_000_000L);
    }

    public CircuitBreakerConfig config() {
        return config;
    }

    /**
     * Manual override: closes the breaker and forgets every recorded outcome and counter.
     */
    public synchronized void reset() {
        CircuitState previous = state;
        transition(CircuitState.CLOSED, clock.nanoTime());
        window.clear();
        windowFailures = 0;
        attempts = 0L;
        successes = 0L;
        failures = 0L;
        rejections = 0L;
        timesOpened = 0L;
        LOG.info(() -> "spawn circuit breaker reset manually (was " + previous + ")");
    }

    /**
     * Applies new thresholds; the current state and recorded outcomes are kept.
     */
    public synchronized void reconfigure(CircuitBreakerConfig newConfig) {
        this.config = Objects.requireNonNull(newConfig, "newConfig").validated();
        advance(clock.nanoTime());
        LOG.info(() -> "spawn circuit breaker reconfigured: " + newConfig);
    }

    public synchronized Snapshot getMetrics() {
        long now = clock.nanoTime();
        advance(now);
        return new Snapshot(
            state,
            ratePercent(windowFailures, window.size()),
            window.size(),
            attempts,
            successes,
            failures,
            rejections,
            timesOpened,
            Math.max(0L, (now - stateSinceNanos) / 1_000_000L)
        );
    }

    private void advance(long now) {
        prune(now);
        CircuitBreakerConfig c = config;
        if (state == CircuitState.OPEN && now - stateSinceNanos >= c.cooldownNanos()) {
            transition(CircuitState.HALF_OPEN, stateSinceNanos + c.cooldownNanos());
            LOG.info(() -> "spawn circuit breaker half-open: admitting up to " + c.halfOpenMaxProbes() + " probes");
        }
        if (state == CircuitState.HALF_OPEN && now - stateSinceNanos >= c.recoveryWindowNanos()) {
            int probes = probeSuccesses + probeFailures;
            // Close only once every admitted attempt has reported an outcome.
            if (probes > 0 && probes >= probeAttempts && ratePercent(probeFailures, probes) < c.closeThresholdPercent()) {
                int succeeded = probeSuccesses;
                transition(CircuitState.CLOSED, now);
                window.clear();
                windowFailures = 0;
                LOG.info(() -> "spawn circuit breaker closed after recovery window, probes succeeded=" + succeeded);
            }
        }
    }

    private void trip(long now, String why) {
        transition(CircuitState.OPEN, now);
        timesOpened++;
        long cooldown = config.cooldownSeconds();
        LOG.warning(() -> "spawn circuit breaker OPEN: " + why + "; cooling down " + cooldown + "s");
    }

    private void transition(CircuitState next, long atNanos) {
        state = next;
        stateSinceNanos = atNanos;
        probeAttempts = 0;
        probeSuccesses = 0;
        probeFailures = 0;
    }

    private void append(long now, boolean failed) {
        window.addLast(new Outcome(now, failed));
        if (failed) {
            windowFailures++;
        }
    }

    private void prune(long now) {
        long horizon = now - config.failureWindowNanos();
        while (!window.isEmpty() && window.peekFirst().atNanos() < horizon) {
            if (window.pollFirst().failed()) {
                windowFailures--;
            }
        }
    }

    private static double ratePercent(int failed, int total) {
        return total == 0 ? 0.0d : failed * 100.0d / total;
    }

    private static String formatRate(int failed, int total) {
        return String.format("%.1f%%", ratePercent(failed, total));
    }

    private record Outcome(long atNanos, boolean failed) {}

    public record Snapshot(CircuitState state,
                           double failureRatePercent,
                           int windowOutcomes,
                           long attempts,
                           long successes,
                           long failures,
                           long rejections,
                           long timesOpened,
                           long millisInState) {}
}
