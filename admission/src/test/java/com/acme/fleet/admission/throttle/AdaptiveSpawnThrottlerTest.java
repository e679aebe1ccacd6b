package com.acme.fleet.admission.throttle;

import com.acme.fleet.admission.breaker.CircuitBreakerConfig;
import com.acme.fleet.admission.breaker.SpawnCircuitBreaker;
import com.acme.fleet.admission.queue.SpawnPriority;
import com.acme.fleet.admission.queue.SpawnRequest;
import com.acme.fleet.admission.resource.ResourceMonitor;
import com.acme.fleet.admission.resource.ResourceThresholds;
import com.acme.fleet.admission.resource.StubResourceSampler;
import com.acme.fleet.admission.util.ManualClock;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdaptiveSpawnThrottlerTest {
    private static final SpawnRequest REQUEST = new SpawnRequest(1L, SpawnPriority.NORMAL, 0L, 0, "test");

    private final ManualClock clock = new ManualClock();
    private final StubResourceSampler sampler = new StubResourceSampler().cpu(20.0d).memory(30.0d);
    private final ResourceMonitor monitor = new ResourceMonitor(sampler, ResourceThresholds.defaults(), 0L, clock);
    private final SpawnCircuitBreaker breaker = new SpawnCircuitBreaker(CircuitBreakerConfig.defaults(), clock);

    private AdaptiveSpawnThrottler throttler(ThrottleConfig config) {
        monitor.update(0L);
        return new AdaptiveSpawnThrottler(config, monitor, breaker, clock);
    }

    private static ThrottleConfig config(boolean adaptive, boolean breakerEnabled, int burstMax) {
        return new ThrottleConfig(1, 50, 10, 100L, 5_000L, 1.0d, adaptive, breakerEnabled, true, 10, burstMax);
    }

    @Test
    void shouldClampBatchSizeForExtremeMultipliers() {
        ThrottleConfig c = ThrottleConfig.defaults();
        assertEquals(1, AdaptiveSpawnThrottler.computeBatchSize(c, 0.0d, 1.0d, 1.0d));
        assertEquals(1, AdaptiveSpawnThrottler.computeBatchSize(c, Double.NaN, 1.0d, 1.0d));
        assertEquals(1, AdaptiveSpawnThrottler.computeBatchSize(c, -3.0d, 1.0d, 1.0d));
        assertEquals(50, AdaptiveSpawnThrottler.computeBatchSize(c, 5.0d, 3.0d, 1.0d));
        assertEquals(50, AdaptiveSpawnThrottler.computeBatchSize(c, Double.POSITIVE_INFINITY, 1.0d, 1.0d));
        for (double m = 0.0d; m <= 10.0d; m += 0.25d) {
            int size = AdaptiveSpawnThrottler.computeBatchSize(c, m, m, 1.0d);
            assertTrue(size >= c.minBatchSize() && size <= c.maxBatchSize(), "out of range at " + m);
        }
    }

    @Test
    void shouldComputeBaseBatchAtNominalLoad() {
        AdaptiveSpawnThrottler throttler = throttler(ThrottleConfig.defaults());
        assertEquals(10, throttler.getCurrentBatchSize());

        throttler.setPhaseMultiplier(1.5d);
        assertEquals(15, throttler.getCurrentBatchSize());

        throttler.setPhaseMultiplier(0.0d);
        assertEquals(1.0d, throttler.phaseMultiplier());
    }

    @Test
    void shouldShrinkBatchUnderPressure() {
        sampler.cpu(80.0d);
        AdaptiveSpawnThrottler throttler = throttler(ThrottleConfig.defaults());
        // HIGH pressure: 10 * 0.4
        assertEquals(4, throttler.getCurrentBatchSize());
        assertEquals(250L, throttler.currentIntervalMs());
    }

    @Test
    void shouldEaseFailureMultiplierTowardsFloor() {
        assertEquals(1.0d, AdaptiveSpawnThrottler.failureMultiplier(0.0d, 30.0d));
        assertEquals(0.775d, AdaptiveSpawnThrottler.failureMultiplier(15.0d, 30.0d), 1e-9);
        assertEquals(0.1d, AdaptiveSpawnThrottler.failureMultiplier(30.0d, 30.0d), 1e-9);
        assertEquals(0.1d, AdaptiveSpawnThrottler.failureMultiplier(90.0d, 30.0d), 1e-9);
        double previous = 1.0d;
        for (double rate = 0.0d; rate <= 40.0d; rate += 1.0d) {
            double m = AdaptiveSpawnThrottler.failureMultiplier(rate, 30.0d);
            assertTrue(m <= previous);
            previous = m;
        }
    }

    @Test
    void shouldSlowDownBeforeBreakerOpens() {
        AdaptiveSpawnThrottler throttler = throttler(ThrottleConfig.defaults());
        for (int i = 0; i < 10; i++) {
            throttler.recordSpawnSuccess(REQUEST);
        }
        for (int i = 0; i < 5; i++) {
            throttler.recordSpawnFailure(REQUEST, SpawnFailureReason.LOGIN_FAILED);
        }
        // 33% failures, still below the minimum sample size
        assertTrue(breaker.allowSpawn());
        assertEquals(0.1d, throttler.failureMultiplier(), 1e-9);
        assertEquals(1, throttler.getCurrentBatchSize());
    }

    @Test
    void shouldCloseGateUnderCriticalPressure() {
        sampler.cpu(95.0d);
        AdaptiveSpawnThrottler throttler = throttler(ThrottleConfig.defaults());

        assertEquals(ThrottleReason.CRITICAL_PRESSURE, throttler.evaluateGate());
        assertFalse(throttler.canSpawnNow());
        assertEquals(1L, throttler.getMetrics().gateDenials().get(ThrottleReason.CRITICAL_PRESSURE));
        assertEquals("throttled: critical resource pressure", throttler.evaluateGate().diagnostic());
    }

    @Test
    void shouldCloseGateWhileBreakerOpenUnlessBreakerDisabled() {
        AdaptiveSpawnThrottler throttler = throttler(ThrottleConfig.defaults());
        tripBreaker(throttler);
        assertEquals(ThrottleReason.CIRCUIT_OPEN, throttler.evaluateGate());
        assertEquals(30_000L, throttler.getRecommendedSpawnDelay());
        assertEquals(0, throttler.getReleasableBatchSize());

        throttler.reconfigure(config(true, false, 500));
        assertEquals(ThrottleReason.NONE, throttler.evaluateGate());
        assertTrue(throttler.getReleasableBatchSize() > 0);
    }

    @Test
    void shouldSpendProbeBudgetWhileHalfOpen() {
        AdaptiveSpawnThrottler throttler = throttler(ThrottleConfig.defaults());
        tripBreaker(throttler);
        clock.advanceSeconds(30L);

        assertEquals(ThrottleReason.NONE, throttler.evaluateGate());
        assertEquals(5, breaker.remainingAdmissions());
        // the failure window still holds the tripping failures
        assertEquals(1, throttler.getReleasableBatchSize());
        throttler.recordBatchReleased(5);
        throttler.update(1_000L);

        assertEquals(ThrottleReason.PROBE_BUDGET_SPENT, throttler.evaluateGate());
    }

    @Test
    void shouldCountBreakerRejectionsOnCountedGateChecks() {
        AdaptiveSpawnThrottler throttler = throttler(ThrottleConfig.defaults());
        tripBreaker(throttler);

        assertEquals(ThrottleReason.CIRCUIT_OPEN, throttler.evaluateGate());
        assertEquals(0L, breaker.getMetrics().rejections());

        assertFalse(throttler.canSpawnNow());
        assertFalse(throttler.canSpawnNow());
        assertEquals(2L, breaker.getMetrics().rejections());
        assertEquals(2L, throttler.getMetrics().gateDenials().get(ThrottleReason.CIRCUIT_OPEN));

        clock.advanceSeconds(30L);
        throttler.recordBatchReleased(5);
        throttler.update(1_000L);
        assertFalse(throttler.canSpawnNow());
        assertEquals(3L, breaker.getMetrics().rejections());
        assertEquals(1L, throttler.getMetrics().gateDenials().get(ThrottleReason.PROBE_BUDGET_SPENT));
    }

    @Test
    void shouldWaitForBatchInterval() {
        AdaptiveSpawnThrottler throttler = throttler(ThrottleConfig.defaults());
        assertTrue(throttler.canSpawnNow());
        assertEquals(0L, throttler.getRecommendedSpawnDelay());

        throttler.recordBatchReleased(10);
        assertEquals(ThrottleReason.BATCH_INTERVAL, throttler.evaluateGate());
        assertEquals(100L, throttler.getRecommendedSpawnDelay());

        throttler.update(40L);
        assertEquals(60L, throttler.getRecommendedSpawnDelay());
        throttler.update(59L);
        assertFalse(throttler.canSpawnNow());
        throttler.update(1L);
        assertTrue(throttler.canSpawnNow());
    }

    @Test
    void shouldLimitReleasesInsideBurstWindow() {
        AdaptiveSpawnThrottler throttler = throttler(config(true, true, 15));
        throttler.recordBatchReleased(10);
        throttler.update(100L);

        assertEquals(5, throttler.getReleasableBatchSize());
        throttler.recordBatchReleased(5);
        throttler.update(100L);
        assertEquals(ThrottleReason.BURST_LIMIT, throttler.evaluateGate());

        clock.advanceSeconds(10L);
        assertEquals(ThrottleReason.NONE, throttler.evaluateGate());
        assertEquals(10, throttler.getReleasableBatchSize());
    }

    @Test
    void shouldIgnoreLoadSignalsWhenNotAdaptive() {
        sampler.cpu(80.0d);
        AdaptiveSpawnThrottler throttler = throttler(config(false, true, 500));
        throttler.setPhaseMultiplier(1.5d);

        assertEquals(10, throttler.getCurrentBatchSize());
        assertEquals(100L, throttler.currentIntervalMs());
    }

    @Test
    void shouldCountOutcomesAndForwardThemToBreaker() {
        AdaptiveSpawnThrottler throttler = throttler(ThrottleConfig.defaults());
        throttler.recordBatchReleased(3);
        throttler.recordSpawnSuccess(REQUEST);
        throttler.recordSpawnFailure(REQUEST, SpawnFailureReason.TIMEOUT);
        throttler.recordSpawnFailure(REQUEST, null);

        ThrottleMetrics metrics = throttler.getMetrics();
        assertEquals(3L, metrics.released());
        assertEquals(1L, metrics.batches());
        assertEquals(3, metrics.lastBatchSize());
        assertEquals(1L, metrics.successes());
        assertEquals(2L, metrics.failures());
        assertEquals(1L, metrics.failuresByReason().get(SpawnFailureReason.TIMEOUT));
        assertEquals(1L, metrics.failuresByReason().get(SpawnFailureReason.UNKNOWN));
        assertEquals(3L, breaker.getMetrics().attempts());
        assertEquals(2L, breaker.getMetrics().failures());

        throttler.resetMetrics();
        assertEquals(0L, throttler.getMetrics().released());
        assertTrue(throttler.getMetrics().failuresByReason().isEmpty());
    }

    private void tripBreaker(AdaptiveSpawnThrottler throttler) {
        for (int i = 0; i < CircuitBreakerConfig.defaults().minimumSampleSize(); i++) {
            throttler.recordSpawnFailure(REQUEST, SpawnFailureReason.SESSION_CREATE_FAILED);
        }
    }
}
