package com.acme.fleet.admission.breaker;

import com.acme.fleet.admission.config.InvalidConfigurationException;
import com.acme.fleet.admission.util.ManualClock;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpawnCircuitBreakerTest {
    private final ManualClock clock = new ManualClock();

    private static CircuitBreakerConfig config(double openPercent, double closePercent, int minSample) {
        return new CircuitBreakerConfig(openPercent, closePercent, 30, 10, 60, minSample, 5);
    }

    @Test
    void shouldOpenWhenFailureRateExceedsThreshold() {
        SpawnCircuitBreaker breaker = new SpawnCircuitBreaker(config(10.0d, 5.0d, 20), clock);

        for (int i = 0; i < 30; i++) {
            breaker.recordAttempt();
            if (i % 6 == 0) {
                breaker.recordSuccess();
            } else {
                breaker.recordFailure();
            }
            clock.advanceMillis(100L);
        }

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertFalse(breaker.allowSpawn());
        SpawnCircuitBreaker.Snapshot metrics = breaker.getMetrics();
        assertEquals(1L, metrics.timesOpened());
        assertEquals(30L, metrics.attempts());
        assertEquals(25L, metrics.failures());
    }

    @Test
    void shouldStayClosedBelowMinimumSampleSize() {
        SpawnCircuitBreaker breaker = new SpawnCircuitBreaker(config(10.0d, 5.0d, 20), clock);
        for (int i = 0; i < 19; i++) {
            breaker.recordFailure();
        }
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(100.0d, breaker.getFailureRate());
        assertTrue(breaker.allowSpawn());

        breaker.recordFailure();
        assertEquals(CircuitState.OPEN, breaker.getState());
    }

    @Test
    void shouldForgetOutcomesOlderThanFailureWindow() {
        SpawnCircuitBreaker breaker = new SpawnCircuitBreaker(config(10.0d, 5.0d, 20), clock);
        for (int i = 0; i < 10; i++) {
            breaker.recordFailure();
        }
        clock.advanceSeconds(61L);
        assertEquals(0.0d, breaker.getFailureRate());

        for (int i = 0; i < 19; i++) {
            breaker.recordSuccess();
        }
        breaker.recordFailure();
        assertEquals(CircuitState.CLOSED, breaker.getState());
    }

    @Test
    void shouldRefuseForWholeCooldownEvenWithSuccessesRecorded() {
        SpawnCircuitBreaker breaker = tripped();

        for (int i = 0; i < 100; i++) {
            breaker.recordSuccess();
        }
        clock.advanceMillis(29_999L);
        assertFalse(breaker.allowSpawn());
        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(1L, breaker.cooldownRemainingMillis());

        clock.advanceMillis(1L);
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertTrue(breaker.allowSpawn());
        assertEquals(0L, breaker.cooldownRemainingMillis());
    }

    @Test
    void shouldLimitProbesWhileHalfOpen() {
        SpawnCircuitBreaker breaker = tripped();
        clock.advanceSeconds(30L);

        assertEquals(5, breaker.remainingAdmissions());
        breaker.recordAttempts(3);
        assertEquals(2, breaker.remainingAdmissions());
        breaker.recordAttempts(2);
        assertEquals(0, breaker.remainingAdmissions());
        assertFalse(breaker.allowSpawn());
    }

    @Test
    void shouldReopenOnAnyHalfOpenFailure() {
        SpawnCircuitBreaker breaker = tripped();
        clock.advanceSeconds(30L);
        breaker.recordAttempt();

        breaker.recordFailure();

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(30_000L, breaker.cooldownRemainingMillis());
        assertEquals(2L, breaker.getMetrics().timesOpened());
    }

    @Test
    void shouldCloseAfterHealthyRecoveryWindow() {
        SpawnCircuitBreaker breaker = tripped();
        clock.advanceSeconds(30L);
        breaker.recordAttempts(2);
        breaker.recordSuccess();
        breaker.recordSuccess();

        clock.advanceSeconds(9L);
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        clock.advanceSeconds(1L);
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(0.0d, breaker.getFailureRate());
        assertEquals(Integer.MAX_VALUE, breaker.remainingAdmissions());
    }

    @Test
    void shouldStayHalfOpenWhileTrialSpawnsAreInFlight() {
        SpawnCircuitBreaker breaker = tripped();
        clock.advanceSeconds(30L);
        breaker.recordAttempts(5);

        clock.advanceSeconds(10L);
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertEquals(0, breaker.remainingAdmissions());
        assertFalse(breaker.allowSpawn());

        breaker.recordFailure();
        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(2L, breaker.getMetrics().timesOpened());
    }

    @Test
    void shouldCloseOnlyAfterEveryAdmittedAttemptReports() {
        SpawnCircuitBreaker breaker = tripped();
        clock.advanceSeconds(30L);
        breaker.recordAttempts(3);
        breaker.recordSuccess();
        breaker.recordSuccess();

        clock.advanceSeconds(15L);
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());

        breaker.recordSuccess();
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertTrue(breaker.allowSpawn());
    }

    @Test
    void shouldNotSkipHalfOpenWhenLeftIdle() {
        SpawnCircuitBreaker breaker = tripped();

        clock.advanceSeconds(600L);

        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertEquals(5, breaker.remainingAdmissions());
    }

    @Test
    void shouldResetToClosedAndClearCounters() {
        SpawnCircuitBreaker breaker = tripped();

        breaker.reset();

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertTrue(breaker.allowSpawn());
        SpawnCircuitBreaker.Snapshot metrics = breaker.getMetrics();
        assertEquals(0L, metrics.failures());
        assertEquals(0L, metrics.timesOpened());
        assertEquals(0, metrics.windowOutcomes());
    }

    @Test
    void shouldCountRejectedAdmissions() {
        SpawnCircuitBreaker breaker = tripped();
        breaker.allowSpawn();
        breaker.allowSpawn();
        assertEquals(2L, breaker.getMetrics().rejections());
    }

    @Test
    void shouldRejectCloseThresholdAboveOpenThreshold() {
        assertThrows(InvalidConfigurationException.class,
            () -> new SpawnCircuitBreaker(config(10.0d, 20.0d, 20), clock));
    }

    private SpawnCircuitBreaker tripped() {
        SpawnCircuitBreaker breaker = new SpawnCircuitBreaker(config(30.0d, 10.0d, 5), clock);
        for (int i = 0; i < 5; i++) {
            breaker.recordFailure();
        }
        assertEquals(CircuitState.OPEN, breaker.getState());
        return breaker;
    }
}
