package com.acme.fleet.admission.runtime;

import com.acme.fleet.admission.breaker.CircuitState;
import com.acme.fleet.admission.config.AdmissionConfig;
import com.acme.fleet.admission.config.InvalidConfigurationException;
import com.acme.fleet.admission.config.RuntimeSettings;
import com.acme.fleet.admission.queue.SpawnPriority;
import com.acme.fleet.admission.queue.SpawnRequest;
import com.acme.fleet.admission.resource.StubResourceSampler;
import com.acme.fleet.admission.startup.SpawnPhase;
import com.acme.fleet.admission.throttle.SpawnFailureReason;
import com.acme.fleet.admission.throttle.ThrottleConfig;
import com.acme.fleet.admission.throttle.ThrottleReason;
import com.acme.fleet.admission.util.ManualClock;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpawnAdmissionServiceTest {
    private final ManualClock clock = new ManualClock();
    private final StubResourceSampler sampler = new StubResourceSampler().cpu(20.0d).memory(30.0d);

    static AdmissionConfig testConfig() {
        return AdmissionConfig.defaults().withRuntime(new RuntimeSettings(
            50L, 0L, false, 30_000L, 60_000L, 5_000L, false, 30, false, 0, "/metrics"));
    }

    private SpawnAdmissionService service() {
        return new SpawnAdmissionService(testConfig(), sampler, clock);
    }

    @Test
    void shouldReleaseQueuedRequestsInPriorityOrder() {
        SpawnAdmissionService service = service();
        long low = service.enqueueSpawnRequest(SpawnPriority.LOW, "zone fill");
        long critical = service.enqueueSpawnRequest(SpawnPriority.CRITICAL, "group invite");
        long normal = service.enqueueSpawnRequest(SpawnPriority.NORMAL, "population");

        assertEquals(3, service.tick(0L));

        List<SpawnRequest> batch = service.pollNextBatch();
        assertEquals(List.of(critical, normal, low), batch.stream().map(SpawnRequest::requestId).toList());
        assertTrue(service.pollNextBatch().isEmpty());
        assertEquals(3, service.inFlightCount());
        assertEquals(0, service.queue().getTotalSize());
    }

    @Test
    void shouldAcceptEachOutcomeOnce() {
        SpawnAdmissionService service = service();
        long id = service.enqueueSpawnRequest(SpawnPriority.HIGH, "test");
        service.tick(0L);
        service.pollNextBatch();

        assertTrue(service.recordOutcome(id, true, null));
        assertFalse(service.recordOutcome(id, true, null));
        assertFalse(service.recordOutcome(12_345L, false, SpawnFailureReason.TIMEOUT));

        AdmissionMetricsSnapshot.ServiceCounters counters = service.metrics().service();
        assertEquals(1L, counters.outcomesRecorded());
        assertEquals(2L, counters.unknownOutcomes());
        assertEquals(1L, service.metrics().throttle().successes());
        assertEquals(0, service.inFlightCount());
    }

    @Test
    void shouldCancelOnlyBeforeRelease() {
        SpawnAdmissionService service = service();
        long first = service.enqueueSpawnRequest(SpawnPriority.NORMAL, "a");
        long second = service.enqueueSpawnRequest(SpawnPriority.NORMAL, "b");

        assertTrue(service.cancel(second));
        assertFalse(service.cancel(second));
        service.tick(0L);
        assertFalse(service.cancel(first));

        assertEquals(1L, service.metrics().service().cancelled());
        assertEquals(List.of(first), service.pollNextBatch().stream().map(SpawnRequest::requestId).toList());
    }

    @Test
    void shouldReleaseOnlyCriticalDuringImmediatePhase() {
        SpawnAdmissionService service = service();
        List<Long> ids = service.enqueueStartupBots(List.of(
            new PendingSpawn(SpawnPriority.LOW, "fill"),
            new PendingSpawn(SpawnPriority.CRITICAL, "raid"),
            new PendingSpawn(SpawnPriority.HIGH, "dungeon")));
        service.beginStartupSequence();

        assertEquals(1, service.tick(0L));

        assertEquals(List.of(ids.get(1)), service.pollNextBatch().stream().map(SpawnRequest::requestId).toList());
        assertEquals(SpawnPhase.IMMEDIATE, service.status().phase());
        assertEquals(2, service.queue().getTotalSize());
        assertEquals(3L, service.metrics().service().requested());
    }

    @Test
    void shouldHoldEverythingUnderCriticalPressure() {
        sampler.cpu(95.0d);
        SpawnAdmissionService service = service();
        service.enqueueSpawnRequest(SpawnPriority.CRITICAL, "urgent");

        assertEquals(0, service.tick(50L));

        AdmissionStatus status = service.status();
        assertEquals(ThrottleReason.CRITICAL_PRESSURE, status.throttleReason());
        assertTrue(status.throttled());
        assertEquals("phase=STEADY_STATE pressure=CRITICAL circuit=CLOSED queue=1 inflight=0 batch=1"
            + " throttled: critical resource pressure", service.summary());
    }

    @Test
    void shouldStopReleasingOnceBreakerOpens() {
        SpawnAdmissionService service = service();
        for (int i = 0; i < 40; i++) {
            service.enqueueSpawnRequest(SpawnPriority.NORMAL, "bulk");
        }
        for (int i = 0; i < 100 && service.circuitBreaker().getState() == CircuitState.CLOSED; i++) {
            service.tick(100L);
            for (SpawnRequest request : service.pollNextBatch()) {
                service.recordOutcome(request.requestId(), false, SpawnFailureReason.LOGIN_FAILED);
            }
        }
        assertEquals(CircuitState.OPEN, service.circuitBreaker().getState());
        int queued = service.queue().getTotalSize();
        assertTrue(queued > 0);

        assertEquals(0, service.tick(100L));
        assertEquals(ThrottleReason.CIRCUIT_OPEN, service.status().throttleReason());
        assertEquals(queued, service.queue().getTotalSize());
        assertEquals(30_000L, service.status().recommendedDelayMs());

        service.resetCircuitBreaker();
        assertEquals(CircuitState.CLOSED, service.status().circuitState());
        assertTrue(service.tick(100L) > 0);
    }

    @Test
    void shouldReportBreakerRejectionsWhileOpen() {
        SpawnAdmissionService service = service();
        for (int i = 0; i < 60; i++) {
            service.enqueueSpawnRequest(SpawnPriority.NORMAL, "bulk");
        }
        for (int i = 0; i < 100 && service.circuitBreaker().getState() == CircuitState.CLOSED; i++) {
            service.tick(100L);
            for (SpawnRequest request : service.pollNextBatch()) {
                service.recordOutcome(request.requestId(), false, SpawnFailureReason.LOGIN_FAILED);
            }
        }
        assertEquals(CircuitState.OPEN, service.circuitBreaker().getState());
        long before = service.metrics().breaker().rejections();

        for (int i = 0; i < 20; i++) {
            assertEquals(0, service.tick(100L));
        }

        assertEquals(before + 20L, service.metrics().breaker().rejections());
        assertEquals(20L, service.metrics().throttle().gateDenials().get(ThrottleReason.CIRCUIT_OPEN));
    }

    @Test
    void shouldWarnAboutStarvingLowTier() {
        sampler.cpu(95.0d);
        SpawnAdmissionService service = service();
        service.enqueueSpawnRequest(SpawnPriority.LOW, "background");
        service.tick(0L);

        clock.advanceSeconds(61L);
        service.tick(5_000L);

        assertEquals(1L, service.metrics().service().starvationWarnings());
        assertEquals(0L, service.metrics().service().staleInFlightWarnings());
    }

    @Test
    void shouldWarnAboutStaleInFlightRequests() {
        SpawnAdmissionService service = service();
        service.enqueueSpawnRequest(SpawnPriority.HIGH, "slow owner");
        service.tick(0L);
        service.pollNextBatch();

        clock.advanceSeconds(10L);
        service.tick(5_000L);
        assertEquals(0L, service.metrics().service().staleInFlightWarnings());

        clock.advanceSeconds(25L);
        service.tick(5_000L);
        assertEquals(1L, service.metrics().service().staleInFlightWarnings());
        assertEquals(1, service.inFlightCount());
    }

    @Test
    void shouldApplyValidReconfigurationOnly() {
        SpawnAdmissionService service = service();
        AdmissionConfig before = service.config();
        AdmissionConfig invalid = before.withThrottle(
            new ThrottleConfig(10, 5, 10, 100L, 5_000L, 1.0d, true, true, true, 10, 500));

        assertThrows(InvalidConfigurationException.class, () -> service.reconfigure(invalid));
        assertSame(before, service.config());

        service.reconfigure(before.withThrottle(
            new ThrottleConfig(1, 3, 10, 100L, 5_000L, 1.0d, true, true, true, 10, 500)));
        for (int i = 0; i < 10; i++) {
            service.enqueueSpawnRequest(SpawnPriority.NORMAL, "bulk");
        }
        assertEquals(3, service.tick(0L));
        assertEquals(3, service.config().throttle().maxBatchSize());
    }

    @Test
    void shouldRejectInvalidConfigurationAtConstruction() {
        AdmissionConfig invalid = testConfig().withThrottle(
            new ThrottleConfig(0, 50, 10, 100L, 5_000L, 1.0d, true, true, true, 10, 500));

        assertThrows(InvalidConfigurationException.class, () -> new SpawnAdmissionService(invalid, sampler, clock));
    }

    @Test
    void shouldResubmitUnderNewIdWithRetryCount() {
        SpawnAdmissionService service = service();
        long id = service.enqueueSpawnRequest(SpawnPriority.HIGH, "retry me");
        service.tick(0L);
        SpawnRequest released = service.pollNextBatch().get(0);
        service.recordOutcome(id, false, SpawnFailureReason.WORKER_NOT_CREATED);

        long retryId = service.resubmit(released);

        assertNotEquals(id, retryId);
        SpawnRequest queued = service.queue().peekTier(SpawnPriority.HIGH).get(0);
        assertEquals(retryId, queued.requestId());
        assertEquals(1, queued.retryCount());
        assertEquals("retry me", queued.reason());
        assertEquals(2L, service.metrics().service().requested());
    }

    @Test
    void shouldResetCountersButKeepQueue() {
        SpawnAdmissionService service = service();
        service.enqueueSpawnRequest(SpawnPriority.NORMAL, "x");
        service.enqueueSpawnRequest(SpawnPriority.NORMAL, "y");
        service.tick(0L);
        service.enqueueSpawnRequest(SpawnPriority.NORMAL, "z");

        AdmissionMetricsSnapshot metrics = service.metrics();
        assertEquals(3L, metrics.service().requested());
        assertEquals(2L, metrics.throttle().released());
        assertEquals(1, metrics.queue().total());

        service.resetMetrics();
        assertEquals(0L, service.metrics().service().requested());
        assertEquals(0L, service.metrics().throttle().released());
        assertEquals(1, service.queue().getTotalSize());
        assertEquals(2, service.inFlightCount());
    }
}
