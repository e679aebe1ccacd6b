package com.acme.fleet.admission.runtime;

import com.acme.fleet.admission.breaker.SpawnCircuitBreaker;
import com.acme.fleet.admission.config.AdmissionConfig;
import com.acme.fleet.admission.config.RuntimeSettings;
import com.acme.fleet.admission.queue.SpawnPriority;
import com.acme.fleet.admission.queue.SpawnPriorityQueue;
import com.acme.fleet.admission.queue.SpawnRequest;
import com.acme.fleet.admission.resource.ResourceMonitor;
import com.acme.fleet.admission.resource.ResourceSampler;
import com.acme.fleet.admission.startup.StartupSpawnOrchestrator;
import com.acme.fleet.admission.throttle.AdaptiveSpawnThrottler;
import com.acme.fleet.admission.throttle.SpawnFailureReason;
import com.acme.fleet.admission.util.AdmissionDefaults;
import com.acme.fleet.admission.util.MonotonicClock;
import com.acme.fleet.admission.util.RateLimitedLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owner-facing entry point of the admission pipeline.
 *
 * <p>One instance is built at service init and passed to whoever needs it. The Owner
 * enqueues requests from any thread, a single tick driver calls {@link #tick(long)},
 * released requests are collected with {@link #pollNextBatch()} and outcomes come back
 * through {@link #recordOutcome(long, boolean, SpawnFailureReason)}.</p>
 *
 * <p>Between hand-off and outcome a request sits in the in-flight registry. There is no
 * cap on it; requests that stay too long are only reported.</p>
 */
public final class SpawnAdmissionService {
    private static final Logger LOG = Logger.getLogger(SpawnAdmissionService.class.getName());

    private final SpawnPriorityQueue queue;
    private final ResourceMonitor resourceMonitor;
    private final SpawnCircuitBreaker circuitBreaker;
    private final AdaptiveSpawnThrottler throttler;
    private final StartupSpawnOrchestrator orchestrator;
    private final MonotonicClock clock;
    private volatile AdmissionConfig config;

    private final AtomicLong nextRequestId = new AtomicLong();
    private final ConcurrentLinkedQueue<SpawnRequest> awaitingPoll = new ConcurrentLinkedQueue<>();
    private final Map<Long, InFlight> inFlight = new ConcurrentHashMap<>();

    private final LongAdder requested = new LongAdder();
    private final LongAdder cancelled = new LongAdder();
    private final LongAdder outcomesRecorded = new LongAdder();
    private final LongAdder unknownOutcomes = new LongAdder();
    private final LongAdder staleInFlightWarnings = new LongAdder();
    private final LongAdder starvationWarnings = new LongAdder();
    private final RateLimitedLog staleInFlightLog;
    private final RateLimitedLog starvationLog;

    private long sinceDiagnosticsMs;

    public SpawnAdmissionService(AdmissionConfig config, ResourceSampler sampler) {
        this(config, sampler, MonotonicClock.SYSTEM);
    }

    /**
     * @throws com.acme.fleet.admission.config.InvalidConfigurationException when the
     *         configuration is inconsistent; nothing is accepted before that check
     */
    public SpawnAdmissionService(AdmissionConfig config, ResourceSampler sampler, MonotonicClock clock) {
        this.config = Objects.requireNonNull(config, "config").validate();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.queue = new SpawnPriorityQueue();
        this.resourceMonitor = new ResourceMonitor(sampler, config.thresholds(),
            config.runtime().sampleIntervalMs(), clock);
        this.circuitBreaker = new SpawnCircuitBreaker(config.circuitBreaker(), clock);
        this.throttler = new AdaptiveSpawnThrottler(config.throttle(), resourceMonitor, circuitBreaker, clock);
        this.orchestrator = new StartupSpawnOrchestrator(config.startupPlan(), queue, throttler, this::handOff);
        this.staleInFlightLog = new RateLimitedLog(LOG, AdmissionDefaults.DIAGNOSTIC_LOG_INTERVAL_MS, clock);
        this.starvationLog = new RateLimitedLog(LOG, AdmissionDefaults.DIAGNOSTIC_LOG_INTERVAL_MS, clock);
    }

    /**
     * Queues one request for on-demand provisioning.
     *
     * @return the id the outcome must later be reported under
     */
    public long enqueueSpawnRequest(SpawnPriority priority, String reason) {
        SpawnRequest request = newRequest(priority, reason);
        queue.enqueue(request);
        requested.increment();
        return request.requestId();
    }

    /**
     * Re-queues work whose previous attempt failed, under a new id and with
     * {@code retryCount + 1}. Retrying is the Owner's decision; nothing retries on its own.
     */
    public long resubmit(SpawnRequest previous) {
        Objects.requireNonNull(previous, "previous");
        SpawnRequest retry = previous.withRetry(nextRequestId.incrementAndGet(), clock.nanoTime());
        queue.enqueue(retry);
        requested.increment();
        return retry.requestId();
    }

    /**
     * Loads the bulk startup backlog in list order.
     *
     * @return the assigned request ids, in the same order
     */
    public List<Long> enqueueStartupBots(List<PendingSpawn> backlog) {
        List<SpawnRequest> requests = new ArrayList<>(backlog.size());
        List<Long> ids = new ArrayList<>(backlog.size());
        for (PendingSpawn pending : backlog) {
            SpawnRequest request = newRequest(pending.priority(), pending.reason());
            requests.add(request);
            ids.add(request.requestId());
        }
        int accepted = orchestrator.enqueueStartupBots(requests);
        requested.add(accepted);
        return List.copyOf(ids);
    }

    public void beginStartupSequence() {
        orchestrator.beginStartupSequence();
    }

    /**
     * Removes a request that has not been released yet. Released requests cannot be
     * cancelled.
     */
    public boolean cancel(long requestId) {
        boolean removed = queue.removeRequest(requestId);
        if (removed) {
            cancelled.increment();
        }
        return removed;
    }

    /**
     * One admission cycle: sample, advance timers, release at most one batch, run
     * diagnostics when due. Never throws for steady-state conditions.
     *
     * @return the number of requests released on this tick
     */
    public synchronized int tick(long deltaTimeMs) {
        long delta = Math.max(0L, deltaTimeMs);
        resourceMonitor.update(delta);
        throttler.update(delta);
        int released = orchestrator.isStartupComplete()
            ? releaseOnDemand()
            : orchestrator.update(delta);
        sinceDiagnosticsMs += delta;
        if (sinceDiagnosticsMs >= config.runtime().diagnosticsIntervalMs()) {
            sinceDiagnosticsMs = 0L;
            runDiagnostics();
        }
        return released;
    }

    private int releaseOnDemand() {
        if (queue.isEmpty() || !throttler.canSpawnNow()) {
            return 0;
        }
        List<SpawnRequest> batch = queue.drain(SpawnPriority.LOW, throttler.getReleasableBatchSize());
        if (batch.isEmpty()) {
            return 0;
        }
        throttler.recordBatchReleased(batch.size());
        handOff(batch);
        return batch.size();
    }

    private void handOff(List<SpawnRequest> batch) {
        long now = clock.nanoTime();
        for (SpawnRequest request : batch) {
            inFlight.put(request.requestId(), new InFlight(request, now));
            awaitingPoll.add(request);
        }
    }

    /**
     * Takes every request released since the previous poll, oldest release first.
     */
    public List<SpawnRequest> pollNextBatch() {
        List<SpawnRequest> out = new ArrayList<>();
        SpawnRequest next;
        while ((next = awaitingPoll.poll()) != null) {
            out.add(next);
        }
        return out;
    }

    /**
     * Reports how a released request ended.
     *
     * @return {@code false} if the id is not in flight (never released, or already reported)
     */
    public boolean recordOutcome(long requestId, boolean success, SpawnFailureReason failureReason) {
        InFlight entry = inFlight.remove(requestId);
        if (entry == null) {
            unknownOutcomes.increment();
            LOG.fine(() -> "outcome for unknown request id " + requestId + " ignored");
            return false;
        }
        outcomesRecorded.increment();
        if (success) {
            throttler.recordSpawnSuccess(entry.request());
        } else {
            throttler.recordSpawnFailure(entry.request(), failureReason);
        }
        return true;
    }

    private void runDiagnostics() {
        RuntimeSettings settings = config.runtime();
        long now = clock.nanoTime();

        int stale = 0;
        long oldestMs = 0L;
        for (InFlight entry : inFlight.values()) {
            long ageMs = (now - entry.releasedAtNanos()) / 1_000_000L;
            if (ageMs >= settings.inFlightWarnAfterMs()) {
                stale++;
                oldestMs = Math.max(oldestMs, ageMs);
            }
        }
        if (stale > 0) {
            staleInFlightWarnings.increment();
            int count = stale;
            long oldest = oldestMs;
            staleInFlightLog.log(Level.WARNING, () -> count + " spawn requests in flight longer than "
                + settings.inFlightWarnAfterMs() + "ms (oldest " + oldest + "ms), possible owner timeout");
        }

        long lowAgeMs = queue.oldestAgeMillis(SpawnPriority.LOW, now);
        if (lowAgeMs >= settings.starvationWarnAfterMs()) {
            starvationWarnings.increment();
            int lowQueued = queue.getQueueSize(SpawnPriority.LOW);
            starvationLog.log(Level.WARNING, () -> "starvation risk: " + lowQueued
                + " LOW requests queued, oldest waiting " + lowAgeMs + "ms");
        }
    }

    public AdmissionStatus status() {
        return new AdmissionStatus(
            orchestrator.currentPhase(),
            resourceMonitor.getPressureLevel(),
            circuitBreaker.getState(),
            throttler.evaluateGate(),
            queue.getTotalSize(),
            inFlight.size(),
            awaitingPoll.size(),
            throttler.getCurrentBatchSize(),
            throttler.getRecommendedSpawnDelay()
        );
    }

    public String summary() {
        return status().summary();
    }

    public AdmissionMetricsSnapshot metrics() {
        return new AdmissionMetricsSnapshot(
            status(),
            resourceMonitor.getMetrics(),
            queue.snapshot(clock.nanoTime()),
            circuitBreaker.getMetrics(),
            throttler.getMetrics(),
            orchestrator.getMetrics(),
            new AdmissionMetricsSnapshot.ServiceCounters(
                requested.sum(),
                cancelled.sum(),
                inFlight.size(),
                outcomesRecorded.sum(),
                unknownOutcomes.sum(),
                staleInFlightWarnings.sum(),
                starvationWarnings.sum()
            )
        );
    }

    /**
     * Swaps throttle, threshold, breaker and diagnostic settings. Queue contents, breaker
     * state and counters are kept; a new startup plan applies from the next
     * {@link #beginStartupSequence()}. Tick and sampling periods are fixed at construction.
     *
     * @throws com.acme.fleet.admission.config.InvalidConfigurationException when the new
     *         configuration is inconsistent; the current one then stays in force
     */
    public synchronized void reconfigure(AdmissionConfig newConfig) {
        AdmissionConfig validated = Objects.requireNonNull(newConfig, "newConfig").validate();
        throttler.reconfigure(validated.throttle());
        resourceMonitor.reconfigure(validated.thresholds());
        circuitBreaker.reconfigure(validated.circuitBreaker());
        orchestrator.setPlan(validated.startupPlan());
        this.config = validated;
    }

    /**
     * Manual override: closes the breaker and forgets its outcome history.
     */
    public void resetCircuitBreaker() {
        circuitBreaker.reset();
        LOG.info("spawn circuit breaker reset by operator");
    }

    /**
     * Clears cumulative counters. Queue, in-flight registry and breaker state are kept.
     */
    public void resetMetrics() {
        throttler.resetMetrics();
        requested.reset();
        cancelled.reset();
        outcomesRecorded.reset();
        unknownOutcomes.reset();
        staleInFlightWarnings.reset();
        starvationWarnings.reset();
    }

    public AdmissionConfig config() {
        return config;
    }

    public SpawnPriorityQueue queue() {
        return queue;
    }

    public ResourceMonitor resourceMonitor() {
        return resourceMonitor;
    }

    public SpawnCircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    public AdaptiveSpawnThrottler throttler() {
        return throttler;
    }

    public StartupSpawnOrchestrator orchestrator() {
        return orchestrator;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private SpawnRequest newRequest(SpawnPriority priority, String reason) {
        return new SpawnRequest(nextRequestId.incrementAndGet(), priority, clock.nanoTime(), 0, reason);
    }

    private record InFlight(SpawnRequest request, long releasedAtNanos) {}
}
