package com.acme.fleet.admission.startup;

import com.acme.fleet.admission.queue.EnqueueResult;
import com.acme.fleet.admission.queue.SpawnPriorityQueue;
import com.acme.fleet.admission.queue.SpawnRequest;
import com.acme.fleet.admission.throttle.AdaptiveSpawnThrottler;
import com.acme.fleet.admission.throttle.SpawnFailureReason;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives the timed bulk-startup ramp.
 *
 * <p>Phases advance on elapsed time only, never on counts, so total startup duration is
 * bounded by the plan. Each tick the orchestrator asks the throttler's gate, dequeues a
 * batch limited to the active phase's priority ceiling and hands it to the sink. Once
 * {@link SpawnPhase#STEADY_STATE} is reached it stops releasing and spawning becomes
 * purely on-demand.</p>
 *
 * <p>Before {@link #beginStartupSequence()} the orchestrator reports
 * {@code STEADY_STATE}: without a bulk startup there is nothing to ramp.</p>
 */
public final class StartupSpawnOrchestrator {
    private static final Logger LOG = Logger.getLogger(StartupSpawnOrchestrator.class.getName());
    private static final int PHASES = SpawnPhase.values().length;

    private final SpawnPriorityQueue queue;
    private final AdaptiveSpawnThrottler throttler;
    private final SpawnBatchSink sink;
    private volatile StartupPhasePlan plan;

    private StartupPhasePlan activePlan;
    private volatile SpawnPhase phase = SpawnPhase.STEADY_STATE;
    private boolean started;
    private long elapsedMs;
    private long phaseStartMs;
    private int transitions;
    private final long[] dispatched = new long[PHASES];
    private final long[] startedAtMs = new long[PHASES];
    private final long[] endedAtMs = new long[PHASES];

    public StartupSpawnOrchestrator(StartupPhasePlan plan,
                                    SpawnPriorityQueue queue,
                                    AdaptiveSpawnThrottler throttler,
                                    SpawnBatchSink sink) {
        this.plan = Objects.requireNonNull(plan, "plan").validated();
        this.queue = Objects.requireNonNull(queue, "queue");
        this.throttler = Objects.requireNonNull(throttler, "throttler");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.activePlan = this.plan;
        clearPhaseMetrics();
    }

    /**
     * Restarts the ramp at {@link SpawnPhase#IMMEDIATE} with the latest plan.
     */
    public synchronized void beginStartupSequence() {
        activePlan = plan;
        started = true;
        elapsedMs = 0L;
        phaseStartMs = 0L;
        transitions = 0;
        clearPhaseMetrics();
        enter(SpawnPhase.IMMEDIATE, 0L);
        LOG.info(() -> "startup sequence begun: planned duration " + activePlan.totalDurationMs() + "ms, "
            + queue.getTotalSize() + " requests queued");
        // zero-length phases end at once
        advancePhases();
    }

    /**
     * Bulk-loads the initial backlog. Requests whose id is already queued are skipped.
     *
     * @return the number of requests accepted
     */
    public int enqueueStartupBots(List<SpawnRequest> requests) {
        int accepted = 0;
        for (SpawnRequest request : requests) {
            EnqueueResult result = queue.enqueue(request);
            if (result.accepted()) {
                accepted++;
            }
        }
        int skipped = requests.size() - accepted;
        if (skipped > 0) {
            LOG.warning("startup backlog: skipped " + skipped + " duplicate request ids");
        }
        int total = accepted;
        LOG.fine(() -> "startup backlog loaded: " + total + " requests");
        return accepted;
    }

    /**
     * Advances the phase clock by {@code deltaTimeMs} and, while still ramping, releases at
     * most one batch.
     *
     * @return the number of requests handed to the sink on this tick
     */
    public synchronized int update(long deltaTimeMs) {
        if (!started || phase.isTerminal()) {
            return 0;
        }
        elapsedMs += Math.max(0L, deltaTimeMs);
        advancePhases();
        if (phase.isTerminal() || !throttler.canSpawnNow()) {
            return 0;
        }
        int size = throttler.getReleasableBatchSize();
        List<SpawnRequest> batch = queue.drain(phase.priorityCeiling(), size);
        if (batch.isEmpty()) {
            return 0;
        }
        throttler.recordBatchReleased(batch.size());
        dispatched[phase.ordinal()] += batch.size();
        handOff(batch);
        return batch.size();
    }

    private void handOff(List<SpawnRequest> batch) {
        try {
            sink.accept(batch);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "startup batch hand-off failed, " + batch.size() + " requests marked failed", e);
            for (SpawnRequest request : batch) {
                throttler.recordSpawnFailure(request, SpawnFailureReason.HANDLER_ERROR);
            }
        }
    }

    private void advancePhases() {
        while (!phase.isTerminal()) {
            long end = phaseStartMs + activePlan.settingsFor(phase).durationMs();
            if (elapsedMs < end) {
                return;
            }
            SpawnPhase ending = phase;
            endedAtMs[ending.ordinal()] = end;
            PhaseSettings settings = activePlan.settingsFor(ending);
            long count = dispatched[ending.ordinal()];
            LOG.info(() -> "startup phase " + ending + " ended at " + end + "ms: dispatched "
                + count + "/" + settings.targetCount()
                + (count < settings.targetCount() ? " (target not reached)" : ""));
            transitions++;
            enter(ending.next(), end);
        }
    }

    private void enter(SpawnPhase next, long atMs) {
        phase = next;
        phaseStartMs = atMs;
        startedAtMs[next.ordinal()] = atMs;
        throttler.setPhaseMultiplier(activePlan.settingsFor(next).rateMultiplier());
        if (next.isTerminal()) {
            LOG.info(() -> "startup complete at " + atMs + "ms, switching to on-demand spawning");
        } else {
            LOG.info(() -> "startup phase " + next + " entered at " + atMs + "ms, draining "
                + next.priorityCeiling() + " and above");
        }
    }

    private void clearPhaseMetrics() {
        Arrays.fill(dispatched, 0L);
        Arrays.fill(startedAtMs, -1L);
        Arrays.fill(endedAtMs, -1L);
    }

    public boolean isStartupComplete() {
        return phase.isTerminal();
    }

    public SpawnPhase currentPhase() {
        return phase;
    }

    public synchronized boolean isStarted() {
        return started;
    }

    public synchronized long elapsedMillis() {
        return elapsedMs;
    }

    /**
     * Replaces the plan used by the next {@link #beginStartupSequence()}; a running ramp
     * keeps its plan.
     */
    public void setPlan(StartupPhasePlan newPlan) {
        this.plan = Objects.requireNonNull(newPlan, "newPlan").validated();
    }

    public synchronized StartupMetrics getMetrics() {
        List<StartupMetrics.PhaseMetrics> phases = new ArrayList<>(PHASES - 1);
        long total = 0L;
        for (SpawnPhase p : SpawnPhase.values()) {
            total += dispatched[p.ordinal()];
            if (p.isTerminal()) {
                continue;
            }
            phases.add(new StartupMetrics.PhaseMetrics(
                p,
                activePlan.settingsFor(p).targetCount(),
                dispatched[p.ordinal()],
                startedAtMs[p.ordinal()],
                endedAtMs[p.ordinal()]
            ));
        }
        return new StartupMetrics(phase, started, elapsedMs, transitions, total, List.copyOf(phases));
    }
}
