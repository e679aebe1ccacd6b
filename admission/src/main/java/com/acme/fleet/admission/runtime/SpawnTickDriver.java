package com.acme.fleet.admission.runtime;

import com.acme.fleet.admission.queue.SpawnRequest;
import com.acme.fleet.admission.throttle.SpawnFailureReason;
import com.acme.fleet.admission.util.MonotonicClock;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-threaded tick loop around a {@link SpawnAdmissionService}.
 *
 * <p>Every period the driver ticks the service with the measured elapsed time and hands
 * each released request to the {@link SpawnHandler}. Outcomes are routed back through
 * {@link SpawnAdmissionService#recordOutcome}, from whichever thread completes them.</p>
 */
public final class SpawnTickDriver implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(SpawnTickDriver.class.getName());
    private static final long SHUTDOWN_TIMEOUT_MS = 2_000L;

    private final SpawnAdmissionService service;
    private final SpawnHandler handler;
    private final long tickPeriodMs;
    private final MonotonicClock clock;
    private final EventExecutor executor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> tickFuture;

    // tick thread only
    private long lastTickNanos;
    private boolean ticked;

    private final LongAdder ticks = new LongAdder();
    private final LongAdder dispatched = new LongAdder();
    private final LongAdder handlerErrors = new LongAdder();

    public SpawnTickDriver(SpawnAdmissionService service, SpawnHandler handler, long tickPeriodMs) {
        this(service, handler, tickPeriodMs, MonotonicClock.SYSTEM);
    }

    SpawnTickDriver(SpawnAdmissionService service, SpawnHandler handler, long tickPeriodMs, MonotonicClock clock) {
        this.service = Objects.requireNonNull(service, "service");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.tickPeriodMs = Math.max(1L, tickPeriodMs);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.executor = new DefaultEventExecutor(new DefaultThreadFactory("spawn-tick", true));
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        tickFuture = executor.scheduleAtFixedRate(this::tickOnce, 0L, tickPeriodMs, TimeUnit.MILLISECONDS);
        LOG.info(() -> "spawn tick driver started, period " + tickPeriodMs + "ms");
    }

    /**
     * One cycle. Exceptions are logged and swallowed here so a single bad tick cannot
     * cancel the schedule.
     */
    void tickOnce() {
        try {
            service.tick(elapsedSinceLastTickMs());
            ticks.increment();
            List<SpawnRequest> batch = service.pollNextBatch();
            for (SpawnRequest request : batch) {
                dispatch(request);
            }
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "spawn tick failed", e);
        }
    }

    private long elapsedSinceLastTickMs() {
        long now = clock.nanoTime();
        if (!ticked) {
            ticked = true;
            lastTickNanos = now;
            return 0L;
        }
        long deltaMs = Math.max(0L, (now - lastTickNanos) / 1_000_000L);
        // carry the sub-millisecond remainder into the next tick
        lastTickNanos += deltaMs * 1_000_000L;
        return deltaMs;
    }

    private void dispatch(SpawnRequest request) {
        dispatched.increment();
        CompletionStage<SpawnOutcome> stage;
        try {
            stage = handler.spawn(request);
        } catch (RuntimeException e) {
            handlerFailed(request, e);
            return;
        }
        if (stage == null) {
            handlerFailed(request, null);
            return;
        }
        stage.whenComplete((outcome, error) -> {
            if (error != null || outcome == null) {
                handlerFailed(request, error);
            } else {
                service.recordOutcome(request.requestId(), outcome.success(), outcome.failureReason());
            }
        });
    }

    private void handlerFailed(SpawnRequest request, Throwable error) {
        handlerErrors.increment();
        LOG.log(Level.WARNING, "spawn handler failed for requestId=" + request.requestId(), error);
        service.recordOutcome(request.requestId(), false, SpawnFailureReason.HANDLER_ERROR);
    }

    public boolean isRunning() {
        return running.get();
    }

    public long ticks() {
        return ticks.sum();
    }

    public long dispatched() {
        return dispatched.sum();
    }

    public long handlerErrors() {
        return handlerErrors.sum();
    }

    @Override
    public void close() {
        running.set(false);
        ScheduledFuture<?> future = tickFuture;
        if (future != null) {
            future.cancel(false);
        }
        executor.shutdownGracefully(0L, SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS).syncUninterruptibly();
    }
}
