package com.acme.fleet.admission.resource;

import com.acme.fleet.admission.util.MonotonicClock;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Moves counter reads off the tick thread.
 *
 * <p>A daemon thread samples the delegate at a fixed rate and swaps the result into an
 * {@link AtomicReference}. {@link #sample()} returns the latest published record and never
 * blocks. Single writer, any number of readers; each reader sees one whole sample.</p>
 */
public final class BackgroundResourceSampler implements ResourceSampler, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(BackgroundResourceSampler.class.getName());

    private final ResourceSampler delegate;
    private final long periodMillis;
    private final ScheduledExecutorService executor;
    private final AtomicReference<ResourceSample> latest;
    private final AtomicBoolean started = new AtomicBoolean(false);

    public BackgroundResourceSampler(ResourceSampler delegate, long periodMillis) {
        this(delegate, periodMillis, MonotonicClock.SYSTEM);
    }

    BackgroundResourceSampler(ResourceSampler delegate, long periodMillis, MonotonicClock clock) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.periodMillis = Math.max(1L, periodMillis);
        this.latest = new AtomicReference<>(ResourceSample.unavailable(clock.nanoTime()));
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "spawn-resource-sampler");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        refresh();
        executor.scheduleAtFixedRate(this::refresh, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }

    void refresh() {
        try {
            ResourceSample sample = delegate.sample();
            if (sample != null) {
                latest.set(sample);
            }
        } catch (Throwable t) {
            LOG.log(Level.WARNING, "background resource sample failed", t);
        }
    }

    @Override
    public ResourceSample sample() {
        return latest.get();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
