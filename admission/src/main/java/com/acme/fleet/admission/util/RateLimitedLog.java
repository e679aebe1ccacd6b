package com.acme.fleet.admission.util;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Emits a log record at most once per interval. Suppressed records are counted and
 * reported with the next emitted one.
 */
public final class RateLimitedLog {
    private final Logger logger;
    private final long intervalNanos;
    private final MonotonicClock clock;
    private final AtomicLong lastEmitNanos = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong suppressed = new AtomicLong();

    public RateLimitedLog(Logger logger, long intervalMillis, MonotonicClock clock) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.intervalNanos = Math.max(0L, intervalMillis) * 1_000_000L;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public boolean log(Level level, Supplier<String> message) {
        long now = clock.nanoTime();
        long last = lastEmitNanos.get();
        if (last != Long.MIN_VALUE && now - last < intervalNanos) {
            suppressed.incrementAndGet();
            return false;
        }
        if (!lastEmitNanos.compareAndSet(last, now)) {
            suppressed.incrementAndGet();
            return false;
        }
        long dropped = suppressed.getAndSet(0L);
        if (logger.isLoggable(level)) {
            logger.log(level, dropped == 0L
                ? message.get()
                : message.get() + " (suppressed " + dropped + " similar)");
        }
        return true;
    }
}
