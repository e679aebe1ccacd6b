package com.acme.fleet.admission.throttle;

import java.util.ArrayDeque;

/**
 * Sliding-window cap on released requests. Guarded by the owning throttler.
 */
final class BurstLimiter {
    private final ArrayDeque<long[]> releases = new ArrayDeque<>();
    private long windowNanos;
    private int maxRequests;
    private int inWindow;

    BurstLimiter(int windowSeconds, int maxRequests) {
        configure(windowSeconds, maxRequests);
    }

    synchronized void configure(int windowSeconds, int maxRequests) {
        this.windowNanos = Math.max(1, windowSeconds) * 1_000_000_000L;
        this.maxRequests = Math.max(1, maxRequests);
    }

    synchronized int remaining(long nowNanos) {
        prune(nowNanos);
        return Math.max(0, maxRequests - inWindow);
    }

    synchronized void record(long nowNanos, int count) {
        if (count <= 0) {
            return;
        }
        prune(nowNanos);
        releases.addLast(new long[] {nowNanos, count});
        inWindow += count;
    }

    private void prune(long nowNanos) {
        long horizon = nowNanos - windowNanos;
        while (!releases.isEmpty() && releases.peekFirst()[0] <= horizon) {
            inWindow -= (int) releases.pollFirst()[1];
        }
    }
}
