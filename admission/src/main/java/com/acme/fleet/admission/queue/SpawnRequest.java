package com.acme.fleet.admission.queue;

import java.util.Objects;

/**
 * A pending request to bring one worker online.
 *
 * @param requestId          unique while queued
 * @param priority           admission tier
 * @param enqueueTimeNanos   monotonic enqueue time, used for aging diagnostics
 * @param retryCount         how many times the owner has re-submitted this work
 * @param reason             free-form requester note, for logs only
 */
public record SpawnRequest(
    long requestId,
    SpawnPriority priority,
    long enqueueTimeNanos,
    int retryCount,
    String reason
) {
    public SpawnRequest {
        Objects.requireNonNull(priority, "priority");
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0");
        }
        reason = reason == null ? "" : reason;
    }

    public long ageMillis(long nowNanos) {
        return Math.max(0L, (nowNanos - enqueueTimeNanos) / 1_000_000L);
    }

    public SpawnRequest withRetry(long newRequestId, long nowNanos) {
        return new SpawnRequest(newRequestId, priority, nowNanos, retryCount + 1, reason);
    }
}
