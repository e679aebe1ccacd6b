package com.acme.fleet.admission.throttle;

/**
 * First reason the admission gate is closed, in evaluation order.
 */
public enum ThrottleReason {
    NONE("admitting"),
    CRITICAL_PRESSURE("critical resource pressure"),
    CIRCUIT_OPEN("circuit breaker open"),
    PROBE_BUDGET_SPENT("circuit breaker half-open, probe budget spent"),
    BATCH_INTERVAL("waiting for batch interval"),
    BURST_LIMIT("burst window limit reached");

    private final String description;

    ThrottleReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /**
     * Operator-facing diagnostic, e.g. {@code "throttled: circuit breaker open"}.
     */
    public String diagnostic() {
        return this == NONE ? description : "throttled: " + description;
    }
}
