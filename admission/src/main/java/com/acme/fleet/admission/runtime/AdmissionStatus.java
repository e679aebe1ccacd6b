package com.acme.fleet.admission.runtime;

import com.acme.fleet.admission.breaker.CircuitState;
import com.acme.fleet.admission.resource.PressureLevel;
import com.acme.fleet.admission.startup.SpawnPhase;
import com.acme.fleet.admission.throttle.ThrottleReason;

/**
 * Point-in-time operator view of the admission pipeline.
 */
public record AdmissionStatus(
    SpawnPhase phase,
    PressureLevel pressure,
    CircuitState circuitState,
    ThrottleReason throttleReason,
    int queued,
    int inFlight,
    int awaitingPoll,
    int currentBatchSize,
    long recommendedDelayMs
) {
    public boolean throttled() {
        return throttleReason != ThrottleReason.NONE;
    }

    /**
     * One-line summary, e.g.
     * {@code phase=RAPID pressure=HIGH circuit=CLOSED queue=120 inflight=8 batch=4 throttled: waiting for batch interval}.
     */
    public String summary() {
        return "phase=" + phase
            + " pressure=" + pressure
            + " circuit=" + circuitState
            + " queue=" + queued
            + " inflight=" + inFlight
            + " batch=" + currentBatchSize
            + ' ' + throttleReason.diagnostic();
    }
}
