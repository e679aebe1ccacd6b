package com.acme.fleet.admission.runtime;

import com.acme.fleet.admission.throttle.SpawnFailureReason;

/**
 * Result of one provisioning attempt as reported by a {@link SpawnHandler}.
 *
 * @param failureReason ignored when {@code success} is true
 */
public record SpawnOutcome(boolean success, SpawnFailureReason failureReason) {
    private static final SpawnOutcome SUCCEEDED = new SpawnOutcome(true, null);

    public static SpawnOutcome succeeded() {
        return SUCCEEDED;
    }

    public static SpawnOutcome failed(SpawnFailureReason reason) {
        return new SpawnOutcome(false, SpawnFailureReason.orUnknown(reason));
    }
}
