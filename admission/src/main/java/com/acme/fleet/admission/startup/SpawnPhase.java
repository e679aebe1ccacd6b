package com.acme.fleet.admission.startup;

import com.acme.fleet.admission.queue.SpawnPriority;

/**
 * Startup ramp phases in the only order they may occur.
 */
public enum SpawnPhase {
    IMMEDIATE(SpawnPriority.CRITICAL),
    RAPID(SpawnPriority.HIGH),
    STEADY(SpawnPriority.LOW),
    BACKGROUND(SpawnPriority.LOW),
    STEADY_STATE(SpawnPriority.LOW);

    private final SpawnPriority priorityCeiling;

    SpawnPhase(SpawnPriority priorityCeiling) {
        this.priorityCeiling = priorityCeiling;
    }

    /**
     * Least urgent tier drained while this phase is active.
     */
    public SpawnPriority priorityCeiling() {
        return priorityCeiling;
    }

    public boolean isTerminal() {
        return this == STEADY_STATE;
    }

    SpawnPhase next() {
        return isTerminal() ? this : values()[ordinal() + 1];
    }
}
