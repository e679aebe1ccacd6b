package com.acme.fleet.admission.startup;

/**
 * Per-phase ramp settings.
 *
 * @param targetCount    workers this phase is expected to bring online; reported, not enforced
 * @param durationMs     how long the phase lasts; 0 skips it
 * @param rateMultiplier batch-size multiplier applied while the phase is active
 */
public record PhaseSettings(int targetCount, long durationMs, double rateMultiplier) {
    static final PhaseSettings STEADY_STATE = new PhaseSettings(0, 0L, 1.0d);
}
