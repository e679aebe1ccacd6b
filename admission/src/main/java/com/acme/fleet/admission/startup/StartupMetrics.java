package com.acme.fleet.admission.startup;

import java.util.List;

public record StartupMetrics(
    SpawnPhase phase,
    boolean started,
    long elapsedMs,
    int transitions,
    long totalDispatched,
    List<PhaseMetrics> phases
) {
    /**
     * @param startedAtMs startup-relative start, -1 if the phase has not begun
     * @param endedAtMs   startup-relative end, -1 while active or not yet begun
     */
    public record PhaseMetrics(SpawnPhase phase,
                               int targetCount,
                               long dispatched,
                               long startedAtMs,
                               long endedAtMs) {
        public boolean targetReached() {
            return dispatched >= targetCount;
        }
    }
}
