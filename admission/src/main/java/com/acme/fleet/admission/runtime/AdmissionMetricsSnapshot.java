package com.acme.fleet.admission.runtime;

import com.acme.fleet.admission.breaker.SpawnCircuitBreaker;
import com.acme.fleet.admission.queue.QueueSnapshot;
import com.acme.fleet.admission.resource.ResourceMonitor;
import com.acme.fleet.admission.startup.StartupMetrics;
import com.acme.fleet.admission.throttle.ThrottleMetrics;

/**
 * Every component's metrics captured together for logging and scraping.
 */
public record AdmissionMetricsSnapshot(
    AdmissionStatus status,
    ResourceMonitor.Snapshot resource,
    QueueSnapshot queue,
    SpawnCircuitBreaker.Snapshot breaker,
    ThrottleMetrics throttle,
    StartupMetrics startup,
    ServiceCounters service
) {
    /**
     * Counters kept by the facade itself.
     */
    public record ServiceCounters(long requested,
                                  long cancelled,
                                  long inFlight,
                                  long outcomesRecorded,
                                  long unknownOutcomes,
                                  long staleInFlightWarnings,
                                  long starvationWarnings) {}
}
