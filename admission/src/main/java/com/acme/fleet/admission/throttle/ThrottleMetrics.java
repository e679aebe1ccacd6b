package com.acme.fleet.admission.throttle;

import java.util.Map;

public record ThrottleMetrics(
    long released,
    long successes,
    long failures,
    long batches,
    int lastBatchSize,
    int currentBatchSize,
    long currentIntervalMs,
    double phaseMultiplier,
    double failureMultiplier,
    Map<SpawnFailureReason, Long> failuresByReason,
    Map<ThrottleReason, Long> gateDenials
) {}
