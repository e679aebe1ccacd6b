package com.acme.fleet.admission.throttle;

import com.acme.fleet.admission.config.InvalidConfigurationException;
import com.acme.fleet.admission.util.AdmissionDefaults;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable throttle tuning.
 *
 * @param minBatchSize             lower clamp of a released batch
 * @param maxBatchSize             upper clamp of a released batch
 * @param baseBatchSize            batch size at nominal load before multipliers
 * @param baseBatchIntervalMs      minimum spacing between batches at nominal load
 * @param maxBatchIntervalMs       cap on the pressure-stretched interval
 * @param aggressivenessMultiplier global scale on {@code baseBatchSize}
 * @param enableAdaptive           when false batch size and interval ignore load signals
 * @param enableCircuitBreaker     when false the gate ignores the breaker
 * @param enableBurstPrevention    enables the sliding release window
 * @param burstWindowSeconds       length of the sliding release window
 * @param burstWindowMaxRequests   releases allowed inside one window
 */
public record ThrottleConfig(
    int minBatchSize,
    int maxBatchSize,
    int baseBatchSize,
    long baseBatchIntervalMs,
    long maxBatchIntervalMs,
    double aggressivenessMultiplier,
    boolean enableAdaptive,
    boolean enableCircuitBreaker,
    boolean enableBurstPrevention,
    int burstWindowSeconds,
    int burstWindowMaxRequests
) {
    public static ThrottleConfig defaults() {
        return new ThrottleConfig(
            AdmissionDefaults.DEFAULT_MIN_BATCH_SIZE,
            AdmissionDefaults.DEFAULT_MAX_BATCH_SIZE,
            AdmissionDefaults.DEFAULT_BASE_BATCH_SIZE,
            AdmissionDefaults.DEFAULT_BATCH_INTERVAL_MS,
            AdmissionDefaults.DEFAULT_MAX_BATCH_INTERVAL_MS,
            AdmissionDefaults.DEFAULT_AGGRESSIVENESS,
            true,
            true,
            true,
            AdmissionDefaults.DEFAULT_BURST_WINDOW_SECONDS,
            AdmissionDefaults.DEFAULT_BURST_WINDOW_MAX_REQUESTS
        );
    }

    public void collectViolations(List<String> out) {
        if (minBatchSize < 1) {
            out.add("minBatchSize must be >= 1 (was " + minBatchSize + ")");
        }
        if (minBatchSize > maxBatchSize) {
            out.add("minBatchSize " + minBatchSize + " exceeds maxBatchSize " + maxBatchSize);
        }
        if (baseBatchSize < 1) {
            out.add("baseBatchSize must be >= 1 (was " + baseBatchSize + ")");
        }
        if (baseBatchIntervalMs <= 0L) {
            out.add("baseBatchIntervalMs must be > 0 (was " + baseBatchIntervalMs + ")");
        }
        if (maxBatchIntervalMs < baseBatchIntervalMs) {
            out.add("maxBatchIntervalMs " + maxBatchIntervalMs + " is below baseBatchIntervalMs " + baseBatchIntervalMs);
        }
        if (!(aggressivenessMultiplier > 0.0d) || Double.isInfinite(aggressivenessMultiplier)) {
            out.add("aggressivenessMultiplier must be a positive finite number (was " + aggressivenessMultiplier + ")");
        }
        if (enableBurstPrevention) {
            if (burstWindowSeconds <= 0) {
                out.add("burstWindowSeconds must be > 0 when burst prevention is enabled");
            }
            if (burstWindowMaxRequests < 1) {
                out.add("burstWindowMaxRequests must be >= 1 when burst prevention is enabled");
            }
        }
    }

    /**
     * @throws InvalidConfigurationException when any field is out of range
     */
    public ThrottleConfig validated() {
        List<String> violations = new ArrayList<>();
        collectViolations(violations);
        InvalidConfigurationException.throwIfAny(violations);
        return this;
    }
}
