package com.acme.fleet.admission.breaker;

import com.acme.fleet.admission.config.InvalidConfigurationException;
import com.acme.fleet.admission.util.AdmissionDefaults;

import java.util.ArrayList;
import java.util.List;

/**
 * Breaker tuning.
 *
 * @param openThresholdPercent  failure rate above which a closed breaker opens
 * @param closeThresholdPercent failure rate a half-open breaker must stay below to close
 * @param cooldownSeconds       time an open breaker waits before probing
 * @param recoveryWindowSeconds probing period of a half-open breaker
 * @param failureWindowSeconds  rolling window the closed-state failure rate is computed over
 * @param minimumSampleSize     outcomes required in the window before the breaker may open
 * @param halfOpenMaxProbes     attempts admitted while half-open
 */
public record CircuitBreakerConfig(
    double openThresholdPercent,
    double closeThresholdPercent,
    int cooldownSeconds,
    int recoveryWindowSeconds,
    int failureWindowSeconds,
    int minimumSampleSize,
    int halfOpenMaxProbes
) {
    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(
            AdmissionDefaults.DEFAULT_OPEN_THRESHOLD,
            AdmissionDefaults.DEFAULT_CLOSE_THRESHOLD,
            AdmissionDefaults.DEFAULT_COOLDOWN_SECONDS,
            AdmissionDefaults.DEFAULT_RECOVERY_WINDOW_SECONDS,
            AdmissionDefaults.DEFAULT_FAILURE_WINDOW_SECONDS,
            AdmissionDefaults.DEFAULT_MINIMUM_SAMPLE_SIZE,
            AdmissionDefaults.DEFAULT_HALF_OPEN_MAX_PROBES
        );
    }

    long cooldownNanos() {
        return cooldownSeconds * 1_000_000_000L;
    }

    long recoveryWindowNanos() {
        return recoveryWindowSeconds * 1_000_000_000L;
    }

    long failureWindowNanos() {
        return failureWindowSeconds * 1_000_000_000L;
    }

    public void collectViolations(List<String> out) {
        if (!(openThresholdPercent > 0.0d) || openThresholdPercent > 100.0d) {
            out.add("openThresholdPercent must be within (0, 100] (was " + openThresholdPercent + ")");
        }
        if (!(closeThresholdPercent >= 0.0d) || closeThresholdPercent > openThresholdPercent) {
            out.add("closeThresholdPercent must be within [0, openThresholdPercent] (was " + closeThresholdPercent + ")");
        }
        if (cooldownSeconds <= 0) {
            out.add("cooldownSeconds must be > 0");
        }
        if (recoveryWindowSeconds <= 0) {
            out.add("recoveryWindowSeconds must be > 0");
        }
        if (failureWindowSeconds <= 0) {
            out.add("failureWindowSeconds must be > 0");
        }
        if (minimumSampleSize < 1) {
            out.add("minimumSampleSize must be >= 1");
        }
        if (halfOpenMaxProbes < 1) {
            out.add("halfOpenMaxProbes must be >= 1");
        }
    }

    public CircuitBreakerConfig validated() {
        List<String> violations = new ArrayList<>();
        collectViolations(violations);
        InvalidConfigurationException.throwIfAny(violations);
        return this;
    }
}
