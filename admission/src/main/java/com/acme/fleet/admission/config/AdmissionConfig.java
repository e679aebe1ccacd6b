package com.acme.fleet.admission.config;

import com.acme.fleet.admission.breaker.CircuitBreakerConfig;
import com.acme.fleet.admission.resource.ResourceThresholds;
import com.acme.fleet.admission.startup.StartupPhasePlan;
import com.acme.fleet.admission.throttle.ThrottleConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable admission settings captured once at service construction. Use
 * {@code SpawnAdmissionService.reconfigure} to swap them at runtime.
 */
public record AdmissionConfig(
    ThrottleConfig throttle,
    ResourceThresholds thresholds,
    CircuitBreakerConfig circuitBreaker,
    StartupPhasePlan startupPlan,
    RuntimeSettings runtime
) {
    public AdmissionConfig {
        Objects.requireNonNull(throttle, "throttle");
        Objects.requireNonNull(thresholds, "thresholds");
        Objects.requireNonNull(circuitBreaker, "circuitBreaker");
        Objects.requireNonNull(startupPlan, "startupPlan");
        Objects.requireNonNull(runtime, "runtime");
    }

    public static AdmissionConfig defaults() {
        return new AdmissionConfig(
            ThrottleConfig.defaults(),
            ResourceThresholds.defaults(),
            CircuitBreakerConfig.defaults(),
            StartupPhasePlan.defaults(),
            RuntimeSettings.defaults()
        );
    }

    public AdmissionConfig withThrottle(ThrottleConfig value) {
        return new AdmissionConfig(value, thresholds, circuitBreaker, startupPlan, runtime);
    }

    public AdmissionConfig withThresholds(ResourceThresholds value) {
        return new AdmissionConfig(throttle, value, circuitBreaker, startupPlan, runtime);
    }

    public AdmissionConfig withCircuitBreaker(CircuitBreakerConfig value) {
        return new AdmissionConfig(throttle, thresholds, value, startupPlan, runtime);
    }

    public AdmissionConfig withStartupPlan(StartupPhasePlan value) {
        return new AdmissionConfig(throttle, thresholds, circuitBreaker, value, runtime);
    }

    public AdmissionConfig withRuntime(RuntimeSettings value) {
        return new AdmissionConfig(throttle, thresholds, circuitBreaker, startupPlan, value);
    }

    /**
     * Checks every section and reports all violations at once.
     *
     * @throws InvalidConfigurationException when any section is inconsistent
     */
    public AdmissionConfig validate() {
        List<String> violations = new ArrayList<>();
        throttle.collectViolations(violations);
        thresholds.collectViolations(violations);
        circuitBreaker.collectViolations(violations);
        startupPlan.collectViolations(violations);
        runtime.collectViolations(violations);
        InvalidConfigurationException.throwIfAny(violations);
        return this;
    }
}
