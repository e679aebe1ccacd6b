package com.acme.fleet.admission.config;

import com.acme.fleet.admission.breaker.CircuitBreakerConfig;
import com.acme.fleet.admission.resource.ResourceThresholds;
import com.acme.fleet.admission.startup.PhaseSettings;
import com.acme.fleet.admission.startup.SpawnPhase;
import com.acme.fleet.admission.startup.StartupPhasePlan;
import com.acme.fleet.admission.throttle.ThrottleConfig;
import com.acme.fleet.admission.util.AdmissionDefaults;
import com.acme.fleet.admission.util.AdmissionEnvKeys;
import com.acme.fleet.admission.util.EnvVars;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Builds an {@link AdmissionConfig} from environment variables.
 *
 * <p>Each value is defaulted and clamped individually; cross-field consistency
 * ({@code minBatchSize <= maxBatchSize}, ascending thresholds, ...) is left to
 * {@link AdmissionConfig#validate()}, which fails loudly.</p>
 */
public final class AdmissionConfigLoader {
    private static final Logger LOG = Logger.getLogger(AdmissionConfigLoader.class.getName());

    private AdmissionConfigLoader() {
    }

    public static AdmissionConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static AdmissionConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        AdmissionConfig config = new AdmissionConfig(
            throttle(env),
            thresholds(env),
            circuitBreaker(env),
            startupPlan(env),
            runtime(env)
        ).validate();
        LOG.fine(() -> "admission config loaded: " + config);
        return config;
    }

    static ThrottleConfig throttle(Map<String, String> env) {
        return new ThrottleConfig(
            EnvVars.getIntClamped(env, AdmissionEnvKeys.SPAWN_THROTTLE_MIN_BATCH_SIZE,
                AdmissionDefaults.DEFAULT_MIN_BATCH_SIZE, 1, 100_000),
            EnvVars.getIntClamped(env, AdmissionEnvKeys.SPAWN_THROTTLE_MAX_BATCH_SIZE,
                AdmissionDefaults.DEFAULT_MAX_BATCH_SIZE, 1, 100_000),
            EnvVars.getIntClamped(env, AdmissionEnvKeys.SPAWN_THROTTLE_BASE_BATCH_SIZE,
                AdmissionDefaults.DEFAULT_BASE_BATCH_SIZE, 1, 100_000),
            EnvVars.getLongClamped(env, AdmissionEnvKeys.SPAWN_THROTTLE_BASE_INTERVAL_MS,
                AdmissionDefaults.DEFAULT_BATCH_INTERVAL_MS, 1L, 3_600_000L),
            EnvVars.getLongClamped(env, AdmissionEnvKeys.SPAWN_THROTTLE_MAX_INTERVAL_MS,
                AdmissionDefaults.DEFAULT_MAX_BATCH_INTERVAL_MS, 1L, 3_600_000L),
            EnvVars.getDoubleClamped(env, AdmissionEnvKeys.SPAWN_THROTTLE_AGGRESSIVENESS,
                AdmissionDefaults.DEFAULT_AGGRESSIVENESS, 0.01d, 100.0d),
            EnvVars.getBoolean(env, AdmissionEnvKeys.SPAWN_THROTTLE_ADAPTIVE, true),
            EnvVars.getBoolean(env, AdmissionEnvKeys.SPAWN_THROTTLE_CIRCUIT_BREAKER, true),
            EnvVars.getBoolean(env, AdmissionEnvKeys.SPAWN_THROTTLE_BURST_PREVENTION, true),
            EnvVars.getIntClamped(env, AdmissionEnvKeys.SPAWN_THROTTLE_BURST_WINDOW_SEC,
                AdmissionDefaults.DEFAULT_BURST_WINDOW_SECONDS, 1, 3_600),
            EnvVars.getIntClamped(env, AdmissionEnvKeys.SPAWN_THROTTLE_BURST_MAX_REQUESTS,
                AdmissionDefaults.DEFAULT_BURST_WINDOW_MAX_REQUESTS, 1, 10_000_000)
        );
    }

    static ResourceThresholds thresholds(Map<String, String> env) {
        return new ResourceThresholds(
            percent(env, AdmissionEnvKeys.SPAWN_RESOURCE_CPU_ELEVATED, AdmissionDefaults.DEFAULT_CPU_ELEVATED),
            percent(env, AdmissionEnvKeys.SPAWN_RESOURCE_CPU_HIGH, AdmissionDefaults.DEFAULT_CPU_HIGH),
            percent(env, AdmissionEnvKeys.SPAWN_RESOURCE_CPU_CRITICAL, AdmissionDefaults.DEFAULT_CPU_CRITICAL),
            percent(env, AdmissionEnvKeys.SPAWN_RESOURCE_MEMORY_ELEVATED, AdmissionDefaults.DEFAULT_MEMORY_ELEVATED),
            percent(env, AdmissionEnvKeys.SPAWN_RESOURCE_MEMORY_HIGH, AdmissionDefaults.DEFAULT_MEMORY_HIGH),
            percent(env, AdmissionEnvKeys.SPAWN_RESOURCE_MEMORY_CRITICAL, AdmissionDefaults.DEFAULT_MEMORY_CRITICAL),
            percent(env, AdmissionEnvKeys.SPAWN_RESOURCE_CONNECTION_THRESHOLD, AdmissionDefaults.DEFAULT_CONNECTION_THRESHOLD),
            EnvVars.getDoubleClamped(env, AdmissionEnvKeys.SPAWN_RESOURCE_HYSTERESIS,
                AdmissionDefaults.DEFAULT_PRESSURE_HYSTERESIS, 0.0d, 50.0d)
        );
    }

    static CircuitBreakerConfig circuitBreaker(Map<String, String> env) {
        return new CircuitBreakerConfig(
            EnvVars.getDoubleClamped(env, AdmissionEnvKeys.SPAWN_BREAKER_OPEN_THRESHOLD,
                AdmissionDefaults.DEFAULT_OPEN_THRESHOLD, 0.1d, 100.0d),
            percent(env, AdmissionEnvKeys.SPAWN_BREAKER_CLOSE_THRESHOLD, AdmissionDefaults.DEFAULT_CLOSE_THRESHOLD),
            EnvVars.getIntClamped(env, AdmissionEnvKeys.SPAWN_BREAKER_COOLDOWN_SEC,
                AdmissionDefaults.DEFAULT_COOLDOWN_SECONDS, 1, 86_400),
            EnvVars.getIntClamped(env, AdmissionEnvKeys.SPAWN_BREAKER_RECOVERY_WINDOW_SEC,
                AdmissionDefaults.DEFAULT_RECOVERY_WINDOW_SECONDS, 1, 86_400),
            EnvVars.getIntClamped(env, AdmissionEnvKeys.SPAWN_BREAKER_FAILURE_WINDOW_SEC,
                AdmissionDefaults.DEFAULT_FAILURE_WINDOW_SECONDS, 1, 86_400),
            EnvVars.getIntClamped(env, AdmissionEnvKeys.SPAWN_BREAKER_MIN_SAMPLE_SIZE,
                AdmissionDefaults.DEFAULT_MINIMUM_SAMPLE_SIZE, 1, 1_000_000),
            EnvVars.getIntClamped(env, AdmissionEnvKeys.SPAWN_BREAKER_HALF_OPEN_PROBES,
                AdmissionDefaults.DEFAULT_HALF_OPEN_MAX_PROBES, 1, 100_000)
        );
    }

    static StartupPhasePlan startupPlan(Map<String, String> env) {
        StartupPhasePlan defaults = StartupPhasePlan.defaults();
        return new StartupPhasePlan(
            phase(env, SpawnPhase.IMMEDIATE, defaults.immediate()),
            phase(env, SpawnPhase.RAPID, defaults.rapid()),
            phase(env, SpawnPhase.STEADY, defaults.steady()),
            phase(env, SpawnPhase.BACKGROUND, defaults.background())
        );
    }

    private static PhaseSettings phase(Map<String, String> env, SpawnPhase phase, PhaseSettings fallback) {
        String prefix = AdmissionEnvKeys.SPAWN_PHASE_PREFIX + phase.name();
        return new PhaseSettings(
            EnvVars.getIntClamped(env, prefix + AdmissionEnvKeys.PHASE_TARGET_SUFFIX,
                fallback.targetCount(), 0, 10_000_000),
            EnvVars.getLongClamped(env, prefix + AdmissionEnvKeys.PHASE_DURATION_SUFFIX,
                fallback.durationMs(), 0L, 86_400_000L),
            EnvVars.getDoubleClamped(env, prefix + AdmissionEnvKeys.PHASE_MULTIPLIER_SUFFIX,
                fallback.rateMultiplier(), 0.01d, 100.0d)
        );
    }

    static RuntimeSettings runtime(Map<String, String> env) {
        return new RuntimeSettings(
            EnvVars.getLongClamped(env, AdmissionEnvKeys.SPAWN_TICK_PERIOD_MS,
                AdmissionDefaults.DEFAULT_TICK_PERIOD_MS, 1L, 60_000L),
            EnvVars.getLongClamped(env, AdmissionEnvKeys.SPAWN_RESOURCE_SAMPLE_INTERVAL_MS,
                AdmissionDefaults.DEFAULT_SAMPLE_INTERVAL_MS, 0L, 60_000L),
            EnvVars.getBoolean(env, AdmissionEnvKeys.SPAWN_RESOURCE_BACKGROUND_SAMPLING, false),
            EnvVars.getLongClamped(env, AdmissionEnvKeys.SPAWN_IN_FLIGHT_WARN_MS,
                AdmissionDefaults.DEFAULT_IN_FLIGHT_WARN_AFTER_MS, 1L, 86_400_000L),
            EnvVars.getLongClamped(env, AdmissionEnvKeys.SPAWN_STARVATION_WARN_MS,
                AdmissionDefaults.DEFAULT_STARVATION_WARN_AFTER_MS, 1L, 86_400_000L),
            AdmissionDefaults.DEFAULT_DIAGNOSTICS_INTERVAL_MS,
            EnvVars.getBoolean(env, AdmissionEnvKeys.SPAWN_METRICS_ENABLED, true),
            EnvVars.getIntClamped(env, AdmissionEnvKeys.SPAWN_METRICS_LOG_INTERVAL_SEC,
                AdmissionDefaults.DEFAULT_METRICS_LOG_INTERVAL_SEC, 1, 3_600),
            EnvVars.getBoolean(env, AdmissionEnvKeys.SPAWN_METRICS_HTTP_ENABLED, false),
            EnvVars.getIntClamped(env, AdmissionEnvKeys.SPAWN_METRICS_HTTP_PORT,
                AdmissionDefaults.DEFAULT_METRICS_HTTP_PORT, 1, 65_535),
            EnvVars.getOrDefault(env, AdmissionEnvKeys.SPAWN_METRICS_HTTP_PATH,
                AdmissionDefaults.DEFAULT_METRICS_HTTP_PATH)
        );
    }

    private static double percent(Map<String, String> env, String key, double fallback) {
        return EnvVars.getDoubleClamped(env, key, fallback, 0.0d, 100.0d);
    }
}
