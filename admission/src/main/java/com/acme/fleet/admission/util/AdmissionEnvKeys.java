package com.acme.fleet.admission.util;

/**
 * Canonical environment variable names read by the admission runtime.
 */
public final class AdmissionEnvKeys {
    public static final String SPAWN_THROTTLE_MIN_BATCH_SIZE = "SPAWN_THROTTLE_MIN_BATCH_SIZE";
    public static final String SPAWN_THROTTLE_MAX_BATCH_SIZE = "SPAWN_THROTTLE_MAX_BATCH_SIZE";
    public static final String SPAWN_THROTTLE_BASE_BATCH_SIZE = "SPAWN_THROTTLE_BASE_BATCH_SIZE";
    public static final String SPAWN_THROTTLE_BASE_INTERVAL_MS = "SPAWN_THROTTLE_BASE_INTERVAL_MS";
    public static final String SPAWN_THROTTLE_MAX_INTERVAL_MS = "SPAWN_THROTTLE_MAX_INTERVAL_MS";
    public static final String SPAWN_THROTTLE_AGGRESSIVENESS = "SPAWN_THROTTLE_AGGRESSIVENESS";
    public static final String SPAWN_THROTTLE_ADAPTIVE = "SPAWN_THROTTLE_ADAPTIVE";
    public static final String SPAWN_THROTTLE_CIRCUIT_BREAKER = "SPAWN_THROTTLE_CIRCUIT_BREAKER";
    public static final String SPAWN_THROTTLE_BURST_PREVENTION = "SPAWN_THROTTLE_BURST_PREVENTION";
    public static final String SPAWN_THROTTLE_BURST_WINDOW_SEC = "SPAWN_THROTTLE_BURST_WINDOW_SEC";
    public static final String SPAWN_THROTTLE_BURST_MAX_REQUESTS = "SPAWN_THROTTLE_BURST_MAX_REQUESTS";

    public static final String SPAWN_RESOURCE_CPU_ELEVATED = "SPAWN_RESOURCE_CPU_ELEVATED";
    public static final String SPAWN_RESOURCE_CPU_HIGH = "SPAWN_RESOURCE_CPU_HIGH";
    public static final String SPAWN_RESOURCE_CPU_CRITICAL = "SPAWN_RESOURCE_CPU_CRITICAL";
    public static final String SPAWN_RESOURCE_MEMORY_ELEVATED = "SPAWN_RESOURCE_MEMORY_ELEVATED";
    public static final String SPAWN_RESOURCE_MEMORY_HIGH = "SPAWN_RESOURCE_MEMORY_HIGH";
    public static final String SPAWN_RESOURCE_MEMORY_CRITICAL = "SPAWN_RESOURCE_MEMORY_CRITICAL";
    public static final String SPAWN_RESOURCE_CONNECTION_THRESHOLD = "SPAWN_RESOURCE_CONNECTION_THRESHOLD";
    public static final String SPAWN_RESOURCE_HYSTERESIS = "SPAWN_RESOURCE_HYSTERESIS";
    public static final String SPAWN_RESOURCE_SAMPLE_INTERVAL_MS = "SPAWN_RESOURCE_SAMPLE_INTERVAL_MS";
    public static final String SPAWN_RESOURCE_BACKGROUND_SAMPLING = "SPAWN_RESOURCE_BACKGROUND_SAMPLING";

    public static final String SPAWN_BREAKER_OPEN_THRESHOLD = "SPAWN_BREAKER_OPEN_THRESHOLD";
    public static final String SPAWN_BREAKER_CLOSE_THRESHOLD = "SPAWN_BREAKER_CLOSE_THRESHOLD";
    public static final String SPAWN_BREAKER_COOLDOWN_SEC = "SPAWN_BREAKER_COOLDOWN_SEC";
    public static final String SPAWN_BREAKER_RECOVERY_WINDOW_SEC = "SPAWN_BREAKER_RECOVERY_WINDOW_SEC";
    public static final String SPAWN_BREAKER_FAILURE_WINDOW_SEC = "SPAWN_BREAKER_FAILURE_WINDOW_SEC";
    public static final String SPAWN_BREAKER_MIN_SAMPLE_SIZE = "SPAWN_BREAKER_MIN_SAMPLE_SIZE";
    public static final String SPAWN_BREAKER_HALF_OPEN_PROBES = "SPAWN_BREAKER_HALF_OPEN_PROBES";

    /** Prefix for per-phase keys, e.g. {@code SPAWN_PHASE_RAPID_DURATION_MS}. */
    public static final String SPAWN_PHASE_PREFIX = "SPAWN_PHASE_";
    public static final String PHASE_TARGET_SUFFIX = "_TARGET";
    public static final String PHASE_DURATION_SUFFIX = "_DURATION_MS";
    public static final String PHASE_MULTIPLIER_SUFFIX = "_MULTIPLIER";

    public static final String SPAWN_TICK_PERIOD_MS = "SPAWN_TICK_PERIOD_MS";
    public static final String SPAWN_IN_FLIGHT_WARN_MS = "SPAWN_IN_FLIGHT_WARN_MS";
    public static final String SPAWN_STARVATION_WARN_MS = "SPAWN_STARVATION_WARN_MS";

    public static final String SPAWN_METRICS_ENABLED = "SPAWN_METRICS_ENABLED";
    public static final String SPAWN_METRICS_LOG_INTERVAL_SEC = "SPAWN_METRICS_LOG_INTERVAL_SEC";
    public static final String SPAWN_METRICS_HTTP_ENABLED = "SPAWN_METRICS_HTTP_ENABLED";
    public static final String SPAWN_METRICS_HTTP_PORT = "SPAWN_METRICS_HTTP_PORT";
    public static final String SPAWN_METRICS_HTTP_PATH = "SPAWN_METRICS_HTTP_PATH";

    private AdmissionEnvKeys() {
    }
}
