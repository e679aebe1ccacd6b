package com.acme.fleet.admission.util;

/**
 * Default tuning constants for the admission runtime.
 * <p>
 * These values are used when the corresponding environment variable is not set.
 */
public final class AdmissionDefaults {

    // ---- Throttle ----
    public static final int DEFAULT_MIN_BATCH_SIZE = 1;
    public static final int DEFAULT_MAX_BATCH_SIZE = 50;
    public static final int DEFAULT_BASE_BATCH_SIZE = 10;
    public static final long DEFAULT_BATCH_INTERVAL_MS = 100L;
    public static final long DEFAULT_MAX_BATCH_INTERVAL_MS = 5_000L;
    public static final double DEFAULT_AGGRESSIVENESS = 1.0d;
    public static final int DEFAULT_BURST_WINDOW_SECONDS = 10;
    public static final int DEFAULT_BURST_WINDOW_MAX_REQUESTS = 500;

    // ---- Resource thresholds (percent) ----
    public static final double DEFAULT_CPU_ELEVATED = 60.0d;
    public static final double DEFAULT_CPU_HIGH = 75.0d;
    public static final double DEFAULT_CPU_CRITICAL = 85.0d;
    public static final double DEFAULT_MEMORY_ELEVATED = 70.0d;
    public static final double DEFAULT_MEMORY_HIGH = 80.0d;
    public static final double DEFAULT_MEMORY_CRITICAL = 90.0d;
    public static final double DEFAULT_CONNECTION_THRESHOLD = 80.0d;
    public static final double DEFAULT_PRESSURE_HYSTERESIS = 5.0d;

    // ---- Moving average windows (samples) ----
    public static final int SHORT_WINDOW_SAMPLES = 5;
    public static final int MEDIUM_WINDOW_SAMPLES = 30;
    public static final int LONG_WINDOW_SAMPLES = 120;
    public static final int HISTORY_CAPACITY = 256;

    // ---- Circuit breaker ----
    public static final double DEFAULT_OPEN_THRESHOLD = 30.0d;
    public static final double DEFAULT_CLOSE_THRESHOLD = 10.0d;
    public static final int DEFAULT_COOLDOWN_SECONDS = 30;
    public static final int DEFAULT_RECOVERY_WINDOW_SECONDS = 10;
    public static final int DEFAULT_FAILURE_WINDOW_SECONDS = 60;
    public static final int DEFAULT_MINIMUM_SAMPLE_SIZE = 20;
    public static final int DEFAULT_HALF_OPEN_MAX_PROBES = 5;

    // ---- Startup phases ----
    public static final long DEFAULT_IMMEDIATE_DURATION_MS = 30_000L;
    public static final long DEFAULT_RAPID_DURATION_MS = 90_000L;
    public static final long DEFAULT_STEADY_DURATION_MS = 480_000L;
    public static final long DEFAULT_BACKGROUND_DURATION_MS = 300_000L;
    public static final int DEFAULT_IMMEDIATE_TARGET = 50;
    public static final int DEFAULT_RAPID_TARGET = 200;
    public static final int DEFAULT_STEADY_TARGET = 500;
    public static final int DEFAULT_BACKGROUND_TARGET = 250;
    public static final double DEFAULT_IMMEDIATE_MULTIPLIER = 1.0d;
    public static final double DEFAULT_RAPID_MULTIPLIER = 1.5d;
    public static final double DEFAULT_STEADY_MULTIPLIER = 1.0d;
    public static final double DEFAULT_BACKGROUND_MULTIPLIER = 0.8d;

    // ---- Runtime ----
    public static final long DEFAULT_TICK_PERIOD_MS = 50L;
    public static final long DEFAULT_SAMPLE_INTERVAL_MS = 1_000L;
    public static final long DEFAULT_IN_FLIGHT_WARN_AFTER_MS = 30_000L;
    public static final long DEFAULT_STARVATION_WARN_AFTER_MS = 60_000L;
    public static final long DEFAULT_DIAGNOSTICS_INTERVAL_MS = 5_000L;
    public static final long DIAGNOSTIC_LOG_INTERVAL_MS = 30_000L;

    // ---- Metrics ----
    public static final int DEFAULT_METRICS_LOG_INTERVAL_SEC = 30;
    public static final int DEFAULT_METRICS_HTTP_PORT = 9470;
    public static final String DEFAULT_METRICS_HTTP_PATH = "/metrics";
    public static final String DEFAULT_STATUS_HTTP_PATH = "/status";
    public static final int DEFAULT_METRICS_RENDER_BUFFER = 2048;

    private AdmissionDefaults() {
    }
}
