package com.acme.fleet.admission.config;

import com.acme.fleet.admission.util.AdmissionDefaults;

import java.util.List;

/**
 * Settings of the hosting runtime rather than of the admission decision itself.
 */
public record RuntimeSettings(
    long tickPeriodMs,
    long sampleIntervalMs,
    boolean backgroundSampling,
    long inFlightWarnAfterMs,
    long starvationWarnAfterMs,
    long diagnosticsIntervalMs,
    boolean metricsEnabled,
    int metricsLogIntervalSec,
    boolean metricsHttpEnabled,
    int metricsHttpPort,
    String metricsHttpPath
) {
    public static RuntimeSettings defaults() {
        return new RuntimeSettings(
            AdmissionDefaults.DEFAULT_TICK_PERIOD_MS,
            AdmissionDefaults.DEFAULT_SAMPLE_INTERVAL_MS,
            false,
            AdmissionDefaults.DEFAULT_IN_FLIGHT_WARN_AFTER_MS,
            AdmissionDefaults.DEFAULT_STARVATION_WARN_AFTER_MS,
            AdmissionDefaults.DEFAULT_DIAGNOSTICS_INTERVAL_MS,
            true,
            AdmissionDefaults.DEFAULT_METRICS_LOG_INTERVAL_SEC,
            false,
            AdmissionDefaults.DEFAULT_METRICS_HTTP_PORT,
            AdmissionDefaults.DEFAULT_METRICS_HTTP_PATH
        );
    }

    void collectViolations(List<String> out) {
        if (tickPeriodMs <= 0L) {
            out.add("tickPeriodMs must be > 0");
        }
        if (sampleIntervalMs < 0L) {
            out.add("sampleIntervalMs must be >= 0");
        }
        if (inFlightWarnAfterMs <= 0L) {
            out.add("inFlightWarnAfterMs must be > 0");
        }
        if (starvationWarnAfterMs <= 0L) {
            out.add("starvationWarnAfterMs must be > 0");
        }
        if (diagnosticsIntervalMs <= 0L) {
            out.add("diagnosticsIntervalMs must be > 0");
        }
    }
}
