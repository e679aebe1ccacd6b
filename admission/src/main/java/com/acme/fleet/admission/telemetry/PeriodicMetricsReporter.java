package com.acme.fleet.admission.telemetry;

import com.acme.fleet.admission.queue.QueueSnapshot;
import com.acme.fleet.admission.runtime.AdmissionMetricsSnapshot;
import com.acme.fleet.admission.runtime.AdmissionStatus;
import com.acme.fleet.admission.throttle.ThrottleMetrics;
import com.acme.fleet.admission.util.JsonCodec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Logs the admission metrics as one JSON line per interval.
 */
public final class PeriodicMetricsReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicMetricsReporter.class.getName());

    private final Supplier<AdmissionMetricsSnapshot> metrics;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    public PeriodicMetricsReporter(Supplier<AdmissionMetricsSnapshot> metrics, long intervalSeconds) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "spawn-metrics-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    private void emit() {
        try {
            Map<String, Object> payload = payload(metrics.get());
            String rendered;
            try {
                rendered = JsonCodec.writeString(payload);
            } catch (Exception e) {
                rendered = payload.toString();
            }
            LOG.info(rendered);
        } catch (Throwable t) {
            LOG.warning("Metrics reporter failure: " + t.getClass().getSimpleName());
        }
    }

    static Map<String, Object> payload(AdmissionMetricsSnapshot s) {
        AdmissionStatus status = s.status();
        QueueSnapshot queue = s.queue();
        ThrottleMetrics throttle = s.throttle();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component", "spawn-admission");
        payload.put("type", "admission_metrics");
        payload.put("phase", status.phase().name());
        payload.put("pressure", status.pressure().name());
        payload.put("circuit", status.circuitState().name());
        payload.put("throttled", status.throttleReason().name());
        payload.put("cpuPercent", s.resource().current().cpuUsagePercent());
        payload.put("memoryPercent", s.resource().current().memoryUsagePercent());
        payload.put("activeConnections", s.resource().current().activeConnections());
        payload.put("sampleFailures", s.resource().sampleFailures());
        payload.put("queueCritical", queue.critical());
        payload.put("queueHigh", queue.high());
        payload.put("queueNormal", queue.normal());
        payload.put("queueLow", queue.low());
        payload.put("oldestLowAgeMs", queue.oldestLowAgeMillis());
        payload.put("inFlight", s.service().inFlight());
        payload.put("released", throttle.released());
        payload.put("successes", throttle.successes());
        payload.put("failures", throttle.failures());
        payload.put("batches", throttle.batches());
        payload.put("currentBatchSize", throttle.currentBatchSize());
        payload.put("currentIntervalMs", throttle.currentIntervalMs());
        payload.put("failureRatePercent", s.breaker().failureRatePercent());
        payload.put("timesOpened", s.breaker().timesOpened());
        payload.put("failuresByReason", throttle.failuresByReason());
        payload.put("gateDenials", throttle.gateDenials());
        payload.put("startupDispatched", s.startup().totalDispatched());
        payload.put("staleInFlightWarnings", s.service().staleInFlightWarnings());
        payload.put("starvationWarnings", s.service().starvationWarnings());
        return payload;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
