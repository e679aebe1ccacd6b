package com.acme.fleet.admission.telemetry;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import com.acme.fleet.admission.breaker.SpawnCircuitBreaker;
import com.acme.fleet.admission.queue.QueueSnapshot;
import com.acme.fleet.admission.queue.SpawnPriority;
import com.acme.fleet.admission.resource.ResourceMonitor;
import com.acme.fleet.admission.runtime.AdmissionMetricsSnapshot;
import com.acme.fleet.admission.runtime.AdmissionStatus;
import com.acme.fleet.admission.startup.StartupMetrics;
import com.acme.fleet.admission.throttle.SpawnFailureReason;
import com.acme.fleet.admission.throttle.ThrottleMetrics;
import com.acme.fleet.admission.throttle.ThrottleReason;
import com.acme.fleet.admission.util.AdmissionDefaults;
import com.acme.fleet.admission.util.HttpStatusCodes;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Scrape endpoint: Prometheus text on the metrics path, the one-line summary on
 * {@code /status}.
 */
public final class MetricsHttpEndpoint implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(MetricsHttpEndpoint.class.getName());
    private static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";
    private static final String TEXT_CONTENT_TYPE = "text/plain; charset=utf-8";

    private final Supplier<AdmissionMetricsSnapshot> metrics;
    private final Supplier<String> summary;
    private final String path;
    private final HttpServer server;
    private final ExecutorService executor;

    public MetricsHttpEndpoint(Supplier<AdmissionMetricsSnapshot> metrics,
                               Supplier<String> summary,
                               int port,
                               String path) throws IOException {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.summary = Objects.requireNonNull(summary, "summary");
        this.path = normalizePath(path);
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.server.createContext(this.path, this::handleMetrics);
        if (!AdmissionDefaults.DEFAULT_STATUS_HTTP_PATH.equals(this.path)) {
            this.server.createContext(AdmissionDefaults.DEFAULT_STATUS_HTTP_PATH, this::handleStatus);
        }
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "spawn-metrics-http");
            t.setDaemon(true);
            return t;
        });
        this.server.setExecutor(executor);
    }

    public void start() {
        server.start();
        LOG.info("Metrics endpoint started on :" + port() + path);
    }

    /**
     * Bound port; differs from the requested one when 0 was passed.
     */
    public int port() {
        return server.getAddress().getPort();
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        try {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                write(exchange, HttpStatusCodes.METHOD_NOT_ALLOWED, TEXT_CONTENT_TYPE, "method not allowed\n");
                return;
            }
            write(exchange, HttpStatusCodes.OK, PROMETHEUS_CONTENT_TYPE, renderPrometheus(metrics.get()));
        } catch (Throwable t) {
            write(exchange, HttpStatusCodes.INTERNAL_ERROR, TEXT_CONTENT_TYPE, "internal error\n");
        }
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        try {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                write(exchange, HttpStatusCodes.METHOD_NOT_ALLOWED, TEXT_CONTENT_TYPE, "method not allowed\n");
                return;
            }
            write(exchange, HttpStatusCodes.OK, TEXT_CONTENT_TYPE, summary.get() + "\n");
        } catch (Throwable t) {
            write(exchange, HttpStatusCodes.INTERNAL_ERROR, TEXT_CONTENT_TYPE, "internal error\n");
        }
    }

    private static void write(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static String normalizePath(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return AdmissionDefaults.DEFAULT_METRICS_HTTP_PATH;
        }
        return rawPath.startsWith("/") ? rawPath : "/" + rawPath;
    }

    static String renderPrometheus(AdmissionMetricsSnapshot snapshot) {
        StringBuilder sb = new StringBuilder(AdmissionDefaults.DEFAULT_METRICS_RENDER_BUFFER);
        AdmissionStatus status = snapshot.status();
        ThrottleMetrics throttle = snapshot.throttle();
        QueueSnapshot queue = snapshot.queue();
        SpawnCircuitBreaker.Snapshot breaker = snapshot.breaker();
        ResourceMonitor.Snapshot resource = snapshot.resource();
        StartupMetrics startup = snapshot.startup();

        appendHelpType(sb, "spawn_requests_total", "Spawn requests by lifecycle status", "counter");
        appendMetric(sb, "spawn_requests_total", Map.of("status", "requested"), snapshot.service().requested());
        appendMetric(sb, "spawn_requests_total", Map.of("status", "released"), throttle.released());
        appendMetric(sb, "spawn_requests_total", Map.of("status", "succeeded"), throttle.successes());
        appendMetric(sb, "spawn_requests_total", Map.of("status", "failed"), throttle.failures());
        appendMetric(sb, "spawn_requests_total", Map.of("status", "cancelled"), snapshot.service().cancelled());

        appendHelpType(sb, "spawn_batches_total", "Batches released", "counter");
        appendMetric(sb, "spawn_batches_total", Map.of(), throttle.batches());

        appendHelpType(sb, "spawn_queue_depth", "Queued requests by priority", "gauge");
        for (SpawnPriority priority : SpawnPriority.values()) {
            appendMetric(sb, "spawn_queue_depth", Map.of("priority", priority.name()), queue.size(priority));
        }
        appendHelpType(sb, "spawn_queue_oldest_low_age_millis", "Age of the oldest LOW request", "gauge");
        appendMetric(sb, "spawn_queue_oldest_low_age_millis", Map.of(), queue.oldestLowAgeMillis());

        appendHelpType(sb, "spawn_in_flight", "Released requests awaiting an outcome", "gauge");
        appendMetric(sb, "spawn_in_flight", Map.of(), snapshot.service().inFlight());

        appendHelpType(sb, "spawn_batch_size", "Batch size the throttler would release now", "gauge");
        appendMetric(sb, "spawn_batch_size", Map.of(), throttle.currentBatchSize());
        appendHelpType(sb, "spawn_batch_interval_millis", "Current spacing between batches", "gauge");
        appendMetric(sb, "spawn_batch_interval_millis", Map.of(), throttle.currentIntervalMs());

        appendHelpType(sb, "spawn_pressure_level", "Resource pressure, 0=NORMAL .. 3=CRITICAL", "gauge");
        appendMetric(sb, "spawn_pressure_level", Map.of("level", status.pressure().name()), status.pressure().ordinal());
        appendHelpType(sb, "spawn_resource_sample_failures_total", "Resource counter reads that failed", "counter");
        appendMetric(sb, "spawn_resource_sample_failures_total", Map.of(), resource.sampleFailures());

        appendHelpType(sb, "spawn_circuit_state", "Circuit breaker state, 0=CLOSED 1=HALF_OPEN 2=OPEN", "gauge");
        appendMetric(sb, "spawn_circuit_state", Map.of("state", breaker.state().name()), breaker.state().ordinal());
        appendHelpType(sb, "spawn_circuit_opened_total", "Times the breaker opened", "counter");
        appendMetric(sb, "spawn_circuit_opened_total", Map.of(), breaker.timesOpened());

        appendHelpType(sb, "spawn_startup_phase", "Startup phase, 0=IMMEDIATE .. 4=STEADY_STATE", "gauge");
        appendMetric(sb, "spawn_startup_phase", Map.of("phase", startup.phase().name()), startup.phase().ordinal());

        appendHelpType(sb, "spawn_failures_total", "Failed spawn attempts by reason", "counter");
        for (Map.Entry<SpawnFailureReason, Long> e : throttle.failuresByReason().entrySet()) {
            appendMetric(sb, "spawn_failures_total", Map.of("reason", e.getKey().name()), e.getValue());
        }

        appendHelpType(sb, "spawn_gate_denials_total", "Ticks the admission gate stayed closed, by reason", "counter");
        for (Map.Entry<ThrottleReason, Long> e : throttle.gateDenials().entrySet()) {
            appendMetric(sb, "spawn_gate_denials_total", Map.of("reason", e.getKey().name()), e.getValue());
        }

        Map<String, Long> warnings = new LinkedHashMap<>();
        warnings.put("stale_in_flight", snapshot.service().staleInFlightWarnings());
        warnings.put("starvation", snapshot.service().starvationWarnings());
        appendHelpType(sb, "spawn_diagnostic_warnings_total", "Diagnostic warnings raised", "counter");
        for (Map.Entry<String, Long> e : warnings.entrySet()) {
            appendMetric(sb, "spawn_diagnostic_warnings_total", Map.of("kind", e.getKey()), e.getValue());
        }
        return sb.toString();
    }

    private static void appendHelpType(StringBuilder sb, String metric, String help, String type) {
        sb.append("# HELP ").append(metric).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(' ').append(type).append('\n');
    }

    private static void appendMetric(StringBuilder sb, String name, Map<String, String> labels, long value) {
        sb.append(name);
        if (labels != null && !labels.isEmpty()) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<String, String> e : labels.entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                sb.append(e.getKey()).append("=\"").append(escapeLabelValue(e.getValue())).append('"');
            }
            sb.append('}');
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabelValue(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }
}
