package com.acme.fleet.admission.runtime;

import com.acme.fleet.admission.config.AdmissionConfig;
import com.acme.fleet.admission.config.AdmissionConfigLoader;
import com.acme.fleet.admission.config.RuntimeSettings;
import com.acme.fleet.admission.resource.BackgroundResourceSampler;
import com.acme.fleet.admission.resource.JvmResourceSampler;
import com.acme.fleet.admission.resource.ResourceSampler;
import com.acme.fleet.admission.telemetry.MetricsHttpEndpoint;
import com.acme.fleet.admission.telemetry.PeriodicMetricsReporter;

import java.util.Map;
import java.util.Objects;
import java.util.function.IntSupplier;
import java.util.logging.Logger;

/**
 * Wires config, sampler, service, tick driver and optional telemetry into one closeable unit.
 */
public final class SpawnAdmissionRuntime implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(SpawnAdmissionRuntime.class.getName());

    private final AdmissionConfig config;
    private final SpawnAdmissionService service;
    private final SpawnTickDriver driver;
    private final BackgroundResourceSampler backgroundSampler;
    private final PeriodicMetricsReporter metricsReporter;
    private final MetricsHttpEndpoint metricsEndpoint;

    private SpawnAdmissionRuntime(AdmissionConfig config,
                                  SpawnAdmissionService service,
                                  SpawnTickDriver driver,
                                  BackgroundResourceSampler backgroundSampler,
                                  PeriodicMetricsReporter metricsReporter,
                                  MetricsHttpEndpoint metricsEndpoint) {
        this.config = config;
        this.service = service;
        this.driver = driver;
        this.backgroundSampler = backgroundSampler;
        this.metricsReporter = metricsReporter;
        this.metricsEndpoint = metricsEndpoint;
    }

    /**
     * Reads {@code SPAWN_*} variables from the process environment and samples the JVM
     * for CPU and heap.
     */
    public static SpawnAdmissionRuntime fromEnvironment(SpawnHandler handler,
                                                        IntSupplier activeConnections,
                                                        IntSupplier maxConnections,
                                                        IntSupplier activeWorkers) {
        return fromEnvironment(System.getenv(), handler,
            new JvmResourceSampler(activeConnections, maxConnections, activeWorkers));
    }

    public static SpawnAdmissionRuntime fromEnvironment(Map<String, String> env,
                                                        SpawnHandler handler,
                                                        ResourceSampler sampler) {
        return create(AdmissionConfigLoader.fromEnvironment(env), handler, sampler);
    }

    public static SpawnAdmissionRuntime create(AdmissionConfig config, SpawnHandler handler, ResourceSampler sampler) {
        AdmissionConfig validated = Objects.requireNonNull(config, "config").validate();
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(sampler, "sampler");
        RuntimeSettings settings = validated.runtime();

        BackgroundResourceSampler background = null;
        ResourceSampler effectiveSampler = sampler;
        if (settings.backgroundSampling()) {
            background = new BackgroundResourceSampler(sampler, Math.max(1L, settings.sampleIntervalMs()));
            effectiveSampler = background;
        }
        SpawnAdmissionService service = new SpawnAdmissionService(validated, effectiveSampler);
        SpawnTickDriver driver = new SpawnTickDriver(service, handler, settings.tickPeriodMs());

        PeriodicMetricsReporter reporter = null;
        MetricsHttpEndpoint endpoint = null;
        if (settings.metricsEnabled()) {
            reporter = new PeriodicMetricsReporter(service::metrics, settings.metricsLogIntervalSec());
            if (settings.metricsHttpEnabled()) {
                try {
                    endpoint = new MetricsHttpEndpoint(service::metrics, service::summary,
                        settings.metricsHttpPort(), settings.metricsHttpPath());
                } catch (Exception e) {
                    LOG.warning("Metrics endpoint init failed: " + e.getClass().getSimpleName());
                }
            }
        }
        return new SpawnAdmissionRuntime(validated, service, driver, background, reporter, endpoint);
    }

    public void start() {
        if (backgroundSampler != null) {
            backgroundSampler.start();
        }
        driver.start();
        if (metricsReporter != null) {
            metricsReporter.start();
        }
        if (metricsEndpoint != null) {
            metricsEndpoint.start();
        }
        LOG.info(() -> "spawn admission runtime started: " + service.summary());
    }

    public SpawnAdmissionService service() {
        return service;
    }

    public SpawnTickDriver driver() {
        return driver;
    }

    public AdmissionConfig config() {
        return config;
    }

    boolean hasMetricsEndpoint() {
        return metricsEndpoint != null;
    }

    boolean hasBackgroundSampler() {
        return backgroundSampler != null;
    }

    @Override
    public void close() {
        if (metricsEndpoint != null) {
            metricsEndpoint.close();
        }
        if (metricsReporter != null) {
            metricsReporter.close();
        }
        driver.close();
        if (backgroundSampler != null) {
            backgroundSampler.close();
        }
        LOG.info("spawn admission runtime stopped");
    }
}
