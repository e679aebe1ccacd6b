package com.acme.fleet.admission.config;

import com.acme.fleet.admission.breaker.CircuitBreakerConfig;
import com.acme.fleet.admission.resource.ResourceThresholds;
import com.acme.fleet.admission.startup.PhaseSettings;
import com.acme.fleet.admission.startup.StartupPhasePlan;
import com.acme.fleet.admission.throttle.ThrottleConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdmissionConfigTest {

    @Test
    void shouldAcceptDefaults() {
        AdmissionConfig config = AdmissionConfig.defaults();
        assertSame(config, config.validate());
        assertEquals(10, config.throttle().baseBatchSize());
        assertEquals(100L, config.throttle().baseBatchIntervalMs());
    }

    @Test
    void shouldRejectMinBatchAboveMax() {
        AdmissionConfig config = AdmissionConfig.defaults()
            .withThrottle(new ThrottleConfig(20, 5, 10, 100L, 5_000L, 1.0d, true, true, true, 10, 500));

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class, config::validate);

        assertEquals(1, e.violations().size());
        assertTrue(e.violations().get(0).contains("minBatchSize"));
    }

    @Test
    void shouldCollectEveryViolation() {
        AdmissionConfig config = AdmissionConfig.defaults()
            .withThrottle(new ThrottleConfig(1, 50, 10, 100L, 50L, 1.0d, true, true, true, 10, 500))
            .withThresholds(new ResourceThresholds(90.0d, 80.0d, 70.0d, 70.0d, 80.0d, 90.0d, 80.0d, 5.0d))
            .withCircuitBreaker(new CircuitBreakerConfig(10.0d, 20.0d, 30, 10, 60, 20, 5));

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class, config::validate);

        assertEquals(3, e.violations().size());
        assertTrue(e.getMessage().contains("maxBatchIntervalMs"));
        assertTrue(e.getMessage().contains("cpu thresholds must ascend"));
        assertTrue(e.getMessage().contains("closeThresholdPercent"));
    }

    @Test
    void shouldRejectNonPositivePhaseMultiplier() {
        StartupPhasePlan defaults = StartupPhasePlan.defaults();
        AdmissionConfig config = AdmissionConfig.defaults().withStartupPlan(new StartupPhasePlan(
            defaults.immediate(), new PhaseSettings(200, 90_000L, 0.0d), defaults.steady(), defaults.background()));

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class, config::validate);

        assertTrue(e.violations().get(0).startsWith("RAPID rateMultiplier"));
    }

    @Test
    void shouldAllowBurstSettingsToBeIgnoredWhenDisabled() {
        AdmissionConfig config = AdmissionConfig.defaults()
            .withThrottle(new ThrottleConfig(1, 50, 10, 100L, 5_000L, 1.0d, true, true, false, 0, 0));

        assertSame(config, config.validate());
    }
}
