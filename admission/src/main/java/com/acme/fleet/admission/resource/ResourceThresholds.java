package com.acme.fleet.admission.resource;

import com.acme.fleet.admission.config.InvalidConfigurationException;
import com.acme.fleet.admission.util.AdmissionDefaults;

import java.util.ArrayList;
import java.util.List;

/**
 * Percent thresholds separating pressure levels, plus the downgrade hysteresis margin.
 *
 * <p>A value at or above the elevated or high threshold enters that level; critical is entered
 * only strictly above its threshold. Leaving a level towards a less
 * severe one requires the value to drop below {@code threshold - hysteresisPercent}.</p>
 */
public record ResourceThresholds(
    double cpuElevated,
    double cpuHigh,
    double cpuCritical,
    double memoryElevated,
    double memoryHigh,
    double memoryCritical,
    double connectionThresholdPercent,
    double hysteresisPercent
) {
    public static ResourceThresholds defaults() {
        return new ResourceThresholds(
            AdmissionDefaults.DEFAULT_CPU_ELEVATED,
            AdmissionDefaults.DEFAULT_CPU_HIGH,
            AdmissionDefaults.DEFAULT_CPU_CRITICAL,
            AdmissionDefaults.DEFAULT_MEMORY_ELEVATED,
            AdmissionDefaults.DEFAULT_MEMORY_HIGH,
            AdmissionDefaults.DEFAULT_MEMORY_CRITICAL,
            AdmissionDefaults.DEFAULT_CONNECTION_THRESHOLD,
            AdmissionDefaults.DEFAULT_PRESSURE_HYSTERESIS
        );
    }

    public ResourceThresholds withHysteresis(double percent) {
        return new ResourceThresholds(cpuElevated, cpuHigh, cpuCritical,
            memoryElevated, memoryHigh, memoryCritical, connectionThresholdPercent, percent);
    }

    public PressureLevel classifyCpu(double cpuPercent, PressureLevel previous) {
        return classify(cpuPercent, cpuElevated, cpuHigh, cpuCritical, previous);
    }

    public PressureLevel classifyMemory(double memoryPercent, PressureLevel previous) {
        return classify(memoryPercent, memoryElevated, memoryHigh, memoryCritical, previous);
    }

    public PressureLevel classifyConnections(ResourceMetrics metrics) {
        if (metrics.connectionPoolExhausted()) {
            return PressureLevel.CRITICAL;
        }
        if (metrics.maxConnections() > 0 && metrics.connectionUsagePercent() >= connectionThresholdPercent) {
            return PressureLevel.HIGH;
        }
        return PressureLevel.NORMAL;
    }

    private PressureLevel classify(double value,
                                   double elevated,
                                   double high,
                                   double critical,
                                   PressureLevel previous) {
        PressureLevel raw = rawLevel(value, elevated, high, critical);
        if (previous == null || raw.ordinal() >= previous.ordinal() || hysteresisPercent <= 0.0d) {
            return raw;
        }
        // Downgrade only as far as the value has cleared each threshold by the margin.
        PressureLevel[] levels = PressureLevel.values();
        for (int i = previous.ordinal(); i > raw.ordinal(); i--) {
            double entry = thresholdOf(levels[i], elevated, high, critical);
            if (value >= entry - hysteresisPercent) {
                return levels[i];
            }
        }
        return raw;
    }

    private static PressureLevel rawLevel(double value, double elevated, double high, double critical) {
        if (value > critical) {
            return PressureLevel.CRITICAL;
        }
        if (value >= high) {
            return PressureLevel.HIGH;
        }
        if (value >= elevated) {
            return PressureLevel.ELEVATED;
        }
        return PressureLevel.NORMAL;
    }

    private static double thresholdOf(PressureLevel level, double elevated, double high, double critical) {
        return switch (level) {
            case NORMAL -> 0.0d;
            case ELEVATED -> elevated;
            case HIGH -> high;
            case CRITICAL -> critical;
        };
    }

    public void collectViolations(List<String> out) {
        checkLadder(out, "cpu", cpuElevated, cpuHigh, cpuCritical);
        checkLadder(out, "memory", memoryElevated, memoryHigh, memoryCritical);
        if (!inPercentRange(connectionThresholdPercent)) {
            out.add("connectionThresholdPercent must be within [0, 100] (was " + connectionThresholdPercent + ")");
        }
        if (!(hysteresisPercent >= 0.0d) || hysteresisPercent > 50.0d) {
            out.add("hysteresisPercent must be within [0, 50] (was " + hysteresisPercent + ")");
        }
    }

    public ResourceThresholds validated() {
        List<String> violations = new ArrayList<>();
        collectViolations(violations);
        InvalidConfigurationException.throwIfAny(violations);
        return this;
    }

    private static void checkLadder(List<String> out, String name, double elevated, double high, double critical) {
        if (!inPercentRange(elevated) || !inPercentRange(high) || !inPercentRange(critical)) {
            out.add(name + " thresholds must be within [0, 100]");
            return;
        }
        if (elevated > high || high > critical) {
            out.add(name + " thresholds must ascend: elevated " + elevated
                + " <= high " + high + " <= critical " + critical);
        }
    }

    private static boolean inPercentRange(double v) {
        return v >= 0.0d && v <= 100.0d;
    }
}
