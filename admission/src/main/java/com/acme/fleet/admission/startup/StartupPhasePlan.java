package com.acme.fleet.admission.startup;

import com.acme.fleet.admission.config.InvalidConfigurationException;
import com.acme.fleet.admission.util.AdmissionDefaults;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Settings of the four timed startup phases.
 */
public record StartupPhasePlan(
    PhaseSettings immediate,
    PhaseSettings rapid,
    PhaseSettings steady,
    PhaseSettings background
) {
    public StartupPhasePlan {
        Objects.requireNonNull(immediate, "immediate");
        Objects.requireNonNull(rapid, "rapid");
        Objects.requireNonNull(steady, "steady");
        Objects.requireNonNull(background, "background");
    }

    public static StartupPhasePlan defaults() {
        return new StartupPhasePlan(
            new PhaseSettings(AdmissionDefaults.DEFAULT_IMMEDIATE_TARGET,
                AdmissionDefaults.DEFAULT_IMMEDIATE_DURATION_MS, AdmissionDefaults.DEFAULT_IMMEDIATE_MULTIPLIER),
            new PhaseSettings(AdmissionDefaults.DEFAULT_RAPID_TARGET,
                AdmissionDefaults.DEFAULT_RAPID_DURATION_MS, AdmissionDefaults.DEFAULT_RAPID_MULTIPLIER),
            new PhaseSettings(AdmissionDefaults.DEFAULT_STEADY_TARGET,
                AdmissionDefaults.DEFAULT_STEADY_DURATION_MS, AdmissionDefaults.DEFAULT_STEADY_MULTIPLIER),
            new PhaseSettings(AdmissionDefaults.DEFAULT_BACKGROUND_TARGET,
                AdmissionDefaults.DEFAULT_BACKGROUND_DURATION_MS, AdmissionDefaults.DEFAULT_BACKGROUND_MULTIPLIER)
        );
    }

    public PhaseSettings settingsFor(SpawnPhase phase) {
        return switch (phase) {
            case IMMEDIATE -> immediate;
            case RAPID -> rapid;
            case STEADY -> steady;
            case BACKGROUND -> background;
            case STEADY_STATE -> PhaseSettings.STEADY_STATE;
        };
    }

    public long totalDurationMs() {
        return immediate.durationMs() + rapid.durationMs() + steady.durationMs() + background.durationMs();
    }

    public void collectViolations(List<String> out) {
        for (SpawnPhase phase : SpawnPhase.values()) {
            if (phase.isTerminal()) {
                continue;
            }
            PhaseSettings s = settingsFor(phase);
            if (s.targetCount() < 0) {
                out.add(phase + " targetCount must be >= 0");
            }
            if (s.durationMs() < 0L) {
                out.add(phase + " durationMs must be >= 0");
            }
            if (!(s.rateMultiplier() > 0.0d) || Double.isInfinite(s.rateMultiplier())) {
                out.add(phase + " rateMultiplier must be a positive finite number (was " + s.rateMultiplier() + ")");
            }
        }
    }

    public StartupPhasePlan validated() {
        List<String> violations = new ArrayList<>();
        collectViolations(violations);
        InvalidConfigurationException.throwIfAny(violations);
        return this;
    }
}
