package com.acme.fleet.admission.resource;

/**
 * Coarse classification of host load, ordered from least to most severe.
 */
public enum PressureLevel {
    NORMAL(1.0d),
    ELEVATED(0.75d),
    HIGH(0.4d),
    CRITICAL(0.0d);

    private final double spawnRateMultiplier;

    PressureLevel(double spawnRateMultiplier) {
        this.spawnRateMultiplier = spawnRateMultiplier;
    }

    /**
     * Advisory share of the nominal spawn rate at this level, non-increasing with severity.
     */
    public double spawnRateMultiplier() {
        return spawnRateMultiplier;
    }

    public static PressureLevel max(PressureLevel a, PressureLevel b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
