package com.acme.fleet.admission.queue;

/**
 * Strict request ranking; declaration order is rank order, most urgent first.
 */
public enum SpawnPriority {
    CRITICAL,
    HIGH,
    NORMAL,
    LOW
}
