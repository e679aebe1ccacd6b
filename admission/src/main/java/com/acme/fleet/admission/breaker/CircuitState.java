package com.acme.fleet.admission.breaker;

public enum CircuitState {
    CLOSED,
    HALF_OPEN,
    OPEN
}
