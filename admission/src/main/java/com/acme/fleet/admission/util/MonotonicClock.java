package com.acme.fleet.admission.util;

/**
 * Source of monotonic nanosecond timestamps. Injected so windowed state can be driven
 * deterministically.
 */
@FunctionalInterface
public interface MonotonicClock {
    MonotonicClock SYSTEM = System::nanoTime;

    long nanoTime();
}
