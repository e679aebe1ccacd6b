package com.acme.fleet.admission.resource;

/**
 * Reads host resource counters.
 *
 * <p>Implementations must not throw for a single unreadable counter; they report it as
 * unavailable in the returned sample. Calls come from the tick thread (or the background
 * sampling thread) and must not block for long.</p>
 */
@FunctionalInterface
public interface ResourceSampler {
    ResourceSample sample();
}
