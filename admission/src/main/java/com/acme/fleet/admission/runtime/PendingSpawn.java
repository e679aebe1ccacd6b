package com.acme.fleet.admission.runtime;

import com.acme.fleet.admission.queue.SpawnPriority;

import java.util.Objects;

/**
 * One entry of a bulk startup backlog; the service assigns the request id.
 */
public record PendingSpawn(SpawnPriority priority, String reason) {
    public PendingSpawn {
        Objects.requireNonNull(priority, "priority");
    }
}
