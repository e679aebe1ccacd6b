package com.acme.fleet.admission.startup;

import com.acme.fleet.admission.queue.SpawnRequest;

import java.util.List;

/**
 * Receives batches released by the admission logic; the hand-off point to the owner.
 * Once a request is handed off it can no longer be cancelled through the queue.
 */
@FunctionalInterface
public interface SpawnBatchSink {
    void accept(List<SpawnRequest> batch);
}
