package com.acme.fleet.admission.runtime;

import com.acme.fleet.admission.queue.SpawnRequest;

import java.util.concurrent.CompletionStage;

/**
 * Owner-side provisioning action invoked by {@link SpawnTickDriver} for each released request.
 *
 * <p>Called on the tick thread, so implementations should hand blocking work off and
 * complete the stage later. Throwing, returning {@code null} or completing exceptionally
 * all count as a {@code HANDLER_ERROR} failure.</p>
 */
@FunctionalInterface
public interface SpawnHandler {
    CompletionStage<SpawnOutcome> spawn(SpawnRequest request);
}
