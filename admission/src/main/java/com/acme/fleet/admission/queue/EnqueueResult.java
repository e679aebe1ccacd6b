package com.acme.fleet.admission.queue;

public sealed interface EnqueueResult permits EnqueueResult.Accepted, EnqueueResult.Duplicate {
    record Accepted(long requestId, int depth) implements EnqueueResult {}
    record Duplicate(long requestId) implements EnqueueResult {}

    default boolean accepted() {
        return this instanceof Accepted;
    }
}
