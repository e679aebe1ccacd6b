package com.acme.fleet.admission.throttle;

/**
 * Why the owner could not bring a worker online. Reported back with each failed outcome
 * and counted per reason; the breaker treats all of them alike.
 */
public enum SpawnFailureReason {
    NO_ACCOUNT_AVAILABLE,
    NO_CHARACTER_AVAILABLE,
    SESSION_CREATE_FAILED,
    LOGIN_FAILED,
    WORKER_NOT_CREATED,
    AI_CREATE_FAILED,
    LIFECYCLE_TRANSITION_FAILED,
    GLOBAL_CAP_REACHED,
    TIMEOUT,
    HANDLER_ERROR,
    UNKNOWN;

    public static SpawnFailureReason orUnknown(SpawnFailureReason reason) {
        return reason == null ? UNKNOWN : reason;
    }
}
