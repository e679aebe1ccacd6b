package com.acme.fleet.admission.queue;

public record QueueSnapshot(
    int critical,
    int high,
    int normal,
    int low,
    long enqueued,
    long dequeued,
    long removed,
    long duplicatesRejected,
    long oldestLowAgeMillis
) {
    public int total() {
        return critical + high + normal + low;
    }

    public int size(SpawnPriority priority) {
        return switch (priority) {
            case CRITICAL -> critical;
            case HIGH -> high;
            case NORMAL -> normal;
            case LOW -> low;
        };
    }
}
