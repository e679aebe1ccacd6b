package com.acme.fleet.admission.queue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Four-tier priority queue of pending spawn requests.
 *
 * <p>Strict priority across tiers, FIFO within a tier. Each tier is an insertion-ordered
 * map so append, head removal and cancellation by id are all O(1). There is no aging:
 * sustained higher-tier load can hold {@link SpawnPriority#LOW} indefinitely.</p>
 *
 * <p>All entry points are synchronized on the queue; owners may enqueue and cancel from
 * their own threads while the tick thread dequeues.</p>
 *
 * <p>Invariant: {@code enqueued - dequeued - removed == getTotalSize() >= 0}.</p>
 */
public final class SpawnPriorityQueue {
    private final LinkedHashMap<Long, SpawnRequest>[] tiers;
    private final Map<Long, SpawnPriority> index = new HashMap<>();

    private long enqueued;
    private long dequeued;
    private long removed;
    private long duplicatesRejected;

    @SuppressWarnings("unchecked")
    public SpawnPriorityQueue() {
        SpawnPriority[] priorities = SpawnPriority.values();
        this.tiers = new LinkedHashMap[priorities.length];
        for (int i = 0; i < priorities.length; i++) {
            tiers[i] = new LinkedHashMap<>();
        }
    }

    /**
     * Appends the request to the tail of its tier. A request whose id is already queued
     * is rejected and the queue is left unchanged.
     */
    public synchronized EnqueueResult enqueue(SpawnRequest request) {
        Objects.requireNonNull(request, "request");
        Long id = request.requestId();
        if (index.containsKey(id)) {
            duplicatesRejected++;
            return new EnqueueResult.Duplicate(request.requestId());
        }
        tiers[request.priority().ordinal()].put(id, request);
        index.put(id, request.priority());
        enqueued++;
        return new EnqueueResult.Accepted(request.requestId(), index.size());
    }

    /**
     * Removes and returns the oldest request of the most urgent non-empty tier, or
     * {@code null} when the queue is empty.
     */
    public synchronized SpawnRequest dequeueNext() {
        return pollAtOrAbove(SpawnPriority.LOW);
    }

    /**
     * Same as {@link #dequeueNext()} but only tiers at least as urgent as {@code ceiling}
     * are considered; returns {@code null} when all of them are empty.
     */
    public synchronized SpawnRequest dequeueNextAtOrAbove(SpawnPriority ceiling) {
        return pollAtOrAbove(Objects.requireNonNull(ceiling, "ceiling"));
    }

    /**
     * Dequeues up to {@code max} requests in priority order under one lock acquisition.
     */
    public synchronized List<SpawnRequest> drain(SpawnPriority ceiling, int max) {
        Objects.requireNonNull(ceiling, "ceiling");
        if (max <= 0 || index.isEmpty()) {
            return List.of();
        }
        List<SpawnRequest> out = new ArrayList<>(Math.min(max, index.size()));
        while (out.size() < max) {
            SpawnRequest next = pollAtOrAbove(ceiling);
            if (next == null) {
                break;
            }
            out.add(next);
        }
        return out;
    }

    private SpawnRequest pollAtOrAbove(SpawnPriority ceiling) {
        for (int rank = 0; rank <= ceiling.ordinal(); rank++) {
            LinkedHashMap<Long, SpawnRequest> tier = tiers[rank];
            if (tier.isEmpty()) {
                continue;
            }
            Iterator<SpawnRequest> it = tier.values().iterator();
            SpawnRequest head = it.next();
            it.remove();
            index.remove(head.requestId());
            dequeued++;
            return head;
        }
        return null;
    }

    /**
     * Cancels a queued request. Returns {@code false} when the id is not queued, including
     * when it has already been dequeued.
     */
    public synchronized boolean removeRequest(long requestId) {
        SpawnPriority priority = index.remove(requestId);
        if (priority == null) {
            return false;
        }
        tiers[priority.ordinal()].remove(requestId);
        removed++;
        return true;
    }

    public synchronized int getQueueSize(SpawnPriority priority) {
        return tiers[priority.ordinal()].size();
    }

    public synchronized int getTotalSize() {
        return index.size();
    }

    public synchronized boolean isEmpty() {
        return index.isEmpty();
    }

    /**
     * Drops every queued request; they count as removed.
     *
     * @return the number of requests dropped
     */
    public synchronized int clearQueue() {
        int cleared = index.size();
        for (LinkedHashMap<Long, SpawnRequest> tier : tiers) {
            tier.clear();
        }
        index.clear();
        removed += cleared;
        return cleared;
    }

    /**
     * Age of the oldest request in {@code priority}, or 0 when the tier is empty.
     */
    public synchronized long oldestAgeMillis(SpawnPriority priority, long nowNanos) {
        LinkedHashMap<Long, SpawnRequest> tier = tiers[priority.ordinal()];
        if (tier.isEmpty()) {
            return 0L;
        }
        return tier.values().iterator().next().ageMillis(nowNanos);
    }

    /**
     * Queued requests of one tier in dequeue order.
     */
    public synchronized List<SpawnRequest> peekTier(SpawnPriority priority) {
        return Collections.unmodifiableList(new ArrayList<>(tiers[priority.ordinal()].values()));
    }

    public synchronized QueueSnapshot snapshot(long nowNanos) {
        return new QueueSnapshot(
            tiers[SpawnPriority.CRITICAL.ordinal()].size(),
            tiers[SpawnPriority.HIGH.ordinal()].size(),
            tiers[SpawnPriority.NORMAL.ordinal()].size(),
            tiers[SpawnPriority.LOW.ordinal()].size(),
            enqueued,
            dequeued,
            removed,
            duplicatesRejected,
            oldestAgeMillis(SpawnPriority.LOW, nowNanos)
        );
    }

    /**
     * Checks the accounting invariant; used by tests and drain-time diagnostics.
     */
    public synchronized boolean validateInvariants() {
        int tierTotal = 0;
        for (LinkedHashMap<Long, SpawnRequest> tier : tiers) {
            tierTotal += tier.size();
        }
        long expected = enqueued - dequeued - removed;
        return tierTotal == index.size() && expected == tierTotal && expected >= 0;
    }
}
