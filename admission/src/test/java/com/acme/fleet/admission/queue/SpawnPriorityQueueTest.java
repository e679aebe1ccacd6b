package com.acme.fleet.admission.queue;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpawnPriorityQueueTest {
    private final SpawnPriorityQueue queue = new SpawnPriorityQueue();

    @Test
    void shouldDequeueCriticalBeforeLow() {
        queue.enqueue(request(1, SpawnPriority.LOW));
        queue.enqueue(request(2, SpawnPriority.CRITICAL));

        assertEquals(2L, queue.dequeueNext().requestId());
        assertEquals(1L, queue.dequeueNext().requestId());
        assertNull(queue.dequeueNext());
    }

    @Test
    void shouldAlwaysPreferCriticalRegardlessOfArrivalOrder() {
        queue.enqueue(request(1, SpawnPriority.NORMAL));
        queue.enqueue(request(2, SpawnPriority.HIGH));
        queue.enqueue(request(3, SpawnPriority.LOW));
        queue.enqueue(request(4, SpawnPriority.CRITICAL));

        assertEquals(SpawnPriority.CRITICAL, queue.dequeueNext().priority());
        assertEquals(SpawnPriority.HIGH, queue.dequeueNext().priority());
        assertEquals(SpawnPriority.NORMAL, queue.dequeueNext().priority());
        assertEquals(SpawnPriority.LOW, queue.dequeueNext().priority());
    }

    @Test
    void shouldKeepFifoWithinTier() {
        queue.enqueue(request(10, SpawnPriority.NORMAL));
        queue.enqueue(request(11, SpawnPriority.NORMAL));
        queue.enqueue(request(12, SpawnPriority.NORMAL));

        assertEquals(List.of(10L, 11L, 12L), ids(queue.drain(SpawnPriority.LOW, 10)));
    }

    @Test
    void shouldPreserveRelativeOrderAfterRemovingMiddleRequest() {
        queue.enqueue(request(1, SpawnPriority.NORMAL));
        queue.enqueue(request(2, SpawnPriority.NORMAL));
        queue.enqueue(request(3, SpawnPriority.NORMAL));

        assertTrue(queue.removeRequest(2));

        assertEquals(1L, queue.dequeueNext().requestId());
        assertEquals(3L, queue.dequeueNext().requestId());
        assertTrue(queue.isEmpty());
    }

    @Test
    void shouldRejectDuplicateIdWithoutChangingQueue() {
        assertTrue(queue.enqueue(request(7, SpawnPriority.HIGH)).accepted());
        EnqueueResult second = queue.enqueue(request(7, SpawnPriority.LOW));

        assertInstanceOf(EnqueueResult.Duplicate.class, second);
        assertEquals(1, queue.getTotalSize());
        assertEquals(0, queue.getQueueSize(SpawnPriority.LOW));
        assertEquals(1L, queue.snapshot(0L).duplicatesRejected());
    }

    @Test
    void shouldRespectPriorityCeiling() {
        queue.enqueue(request(1, SpawnPriority.LOW));
        queue.enqueue(request(2, SpawnPriority.NORMAL));

        assertNull(queue.dequeueNextAtOrAbove(SpawnPriority.HIGH));
        assertEquals(2L, queue.dequeueNextAtOrAbove(SpawnPriority.NORMAL).requestId());
        assertNull(queue.dequeueNextAtOrAbove(SpawnPriority.NORMAL));
        assertEquals(1, queue.getTotalSize());
    }

    @Test
    void shouldNotReturnRemovedOrAlreadyDequeuedRequests() {
        queue.enqueue(request(1, SpawnPriority.HIGH));
        assertEquals(1L, queue.dequeueNext().requestId());
        assertFalse(queue.removeRequest(1));
        assertFalse(queue.removeRequest(99));
    }

    @Test
    void shouldCountClearedRequestsAsRemoved() {
        queue.enqueue(request(1, SpawnPriority.HIGH));
        queue.enqueue(request(2, SpawnPriority.LOW));

        assertEquals(2, queue.clearQueue());

        QueueSnapshot snapshot = queue.snapshot(0L);
        assertEquals(0, snapshot.total());
        assertEquals(2L, snapshot.removed());
        assertTrue(queue.validateInvariants());
    }

    @Test
    void shouldReportOldestLowAge() {
        queue.enqueue(new SpawnRequest(1, SpawnPriority.LOW, 1_000_000_000L, 0, "refill"));
        queue.enqueue(new SpawnRequest(2, SpawnPriority.LOW, 3_000_000_000L, 0, "refill"));

        assertEquals(4_000L, queue.oldestAgeMillis(SpawnPriority.LOW, 5_000_000_000L));
        assertEquals(0L, queue.oldestAgeMillis(SpawnPriority.CRITICAL, 5_000_000_000L));
    }

    @Test
    void shouldHoldSizeInvariantOverRandomOperations() {
        Random random = new Random(42L);
        Set<Long> seen = new HashSet<>();
        long nextId = 1L;
        long enqueued = 0L;
        long dequeued = 0L;
        long removed = 0L;
        for (int i = 0; i < 5_000; i++) {
            int op = random.nextInt(10);
            if (op < 5) {
                SpawnPriority priority = SpawnPriority.values()[random.nextInt(4)];
                if (queue.enqueue(request(nextId++, priority)).accepted()) {
                    enqueued++;
                }
            } else if (op < 8) {
                SpawnRequest next = queue.dequeueNext();
                if (next != null) {
                    dequeued++;
                    assertTrue(seen.add(next.requestId()), "returned twice: " + next.requestId());
                }
            } else if (nextId > 1L && queue.removeRequest(1L + random.nextInt((int) (nextId - 1L)))) {
                removed++;
            }
            assertEquals(enqueued - dequeued - removed, queue.getTotalSize());
            assertTrue(queue.getTotalSize() >= 0);
        }
        assertTrue(queue.validateInvariants());
        QueueSnapshot snapshot = queue.snapshot(0L);
        assertEquals(enqueued, snapshot.enqueued());
        assertEquals(dequeued, snapshot.dequeued());
        assertEquals(removed, snapshot.removed());
    }

    private static SpawnRequest request(long id, SpawnPriority priority) {
        return new SpawnRequest(id, priority, 0L, 0, "test");
    }

    private static List<Long> ids(List<SpawnRequest> requests) {
        List<Long> out = new ArrayList<>(requests.size());
        for (SpawnRequest r : requests) {
            out.add(r.requestId());
        }
        return out;
    }
}
