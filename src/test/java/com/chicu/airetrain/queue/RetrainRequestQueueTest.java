package com.chicu.airetrain.queue;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetrainRequestQueueTest {

    private static final Instant T0 = Instant.parse("2026-03-11T10:00:00Z");
    private static final Instant WINDOW = Instant.parse("2026-03-09T00:00:00Z");

    private final RetrainRequestQueue queue = new RetrainRequestQueue();

    @Test
    void offer_shouldKeepOnlyOnePendingPerTarget() {
        assertTrue(queue.offer(RetrainRequest.create("demand-eu", 0.85, T0, WINDOW)));
        assertFalse(queue.offer(RetrainRequest.create("demand-eu", 0.95, T0.plusSeconds(5), WINDOW)));

        assertEquals(1, queue.size());
        assertEquals(0.85, queue.pending("demand-eu").orElseThrow().triggerSeverity());
    }

    @Test
    void coalesce_shouldTakeMaxSeverityAndCountEvents() {
        RetrainRequest r1 = RetrainRequest.create("demand-eu", 0.9, T0, WINDOW);
        queue.offer(r1);

        queue.coalesce("demand-eu", 0.82);
        RetrainRequest merged = queue.coalesce("demand-eu", 0.88).orElseThrow();

        assertEquals(r1.requestId(), merged.requestId());
        assertEquals(0.9, merged.triggerSeverity());
        assertEquals(3, merged.coalescedCount());
        assertEquals(T0, merged.createdAt(), "coalescing must not move the request in the FIFO order");
    }

    @Test
    void coalesce_withoutPending_shouldReturnEmpty() {
        assertTrue(queue.coalesce("nobody", 0.99).isEmpty());
        assertEquals(0, queue.size());
    }

    @Test
    void ordered_shouldSortByPriorityThenFifo() {
        RetrainRequest lowEarly = RetrainRequest.create("a", 0.81, T0, WINDOW);
        RetrainRequest highLate = RetrainRequest.create("b", 0.97, T0.plusSeconds(30), WINDOW);
        RetrainRequest lowLate = RetrainRequest.create("c", 0.84, T0.plusSeconds(10), WINDOW);
        queue.offer(lowLate);
        queue.offer(highLate);
        queue.offer(lowEarly);

        List<RetrainRequest> ordered = queue.ordered();

        assertEquals(List.of("b", "a", "c"), ordered.stream().map(RetrainRequest::targetId).toList());
    }

    @Test
    void coalescedSeverity_shouldRaisePriority() {
        queue.offer(RetrainRequest.create("a", 0.95, T0, WINDOW));
        queue.offer(RetrainRequest.create("b", 0.81, T0.plusSeconds(1), WINDOW));

        queue.coalesce("b", 1.0);

        assertEquals("b", queue.ordered().get(0).targetId());
    }

    @Test
    void remove_shouldIgnoreStaleRequestId() {
        RetrainRequest r1 = RetrainRequest.create("a", 0.9, T0, WINDOW);
        queue.offer(r1);

        assertTrue(queue.remove("a", "other-id").isEmpty());
        assertTrue(queue.hasPending("a"));

        queue.coalesce("a", 0.93);
        RetrainRequest removed = queue.remove("a", r1.requestId()).orElseThrow();
        assertEquals(2, removed.coalescedCount());
        assertFalse(queue.hasPending("a"));
    }

    @Test
    void offerOrMerge_shouldMergeIntoExisting() {
        RetrainRequest existing = RetrainRequest.create("a", 0.85, T0, WINDOW);
        queue.offer(existing);

        RetrainRequest retry = RetrainRequest.create("a", 0.92, T0, WINDOW).retry(T0.plusSeconds(300), WINDOW);
        assertFalse(queue.offerOrMerge(retry));

        RetrainRequest pending = queue.pending("a").orElseThrow();
        assertEquals(existing.requestId(), pending.requestId());
        assertEquals(0.92, pending.triggerSeverity());
    }

    @Test
    void isFull_shouldCompareWithCapacity() {
        queue.offer(RetrainRequest.create("a", 0.9, T0, WINDOW));
        queue.offer(RetrainRequest.create("b", 0.9, T0, WINDOW));

        assertTrue(queue.isFull(2));
        assertFalse(queue.isFull(3));
    }

    @Test
    void priorityOf_shouldBeClampedToTenBuckets() {
        assertEquals(8, RetrainRequest.priorityOf(0.85));
        assertEquals(10, RetrainRequest.priorityOf(1.0));
        assertEquals(0, RetrainRequest.priorityOf(0.0));
    }
}
