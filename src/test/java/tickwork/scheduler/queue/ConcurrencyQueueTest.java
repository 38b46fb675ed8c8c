package tickwork.scheduler.queue;

import tickwork.scheduler.model.Priority;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;
import static tickwork.scheduler.queue.JobPriorityQueueTest.job;

class ConcurrencyQueueTest {

    @Test
    void globalCapLimitsAdmission() {
        ConcurrencyQueue queue = new ConcurrencyQueue(2, 10);
        queue.enqueue(job("a", "o1", Priority.NORMAL));
        queue.enqueue(job("b", "o2", Priority.NORMAL));
        queue.enqueue(job("c", "o3", Priority.NORMAL));

        assertTrue(queue.dequeue().isPresent());
        assertTrue(queue.dequeue().isPresent());
        assertTrue(queue.dequeue().isEmpty());
        assertEquals(2, queue.runningCount());
        assertEquals(1, queue.queuedCount());

        queue.complete("a");
        assertEquals("c", queue.dequeue().orElseThrow().id());
    }

    @Test
    void ownerAtCapBlocksTheHeadUntilCompleted() {
        ConcurrencyQueue queue = new ConcurrencyQueue(10, 1);
        queue.enqueue(job("a1", "alice", Priority.URGENT));
        queue.enqueue(job("a2", "alice", Priority.URGENT));
        queue.enqueue(job("b1", "bob", Priority.LOW));

        assertEquals("a1", queue.dequeue().orElseThrow().id());
        // a2 is at the head and alice is at her cap
        assertTrue(queue.dequeue().isEmpty());
        assertEquals(2, queue.queuedCount());
        assertEquals(0, queue.runningFor("bob"));

        queue.complete("a1");
        assertEquals("a2", queue.dequeue().orElseThrow().id());
        // bob's job is now at the head and bob has a free slot
        assertEquals("b1", queue.dequeue().orElseThrow().id());
        assertEquals(0, queue.queuedCount());
        assertEquals(1, queue.runningFor("alice"));
    }

    @Test
    void duplicateEnqueueIsRefused() {
        ConcurrencyQueue queue = new ConcurrencyQueue(5, 5);

        assertTrue(queue.enqueue(job("a", "o", Priority.NORMAL)));
        assertFalse(queue.enqueue(job("a", "o", Priority.NORMAL)), "already queued");

        queue.dequeue();
        assertFalse(queue.enqueue(job("a", "o", Priority.NORMAL)), "already running");

        queue.complete("a");
        assertTrue(queue.enqueue(job("a", "o", Priority.NORMAL)));
    }

    @Test
    void completeOfUnknownJobIsIgnored() {
        ConcurrencyQueue queue = new ConcurrencyQueue(1, 1);
        queue.complete("missing");

        assertEquals(0, queue.runningCount());
    }

    @Test
    void statsReportQueuedByPriority() {
        ConcurrencyQueue queue = new ConcurrencyQueue(3, 2);
        queue.enqueue(job("a", "o", Priority.HIGH));
        queue.enqueue(job("b", "o", Priority.HIGH));
        queue.enqueue(job("c", "o", Priority.LOW));
        queue.dequeue();

        QueueStats stats = queue.stats();

        assertEquals(2, stats.queued());
        assertEquals(1, stats.running());
        assertEquals(3, stats.maxConcurrent());
        assertEquals(2, stats.maxPerOwner());
        assertEquals(1, stats.queuedByPriority().get(Priority.HIGH));
        assertEquals(1, stats.queuedByPriority().get(Priority.LOW));
        assertEquals(0, stats.queuedByPriority().get(Priority.URGENT));
    }

    @Test
    void removeDropsQueuedJob() {
        ConcurrencyQueue queue = new ConcurrencyQueue(1, 1);
        queue.enqueue(job("a", "o", Priority.NORMAL));

        assertTrue(queue.remove("a"));
        assertEquals(0, queue.queuedCount());
        assertTrue(queue.dequeue().isEmpty());
    }

    @Test
    void invalidCapsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ConcurrencyQueue(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new ConcurrencyQueue(1, 0));
    }
}
