package tickwork.scheduler.queue;

import tickwork.scheduler.model.Priority;
import tickwork.scheduler.model.ScheduledJob;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobPriorityQueueTest {

    static ScheduledJob job(String id, String owner, Priority priority) {
        return ScheduledJob.builder()
                .id(id)
                .ownerId(owner)
                .name(id)
                .jobType("noop")
                .priority(priority)
                .build();
    }

    @Test
    void popsByPriorityThenInsertionOrder() {
        JobPriorityQueue queue = new JobPriorityQueue();
        queue.push(job("low", "o", Priority.LOW));
        queue.push(job("normal-1", "o", Priority.NORMAL));
        queue.push(job("urgent", "o", Priority.URGENT));
        queue.push(job("normal-2", "o", Priority.NORMAL));
        queue.push(job("high", "o", Priority.HIGH));

        assertEquals("urgent", queue.pop().orElseThrow().id());
        assertEquals("high", queue.pop().orElseThrow().id());
        assertEquals("normal-1", queue.pop().orElseThrow().id());
        assertEquals("normal-2", queue.pop().orElseThrow().id());
        assertEquals("low", queue.pop().orElseThrow().id());
        assertTrue(queue.pop().isEmpty());
    }

    @Test
    void removeAndContainsById() {
        JobPriorityQueue queue = new JobPriorityQueue();
        queue.push(job("a", "o", Priority.NORMAL));
        queue.push(job("b", "o", Priority.HIGH));

        assertTrue(queue.contains("a"));
        assertTrue(queue.remove("a"));
        assertFalse(queue.contains("a"));
        assertFalse(queue.remove("a"));
        assertEquals(List.of("b"), queue.byPriority(Priority.HIGH).stream().map(ScheduledJob::id).toList());

        queue.clear();
        assertTrue(queue.isEmpty());
    }
}
