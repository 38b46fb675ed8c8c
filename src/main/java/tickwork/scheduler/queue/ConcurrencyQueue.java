package tickwork.scheduler.queue;

import tickwork.scheduler.model.Priority;
import tickwork.scheduler.model.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Admission control over due jobs.
 *
 * Wraps a {@link JobPriorityQueue} with a global running count and a per-owner
 * running count. The head job is admitted only while both are below their caps;
 * otherwise it stays queued for the next cycle. There is no
 * starvation guarantee beyond priority order and FIFO among peers.
 */
public final class ConcurrencyQueue {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyQueue.class);

    private final JobPriorityQueue queue = new JobPriorityQueue();
    private final Map<String, String> running = new HashMap<>(); // jobId -> ownerId
    private final Map<String, Integer> runningPerOwner = new HashMap<>();
    private final int maxConcurrent;
    private final int maxPerOwner;

    public ConcurrencyQueue(int maxConcurrent, int maxPerOwner) {
        if (maxConcurrent < 1 || maxPerOwner < 1) {
            throw new IllegalArgumentException("concurrency caps must be >= 1");
        }
        this.maxConcurrent = maxConcurrent;
        this.maxPerOwner = maxPerOwner;
    }

    /**
     * Queue a due job.
     *
     * @return false if the job is already queued or running
     */
    public synchronized boolean enqueue(ScheduledJob job) {
        if (running.containsKey(job.id()) || queue.contains(job.id())) {
            return false;
        }
        queue.push(job);
        return true;
    }

    /**
     * Admit the head of the queue, if it may start now.
     *
     * @return empty when the global cap is saturated or the head job's owner is
     *         at its cap; the head then stays queued for the next cycle
     */
    public synchronized Optional<ScheduledJob> dequeue() {
        if (running.size() >= maxConcurrent) {
            return Optional.empty();
        }
        Optional<ScheduledJob> head = queue.peek();
        if (head.isEmpty() || runningPerOwner.getOrDefault(head.get().ownerId(), 0) >= maxPerOwner) {
            return Optional.empty();
        }

        ScheduledJob job = queue.pop().orElseThrow();
        running.put(job.id(), job.ownerId());
        runningPerOwner.merge(job.ownerId(), 1, Integer::sum);
        return Optional.of(job);
    }

    /**
     * Mark an admitted job as finished, freeing its global and owner slots.
     */
    public synchronized void complete(String jobId) {
        String ownerId = running.remove(jobId);
        if (ownerId == null) {
            log.debug("complete() for job {} which is not running", jobId);
            return;
        }
        runningPerOwner.computeIfPresent(ownerId, (k, count) -> count > 1 ? count - 1 : null);
    }

    /** Drop a queued (not yet admitted) job */
    public synchronized boolean remove(String jobId) {
        return queue.remove(jobId);
    }

    public synchronized int runningCount() {
        return running.size();
    }

    public synchronized int runningFor(String ownerId) {
        return runningPerOwner.getOrDefault(ownerId, 0);
    }

    public synchronized int queuedCount() {
        return queue.size();
    }

    public synchronized QueueStats stats() {
        Map<Priority, Integer> byPriority = new EnumMap<>(Priority.class);
        for (Priority priority : Priority.values()) {
            byPriority.put(priority, queue.byPriority(priority).size());
        }
        return new QueueStats(queue.size(), running.size(), maxConcurrent, maxPerOwner, byPriority);
    }
}
