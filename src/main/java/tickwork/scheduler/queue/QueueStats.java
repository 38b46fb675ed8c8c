package tickwork.scheduler.queue;

import tickwork.scheduler.model.Priority;

import java.util.Map;

/**
 * Snapshot of the admission queue.
 */
public record QueueStats(
        int queued,
        int running,
        int maxConcurrent,
        int maxPerOwner,
        Map<Priority, Integer> queuedByPriority) {

    public QueueStats {
        queuedByPriority = Map.copyOf(queuedByPriority);
    }
}
