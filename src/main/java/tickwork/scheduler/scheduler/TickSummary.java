package tickwork.scheduler.scheduler;

import java.time.Instant;

/**
 * What one tick did.
 *
 * @param tickedAt   the tick's reference instant
 * @param due        due jobs found
 * @param enqueued   jobs newly queued (already queued or running ones are not
 *                   counted)
 * @param dispatched jobs handed to the worker pool
 * @param waiting    jobs left queued behind a concurrency cap
 */
public record TickSummary(Instant tickedAt, int due, int enqueued, int dispatched, int waiting) {
}
