package tickwork.scheduler.model;

/**
 * Lifecycle status of a scheduled job.
 */
public enum ScheduleStatus {
    /** Eligible for ticks */
    ACTIVE,
    /** Temporarily excluded from ticks, can be resumed */
    PAUSED,
    /** No more occurrences (max runs reached, rule exhausted, or one-time run done) */
    COMPLETED,
    /** Cancelled by the owner */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
