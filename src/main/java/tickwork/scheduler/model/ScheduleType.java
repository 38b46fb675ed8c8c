package tickwork.scheduler.model;

/**
 * Whether a job runs once or follows a recurrence rule.
 */
public enum ScheduleType {
    /** Runs at a single instant, then completes */
    ONE_TIME,
    /** Runs on every occurrence of its recurrence rule */
    RECURRING
}
