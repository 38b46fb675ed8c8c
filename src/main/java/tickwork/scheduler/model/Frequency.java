package tickwork.scheduler.model;

/**
 * How often a recurrence rule repeats.
 */
public enum Frequency {
    MINUTELY,
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY,
    YEARLY
}
