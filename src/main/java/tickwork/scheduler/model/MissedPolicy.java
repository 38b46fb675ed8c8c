package tickwork.scheduler.model;

/**
 * What to do with occurrences that passed while the driver was not ticking.
 */
public enum MissedPolicy {
    /** Drop missed occurrences and continue from now */
    SKIP,
    /** Run once for the most recent missed occurrence */
    RUN_LATEST,
    /** Run every missed occurrence, up to the catch-up cap */
    RUN_ALL
}
