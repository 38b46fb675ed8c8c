package tickwork.scheduler.model;

/**
 * Status of a single execution attempt.
 */
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    /** Another executor held the job's lock, or the occurrence was already handled */
    SKIPPED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
