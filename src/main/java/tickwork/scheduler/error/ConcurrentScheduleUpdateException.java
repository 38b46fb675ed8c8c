package tickwork.scheduler.error;

/**
 * Optimistic update kept losing to concurrent writers.
 */
public class ConcurrentScheduleUpdateException extends SchedulingException {

    public ConcurrentScheduleUpdateException(String jobId, int attempts) {
        super("Schedule " + jobId + " was modified concurrently; gave up after " + attempts + " attempts");
    }
}
