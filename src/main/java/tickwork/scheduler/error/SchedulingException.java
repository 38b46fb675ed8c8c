package tickwork.scheduler.error;

/**
 * Base class of the scheduler's domain errors. Unchecked: callers that can
 * recover catch the specific subclass.
 */
public class SchedulingException extends RuntimeException {

    public SchedulingException(String message) {
        super(message);
    }

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
