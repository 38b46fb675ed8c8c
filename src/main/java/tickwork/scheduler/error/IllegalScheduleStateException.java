package tickwork.scheduler.error;

import tickwork.scheduler.model.ScheduleStatus;

/**
 * A lifecycle transition was requested from a status that does not allow it.
 */
public class IllegalScheduleStateException extends SchedulingException {

    private final String jobId;
    private final ScheduleStatus status;

    public IllegalScheduleStateException(String jobId, ScheduleStatus status, String operation) {
        super("Cannot " + operation + " schedule " + jobId + " in status " + status);
        this.jobId = jobId;
        this.status = status;
    }

    public String jobId() {
        return jobId;
    }

    public ScheduleStatus status() {
        return status;
    }
}
