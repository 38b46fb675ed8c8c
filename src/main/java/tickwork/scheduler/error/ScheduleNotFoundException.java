package tickwork.scheduler.error;

public class ScheduleNotFoundException extends SchedulingException {

    private final String jobId;

    public ScheduleNotFoundException(String jobId) {
        super("Schedule not found: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
