package tickwork.scheduler.error;

public class BulkLimitExceededException extends SchedulingException {

    private final int requested;
    private final int limit;

    public BulkLimitExceededException(int requested, int limit) {
        super("Bulk operation on " + requested + " schedules exceeds the limit of " + limit);
        this.requested = requested;
        this.limit = limit;
    }

    public int requested() {
        return requested;
    }

    public int limit() {
        return limit;
    }
}
