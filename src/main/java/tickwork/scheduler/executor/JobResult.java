package tickwork.scheduler.executor;

/**
 * Outcome reported by a {@link JobRunner}.
 *
 * @param success whether the job did its work
 * @param payload optional result, stored on the execution record
 * @param error   failure description, null on success
 */
public record JobResult(boolean success, String payload, String error) {

    public static JobResult ok() {
        return new JobResult(true, null, null);
    }

    public static JobResult ok(String payload) {
        return new JobResult(true, payload, null);
    }

    public static JobResult failure(String error) {
        return new JobResult(false, null, error != null ? error : "Unknown error");
    }
}
