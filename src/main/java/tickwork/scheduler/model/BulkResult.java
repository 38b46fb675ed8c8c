package tickwork.scheduler.model;

import java.util.List;

/**
 * Outcome of a bulk pause/resume/cancel.
 *
 * @param operationId unique id of this bulk call
 * @param operation   "pause", "resume" or "cancel"
 * @param total       number of ids submitted
 * @param success     number of jobs transitioned
 * @param failures    per-job reasons for the ones that were not transitioned
 */
public record BulkResult(
        String operationId,
        String operation,
        int total,
        int success,
        List<Failure> failures) {

    public BulkResult {
        failures = List.copyOf(failures);
    }

    public int failed() {
        return failures.size();
    }

    /**
     * One job that could not be transitioned.
     */
    public record Failure(String jobId, String error) {
    }
}
