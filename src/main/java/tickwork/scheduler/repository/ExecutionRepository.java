package tickwork.scheduler.repository;

import tickwork.scheduler.model.ExecutionStatus;
import tickwork.scheduler.model.ScheduleExecution;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the append-only execution history.
 */
public interface ExecutionRepository {

    /**
     * Append a new execution record.
     */
    void save(ScheduleExecution execution);

    Optional<ScheduleExecution> findById(String executionId);

    /**
     * Execution history of a job, latest scheduled occurrence first.
     *
     * @param jobId the job ID
     * @param limit maximum results
     */
    List<ScheduleExecution> findByJobId(String jobId, int limit);

    /**
     * Move a non-terminal execution to a terminal status.
     * Terminal records are immutable: this is a no-op for them.
     *
     * @param executionId   the execution ID
     * @param status        terminal status to set
     * @param completedAt   completion time
     * @param errorMessage  error for FAILED executions, otherwise null
     * @param resultPayload runner payload, may be null
     * @return true if updated, false if missing or already terminal
     */
    boolean complete(String executionId, ExecutionStatus status, Instant completedAt, String errorMessage,
            String resultPayload);

    /**
     * Find executions still RUNNING that started before the given instant.
     * Used by the reaper to recover executions orphaned by a crash.
     */
    List<ScheduleExecution> findStuckRunning(Instant startedBefore);

    /**
     * Count a job's executions with the given status.
     */
    int countByJobIdAndStatus(String jobId, ExecutionStatus status);

    /**
     * Remove a job's history (on job deletion).
     *
     * @return number of records removed
     */
    int deleteByJobId(String jobId);

    /**
     * Generate a new unique execution ID.
     */
    String generateId();
}
