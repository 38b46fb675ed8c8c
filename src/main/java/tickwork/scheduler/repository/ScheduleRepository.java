package tickwork.scheduler.repository;

import tickwork.scheduler.model.ScheduledJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for ScheduledJob persistence.
 * Implementations can use JDBC or in-memory storage.
 */
public interface ScheduleRepository {

    /**
     * Save a new job.
     *
     * @param job the job to save
     */
    void save(ScheduledJob job);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<ScheduledJob> findById(String jobId);

    /**
     * Get all jobs, most recently created first.
     */
    List<ScheduledJob> findAll();

    /**
     * Get one owner's jobs, most recently created first.
     *
     * @param ownerId the owner
     * @return list of jobs
     */
    List<ScheduledJob> findByOwner(String ownerId);

    /**
     * Find ACTIVE jobs whose next run is at or before {@code asOf}.
     * Ordered by priority weight (URGENT first), then next run time.
     *
     * @param asOf  the reference instant
     * @param limit maximum results
     * @return due jobs
     */
    List<ScheduledJob> findDue(Instant asOf, int limit);

    /**
     * Replace a job, optimistically.
     * Succeeds only if the stored version equals {@code job.version()}; the
     * stored version is then incremented.
     *
     * @param job the new state
     * @return false if the job is missing or was modified concurrently
     */
    boolean update(ScheduledJob job);

    /**
     * Delete a job. Its execution history is removed by the caller.
     *
     * @param jobId the job ID
     * @return true if deleted
     */
    boolean delete(String jobId);

    /**
     * Generate a new unique job ID.
     *
     * @return unique ID like "sched-{uuid}"
     */
    String generateId();
}
