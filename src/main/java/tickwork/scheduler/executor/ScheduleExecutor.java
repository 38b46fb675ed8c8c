package tickwork.scheduler.executor;

import tickwork.scheduler.config.SchedulerConfig;
import tickwork.scheduler.error.ScheduleNotFoundException;
import tickwork.scheduler.lock.LockManager;
import tickwork.scheduler.model.ExecutionStatus;
import tickwork.scheduler.model.ScheduleExecution;
import tickwork.scheduler.model.ScheduleStatus;
import tickwork.scheduler.model.ScheduledJob;
import tickwork.scheduler.recurrence.FixedOffsetZones;
import tickwork.scheduler.recurrence.RecurrenceEngine;
import tickwork.scheduler.repository.ExecutionRepository;
import tickwork.scheduler.repository.OptimisticUpdate;
import tickwork.scheduler.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.UnaryOperator;

/**
 * Runs one tick of a scheduled job: takes the job's lock, invokes the runner,
 * records the execution and advances the job.
 *
 * Every attempt leaves an execution record. An attempt that cannot take the
 * lock, or that finds the occurrence already handled by another attempt, is
 * recorded SKIPPED and leaves the job untouched.
 *
 * Runner failures never escape: they become FAILED executions and the job
 * advances as if the run had succeeded.
 */
public class ScheduleExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScheduleExecutor.class);

    static final String LOCK_CONTENDED = "Skipped: already executing in another process";
    static final String ALREADY_HANDLED = "Skipped: occurrence already handled";

    private final ScheduleRepository schedules;
    private final ExecutionRepository executions;
    private final LockManager locks;
    private final JobRunner runner;
    private final RecurrenceEngine engine;
    private final SchedulerConfig config;
    private final Clock clock;
    private final String instanceId;

    // Only created when an execution timeout is configured
    private final ExecutorService runnerPool;

    public ScheduleExecutor(ScheduleRepository schedules, ExecutionRepository executions, LockManager locks,
            JobRunner runner, SchedulerConfig config) {
        this(schedules, executions, locks, runner, new RecurrenceEngine(), config, Clock.systemUTC());
    }

    public ScheduleExecutor(ScheduleRepository schedules, ExecutionRepository executions, LockManager locks,
            JobRunner runner, RecurrenceEngine engine, SchedulerConfig config, Clock clock) {
        this.schedules = schedules;
        this.executions = executions;
        this.locks = locks;
        this.runner = runner;
        this.engine = engine;
        this.config = config;
        this.clock = clock;
        this.instanceId = "executor-" + UUID.randomUUID().toString().substring(0, 8);
        this.runnerPool = config.hasExecutionTimeout()
                ? Executors.newCachedThreadPool(r -> {
                    Thread t = new Thread(r, "tickwork-runner");
                    t.setDaemon(true);
                    return t;
                })
                : null;
    }

    /**
     * Execute the occurrence the job is currently due for.
     *
     * @param job snapshot of the job as seen by the caller; its next_run_at
     *            identifies the occurrence
     * @return the recorded execution (COMPLETED, FAILED or SKIPPED)
     */
    public ScheduleExecution execute(ScheduledJob job) {
        Instant scheduledFor = job.nextRunAt() != null ? job.nextRunAt() : clock.instant();
        String executionId = executions.generateId();
        String lockKey = LockManager.jobKey(job.id());
        String lockOwner = instanceId + ":" + executionId;

        if (!locks.acquire(lockKey, lockOwner, config.lockTimeout(), config.lockTtl())) {
            log.info("Schedule {} skipped for {}: lock held elsewhere", job.id(), scheduledFor);
            return recordSkipped(executionId, job.id(), scheduledFor, false, LOCK_CONTENDED);
        }

        try {
            Optional<ScheduledJob> current = stillDue(job);
            if (current.isEmpty()) {
                log.info("Schedule {} skipped for {}: already handled", job.id(), scheduledFor);
                return recordSkipped(executionId, job.id(), scheduledFor, false, ALREADY_HANDLED);
            }
            ScheduleExecution execution = runOnce(executionId, current.get(), scheduledFor, false);
            advanceAfterRun(job.id(), execution.completedAt(), clock.instant());
            return execution;
        } finally {
            releaseLock(lockKey, lockOwner);
        }
    }

    /**
     * Run a job immediately, outside its schedule, under the same per-job lock
     * as a scheduled tick.
     *
     * When {@code countRun} is set the run counts toward max_runs (and may
     * complete the job); otherwise the job is left untouched. next_run_at is
     * never moved by a manual run.
     *
     * @throws ScheduleNotFoundException if the job does not exist
     */
    public ScheduleExecution runNow(String jobId, boolean countRun) {
        ScheduledJob job = schedules.findById(jobId).orElseThrow(() -> new ScheduleNotFoundException(jobId));
        Instant scheduledFor = clock.instant();
        String executionId = executions.generateId();
        String lockKey = LockManager.jobKey(jobId);
        String lockOwner = instanceId + ":" + executionId;

        if (!locks.acquire(lockKey, lockOwner, config.lockTimeout(), config.lockTtl())) {
            log.info("Manual run of schedule {} skipped: lock held elsewhere", jobId);
            return recordSkipped(executionId, jobId, scheduledFor, true, LOCK_CONTENDED);
        }

        try {
            ScheduleExecution execution = runOnce(executionId, job, scheduledFor, true);
            if (countRun) {
                countManualRun(jobId, execution.completedAt());
            }
            return execution;
        } finally {
            releaseLock(lockKey, lockOwner);
        }
    }

    /**
     * A recurring job is missed when the occurrence following its next_run_at
     * is also already due: at least one whole occurrence went by without a
     * tick. One-time jobs are never missed.
     */
    public boolean isMissed(ScheduledJob job, Instant now) {
        if (!job.isRecurring() || job.nextRunAt() == null || job.nextRunAt().isAfter(now)) {
            return false;
        }
        return engine.nextOccurrence(job.recurrenceRule(), job.nextRunAt(), zoneOf(job))
                .map(following -> !following.isAfter(now))
                .orElse(false);
    }

    /**
     * Recover a job that missed occurrences, according to its missed policy.
     * The whole recovery happens under the job's lock.
     *
     * <ul>
     * <li>SKIP: next_run_at is recomputed from {@code now}, nothing runs</li>
     * <li>RUN_LATEST: one run for the most recent missed occurrence, then the
     * job advances from {@code now}</li>
     * <li>RUN_ALL: one run per missed occurrence, oldest first, each advancing
     * from the occurrence it stands for; after {@code maxCatchUpRuns} runs the
     * rest are skipped by advancing from {@code now}</li>
     * </ul>
     *
     * A one-time job is simply run once, as a scheduled tick would.
     *
     * @return executions recorded, possibly empty
     */
    public List<ScheduleExecution> handleMissed(ScheduledJob job, Instant now) {
        String executionId = executions.generateId();
        String lockKey = LockManager.jobKey(job.id());
        String lockOwner = instanceId + ":" + executionId;
        Instant expected = job.nextRunAt() != null ? job.nextRunAt() : now;

        if (!locks.acquire(lockKey, lockOwner, config.lockTimeout(), config.lockTtl())) {
            log.info("Missed-run recovery of schedule {} skipped: lock held elsewhere", job.id());
            return List.of(recordSkipped(executionId, job.id(), expected, false, LOCK_CONTENDED));
        }

        try {
            Optional<ScheduledJob> current = stillDue(job);
            if (current.isEmpty()) {
                log.info("Missed-run recovery of schedule {} skipped: already handled", job.id());
                return List.of(recordSkipped(executionId, job.id(), expected, false, ALREADY_HANDLED));
            }
            ScheduledJob missed = current.get();

            if (!missed.isRecurring()) {
                // one-time jobs have a single occurrence, whatever the policy
                ScheduleExecution execution = runOnce(executionId, missed, expected, false);
                advanceAfterRun(missed.id(), execution.completedAt(), now);
                return List.of(execution);
            }

            return switch (missed.missedPolicy()) {
                case SKIP -> {
                    ScheduledJob advanced = skipMissed(missed, now);
                    log.info("Schedule {} skipped missed runs, next run at {}", missed.id(), advanced.nextRunAt());
                    yield List.of();
                }
                case RUN_LATEST -> {
                    Instant latest = engine.latestOccurrenceAtOrBefore(
                            missed.recurrenceRule(), missed.nextRunAt(), now, zoneOf(missed));
                    ScheduleExecution execution = runOnce(executionId, missed, latest, false);
                    advanceAfterRun(missed.id(), execution.completedAt(), now);
                    yield List.of(execution);
                }
                case RUN_ALL -> catchUp(missed, executionId, now);
            };
        } finally {
            releaseLock(lockKey, lockOwner);
        }
    }

    private List<ScheduleExecution> catchUp(ScheduledJob job, String firstExecutionId, Instant now) {
        List<ScheduleExecution> recorded = new ArrayList<>();
        ScheduledJob current = job;
        String executionId = firstExecutionId;

        while (recorded.size() < config.maxCatchUpRuns()
                && current.status() == ScheduleStatus.ACTIVE
                && current.isDue(now)) {
            Instant occurrence = current.nextRunAt();
            ScheduleExecution execution = runOnce(executionId, current, occurrence, false);
            recorded.add(execution);
            Optional<ScheduledJob> advanced = advanceAfterRun(current.id(), execution.completedAt(), occurrence);
            if (advanced.isEmpty()) {
                return recorded;
            }
            current = advanced.get();
            executionId = executions.generateId();
        }

        if (current.status() == ScheduleStatus.ACTIVE && current.isDue(now)) {
            ScheduledJob advanced = skipMissed(current, now);
            log.info("Schedule {} caught up {} runs (cap {}), skipped the rest, next run at {}",
                    job.id(), recorded.size(), config.maxCatchUpRuns(), advanced.nextRunAt());
        } else {
            log.info("Schedule {} caught up {} missed runs", job.id(), recorded.size());
        }
        return recorded;
    }

    // --- Execution ---

    /**
     * Re-read the job under its lock. Empty when another attempt already
     * handled the occurrence the caller saw.
     */
    private Optional<ScheduledJob> stillDue(ScheduledJob seen) {
        return schedules.findById(seen.id())
                .filter(current -> current.status() == ScheduleStatus.ACTIVE)
                .filter(current -> Objects.equals(current.nextRunAt(), seen.nextRunAt()));
    }

    private ScheduleExecution runOnce(String executionId, ScheduledJob job, Instant scheduledFor, boolean manual) {
        Instant startedAt = clock.instant();
        executions.save(ScheduleExecution.builder()
                .id(executionId)
                .jobId(job.id())
                .scheduledFor(scheduledFor)
                .startedAt(startedAt)
                .status(ExecutionStatus.RUNNING)
                .manual(manual)
                .build());

        JobResult result = invokeRunner(job);
        Instant completedAt = clock.instant();

        if (result.success()) {
            executions.complete(executionId, ExecutionStatus.COMPLETED, completedAt, null, result.payload());
            log.debug("Schedule {} run {} completed", job.id(), executionId);
        } else {
            executions.complete(executionId, ExecutionStatus.FAILED, completedAt, result.error(), result.payload());
            log.warn("Schedule {} run {} failed: {}", job.id(), executionId, result.error());
        }

        return executions.findById(executionId)
                .orElseThrow(() -> new IllegalStateException("Execution vanished: " + executionId));
    }

    private JobResult invokeRunner(ScheduledJob job) {
        if (runnerPool == null) {
            try {
                return orFailure(runner.run(job.jobType(), job.jobConfig()));
            } catch (Exception e) {
                return JobResult.failure(describe(e));
            }
        }

        Future<JobResult> future = runnerPool.submit(() -> runner.run(job.jobType(), job.jobConfig()));
        try {
            return orFailure(future.get(config.executionTimeout().toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Schedule {} timed out after {}", job.id(), config.executionTimeout());
            return JobResult.failure("Execution timed out after " + config.executionTimeout());
        } catch (ExecutionException e) {
            return JobResult.failure(describe(e.getCause() != null ? e.getCause() : e));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return JobResult.failure("Interrupted while waiting for the job runner");
        }
    }

    private static JobResult orFailure(JobResult result) {
        return result != null ? result : JobResult.failure("Job runner returned no result");
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private ScheduleExecution recordSkipped(String executionId, String jobId, Instant scheduledFor, boolean manual,
            String reason) {
        Instant now = clock.instant();
        ScheduleExecution skipped = ScheduleExecution.builder()
                .id(executionId)
                .jobId(jobId)
                .scheduledFor(scheduledFor)
                .startedAt(now)
                .completedAt(now)
                .status(ExecutionStatus.SKIPPED)
                .manual(manual)
                .errorMessage(reason)
                .build();
        executions.save(skipped);
        return skipped;
    }

    private void releaseLock(String lockKey, String lockOwner) {
        if (!locks.release(lockKey, lockOwner)) {
            log.warn("Lock {} was no longer held by {} at release (TTL too short?)", lockKey, lockOwner);
        }
    }

    // --- Job state ---

    /**
     * Apply a finished run to the job: bump counters, then complete it or move
     * next_run_at to the first occurrence after {@code advanceFrom}.
     *
     * @return the stored job, empty if it was deleted meanwhile
     */
    Optional<ScheduledJob> advanceAfterRun(String jobId, Instant ranAt, Instant advanceFrom) {
        return updateWithRetry(jobId, current -> {
            int runs = current.runCount() + 1;
            ScheduledJob.Builder next = current.toBuilder()
                    .lastRunAt(ranAt)
                    .runCount(runs)
                    .updatedAt(clock.instant());

            if (current.status().isTerminal()) {
                // cancelled while running: counters only
                return next.build();
            }
            if (current.maxRunsReached(runs)) {
                log.info("Schedule {} completed after {} runs (max {})", jobId, runs, current.maxRuns());
                return next.status(ScheduleStatus.COMPLETED).nextRunAt(null).build();
            }
            if (!current.isRecurring()) {
                log.info("One-time schedule {} completed", jobId);
                return next.status(ScheduleStatus.COMPLETED).nextRunAt(null).build();
            }

            Optional<Instant> following = engine.nextOccurrence(current.recurrenceRule(), advanceFrom,
                    zoneOf(current));
            if (following.isEmpty()) {
                log.info("Schedule {} completed: recurrence exhausted", jobId);
                return next.status(ScheduleStatus.COMPLETED).nextRunAt(null).build();
            }
            log.debug("Schedule {} next run at {}", jobId, following.get());
            return next.nextRunAt(following.get()).build();
        });
    }

    private void countManualRun(String jobId, Instant ranAt) {
        updateWithRetry(jobId, current -> {
            int runs = current.runCount() + 1;
            ScheduledJob.Builder next = current.toBuilder()
                    .lastRunAt(ranAt)
                    .runCount(runs)
                    .updatedAt(clock.instant());
            if (!current.status().isTerminal() && current.maxRunsReached(runs)) {
                log.info("Schedule {} completed by manual run {} (max {})", jobId, runs, current.maxRuns());
                next.status(ScheduleStatus.COMPLETED).nextRunAt(null);
            }
            return next.build();
        });
    }

    private ScheduledJob skipMissed(ScheduledJob job, Instant now) {
        return updateWithRetry(job.id(), current -> {
            if (current.status() != ScheduleStatus.ACTIVE || !current.isRecurring()) {
                return current;
            }
            Optional<Instant> following = engine.nextOccurrence(current.recurrenceRule(), now, zoneOf(current));
            ScheduledJob.Builder next = current.toBuilder().updatedAt(clock.instant());
            return following.isPresent()
                    ? next.nextRunAt(following.get()).build()
                    : next.status(ScheduleStatus.COMPLETED).nextRunAt(null).build();
        }).orElse(job);
    }

    private Optional<ScheduledJob> updateWithRetry(String jobId, UnaryOperator<ScheduledJob> change) {
        Optional<ScheduledJob> stored = OptimisticUpdate.apply(schedules, jobId, change);
        if (stored.isEmpty()) {
            log.warn("Schedule {} disappeared before its state could be updated", jobId);
        }
        return stored;
    }

    private static ZoneOffset zoneOf(ScheduledJob job) {
        return FixedOffsetZones.offsetOf(job.timezone());
    }

    public String instanceId() {
        return instanceId;
    }

    @Override
    public void close() {
        if (runnerPool != null) {
            runnerPool.shutdownNow();
        }
    }
}
