package tickwork.scheduler.scheduler;

import tickwork.scheduler.config.SchedulerConfig;
import tickwork.scheduler.lock.LockManager;
import tickwork.scheduler.model.ExecutionStatus;
import tickwork.scheduler.model.ScheduleExecution;
import tickwork.scheduler.repository.ExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Background task that recovers executions stuck in RUNNING.
 *
 * An execution gets stuck when the process running it dies before recording
 * the outcome. Its job was never advanced, so it stays due and the next tick
 * runs it again once the lock is free.
 *
 * The reaper:
 * 1. Finds executions RUNNING longer than the stuck threshold
 * 2. Marks each FAILED
 * 3. Force-releases the lock of its job
 */
public class ExecutionReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionReaper.class);

    private final ExecutionRepository executions;
    private final LockManager locks;
    private final SchedulerConfig config;
    private final Clock clock;

    public ExecutionReaper(ExecutionRepository executions, LockManager locks, SchedulerConfig config) {
        this(executions, locks, config, Clock.systemUTC());
    }

    public ExecutionReaper(ExecutionRepository executions, LockManager locks, SchedulerConfig config, Clock clock) {
        this.executions = executions;
        this.locks = locks;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            reapStuckExecutions();
        } catch (Exception e) {
            log.error("Execution reaper error", e);
        }
    }

    /**
     * Find and fail stuck RUNNING executions.
     *
     * @return number of executions reaped
     */
    public int reapStuckExecutions() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(config.stuckExecutionThreshold());

        List<ScheduleExecution> stuck = executions.findStuckRunning(cutoff);

        if (stuck.isEmpty()) {
            log.debug("No stuck executions found");
            return 0;
        }

        int reaped = 0;
        for (ScheduleExecution execution : stuck) {
            try {
                boolean failed = executions.complete(execution.id(), ExecutionStatus.FAILED, now,
                        "Execution stuck in RUNNING for more than " + config.stuckExecutionThreshold(), null);
                if (!failed) {
                    // finished between the query and the update
                    continue;
                }
                locks.forceRelease(LockManager.jobKey(execution.jobId()));
                reaped++;
                log.warn("Reaped execution {} of schedule {} (started {})",
                        execution.id(), execution.jobId(), execution.startedAt());
            } catch (Exception e) {
                log.error("Failed to reap execution {}", execution.id(), e);
            }
        }

        log.info("Execution reaper: {} reaped, {} total stuck", reaped, stuck.size());

        return reaped;
    }
}
