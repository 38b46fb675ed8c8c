package tickwork.scheduler.repository;

import tickwork.scheduler.error.ConcurrentScheduleUpdateException;
import tickwork.scheduler.model.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Read-modify-write of a job against {@link ScheduleRepository#update}, retried
 * while concurrent writers win.
 */
public final class OptimisticUpdate {

    private static final Logger log = LoggerFactory.getLogger(OptimisticUpdate.class);

    public static final int MAX_ATTEMPTS = 5;

    private OptimisticUpdate() {
    }

    /**
     * Apply {@code change} to the latest stored job until the write sticks.
     * The change is re-applied to a fresh read on every attempt; it may throw
     * to abort, and may return its argument unchanged to skip the write.
     *
     * @return the stored job after the change, empty if the job does not exist
     * @throws ConcurrentScheduleUpdateException after {@link #MAX_ATTEMPTS}
     *                                           lost races
     */
    public static Optional<ScheduledJob> apply(ScheduleRepository schedules, String jobId,
            UnaryOperator<ScheduledJob> change) {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            Optional<ScheduledJob> current = schedules.findById(jobId);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            ScheduledJob updated = change.apply(current.get());
            if (updated == current.get()) {
                return current;
            }
            if (schedules.update(updated)) {
                return schedules.findById(jobId);
            }
            log.debug("Schedule {} update conflict, attempt {}", jobId, attempt);
        }
        throw new ConcurrentScheduleUpdateException(jobId, MAX_ATTEMPTS);
    }
}
