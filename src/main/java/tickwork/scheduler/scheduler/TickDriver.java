package tickwork.scheduler.scheduler;

import tickwork.scheduler.config.SchedulerConfig;
import tickwork.scheduler.executor.ScheduleExecutor;
import tickwork.scheduler.model.ScheduledJob;
import tickwork.scheduler.queue.ConcurrencyQueue;
import tickwork.scheduler.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives the scheduler:
 * - tick: finds due jobs, queues them and dispatches every admitted job to
 * the worker pool
 * - ExecutionReaper: recovers executions stuck in RUNNING
 *
 * Both run on one single-threaded scheduled executor. Job runs happen on the
 * injected worker {@link Executor}; per-job exclusion comes from the lock taken
 * by {@link ScheduleExecutor}, not from this class.
 */
public class TickDriver implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TickDriver.class);

    private final ScheduledExecutorService timer;
    private final ScheduleRepository schedules;
    private final ScheduleExecutor executor;
    private final ConcurrencyQueue queue;
    private final Executor workers;
    private final ExecutionReaper reaper;
    private final SchedulerConfig config;
    private final Clock clock;

    private volatile boolean running = false;

    /**
     * @param workers where job runs are submitted; a bounded pool in production,
     *                a direct executor in tests
     * @param reaper  may be null to run without crash recovery
     */
    public TickDriver(ScheduleRepository schedules, ScheduleExecutor executor, ConcurrencyQueue queue,
            Executor workers, ExecutionReaper reaper, SchedulerConfig config, Clock clock) {
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tickwork-driver");
            t.setDaemon(true);
            return t;
        });
        this.schedules = schedules;
        this.executor = executor;
        this.queue = queue;
        this.workers = workers;
        this.reaper = reaper;
        this.config = config;
        this.clock = clock;
    }

    /**
     * One scheduling pass.
     *
     * Jobs blocked by a concurrency cap stay queued and are admitted by a later
     * tick. A queued job is re-read before it runs, so one paused or cancelled
     * meanwhile is dropped.
     */
    public TickSummary tick(Instant now) {
        List<ScheduledJob> due = schedules.findDue(now, config.dueBatchSize());

        int enqueued = 0;
        for (ScheduledJob job : due) {
            if (queue.enqueue(job)) {
                enqueued++;
            }
        }

        int dispatched = 0;
        Optional<ScheduledJob> next;
        while ((next = queue.dequeue()).isPresent()) {
            if (dispatch(next.get(), now)) {
                dispatched++;
            }
        }

        TickSummary summary = new TickSummary(now, due.size(), enqueued, dispatched, queue.queuedCount());
        if (summary.due() > 0) {
            log.debug("Tick {}: {} due, {} dispatched, {} waiting",
                    now, summary.due(), summary.dispatched(), summary.waiting());
        }
        return summary;
    }

    private boolean dispatch(ScheduledJob queued, Instant now) {
        try {
            workers.execute(() -> runAdmitted(queued, now));
            return true;
        } catch (RejectedExecutionException e) {
            queue.complete(queued.id());
            log.warn("Worker pool rejected schedule {}: {}", queued.id(), e.getMessage());
            return false;
        }
    }

    private void runAdmitted(ScheduledJob queued, Instant now) {
        try {
            Optional<ScheduledJob> fresh = schedules.findById(queued.id()).filter(job -> job.isDue(now));
            if (fresh.isEmpty()) {
                log.debug("Schedule {} no longer due, dropped from this tick", queued.id());
                return;
            }
            ScheduledJob job = fresh.get();
            if (executor.isMissed(job, now)) {
                executor.handleMissed(job, now);
            } else {
                executor.execute(job);
            }
        } catch (Exception e) {
            log.error("Schedule {} execution error", queued.id(), e);
        } finally {
            queue.complete(queued.id());
        }
    }

    /**
     * Start ticking at the configured interval, plus the reaper if one was
     * given.
     */
    public void start() {
        if (running) {
            log.warn("Tick driver already running");
            return;
        }

        running = true;

        long tickMs = config.tickInterval().toMillis();
        timer.scheduleAtFixedRate(
                wrapRunnable("tick", () -> tick(clock.instant())),
                0,
                tickMs,
                TimeUnit.MILLISECONDS);
        log.info("Tick scheduled every {}ms", tickMs);

        if (reaper != null) {
            long reaperMs = config.reaperInterval().toMillis();
            timer.scheduleAtFixedRate(
                    wrapRunnable("execution-reaper", reaper),
                    reaperMs,
                    reaperMs,
                    TimeUnit.MILLISECONDS);
            log.info("Execution reaper scheduled every {}ms", reaperMs);
        }

        log.info("Tick driver started");
    }

    /**
     * Stop ticking. Runs already handed to the worker pool are not interrupted.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        timer.shutdown();

        try {
            if (!timer.awaitTermination(5, TimeUnit.SECONDS)) {
                timer.shutdownNow();
                log.warn("Tick driver forcefully stopped");
            } else {
                log.info("Tick driver stopped gracefully");
            }
        } catch (InterruptedException e) {
            timer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public ConcurrencyQueue queue() {
        return queue;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
