package tickwork.scheduler.config;

import tickwork.scheduler.executor.JobRunner;
import tickwork.scheduler.executor.ScheduleExecutor;
import tickwork.scheduler.lock.InMemoryLockManager;
import tickwork.scheduler.lock.LockManager;
import tickwork.scheduler.queue.ConcurrencyQueue;
import tickwork.scheduler.recurrence.RecurrenceEngine;
import tickwork.scheduler.repository.ExecutionRepository;
import tickwork.scheduler.repository.ScheduleRepository;
import tickwork.scheduler.scheduler.ExecutionReaper;
import tickwork.scheduler.scheduler.TickDriver;
import tickwork.scheduler.service.ScheduleRegistry;
import tickwork.scheduler.store.Database;
import tickwork.scheduler.store.InMemoryExecutionRepository;
import tickwork.scheduler.store.InMemoryScheduleRepository;
import tickwork.scheduler.store.JdbcExecutionRepository;
import tickwork.scheduler.store.JdbcLockManager;
import tickwork.scheduler.store.JdbcScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Manual dependency injection container.
 * Creates and wires all scheduler components for the configured storage mode.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(SchedulerConfig.fromEnv(), runner);
 * deps.startDriver(); // start ticking
 * ScheduleRegistry registry = deps.registry();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final SchedulerConfig config;
    private final Clock clock;
    private final Database database; // null in MEMORY mode
    private final ScheduleRepository scheduleRepository;
    private final ExecutionRepository executionRepository;
    private final LockManager lockManager;
    private final RecurrenceEngine engine;
    private final ScheduleExecutor executor;
    private final ScheduleRegistry registry;
    private final ConcurrencyQueue queue;
    private final ExecutorService workers;

    // Driver (lazy-initialized)
    private TickDriver driver;

    private Dependencies(SchedulerConfig config, JobRunner runner, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Storage
        if (config.storageMode() == SchedulerConfig.StorageMode.JDBC) {
            this.database = new Database(config);
            this.scheduleRepository = new JdbcScheduleRepository(database);
            this.executionRepository = new JdbcExecutionRepository(database);
            this.lockManager = new JdbcLockManager(database, clock, config.lockRetryInterval());
        } else {
            this.database = null;
            this.scheduleRepository = new InMemoryScheduleRepository();
            this.executionRepository = new InMemoryExecutionRepository();
            this.lockManager = new InMemoryLockManager(clock, config.lockRetryInterval());
        }

        // Services
        this.engine = new RecurrenceEngine();
        this.executor = new ScheduleExecutor(scheduleRepository, executionRepository, lockManager, runner, engine,
                config, clock);
        this.registry = new ScheduleRegistry(scheduleRepository, executionRepository, executor, engine, config,
                clock);

        // Dispatch
        this.queue = new ConcurrencyQueue(config.maxConcurrent(), config.maxPerOwner());
        AtomicInteger workerIds = new AtomicInteger(1);
        this.workers = Executors.newFixedThreadPool(config.workerThreads(), r -> {
            Thread t = new Thread(r, "tickwork-worker-" + workerIds.getAndIncrement());
            t.setDaemon(true);
            return t;
        });

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(SchedulerConfig config, JobRunner runner) {
        return new Dependencies(config, runner, Clock.systemUTC());
    }

    public static Dependencies create(SchedulerConfig config, JobRunner runner, Clock clock) {
        return new Dependencies(config, runner, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create(JobRunner runner) {
        return create(SchedulerConfig.fromEnv(), runner);
    }

    // Getters
    public SchedulerConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public ScheduleRepository scheduleRepository() {
        return scheduleRepository;
    }

    public ExecutionRepository executionRepository() {
        return executionRepository;
    }

    public LockManager lockManager() {
        return lockManager;
    }

    public ScheduleExecutor executor() {
        return executor;
    }

    public ScheduleRegistry registry() {
        return registry;
    }

    public ConcurrencyQueue queue() {
        return queue;
    }

    /**
     * Get the tick driver (creates it if not yet created).
     */
    public synchronized TickDriver driver() {
        if (driver == null) {
            ExecutionReaper reaper = new ExecutionReaper(executionRepository, lockManager, config, clock);
            driver = new TickDriver(scheduleRepository, executor, queue, workers, reaper, config, clock);
        }
        return driver;
    }

    public void startDriver() {
        driver().start();
    }

    public synchronized void stopDriver() {
        if (driver != null) {
            driver.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop ticking first
        try {
            stopDriver();
        } catch (Exception e) {
            log.warn("Error stopping tick driver: {}", e.getMessage());
        }

        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
                log.warn("Worker pool forcefully stopped");
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }

        executor.close();

        if (database != null) {
            try {
                database.close();
            } catch (Exception e) {
                log.warn("Error closing database: {}", e.getMessage());
            }
        }

        log.info("Dependencies closed");
    }
}
