package tickwork.scheduler.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for scheduler settings.
 * All settings have sensible defaults.
 */
public final class SchedulerConfig {

    /** Default cap on RUN_ALL catch-up executions per missed-tick recovery */
    public static final int DEFAULT_MAX_CATCH_UP_RUNS = 5;

    /** Default maximum number of jobs in one bulk operation */
    public static final int DEFAULT_MAX_BULK_SIZE = 50;

    public enum StorageMode {
        MEMORY,
        JDBC
    }

    // Storage settings
    private StorageMode storageMode = StorageMode.MEMORY;
    private String databaseUrl = "jdbc:h2:file:./data/tickwork;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Driver settings
    private Duration tickInterval = Duration.ofSeconds(30);
    private int workerThreads = 4;
    private int dueBatchSize = 500;

    // Admission settings
    private int maxConcurrent = 5;
    private int maxPerOwner = 3;

    // Lock settings
    private Duration lockTimeout = Duration.ofSeconds(2);
    private Duration lockTtl = Duration.ofMinutes(5);
    private Duration lockRetryInterval = Duration.ofMillis(100);

    // Execution settings
    private int maxCatchUpRuns = DEFAULT_MAX_CATCH_UP_RUNS;
    private Duration executionTimeout = null; // no timeout unless configured
    private Duration stuckExecutionThreshold = Duration.ofMinutes(10);
    private Duration reaperInterval = Duration.ofSeconds(60);

    // Registry settings
    private int maxBulkSize = DEFAULT_MAX_BULK_SIZE;

    private SchedulerConfig() {
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig();
    }

    public static SchedulerConfig fromEnv() {
        SchedulerConfig config = new SchedulerConfig();

        String storage = System.getenv("TICKWORK_STORAGE");
        if (storage != null && !storage.isBlank()) {
            config.storageMode = StorageMode.valueOf(storage.trim().toUpperCase());
        }

        String dbUrl = System.getenv("TICKWORK_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String tickSeconds = System.getenv("TICKWORK_TICK_SECONDS");
        if (tickSeconds != null && !tickSeconds.isBlank()) {
            config.tickInterval = Duration.ofSeconds(Long.parseLong(tickSeconds));
        }

        String workers = System.getenv("TICKWORK_WORKERS");
        if (workers != null && !workers.isBlank()) {
            config.workerThreads = Integer.parseInt(workers);
        }

        String maxConcurrent = System.getenv("TICKWORK_MAX_CONCURRENT");
        if (maxConcurrent != null && !maxConcurrent.isBlank()) {
            config.maxConcurrent = Integer.parseInt(maxConcurrent);
        }

        String maxPerOwner = System.getenv("TICKWORK_MAX_PER_OWNER");
        if (maxPerOwner != null && !maxPerOwner.isBlank()) {
            config.maxPerOwner = Integer.parseInt(maxPerOwner);
        }

        String timeoutSeconds = System.getenv("TICKWORK_EXECUTION_TIMEOUT_SECONDS");
        if (timeoutSeconds != null && !timeoutSeconds.isBlank()) {
            config.executionTimeout = Duration.ofSeconds(Long.parseLong(timeoutSeconds));
        }

        return config;
    }

    /**
     * Load settings from an INI file. Missing sections or keys keep their
     * defaults.
     *
     * <pre>
     * [database]
     * storage = jdbc
     * url = jdbc:h2:file:./data/tickwork
     * pool_size = 10
     *
     * [scheduler]
     * tick_seconds = 30
     * workers = 4
     * max_catch_up_runs = 5
     * execution_timeout_seconds = 600
     *
     * [queue]
     * max_concurrent = 5
     * max_per_owner = 3
     *
     * [locks]
     * timeout_ms = 2000
     * ttl_seconds = 300
     * </pre>
     */
    public static SchedulerConfig fromIni(Path path) throws IOException {
        Ini ini = new Ini(path.toFile());
        SchedulerConfig config = new SchedulerConfig();

        Profile.Section database = ini.get("database");
        if (database != null) {
            String storage = database.get("storage");
            if (storage != null && !storage.isBlank()) {
                config.storageMode = StorageMode.valueOf(storage.trim().toUpperCase());
            }
            config.databaseUrl = database.get("url", String.class, config.databaseUrl);
            config.databasePoolSize = database.get("pool_size", int.class, config.databasePoolSize);
        }

        Profile.Section scheduler = ini.get("scheduler");
        if (scheduler != null) {
            config.tickInterval = Duration.ofSeconds(
                    scheduler.get("tick_seconds", long.class, config.tickInterval.toSeconds()));
            config.workerThreads = scheduler.get("workers", int.class, config.workerThreads);
            config.dueBatchSize = scheduler.get("due_batch_size", int.class, config.dueBatchSize);
            config.maxCatchUpRuns = scheduler.get("max_catch_up_runs", int.class, config.maxCatchUpRuns);
            config.maxBulkSize = scheduler.get("max_bulk_size", int.class, config.maxBulkSize);
            String timeout = scheduler.get("execution_timeout_seconds");
            if (timeout != null && !timeout.isBlank()) {
                config.executionTimeout = Duration.ofSeconds(Long.parseLong(timeout.trim()));
            }
            config.stuckExecutionThreshold = Duration.ofSeconds(scheduler.get("stuck_threshold_seconds",
                    long.class, config.stuckExecutionThreshold.toSeconds()));
            config.reaperInterval = Duration.ofSeconds(
                    scheduler.get("reaper_seconds", long.class, config.reaperInterval.toSeconds()));
        }

        Profile.Section queue = ini.get("queue");
        if (queue != null) {
            config.maxConcurrent = queue.get("max_concurrent", int.class, config.maxConcurrent);
            config.maxPerOwner = queue.get("max_per_owner", int.class, config.maxPerOwner);
        }

        Profile.Section locks = ini.get("locks");
        if (locks != null) {
            config.lockTimeout = Duration.ofMillis(
                    locks.get("timeout_ms", long.class, config.lockTimeout.toMillis()));
            config.lockTtl = Duration.ofSeconds(locks.get("ttl_seconds", long.class, config.lockTtl.toSeconds()));
            config.lockRetryInterval = Duration.ofMillis(
                    locks.get("retry_ms", long.class, config.lockRetryInterval.toMillis()));
        }

        return config;
    }

    // Getters
    public StorageMode storageMode() {
        return storageMode;
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Duration tickInterval() {
        return tickInterval;
    }

    public int workerThreads() {
        return workerThreads;
    }

    public int dueBatchSize() {
        return dueBatchSize;
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public int maxPerOwner() {
        return maxPerOwner;
    }

    public Duration lockTimeout() {
        return lockTimeout;
    }

    public Duration lockTtl() {
        return lockTtl;
    }

    public Duration lockRetryInterval() {
        return lockRetryInterval;
    }

    public int maxCatchUpRuns() {
        return maxCatchUpRuns;
    }

    public Duration executionTimeout() {
        return executionTimeout;
    }

    public boolean hasExecutionTimeout() {
        return executionTimeout != null && !executionTimeout.isZero() && !executionTimeout.isNegative();
    }

    public Duration stuckExecutionThreshold() {
        return stuckExecutionThreshold;
    }

    public Duration reaperInterval() {
        return reaperInterval;
    }

    public int maxBulkSize() {
        return maxBulkSize;
    }

    // Fluent setters for testing/customization
    public SchedulerConfig withStorageMode(StorageMode mode) {
        this.storageMode = mode;
        return this;
    }

    public SchedulerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public SchedulerConfig withTickInterval(Duration interval) {
        this.tickInterval = interval;
        return this;
    }

    public SchedulerConfig withWorkerThreads(int threads) {
        this.workerThreads = threads;
        return this;
    }

    public SchedulerConfig withMaxConcurrent(int max) {
        this.maxConcurrent = max;
        return this;
    }

    public SchedulerConfig withMaxPerOwner(int max) {
        this.maxPerOwner = max;
        return this;
    }

    public SchedulerConfig withDueBatchSize(int size) {
        this.dueBatchSize = size;
        return this;
    }

    public SchedulerConfig withLockTimeout(Duration timeout) {
        this.lockTimeout = timeout;
        return this;
    }

    public SchedulerConfig withLockTtl(Duration ttl) {
        this.lockTtl = ttl;
        return this;
    }

    public SchedulerConfig withLockRetryInterval(Duration interval) {
        this.lockRetryInterval = interval;
        return this;
    }

    public SchedulerConfig withMaxCatchUpRuns(int runs) {
        this.maxCatchUpRuns = runs;
        return this;
    }

    public SchedulerConfig withExecutionTimeout(Duration timeout) {
        this.executionTimeout = timeout;
        return this;
    }

    public SchedulerConfig withStuckExecutionThreshold(Duration threshold) {
        this.stuckExecutionThreshold = threshold;
        return this;
    }

    public SchedulerConfig withReaperInterval(Duration interval) {
        this.reaperInterval = interval;
        return this;
    }

    public SchedulerConfig withMaxBulkSize(int size) {
        this.maxBulkSize = size;
        return this;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "storage=" + storageMode +
                (storageMode == StorageMode.JDBC ? ", databaseUrl='" + databaseUrl + '\'' : "") +
                ", tickInterval=" + tickInterval +
                ", workers=" + workerThreads +
                ", maxConcurrent=" + maxConcurrent +
                ", maxPerOwner=" + maxPerOwner +
                ", lockTtl=" + lockTtl +
                ", executionTimeout=" + executionTimeout +
                '}';
    }
}
