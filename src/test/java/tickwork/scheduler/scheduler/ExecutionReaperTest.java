package tickwork.scheduler.scheduler;

import tickwork.scheduler.MutableClock;
import tickwork.scheduler.config.SchedulerConfig;
import tickwork.scheduler.lock.LockManager;
import tickwork.scheduler.model.ExecutionStatus;
import tickwork.scheduler.model.ScheduleExecution;
import tickwork.scheduler.store.Database;
import tickwork.scheduler.store.JdbcExecutionRepository;
import tickwork.scheduler.store.JdbcLockManager;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionReaperTest {

    private static Database db;
    private static JdbcExecutionRepository executions;
    private static SchedulerConfig config;

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    private MutableClock clock;
    private JdbcLockManager locks;
    private ExecutionReaper reaper;

    @BeforeAll
    static void setup() {
        config = SchedulerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-reaper;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withStuckExecutionThreshold(Duration.ofMinutes(10));
        db = new Database(config);
        executions = new JdbcExecutionRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        try (var conn = db.getConnection(); var st = conn.createStatement()) {
            st.execute("DELETE FROM schedule_executions");
            st.execute("DELETE FROM schedule_locks");
            conn.commit();
        }
        clock = new MutableClock(NOW);
        locks = new JdbcLockManager(db, clock, Duration.ofMillis(5));
        reaper = new ExecutionReaper(executions, locks, config, clock);
    }

    private void running(String id, String jobId, Instant startedAt) {
        executions.save(ScheduleExecution.builder()
                .id(id)
                .jobId(jobId)
                .scheduledFor(startedAt)
                .startedAt(startedAt)
                .status(ExecutionStatus.RUNNING)
                .build());
    }

    @Test
    void reapsStuckExecutionAndFreesItsLock() {
        running("stuck", "job-1", NOW.minus(Duration.ofMinutes(30)));
        locks.acquire(LockManager.jobKey("job-1"), "dead-process", Duration.ZERO, Duration.ofHours(1));

        int reaped = reaper.reapStuckExecutions();

        assertEquals(1, reaped);
        ScheduleExecution execution = executions.findById("stuck").orElseThrow();
        assertEquals(ExecutionStatus.FAILED, execution.status());
        assertEquals(NOW, execution.completedAt());
        assertTrue(execution.errorMessage().startsWith("Execution stuck in RUNNING"));
        assertFalse(locks.isLocked(LockManager.jobKey("job-1")));
    }

    @Test
    void leavesRecentRunsAlone() {
        running("fresh", "job-1", NOW.minus(Duration.ofMinutes(2)));
        locks.acquire(LockManager.jobKey("job-1"), "live-process", Duration.ZERO, Duration.ofHours(1));

        assertEquals(0, reaper.reapStuckExecutions());

        assertEquals(ExecutionStatus.RUNNING, executions.findById("fresh").orElseThrow().status());
        assertTrue(locks.isLocked(LockManager.jobKey("job-1")));
    }

    @Test
    void finishedRunsAreNotReaped() {
        running("done", "job-1", NOW.minus(Duration.ofHours(1)));
        executions.complete("done", ExecutionStatus.COMPLETED, NOW.minus(Duration.ofMinutes(59)), null, null);

        reaper.run();

        assertEquals(ExecutionStatus.COMPLETED, executions.findById("done").orElseThrow().status());
    }
}
