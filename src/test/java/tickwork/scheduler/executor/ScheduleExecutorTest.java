package tickwork.scheduler.executor;

import tickwork.scheduler.MutableClock;
import tickwork.scheduler.config.SchedulerConfig;
import tickwork.scheduler.error.ScheduleNotFoundException;
import tickwork.scheduler.lock.InMemoryLockManager;
import tickwork.scheduler.lock.LockManager;
import tickwork.scheduler.model.*;
import tickwork.scheduler.recurrence.RecurrenceEngine;
import tickwork.scheduler.store.InMemoryExecutionRepository;
import tickwork.scheduler.store.InMemoryScheduleRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleExecutorTest {

    private static final Instant JAN_1_0900 = Instant.parse("2024-01-01T09:00:00Z");

    private MutableClock clock;
    private InMemoryScheduleRepository schedules;
    private InMemoryExecutionRepository executions;
    private InMemoryLockManager locks;
    private SchedulerConfig config;
    private AtomicInteger runs;
    private ScheduleExecutor executor;

    @BeforeEach
    void setup() {
        clock = new MutableClock(JAN_1_0900.plusSeconds(5));
        schedules = new InMemoryScheduleRepository();
        executions = new InMemoryExecutionRepository();
        locks = new InMemoryLockManager(clock, Duration.ofMillis(5));
        config = SchedulerConfig.defaults().withLockTimeout(Duration.ofMillis(50));
        runs = new AtomicInteger();
        executor = newExecutor((type, cfg) -> {
            runs.incrementAndGet();
            return JobResult.ok("ok");
        });
    }

    @AfterEach
    void teardown() {
        executor.close();
    }

    private ScheduleExecutor newExecutor(JobRunner runner) {
        return new ScheduleExecutor(schedules, executions, locks, runner, new RecurrenceEngine(), config, clock);
    }

    private ScheduledJob daily(String id, Instant nextRunAt, MissedPolicy policy) {
        ScheduledJob job = ScheduledJob.builder()
                .id(id)
                .ownerId("owner-1")
                .name("Daily " + id)
                .jobType("report")
                .scheduleType(ScheduleType.RECURRING)
                .recurrenceRule(RecurrenceRule.builder(Frequency.DAILY).timeOfDay("09:00").build())
                .nextRunAt(nextRunAt)
                .missedPolicy(policy)
                .createdAt(JAN_1_0900.minusSeconds(86400))
                .build();
        schedules.save(job);
        return job;
    }

    private ScheduledJob stored(String id) {
        return schedules.findById(id).orElseThrow();
    }

    @Test
    void executeRunsAndAdvancesToNextOccurrence() {
        ScheduledJob job = daily("d-1", JAN_1_0900, MissedPolicy.SKIP);

        ScheduleExecution execution = executor.execute(job);

        assertEquals(ExecutionStatus.COMPLETED, execution.status());
        assertEquals(JAN_1_0900, execution.scheduledFor());
        assertEquals("ok", execution.resultPayload());
        assertFalse(execution.manual());

        ScheduledJob after = stored("d-1");
        assertEquals(1, after.runCount());
        assertEquals(clock.instant(), after.lastRunAt());
        assertEquals(Instant.parse("2024-01-02T09:00:00Z"), after.nextRunAt());
        assertEquals(ScheduleStatus.ACTIVE, after.status());
        assertFalse(locks.isLocked(LockManager.jobKey("d-1")));
    }

    @Test
    void concurrentExecutesOfOneOccurrenceRunItOnce() throws Exception {
        executor.close();
        executor = newExecutor((type, cfg) -> {
            runs.incrementAndGet();
            Thread.sleep(100);
            return JobResult.ok();
        });
        ScheduledJob job = daily("d-1", JAN_1_0900, MissedPolicy.SKIP);

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ScheduleExecution>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return executor.execute(job);
                }));
            }
            start.countDown();

            int completed = 0;
            int skipped = 0;
            for (Future<ScheduleExecution> future : futures) {
                ScheduleExecution execution = future.get(10, TimeUnit.SECONDS);
                if (execution.status() == ExecutionStatus.COMPLETED) {
                    completed++;
                } else if (execution.status() == ExecutionStatus.SKIPPED) {
                    skipped++;
                }
            }
            assertEquals(1, completed);
            assertEquals(threads - 1, skipped);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, runs.get());
        assertEquals(1, stored("d-1").runCount());
        assertEquals(1, executions.countByJobIdAndStatus("d-1", ExecutionStatus.COMPLETED));
        assertEquals(threads - 1, executions.countByJobIdAndStatus("d-1", ExecutionStatus.SKIPPED));
    }

    @Test
    void staleSnapshotIsSkippedAsAlreadyHandled() {
        ScheduledJob job = daily("d-1", JAN_1_0900, MissedPolicy.SKIP);
        executor.execute(job);

        ScheduleExecution again = executor.execute(job);

        assertEquals(ExecutionStatus.SKIPPED, again.status());
        assertEquals(ScheduleExecutor.ALREADY_HANDLED, again.errorMessage());
        assertEquals(1, runs.get());
    }

    @Test
    void heldLockSkipsExecution() {
        ScheduledJob job = daily("d-1", JAN_1_0900, MissedPolicy.SKIP);
        locks.acquire(LockManager.jobKey("d-1"), "other-process", Duration.ZERO, Duration.ofMinutes(5));

        ScheduleExecution execution = executor.execute(job);

        assertEquals(ExecutionStatus.SKIPPED, execution.status());
        assertEquals(ScheduleExecutor.LOCK_CONTENDED, execution.errorMessage());
        assertEquals(0, runs.get());
        // still due for a later tick
        assertEquals(JAN_1_0900, stored("d-1").nextRunAt());
        assertEquals(0, stored("d-1").runCount());
    }

    @Test
    void maxRunsCompletesTheJob() {
        ScheduledJob job = daily("d-1", JAN_1_0900, MissedPolicy.SKIP).toBuilder().maxRuns(3).build();
        schedules.update(job);

        for (int i = 0; i < 3; i++) {
            ScheduledJob current = stored("d-1");
            clock.set(current.nextRunAt().plusSeconds(1));
            assertEquals(ExecutionStatus.COMPLETED, executor.execute(current).status());
        }

        ScheduledJob after = stored("d-1");
        assertEquals(3, after.runCount());
        assertEquals(ScheduleStatus.COMPLETED, after.status());
        assertNull(after.nextRunAt());
        assertEquals(3, runs.get());
    }

    @Test
    void failedRunStillAdvances() {
        executor.close();
        executor = newExecutor((type, cfg) -> {
            throw new IllegalStateException("upstream unavailable");
        });
        ScheduledJob job = daily("d-1", JAN_1_0900, MissedPolicy.SKIP);

        ScheduleExecution execution = executor.execute(job);

        assertEquals(ExecutionStatus.FAILED, execution.status());
        assertEquals("upstream unavailable", execution.errorMessage());
        assertEquals(1, stored("d-1").runCount());
        assertEquals(Instant.parse("2024-01-02T09:00:00Z"), stored("d-1").nextRunAt());
    }

    @Test
    void oneTimeJobCompletesAfterItsRun() {
        ScheduledJob job = ScheduledJob.builder()
                .id("once")
                .ownerId("owner-1")
                .name("Once")
                .jobType("report")
                .scheduledAt(JAN_1_0900)
                .nextRunAt(JAN_1_0900)
                .build();
        schedules.save(job);

        executor.execute(job);

        assertEquals(ScheduleStatus.COMPLETED, stored("once").status());
        assertNull(stored("once").nextRunAt());
    }

    @Test
    void cancelledWhileRunningKeepsStatus() {
        executor.close();
        executor = newExecutor((type, cfg) -> {
            ScheduledJob current = stored("d-1");
            schedules.update(current.toBuilder().status(ScheduleStatus.CANCELLED).nextRunAt(null).build());
            return JobResult.ok();
        });
        ScheduledJob job = daily("d-1", JAN_1_0900, MissedPolicy.SKIP);

        executor.execute(job);

        ScheduledJob after = stored("d-1");
        assertEquals(ScheduleStatus.CANCELLED, after.status());
        assertNull(after.nextRunAt());
        assertEquals(1, after.runCount());
    }

    @Test
    void timedOutRunIsFailed() {
        executor.close();
        config.withExecutionTimeout(Duration.ofMillis(100));
        executor = newExecutor((type, cfg) -> {
            Thread.sleep(5_000);
            return JobResult.ok();
        });
        ScheduledJob job = daily("d-1", JAN_1_0900, MissedPolicy.SKIP);

        ScheduleExecution execution = executor.execute(job);

        assertEquals(ExecutionStatus.FAILED, execution.status());
        assertEquals("Execution timed out after PT0.1S", execution.errorMessage());
        assertEquals(Instant.parse("2024-01-02T09:00:00Z"), stored("d-1").nextRunAt());
    }

    // --- Missed runs ---

    @Test
    void onlyCurrentOccurrenceDueIsNotMissed() {
        ScheduledJob job = daily("d-1", JAN_1_0900, MissedPolicy.SKIP);

        assertFalse(executor.isMissed(job, Instant.parse("2024-01-01T23:00:00Z")));
        assertTrue(executor.isMissed(job, Instant.parse("2024-01-02T09:00:00Z")));
    }

    @Test
    void skipPolicyJumpsToNextFutureOccurrence() {
        ScheduledJob job = daily("d-1", JAN_1_0900, MissedPolicy.SKIP);
        Instant now = Instant.parse("2024-01-05T10:00:00Z");
        clock.set(now);

        List<ScheduleExecution> recorded = executor.handleMissed(job, now);

        assertTrue(recorded.isEmpty());
        assertEquals(0, runs.get());
        assertEquals(Instant.parse("2024-01-06T09:00:00Z"), stored("d-1").nextRunAt());
        assertEquals(0, stored("d-1").runCount());
    }

    @Test
    void runLatestPolicyRunsOnceForMostRecentOccurrence() {
        ScheduledJob job = daily("d-1", JAN_1_0900, MissedPolicy.RUN_LATEST);
        Instant now = Instant.parse("2024-01-05T10:00:00Z");
        clock.set(now);

        List<ScheduleExecution> recorded = executor.handleMissed(job, now);

        assertEquals(1, recorded.size());
        assertEquals(Instant.parse("2024-01-05T09:00:00Z"), recorded.get(0).scheduledFor());
        assertEquals(1, stored("d-1").runCount());
        assertEquals(Instant.parse("2024-01-06T09:00:00Z"), stored("d-1").nextRunAt());
    }

    @Test
    void missedRecoveryOfOneTimeJobRunsItOnce() {
        ScheduledJob job = ScheduledJob.builder()
                .id("once")
                .ownerId("owner-1")
                .name("Once")
                .jobType("report")
                .scheduledAt(JAN_1_0900)
                .nextRunAt(JAN_1_0900)
                .missedPolicy(MissedPolicy.RUN_LATEST)
                .build();
        schedules.save(job);
        Instant now = Instant.parse("2024-01-05T10:00:00Z");
        clock.set(now);

        List<ScheduleExecution> recorded = executor.handleMissed(job, now);

        assertEquals(1, recorded.size());
        assertEquals(ExecutionStatus.COMPLETED, recorded.get(0).status());
        assertEquals(JAN_1_0900, recorded.get(0).scheduledFor());
        assertEquals(ScheduleStatus.COMPLETED, stored("once").status());
        assertNull(stored("once").nextRunAt());
    }

    @Test
    void runAllPolicyCatchesUpOldestFirst() {
        ScheduledJob job = daily("d-1", JAN_1_0900, MissedPolicy.RUN_ALL);
        Instant now = Instant.parse("2024-01-03T10:00:00Z");
        clock.set(now);

        List<ScheduleExecution> recorded = executor.handleMissed(job, now);

        assertEquals(List.of(
                JAN_1_0900,
                Instant.parse("2024-01-02T09:00:00Z"),
                Instant.parse("2024-01-03T09:00:00Z")),
                recorded.stream().map(ScheduleExecution::scheduledFor).toList());
        assertEquals(3, stored("d-1").runCount());
        assertEquals(Instant.parse("2024-01-04T09:00:00Z"), stored("d-1").nextRunAt());
    }

    @Test
    void runAllPolicyStopsAtCatchUpCap() {
        ScheduledJob job = daily("d-1", JAN_1_0900, MissedPolicy.RUN_ALL);
        Instant now = Instant.parse("2024-01-10T10:00:00Z");
        clock.set(now);

        List<ScheduleExecution> recorded = executor.handleMissed(job, now);

        assertEquals(SchedulerConfig.DEFAULT_MAX_CATCH_UP_RUNS, recorded.size());
        assertEquals(Instant.parse("2024-01-05T09:00:00Z"), recorded.get(4).scheduledFor());
        assertEquals(5, runs.get());
        // the rest are skipped
        assertEquals(Instant.parse("2024-01-11T09:00:00Z"), stored("d-1").nextRunAt());
    }

    @Test
    void runAllPolicyRespectsMaxRuns() {
        ScheduledJob job = daily("d-1", JAN_1_0900, MissedPolicy.RUN_ALL).toBuilder().maxRuns(2).build();
        schedules.update(job);
        Instant now = Instant.parse("2024-01-10T10:00:00Z");
        clock.set(now);

        List<ScheduleExecution> recorded = executor.handleMissed(stored("d-1"), now);

        assertEquals(2, recorded.size());
        assertEquals(ScheduleStatus.COMPLETED, stored("d-1").status());
    }

    // --- Manual runs ---

    @Test
    void runNowLeavesScheduleUntouched() {
        daily("d-1", JAN_1_0900.plusSeconds(86400), MissedPolicy.SKIP);

        ScheduleExecution execution = executor.runNow("d-1", false);

        assertEquals(ExecutionStatus.COMPLETED, execution.status());
        assertTrue(execution.manual());
        assertEquals(0, stored("d-1").runCount());
        assertEquals(JAN_1_0900.plusSeconds(86400), stored("d-1").nextRunAt());
    }

    @Test
    void countedRunNowCanCompleteTheJob() {
        ScheduledJob job = daily("d-1", JAN_1_0900.plusSeconds(86400), MissedPolicy.SKIP).toBuilder()
                .maxRuns(1).build();
        schedules.update(job);

        executor.runNow("d-1", true);

        ScheduledJob after = stored("d-1");
        assertEquals(1, after.runCount());
        assertEquals(ScheduleStatus.COMPLETED, after.status());
        assertNull(after.nextRunAt());
    }

    @Test
    void runNowTakesTheJobLock() {
        daily("d-1", JAN_1_0900, MissedPolicy.SKIP);
        locks.acquire(LockManager.jobKey("d-1"), "tick-in-progress", Duration.ZERO, Duration.ofMinutes(5));

        ScheduleExecution execution = executor.runNow("d-1", true);

        assertEquals(ExecutionStatus.SKIPPED, execution.status());
        assertTrue(execution.manual());
        assertEquals(0, runs.get());
    }

    @Test
    void runNowOfUnknownJobThrows() {
        assertThrows(ScheduleNotFoundException.class, () -> executor.runNow("missing", false));
    }
}
