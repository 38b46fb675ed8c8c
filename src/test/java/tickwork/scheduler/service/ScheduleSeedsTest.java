package tickwork.scheduler.service;

import tickwork.scheduler.MutableClock;
import tickwork.scheduler.config.SchedulerConfig;
import tickwork.scheduler.executor.JobResult;
import tickwork.scheduler.executor.ScheduleExecutor;
import tickwork.scheduler.lock.InMemoryLockManager;
import tickwork.scheduler.model.*;
import tickwork.scheduler.recurrence.RecurrenceEngine;
import tickwork.scheduler.store.InMemoryExecutionRepository;
import tickwork.scheduler.store.InMemoryScheduleRepository;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleSeedsTest {

    private static final String SEEDS = """
            [
              {
                "name": "Weekly digest",
                "job_type": "email",
                "job_config": {"template": "digest", "batch": 100},
                "schedule_type": "RECURRING",
                "recurrence": {
                  "frequency": "WEEKLY",
                  "days_of_week": [1, 4],
                  "time_of_day": "09:00",
                  "exceptions": ["2024-01-04"]
                },
                "priority": "HIGH",
                "missed_policy": "RUN_LATEST",
                "unknown_field": true
              },
              {
                "name": "Launch",
                "job_type": "notify",
                "schedule_type": "ONE_TIME",
                "scheduled_at": "2024-01-02T12:00:00Z",
                "timezone": "Europe/Paris"
              },
              {
                "name": "Broken",
                "job_type": "notify",
                "schedule_type": "RECURRING"
              }
            ]
            """;

    @Test
    void parsesSnakeCaseRequests() throws Exception {
        List<CreateScheduleRequest> requests = ScheduleSeeds.parse(SEEDS);

        assertEquals(3, requests.size());
        CreateScheduleRequest digest = requests.get(0);
        assertEquals("email", digest.jobType());
        assertEquals(100, ((Number) digest.jobConfig().get("batch")).intValue());
        assertEquals(Priority.HIGH, digest.priority());
        assertEquals(MissedPolicy.RUN_LATEST, digest.missedPolicy());

        RecurrenceRule rule = digest.recurrenceRule();
        assertEquals(Frequency.WEEKLY, rule.frequency());
        assertEquals(1, rule.interval());
        assertEquals(List.of(1, 4), rule.daysOfWeek());
        assertEquals(Set.of(LocalDate.of(2024, 1, 4)), rule.exceptions());

        assertEquals(Instant.parse("2024-01-02T12:00:00Z"), requests.get(1).scheduledAt());
        assertNull(requests.get(1).recurrenceRule());
    }

    @Test
    void registerSkipsInvalidEntries() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T08:00:00Z"));
        InMemoryScheduleRepository schedules = new InMemoryScheduleRepository();
        InMemoryExecutionRepository executions = new InMemoryExecutionRepository();
        SchedulerConfig config = SchedulerConfig.defaults();
        RecurrenceEngine engine = new RecurrenceEngine();
        try (ScheduleExecutor executor = new ScheduleExecutor(schedules, executions,
                new InMemoryLockManager(clock, Duration.ofMillis(5)), (type, cfg) -> JobResult.ok(),
                engine, config, clock)) {
            ScheduleRegistry registry = new ScheduleRegistry(schedules, executions, executor, engine, config, clock);

            List<ScheduledJob> created = ScheduleSeeds.register(registry, "seed-owner", ScheduleSeeds.parse(SEEDS));

            assertEquals(List.of("Weekly digest", "Launch"), created.stream().map(ScheduledJob::name).toList());
            // Monday 09:00 is still ahead
            assertEquals(Instant.parse("2024-01-01T09:00:00Z"), created.get(0).nextRunAt());
            assertEquals("Europe/Paris", created.get(1).timezone());
        }
    }

    @Test
    void writtenSeedsReadBack(@TempDir Path dir) throws Exception {
        List<CreateScheduleRequest> original = List.of(
                CreateScheduleRequest.recurring("Nightly", "backup",
                        RecurrenceRule.builder(Frequency.DAILY).timeOfDay("02:30").build())
                        .withMaxRuns(7));
        Path file = dir.resolve("seeds.json");
        Files.writeString(file, ScheduleSeeds.write(original));

        String json = Files.readString(file);
        assertTrue(json.contains("time_of_day") && json.contains("02:30"), json);

        List<CreateScheduleRequest> read = ScheduleSeeds.read(file);
        assertEquals(7, read.get(0).maxRuns());
        assertEquals(original.get(0).recurrenceRule(), read.get(0).recurrenceRule());
    }
}
