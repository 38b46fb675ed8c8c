package tickwork.scheduler.store;

import tickwork.scheduler.model.Priority;
import tickwork.scheduler.model.ScheduleStatus;
import tickwork.scheduler.model.ScheduledJob;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryScheduleRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private InMemoryScheduleRepository repo;

    @BeforeEach
    void setup() {
        repo = new InMemoryScheduleRepository();
    }

    private ScheduledJob job(String id, Priority priority, Instant nextRunAt) {
        return ScheduledJob.builder()
                .id(id)
                .ownerId("owner-1")
                .name(id)
                .jobType("noop")
                .priority(priority)
                .nextRunAt(nextRunAt)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    @Test
    void duplicateSaveIsRejected() {
        repo.save(job("a", Priority.NORMAL, NOW));

        assertThrows(IllegalStateException.class, () -> repo.save(job("a", Priority.NORMAL, NOW)));
    }

    @Test
    void updateBumpsVersionAndRejectsStaleCopies() {
        ScheduledJob job = job("a", Priority.NORMAL, NOW);
        repo.save(job);

        assertTrue(repo.update(job.toBuilder().status(ScheduleStatus.PAUSED).build()));
        assertFalse(repo.update(job.toBuilder().status(ScheduleStatus.CANCELLED).build()));
        assertFalse(repo.update(job("missing", Priority.NORMAL, NOW)));

        ScheduledJob stored = repo.findById("a").orElseThrow();
        assertEquals(ScheduleStatus.PAUSED, stored.status());
        assertEquals(1, stored.version());
    }

    @Test
    void findDueMatchesJdbcOrdering() {
        repo.save(job("low", Priority.LOW, NOW.minusSeconds(60)));
        repo.save(job("urgent", Priority.URGENT, NOW));
        repo.save(job("normal", Priority.NORMAL, NOW.minusSeconds(30)));
        repo.save(job("future", Priority.URGENT, NOW.plusSeconds(30)));

        List<String> due = repo.findDue(NOW, 10).stream().map(ScheduledJob::id).toList();

        assertEquals(List.of("urgent", "normal", "low"), due);
    }
}
