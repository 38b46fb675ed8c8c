package tickwork.scheduler.store;

import tickwork.scheduler.model.ScheduledJob;
import tickwork.scheduler.repository.ScheduleRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local ScheduleRepository. Used by default and in tests.
 */
public class InMemoryScheduleRepository implements ScheduleRepository {

    private static final Comparator<ScheduledJob> NEWEST_FIRST = Comparator
            .comparing(ScheduledJob::createdAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(ScheduledJob::id);

    private static final Comparator<ScheduledJob> DUE_ORDER = Comparator
            .comparingInt((ScheduledJob j) -> j.priority().weight())
            .thenComparing(ScheduledJob::nextRunAt)
            .thenComparing(ScheduledJob::id);

    private final ConcurrentHashMap<String, ScheduledJob> jobs = new ConcurrentHashMap<>();

    @Override
    public void save(ScheduledJob job) {
        if (jobs.putIfAbsent(job.id(), job) != null) {
            throw new IllegalStateException("Schedule already exists: " + job.id());
        }
    }

    @Override
    public Optional<ScheduledJob> findById(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public List<ScheduledJob> findAll() {
        return jobs.values().stream().sorted(NEWEST_FIRST).toList();
    }

    @Override
    public List<ScheduledJob> findByOwner(String ownerId) {
        return jobs.values().stream()
                .filter(j -> j.ownerId().equals(ownerId))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public List<ScheduledJob> findDue(Instant asOf, int limit) {
        return jobs.values().stream()
                .filter(j -> j.isDue(asOf))
                .sorted(DUE_ORDER)
                .limit(limit)
                .toList();
    }

    @Override
    public boolean update(ScheduledJob job) {
        boolean[] applied = { false };
        jobs.computeIfPresent(job.id(), (id, current) -> {
            if (current.version() != job.version()) {
                return current;
            }
            applied[0] = true;
            return job.toBuilder().version(job.version() + 1).build();
        });
        return applied[0];
    }

    @Override
    public boolean delete(String jobId) {
        return jobs.remove(jobId) != null;
    }

    @Override
    public String generateId() {
        return "sched-" + UUID.randomUUID();
    }
}
