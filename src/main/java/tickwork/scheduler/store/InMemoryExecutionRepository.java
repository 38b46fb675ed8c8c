package tickwork.scheduler.store;

import tickwork.scheduler.model.ExecutionStatus;
import tickwork.scheduler.model.ScheduleExecution;
import tickwork.scheduler.repository.ExecutionRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local ExecutionRepository.
 */
public class InMemoryExecutionRepository implements ExecutionRepository {

    private static final Comparator<ScheduleExecution> LATEST_FIRST = Comparator
            .comparing(ScheduleExecution::scheduledFor, Comparator.reverseOrder())
            .thenComparing(ScheduleExecution::startedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final ConcurrentHashMap<String, ScheduleExecution> executions = new ConcurrentHashMap<>();

    @Override
    public void save(ScheduleExecution execution) {
        if (executions.putIfAbsent(execution.id(), execution) != null) {
            throw new IllegalStateException("Execution already exists: " + execution.id());
        }
    }

    @Override
    public Optional<ScheduleExecution> findById(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public List<ScheduleExecution> findByJobId(String jobId, int limit) {
        return executions.values().stream()
                .filter(e -> e.jobId().equals(jobId))
                .sorted(LATEST_FIRST)
                .limit(limit)
                .toList();
    }

    @Override
    public boolean complete(String executionId, ExecutionStatus status, Instant completedAt, String errorMessage,
            String resultPayload) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        boolean[] applied = { false };
        executions.computeIfPresent(executionId, (id, current) -> {
            if (current.isTerminal()) {
                return current;
            }
            applied[0] = true;
            return current.toBuilder()
                    .status(status)
                    .completedAt(completedAt)
                    .errorMessage(errorMessage)
                    .resultPayload(resultPayload)
                    .build();
        });
        return applied[0];
    }

    @Override
    public List<ScheduleExecution> findStuckRunning(Instant startedBefore) {
        return executions.values().stream()
                .filter(e -> e.status() == ExecutionStatus.RUNNING)
                .filter(e -> e.startedAt() != null && e.startedAt().isBefore(startedBefore))
                .sorted(Comparator.comparing(ScheduleExecution::startedAt))
                .toList();
    }

    @Override
    public int countByJobIdAndStatus(String jobId, ExecutionStatus status) {
        return (int) executions.values().stream()
                .filter(e -> e.jobId().equals(jobId) && e.status() == status)
                .count();
    }

    @Override
    public int deleteByJobId(String jobId) {
        int before = executions.size();
        executions.values().removeIf(e -> e.jobId().equals(jobId));
        return before - executions.size();
    }

    @Override
    public String generateId() {
        return "exec-" + UUID.randomUUID();
    }
}
