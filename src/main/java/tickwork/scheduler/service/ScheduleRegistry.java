package tickwork.scheduler.service;

import tickwork.scheduler.config.SchedulerConfig;
import tickwork.scheduler.error.BulkLimitExceededException;
import tickwork.scheduler.error.IllegalScheduleStateException;
import tickwork.scheduler.error.ScheduleNotFoundException;
import tickwork.scheduler.error.ScheduleValidationException;
import tickwork.scheduler.error.SchedulingException;
import tickwork.scheduler.executor.ScheduleExecutor;
import tickwork.scheduler.model.BulkResult;
import tickwork.scheduler.model.RecurrenceRule;
import tickwork.scheduler.model.ScheduleExecution;
import tickwork.scheduler.model.ScheduleStatus;
import tickwork.scheduler.model.ScheduleType;
import tickwork.scheduler.model.ScheduledJob;
import tickwork.scheduler.recurrence.FixedOffsetZones;
import tickwork.scheduler.recurrence.RecurrenceEngine;
import tickwork.scheduler.recurrence.RuleIssue;
import tickwork.scheduler.recurrence.SchedulePatterns;
import tickwork.scheduler.repository.ExecutionRepository;
import tickwork.scheduler.repository.OptimisticUpdate;
import tickwork.scheduler.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

/**
 * Business logic for scheduled job definitions: creation, lifecycle
 * transitions, updates and bulk operations.
 *
 * Every operation is scoped to an owner. A job that belongs to another owner
 * is reported as not found.
 */
public class ScheduleRegistry {

    private static final Logger log = LoggerFactory.getLogger(ScheduleRegistry.class);

    private final ScheduleRepository schedules;
    private final ExecutionRepository executions;
    private final ScheduleExecutor executor;
    private final RecurrenceEngine engine;
    private final SchedulerConfig config;
    private final Clock clock;

    public ScheduleRegistry(ScheduleRepository schedules, ExecutionRepository executions, ScheduleExecutor executor,
            RecurrenceEngine engine, SchedulerConfig config, Clock clock) {
        this.schedules = schedules;
        this.executions = executions;
        this.executor = executor;
        this.engine = engine;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Create a job. It starts ACTIVE with its first run computed from now.
     *
     * A recurring rule without a start date is pinned to the date of its first
     * run (in the job's timezone), which anchors its interval and occurrence
     * count.
     *
     * @param ownerId the owning user
     * @param request the job definition
     * @return the stored job
     * @throws ScheduleValidationException listing every violated constraint
     */
    public ScheduledJob create(String ownerId, CreateScheduleRequest request) {
        Instant now = clock.instant();
        List<RuleIssue> issues = new ArrayList<>();

        if (ownerId == null || ownerId.isBlank()) {
            issues.add(new RuleIssue("owner_id", "Owner is required"));
        }
        if (request.name() == null || request.name().isBlank()) {
            issues.add(new RuleIssue("name", "Name is required"));
        }
        if (request.jobType() == null || request.jobType().isBlank()) {
            issues.add(new RuleIssue("job_type", "Job type is required"));
        }
        String timezone = request.timezone() != null ? request.timezone() : FixedOffsetZones.UTC;
        if (!FixedOffsetZones.isValid(timezone)) {
            issues.add(new RuleIssue("timezone", "Invalid timezone: " + timezone));
        }
        if (request.maxRuns() != null && request.maxRuns() < 1) {
            issues.add(new RuleIssue("max_runs", "Max runs must be positive"));
        }

        ScheduleType type = request.scheduleType();
        RecurrenceRule rule = null;
        Instant nextRunAt = null;

        if (type == null) {
            issues.add(new RuleIssue("schedule_type", "Schedule type is required"));
        } else if (type == ScheduleType.RECURRING) {
            rule = request.recurrenceRule();
            if (rule == null) {
                issues.add(new RuleIssue("recurrence", "Recurring schedule requires a recurrence rule"));
            } else {
                List<RuleIssue> ruleIssues = engine.validate(rule);
                issues.addAll(ruleIssues);
                if (ruleIssues.isEmpty() && FixedOffsetZones.isValid(timezone)) {
                    ZoneOffset zone = FixedOffsetZones.offsetOf(timezone);
                    rule = engine.pinStartDate(rule, now, zone);
                    nextRunAt = engine.nextOccurrence(rule, now, zone).orElse(null);
                    if (nextRunAt == null) {
                        issues.add(new RuleIssue("recurrence", "Recurrence has no future occurrence"));
                    }
                }
            }
        } else {
            if (request.scheduledAt() == null) {
                issues.add(new RuleIssue("scheduled_at", "One-time schedule requires scheduled_at"));
            } else if (!request.scheduledAt().isAfter(now)) {
                issues.add(new RuleIssue("scheduled_at", "Scheduled time must be in the future"));
            }
            nextRunAt = request.scheduledAt();
        }

        if (!issues.isEmpty()) {
            throw new ScheduleValidationException(issues);
        }

        ScheduledJob.Builder builder = ScheduledJob.builder()
                .id(schedules.generateId())
                .ownerId(ownerId)
                .name(request.name())
                .jobType(request.jobType())
                .jobConfig(request.jobConfig())
                .scheduleType(type)
                .scheduledAt(type == ScheduleType.ONE_TIME ? request.scheduledAt() : null)
                .recurrenceRule(rule)
                .timezone(timezone)
                .status(ScheduleStatus.ACTIVE)
                .nextRunAt(nextRunAt)
                .maxRuns(request.maxRuns())
                .createdAt(now)
                .updatedAt(now);
        if (request.description() != null) {
            builder.description(request.description());
        }
        if (request.priority() != null) {
            builder.priority(request.priority());
        }
        if (request.missedPolicy() != null) {
            builder.missedPolicy(request.missedPolicy());
        }
        ScheduledJob job = builder.build();

        schedules.save(job);
        log.info("Created {} schedule {} for owner {}, next run at {}", type, job.id(), ownerId, nextRunAt);
        return job;
    }

    /**
     * Create a recurring job from a named preset, see {@link #patterns()}.
     *
     * @throws ScheduleValidationException if the pattern is unknown
     */
    public ScheduledJob createFromPattern(String ownerId, String patternName, String name, String jobType,
            Map<String, Object> jobConfig) {
        RecurrenceRule rule = SchedulePatterns.named(patternName)
                .orElseThrow(() -> new ScheduleValidationException("pattern", "Unknown pattern: " + patternName));
        return create(ownerId, CreateScheduleRequest.recurring(name, jobType, rule).withJobConfig(jobConfig));
    }

    public ScheduledJob get(String ownerId, String jobId) {
        return findOwned(ownerId, jobId);
    }

    /**
     * One owner's jobs, newest first.
     *
     * @param status  only jobs in this status, or null for all
     * @param jobType only jobs of this type, or null for all
     */
    public List<ScheduledJob> list(String ownerId, ScheduleStatus status, String jobType) {
        return schedules.findByOwner(ownerId).stream()
                .filter(job -> status == null || job.status() == status)
                .filter(job -> jobType == null || job.jobType().equals(jobType))
                .toList();
    }

    /**
     * Apply a partial update. A new rule or timezone is re-validated and, for
     * ACTIVE and PAUSED jobs, next_run_at is recomputed from now.
     *
     * @throws ScheduleValidationException if the result would be invalid
     */
    public ScheduledJob update(String ownerId, String jobId, ScheduleUpdate update) {
        findOwned(ownerId, jobId);
        Instant now = clock.instant();

        return modify(jobId, job -> {
            List<RuleIssue> issues = new ArrayList<>();
            ScheduledJob.Builder builder = job.toBuilder().updatedAt(now);

            if (update.name() != null) {
                if (update.name().isBlank()) {
                    issues.add(new RuleIssue("name", "Name is required"));
                }
                builder.name(update.name());
            }
            if (update.description() != null) {
                builder.description(update.description());
            }
            if (update.jobConfig() != null) {
                builder.jobConfig(update.jobConfig());
            }
            if (update.priority() != null) {
                builder.priority(update.priority());
            }
            if (update.missedPolicy() != null) {
                builder.missedPolicy(update.missedPolicy());
            }
            if (update.maxRuns() != null) {
                if (update.maxRuns() < 1) {
                    issues.add(new RuleIssue("max_runs", "Max runs must be positive"));
                }
                builder.maxRuns(update.maxRuns());
            }

            String timezone = update.timezone() != null ? update.timezone() : job.timezone();
            if (!FixedOffsetZones.isValid(timezone)) {
                issues.add(new RuleIssue("timezone", "Invalid timezone: " + timezone));
            }
            builder.timezone(timezone);

            RecurrenceRule rule = job.recurrenceRule();
            if (update.recurrence() != null) {
                if (job.scheduleType() != ScheduleType.RECURRING) {
                    issues.add(new RuleIssue("recurrence", "Only recurring schedules have a recurrence rule"));
                } else {
                    rule = update.recurrence().toRule();
                    issues.addAll(engine.validate(rule));
                }
            }

            boolean reschedule = update.changesTiming()
                    && job.isRecurring()
                    && (job.status() == ScheduleStatus.ACTIVE || job.status() == ScheduleStatus.PAUSED);
            if (issues.isEmpty() && reschedule) {
                ZoneOffset zone = FixedOffsetZones.offsetOf(timezone);
                rule = engine.pinStartDate(rule, now, zone);
                Optional<Instant> next = engine.nextOccurrence(rule, now, zone);
                if (next.isEmpty()) {
                    issues.add(new RuleIssue("recurrence", "Recurrence has no future occurrence"));
                } else {
                    builder.nextRunAt(next.get());
                }
            }
            if (!issues.isEmpty()) {
                throw new ScheduleValidationException(issues);
            }
            return builder.recurrenceRule(rule).build();
        });
    }

    /**
     * Delete a job and its execution history. A run in progress is not
     * interrupted.
     */
    public void delete(String ownerId, String jobId) {
        findOwned(ownerId, jobId);
        schedules.delete(jobId);
        int history = executions.deleteByJobId(jobId);
        log.info("Deleted schedule {} ({} executions)", jobId, history);
    }

    /** ACTIVE -> PAUSED. */
    public ScheduledJob pause(String ownerId, String jobId) {
        findOwned(ownerId, jobId);
        ScheduledJob paused = modify(jobId, job -> {
            if (job.status() != ScheduleStatus.ACTIVE) {
                throw new IllegalScheduleStateException(jobId, job.status(), "pause");
            }
            return job.toBuilder().status(ScheduleStatus.PAUSED).updatedAt(clock.instant()).build();
        });
        log.info("Paused schedule {}", jobId);
        return paused;
    }

    /**
     * PAUSED -> ACTIVE. A recurring job's next run is recomputed from now, so
     * occurrences that passed while paused are not replayed. A one-time job
     * whose instant passed is due immediately.
     */
    public ScheduledJob resume(String ownerId, String jobId) {
        findOwned(ownerId, jobId);
        ScheduledJob resumed = modify(jobId, job -> {
            if (job.status() != ScheduleStatus.PAUSED) {
                throw new IllegalScheduleStateException(jobId, job.status(), "resume");
            }
            Instant now = clock.instant();
            ScheduledJob.Builder builder = job.toBuilder().status(ScheduleStatus.ACTIVE).updatedAt(now);
            if (job.isRecurring()) {
                Optional<Instant> next = engine.nextOccurrence(job.recurrenceRule(), now,
                        FixedOffsetZones.offsetOf(job.timezone()));
                if (next.isEmpty()) {
                    return builder.status(ScheduleStatus.COMPLETED).nextRunAt(null).build();
                }
                builder.nextRunAt(next.get());
            } else {
                builder.nextRunAt(job.scheduledAt());
            }
            return builder.build();
        });
        log.info("Resumed schedule {} ({}), next run at {}", jobId, resumed.status(), resumed.nextRunAt());
        return resumed;
    }

    /**
     * Any non-terminal status -> CANCELLED. A run in progress completes; only
     * its counters are recorded.
     */
    public ScheduledJob cancel(String ownerId, String jobId) {
        findOwned(ownerId, jobId);
        ScheduledJob cancelled = modify(jobId, job -> {
            if (job.status().isTerminal()) {
                throw new IllegalScheduleStateException(jobId, job.status(), "cancel");
            }
            return job.toBuilder()
                    .status(ScheduleStatus.CANCELLED)
                    .nextRunAt(null)
                    .updatedAt(clock.instant())
                    .build();
        });
        log.info("Cancelled schedule {}", jobId);
        return cancelled;
    }

    /**
     * Create a new job with the same definition. Run history and counters are
     * not copied; the rule keeps its original start date.
     *
     * @param newName name of the copy, or null for "&lt;name&gt; (Copy)"
     */
    public ScheduledJob clone(String ownerId, String jobId, String newName) {
        ScheduledJob original = findOwned(ownerId, jobId);
        CreateScheduleRequest request = new CreateScheduleRequest(
                newName != null ? newName : original.name() + " (Copy)",
                original.description(),
                original.jobType(),
                original.jobConfig(),
                original.scheduleType(),
                original.scheduledAt(),
                original.recurrenceRule() != null ? RecurrenceRequest.from(original.recurrenceRule()) : null,
                original.timezone(),
                original.priority(),
                original.maxRuns(),
                original.missedPolicy());
        ScheduledJob copy = create(ownerId, request);
        log.info("Cloned schedule {} into {}", jobId, copy.id());
        return copy;
    }

    /**
     * Run a job now, under its tick lock.
     *
     * @param countRun whether the run counts toward max_runs
     * @throws IllegalScheduleStateException if the job is COMPLETED or CANCELLED
     */
    public ScheduleExecution runNow(String ownerId, String jobId, boolean countRun) {
        ScheduledJob job = findOwned(ownerId, jobId);
        if (job.status().isTerminal()) {
            throw new IllegalScheduleStateException(jobId, job.status(), "run");
        }
        return executor.runNow(jobId, countRun);
    }

    /** Execution history, latest occurrence first. */
    public List<ScheduleExecution> executions(String ownerId, String jobId, int limit) {
        findOwned(ownerId, jobId);
        return executions.findByJobId(jobId, limit);
    }

    /**
     * Upcoming run instants: the next {@code n} occurrences after now for an
     * ACTIVE or PAUSED recurring job, the pending instant for a one-time job,
     * nothing for a finished one.
     */
    public List<Instant> nextOccurrences(String ownerId, String jobId, int n) {
        ScheduledJob job = findOwned(ownerId, jobId);
        if (job.status().isTerminal()) {
            return List.of();
        }
        if (!job.isRecurring()) {
            return job.nextRunAt() != null ? List.of(job.nextRunAt()) : List.of();
        }
        return engine.nextNOccurrences(job.recurrenceRule(), n, clock.instant(),
                FixedOffsetZones.offsetOf(job.timezone()));
    }

    /** Named recurrence presets usable with {@link #createFromPattern}. */
    public Map<String, RecurrenceRule> patterns() {
        return SchedulePatterns.all();
    }

    // --- Bulk ---

    public BulkResult bulkPause(String ownerId, List<String> jobIds) {
        return bulk("pause", ownerId, jobIds, this::pause);
    }

    public BulkResult bulkResume(String ownerId, List<String> jobIds) {
        return bulk("resume", ownerId, jobIds, this::resume);
    }

    public BulkResult bulkCancel(String ownerId, List<String> jobIds) {
        return bulk("cancel", ownerId, jobIds, this::cancel);
    }

    /**
     * Apply a transition to each job. The size check happens before anything
     * is touched; after that each job succeeds or fails on its own.
     *
     * @throws BulkLimitExceededException if more than maxBulkSize ids are given
     */
    private BulkResult bulk(String operation, String ownerId, List<String> jobIds,
            BiFunction<String, String, ScheduledJob> transition) {
        if (jobIds.size() > config.maxBulkSize()) {
            throw new BulkLimitExceededException(jobIds.size(), config.maxBulkSize());
        }

        int success = 0;
        List<BulkResult.Failure> failures = new ArrayList<>();
        for (String jobId : jobIds) {
            try {
                transition.apply(ownerId, jobId);
                success++;
            } catch (SchedulingException e) {
                failures.add(new BulkResult.Failure(jobId, e.getMessage()));
            }
        }

        BulkResult result = new BulkResult(UUID.randomUUID().toString(), operation, jobIds.size(), success,
                failures);
        log.info("Bulk {} for owner {}: {} of {} succeeded", operation, ownerId, success, jobIds.size());
        return result;
    }

    // --- Helpers ---

    private ScheduledJob findOwned(String ownerId, String jobId) {
        return schedules.findById(jobId)
                .filter(job -> job.ownerId().equals(ownerId))
                .orElseThrow(() -> new ScheduleNotFoundException(jobId));
    }

    private ScheduledJob modify(String jobId, UnaryOperator<ScheduledJob> change) {
        return OptimisticUpdate.apply(schedules, jobId, change)
                .orElseThrow(() -> new ScheduleNotFoundException(jobId));
    }
}
