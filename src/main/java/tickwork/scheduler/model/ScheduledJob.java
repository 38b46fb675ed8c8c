package tickwork.scheduler.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable domain model of a user-defined job schedule.
 * The job type and config are opaque to the scheduler and are only handed to
 * the job runner.
 */
public final class ScheduledJob {
    private final String id;
    private final String ownerId;
    private final String name;
    private final String description;
    private final String jobType;
    private final Map<String, Object> jobConfig;
    private final ScheduleType scheduleType;
    private final Instant scheduledAt; // ONE_TIME only
    private final RecurrenceRule recurrenceRule; // RECURRING only
    private final String timezone;
    private final ScheduleStatus status;
    private final Priority priority;
    private final Instant nextRunAt;
    private final Instant lastRunAt;
    private final int runCount;
    private final Integer maxRuns;
    private final MissedPolicy missedPolicy;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final long version;

    private ScheduledJob(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.ownerId = Objects.requireNonNull(builder.ownerId, "ownerId is required");
        this.name = builder.name;
        this.description = builder.description;
        this.jobType = Objects.requireNonNull(builder.jobType, "jobType is required");
        this.jobConfig = builder.jobConfig != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.jobConfig))
                : Map.of();
        this.scheduleType = Objects.requireNonNull(builder.scheduleType, "scheduleType is required");
        this.scheduledAt = builder.scheduledAt;
        this.recurrenceRule = builder.recurrenceRule;
        this.timezone = builder.timezone;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.nextRunAt = builder.nextRunAt;
        this.lastRunAt = builder.lastRunAt;
        this.runCount = builder.runCount;
        this.maxRuns = builder.maxRuns;
        this.missedPolicy = Objects.requireNonNull(builder.missedPolicy, "missedPolicy is required");
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.version = builder.version;
    }

    public String id() {
        return id;
    }

    public String ownerId() {
        return ownerId;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public String jobType() {
        return jobType;
    }

    public Map<String, Object> jobConfig() {
        return jobConfig;
    }

    public ScheduleType scheduleType() {
        return scheduleType;
    }

    public Instant scheduledAt() {
        return scheduledAt;
    }

    public RecurrenceRule recurrenceRule() {
        return recurrenceRule;
    }

    public String timezone() {
        return timezone;
    }

    public ScheduleStatus status() {
        return status;
    }

    public Priority priority() {
        return priority;
    }

    public Instant nextRunAt() {
        return nextRunAt;
    }

    public Instant lastRunAt() {
        return lastRunAt;
    }

    public int runCount() {
        return runCount;
    }

    public Integer maxRuns() {
        return maxRuns;
    }

    public MissedPolicy missedPolicy() {
        return missedPolicy;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Optimistic concurrency token, bumped by the repository on every update */
    public long version() {
        return version;
    }

    public boolean isRecurring() {
        return scheduleType == ScheduleType.RECURRING && recurrenceRule != null;
    }

    /** Check if the job is ACTIVE and its next run is at or before the given instant */
    public boolean isDue(Instant asOf) {
        return status == ScheduleStatus.ACTIVE && nextRunAt != null && !nextRunAt.isAfter(asOf);
    }

    /** Check if another run would hit the max-runs cap */
    public boolean maxRunsReached(int runs) {
        return maxRuns != null && runs >= maxRuns;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .ownerId(ownerId)
                .name(name)
                .description(description)
                .jobType(jobType)
                .jobConfig(jobConfig)
                .scheduleType(scheduleType)
                .scheduledAt(scheduledAt)
                .recurrenceRule(recurrenceRule)
                .timezone(timezone)
                .status(status)
                .priority(priority)
                .nextRunAt(nextRunAt)
                .lastRunAt(lastRunAt)
                .runCount(runCount)
                .maxRuns(maxRuns)
                .missedPolicy(missedPolicy)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .version(version);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String ownerId;
        private String name;
        private String description = "";
        private String jobType;
        private Map<String, Object> jobConfig = Map.of();
        private ScheduleType scheduleType = ScheduleType.ONE_TIME;
        private Instant scheduledAt;
        private RecurrenceRule recurrenceRule;
        private String timezone = "UTC";
        private ScheduleStatus status = ScheduleStatus.ACTIVE;
        private Priority priority = Priority.NORMAL;
        private Instant nextRunAt;
        private Instant lastRunAt;
        private int runCount;
        private Integer maxRuns;
        private MissedPolicy missedPolicy = MissedPolicy.SKIP;
        private Instant createdAt;
        private Instant updatedAt;
        private long version;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder jobType(String jobType) {
            this.jobType = jobType;
            return this;
        }

        public Builder jobConfig(Map<String, Object> jobConfig) {
            this.jobConfig = jobConfig;
            return this;
        }

        public Builder scheduleType(ScheduleType scheduleType) {
            this.scheduleType = scheduleType;
            return this;
        }

        public Builder scheduledAt(Instant scheduledAt) {
            this.scheduledAt = scheduledAt;
            return this;
        }

        public Builder recurrenceRule(RecurrenceRule recurrenceRule) {
            this.recurrenceRule = recurrenceRule;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder status(ScheduleStatus status) {
            this.status = status;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder nextRunAt(Instant nextRunAt) {
            this.nextRunAt = nextRunAt;
            return this;
        }

        public Builder lastRunAt(Instant lastRunAt) {
            this.lastRunAt = lastRunAt;
            return this;
        }

        public Builder runCount(int runCount) {
            this.runCount = runCount;
            return this;
        }

        public Builder maxRuns(Integer maxRuns) {
            this.maxRuns = maxRuns;
            return this;
        }

        public Builder missedPolicy(MissedPolicy missedPolicy) {
            this.missedPolicy = missedPolicy;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public ScheduledJob build() {
            return new ScheduledJob(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScheduledJob job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ScheduledJob{id='" + id + "', status=" + status + ", priority=" + priority
                + ", nextRunAt=" + nextRunAt + ", runCount=" + runCount + "}";
    }
}
