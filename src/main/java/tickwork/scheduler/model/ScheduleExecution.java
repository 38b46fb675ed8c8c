package tickwork.scheduler.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one execution attempt of a scheduled job.
 * One is created per tick attempt, including attempts skipped because of
 * lock contention.
 */
public final class ScheduleExecution {
    private final String id;
    private final String jobId;
    private final Instant scheduledFor;
    private final Instant startedAt;
    private final Instant completedAt;
    private final ExecutionStatus status;
    private final boolean manual;
    private final String errorMessage;
    private final String resultPayload;

    private ScheduleExecution(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.jobId = Objects.requireNonNull(builder.jobId, "jobId is required");
        this.scheduledFor = Objects.requireNonNull(builder.scheduledFor, "scheduledFor is required");
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.manual = builder.manual;
        this.errorMessage = builder.errorMessage;
        this.resultPayload = builder.resultPayload;
    }

    public String id() {
        return id;
    }

    public String jobId() {
        return jobId;
    }

    public Instant scheduledFor() {
        return scheduledFor;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public ExecutionStatus status() {
        return status;
    }

    public boolean manual() {
        return manual;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public String resultPayload() {
        return resultPayload;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .jobId(jobId)
                .scheduledFor(scheduledFor)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .status(status)
                .manual(manual)
                .errorMessage(errorMessage)
                .resultPayload(resultPayload);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String jobId;
        private Instant scheduledFor;
        private Instant startedAt;
        private Instant completedAt;
        private ExecutionStatus status = ExecutionStatus.PENDING;
        private boolean manual;
        private String errorMessage;
        private String resultPayload;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder scheduledFor(Instant scheduledFor) {
            this.scheduledFor = scheduledFor;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder manual(boolean manual) {
            this.manual = manual;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder resultPayload(String resultPayload) {
            this.resultPayload = resultPayload;
            return this;
        }

        public ScheduleExecution build() {
            return new ScheduleExecution(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScheduleExecution that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ScheduleExecution{id='" + id + "', jobId='" + jobId + "', status=" + status
                + ", scheduledFor=" + scheduledFor + ", manual=" + manual + "}";
    }
}
