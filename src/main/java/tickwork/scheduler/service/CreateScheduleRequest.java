package tickwork.scheduler.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import tickwork.scheduler.model.MissedPolicy;
import tickwork.scheduler.model.Priority;
import tickwork.scheduler.model.RecurrenceRule;
import tickwork.scheduler.model.ScheduleType;

import java.time.Instant;
import java.util.Map;

/**
 * Request to create a scheduled job.
 * Null optional fields take their defaults: UTC, NORMAL priority, SKIP policy,
 * unlimited runs.
 */
public record CreateScheduleRequest(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("job_type") String jobType,
        @JsonProperty("job_config") Map<String, Object> jobConfig,
        @JsonProperty("schedule_type") ScheduleType scheduleType,
        @JsonProperty("scheduled_at") Instant scheduledAt,
        @JsonProperty("recurrence") RecurrenceRequest recurrence,
        @JsonProperty("timezone") String timezone,
        @JsonProperty("priority") Priority priority,
        @JsonProperty("max_runs") Integer maxRuns,
        @JsonProperty("missed_policy") MissedPolicy missedPolicy) {

    public static CreateScheduleRequest oneTime(String name, String jobType, Instant scheduledAt) {
        return new CreateScheduleRequest(name, null, jobType, null, ScheduleType.ONE_TIME, scheduledAt, null,
                null, null, null, null);
    }

    public static CreateScheduleRequest recurring(String name, String jobType, RecurrenceRule rule) {
        return new CreateScheduleRequest(name, null, jobType, null, ScheduleType.RECURRING, null,
                RecurrenceRequest.from(rule), null, null, null, null);
    }

    public CreateScheduleRequest withDescription(String description) {
        return new CreateScheduleRequest(name, description, jobType, jobConfig, scheduleType, scheduledAt,
                recurrence, timezone, priority, maxRuns, missedPolicy);
    }

    public CreateScheduleRequest withJobConfig(Map<String, Object> jobConfig) {
        return new CreateScheduleRequest(name, description, jobType, jobConfig, scheduleType, scheduledAt,
                recurrence, timezone, priority, maxRuns, missedPolicy);
    }

    public CreateScheduleRequest withTimezone(String timezone) {
        return new CreateScheduleRequest(name, description, jobType, jobConfig, scheduleType, scheduledAt,
                recurrence, timezone, priority, maxRuns, missedPolicy);
    }

    public CreateScheduleRequest withPriority(Priority priority) {
        return new CreateScheduleRequest(name, description, jobType, jobConfig, scheduleType, scheduledAt,
                recurrence, timezone, priority, maxRuns, missedPolicy);
    }

    public CreateScheduleRequest withMaxRuns(Integer maxRuns) {
        return new CreateScheduleRequest(name, description, jobType, jobConfig, scheduleType, scheduledAt,
                recurrence, timezone, priority, maxRuns, missedPolicy);
    }

    public CreateScheduleRequest withMissedPolicy(MissedPolicy missedPolicy) {
        return new CreateScheduleRequest(name, description, jobType, jobConfig, scheduleType, scheduledAt,
                recurrence, timezone, priority, maxRuns, missedPolicy);
    }

    /** The recurrence as a rule, or null for one-time requests */
    public RecurrenceRule recurrenceRule() {
        return recurrence != null ? recurrence.toRule() : null;
    }
}
