package tickwork.scheduler.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import tickwork.scheduler.model.MissedPolicy;
import tickwork.scheduler.model.Priority;

import java.util.Map;

/**
 * Partial update of a scheduled job. Null fields are left unchanged.
 */
public record ScheduleUpdate(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("job_config") Map<String, Object> jobConfig,
        @JsonProperty("priority") Priority priority,
        @JsonProperty("max_runs") Integer maxRuns,
        @JsonProperty("missed_policy") MissedPolicy missedPolicy,
        @JsonProperty("recurrence") RecurrenceRequest recurrence,
        @JsonProperty("timezone") String timezone) {

    public static ScheduleUpdate none() {
        return new ScheduleUpdate(null, null, null, null, null, null, null, null);
    }

    public ScheduleUpdate withName(String name) {
        return new ScheduleUpdate(name, description, jobConfig, priority, maxRuns, missedPolicy, recurrence,
                timezone);
    }

    public ScheduleUpdate withPriority(Priority priority) {
        return new ScheduleUpdate(name, description, jobConfig, priority, maxRuns, missedPolicy, recurrence,
                timezone);
    }

    public ScheduleUpdate withMaxRuns(Integer maxRuns) {
        return new ScheduleUpdate(name, description, jobConfig, priority, maxRuns, missedPolicy, recurrence,
                timezone);
    }

    public ScheduleUpdate withRecurrence(RecurrenceRequest recurrence) {
        return new ScheduleUpdate(name, description, jobConfig, priority, maxRuns, missedPolicy, recurrence,
                timezone);
    }

    public ScheduleUpdate withTimezone(String timezone) {
        return new ScheduleUpdate(name, description, jobConfig, priority, maxRuns, missedPolicy, recurrence,
                timezone);
    }

    /** Whether the update touches when the job runs */
    boolean changesTiming() {
        return recurrence != null || timezone != null;
    }
}
