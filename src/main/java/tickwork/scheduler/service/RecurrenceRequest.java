package tickwork.scheduler.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import tickwork.scheduler.model.Frequency;
import tickwork.scheduler.model.RecurrenceRule;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Wire form of a recurrence rule in schedule requests.
 * Absent fields take the rule defaults (interval 1, 09:00).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecurrenceRequest(
        @JsonProperty("frequency") Frequency frequency,
        @JsonProperty("interval") Integer interval,
        @JsonProperty("days_of_week") List<Integer> daysOfWeek,
        @JsonProperty("days_of_month") List<Integer> daysOfMonth,
        @JsonProperty("time_of_day") String timeOfDay,
        @JsonProperty("start_date") LocalDate startDate,
        @JsonProperty("end_date") LocalDate endDate,
        @JsonProperty("count") Integer count,
        @JsonProperty("exceptions") Set<LocalDate> exceptions) {

    public static RecurrenceRequest from(RecurrenceRule rule) {
        return new RecurrenceRequest(rule.frequency(), rule.interval(), rule.daysOfWeek(), rule.daysOfMonth(),
                rule.timeOfDay(), rule.startDate(), rule.endDate(), rule.count(), rule.exceptions());
    }

    public RecurrenceRule toRule() {
        RecurrenceRule.Builder builder = RecurrenceRule.builder(frequency)
                .daysOfWeek(daysOfWeek)
                .daysOfMonth(daysOfMonth)
                .startDate(startDate)
                .endDate(endDate)
                .count(count)
                .exceptions(exceptions);
        if (interval != null) {
            builder.interval(interval);
        }
        if (timeOfDay != null) {
            builder.timeOfDay(timeOfDay);
        }
        return builder.build();
    }
}
