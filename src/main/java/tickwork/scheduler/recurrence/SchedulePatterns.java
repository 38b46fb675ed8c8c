package tickwork.scheduler.recurrence;

import tickwork.scheduler.model.Frequency;
import tickwork.scheduler.model.RecurrenceRule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Named presets for common recurrence rules.
 */
public final class SchedulePatterns {

    private static final Map<String, RecurrenceRule> PATTERNS;

    static {
        Map<String, RecurrenceRule> patterns = new LinkedHashMap<>();
        patterns.put("daily_9am", RecurrenceRule.builder(Frequency.DAILY)
                .timeOfDay("09:00")
                .build());
        patterns.put("weekdays_6pm", RecurrenceRule.builder(Frequency.WEEKLY)
                .daysOfWeek(1, 2, 3, 4, 5)
                .timeOfDay("18:00")
                .build());
        patterns.put("weekly_monday", RecurrenceRule.builder(Frequency.WEEKLY)
                .daysOfWeek(1)
                .timeOfDay("10:00")
                .build());
        patterns.put("twice_weekly", RecurrenceRule.builder(Frequency.WEEKLY)
                .daysOfWeek(1, 4)
                .timeOfDay("09:00")
                .build());
        patterns.put("first_of_month", RecurrenceRule.builder(Frequency.MONTHLY)
                .daysOfMonth(1)
                .timeOfDay("12:00")
                .build());
        patterns.put("biweekly", RecurrenceRule.builder(Frequency.WEEKLY)
                .interval(2)
                .daysOfWeek(1)
                .timeOfDay("09:00")
                .build());
        PATTERNS = Collections.unmodifiableMap(patterns);
    }

    private SchedulePatterns() {
    }

    public static Optional<RecurrenceRule> named(String name) {
        return Optional.ofNullable(PATTERNS.get(name));
    }

    /** All presets in declaration order */
    public static Map<String, RecurrenceRule> all() {
        return PATTERNS;
    }
}
