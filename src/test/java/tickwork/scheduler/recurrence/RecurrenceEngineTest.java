package tickwork.scheduler.recurrence;

import tickwork.scheduler.model.Frequency;
import tickwork.scheduler.model.RecurrenceRule;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RecurrenceEngineTest {

    private final RecurrenceEngine engine = new RecurrenceEngine();

    @Test
    void dailyWithIntervalStepsByIntervalDays() {
        RecurrenceRule rule = RecurrenceRule.builder(Frequency.DAILY)
                .interval(3)
                .timeOfDay("09:00")
                .startDate(LocalDate.of(2024, 1, 1))
                .build();

        List<Instant> next = engine.nextNOccurrences(rule, 4, Instant.parse("2024-01-01T00:00:00Z"));

        assertEquals(4, next.size());
        assertEquals(Instant.parse("2024-01-01T09:00:00Z"), next.get(0));
        for (int i = 1; i < next.size(); i++) {
            assertEquals(Duration.ofDays(3), Duration.between(next.get(i - 1), next.get(i)));
        }
    }

    @Test
    void dailyAfterTodaysTimeMovesToTomorrow() {
        RecurrenceRule rule = RecurrenceRule.builder(Frequency.DAILY).timeOfDay("09:00").build();

        assertEquals(Optional.of(Instant.parse("2024-01-02T09:00:00Z")),
                engine.nextOccurrence(rule, Instant.parse("2024-01-01T09:00:00Z")));
        assertEquals(Optional.of(Instant.parse("2024-01-01T09:00:00Z")),
                engine.nextOccurrence(rule, Instant.parse("2024-01-01T08:00:00Z")));
    }

    @Test
    void weeklyOnMondayAndThursday() {
        RecurrenceRule rule = RecurrenceRule.builder(Frequency.WEEKLY)
                .daysOfWeek(1, 4)
                .timeOfDay("09:00")
                .build();

        // 2024-01-01 is a Monday, already past 09:00
        List<Instant> next = engine.nextNOccurrences(rule, 4, Instant.parse("2024-01-01T10:00:00Z"));

        assertEquals(List.of(
                Instant.parse("2024-01-04T09:00:00Z"),
                Instant.parse("2024-01-08T09:00:00Z"),
                Instant.parse("2024-01-11T09:00:00Z"),
                Instant.parse("2024-01-15T09:00:00Z")), next);
    }

    @Test
    void biweeklyAlignsToStartWeek() {
        RecurrenceRule rule = RecurrenceRule.builder(Frequency.WEEKLY)
                .interval(2)
                .daysOfWeek(1)
                .timeOfDay("09:00")
                .startDate(LocalDate.of(2024, 1, 1))
                .build();

        List<Instant> next = engine.nextNOccurrences(rule, 3, Instant.parse("2024-01-01T10:00:00Z"));

        assertEquals(List.of(
                Instant.parse("2024-01-15T09:00:00Z"),
                Instant.parse("2024-01-29T09:00:00Z"),
                Instant.parse("2024-02-12T09:00:00Z")), next);
    }

    @Test
    void monthlySkipsMonthsWithoutTheDay() {
        RecurrenceRule rule = RecurrenceRule.builder(Frequency.MONTHLY)
                .daysOfMonth(31)
                .timeOfDay("12:00")
                .build();

        List<Instant> next = engine.nextNOccurrences(rule, 3, Instant.parse("2024-01-31T12:00:00Z"));

        assertEquals(List.of(
                Instant.parse("2024-03-31T12:00:00Z"),
                Instant.parse("2024-05-31T12:00:00Z"),
                Instant.parse("2024-07-31T12:00:00Z")), next);
    }

    @Test
    void yearlyOnLeapDayWaitsForLeapYear() {
        RecurrenceRule rule = RecurrenceRule.builder(Frequency.YEARLY)
                .timeOfDay("08:00")
                .startDate(LocalDate.of(2024, 2, 29))
                .build();

        assertEquals(Optional.of(Instant.parse("2028-02-29T08:00:00Z")),
                engine.nextOccurrence(rule, Instant.parse("2024-03-01T00:00:00Z")));
    }

    @Test
    void hourlyUsesMinuteOfTimeOfDay() {
        RecurrenceRule rule = RecurrenceRule.builder(Frequency.HOURLY).timeOfDay("00:15").build();

        assertEquals(Optional.of(Instant.parse("2024-01-01T11:15:00Z")),
                engine.nextOccurrence(rule, Instant.parse("2024-01-01T10:20:00Z")));
    }

    @Test
    void exceptionDatesAreSkipped() {
        RecurrenceRule rule = RecurrenceRule.builder(Frequency.DAILY)
                .timeOfDay("09:00")
                .exceptions(Set.of(LocalDate.of(2024, 1, 2)))
                .build();

        assertEquals(Optional.of(Instant.parse("2024-01-03T09:00:00Z")),
                engine.nextOccurrence(rule, Instant.parse("2024-01-01T10:00:00Z")));
    }

    @Test
    void endDateExhaustsRule() {
        RecurrenceRule rule = RecurrenceRule.builder(Frequency.DAILY)
                .timeOfDay("09:00")
                .endDate(LocalDate.of(2024, 1, 2))
                .build();

        assertTrue(engine.nextOccurrence(rule, Instant.parse("2024-01-02T09:00:00Z")).isEmpty());
    }

    @Test
    void countCapsOccurrencesFromStartDate() {
        RecurrenceRule rule = RecurrenceRule.builder(Frequency.DAILY)
                .timeOfDay("09:00")
                .startDate(LocalDate.of(2024, 1, 1))
                .count(3)
                .build();

        List<Instant> all = engine.nextNOccurrences(rule, 10, Instant.parse("2023-12-01T00:00:00Z"));

        assertEquals(3, all.size());
        assertEquals(Instant.parse("2024-01-03T09:00:00Z"), all.get(2));
        assertTrue(engine.nextOccurrence(rule, all.get(2)).isEmpty());
    }

    @Test
    void countWithoutStartDateCountsFromFirstComputedOccurrence() {
        RecurrenceRule rule = RecurrenceRule.builder(Frequency.DAILY)
                .timeOfDay("09:00")
                .count(2)
                .build();

        List<Instant> all = engine.nextNOccurrences(rule, 5, Instant.parse("2024-01-01T10:00:00Z"));

        assertEquals(List.of(
                Instant.parse("2024-01-02T09:00:00Z"),
                Instant.parse("2024-01-03T09:00:00Z")), all);
    }

    @Test
    void pinStartDateUsesDayOfFirstOccurrence() {
        RecurrenceRule rule = RecurrenceRule.builder(Frequency.DAILY).timeOfDay("09:00").count(3).build();

        RecurrenceRule pinned = engine.pinStartDate(rule, Instant.parse("2024-01-01T10:00:00Z"), ZoneOffset.UTC);

        assertEquals(LocalDate.of(2024, 1, 2), pinned.startDate());
        assertEquals(Integer.valueOf(3), pinned.count());
        assertEquals(List.of(
                Instant.parse("2024-01-02T09:00:00Z"),
                Instant.parse("2024-01-03T09:00:00Z"),
                Instant.parse("2024-01-04T09:00:00Z")),
                engine.nextNOccurrences(pinned, 10, Instant.parse("2024-01-01T10:00:00Z")));

        RecurrenceRule dated = rule.withStartDate(LocalDate.of(2023, 6, 1));
        assertSame(dated, engine.pinStartDate(dated, Instant.parse("2024-01-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void fixedOffsetZoneShiftsWallClockTime() {
        RecurrenceRule rule = RecurrenceRule.builder(Frequency.DAILY).timeOfDay("09:00").build();

        // 09:00 at UTC-5 is 14:00Z
        assertEquals(Optional.of(Instant.parse("2024-01-01T14:00:00Z")),
                engine.nextOccurrence(rule, Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.ofHours(-5)));
    }

    @Test
    void latestOccurrenceWalksUpToNow() {
        RecurrenceRule rule = RecurrenceRule.builder(Frequency.DAILY).timeOfDay("09:00").build();

        Instant latest = engine.latestOccurrenceAtOrBefore(rule,
                Instant.parse("2024-01-01T09:00:00Z"), Instant.parse("2024-01-05T10:00:00Z"), ZoneOffset.UTC);

        assertEquals(Instant.parse("2024-01-05T09:00:00Z"), latest);
    }

    @Test
    void validateReportsEveryIssue() {
        RecurrenceRule rule = RecurrenceRule.builder(Frequency.WEEKLY)
                .interval(0)
                .daysOfWeek(8)
                .daysOfMonth(0)
                .timeOfDay("25:00")
                .startDate(LocalDate.of(2024, 2, 1))
                .endDate(LocalDate.of(2024, 1, 1))
                .count(0)
                .build();

        List<String> fields = engine.validate(rule).stream().map(RuleIssue::field).toList();

        assertEquals(List.of("interval", "daysOfWeek", "daysOfMonth", "startDate", "count", "timeOfDay"), fields);
    }

    @Test
    void validateRejectsMalformedTime() {
        RecurrenceRule rule = RecurrenceRule.builder(Frequency.DAILY).timeOfDay("9am").build();

        List<RuleIssue> issues = engine.validate(rule);

        assertEquals(1, issues.size());
        assertEquals("Invalid time format (use HH:MM)", issues.get(0).message());
        assertThrows(IllegalArgumentException.class,
                () -> engine.nextOccurrence(rule, Instant.parse("2024-01-01T00:00:00Z")));
    }

    @Test
    void validRuleHasNoIssues() {
        assertTrue(engine.validate(SchedulePatterns.named("weekdays_6pm").orElseThrow()).isEmpty());
        assertEquals(List.of(new RuleIssue("rule", "Recurrence rule is required")), engine.validate(null));
    }
}
