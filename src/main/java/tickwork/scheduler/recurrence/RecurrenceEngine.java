package tickwork.scheduler.recurrence;

import tickwork.scheduler.model.RecurrenceRule;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes occurrences of recurrence rules.
 *
 * Pure and stateless: no clock, no storage. All calendar arithmetic happens in
 * a fixed UTC offset, so local date-times map one to one onto instants.
 *
 * Interval alignment is counted from the rule's start date, or from
 * 1970-01-01 when the rule has none. The occurrence count cap is counted from
 * the start of the start date. A rule without a start date counts from the
 * first occurrence computed after the query instant.
 */
public final class RecurrenceEngine {

    /** Alignment origin for rules without a start date */
    static final LocalDate EPOCH_ANCHOR = LocalDate.of(1970, 1, 1);

    private static final Pattern TIME_PATTERN = Pattern.compile("^(\\d{1,2}):(\\d{2})$");

    /** Aligned months inspected before a monthly rule is declared unsatisfiable */
    private static final int MONTHLY_SEARCH_LIMIT = 60;

    /** Aligned years inspected before a yearly rule is declared unsatisfiable */
    private static final int YEARLY_SEARCH_LIMIT = 8;

    /** Upper bound on forward steps when looking for the latest missed occurrence */
    private static final int LATEST_SEARCH_LIMIT = 10_000;

    public Optional<Instant> nextOccurrence(RecurrenceRule rule, Instant after) {
        return nextOccurrence(rule, after, ZoneOffset.UTC);
    }

    /**
     * Earliest instant strictly after {@code after} that satisfies the rule.
     *
     * @return empty when the rule's end date or occurrence count is exhausted,
     *         or when no occurrence exists within the bounded search window
     * @throws IllegalArgumentException if the rule's time of day is malformed
     */
    public Optional<Instant> nextOccurrence(RecurrenceRule rule, Instant after, ZoneOffset zone) {
        Objects.requireNonNull(rule, "rule is required");
        Objects.requireNonNull(after, "after is required");
        Objects.requireNonNull(rule.frequency(), "rule frequency is required");
        LocalTime time = parseTimeOfDay(rule.timeOfDay());

        LocalDateTime cursor = LocalDateTime.ofInstant(after, zone);
        while (true) {
            Optional<LocalDateTime> candidate = rawNext(rule, time, cursor);
            if (candidate.isEmpty()) {
                return Optional.empty();
            }
            LocalDateTime next = candidate.get();
            if (rule.endDate() != null && next.toLocalDate().isAfter(rule.endDate())) {
                return Optional.empty();
            }
            if (rule.exceptions().contains(next.toLocalDate())) {
                cursor = next;
                continue;
            }
            if (rule.count() != null && !withinCount(rule, time, next)) {
                return Optional.empty();
            }
            return Optional.of(next.toInstant(zone));
        }
    }

    public List<Instant> nextNOccurrences(RecurrenceRule rule, int n, Instant after) {
        return nextNOccurrences(rule, n, after, ZoneOffset.UTC);
    }

    /**
     * Up to {@code n} consecutive occurrences after {@code after}. Stops early
     * when the rule runs out.
     */
    public List<Instant> nextNOccurrences(RecurrenceRule rule, int n, Instant after, ZoneOffset zone) {
        List<Instant> occurrences = new ArrayList<>();
        Instant current = after;
        int limit = unanchoredCount(rule) != null ? Math.min(n, unanchoredCount(rule)) : n;
        for (int i = 0; i < limit; i++) {
            Optional<Instant> next = nextOccurrence(rule, current, zone);
            if (next.isEmpty()) {
                break;
            }
            occurrences.add(next.get());
            current = next.get();
        }
        return occurrences;
    }

    /**
     * Walks forward from {@code from} (itself an occurrence) and returns the last
     * occurrence not after {@code now}. Returns {@code from} when nothing later
     * qualifies.
     */
    public Instant latestOccurrenceAtOrBefore(RecurrenceRule rule, Instant from, Instant now, ZoneOffset zone) {
        Instant latest = from;
        // from is the first counted occurrence of an unanchored rule
        int steps = unanchoredCount(rule) != null ? unanchoredCount(rule) - 1 : LATEST_SEARCH_LIMIT;
        for (int i = 0; i < steps; i++) {
            Optional<Instant> next = nextOccurrence(rule, latest, zone);
            if (next.isEmpty() || next.get().isAfter(now)) {
                break;
            }
            latest = next.get();
        }
        return latest;
    }

    /**
     * Pin an absent start date to the date of the rule's first occurrence after
     * {@code now}, so a count cap starts with the first run instead of with
     * slots that already passed. A rule with a start date is returned as is.
     * When the rule has no future occurrence it is pinned to the date of
     * {@code now}.
     */
    public RecurrenceRule pinStartDate(RecurrenceRule rule, Instant now, ZoneOffset zone) {
        if (rule.startDate() != null) {
            return rule;
        }
        LocalDate today = LocalDate.ofInstant(now, zone);
        RecurrenceRule uncapped = rule.toBuilder().startDate(today).count(null).build();
        return nextOccurrence(uncapped, now, zone)
                .map(first -> rule.withStartDate(LocalDate.ofInstant(first, zone)))
                .orElseGet(() -> rule.withStartDate(today));
    }

    /**
     * Structural validation. Never repairs the rule.
     *
     * @return every violated constraint, empty if the rule is valid
     */
    public List<RuleIssue> validate(RecurrenceRule rule) {
        List<RuleIssue> issues = new ArrayList<>();
        if (rule == null) {
            issues.add(new RuleIssue("rule", "Recurrence rule is required"));
            return issues;
        }

        if (rule.frequency() == null) {
            issues.add(new RuleIssue("frequency", "Frequency is required"));
        }

        if (rule.interval() < 1) {
            issues.add(new RuleIssue("interval", "Interval must be positive"));
        }

        for (Integer day : rule.daysOfWeek()) {
            if (day < 1 || day > 7) {
                issues.add(new RuleIssue("daysOfWeek", "Invalid day of week: " + day));
            }
        }

        for (Integer day : rule.daysOfMonth()) {
            if (day < 1 || day > 31) {
                issues.add(new RuleIssue("daysOfMonth", "Invalid day of month: " + day));
            }
        }

        if (rule.startDate() != null && rule.endDate() != null && rule.startDate().isAfter(rule.endDate())) {
            issues.add(new RuleIssue("startDate", "Start date must be before end date"));
        }

        if (rule.count() != null && rule.count() < 1) {
            issues.add(new RuleIssue("count", "Count must be positive"));
        }

        Matcher m = rule.timeOfDay() != null ? TIME_PATTERN.matcher(rule.timeOfDay().trim()) : null;
        if (m == null || !m.matches()) {
            issues.add(new RuleIssue("timeOfDay", "Invalid time format (use HH:MM)"));
        } else {
            int hour = Integer.parseInt(m.group(1));
            int minute = Integer.parseInt(m.group(2));
            if (hour > 23 || minute > 59) {
                issues.add(new RuleIssue("timeOfDay", "Invalid time of day"));
            }
        }

        return issues;
    }

    static LocalTime parseTimeOfDay(String value) {
        if (value == null) {
            throw new IllegalArgumentException("time of day is required");
        }
        Matcher m = TIME_PATTERN.matcher(value.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("invalid time of day: " + value);
        }
        int hour = Integer.parseInt(m.group(1));
        int minute = Integer.parseInt(m.group(2));
        if (hour > 23 || minute > 59) {
            throw new IllegalArgumentException("invalid time of day: " + value);
        }
        return LocalTime.of(hour, minute);
    }

    // --- Frequency handling ---

    /**
     * Earliest local date-time after {@code after} matching frequency, interval
     * and start date. End date, exceptions and count are applied by the caller.
     */
    private Optional<LocalDateTime> rawNext(RecurrenceRule rule, LocalTime time, LocalDateTime after) {
        int interval = Math.max(1, rule.interval());
        LocalDate anchor = rule.startDate() != null ? rule.startDate() : EPOCH_ANCHOR;

        LocalDateTime from = after;
        if (rule.startDate() != null) {
            LocalDateTime floor = rule.startDate().atStartOfDay().minusNanos(1);
            if (from.isBefore(floor)) {
                from = floor;
            }
        }

        return switch (rule.frequency()) {
            case MINUTELY -> Optional.of(nextFixedPeriod(anchor.atStartOfDay(), Duration.ofMinutes(interval), from));
            case HOURLY -> Optional.of(nextFixedPeriod(anchor.atTime(0, time.getMinute()),
                    Duration.ofHours(interval), from));
            case DAILY -> Optional.of(nextDaily(anchor, interval, time, from));
            case WEEKLY -> nextWeekly(rule, anchor, interval, time, from);
            case MONTHLY -> nextMonthly(rule, anchor, interval, time, from);
            case YEARLY -> nextYearly(anchor, interval, time, from);
        };
    }

    private LocalDateTime nextFixedPeriod(LocalDateTime anchor, Duration period, LocalDateTime from) {
        if (from.isBefore(anchor)) {
            return anchor;
        }
        long elapsed = Duration.between(anchor, from).getSeconds();
        long steps = elapsed / period.getSeconds() + 1;
        return anchor.plusSeconds(steps * period.getSeconds());
    }

    private LocalDateTime nextDaily(LocalDate anchor, int interval, LocalTime time, LocalDateTime from) {
        LocalDate day = from.toLocalDate();
        if (!day.atTime(time).isAfter(from)) {
            day = day.plusDays(1);
        }
        long remainder = Math.floorMod(ChronoUnit.DAYS.between(anchor, day), interval);
        if (remainder != 0) {
            day = day.plusDays(interval - remainder);
        }
        return day.atTime(time);
    }

    private Optional<LocalDateTime> nextWeekly(RecurrenceRule rule, LocalDate anchor, int interval, LocalTime time,
            LocalDateTime from) {
        Set<Integer> days = rule.daysOfWeek().isEmpty() ? Set.of(DayOfWeek.MONDAY.getValue())
                : Set.copyOf(rule.daysOfWeek());
        LocalDate anchorWeek = anchor.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));

        // two weeks for interval 1; wide enough to reach the next aligned week otherwise
        int window = 7 * (interval + 1);
        LocalDate day = from.toLocalDate();
        for (int i = 0; i < window; i++, day = day.plusDays(1)) {
            if (!days.contains(day.getDayOfWeek().getValue())) {
                continue;
            }
            LocalDate week = day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            if (Math.floorMod(ChronoUnit.WEEKS.between(anchorWeek, week), interval) != 0) {
                continue;
            }
            LocalDateTime candidate = day.atTime(time);
            if (candidate.isAfter(from)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private Optional<LocalDateTime> nextMonthly(RecurrenceRule rule, LocalDate anchor, int interval, LocalTime time,
            LocalDateTime from) {
        TreeSet<Integer> days = rule.daysOfMonth().isEmpty() ? new TreeSet<>(List.of(1))
                : new TreeSet<>(rule.daysOfMonth());
        YearMonth anchorMonth = YearMonth.from(anchor);

        YearMonth month = YearMonth.from(from);
        long remainder = Math.floorMod(ChronoUnit.MONTHS.between(anchorMonth, month), interval);
        if (remainder != 0) {
            month = month.plusMonths(interval - remainder);
        }

        for (int i = 0; i < MONTHLY_SEARCH_LIMIT; i++, month = month.plusMonths(interval)) {
            for (int day : days) {
                // a day the month does not have is skipped for that month
                if (day < 1 || day > month.lengthOfMonth()) {
                    continue;
                }
                LocalDateTime candidate = month.atDay(day).atTime(time);
                if (candidate.isAfter(from)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    private Optional<LocalDateTime> nextYearly(LocalDate anchor, int interval, LocalTime time, LocalDateTime from) {
        MonthDay monthDay = MonthDay.from(anchor);

        int year = from.getYear();
        int remainder = Math.floorMod(year - anchor.getYear(), interval);
        if (remainder != 0) {
            year += interval - remainder;
        }

        for (int i = 0; i < YEARLY_SEARCH_LIMIT; i++, year += interval) {
            if (!monthDay.isValidYear(year)) {
                continue;
            }
            LocalDateTime candidate = monthDay.atYear(year).atTime(time);
            if (candidate.isAfter(from)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static Integer unanchoredCount(RecurrenceRule rule) {
        return rule.startDate() == null ? rule.count() : null;
    }

    /**
     * Check whether {@code target} is within the first {@code count} effective
     * occurrences counted from the start of the start date.
     */
    private boolean withinCount(RecurrenceRule rule, LocalTime time, LocalDateTime target) {
        if (rule.startDate() == null) {
            // target is the first computed occurrence, count >= 1 admits it
            return rule.count() >= 1;
        }
        LocalDateTime cursor = rule.startDate().atStartOfDay().minusNanos(1);
        int seen = 0;
        while (seen < rule.count()) {
            Optional<LocalDateTime> next = rawNext(rule, time, cursor);
            if (next.isEmpty()) {
                return false;
            }
            cursor = next.get();
            if (rule.exceptions().contains(cursor.toLocalDate())) {
                continue;
            }
            seen++;
            if (!cursor.isBefore(target)) {
                return true;
            }
        }
        return false;
    }
}
