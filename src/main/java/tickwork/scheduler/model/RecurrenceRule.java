package tickwork.scheduler.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable recurrence rule attached to a recurring job.
 * A rule may carry invalid values; RecurrenceEngine.validate reports them
 * instead of the constructor rejecting them.
 */
public final class RecurrenceRule {
    private final Frequency frequency;
    private final int interval;
    private final List<Integer> daysOfWeek; // 1-7, Monday = 1
    private final List<Integer> daysOfMonth; // 1-31
    private final String timeOfDay; // HH:MM
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final Integer count;
    private final Set<LocalDate> exceptions;

    private RecurrenceRule(Builder builder) {
        this.frequency = builder.frequency;
        this.interval = builder.interval;
        this.daysOfWeek = List.copyOf(builder.daysOfWeek);
        this.daysOfMonth = List.copyOf(builder.daysOfMonth);
        this.timeOfDay = builder.timeOfDay;
        this.startDate = builder.startDate;
        this.endDate = builder.endDate;
        this.count = builder.count;
        this.exceptions = Set.copyOf(builder.exceptions);
    }

    public Frequency frequency() {
        return frequency;
    }

    public int interval() {
        return interval;
    }

    public List<Integer> daysOfWeek() {
        return daysOfWeek;
    }

    public List<Integer> daysOfMonth() {
        return daysOfMonth;
    }

    public String timeOfDay() {
        return timeOfDay;
    }

    public LocalDate startDate() {
        return startDate;
    }

    public LocalDate endDate() {
        return endDate;
    }

    public Integer count() {
        return count;
    }

    public Set<LocalDate> exceptions() {
        return exceptions;
    }

    /** Copy with a different start date (rules are never mutated in place) */
    public RecurrenceRule withStartDate(LocalDate date) {
        return toBuilder().startDate(date).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .frequency(frequency)
                .interval(interval)
                .daysOfWeek(daysOfWeek)
                .daysOfMonth(daysOfMonth)
                .timeOfDay(timeOfDay)
                .startDate(startDate)
                .endDate(endDate)
                .count(count)
                .exceptions(exceptions);
    }

    public static Builder builder(Frequency frequency) {
        return new Builder().frequency(frequency);
    }

    public static final class Builder {
        private Frequency frequency;
        private int interval = 1;
        private List<Integer> daysOfWeek = List.of();
        private List<Integer> daysOfMonth = List.of();
        private String timeOfDay = "09:00";
        private LocalDate startDate;
        private LocalDate endDate;
        private Integer count;
        private Set<LocalDate> exceptions = Set.of();

        public Builder frequency(Frequency frequency) {
            this.frequency = frequency;
            return this;
        }

        public Builder interval(int interval) {
            this.interval = interval;
            return this;
        }

        public Builder daysOfWeek(List<Integer> daysOfWeek) {
            this.daysOfWeek = daysOfWeek != null ? daysOfWeek : List.of();
            return this;
        }

        public Builder daysOfWeek(Integer... daysOfWeek) {
            return daysOfWeek(List.of(daysOfWeek));
        }

        public Builder daysOfMonth(List<Integer> daysOfMonth) {
            this.daysOfMonth = daysOfMonth != null ? daysOfMonth : List.of();
            return this;
        }

        public Builder daysOfMonth(Integer... daysOfMonth) {
            return daysOfMonth(List.of(daysOfMonth));
        }

        public Builder timeOfDay(String timeOfDay) {
            this.timeOfDay = timeOfDay;
            return this;
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(LocalDate endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder count(Integer count) {
            this.count = count;
            return this;
        }

        public Builder exceptions(Set<LocalDate> exceptions) {
            this.exceptions = exceptions != null ? exceptions : Set.of();
            return this;
        }

        public RecurrenceRule build() {
            return new RecurrenceRule(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RecurrenceRule that))
            return false;
        return interval == that.interval
                && frequency == that.frequency
                && daysOfWeek.equals(that.daysOfWeek)
                && daysOfMonth.equals(that.daysOfMonth)
                && Objects.equals(timeOfDay, that.timeOfDay)
                && Objects.equals(startDate, that.startDate)
                && Objects.equals(endDate, that.endDate)
                && Objects.equals(count, that.count)
                && exceptions.equals(that.exceptions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(frequency, interval, daysOfWeek, daysOfMonth, timeOfDay, startDate, endDate, count,
                exceptions);
    }

    @Override
    public String toString() {
        return "RecurrenceRule{" + frequency + " every " + interval + " at " + timeOfDay + "}";
    }
}
