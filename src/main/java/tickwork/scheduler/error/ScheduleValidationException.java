package tickwork.scheduler.error;

import tickwork.scheduler.recurrence.RuleIssue;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A job definition violates one or more constraints. Carries every issue
 * found, not just the first.
 */
public class ScheduleValidationException extends SchedulingException {

    private final List<RuleIssue> issues;

    public ScheduleValidationException(List<RuleIssue> issues) {
        super("Invalid schedule: " + issues.stream().map(RuleIssue::toString).collect(Collectors.joining("; ")));
        this.issues = List.copyOf(issues);
    }

    public ScheduleValidationException(String field, String message) {
        this(List.of(new RuleIssue(field, message)));
    }

    public List<RuleIssue> issues() {
        return issues;
    }
}
