package tickwork.scheduler.recurrence;

/**
 * One violated constraint found while validating a recurrence rule.
 *
 * @param field   the rule field at fault (e.g. "interval", "daysOfWeek")
 * @param message human readable description
 */
public record RuleIssue(String field, String message) {

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
