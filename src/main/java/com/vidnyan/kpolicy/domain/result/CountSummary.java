package com.vidnyan.kpolicy.domain.result;

/**
 * Pass/warning/danger tally. Failing checks count by severity, passing checks as successes.
 */
public record CountSummary(
    int successes,
    int warnings,
    int dangers
) {

    public static CountSummary empty() {
        return new CountSummary(0, 0, 0);
    }

    public CountSummary add(ResultRecord record) {
        if (record.success()) {
            return new CountSummary(successes + 1, warnings, dangers);
        }
        return switch (record.severity()) {
            case DANGER -> new CountSummary(successes, warnings, dangers + 1);
            case WARNING -> new CountSummary(successes, warnings + 1, dangers);
            case IGNORE -> this;
        };
    }

    public CountSummary plus(CountSummary other) {
        return new CountSummary(successes + other.successes, warnings + other.warnings, dangers + other.dangers);
    }

    /**
     * Percentage of passing checks, 0 when nothing ran.
     */
    public int score() {
        int total = successes + warnings + dangers;
        return total == 0 ? 0 : (int) Math.round(100.0 * successes / total);
    }
}
