package io.fairsched.core;

/**
 * How a task left the scheduler. A deadline miss is a recorded SLO violation, the task
 * still ran to completion.
 */
public enum TaskOutcome {
    COMPLETED,
    DEADLINE_MISSED_SOFT,
    DEADLINE_MISSED_HARD,
    FAILED;

    public boolean isDeadlineMiss() {
        return this == DEADLINE_MISSED_SOFT || this == DEADLINE_MISSED_HARD;
    }

    public static TaskOutcome forCompletion(long finishNanos, long softDeadlineNanos, long hardDeadlineNanos) {
        if (finishNanos > hardDeadlineNanos) return DEADLINE_MISSED_HARD;
        if (finishNanos > softDeadlineNanos) return DEADLINE_MISSED_SOFT;
        return COMPLETED;
    }
}
