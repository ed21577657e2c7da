package io.fairsched.core;

import java.util.EnumSet;
import java.util.Set;

/**
 * Task lifecycle: {@code NEW -> ADMITTED|REJECTED}, then
 * {@code QUEUED -> RUNNING -> (BLOCKED -> QUEUED)* -> COMPLETED|FAILED}.
 */
public enum TaskState {
    NEW,
    ADMITTED,
    REJECTED,
    QUEUED,
    RUNNING,
    BLOCKED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == REJECTED || this == COMPLETED || this == FAILED;
    }

    public boolean canMoveTo(TaskState next) {
        return successors().contains(next);
    }

    private Set<TaskState> successors() {
        return switch (this) {
            case NEW -> EnumSet.of(ADMITTED, REJECTED);
            // an admitted task can still bounce off the queue's hard capacity
            case ADMITTED -> EnumSet.of(QUEUED, REJECTED);
            case QUEUED -> EnumSet.of(RUNNING);
            // RUNNING -> QUEUED covers a sliced task that still has cost left
            case RUNNING -> EnumSet.of(BLOCKED, QUEUED, COMPLETED, FAILED);
            case BLOCKED -> EnumSet.of(QUEUED);
            case REJECTED, COMPLETED, FAILED -> EnumSet.noneOf(TaskState.class);
        };
    }
}
