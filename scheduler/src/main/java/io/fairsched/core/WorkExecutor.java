package io.fairsched.core;

/**
 * Performs the actual work of a task. The scheduler only needs "run for cost C".
 */
@FunctionalInterface
public interface WorkExecutor {
    /**
     * Run {@code costNanos} worth of work for the task and return the cost actually consumed.
     * Exceptions are caught by the scheduler and turn the task into {@link TaskOutcome#FAILED}.
     */
    long execute(long taskId, long costNanos) throws Exception;
}
