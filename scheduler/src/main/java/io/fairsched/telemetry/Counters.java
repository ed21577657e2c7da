package io.fairsched.telemetry;

import io.fairsched.core.RejectionReason;

/** Names of the counters the scheduler reports. */
public final class Counters {
    public static final String TASKS_SUBMITTED = "tasks_submitted";
    public static final String TASKS_ADMITTED = "tasks_admitted";
    public static final String TASKS_COMPLETED = "tasks_completed";
    public static final String TASKS_FAILED = "tasks_failed";
    public static final String TASKS_REJECTED = "tasks_rejected";
    public static final String DEADLINE_MISSES = "deadline_misses";
    public static final String DEADLINE_MISSES_SOFT = "deadline_misses.soft";
    public static final String DEADLINE_MISSES_HARD = "deadline_misses.hard";
    public static final String PRIORITY_INHERITANCE_EVENTS = "priority_inheritance_events";
    public static final String RESOURCE_CONTENTION = "resource_contention";
    public static final String AGING_PROMOTIONS = "aging_promotions";
    public static final String MLFQ_DEMOTIONS = "mlfq_demotions";
    public static final String SOFT_BACKPRESSURE = "soft_backpressure";
    public static final String EXECUTOR_RETRIES = "executor_retries";

    private Counters() {}

    public static String rejected(RejectionReason reason) {
        return TASKS_REJECTED + "." + reason.metricName();
    }
}
