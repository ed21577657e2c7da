package io.fairsched.core;

/** Why a submission was turned away. Always returned to the caller, never thrown. */
public enum RejectionReason {
    QUEUE_FULL_HARD("queue-full-hard"),
    DEADLINE_INFEASIBLE("estimated-time-violation"),
    ALREADY_EXPIRED("expired-on-arrival"),
    RATE_LIMITED("rate-limited"),
    UNKNOWN_TENANT("unknown-tenant"),
    SHUTDOWN("shutdown");

    private final String metricName;

    RejectionReason(String metricName) { this.metricName = metricName; }

    public String metricName() { return metricName; }
}
