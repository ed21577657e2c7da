package io.fairsched.queue;

/** Point-in-time view of one tenant. */
public record TenantStats(long id, long weight, long vruntime, long executedNanos, int queued, int inFlight) {}
