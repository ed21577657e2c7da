package io.fairsched.telemetry;

import io.fairsched.queue.TenantStats;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of a scheduler, assembled from lock-free counters and one pass over the tenant map.
 * Counters are read with relaxed ordering and may be mutually slightly inconsistent.
 */
public record SchedulerSnapshot(
        long timestampMillis,
        boolean running,
        int queued,
        int inExecution,
        double admittedRate,
        double tokens,
        double serviceEstimateNanos,
        Map<String, Long> counters,
        List<TenantStats> tenants,
        List<WorkerStats> workers
) {
    public long counter(String name) { return counters.getOrDefault(name, 0L); }
}
