package io.fairsched.queue;

import io.fairsched.core.Task;

import java.util.ArrayDeque;

/**
 * Per-tenant scheduling state: weight, virtual runtime and one FIFO per priority level.
 * Guarded by the owning {@link HierarchicalFairQueue}'s lock.
 */
final class TenantQueue {
    final long id;
    long weight;
    long vruntime;
    long executedNanos;
    /** queued plus running tasks of this tenant */
    int inFlight;
    int queued;
    final ArrayDeque<Task>[] levels;

    @SuppressWarnings("unchecked")
    TenantQueue(long id, long weight, int levelCount) {
        this.id = id;
        this.weight = weight;
        this.levels = new ArrayDeque[levelCount];
        for (int i = 0; i < levelCount; i++) {
            levels[i] = new ArrayDeque<>();
        }
    }

    boolean isRunnable() { return queued > 0; }

    void charge(long costNanos, long referenceWeight) {
        vruntime += costNanos * referenceWeight / weight;
        executedNanos += costNanos;
    }
}
