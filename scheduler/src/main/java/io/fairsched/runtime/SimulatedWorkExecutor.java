package io.fairsched.runtime;

import io.fairsched.core.WorkExecutor;

import java.util.concurrent.locks.LockSupport;

/**
 * Stands in for real work by occupying the worker for the requested cost. Parks for the bulk of the
 * duration and spins for the last {@code spinNanos} to keep short costs accurate.
 */
public class SimulatedWorkExecutor implements WorkExecutor {
    private final long spinNanos;

    public SimulatedWorkExecutor() {
        this(50_000);
    }

    public SimulatedWorkExecutor(long spinNanos) {
        this.spinNanos = Math.max(0, spinNanos);
    }

    @Override
    public long execute(long taskId, long costNanos) throws InterruptedException {
        long start = System.nanoTime();
        long end = start + costNanos;
        long left;
        while ((left = end - System.nanoTime()) > spinNanos) {
            LockSupport.parkNanos(left - spinNanos);
            if (Thread.interrupted()) throw new InterruptedException("interrupted while running task " + taskId);
        }
        while (end - System.nanoTime() > 0) {
            Thread.onSpinWait();
        }
        return System.nanoTime() - start;
    }
}
