package io.fairsched.sim;

import io.fairsched.core.Priority;
import io.fairsched.core.SubmitResult;
import io.fairsched.runtime.Scheduler;

import java.time.Duration;
import java.util.SplittableRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.LockSupport;

/**
 * Seeded synthetic load: tenants 1/2/3 picked 50/30/20 percent, priorities skewed toward normal,
 * one task in twenty needing resource 1, cost 0.5 to 3 ms and a deadline of 2 to 10 times the cost.
 */
public class LoadGenerator {
    public static final long[] TENANTS = {1, 2, 3};
    public static final long[] WEIGHTS = {200, 100, 50};
    static final int CONTENDED_RESOURCE = 1;
    static final long MIN_COST_NANOS = 500_000;
    static final long MAX_COST_NANOS = 3_000_000;
    static final long BACKOFF_AFTER_REJECT_NANOS = 100_000;
    static final long PAUSE_AFTER_ACCEPT_NANOS = 50_000;

    /** One synthetic submission. */
    public record Request(long tenantId, int priority, long costNanos, long deadlineOffsetNanos, int resourceId) {}

    private final SplittableRandom random;
    private final int backgroundLevel;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicLong generated = new AtomicLong();
    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    public LoadGenerator(long seed, int priorityLevels) {
        this.random = new SplittableRandom(seed);
        this.backgroundLevel = priorityLevels - 1;
    }

    public static void registerTenants(Scheduler scheduler) {
        for (int i = 0; i < TENANTS.length; i++) {
            scheduler.registerTenant(TENANTS[i], WEIGHTS[i]);
        }
    }

    public Request next() {
        int r = random.nextInt(100);
        long tenant = r < 50 ? TENANTS[0] : (r < 80 ? TENANTS[1] : TENANTS[2]);

        int p = random.nextInt(100);
        int priority = Priority.NORMAL;
        if (p < 5) priority = Priority.REALTIME;
        else if (p < 20) priority = Priority.INTERACTIVE;
        else if (p > 80) priority = backgroundLevel;

        int resource = random.nextInt(100) < 5 ? CONTENDED_RESOURCE : 0;
        long cost = random.nextLong(MIN_COST_NANOS, MAX_COST_NANOS + 1);
        long deadline = cost * random.nextInt(2, 11);
        return new Request(tenant, priority, cost, deadline, resource);
    }

    /** Submits until {@code duration} has passed or {@link #stop()} is called. */
    public void run(Scheduler scheduler, Duration duration) {
        long end = System.nanoTime() + duration.toNanos();
        while (!stopped.get() && System.nanoTime() - end < 0) {
            Request req = next();
            generated.incrementAndGet();
            SubmitResult result = scheduler.submit(req.tenantId(), req.priority(),
                    Duration.ofNanos(req.costNanos()), Duration.ofNanos(req.deadlineOffsetNanos()), req.resourceId());
            if (result.isAccepted()) {
                accepted.incrementAndGet();
                LockSupport.parkNanos(PAUSE_AFTER_ACCEPT_NANOS);
            } else {
                rejected.incrementAndGet();
                LockSupport.parkNanos(BACKOFF_AFTER_REJECT_NANOS);
            }
            if (Thread.currentThread().isInterrupted()) return;
        }
    }

    public void stop() { stopped.set(true); }

    public long generated() { return generated.get(); }
    public long accepted() { return accepted.get(); }
    public long rejected() { return rejected.get(); }
}
