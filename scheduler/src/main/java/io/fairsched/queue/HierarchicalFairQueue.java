package io.fairsched.queue;

import io.fairsched.core.Priority;
import io.fairsched.core.Task;
import io.fairsched.core.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Two-level selection: weighted fairness across tenants by virtual runtime, then multi-level
 * priority with deficit round robin inside the chosen tenant.
 *
 * <ul>
 *   <li>Tenant: the runnable tenant with the lowest vruntime, ties to the lower id.</li>
 *   <li>Level: the most urgent non-empty level of that tenant.</li>
 *   <li>Task: the level's head gets the level quantum added to its deficit and runs if the deficit
 *       is then strictly positive, otherwise it goes to the tail. One pass per level per call.</li>
 * </ul>
 *
 * Aging ({@link #runAgingPass}) promotes tasks that waited past the starvation threshold by one level;
 * {@link #requeueAfterSlice} demotes a task whose deficit went negative before it finished.
 *
 * <p>A single lock covers the tenant map and every level queue, so selection is linearizable with
 * enqueue and requeue. Workers park on {@link #awaitNext} and are woken on every enqueue and on close.
 */
public class HierarchicalFairQueue {
    private static final Logger LOG = LoggerFactory.getLogger(HierarchicalFairQueue.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition workAvailable = lock.newCondition();
    private final TreeMap<Long, TenantQueue> tenants = new TreeMap<>();
    private final QuantumSchedule quanta;
    private final int levels;
    private final int hardCapacity;
    private final long referenceWeight;

    private final AtomicLong promotions = new AtomicLong();
    private final AtomicLong demotions = new AtomicLong();
    private volatile int size;
    private volatile int running;
    private boolean closed;

    public HierarchicalFairQueue(QuantumSchedule quanta, int hardCapacity, long referenceWeight) {
        if (hardCapacity <= 0) throw new IllegalArgumentException("hard capacity must be positive");
        if (referenceWeight <= 0) throw new IllegalArgumentException("reference weight must be positive");
        this.quanta = quanta;
        this.levels = quanta.levels();
        this.hardCapacity = hardCapacity;
        this.referenceWeight = referenceWeight;
    }

    /** Adds a tenant, or updates the weight of an existing one. Returns true if it was new. */
    public boolean registerTenant(long tenantId, long weight) {
        if (weight <= 0) throw new IllegalArgumentException("tenant weight must be positive, got " + weight);
        lock.lock();
        try {
            TenantQueue existing = tenants.get(tenantId);
            if (existing != null) {
                existing.weight = weight;
                return false;
            }
            tenants.put(tenantId, new TenantQueue(tenantId, weight, levels));
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasTenant(long tenantId) {
        lock.lock();
        try {
            return tenants.containsKey(tenantId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Queues a newly admitted task at the tail of its level. Returns false when the queue is at hard
     * capacity. A tenant with nothing in flight re-enters at the lowest vruntime among runnable tenants
     * so idle time cannot be banked.
     */
    public boolean enqueue(Task task) {
        lock.lock();
        try {
            if (closed || size >= hardCapacity) return false;
            TenantQueue tenant = tenant(task.tenantId());
            if (tenant.inFlight == 0) {
                long floor = minRunnableVruntime();
                if (floor != Long.MAX_VALUE && tenant.vruntime < floor) {
                    tenant.vruntime = floor;
                }
            }
            task.transitionTo(TaskState.QUEUED);
            tenant.levels[task.currentPriority()].addLast(task);
            tenant.queued++;
            tenant.inFlight++;
            size++;
            workAvailable.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puts a task that lost a resource race back at the head of its level, withdrawing the quantum its
     * selection granted. Not capacity-checked: the task is already admitted.
     */
    public void requeueBlocked(Task task) {
        lock.lock();
        try {
            TenantQueue tenant = tenant(task.tenantId());
            task.withdrawGrant();
            task.transitionTo(TaskState.QUEUED);
            tenant.levels[task.currentPriority()].addFirst(task);
            requeued(tenant);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Requeues a task that ran a slice and still has cost left. A negative deficit demotes it one level.
     * Returns true if it was demoted.
     */
    public boolean requeueAfterSlice(Task task) {
        lock.lock();
        try {
            TenantQueue tenant = tenant(task.tenantId());
            boolean demoted = false;
            int lowest = levels - 1;
            if (task.deficit() < 0 && task.currentPriority() < lowest) {
                int from = task.currentPriority();
                task.moveToLevel(Priority.demote(from, lowest));
                demotions.incrementAndGet();
                demoted = true;
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Demoted task {} from level {} to {}", task.id(), from, task.currentPriority());
                }
            }
            task.transitionTo(TaskState.QUEUED);
            tenant.levels[task.currentPriority()].addLast(task);
            requeued(tenant);
            return demoted;
        } finally {
            lock.unlock();
        }
    }

    /** Non-blocking selection. Empty when nothing is queued or no head earned a positive deficit. */
    public Optional<Task> selectNext(long nowNanos) {
        lock.lock();
        try {
            return Optional.ofNullable(selectLocked(nowNanos));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for queued work, then selects. Empty on timeout, on a DRR pass that
     * found nothing runnable, or once closed.
     */
    public Optional<Task> awaitNext(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lock();
        try {
            while (!closed && size == 0) {
                if (remaining <= 0L) return Optional.empty();
                remaining = workAvailable.awaitNanos(remaining);
            }
            if (closed) return Optional.empty();
            return Optional.ofNullable(selectLocked(System.nanoTime()));
        } finally {
            lock.unlock();
        }
    }

    /** Charges a run of {@code costNanos}: tenant vruntime by weight, task deficit one for one. */
    public void charge(Task task, long costNanos) {
        lock.lock();
        try {
            tenant(task.tenantId()).charge(costNanos, referenceWeight);
            task.charge(costNanos);
        } finally {
            lock.unlock();
        }
    }

    /** Marks a finished (completed or failed) task as gone from its tenant. */
    public void retire(Task task) {
        lock.lock();
        try {
            TenantQueue tenant = tenant(task.tenantId());
            if (tenant.inFlight <= 0) throw new IllegalStateException("tenant " + tenant.id + " has nothing in flight");
            tenant.inFlight--;
            running--;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves every task on levels 1..n-1 that has not been scheduled for longer than the threshold one
     * level up, with its deficit reset. Levels are visited from urgent to background so a task is
     * promoted at most once per pass. Returns the number of promotions.
     */
    public int runAgingPass(long nowNanos, long starvationThresholdNanos) {
        int promoted = 0;
        lock.lock();
        try {
            for (TenantQueue tenant : tenants.values()) {
                if (!tenant.isRunnable()) continue;
                for (int p = 1; p < levels; p++) {
                    ArrayDeque<Task> level = tenant.levels[p];
                    if (level.isEmpty()) continue;
                    Iterator<Task> it = level.iterator();
                    while (it.hasNext()) {
                        Task task = it.next();
                        if (nowNanos - task.lastScheduledNanos() > starvationThresholdNanos) {
                            it.remove();
                            task.moveToLevel(Priority.promote(p));
                            tenant.levels[p - 1].addLast(task);
                            promoted++;
                            if (LOG.isDebugEnabled()) {
                                LOG.debug("Aging promoted task {} of tenant {} to level {}", task.id(), tenant.id, p - 1);
                            }
                        }
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        promotions.addAndGet(promoted);
        return promoted;
    }

    /** Stops handing out work and wakes every waiting worker. Queued tasks stay queued. */
    public void close() {
        lock.lock();
        try {
            closed = true;
            workAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /** Queued tasks (running tasks excluded). */
    public int size() { return size; }

    /** Tasks currently handed out to workers. */
    public int running() { return running; }

    public int hardCapacity() { return hardCapacity; }
    public int levels() { return levels; }
    public long promotions() { return promotions.get(); }
    public long demotions() { return demotions.get(); }
    public long quantumNanos(int level) { return quanta.quantumNanos(level); }

    public List<TenantStats> tenantStats() {
        lock.lock();
        try {
            List<TenantStats> out = new ArrayList<>(tenants.size());
            for (TenantQueue t : tenants.values()) {
                out.add(new TenantStats(t.id, t.weight, t.vruntime, t.executedNanos, t.queued, t.inFlight));
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    public Optional<TenantStats> tenantStats(long tenantId) {
        return tenantStats().stream().filter(s -> s.id() == tenantId).findFirst();
    }

    /** Copy of one level's queue in FIFO order. */
    public List<Task> queuedAt(long tenantId, int level) {
        lock.lock();
        try {
            return new ArrayList<>(tenant(tenantId).levels[level]);
        } finally {
            lock.unlock();
        }
    }

    private Task selectLocked(long nowNanos) {
        TenantQueue best = null;
        for (TenantQueue t : tenants.values()) {
            if (t.isRunnable() && (best == null || t.vruntime < best.vruntime)) {
                best = t;
            }
        }
        if (best == null) return null;
        for (int p = 0; p < levels; p++) {
            ArrayDeque<Task> level = best.levels[p];
            int checks = level.size();
            while (checks-- > 0) {
                Task head = level.pollFirst();
                head.grant(quanta.quantumNanos(p));
                if (head.deficit() > 0) {
                    best.queued--;
                    size--;
                    running++;
                    head.transitionTo(TaskState.RUNNING);
                    head.markScheduled(nowNanos);
                    return head;
                }
                level.addLast(head);
            }
        }
        return null;
    }

    private void requeued(TenantQueue tenant) {
        tenant.queued++;
        size++;
        running--;
        workAvailable.signal();
    }

    private long minRunnableVruntime() {
        long min = Long.MAX_VALUE;
        for (TenantQueue t : tenants.values()) {
            if (t.isRunnable() && t.vruntime < min) min = t.vruntime;
        }
        return min;
    }

    private TenantQueue tenant(long tenantId) {
        TenantQueue t = tenants.get(tenantId);
        if (t == null) throw new IllegalArgumentException("unknown tenant " + tenantId);
        return t;
    }
}
