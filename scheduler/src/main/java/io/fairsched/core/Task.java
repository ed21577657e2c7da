package io.fairsched.core;

/**
 * Task control block: immutable identity plus the mutable scheduling state of one unit of work.
 *
 * <p>A task is owned by exactly one queue or one worker at a time; ownership moves under the
 * queue lock, so the mutable fields need no synchronization of their own. Only {@link #state()}
 * is read from other threads (telemetry, tests) and is therefore volatile.
 *
 * <p>All times are {@link System#nanoTime()}-based nanoseconds. Priorities follow {@link Priority}.
 */
public final class Task {
    private final long id;
    private final int slot;
    private final long tenantId;
    private final int basePriority;
    private final long arrivalNanos;
    private final long softDeadlineNanos;
    private final long hardDeadlineNanos;
    private final long estimatedCostNanos;
    private final int requiredResource;

    private int currentPriority;
    private int boostedFrom = -1;
    private long lastScheduledNanos;
    private long remainingCostNanos;
    private long actualCostNanos;
    private long deficit;
    private long lastGrant;
    private long startNanos;
    private long finishNanos;
    private int blockedCount;
    private volatile TaskState state = TaskState.NEW;
    private volatile TaskOutcome outcome;

    public Task(long id,
                int slot,
                long tenantId,
                int priority,
                long arrivalNanos,
                long relativeDeadlineNanos,
                double hardDeadlineMultiplier,
                long estimatedCostNanos,
                int requiredResource) {
        if (hardDeadlineMultiplier <= 1.0) throw new IllegalArgumentException("hard deadline multiplier must be > 1");
        if (estimatedCostNanos < 0) throw new IllegalArgumentException("negative cost");
        this.id = id;
        this.slot = slot;
        this.tenantId = tenantId;
        this.basePriority = priority;
        this.currentPriority = priority;
        this.arrivalNanos = arrivalNanos;
        this.softDeadlineNanos = arrivalNanos + relativeDeadlineNanos;
        this.hardDeadlineNanos = arrivalNanos + (long) (relativeDeadlineNanos * hardDeadlineMultiplier);
        this.estimatedCostNanos = estimatedCostNanos;
        this.remainingCostNanos = estimatedCostNanos;
        this.requiredResource = Math.max(0, requiredResource);
        this.lastScheduledNanos = arrivalNanos;
    }

    public long id() { return id; }
    public int slot() { return slot; }
    public long tenantId() { return tenantId; }
    public int basePriority() { return basePriority; }
    public int currentPriority() { return currentPriority; }
    public long arrivalNanos() { return arrivalNanos; }
    public long softDeadlineNanos() { return softDeadlineNanos; }
    public long hardDeadlineNanos() { return hardDeadlineNanos; }
    public long estimatedCostNanos() { return estimatedCostNanos; }
    public long remainingCostNanos() { return remainingCostNanos; }
    public long actualCostNanos() { return actualCostNanos; }
    public int requiredResource() { return requiredResource; }
    public boolean needsResource() { return requiredResource != 0; }
    public long deficit() { return deficit; }
    public long lastScheduledNanos() { return lastScheduledNanos; }
    public long startNanos() { return startNanos; }
    public long finishNanos() { return finishNanos; }
    public int blockedCount() { return blockedCount; }
    public boolean isBoosted() { return boostedFrom >= 0; }
    public TaskState state() { return state; }
    public TaskOutcome outcome() { return outcome; }

    public boolean isExpired(long nowNanos) { return nowNanos > softDeadlineNanos; }

    /** Moves to {@code next}; an edge the lifecycle does not allow means scheduler state is corrupt. */
    public void transitionTo(TaskState next) {
        TaskState current = state;
        if (!current.canMoveTo(next)) {
            throw new IllegalStateException("task " + id + ": illegal transition " + current + " -> " + next);
        }
        state = next;
    }

    // --- DRR accounting, driven by the fair queue ---

    public void grant(long quantum) {
        deficit += quantum;
        lastGrant = quantum;
    }

    /** Takes back the quantum granted by the selection that just happened. */
    public void withdrawGrant() {
        deficit -= lastGrant;
        lastGrant = 0;
    }

    public void charge(long costNanos) {
        deficit -= costNanos;
        actualCostNanos += costNanos;
    }

    /** Marks {@code workNanos} of the estimated cost as done. */
    public void consume(long workNanos) {
        remainingCostNanos = Math.max(0, remainingCostNanos - workNanos);
    }

    public void moveToLevel(int level) {
        currentPriority = level;
        deficit = 0;
        lastGrant = 0;
    }

    // --- priority inheritance ---

    /** Raises the priority to {@code inherited} if that is more urgent. Returns true when boosted. */
    public boolean boostTo(int inherited) {
        if (!Priority.isMoreUrgent(inherited, currentPriority)) return false;
        if (boostedFrom < 0) boostedFrom = currentPriority;
        currentPriority = inherited;
        return true;
    }

    public void restoreAfterBoost() {
        if (boostedFrom >= 0) {
            currentPriority = boostedFrom;
            boostedFrom = -1;
        }
    }

    // --- execution bookkeeping ---

    public void markScheduled(long nowNanos) {
        lastScheduledNanos = nowNanos;
        if (startNanos == 0) startNanos = nowNanos;
    }

    public void markBlocked() { blockedCount++; }

    public void finish(long nowNanos, TaskOutcome taskOutcome) {
        finishNanos = nowNanos;
        outcome = taskOutcome;
    }

    public long latencyNanos() { return finishNanos - arrivalNanos; }

    @Override
    public String toString() {
        return "Task{" +
                "id=" + id +
                ", tenant=" + tenantId +
                ", prio=" + currentPriority + "/" + basePriority +
                ", state=" + state +
                ", remaining=" + remainingCostNanos +
                ", deficit=" + deficit +
                '}';
    }
}
