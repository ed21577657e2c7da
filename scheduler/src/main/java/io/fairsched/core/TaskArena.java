package io.fairsched.core;

import java.util.Optional;

/**
 * Fixed-capacity store for task control blocks. Slots are handed out from a free-index stack;
 * a task's {@link Task#slot()} is its handle. Exhaustion is an ordinary outcome (empty result),
 * releasing a slot twice or releasing a live task is a programmer error.
 */
public class TaskArena {
    private final Task[] slots;
    private final int[] free;
    private int freeTop;

    public TaskArena(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("arena capacity must be positive");
        this.slots = new Task[capacity];
        this.free = new int[capacity];
        for (int i = 0; i < capacity; i++) {
            free[i] = capacity - 1 - i;
        }
        this.freeTop = capacity;
    }

    public interface TaskFactory {
        Task create(int slot);
    }

    /** Reserves a slot and stores the task built for it, or returns empty when the arena is full. */
    public synchronized Optional<Task> allocate(TaskFactory factory) {
        if (freeTop == 0) return Optional.empty();
        int slot = free[--freeTop];
        Task task = factory.create(slot);
        if (task.slot() != slot) {
            free[freeTop++] = slot;
            throw new IllegalStateException("factory built task for slot " + task.slot() + ", expected " + slot);
        }
        slots[slot] = task;
        return Optional.of(task);
    }

    public synchronized void release(Task task) {
        if (!task.state().isTerminal()) {
            throw new IllegalStateException("releasing live task " + task);
        }
        int slot = task.slot();
        if (slot < 0 || slot >= slots.length || slots[slot] != task) {
            throw new IllegalStateException("slot " + slot + " does not hold task " + task.id() + " (double release?)");
        }
        slots[slot] = null;
        free[freeTop++] = slot;
    }

    public synchronized Task get(int slot) {
        return slots[slot];
    }

    public synchronized int inUse() { return slots.length - freeTop; }

    public int capacity() { return slots.length; }
}
