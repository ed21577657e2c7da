package io.fairsched.resource;

import io.fairsched.core.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed pool of exclusive resources with priority inheritance.
 *
 * <p>Acquisition never blocks: a busy resource records the caller's priority as a contention
 * signal and reports failure, the caller requeues. The owner of a resource learns through
 * {@link #checkInheritance(long)} that a more urgent task is waiting and boosts itself.
 *
 * <p>Resource ids run from {@code 1} to {@code size}; id {@code 0} means "no resource".
 */
public class ResourceManager {
    private static final Logger LOG = LoggerFactory.getLogger(ResourceManager.class);

    public static final int NO_RESOURCE = 0;

    private final Resource[] resources;
    private final AtomicLong acquisitions = new AtomicLong();
    private final AtomicLong releases = new AtomicLong();
    private final AtomicLong contentions = new AtomicLong();

    public ResourceManager(int size) {
        if (size < 0) throw new IllegalArgumentException("negative resource pool size");
        this.resources = new Resource[size];
        for (int i = 0; i < size; i++) {
            resources[i] = new Resource(i + 1);
        }
    }

    public int size() { return resources.length; }

    public boolean isValid(int resourceId) {
        return resourceId == NO_RESOURCE || (resourceId > 0 && resourceId <= resources.length);
    }

    /**
     * Claims {@code resourceId} for {@code taskId}. On a busy resource, records {@code priority} as a
     * waiter and returns false. {@link #NO_RESOURCE} always succeeds.
     */
    public boolean tryAcquire(int resourceId, long taskId, int priority) {
        if (resourceId == NO_RESOURCE) return true;
        Resource res = resource(resourceId);
        synchronized (res) {
            if (res.owner == 0L) {
                res.owner = taskId;
                acquisitions.incrementAndGet();
                return true;
            }
            if (res.owner == taskId) {
                throw new IllegalStateException("task " + taskId + " already owns resource " + resourceId);
            }
            if (Priority.isMoreUrgent(priority, res.highestWaiterPriority)) {
                res.highestWaiterPriority = priority;
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Resource {} contended: task {} (prio {}) waits on owner {}", resourceId, taskId, priority, res.owner);
                }
            }
            contentions.incrementAndGet();
            return false;
        }
    }

    /** Frees the resource and clears its waiter signal. Exactly once per successful acquisition. */
    public void release(int resourceId) {
        if (resourceId == NO_RESOURCE) return;
        Resource res = resource(resourceId);
        synchronized (res) {
            if (res.owner == 0L) {
                throw new IllegalStateException("resource " + resourceId + " released while free");
            }
            res.owner = 0L;
            res.highestWaiterPriority = Priority.NONE;
            releases.incrementAndGet();
        }
    }

    /**
     * Most urgent priority waiting on any resource held by {@code taskId}, if one is recorded.
     */
    public OptionalInt checkInheritance(long taskId) {
        int best = Priority.NONE;
        for (Resource res : resources) {
            synchronized (res) {
                if (res.owner == taskId && res.highestWaiterPriority != Priority.NONE) {
                    best = Priority.mostUrgent(best, res.highestWaiterPriority);
                }
            }
        }
        return best == Priority.NONE ? OptionalInt.empty() : OptionalInt.of(best);
    }

    public long ownerOf(int resourceId) {
        Resource res = resource(resourceId);
        synchronized (res) { return res.owner; }
    }

    public int highestWaiterPriority(int resourceId) {
        Resource res = resource(resourceId);
        synchronized (res) { return res.highestWaiterPriority; }
    }

    public long acquisitions() { return acquisitions.get(); }
    public long releases() { return releases.get(); }
    public long contentions() { return contentions.get(); }

    private Resource resource(int resourceId) {
        if (resourceId <= 0 || resourceId > resources.length) {
            throw new IllegalArgumentException("unknown resource " + resourceId);
        }
        return resources[resourceId - 1];
    }

    private static final class Resource {
        final int id;
        long owner;
        int highestWaiterPriority = Priority.NONE;

        Resource(int id) { this.id = id; }

        @Override
        public String toString() { return "Resource{" + id + ", owner=" + owner + '}'; }
    }
}
