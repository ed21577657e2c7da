package io.fairsched.resource;

import io.fairsched.core.Priority;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ResourceManagerTest {

    @Test
    void holder_inherits_priority_of_blocked_waiter() {
        ResourceManager rm = new ResourceManager(4);
        long low = 10, high = 20;
        assertTrue(rm.tryAcquire(1, low, 6));
        assertFalse(rm.tryAcquire(1, high, Priority.REALTIME));
        assertEquals(Priority.REALTIME, rm.highestWaiterPriority(1));
        assertEquals(OptionalInt.of(Priority.REALTIME), rm.checkInheritance(low));
        assertTrue(rm.checkInheritance(high).isEmpty());

        rm.release(1);
        assertEquals(0L, rm.ownerOf(1));
        assertEquals(Priority.NONE, rm.highestWaiterPriority(1));
        assertTrue(rm.checkInheritance(low).isEmpty());
        assertTrue(rm.tryAcquire(1, high, Priority.REALTIME));
    }

    @Test
    void keeps_the_most_urgent_waiter() {
        ResourceManager rm = new ResourceManager(1);
        rm.tryAcquire(1, 1, 7);
        rm.tryAcquire(1, 2, 3);
        rm.tryAcquire(1, 3, 5);
        assertEquals(3, rm.highestWaiterPriority(1));
        assertEquals(2, rm.contentions());
    }

    @Test
    void no_resource_always_succeeds() {
        ResourceManager rm = new ResourceManager(1);
        assertTrue(rm.tryAcquire(ResourceManager.NO_RESOURCE, 1, 0));
        assertTrue(rm.tryAcquire(ResourceManager.NO_RESOURCE, 2, 0));
        rm.release(ResourceManager.NO_RESOURCE);
        assertEquals(0, rm.acquisitions());
    }

    @Test
    void misuse_fails_fast() {
        ResourceManager rm = new ResourceManager(2);
        assertThrows(IllegalStateException.class, () -> rm.release(1));
        assertThrows(IllegalArgumentException.class, () -> rm.tryAcquire(3, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> rm.tryAcquire(-1, 1, 0));
        rm.tryAcquire(2, 5, 0);
        assertThrows(IllegalStateException.class, () -> rm.tryAcquire(2, 5, 0));
        assertFalse(rm.isValid(3));
        assertTrue(rm.isValid(0));
    }

    @Test
    void at_most_one_holder_under_contention() throws Exception {
        ResourceManager rm = new ResourceManager(1);
        AtomicInteger holders = new AtomicInteger();
        AtomicInteger maxHolders = new AtomicInteger();
        int threads = 8;
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        for (int t = 0; t < threads; t++) {
            long taskId = t + 1;
            pool.submit(() -> {
                go.await();
                for (int i = 0; i < 2_000; i++) {
                    if (rm.tryAcquire(1, taskId, 2)) {
                        maxHolders.accumulateAndGet(holders.incrementAndGet(), Math::max);
                        holders.decrementAndGet();
                        rm.release(1);
                    }
                }
                return null;
            });
        }
        go.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        assertEquals(1, maxHolders.get());
        assertEquals(rm.acquisitions(), rm.releases());
        assertEquals(0L, rm.ownerOf(1));
    }
}
