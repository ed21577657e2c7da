package io.fairsched.queue;

import io.fairsched.core.Task;
import io.fairsched.core.TaskState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class HierarchicalFairQueueTest {
    private static final long MS = 1_000_000L;

    private HierarchicalFairQueue queue;
    private long nextId;

    @BeforeEach
    void setUp() {
        // level quanta: 1ms, 1.5ms, 2.25ms, ... 17.09ms at level 7
        queue = new HierarchicalFairQueue(new QuantumSchedule(8, 1.0, 1.5), 1_000, 1024);
        nextId = 1;
    }

    private Task admitted(long tenant, int priority, long arrival) {
        Task t = new Task(nextId++, 0, tenant, priority, arrival, 10_000 * MS, 1.4, MS, 0);
        t.transitionTo(TaskState.ADMITTED);
        return t;
    }

    private Task enqueue(long tenant, int priority) {
        Task t = admitted(tenant, priority, 0);
        assertTrue(queue.enqueue(t));
        return t;
    }

    private void finish(Task t) {
        t.transitionTo(TaskState.COMPLETED);
        queue.retire(t);
    }

    @Test
    void serves_tenants_in_proportion_to_weight() {
        queue.registerTenant(1, 200);
        queue.registerTenant(2, 100);
        for (int i = 0; i < 200; i++) {
            enqueue(1, 2);
            enqueue(2, 2);
        }
        int a = 0, b = 0;
        for (int i = 0; i < 150; i++) {
            Task t = queue.selectNext(0).orElseThrow();
            queue.charge(t, MS);
            if (t.tenantId() == 1) a++; else b++;
            finish(t);
        }
        assertTrue(Math.abs(a - 100) <= 2, "tenant 1 ran " + a);
        assertTrue(Math.abs(b - 50) <= 2, "tenant 2 ran " + b);
        TenantStats s1 = queue.tenantStats(1).orElseThrow();
        TenantStats s2 = queue.tenantStats(2).orElseThrow();
        assertEquals(2.0, (double) s1.executedNanos() / s2.executedNanos(), 0.1);
        assertTrue(Math.abs(s1.vruntime() - s2.vruntime()) <= 10 * MS);
    }

    @Test
    void ties_between_tenants_go_to_lower_id() {
        queue.registerTenant(5, 100);
        queue.registerTenant(3, 100);
        enqueue(5, 2);
        enqueue(3, 2);
        assertEquals(3, queue.selectNext(0).orElseThrow().tenantId());
    }

    @Test
    void most_urgent_level_wins_inside_a_tenant() {
        queue.registerTenant(1, 100);
        Task background = enqueue(1, 6);
        Task urgent = enqueue(1, 0);
        assertSame(urgent, queue.selectNext(0).orElseThrow());
        assertSame(background, queue.selectNext(0).orElseThrow());
    }

    @Test
    void fifo_within_a_level() {
        queue.registerTenant(1, 100);
        Task first = enqueue(1, 2);
        Task second = enqueue(1, 2);
        Task third = enqueue(1, 2);
        assertSame(first, queue.selectNext(0).orElseThrow());
        assertSame(second, queue.selectNext(0).orElseThrow());
        assertSame(third, queue.selectNext(0).orElseThrow());
        assertTrue(queue.selectNext(0).isEmpty());
        assertEquals(3, queue.running());
        assertEquals(TaskState.RUNNING, first.state());
    }

    @Test
    void head_with_negative_deficit_is_skipped_until_it_earns_enough() {
        queue.registerTenant(1, 100);
        Task heavy = enqueue(1, 7);
        Task light = enqueue(1, 7);

        assertSame(heavy, queue.selectNext(0).orElseThrow());
        queue.charge(heavy, 50 * MS);
        assertFalse(queue.requeueAfterSlice(heavy), "lowest level cannot demote");
        assertTrue(heavy.deficit() < 0);

        assertSame(light, queue.selectNext(0).orElseThrow());
        finish(light);

        // 17.09ms granted against a 32.9ms debt: skipped, and one pass per call
        assertTrue(queue.selectNext(0).isEmpty());
        assertEquals(1, queue.size());
        assertSame(heavy, queue.selectNext(0).orElseThrow());
        assertTrue(heavy.deficit() > 0);
    }

    @Test
    void demotes_task_that_overran_its_quantum() {
        queue.registerTenant(1, 100);
        Task t = enqueue(1, 2);
        assertSame(t, queue.selectNext(0).orElseThrow());
        queue.charge(t, 5 * MS);
        assertTrue(queue.requeueAfterSlice(t));
        assertEquals(3, t.currentPriority());
        assertEquals(0, t.deficit());
        assertEquals(1, queue.demotions());
        assertEquals(List.of(t), queue.queuedAt(1, 3));
    }

    @Test
    void task_within_quantum_keeps_its_level() {
        queue.registerTenant(1, 100);
        Task t = enqueue(1, 2);
        queue.selectNext(0).orElseThrow();
        queue.charge(t, MS);
        assertFalse(queue.requeueAfterSlice(t));
        assertEquals(2, t.currentPriority());
    }

    @Test
    void aging_promotes_one_level_per_pass() {
        queue.registerTenant(1, 100);
        Task starving = enqueue(1, 7);
        long threshold = 100 * MS;

        assertEquals(0, queue.runAgingPass(50 * MS, threshold));
        assertEquals(7, starving.currentPriority());

        for (int expected = 6; expected >= 0; expected--) {
            long now = (200 + 100L * (6 - expected)) * MS;
            assertEquals(1, queue.runAgingPass(now, threshold));
            assertEquals(expected, starving.currentPriority());
            assertEquals(List.of(starving), queue.queuedAt(1, expected));
        }
        assertEquals(0, queue.runAgingPass(10_000 * MS, threshold));
        assertEquals(7, queue.promotions());
    }

    @Test
    void recently_scheduled_task_does_not_age() {
        queue.registerTenant(1, 100);
        Task t = enqueue(1, 5);
        queue.selectNext(500 * MS).orElseThrow();
        queue.requeueAfterSlice(t);
        assertEquals(0, queue.runAgingPass(550 * MS, 100 * MS));
        assertEquals(1, queue.runAgingPass(700 * MS, 100 * MS));
        assertEquals(4, t.currentPriority());
    }

    @Test
    void refuses_admission_past_hard_capacity() {
        HierarchicalFairQueue small = new HierarchicalFairQueue(new QuantumSchedule(8, 1.0, 1.5), 2, 1024);
        small.registerTenant(1, 100);
        assertTrue(small.enqueue(admitted(1, 2, 0)));
        assertTrue(small.enqueue(admitted(1, 2, 0)));
        Task third = admitted(1, 2, 0);
        assertFalse(small.enqueue(third));
        assertEquals(TaskState.ADMITTED, third.state());
        assertEquals(2, small.size());
    }

    @Test
    void blocked_task_returns_to_head_without_banking_its_quantum() {
        queue.registerTenant(1, 100);
        Task a = enqueue(1, 2);
        Task b = enqueue(1, 2);
        assertSame(a, queue.selectNext(0).orElseThrow());
        a.transitionTo(TaskState.BLOCKED);
        queue.requeueBlocked(a);
        assertEquals(0, a.deficit());
        assertEquals(List.of(a, b), queue.queuedAt(1, 2));
        assertEquals(0, queue.running());
        assertSame(a, queue.selectNext(0).orElseThrow());
    }

    @Test
    void returning_tenant_cannot_bank_idle_credit() {
        queue.registerTenant(1, 1024);
        queue.registerTenant(2, 1024);
        Task first = enqueue(1, 2);
        enqueue(1, 2);
        assertSame(first, queue.selectNext(0).orElseThrow());
        queue.charge(first, 10 * MS);
        finish(first);

        enqueue(2, 2);
        assertEquals(10 * MS, queue.tenantStats(2).orElseThrow().vruntime());
        assertEquals(10 * MS, queue.tenantStats(1).orElseThrow().vruntime());
    }

    @Test
    void reregistering_updates_weight_only() {
        assertTrue(queue.registerTenant(1, 100));
        Task t = enqueue(1, 2);
        queue.selectNext(0).orElseThrow();
        queue.charge(t, 10 * MS);
        assertFalse(queue.registerTenant(1, 300));
        TenantStats stats = queue.tenantStats(1).orElseThrow();
        assertEquals(300, stats.weight());
        assertEquals(10 * MS * 1024 / 100, stats.vruntime());
        assertThrows(IllegalArgumentException.class, () -> queue.registerTenant(2, 0));
    }

    @Test
    void unknown_tenant_and_spurious_retire_fail_fast() {
        assertThrows(IllegalArgumentException.class, () -> queue.enqueue(admitted(9, 2, 0)));
        queue.registerTenant(1, 100);
        Task t = admitted(1, 2, 0);
        assertThrows(IllegalStateException.class, () -> queue.retire(t));
    }

    @Test
    void waiting_worker_is_woken_by_enqueue_and_by_close() throws Exception {
        queue.registerTenant(1, 100);
        CompletableFuture<Optional<Task>> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.awaitNext(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(50);
        Task t = enqueue(1, 2);
        assertSame(t, waiter.get(5, TimeUnit.SECONDS).orElseThrow());

        CompletableFuture<Optional<Task>> idle = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.awaitNext(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(50);
        queue.close();
        assertTrue(idle.get(5, TimeUnit.SECONDS).isEmpty());
        assertFalse(queue.enqueue(admitted(1, 2, 0)));
    }

    @Test
    void await_times_out_when_nothing_arrives() throws Exception {
        long t0 = System.nanoTime();
        assertTrue(queue.awaitNext(20, TimeUnit.MILLISECONDS).isEmpty());
        assertTrue(System.nanoTime() - t0 >= 15 * MS);
    }
}
