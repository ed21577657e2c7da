package io.fairsched.admission;

import io.fairsched.core.Priority;
import io.fairsched.core.RejectionReason;
import io.fairsched.core.Task;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class AdmissionControllerTest {
    private static final long MS = 1_000_000L;
    private static final long TARGET = 100 * MS;

    private final AtomicInteger queueLength = new AtomicInteger();
    private long nextId = 1;

    private AdmissionController controller() {
        return new AdmissionController(100, 10, TARGET, 50, 10, 0.18, 1_200_000, 100, 75, queueLength::get, 0);
    }

    private Task task(long arrival, long deadlineOffset, long cost) {
        return new Task(nextId++, 0, 1, Priority.NORMAL, arrival, deadlineOffset, 1.4, cost, 0);
    }

    private static RejectionReason reason(AdmissionDecision d) {
        return assertInstanceOf(AdmissionDecision.Reject.class, d).reason();
    }

    @Test
    void rejects_task_that_cannot_meet_its_deadline() {
        AdmissionController ac = controller();
        queueLength.set(10);
        assertEquals(RejectionReason.DEADLINE_INFEASIBLE, reason(ac.decide(task(0, MS, 50 * MS), 0)));
    }

    @Test
    void queueing_delay_estimate_scales_with_queue_length() {
        AdmissionController ac = controller();
        // 1.2ms x 40 queued + 1ms cost = 49ms
        queueLength.set(40);
        assertTrue(ac.decide(task(0, 50 * MS, MS), 0).isAccepted());
        queueLength.set(45);
        assertEquals(RejectionReason.DEADLINE_INFEASIBLE, reason(ac.decide(task(0, 50 * MS, MS), 0)));
    }

    @Test
    void rejects_already_expired_before_anything_else() {
        AdmissionController ac = controller();
        queueLength.set(100);
        assertEquals(RejectionReason.ALREADY_EXPIRED, reason(ac.decide(task(0, -1, MS), 0)));
    }

    @Test
    void rejects_when_queue_is_at_hard_capacity() {
        AdmissionController ac = controller();
        queueLength.set(100);
        assertEquals(RejectionReason.QUEUE_FULL_HARD, reason(ac.decide(task(0, 1_000 * MS, MS), 0)));
    }

    @Test
    void flags_soft_backpressure_above_threshold() {
        AdmissionController ac = controller();
        assertEquals(75, ac.softThreshold());
        queueLength.set(74);
        AdmissionDecision below = ac.decide(task(0, 1_000 * MS, MS), 0);
        queueLength.set(75);
        AdmissionDecision at = ac.decide(task(0, 1_000 * MS, MS), 0);
        assertFalse(assertInstanceOf(AdmissionDecision.Accept.class, below).softBackpressure());
        assertTrue(assertInstanceOf(AdmissionDecision.Accept.class, at).softBackpressure());
    }

    @Test
    void rate_limits_once_credit_is_spent_and_refills_over_time() {
        AdmissionController ac = controller();
        for (int i = 0; i < 100; i++) {
            assertTrue(ac.decide(task(0, 1_000 * MS, MS), 0).isAccepted(), "accept #" + i);
        }
        assertEquals(RejectionReason.RATE_LIMITED, reason(ac.decide(task(0, 1_000 * MS, MS), 0)));
        // rate limiting is checked before feasibility
        assertEquals(RejectionReason.RATE_LIMITED, reason(ac.decide(task(0, MS, 50 * MS), 0)));

        long later = 20 * MS; // 100/s for 20ms = 2 tokens
        assertTrue(ac.decide(task(later, 1_000 * MS, MS), later).isAccepted());
        assertTrue(ac.decide(task(later, 1_000 * MS, MS), later).isAccepted());
        assertEquals(RejectionReason.RATE_LIMITED, reason(ac.decide(task(later, 1_000 * MS, MS), later)));

        ac.refund();
        assertTrue(ac.decide(task(later, 1_000 * MS, MS), later).isAccepted());
    }

    @Test
    void tokens_never_exceed_ceiling() {
        AdmissionController ac = controller();
        assertEquals(100.0, ac.tokens(0), 1e-9);
        assertEquals(100.0, ac.tokens(60_000 * MS), 1e-9);
    }

    @Test
    void high_latency_feedback_decays_rate_to_floor() {
        AdmissionController ac = controller();
        for (int i = 0; i < 9; i++) ac.feedback(10 * TARGET);
        assertEquals(100.0, ac.admittedRate(), 1e-9, "no adaptation before the minimum sample count");

        double previous = ac.admittedRate();
        for (int i = 0; i < 11; i++) {
            ac.feedback(10 * TARGET);
            assertTrue(ac.admittedRate() < previous);
            previous = ac.admittedRate();
        }
        assertEquals(100.0 * Math.pow(0.95, 11), ac.admittedRate(), 1e-6);

        for (int i = 0; i < 100; i++) ac.feedback(10 * TARGET);
        assertEquals(10.0, ac.admittedRate(), 1e-9);
    }

    @Test
    void low_latency_feedback_recovers_rate_up_to_ceiling() {
        AdmissionController ac = controller();
        for (int i = 0; i < 100; i++) ac.feedback(10 * TARGET);
        assertEquals(10.0, ac.admittedRate(), 1e-9);

        for (int i = 0; i < 50; i++) ac.feedback(MS);
        double recovering = ac.admittedRate();
        assertTrue(recovering > 10.0);
        for (int i = 0; i < 200; i++) ac.feedback(MS);
        assertEquals(100.0, ac.admittedRate(), 1e-9);
    }

    @Test
    void latency_inside_band_leaves_rate_alone() {
        AdmissionController ac = controller();
        for (int i = 0; i < 100; i++) ac.feedback(10 * TARGET);
        double floor = ac.admittedRate();
        for (int i = 0; i < 100; i++) ac.feedback(TARGET);
        assertEquals(floor, ac.admittedRate(), 1e-9);
    }

    @Test
    void service_time_estimate_follows_observations() {
        AdmissionController ac = controller();
        assertEquals(1_200_000, ac.serviceTimeEstimateNanos(), 1e-6);
        ac.observeServiceTime(2_200_000);
        assertEquals(0.18 * 2_200_000 + 0.82 * 1_200_000, ac.serviceTimeEstimateNanos(), 1e-6);
    }

    @Test
    void refuses_floor_above_ceiling() {
        assertThrows(IllegalArgumentException.class,
                () -> new AdmissionController(10, 20, TARGET, 50, 10, 0.18, 1_000, 100, 75, () -> 0, 0));
    }
}
