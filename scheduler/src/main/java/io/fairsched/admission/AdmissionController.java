package io.fairsched.admission;

import io.fairsched.config.SchedulerConfig;
import io.fairsched.core.RejectionReason;
import io.fairsched.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;

/**
 * Deadline-feasibility and rate-based gatekeeper.
 *
 * <p>Credits accrue continuously at the admitted rate and are capped at the ceiling; every accepted
 * task costs one credit. Completion latencies fed back through {@link #feedback(long)} steer the
 * admitted rate: a window average above 1.2x target backs off by 5%, below 0.8x target recovers
 * by 5%, always within {@code [floor, ceiling]}.
 *
 * <p>All state is guarded by the instance monitor so {@link #decide} sees one consistent snapshot
 * of rate, credits, service-time estimate and queue length.
 */
public class AdmissionController {
    private static final Logger LOG = LoggerFactory.getLogger(AdmissionController.class);

    static final double CONGESTION_FACTOR = 1.2;
    static final double RECOVERY_FACTOR = 0.8;
    static final double BACKOFF = 0.95;
    static final double RECOVERY = 1.05;

    private final double ceilingRate;
    private final double floorRate;
    private final long targetLatencyNanos;
    private final int minSamples;
    private final int hardCapacity;
    private final int softThreshold;
    private final IntSupplier queueLength;

    private final LatencyWindow window;
    private final Ewma serviceTime;
    private double admittedRate;
    private double tokens;
    private long lastRefillNanos;

    public AdmissionController(double ceilingRate,
                               double floorRate,
                               long targetLatencyNanos,
                               int windowSize,
                               int minSamples,
                               double ewmaAlpha,
                               long initialServiceNanos,
                               int hardCapacity,
                               int softThresholdPct,
                               IntSupplier queueLength,
                               long startNanos) {
        if (floorRate <= 0 || ceilingRate < floorRate) {
            throw new IllegalArgumentException("need 0 < floor <= ceiling, got floor=" + floorRate + " ceiling=" + ceilingRate);
        }
        if (hardCapacity <= 0) throw new IllegalArgumentException("hard capacity must be positive");
        this.ceilingRate = ceilingRate;
        this.floorRate = floorRate;
        this.targetLatencyNanos = targetLatencyNanos;
        this.minSamples = Math.max(1, Math.min(minSamples, windowSize));
        this.hardCapacity = hardCapacity;
        this.softThreshold = (int) ((long) hardCapacity * softThresholdPct / 100);
        this.queueLength = queueLength;
        this.window = new LatencyWindow(windowSize);
        this.serviceTime = new Ewma(ewmaAlpha);
        this.serviceTime.update(initialServiceNanos);
        this.admittedRate = ceilingRate;
        this.tokens = ceilingRate;
        this.lastRefillNanos = startNanos;
    }

    public static AdmissionController fromConfig(SchedulerConfig config, IntSupplier queueLength, long startNanos) {
        return new AdmissionController(
                config.ceilingRate(),
                config.floorRate(),
                TimeUnit.MILLISECONDS.toNanos(config.targetLatencyMillis()),
                config.latencyWindow(),
                config.minLatencySamples(),
                config.ewmaAlpha(),
                TimeUnit.MICROSECONDS.toNanos(config.initialServiceMicros()),
                config.hardCapacity(),
                config.softThresholdPct(),
                queueLength,
                startNanos);
    }

    /**
     * Checks, in order: expired on arrival, hard capacity, rate credit, deadline feasibility against
     * {@code EWMA(service) x queue length}, then flags soft backpressure. Consumes one credit on accept.
     */
    public synchronized AdmissionDecision decide(Task task, long nowNanos) {
        if (task.isExpired(nowNanos)) {
            return new AdmissionDecision.Reject(RejectionReason.ALREADY_EXPIRED, "past soft deadline on arrival");
        }
        int qlen = queueLength.getAsInt();
        if (qlen >= hardCapacity) {
            return new AdmissionDecision.Reject(RejectionReason.QUEUE_FULL_HARD, "queue full (" + qlen + " >= " + hardCapacity + ")");
        }
        refill(nowNanos);
        if (tokens < 1.0) {
            return new AdmissionDecision.Reject(RejectionReason.RATE_LIMITED,
                    String.format("no credit at %.1f tasks/s", admittedRate));
        }
        double estimatedDelay = serviceTime.get() * qlen;
        double estimatedCompletion = nowNanos + estimatedDelay + task.estimatedCostNanos();
        if (estimatedCompletion > task.softDeadlineNanos()) {
            return new AdmissionDecision.Reject(RejectionReason.DEADLINE_INFEASIBLE,
                    String.format("estimated completion in %dus exceeds deadline in %dus",
                            TimeUnit.NANOSECONDS.toMicros((long) (estimatedCompletion - nowNanos)),
                            TimeUnit.NANOSECONDS.toMicros(task.softDeadlineNanos() - nowNanos)));
        }
        tokens -= 1.0;
        return new AdmissionDecision.Accept(qlen >= softThreshold);
    }

    /** Returns the credit of an accepted task that the queue then refused. */
    public synchronized void refund() {
        tokens = Math.min(ceilingRate, tokens + 1.0);
    }

    /** Completion latency sample driving rate adaptation. */
    public synchronized void feedback(long latencyNanos) {
        window.add(latencyNanos);
        if (window.size() < minSamples) return;
        double avg = window.average();
        double previous = admittedRate;
        if (avg > targetLatencyNanos * CONGESTION_FACTOR) {
            admittedRate = Math.max(floorRate, admittedRate * BACKOFF);
        } else if (avg < targetLatencyNanos * RECOVERY_FACTOR && admittedRate < ceilingRate) {
            admittedRate = Math.min(ceilingRate, admittedRate * RECOVERY);
        }
        if (LOG.isTraceEnabled() && previous != admittedRate) {
            LOG.trace("Admitted rate {} -> {} (window avg {}us)", previous, admittedRate, (long) (avg / 1000));
        }
    }

    /** Observed execution time of a completed task, smoothed into the queueing-delay estimate. */
    public synchronized void observeServiceTime(long serviceNanos) {
        serviceTime.update(serviceNanos);
    }

    public synchronized double admittedRate() { return admittedRate; }

    public synchronized double tokens(long nowNanos) {
        refill(nowNanos);
        return tokens;
    }

    public synchronized double serviceTimeEstimateNanos() { return serviceTime.get(); }

    public synchronized double windowAverageNanos() { return window.average(); }

    public double ceilingRate() { return ceilingRate; }
    public double floorRate() { return floorRate; }
    public int hardCapacity() { return hardCapacity; }
    public int softThreshold() { return softThreshold; }

    private void refill(long nowNanos) {
        long elapsed = nowNanos - lastRefillNanos;
        if (elapsed <= 0) return;
        tokens = Math.min(ceilingRate, tokens + (elapsed / 1e9) * admittedRate);
        lastRefillNanos = nowNanos;
    }
}
