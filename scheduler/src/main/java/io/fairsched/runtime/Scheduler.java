package io.fairsched.runtime;

import io.fairsched.admission.AdmissionController;
import io.fairsched.admission.AdmissionDecision;
import io.fairsched.config.SchedulerConfig;
import io.fairsched.core.Priority;
import io.fairsched.core.RejectionReason;
import io.fairsched.core.SubmitResult;
import io.fairsched.core.Task;
import io.fairsched.core.TaskArena;
import io.fairsched.core.TaskOutcome;
import io.fairsched.core.TaskState;
import io.fairsched.core.WorkExecutor;
import io.fairsched.error.DeadLetterSink;
import io.fairsched.queue.HierarchicalFairQueue;
import io.fairsched.queue.QuantumSchedule;
import io.fairsched.resource.ResourceManager;
import io.fairsched.retry.ExponentialBackoffRetryPolicy;
import io.fairsched.retry.RetryPolicy;
import io.fairsched.telemetry.Counters;
import io.fairsched.telemetry.SchedulerSnapshot;
import io.fairsched.telemetry.Severity;
import io.fairsched.telemetry.TelemetrySink;
import io.fairsched.telemetry.WorkerStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.LockSupport;

/**
 * Execution engine: admits submissions, runs a fixed pool of workers that pull from the
 * {@link HierarchicalFairQueue}, and a maintenance thread that runs aging passes and publishes snapshots.
 *
 * <p>Worker loop: wait for work or shutdown, select, try the task's resource (on contention requeue at
 * the head of its level and back off), check for a more urgent waiter and inherit its priority, run one
 * slice through the {@link WorkExecutor}, release the resource, charge the tenant, then requeue, complete
 * or fail the task. Executor exceptions are retried per {@link RetryPolicy} and end in {@code FAILED}.
 *
 * <p>Shutdown closes the queue: in-flight slices finish, nothing new is selected, queued tasks stay queued.
 */
public class Scheduler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(Scheduler.class);
    private static final long IDLE_POLL_MILLIS = 50;

    private final SchedulerConfig config;
    private final WorkExecutor executor;
    private final TelemetrySink telemetry;
    private final DeadLetterSink deadLetter;
    private final RetryPolicy retryPolicy;
    private final RetryPolicy contentionBackoff;

    private final TaskArena arena;
    private final ResourceManager resources;
    private final HierarchicalFairQueue queue;
    private final AdmissionController admission;

    private final AtomicLong nextId = new AtomicLong(1);
    private final Object lifecycle = new Object();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private final AtomicBoolean finalSnapshotPublished = new AtomicBoolean(false);
    private final long sliceNanos;
    private final long starvationThresholdNanos;

    private volatile ExecutorService workerPool;
    private volatile ScheduledExecutorService maintenance;
    private final WorkerState[] workers;

    private final LongAdder submitted = new LongAdder();
    private final LongAdder admitted = new LongAdder();
    private final LongAdder completed = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder softMisses = new LongAdder();
    private final LongAdder hardMisses = new LongAdder();
    private final LongAdder inheritanceEvents = new LongAdder();
    private final LongAdder contention = new LongAdder();
    private final LongAdder softBackpressure = new LongAdder();
    private final LongAdder executorRetries = new LongAdder();
    private final Map<RejectionReason, LongAdder> rejected = new EnumMap<>(RejectionReason.class);

    public Scheduler(SchedulerConfig config,
                     WorkExecutor executor,
                     TelemetrySink telemetry,
                     DeadLetterSink deadLetter,
                     RetryPolicy retryPolicy) {
        this.config = Objects.requireNonNull(config);
        this.executor = Objects.requireNonNull(executor);
        this.telemetry = Objects.requireNonNull(telemetry);
        this.deadLetter = Objects.requireNonNull(deadLetter);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.contentionBackoff = ExponentialBackoffRetryPolicy.ofMicros(Integer.MAX_VALUE,
                config.contentionBackoffMicros(), config.contentionBackoffMicros() * 64);
        this.arena = new TaskArena(config.arenaCapacity());
        this.resources = new ResourceManager(config.resourceCount());
        this.queue = new HierarchicalFairQueue(
                new QuantumSchedule(config.priorityLevels(), config.quantumBaseMillis(), config.quantumMultiplier()),
                config.hardCapacity(), config.referenceWeight());
        this.admission = AdmissionController.fromConfig(config, queue::size, System.nanoTime());
        this.sliceNanos = TimeUnit.MICROSECONDS.toNanos(config.sliceMicros());
        this.starvationThresholdNanos = TimeUnit.MILLISECONDS.toNanos(config.starvationThresholdMillis());
        this.workers = new WorkerState[config.workers()];
        for (int i = 0; i < workers.length; i++) workers[i] = new WorkerState();
        for (RejectionReason r : RejectionReason.values()) rejected.put(r, new LongAdder());
    }

    public static SchedulerBuilder builder() { return new SchedulerBuilder(); }

    /** Registers a tenant, or updates the weight of a registered one. */
    public void registerTenant(long tenantId, long weight) {
        boolean created = queue.registerTenant(tenantId, weight);
        if (created) {
            LOG.info("Registered tenant {} with weight {}", tenantId, weight);
        } else {
            LOG.info("Updated tenant {} weight to {}", tenantId, weight);
        }
    }

    public SubmitResult submit(long tenantId, int priority, Duration cost, Duration deadlineOffset) {
        return submit(tenantId, priority, cost, deadlineOffset, ResourceManager.NO_RESOURCE);
    }

    /**
     * Admits a task or says why not. Rejections are results, not exceptions; an out-of-range
     * resource id is a caller bug and throws.
     */
    public SubmitResult submit(long tenantId, int priority, Duration cost, Duration deadlineOffset, int resourceId) {
        long now = System.nanoTime();
        submitted.increment();
        telemetry.count(Counters.TASKS_SUBMITTED);
        if (!resources.isValid(resourceId)) {
            throw new IllegalArgumentException("unknown resource " + resourceId);
        }
        if (shutdownRequested.get()) return reject(RejectionReason.SHUTDOWN, "scheduler is shut down");
        if (!queue.hasTenant(tenantId)) return reject(RejectionReason.UNKNOWN_TENANT, "unknown tenant " + tenantId);

        int level = Priority.clamp(priority, config.priorityLevels());
        long id = nextId.getAndIncrement();
        long costNanos = cost.toNanos();
        long offsetNanos = deadlineOffset.toNanos();
        Optional<Task> allocated = arena.allocate(slot -> new Task(id, slot, tenantId, level, now, offsetNanos,
                config.hardDeadlineMultiplier(), costNanos, resourceId));
        if (allocated.isEmpty()) return reject(RejectionReason.QUEUE_FULL_HARD, "task arena exhausted");
        Task task = allocated.get();

        AdmissionDecision decision = admission.decide(task, now);
        if (decision instanceof AdmissionDecision.Reject r) {
            task.transitionTo(TaskState.REJECTED);
            arena.release(task);
            return reject(r.reason(), r.message());
        }
        task.transitionTo(TaskState.ADMITTED);
        if (!queue.enqueue(task)) {
            admission.refund();
            task.transitionTo(TaskState.REJECTED);
            arena.release(task);
            return queue.isClosed()
                    ? reject(RejectionReason.SHUTDOWN, "scheduler is shut down")
                    : reject(RejectionReason.QUEUE_FULL_HARD, "queue at hard capacity");
        }
        admitted.increment();
        telemetry.count(Counters.TASKS_ADMITTED);
        boolean soft = ((AdmissionDecision.Accept) decision).softBackpressure();
        if (soft) {
            softBackpressure.increment();
            telemetry.count(Counters.SOFT_BACKPRESSURE);
        }
        return SubmitResult.accepted(id, soft);
    }

    public void start() {
        synchronized (lifecycle) {
            if (shutdownRequested.get()) throw new IllegalStateException("scheduler already shut down");
            if (!started.compareAndSet(false, true)) return;
            workerPool = Executors.newFixedThreadPool(workers.length, named("fairsched-worker"));
            for (int i = 0; i < workers.length; i++) {
                int index = i;
                workerPool.execute(() -> runWorker(index));
            }
            maintenance = Executors.newSingleThreadScheduledExecutor(named("fairsched-aging"));
            maintenance.scheduleAtFixedRate(this::maintenanceTick,
                    config.agingIntervalMillis(), config.agingIntervalMillis(), TimeUnit.MILLISECONDS);
        }
        LOG.info("Scheduler started with {} workers, {} priority levels, hard capacity {}",
                workers.length, config.priorityLevels(), config.hardCapacity());
        telemetry.event(Severity.INFO, "scheduler started");
    }

    /**
     * Stops selection, lets in-flight slices finish and waits for the workers. Safe to call more than once
     * and before {@link #start()}.
     */
    public void shutdown() {
        ExecutorService pool;
        synchronized (lifecycle) {
            if (shutdownRequested.compareAndSet(false, true)) {
                LOG.info("Scheduler shutting down, {} tasks still queued", queue.size());
                queue.close();
                if (maintenance != null) maintenance.shutdownNow();
                if (workerPool != null) workerPool.shutdown();
            }
            pool = workerPool;
        }
        if (pool != null) {
            try {
                while (!pool.awaitTermination(1, TimeUnit.SECONDS)) {
                    LOG.debug("Waiting for workers to finish in-flight slices");
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            }
        }
        if (finalSnapshotPublished.compareAndSet(false, true)) {
            telemetry.snapshot(snapshot());
            telemetry.event(Severity.INFO, "scheduler stopped");
        }
    }

    /** Waits until nothing is queued or running. Returns false on timeout. */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (queue.size() > 0 || queue.running() > 0) {
            if (System.nanoTime() - deadline > 0) return false;
            sleepQuiet(1);
            if (Thread.currentThread().isInterrupted()) return false;
        }
        return true;
    }

    public boolean isRunning() { return started.get() && !shutdownRequested.get(); }

    public SchedulerSnapshot snapshot() {
        long now = System.nanoTime();
        List<WorkerStats> workerStats = new ArrayList<>(workers.length);
        for (int i = 0; i < workers.length; i++) {
            workerStats.add(new WorkerStats(i, workers[i].tasksRun.get(), workers[i].idleNanos.get()));
        }
        return new SchedulerSnapshot(
                System.currentTimeMillis(),
                isRunning(),
                queue.size(),
                queue.running(),
                admission.admittedRate(),
                admission.tokens(now),
                admission.serviceTimeEstimateNanos(),
                counters(),
                queue.tenantStats(),
                workerStats);
    }

    public SchedulerConfig config() { return config; }
    public HierarchicalFairQueue queue() { return queue; }
    public ResourceManager resources() { return resources; }
    public AdmissionController admission() { return admission; }
    public TaskArena arena() { return arena; }
    public TelemetrySink telemetry() { return telemetry; }

    @Override
    public void close() {
        shutdown();
    }

    private Map<String, Long> counters() {
        Map<String, Long> out = new LinkedHashMap<>();
        out.put(Counters.TASKS_SUBMITTED, submitted.sum());
        out.put(Counters.TASKS_ADMITTED, admitted.sum());
        out.put(Counters.TASKS_COMPLETED, completed.sum());
        out.put(Counters.TASKS_FAILED, failed.sum());
        long rejectedTotal = 0;
        for (Map.Entry<RejectionReason, LongAdder> e : rejected.entrySet()) {
            long n = e.getValue().sum();
            rejectedTotal += n;
            out.put(Counters.rejected(e.getKey()), n);
        }
        out.put(Counters.TASKS_REJECTED, rejectedTotal);
        out.put(Counters.DEADLINE_MISSES, softMisses.sum() + hardMisses.sum());
        out.put(Counters.DEADLINE_MISSES_SOFT, softMisses.sum());
        out.put(Counters.DEADLINE_MISSES_HARD, hardMisses.sum());
        out.put(Counters.PRIORITY_INHERITANCE_EVENTS, inheritanceEvents.sum());
        out.put(Counters.RESOURCE_CONTENTION, contention.sum());
        out.put(Counters.AGING_PROMOTIONS, queue.promotions());
        out.put(Counters.MLFQ_DEMOTIONS, queue.demotions());
        out.put(Counters.SOFT_BACKPRESSURE, softBackpressure.sum());
        out.put(Counters.EXECUTOR_RETRIES, executorRetries.sum());
        return out;
    }

    private SubmitResult reject(RejectionReason reason, String message) {
        rejected.get(reason).increment();
        telemetry.count(Counters.TASKS_REJECTED);
        telemetry.count(Counters.rejected(reason));
        if (LOG.isDebugEnabled()) LOG.debug("Rejected submission: {} ({})", reason, message);
        return SubmitResult.rejected(reason);
    }

    private void runWorker(int index) {
        WorkerState state = workers[index];
        while (true) {
            long waitStart = System.nanoTime();
            Optional<Task> next;
            try {
                next = queue.awaitNext(IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            } finally {
                state.idleNanos.addAndGet(System.nanoTime() - waitStart);
            }
            if (next.isPresent()) {
                Task task = next.get();
                try {
                    runSlice(state, task);
                } catch (VirtualMachineError e) {
                    throw e;
                } catch (Throwable t) {
                    LOG.error("Worker {} lost task {} to an unexpected error", index, task.id(), t);
                }
            } else if (queue.isClosed()) {
                return;
            }
        }
    }

    private void runSlice(WorkerState worker, Task task) {
        int resource = task.requiredResource();
        boolean holding = false;
        if (task.needsResource()) {
            if (!resources.tryAcquire(resource, task.id(), task.currentPriority())) {
                task.transitionTo(TaskState.BLOCKED);
                task.markBlocked();
                int blocked = task.blockedCount();
                // the queue owns the task from here on
                queue.requeueBlocked(task);
                contention.increment();
                telemetry.count(Counters.RESOURCE_CONTENTION);
                LockSupport.parkNanos(contentionBackoff.backoffNanos(blocked));
                return;
            }
            holding = true;
        }
        worker.tasksRun.incrementAndGet();
        long work = sliceNanos > 0 ? Math.min(sliceNanos, task.remainingCostNanos()) : task.remainingCostNanos();
        SliceResult result;
        try {
            if (holding) inheritPriority(task);
            result = execute(task, work);
            // a waiter that arrived mid-slice is still recorded until the release below
            if (holding) inheritPriority(task);
        } finally {
            if (holding) {
                resources.release(resource);
                task.restoreAfterBoost();
            }
        }
        queue.charge(task, result.actualNanos());
        if (result.failure() != null) {
            fail(task, result.failure());
            return;
        }
        task.consume(work);
        if (task.remainingCostNanos() > 0) {
            if (queue.requeueAfterSlice(task)) telemetry.count(Counters.MLFQ_DEMOTIONS);
        } else {
            complete(task);
        }
    }

    private void inheritPriority(Task task) {
        OptionalInt waiter = resources.checkInheritance(task.id());
        if (waiter.isPresent()) {
            int from = task.currentPriority();
            if (task.boostTo(waiter.getAsInt())) {
                inheritanceEvents.increment();
                telemetry.count(Counters.PRIORITY_INHERITANCE_EVENTS);
                telemetry.event(Severity.DEBUG, String.format("task %d inherited priority %d (was %d) on resource %d",
                        task.id(), task.currentPriority(), from, task.requiredResource()));
            }
        }
    }

    private SliceResult execute(Task task, long work) {
        long spent = 0;
        int attempt = 0;
        while (true) {
            attempt++;
            long t0 = System.nanoTime();
            try {
                long actual = executor.execute(task.id(), work);
                return new SliceResult(spent + Math.max(0, actual), null);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return new SliceResult(spent + System.nanoTime() - t0, ie);
            } catch (Exception e) {
                spent += System.nanoTime() - t0;
                if (!retryPolicy.shouldRetry(attempt, e)) {
                    return new SliceResult(spent, e);
                }
                executorRetries.increment();
                telemetry.count(Counters.EXECUTOR_RETRIES);
                LockSupport.parkNanos(retryPolicy.backoffNanos(attempt));
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable t) {
                // errors are not retried
                return new SliceResult(spent + System.nanoTime() - t0, t);
            }
        }
    }

    private void complete(Task task) {
        long now = System.nanoTime();
        TaskOutcome outcome = TaskOutcome.forCompletion(now, task.softDeadlineNanos(), task.hardDeadlineNanos());
        task.finish(now, outcome);
        task.transitionTo(TaskState.COMPLETED);
        long latency = task.latencyNanos();
        admission.feedback(latency);
        admission.observeServiceTime(task.actualCostNanos());
        completed.increment();
        telemetry.count(Counters.TASKS_COMPLETED);
        telemetry.latency(latency);
        if (outcome.isDeadlineMiss()) {
            telemetry.count(Counters.DEADLINE_MISSES);
            if (outcome == TaskOutcome.DEADLINE_MISSED_HARD) {
                hardMisses.increment();
                telemetry.count(Counters.DEADLINE_MISSES_HARD);
            } else {
                softMisses.increment();
                telemetry.count(Counters.DEADLINE_MISSES_SOFT);
            }
        }
        arena.release(task);
        // last, so awaitIdle observes the counters above
        queue.retire(task);
    }

    private void fail(Task task, Throwable cause) {
        task.finish(System.nanoTime(), TaskOutcome.FAILED);
        task.transitionTo(TaskState.FAILED);
        failed.increment();
        telemetry.count(Counters.TASKS_FAILED);
        telemetry.event(Severity.WARN, String.format("task %d of tenant %d failed: %s",
                task.id(), task.tenantId(), cause));
        LOG.warn("Task {} of tenant {} failed", task.id(), task.tenantId(), cause);
        deadLetter.acceptFailure("execute", task, cause);
        arena.release(task);
        queue.retire(task);
    }

    // must not throw, scheduleAtFixedRate cancels all later runs on an exception
    private void maintenanceTick() {
        try {
            int promoted = queue.runAgingPass(System.nanoTime(), starvationThresholdNanos);
            if (promoted > 0) telemetry.count(Counters.AGING_PROMOTIONS, promoted);
        } catch (RuntimeException e) {
            LOG.error("Aging pass failed", e);
        }
        try {
            telemetry.snapshot(snapshot());
        } catch (RuntimeException e) {
            LOG.error("Publishing scheduler snapshot failed", e);
        }
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }

    private static void sleepQuiet(long millis) {
        try { Thread.sleep(millis); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
    }

    private record SliceResult(long actualNanos, Throwable failure) {}

    private static final class WorkerState {
        final AtomicLong tasksRun = new AtomicLong();
        final AtomicLong idleNanos = new AtomicLong();
    }
}
