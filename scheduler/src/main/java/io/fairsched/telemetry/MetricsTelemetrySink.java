package io.fairsched.telemetry;

import com.codahale.metrics.Histogram;
import io.fairsched.metrics.Metrics;
import io.fairsched.queue.TenantStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Telemetry sink backed by a Dropwizard {@link com.codahale.metrics.MetricRegistry}.
 *
 * <p>Counters map to registry counters of the same name, latencies feed both a
 * {@link LatencyHistogram} and a registry histogram ({@code task.latency.micros}), events are kept in
 * a bounded ring (oldest dropped) and mirrored to the log. Tenant and worker gauges read the most
 * recently published {@link SchedulerSnapshot}.
 */
public class MetricsTelemetrySink implements TelemetrySink {
    private static final Logger LOG = LoggerFactory.getLogger("io.fairsched.telemetry.events");

    public static final int DEFAULT_EVENT_CAPACITY = 8192;

    private final Metrics metrics;
    private final int eventCapacity;
    private final ArrayDeque<TelemetryEvent> events;
    private final LatencyHistogram histogram = new LatencyHistogram();
    private final Histogram latencyMicros;
    private final AtomicReference<SchedulerSnapshot> latest = new AtomicReference<>();
    private long droppedEvents;

    public MetricsTelemetrySink(Metrics metrics) {
        this(metrics, DEFAULT_EVENT_CAPACITY);
    }

    public MetricsTelemetrySink(Metrics metrics, int eventCapacity) {
        this.metrics = metrics;
        this.eventCapacity = Math.max(1, eventCapacity);
        this.events = new ArrayDeque<>(Math.min(this.eventCapacity, 1024));
        this.latencyMicros = metrics.histogram("task.latency.micros");
    }

    @Override
    public void event(TelemetryEvent event) {
        synchronized (events) {
            if (events.size() == eventCapacity) {
                events.removeFirst();
                droppedEvents++;
            }
            events.addLast(event);
        }
        switch (event.severity()) {
            case TRACE -> LOG.trace(event.message());
            case DEBUG -> LOG.debug(event.message());
            case INFO -> LOG.info(event.message());
            case WARN -> LOG.warn(event.message());
            case ERROR -> LOG.error(event.message());
        }
    }

    @Override
    public void count(String counter, long delta) {
        metrics.counter(counter).inc(delta);
    }

    @Override
    public void latency(long latencyNanos) {
        histogram.record(latencyNanos);
        latencyMicros.update(TimeUnit.NANOSECONDS.toMicros(latencyNanos));
    }

    @Override
    public void snapshot(SchedulerSnapshot snapshot) {
        latest.set(snapshot);
        for (TenantStats t : snapshot.tenants()) {
            long id = t.id();
            metrics.gauge("tenant." + id + ".weight", () -> tenant(id).map(TenantStats::weight).orElse(0L));
            metrics.gauge("tenant." + id + ".vruntime", () -> tenant(id).map(TenantStats::vruntime).orElse(0L));
            metrics.gauge("tenant." + id + ".executed_nanos", () -> tenant(id).map(TenantStats::executedNanos).orElse(0L));
        }
        for (WorkerStats w : snapshot.workers()) {
            int idx = w.index();
            metrics.gauge("worker." + idx + ".tasks_run", () -> worker(idx).map(WorkerStats::tasksRun).orElse(0L));
            metrics.gauge("worker." + idx + ".idle_nanos", () -> worker(idx).map(WorkerStats::idleNanos).orElse(0L));
        }
    }

    public long counter(String name) { return metrics.counter(name).getCount(); }

    public LatencyHistogram histogram() { return histogram; }

    public Optional<SchedulerSnapshot> latestSnapshot() { return Optional.ofNullable(latest.get()); }

    public List<TelemetryEvent> events() {
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }

    public long droppedEvents() {
        synchronized (events) {
            return droppedEvents;
        }
    }

    public Metrics metrics() { return metrics; }

    private Optional<TenantStats> tenant(long id) {
        SchedulerSnapshot s = latest.get();
        if (s == null) return Optional.empty();
        return s.tenants().stream().filter(t -> t.id() == id).findFirst();
    }

    private Optional<WorkerStats> worker(int index) {
        SchedulerSnapshot s = latest.get();
        if (s == null) return Optional.empty();
        return s.workers().stream().filter(w -> w.index() == index).findFirst();
    }
}
