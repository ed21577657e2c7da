package io.fairsched.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.MetricRegistry;

import java.util.function.Supplier;

public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Histogram histogram(String name) { return registry.histogram(name); }

    /** Registers a gauge reading {@code value} unless one with that name exists already. */
    @SuppressWarnings("unchecked")
    public <T> Gauge<T> gauge(String name, Supplier<T> value) {
        return registry.gauge(name, () -> (Gauge<T>) value::get);
    }
}
