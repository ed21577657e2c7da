package io.fairsched.runtime;

import com.codahale.metrics.MetricRegistry;
import io.fairsched.config.SchedulerConfig;
import io.fairsched.core.WorkExecutor;
import io.fairsched.error.DeadLetterSink;
import io.fairsched.metrics.Metrics;
import io.fairsched.retry.ExponentialBackoffRetryPolicy;
import io.fairsched.retry.RetryPolicy;
import io.fairsched.telemetry.MetricsTelemetrySink;
import io.fairsched.telemetry.TelemetrySink;

import java.util.Objects;

public class SchedulerBuilder {
    private SchedulerConfig config = SchedulerConfig.defaults();
    private WorkExecutor executor = new SimulatedWorkExecutor();
    private TelemetrySink telemetry;
    private DeadLetterSink deadLetter = (stage, task, e) -> {};
    private RetryPolicy retryPolicy;
    private MetricRegistry metricRegistry = new MetricRegistry();

    public SchedulerBuilder config(SchedulerConfig c) { this.config = c; return this; }
    public SchedulerBuilder executor(WorkExecutor e) { this.executor = e; return this; }
    public SchedulerBuilder telemetry(TelemetrySink t) { this.telemetry = t; return this; }
    public SchedulerBuilder deadLetter(DeadLetterSink d) { this.deadLetter = d; return this; }
    public SchedulerBuilder retry(RetryPolicy r) { this.retryPolicy = r; return this; }
    public SchedulerBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }

    public Scheduler build() {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(deadLetter, "deadLetter");
        TelemetrySink sink = telemetry != null
                ? telemetry
                : new MetricsTelemetrySink(new Metrics(Objects.requireNonNull(metricRegistry, "metricRegistry")));
        RetryPolicy retry = retryPolicy != null
                ? retryPolicy
                : ExponentialBackoffRetryPolicy.ofMicros(config.executorAttempts(), 1_000, 100_000);
        return new Scheduler(config, executor, sink, deadLetter, retry);
    }
}
