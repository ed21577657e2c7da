package io.fairsched.bootstrap;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.fairsched.config.SchedulerConfig;
import io.fairsched.core.WorkExecutor;
import io.fairsched.error.DeadLetterSink;
import io.fairsched.error.FileDeadLetterSink;
import io.fairsched.metrics.Metrics;
import io.fairsched.runtime.Scheduler;
import io.fairsched.runtime.SimulatedWorkExecutor;
import io.fairsched.telemetry.MetricsTelemetrySink;
import io.fairsched.telemetry.TelemetrySink;

import java.io.IOException;
import java.nio.file.Path;

public class SchedulerModule extends AbstractModule {
    private final SchedulerConfig config;
    private final Path deadLetterFile;

    public SchedulerModule(SchedulerConfig config, Path deadLetterFile) {
        this.config = config;
        this.deadLetterFile = deadLetterFile;
    }

    @Override
    protected void configure() {
        bind(SchedulerConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton TelemetrySink telemetry(Metrics metrics) { return new MetricsTelemetrySink(metrics); }

    @Provides WorkExecutor executor() { return new SimulatedWorkExecutor(); }

    @Provides @Singleton DeadLetterSink deadLetter() throws IOException { return new FileDeadLetterSink(deadLetterFile); }

    @Provides @Singleton Scheduler scheduler(WorkExecutor executor, TelemetrySink telemetry, DeadLetterSink deadLetter) {
        return Scheduler.builder()
                .config(config)
                .executor(executor)
                .telemetry(telemetry)
                .deadLetter(deadLetter)
                .build();
    }
}
