package io.fairsched.sim;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.fairsched.bootstrap.SchedulerModule;
import io.fairsched.config.SchedulerConfig;
import io.fairsched.runtime.Scheduler;
import io.fairsched.telemetry.LatencyHistogram;
import io.fairsched.telemetry.MetricsTelemetrySink;
import io.fairsched.telemetry.TelemetrySink;
import picocli.CommandLine;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Drives a scheduler with synthetic multi-tenant load, drains it and prints a report.
 */
@CommandLine.Command(name = "fairsched-sim", mixinStandardHelpOptions = true, description = "Run a synthetic multi-tenant load against the scheduler")
public final class SimulateCommand implements Callable<Integer> {
    @CommandLine.Option(names = {"-d", "--duration-seconds"}, description = "Seconds of load injection", defaultValue = "5")
    long durationSeconds;

    @CommandLine.Option(names = {"--drain-seconds"}, description = "Seconds allowed for draining after load stops", defaultValue = "2")
    long drainSeconds;

    @CommandLine.Option(names = {"-w", "--workers"}, description = "Worker threads", defaultValue = "4")
    int workers;

    @CommandLine.Option(names = {"-r", "--ceiling-rate"}, description = "Admission ceiling, tasks per second", defaultValue = "2000")
    double ceilingRate;

    @CommandLine.Option(names = {"--slice-micros"}, description = "Execution slice in microseconds, 0 runs to completion", defaultValue = "0")
    long sliceMicros;

    @CommandLine.Option(names = {"-s", "--seed"}, description = "Load generator seed", defaultValue = "12345")
    long seed;

    @CommandLine.Option(names = {"--dead-letter-file"}, description = "Where failed tasks are recorded", defaultValue = "fairsched-dead-letters.jsonl")
    Path deadLetterFile;

    private final PrintStream out;

    public SimulateCommand() {
        this(System.out);
    }

    SimulateCommand(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SimulateCommand()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        if (durationSeconds < 0 || drainSeconds < 0) {
            System.err.println("Durations must not be negative");
            return 2;
        }
        SchedulerConfig config = SchedulerConfig.builder()
                .workers(workers)
                .ceilingRate(ceilingRate)
                .sliceMicros(sliceMicros)
                .build();
        Injector injector = Guice.createInjector(new SchedulerModule(config, deadLetterFile));
        Scheduler scheduler = injector.getInstance(Scheduler.class);
        TelemetrySink telemetry = injector.getInstance(TelemetrySink.class);
        LoadGenerator generator = new LoadGenerator(seed, config.priorityLevels());

        LoadGenerator.registerTenants(scheduler);
        scheduler.start();
        out.printf("Injecting load... (%d seconds)%n", durationSeconds);
        generator.run(scheduler, Duration.ofSeconds(durationSeconds));

        out.println("Draining...");
        if (!scheduler.awaitIdle(Duration.ofSeconds(drainSeconds))) {
            out.printf("Drain timed out, %d tasks still queued%n", scheduler.queue().size());
        }
        scheduler.shutdown();

        LatencyHistogram histogram = telemetry instanceof MetricsTelemetrySink m ? m.histogram() : new LatencyHistogram();
        out.print(SimulationReport.render(generator.generated(), scheduler.snapshot(), histogram));
        return 0;
    }
}
