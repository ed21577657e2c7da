package io.fairsched.bootstrap;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.fairsched.admin.AdminServer;
import io.fairsched.config.SchedulerConfig;
import io.fairsched.runtime.Scheduler;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs a scheduler with the admin endpoint until the process is stopped.
 * Tenants come from {@code fairsched.tenants} / {@code FAIRSCHED_TENANTS} as {@code id:weight,...}.
 */
public class SchedulerMain {
    public static void main(String[] args) throws Exception {
        SchedulerConfig cfg = SchedulerConfig.fromEnv();
        Path deadLetters = Path.of(setting("deadLetterFile", "fairsched-dead-letters.jsonl"));
        Injector injector = Guice.createInjector(new SchedulerModule(cfg, deadLetters));
        Scheduler scheduler = injector.getInstance(Scheduler.class);
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);
        parseTenants(setting("tenants", "1:100")).forEach(scheduler::registerTenant);
        try (AdminServer admin = new AdminServer(cfg.adminPort(), scheduler, registry)) {
            scheduler.start();
            admin.start();
            Runtime.getRuntime().addShutdownHook(new Thread(scheduler::close));
            Thread.currentThread().join();
        }
    }

    /** Parses {@code "1:200,2:100"} into tenant id to weight, in order. */
    static Map<Long, Long> parseTenants(String spec) {
        Map<Long, Long> out = new LinkedHashMap<>();
        for (String part : spec.split(",")) {
            String p = part.trim();
            if (p.isEmpty()) continue;
            String[] kv = p.split(":");
            if (kv.length != 2) throw new IllegalArgumentException("tenant entry must be id:weight, got '" + p + "'");
            out.put(Long.parseLong(kv[0].trim()), Long.parseLong(kv[1].trim()));
        }
        return out;
    }

    private static String setting(String name, String fallback) {
        String v = System.getProperty("fairsched." + name);
        if (v == null) v = System.getenv("FAIRSCHED_" + name.replaceAll("([a-z])([A-Z])", "$1_$2").toUpperCase());
        return v != null ? v : fallback;
    }
}
