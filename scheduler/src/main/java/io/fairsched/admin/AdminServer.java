package io.fairsched.admin;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.fairsched.queue.TenantStats;
import io.fairsched.runtime.Scheduler;
import io.fairsched.telemetry.SchedulerSnapshot;
import io.fairsched.telemetry.WorkerStats;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Read-only admin endpoint: {@code /status}, {@code /metrics} and {@code /tenants}, all JSON.
 */
public class AdminServer implements AutoCloseable {
    private final HttpServer server;
    private final ExecutorService executor;
    private final Scheduler scheduler;
    private final MetricRegistry registry;

    public AdminServer(int port, Scheduler scheduler, MetricRegistry registry) throws IOException {
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.scheduler = scheduler;
        this.registry = registry;
        this.executor = Executors.newCachedThreadPool();
        server.createContext("/status", new StatusHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/tenants", new TenantsHandler());
        server.setExecutor(executor);
    }

    public void start() { server.start(); }

    public int port() { return server.getAddress().getPort(); }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private static void sendJson(HttpExchange exchange, String json) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return;
        }
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) { os.write(bytes); }
    }

    private class StatusHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            SchedulerSnapshot s = scheduler.snapshot();
            String json = String.format(Locale.ROOT,
                    "{\"running\":%s,\"queued\":%d,\"inExecution\":%d,\"admittedRate\":%.2f,\"tokens\":%.2f,\"serviceEstimateMicros\":%.1f,\"workers\":[%s]}",
                    s.running(), s.queued(), s.inExecution(), s.admittedRate(), s.tokens(),
                    s.serviceEstimateNanos() / 1_000.0, workersJson(s));
            sendJson(exchange, json);
        }

        private String workersJson(SchedulerSnapshot s) {
            StringBuilder sb = new StringBuilder();
            for (WorkerStats w : s.workers()) {
                if (sb.length() > 0) sb.append(',');
                sb.append(String.format(Locale.ROOT, "{\"index\":%d,\"tasksRun\":%d,\"idleNanos\":%d}",
                        w.index(), w.tasksRun(), w.idleNanos()));
            }
            return sb.toString();
        }
    }

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            StringBuilder sb = new StringBuilder("{\"counters\":{");
            boolean first = true;
            for (Map.Entry<String, Long> e : scheduler.snapshot().counters().entrySet()) {
                if (!first) sb.append(',');
                first = false;
                sb.append('"').append(e.getKey()).append("\":").append(e.getValue());
            }
            sb.append("},\"registry\":{");
            first = true;
            for (Map.Entry<String, Counter> e : registry.getCounters().entrySet()) {
                if (!first) sb.append(',');
                first = false;
                sb.append('"').append(e.getKey()).append("\":").append(e.getValue().getCount());
            }
            sb.append("}}");
            sendJson(exchange, sb.toString());
        }
    }

    private class TenantsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            StringBuilder sb = new StringBuilder("[");
            for (TenantStats t : scheduler.snapshot().tenants()) {
                if (sb.length() > 1) sb.append(',');
                sb.append(String.format(Locale.ROOT,
                        "{\"id\":%d,\"weight\":%d,\"vruntime\":%d,\"executedNanos\":%d,\"queued\":%d,\"inFlight\":%d}",
                        t.id(), t.weight(), t.vruntime(), t.executedNanos(), t.queued(), t.inFlight()));
            }
            sb.append(']');
            sendJson(exchange, sb.toString());
        }
    }
}
