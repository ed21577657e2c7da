package io.fairsched.admin;

import com.codahale.metrics.MetricRegistry;
import io.fairsched.config.SchedulerConfig;
import io.fairsched.core.Priority;
import io.fairsched.runtime.Scheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class AdminServerTest {
    AdminServer http;
    Scheduler scheduler;

    @AfterEach
    void tearDown() {
        if (http != null) http.close();
        if (scheduler != null) scheduler.close();
    }

    private static int freePort() throws Exception {
        try (java.net.ServerSocket s = new java.net.ServerSocket(0)) { return s.getLocalPort(); }
    }

    @Test
    void serves_status_metrics_and_tenants() throws Exception {
        int port = freePort();
        MetricRegistry registry = new MetricRegistry();
        scheduler = Scheduler.builder()
                .config(SchedulerConfig.builder().workers(2).build())
                .executor((id, cost) -> cost)
                .metrics(registry)
                .build();
        scheduler.registerTenant(1, 200);
        scheduler.registerTenant(2, 100);
        for (int i = 0; i < 10; i++) {
            scheduler.submit(1, Priority.NORMAL, Duration.ofMillis(1), Duration.ofSeconds(10));
        }
        scheduler.submit(42, Priority.NORMAL, Duration.ofMillis(1), Duration.ofSeconds(10));
        scheduler.start();
        assertTrue(scheduler.awaitIdle(Duration.ofSeconds(10)));

        http = new AdminServer(port, scheduler, registry);
        http.start();

        HttpClient client = HttpClient.newHttpClient();
        HttpResponse<String> status = client.send(HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/status")).GET().build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(200, status.statusCode());
        assertTrue(status.body().contains("\"running\":true"), status.body());
        assertTrue(status.body().contains("\"queued\":0"));

        HttpResponse<String> metrics = client.send(HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/metrics")).GET().build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.body().contains("\"tasks_completed\":10"), metrics.body());
        assertTrue(metrics.body().contains("\"tasks_rejected.unknown-tenant\":1"), metrics.body());

        HttpResponse<String> tenants = client.send(HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/tenants")).GET().build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(200, tenants.statusCode());
        assertTrue(tenants.body().startsWith("[{\"id\":1,\"weight\":200"), tenants.body());
        assertTrue(tenants.body().contains("\"executedNanos\":10000000"));
        assertTrue(tenants.body().contains("{\"id\":2,\"weight\":100"));

        HttpResponse<String> post = client.send(HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/status")).POST(HttpRequest.BodyPublishers.noBody()).build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(405, post.statusCode());
    }
}
