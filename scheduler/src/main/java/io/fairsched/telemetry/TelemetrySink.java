package io.fairsched.telemetry;

/**
 * Receives append-only scheduler telemetry. Implementations own formatting and storage; the
 * scheduler calls these from worker threads and must not be slowed down by them.
 */
public interface TelemetrySink extends AutoCloseable {

    void event(TelemetryEvent event);

    void count(String counter, long delta);

    /** End-to-end latency (arrival to completion) of a completed task. */
    void latency(long latencyNanos);

    default void event(Severity severity, String message) {
        event(TelemetryEvent.now(severity, message));
    }

    default void count(String counter) {
        count(counter, 1L);
    }

    /** Latest tenant/worker view; published periodically and at shutdown. */
    default void snapshot(SchedulerSnapshot snapshot) {}

    @Override
    default void close() {}
}
