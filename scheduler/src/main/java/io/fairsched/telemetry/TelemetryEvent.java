package io.fairsched.telemetry;

import java.time.Instant;

public record TelemetryEvent(Instant timestamp, Severity severity, String message) {
    public static TelemetryEvent now(Severity severity, String message) {
        return new TelemetryEvent(Instant.now(), severity, message);
    }
}
