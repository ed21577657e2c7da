package io.fairsched.telemetry;

public enum Severity {
    TRACE, DEBUG, INFO, WARN, ERROR
}
