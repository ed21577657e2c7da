package io.fairsched.telemetry;

public record WorkerStats(int index, long tasksRun, long idleNanos) {}
