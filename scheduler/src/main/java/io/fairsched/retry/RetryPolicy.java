package io.fairsched.retry;

public interface RetryPolicy {
    boolean shouldRetry(int attempt, Exception e);
    long backoffNanos(int attempt);
}
