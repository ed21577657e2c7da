package io.fairsched.retry;

import java.util.concurrent.TimeUnit;

/**
 * Doubles the pause on every attempt, from {@code baseNanos} up to {@code maxNanos}, and allows
 * {@code maxAttempts} attempts in total.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseNanos;
    private final long maxNanos;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseNanos, long maxNanos) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseNanos = Math.max(1, baseNanos);
        this.maxNanos = Math.max(this.baseNanos, maxNanos);
    }

    public static ExponentialBackoffRetryPolicy ofMicros(int maxAttempts, long baseMicros, long maxMicros) {
        return new ExponentialBackoffRetryPolicy(maxAttempts,
                TimeUnit.MICROSECONDS.toNanos(baseMicros), TimeUnit.MICROSECONDS.toNanos(maxMicros));
    }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        return attempt < maxAttempts;
    }

    @Override
    public long backoffNanos(int attempt) {
        long delay = baseNanos * (1L << Math.min(20, Math.max(0, attempt - 1)));
        return Math.min(delay, maxNanos);
    }

    public int maxAttempts() { return maxAttempts; }
}
