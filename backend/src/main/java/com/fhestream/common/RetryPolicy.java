package com.fhestream.common;

/**
 * Exponential backoff with a delay ceiling and an attempt limit.
 * Used by push-mode reconnects.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final int maxAttempts;
    private final long maxDelayMs;

    public RetryPolicy(long baseDelayMs, int maxAttempts, long maxDelayMs) {
        this.baseDelayMs = baseDelayMs;
        this.maxAttempts = maxAttempts;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * Delay in milliseconds for the given zero-based attempt.
     * Formula: min(baseDelay * 2^attempt, maxDelay).
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return Math.min(baseDelayMs, maxDelayMs);
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return Math.min(exponential, maxDelayMs);
    }

    /** True when another attempt is allowed after {@code failedAttempts} failures. */
    public boolean canRetry(int failedAttempts) {
        return failedAttempts < maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Reconnection schedule: 1s base, doubling, 30s ceiling, give up after 10 attempts.
     */
    public static RetryPolicy reconnectPolicy() {
        return new RetryPolicy(1000L, 10, 30_000L);
    }
}
