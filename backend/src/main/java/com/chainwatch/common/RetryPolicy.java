package com.chainwatch.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with ±jitter for transient store failures in the ingestion loop.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds for the given zero-based attempt.
     * Formula: baseDelay * 2^attempt, then ±jitter. Attempts past maxAttempts stay at the ceiling.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return jitter(baseDelayMs);
        }
        int capped = Math.min(attempt, Math.max(0, maxAttempts - 1));
        long exponential = baseDelayMs * (1L << Math.min(capped, 20));
        return jitter(exponential);
    }

    private long jitter(long value) {
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default: 500ms base, ±20% jitter, 5 attempts before the delay stops growing.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(500L, 0.2, 5);
    }
}
