package com.celia.orchestrator.resilience;

import java.time.Duration;

/**
 * Exponential backoff settings.
 *
 * The wait before attempt {@code k + 1} is
 * {@code min(baseDelay * exponentialBase^(k - 1), maxDelay)}.
 *
 * @param maxAttempts     total attempts including the first one
 * @param baseDelay       wait after the first failed attempt
 * @param maxDelay        upper bound on any single wait
 * @param exponentialBase growth factor between consecutive waits
 */
public record RetryConfig(
        int      maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        double   exponentialBase
) {
    public static final RetryConfig DEFAULT =
            new RetryConfig(3, Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0);

    public RetryConfig {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1");
        if (baseDelay == null || baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay must be non-negative");
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        if (exponentialBase < 1.0) throw new IllegalArgumentException("exponentialBase must be >= 1.0");
    }

    /**
     * Wait to apply after attempt {@code failedAttempt} (1-based) has failed.
     */
    public Duration delayAfter(int failedAttempt) {
        double nanos = baseDelay.toNanos() * Math.pow(exponentialBase, Math.max(0, failedAttempt - 1));
        if (nanos >= maxDelay.toNanos()) {
            return maxDelay;
        }
        return Duration.ofNanos((long) nanos);
    }
}
