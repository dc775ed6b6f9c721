package com.clapgrow.content.common.retry;

/**
 * Immutable retry policy configuration.
 *
 * Replaced as a whole (never mutated in place) so readers always see a consistent set of values.
 *
 * @param baseDelayMs       delay before the first retry
 * @param maxDelayMs        upper bound of the exponential backoff (before jitter)
 * @param backoffMultiplier growth factor per attempt (≥ 1.0)
 * @param jitterFactor      symmetric random jitter as a fraction of the delay (0.0 - 1.0)
 * @param maxAttempts       total attempts allowed, including the first one
 * @param timeoutMs         maximum span of a retry sequence
 */
public record RetryConfig(
    long baseDelayMs,
    long maxDelayMs,
    double backoffMultiplier,
    double jitterFactor,
    int maxAttempts,
    long timeoutMs
) {
    public static final long DEFAULT_BASE_DELAY_MS = 1000;
    public static final long DEFAULT_MAX_DELAY_MS = 30000;
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;
    public static final double DEFAULT_JITTER_FACTOR = 0.1;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_TIMEOUT_MS = 60000;

    public RetryConfig {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be >= 0");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    public static RetryConfig defaults() {
        return new RetryConfig(
            DEFAULT_BASE_DELAY_MS,
            DEFAULT_MAX_DELAY_MS,
            DEFAULT_BACKOFF_MULTIPLIER,
            DEFAULT_JITTER_FACTOR,
            DEFAULT_MAX_ATTEMPTS,
            DEFAULT_TIMEOUT_MS
        );
    }
}
