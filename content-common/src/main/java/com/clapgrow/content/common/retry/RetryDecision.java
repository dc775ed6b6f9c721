package com.clapgrow.content.common.retry;

/**
 * Outcome of a retry policy evaluation.
 *
 * @param shouldRetry whether another attempt is allowed
 * @param delayMs     delay before the next attempt (0 when no retry)
 * @param reason      human-readable explanation
 */
public record RetryDecision(boolean shouldRetry, long delayMs, String reason) {

    public static RetryDecision retryAfter(long delayMs, String reason) {
        return new RetryDecision(true, delayMs, reason);
    }

    public static RetryDecision stop(String reason) {
        return new RetryDecision(false, 0, reason);
    }
}
