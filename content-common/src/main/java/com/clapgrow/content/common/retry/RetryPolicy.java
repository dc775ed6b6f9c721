package com.clapgrow.content.common.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Computes backoff delays and retry eligibility. Pure function of its inputs and configuration.
 *
 * Delay for attempt {@code n} (1-based):
 * <pre>
 * delay = min(maxDelay, baseDelay * multiplier^(n-1))
 * delay += uniform(-jitterFactor, +jitterFactor) * delay
 * </pre>
 * Rate-limit errors carrying a server retry-after use that value instead.
 *
 * Eligibility requires a retryable category, a next attempt number within maxAttempts
 * and an elapsed time below the configured timeout.
 */
public class RetryPolicy {

    private final RetryConfig config;
    private final DoubleSupplier random;

    public RetryPolicy(RetryConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of uniformly distributed values in [0, 1)
     */
    public RetryPolicy(RetryConfig config, DoubleSupplier random) {
        if (config == null) {
            throw new IllegalArgumentException("Retry config is required");
        }
        this.config = config;
        this.random = random;
    }

    public RetryConfig getConfig() {
        return config;
    }

    /**
     * Exponential backoff without jitter, capped at maxDelay.
     *
     * @param attempt 1-based attempt number
     */
    public long computeBaseDelay(int attempt) {
        int exponent = Math.max(0, attempt - 1);
        double raw = config.baseDelayMs() * Math.pow(config.backoffMultiplier(), exponent);
        if (Double.isInfinite(raw) || raw > config.maxDelayMs()) {
            return config.maxDelayMs();
        }
        return (long) raw;
    }

    /**
     * Backoff with symmetric jitter applied.
     *
     * @param attempt 1-based attempt number
     */
    public long computeDelay(int attempt) {
        long delay = computeBaseDelay(attempt);
        if (config.jitterFactor() <= 0 || delay == 0) {
            return delay;
        }
        double offset = (random.getAsDouble() * 2 - 1) * config.jitterFactor() * delay;
        return Math.max(0, Math.round(delay + offset));
    }

    /**
     * Delay for a classified error. Server-provided retry-after wins for rate limits.
     */
    public long computeDelay(ClassifiedError error, int attempt) {
        if (error != null && error.category() == ErrorCategory.RATE_LIMIT && error.hasRetryAfter()) {
            return error.retryAfterMs();
        }
        return computeDelay(attempt);
    }

    /**
     * @param error         classified error of the last failure
     * @param failedAttempt 1-based number of the attempt that just failed
     * @param elapsedMs     time spent in the retry sequence so far
     */
    public boolean shouldRetry(ClassifiedError error, int failedAttempt, long elapsedMs) {
        return evaluate(error, failedAttempt, elapsedMs).shouldRetry();
    }

    public boolean isRetryable(ErrorCategory category) {
        return category != null && category.isRetryable();
    }

    /**
     * Decide whether the attempt following {@code failedAttempt} may run and how long to wait.
     * The next attempt number ({@code failedAttempt + 1}) must not exceed maxAttempts.
     */
    public RetryDecision evaluate(ClassifiedError error, int failedAttempt, long elapsedMs) {
        if (error == null) {
            return RetryDecision.stop("No error to retry");
        }
        if (!isRetryable(error.category())) {
            return RetryDecision.stop("Error category " + error.category() + " is not retryable");
        }
        int nextAttempt = failedAttempt + 1;
        if (nextAttempt > config.maxAttempts()) {
            return RetryDecision.stop(String.format(
                "Attempt %d would exceed max attempts (%d)", nextAttempt, config.maxAttempts()));
        }
        if (elapsedMs >= config.timeoutMs()) {
            return RetryDecision.stop(String.format(
                "Retry sequence exceeded timeout (%d ms >= %d ms)", elapsedMs, config.timeoutMs()));
        }
        long delay = computeDelay(error, failedAttempt);
        return RetryDecision.retryAfter(delay, String.format(
            "Retrying %s failure (attempt %d of %d)", error.category(), nextAttempt, config.maxAttempts()));
    }
}
