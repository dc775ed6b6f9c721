package com.clapgrow.content.common.retry;

/**
 * Closed error type produced once by {@link ErrorClassifier} and consumed by the
 * retry policy, circuit breaker, retry tracker and HTTP layer.
 *
 * @param category      failure category
 * @param httpStatus    HTTP status of the failed call, if any
 * @param vendorCode    provider-specific error code, if any
 * @param retryAfterMs  server-suggested delay in milliseconds, if any
 * @param message       original error message (may contain vendor detail, never shown to users as-is)
 */
public record ClassifiedError(
    ErrorCategory category,
    Integer httpStatus,
    String vendorCode,
    Long retryAfterMs,
    String message
) {
    public ClassifiedError {
        if (category == null) {
            throw new IllegalArgumentException("Error category is required");
        }
    }

    public static ClassifiedError of(ErrorCategory category, String message) {
        return new ClassifiedError(category, null, null, null, message);
    }

    public boolean retryable() {
        return category.isRetryable();
    }

    public boolean countsTowardsBreaker() {
        return category.countsTowardsBreaker();
    }

    public boolean hasRetryAfter() {
        return retryAfterMs != null && retryAfterMs > 0;
    }

    /**
     * Message derived from the category, safe for API responses.
     */
    public String userMessage() {
        return category.getUserMessage();
    }
}
