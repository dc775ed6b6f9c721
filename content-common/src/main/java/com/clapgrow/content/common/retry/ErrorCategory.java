package com.clapgrow.content.common.retry;

/**
 * Failure taxonomy for calls to the generation and publishing APIs.
 *
 * Each category declares whether it is worth retrying and whether it counts
 * against the dependency's circuit breaker:
 * - Caller/content errors (AUTH, VALIDATION, CONTENT_POLICY, MODEL) are never retried
 *   and never trip the breaker
 * - RATE_LIMIT is retried (honouring the server's retry-after) but is not a sign of
 *   dependency unavailability
 * - NETWORK, TIMEOUT and SERVER are retried and count towards the breaker
 * - UNKNOWN is retried conservatively and does not trip the breaker
 */
public enum ErrorCategory {
    /**
     * Invalid or revoked credentials (401/403).
     */
    AUTH(false, false, "Authentication with the external service failed. Check the configured credentials."),

    /**
     * Quota or request rate exceeded (429).
     */
    RATE_LIMIT(true, false, "The external service is rate limiting requests. The job will be retried later."),

    /**
     * Malformed or rejected request (400).
     */
    VALIDATION(false, false, "The request was rejected as invalid by the external service."),

    /**
     * Request refused by the provider's content policy.
     */
    CONTENT_POLICY(false, false, "The content was rejected by the provider's content policy."),

    /**
     * Requested model does not exist or is unavailable to this account.
     */
    MODEL(false, false, "The requested model is not available."),

    /**
     * Connection reset, refused or unresolved host.
     */
    NETWORK(true, true, "A network error occurred while contacting the external service."),

    /**
     * Request or connection timed out.
     */
    TIMEOUT(true, true, "The external service did not respond in time."),

    /**
     * 5xx response from the external service.
     */
    SERVER(true, true, "The external service reported an internal error."),

    /**
     * Failure that matched no known pattern.
     */
    UNKNOWN(true, false, "An unexpected error occurred while processing the job.");

    private final boolean retryable;
    private final boolean countsTowardsBreaker;
    private final String userMessage;

    ErrorCategory(boolean retryable, boolean countsTowardsBreaker, String userMessage) {
        this.retryable = retryable;
        this.countsTowardsBreaker = countsTowardsBreaker;
        this.userMessage = userMessage;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Whether a failure of this category indicates dependency unavailability.
     */
    public boolean countsTowardsBreaker() {
        return countsTowardsBreaker;
    }

    /**
     * Human-readable description safe to return to API callers.
     */
    public String getUserMessage() {
        return userMessage;
    }
}
