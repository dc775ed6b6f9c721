package com.clapgrow.content.common.retry;

/**
 * Raw failure as reported by an API client, before classification.
 *
 * All fields are optional. {@code retryAfter} is the raw header value
 * (delta-seconds or an HTTP date).
 */
public record FailureDescriptor(
    Integer httpStatus,
    String vendorCode,
    String message,
    String retryAfter
) {
    public static FailureDescriptor ofStatus(int httpStatus, String message) {
        return new FailureDescriptor(httpStatus, null, message, null);
    }

    public static FailureDescriptor ofMessage(String message) {
        return new FailureDescriptor(null, null, message, null);
    }
}
