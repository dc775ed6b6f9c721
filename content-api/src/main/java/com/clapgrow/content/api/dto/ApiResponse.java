package com.clapgrow.content.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Standardized API response envelope.
 * 
 * Every response carries {@code success} and {@code timestamp}, an echo of the operative
 * identifiers ({@code action}, {@code jobId}, {@code service}) when present, and either a
 * {@code result} payload or an {@code error} message.
 * 
 * Example usage:
 * <pre>
 * {@code
 * return ResponseEntity.ok(ApiResponse.forJob("history", jobId, history));
 * return ResponseEntity.status(400).body(ApiResponse.error("Unknown action: foo"));
 * }
 * </pre>
 * 
 * @param <T> Type of the result payload
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
    boolean success,
    String action,
    String jobId,
    String service,
    T result,
    String error,
    String errorCode,
    LocalDateTime timestamp
) {
    public static <T> ApiResponse<T> success(T result) {
        return new ApiResponse<>(true, null, null, null, result, null, null, now());
    }

    public static <T> ApiResponse<T> success(String action, T result) {
        return new ApiResponse<>(true, action, null, null, result, null, null, now());
    }

    public static <T> ApiResponse<T> forJob(String action, UUID jobId, T result) {
        return new ApiResponse<>(true, action, jobId != null ? jobId.toString() : null, null, result, null, null, now());
    }

    public static <T> ApiResponse<T> forService(String action, String service, T result) {
        return new ApiResponse<>(true, action, null, service, result, null, null, now());
    }

    /**
     * Operation ran but reported a domain failure (rejected transition, denied admin retry).
     * The result payload is kept so callers can read the reason.
     */
    public static <T> ApiResponse<T> failure(String action, UUID jobId, T result, String error) {
        return new ApiResponse<>(false, action, jobId != null ? jobId.toString() : null, null, result, error, null, now());
    }

    public static <T> ApiResponse<T> error(String error) {
        return new ApiResponse<>(false, null, null, null, null, error, null, now());
    }

    public static <T> ApiResponse<T> error(String errorCode, String error) {
        return new ApiResponse<>(false, null, null, null, null, error, errorCode, now());
    }

    private static LocalDateTime now() {
        return LocalDateTime.now(ZoneOffset.UTC);
    }
}
