package com.clapgrow.content.api.dto;

import com.clapgrow.content.common.retry.FailureDescriptor;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.UUID;

/**
 * Raw failure of an external call as reported by a worker.
 */
@Data
public class RecordFailureRequest {

    @NotNull(message = "Job ID is required")
    private UUID jobId;

    /**
     * HTTP status of the failed call, 0 for network-level failures.
     */
    private Integer httpStatus;

    private String vendorCode;

    private String message;

    /**
     * Raw Retry-After header value (seconds or HTTP date).
     */
    private String retryAfter;

    /**
     * Caller may mark a failure non-retryable regardless of its category.
     */
    private Boolean retryable;

    /**
     * Dependency that failed ("generation-api" or "publishing-api"), optional.
     */
    private String service;

    public FailureDescriptor toDescriptor() {
        return new FailureDescriptor(httpStatus, vendorCode, message, retryAfter);
    }
}
