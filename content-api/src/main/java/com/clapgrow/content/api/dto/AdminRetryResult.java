package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.AdminRetryType;
import com.clapgrow.content.api.enums.JobStatus;

import java.util.List;
import java.util.UUID;

/**
 * @param ineligibilityReason why the job would normally have been refused; set when force_override bypassed it
 */
public record AdminRetryResult(
    boolean success,
    boolean permissionGranted,
    UUID jobId,
    AdminRetryType retryType,
    JobStatus previousStatus,
    JobStatus newStatus,
    int previousRetryCount,
    int newRetryCount,
    int maxRetries,
    long delayMs,
    boolean forced,
    String ineligibilityReason,
    List<String> warnings,
    String error
) {
    public static AdminRetryResult denied(AdminRetryRequest request, String error) {
        return new AdminRetryResult(false, false, request.getJobId(), request.getRetryType(),
            null, null, 0, 0, 0, 0, false, null, List.of(), error);
    }

    public static AdminRetryResult ineligible(AdminRetryRequest request, JobStatus status, int retryCount,
                                              int maxRetries, String error, List<String> warnings) {
        return new AdminRetryResult(false, true, request.getJobId(), request.getRetryType(),
            status, status, retryCount, retryCount, maxRetries, 0, false, error, warnings, error);
    }
}
