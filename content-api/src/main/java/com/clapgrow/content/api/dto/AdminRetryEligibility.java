package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.JobStatus;

import java.util.List;
import java.util.UUID;

public record AdminRetryEligibility(
    UUID jobId,
    boolean eligible,
    JobStatus status,
    int retryCount,
    int maxRetries,
    long manualRetryCount,
    String reason,
    List<String> warnings
) {
}
