package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.JobStatus;

import java.util.List;
import java.util.UUID;

public record RetryHistory(
    UUID jobId,
    JobStatus status,
    int retryCount,
    int maxRetries,
    List<RetryAttemptResponse> attempts
) {
}
