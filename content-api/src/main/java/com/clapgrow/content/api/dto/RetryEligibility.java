package com.clapgrow.content.api.dto;

import com.clapgrow.content.common.retry.ErrorCategory;

import java.util.UUID;

public record RetryEligibility(
    UUID jobId,
    boolean canRetry,
    String reason,
    int retryCount,
    int maxRetries,
    int failedAttempts,
    long elapsedMs,
    ErrorCategory lastErrorCategory,
    long nextDelayMs
) {
}
