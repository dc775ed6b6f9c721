package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.AttemptOutcome;
import com.clapgrow.content.common.retry.ErrorCategory;

import java.util.UUID;

/**
 * Result of appending an attempt to a job's retry log.
 *
 * @param nextDelayMs              delay before the next attempt, 0 when no further retry
 * @param eligibleForFurtherRetry  whether the job may be requeued
 * @param userMessage              human-readable message derived from the error category
 *
 * An ignored result has attempt number 0 and no outcome: nothing was appended.
 */
public record RetryRecordResult(
    UUID jobId,
    int attemptNumber,
    AttemptOutcome outcome,
    int retryCount,
    int maxRetries,
    long nextDelayMs,
    boolean eligibleForFurtherRetry,
    ErrorCategory errorCategory,
    String reason,
    String userMessage
) {
    public static RetryRecordResult ignored(UUID jobId, int retryCount, int maxRetries, String reason) {
        return new RetryRecordResult(jobId, 0, null, retryCount, maxRetries, 0, false, null, reason, null);
    }
}
