package com.clapgrow.content.api.dto;

/**
 * @param retrySuccessRate share of retried jobs that eventually completed, 0 when none were retried
 */
public record RetryStatistics(
    long totalJobsWithRetries,
    long retryableJobs,
    long maxRetriesReached,
    double averageRetryCount,
    double retrySuccessRate
) {
}
