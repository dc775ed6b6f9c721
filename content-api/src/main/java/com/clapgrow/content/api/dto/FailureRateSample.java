package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.TimeWindow;

/**
 * Aggregate failure rate over a time window; input to the alerting engine.
 */
public record FailureRateSample(TimeWindow timeWindow, long totalJobs, long failedJobs, double failureRate) {

    public FailureRateSample {
        if (timeWindow == null) {
            throw new IllegalArgumentException("Time window is required");
        }
        if (totalJobs < 0 || failedJobs < 0) {
            throw new IllegalArgumentException("Job counts cannot be negative");
        }
        if (failedJobs > totalJobs) {
            throw new IllegalArgumentException("Failed jobs cannot exceed total jobs");
        }
        if (failureRate < 0 || failureRate > 1 || Double.isNaN(failureRate)) {
            throw new IllegalArgumentException("Failure rate must be between 0 and 1");
        }
    }

    public static FailureRateSample of(TimeWindow timeWindow, long totalJobs, long failedJobs) {
        double rate = totalJobs > 0 ? (double) failedJobs / totalJobs : 0.0;
        return new FailureRateSample(timeWindow, totalJobs, failedJobs, rate);
    }
}
