package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.JobStatus;

import java.util.Map;

/**
 * @param averageProcessingTimeMs mean start-to-completion time of jobs completed in the last 30 days, null if none
 */
public record StatusStatistics(
    Map<JobStatus, Long> countsByStatus,
    long totalJobs,
    Double averageProcessingTimeMs
) {
}
