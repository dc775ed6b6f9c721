package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.JobStatus;

import java.util.UUID;

/**
 * Outcome of reporting an attempt result.
 * 
 * @param ignored true when the job was already terminal and the late outcome was dropped
 * @param retry   retry log entry for failures, null for successes and ignored outcomes
 */
public record AttemptOutcomeResult(
    UUID jobId,
    boolean ignored,
    JobStatus jobStatus,
    RetryRecordResult retry,
    String userMessage
) {
}
