package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.JobStatus;

import java.util.UUID;

/**
 * Outcome of a status transition. Illegal transitions are reported here with {@code success=false}
 * rather than thrown.
 */
public record TransitionResult(
    boolean success,
    UUID jobId,
    JobStatus fromStatus,
    JobStatus toStatus,
    boolean forced,
    Long transitionId,
    String error
) {
    public static TransitionResult applied(UUID jobId, JobStatus from, JobStatus to, boolean forced, Long transitionId) {
        return new TransitionResult(true, jobId, from, to, forced, transitionId, null);
    }

    public static TransitionResult rejected(UUID jobId, JobStatus from, JobStatus to, String error) {
        return new TransitionResult(false, jobId, from, to, false, null, error);
    }
}
