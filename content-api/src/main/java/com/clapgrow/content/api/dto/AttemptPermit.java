package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.JobStatus;

import java.util.UUID;

/**
 * Answer to "may this job call the dependency now".
 * 
 * {@code shortCircuited} means the circuit breaker refused the call and no request was made;
 * it is reported separately from a recorded failure. {@code rateLimited} means the quota was full.
 * 
 * @param reservedTokens tokens reserved against the quota; report back with the outcome
 */
public record AttemptPermit(
    UUID jobId,
    boolean allowed,
    boolean shortCircuited,
    boolean rateLimited,
    boolean probe,
    long waitTimeMs,
    long reservedTokens,
    JobStatus jobStatus,
    String reason
) {
    public static AttemptPermit granted(UUID jobId, boolean probe, long reservedTokens, JobStatus status) {
        return new AttemptPermit(jobId, true, false, false, probe, 0, reservedTokens, status, "Attempt started");
    }

    public static AttemptPermit shortCircuited(UUID jobId, long waitTimeMs, JobStatus status, String reason) {
        return new AttemptPermit(jobId, false, true, false, false, waitTimeMs, 0, status, reason);
    }

    public static AttemptPermit rateLimited(UUID jobId, long waitTimeMs, JobStatus status, String reason) {
        return new AttemptPermit(jobId, false, false, true, false, waitTimeMs, 0, status, reason);
    }

    public static AttemptPermit refused(UUID jobId, JobStatus status, String reason) {
        return new AttemptPermit(jobId, false, false, false, false, 0, 0, status, reason);
    }
}
