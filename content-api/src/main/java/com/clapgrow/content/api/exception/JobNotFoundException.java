package com.clapgrow.content.api.exception;

import java.util.UUID;

public class JobNotFoundException extends ResourceNotFoundException {

    private final UUID jobId;

    public JobNotFoundException(UUID jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
