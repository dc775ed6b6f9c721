package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.JobStatus;

import java.util.List;
import java.util.UUID;

public record ConsistencyReport(
    UUID jobId,
    boolean consistent,
    JobStatus currentStatus,
    JobStatus lastTransitionStatus,
    int transitionCount,
    List<String> issues
) {
}
