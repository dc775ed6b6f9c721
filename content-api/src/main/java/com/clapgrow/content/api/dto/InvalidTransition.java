package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.JobStatus;

public record InvalidTransition(JobStatus fromStatus, JobStatus toStatus, String reason) {
}
