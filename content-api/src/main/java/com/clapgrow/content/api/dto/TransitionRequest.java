package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.JobStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.UUID;

@Data
public class TransitionRequest {

    @NotNull(message = "Job ID is required")
    private UUID jobId;

    @NotNull(message = "Target status is required")
    private JobStatus toStatus;

    private String reason;
}
