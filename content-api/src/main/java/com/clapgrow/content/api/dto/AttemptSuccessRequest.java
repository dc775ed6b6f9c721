package com.clapgrow.content.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AttemptSuccessRequest {

    @NotBlank(message = "Service is required")
    private String service;

    private String title;

    private String content;

    private String postId;

    @Min(0)
    private Long actualTokens;

    @Min(0)
    private Long reservedTokens;

    @Min(0)
    private long responseTimeMs;

    /**
     * Marks the job completed; false for an intermediate step (e.g. generation before publishing).
     */
    private boolean finalStep = true;
}
