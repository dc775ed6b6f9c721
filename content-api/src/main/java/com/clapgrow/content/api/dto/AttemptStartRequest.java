package com.clapgrow.content.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AttemptStartRequest {

    @NotBlank(message = "Service is required")
    private String service;

    @Min(0)
    private Long estimatedTokens;
}
