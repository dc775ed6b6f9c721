package com.clapgrow.content.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class RecordUsageRequest {

    @NotBlank(message = "Service is required")
    private String service;

    @Min(0)
    private Long actualTokens;

    @Min(0)
    private Long reservedTokens;

    @Min(0)
    private long responseTimeMs;

    @NotNull(message = "Success flag is required")
    private Boolean success;
}
