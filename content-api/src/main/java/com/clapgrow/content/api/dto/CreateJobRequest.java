package com.clapgrow.content.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateJobRequest {

    @NotBlank(message = "Topic is required")
    @Size(max = 500, message = "Topic must be at most 500 characters")
    private String topic;

    /**
     * Optional, defaults to retry.default-max-retries.
     */
    @Min(value = 0, message = "Max retries cannot be negative")
    @Max(value = 10, message = "Max retries cannot exceed 10")
    private Integer maxRetries;
}
