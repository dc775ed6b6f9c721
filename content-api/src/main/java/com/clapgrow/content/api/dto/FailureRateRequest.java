package com.clapgrow.content.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Failure-rate sample submitted for evaluation. When {@code failureRate} is omitted it is
 * derived from the job counts.
 */
@Data
public class FailureRateRequest {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double failureRate;

    @NotNull(message = "Total jobs is required")
    @Min(0)
    private Long totalJobs;

    @NotNull(message = "Failed jobs is required")
    @Min(0)
    private Long failedJobs;

    private String timeWindow;
}
