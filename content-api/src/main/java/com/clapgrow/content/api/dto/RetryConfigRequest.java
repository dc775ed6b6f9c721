package com.clapgrow.content.api.dto;

import com.clapgrow.content.common.retry.RetryConfig;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Replacement retry configuration. All fields are required so the swap is all-or-nothing.
 */
@Data
public class RetryConfigRequest {

    @NotNull
    @Min(0)
    private Long baseDelayMs;

    @NotNull
    @Min(0)
    private Long maxDelayMs;

    @NotNull
    @DecimalMin("1.0")
    private Double backoffMultiplier;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double jitterFactor;

    @NotNull
    @Min(1)
    private Integer maxAttempts;

    @NotNull
    @Min(1)
    private Long timeoutMs;

    public RetryConfig toRetryConfig() {
        return new RetryConfig(baseDelayMs, maxDelayMs, backoffMultiplier, jitterFactor, maxAttempts, timeoutMs);
    }
}
