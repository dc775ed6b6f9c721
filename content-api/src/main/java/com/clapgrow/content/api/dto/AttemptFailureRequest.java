package com.clapgrow.content.api.dto;

import com.clapgrow.content.common.retry.FailureDescriptor;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AttemptFailureRequest {

    @NotBlank(message = "Service is required")
    private String service;

    private Integer httpStatus;

    private String vendorCode;

    private String message;

    private String retryAfter;

    @Min(0)
    private Long reservedTokens;

    @Min(0)
    private long responseTimeMs;

    public FailureDescriptor toDescriptor() {
        return new FailureDescriptor(httpStatus, vendorCode, message, retryAfter);
    }
}
