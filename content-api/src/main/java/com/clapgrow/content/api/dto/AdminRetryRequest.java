package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.AdminRetryType;
import com.clapgrow.content.api.enums.AdminRole;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Privileged retry request. Transient: validated against the permission table and job
 * eligibility before anything is written.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AdminRetryRequest {

    @NotNull(message = "Job ID is required")
    private UUID jobId;

    @NotBlank(message = "Admin user ID is required")
    @Size(max = 100)
    private String adminUserId;

    @NotNull(message = "Admin role is required")
    private AdminRole adminRole;

    @NotNull(message = "Retry type is required")
    private AdminRetryType retryType;

    @NotBlank(message = "Reason is required")
    private String reason;

    private boolean forceOverride;

    /**
     * Reset the retry count to 0 in addition to the retry type's own effect.
     */
    private boolean resetRetryCount;

    @PositiveOrZero
    private Long customDelayMs;
}
