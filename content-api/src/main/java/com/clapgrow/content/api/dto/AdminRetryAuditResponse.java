package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.entity.AdminRetryAudit;
import com.clapgrow.content.api.enums.AdminRetryType;
import com.clapgrow.content.api.enums.AdminRole;
import com.clapgrow.content.api.enums.JobStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public record AdminRetryAuditResponse(
    UUID id,
    UUID jobId,
    String adminUserId,
    AdminRole adminRole,
    AdminRetryType retryType,
    String reason,
    boolean forceOverride,
    JobStatus previousStatus,
    JobStatus newStatus,
    int previousRetryCount,
    int newRetryCount,
    Long customDelayMs,
    String ineligibilityReason,
    List<String> warnings,
    LocalDateTime createdAt
) {
    public static AdminRetryAuditResponse from(AdminRetryAudit audit) {
        return new AdminRetryAuditResponse(
            audit.getId(),
            audit.getJobId(),
            audit.getAdminUserId(),
            audit.getAdminRole(),
            audit.getRetryType(),
            audit.getReason(),
            Boolean.TRUE.equals(audit.getForceOverride()),
            audit.getPreviousStatus(),
            audit.getNewStatus(),
            audit.getPreviousRetryCount(),
            audit.getNewRetryCount(),
            audit.getCustomDelayMs(),
            audit.getIneligibilityReason(),
            audit.getWarnings(),
            audit.getCreatedAt()
        );
    }
}
