package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.entity.RetryAttempt;
import com.clapgrow.content.api.enums.AdminRetryType;
import com.clapgrow.content.api.enums.AdminRole;
import com.clapgrow.content.api.enums.AttemptOutcome;
import com.clapgrow.content.api.enums.TransitionActor;
import com.clapgrow.content.common.retry.ErrorCategory;
import com.clapgrow.content.common.service.ExternalService;

import java.time.LocalDateTime;
import java.util.UUID;

public record RetryAttemptResponse(
    UUID id,
    int attemptNumber,
    AttemptOutcome outcome,
    ErrorCategory errorCategory,
    boolean retryable,
    Integer httpStatus,
    String errorMessage,
    long delayAppliedMs,
    ExternalService service,
    TransitionActor actor,
    String adminUserId,
    AdminRole adminRole,
    AdminRetryType adminRetryType,
    String reason,
    LocalDateTime createdAt
) {
    public static RetryAttemptResponse from(RetryAttempt attempt) {
        return new RetryAttemptResponse(
            attempt.getId(),
            attempt.getAttemptNumber(),
            attempt.getOutcome(),
            attempt.getErrorCategory(),
            Boolean.TRUE.equals(attempt.getRetryable()),
            attempt.getHttpStatus(),
            attempt.getErrorMessage(),
            attempt.getDelayAppliedMs() != null ? attempt.getDelayAppliedMs() : 0L,
            attempt.getService(),
            attempt.getActor(),
            attempt.getAdminUserId(),
            attempt.getAdminRole(),
            attempt.getAdminRetryType(),
            attempt.getReason(),
            attempt.getCreatedAt()
        );
    }
}
