package com.clapgrow.content.api.entity;

import com.clapgrow.content.api.enums.AdminRetryType;
import com.clapgrow.content.api.enums.AdminRole;
import com.clapgrow.content.api.enums.AttemptOutcome;
import com.clapgrow.content.api.enums.TransitionActor;
import com.clapgrow.content.common.retry.ErrorCategory;
import com.clapgrow.content.common.service.ExternalService;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only log of job attempts and their outcomes, owned by RetryTracker.
 * attempt_number is strictly increasing per job (enforced by the unique constraint).
 */
@Entity
@Table(name = "job_retry_attempts",
    uniqueConstraints = @UniqueConstraint(name = "uk_job_retry_attempts_job_attempt", columnNames = {"job_id", "attempt_number"}),
    indexes = {
        @Index(name = "idx_job_retry_attempts_job_id", columnList = "job_id"),
        @Index(name = "idx_job_retry_attempts_created_at", columnList = "created_at")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RetryAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "attempt_number", nullable = false)
    private Integer attemptNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_category", length = 30)
    private ErrorCategory errorCategory;

    @Column(name = "retryable", nullable = false)
    private Boolean retryable = false;

    @Column(name = "http_status")
    private Integer httpStatus;

    /**
     * Sanitized error message (credentials masked, max 1000 characters).
     */
    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "delay_applied_ms", nullable = false)
    private Long delayAppliedMs = 0L;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 20)
    private AttemptOutcome outcome;

    @Enumerated(EnumType.STRING)
    @Column(name = "service", length = 30)
    private ExternalService service;

    @Enumerated(EnumType.STRING)
    @Column(name = "actor", nullable = false, length = 20)
    private TransitionActor actor = TransitionActor.SYSTEM;

    @Column(name = "admin_user_id", length = 100)
    private String adminUserId;

    @Enumerated(EnumType.STRING)
    @Column(name = "admin_role", length = 30)
    private AdminRole adminRole;

    @Enumerated(EnumType.STRING)
    @Column(name = "admin_retry_type", length = 30)
    private AdminRetryType adminRetryType;

    @Column(name = "reason", columnDefinition = "TEXT")
    private String reason;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
