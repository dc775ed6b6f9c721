package com.clapgrow.content.api.entity;

import com.clapgrow.content.api.enums.AdminRetryType;
import com.clapgrow.content.api.enums.AdminRole;
import com.clapgrow.content.api.enums.JobStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Audit record of an executed admin retry.
 * Denied requests are not persisted (they have no side effects).
 */
@Entity
@Table(name = "admin_retry_audit", indexes = {
    @Index(name = "idx_admin_retry_audit_job_id", columnList = "job_id"),
    @Index(name = "idx_admin_retry_audit_created_at", columnList = "created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AdminRetryAudit {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "admin_user_id", nullable = false, length = 100)
    private String adminUserId;

    @Enumerated(EnumType.STRING)
    @Column(name = "admin_role", nullable = false, length = 30)
    private AdminRole adminRole;

    @Enumerated(EnumType.STRING)
    @Column(name = "retry_type", nullable = false, length = 30)
    private AdminRetryType retryType;

    @Column(name = "reason", nullable = false, columnDefinition = "TEXT")
    private String reason;

    @Column(name = "force_override", nullable = false)
    private Boolean forceOverride = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status", nullable = false, length = 20)
    private JobStatus previousStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status", nullable = false, length = 20)
    private JobStatus newStatus;

    @Column(name = "previous_retry_count", nullable = false)
    private Integer previousRetryCount;

    @Column(name = "new_retry_count", nullable = false)
    private Integer newRetryCount;

    @Column(name = "custom_delay_ms")
    private Long customDelayMs;

    /**
     * Eligibility failure that force_override bypassed, if any.
     */
    @Column(name = "ineligibility_reason", columnDefinition = "TEXT")
    private String ineligibilityReason;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "warnings", columnDefinition = "jsonb")
    private List<String> warnings;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
