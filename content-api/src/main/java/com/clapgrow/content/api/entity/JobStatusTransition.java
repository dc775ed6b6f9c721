package com.clapgrow.content.api.entity;

import com.clapgrow.content.api.enums.AdminRole;
import com.clapgrow.content.api.enums.JobStatus;
import com.clapgrow.content.api.enums.TransitionActor;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit trail of job status changes.
 * Rows are written in the same transaction as the status update they describe.
 * The identity id gives insertion order.
 */
@Entity
@Table(name = "job_status_transitions", indexes = {
    @Index(name = "idx_job_status_transitions_job_id", columnList = "job_id"),
    @Index(name = "idx_job_status_transitions_timestamp", columnList = "timestamp")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusTransition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", length = 20)
    private JobStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false, length = 20)
    private JobStatus toStatus;

    @Column(name = "reason", columnDefinition = "TEXT")
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "actor", nullable = false, length = 20)
    private TransitionActor actor;

    /**
     * true when an admin executed a transition the FSM would otherwise reject.
     */
    @Column(name = "force_override", nullable = false)
    private Boolean forceOverride = false;

    @Column(name = "admin_user_id", length = 100)
    private String adminUserId;

    @Enumerated(EnumType.STRING)
    @Column(name = "admin_role", length = 30)
    private AdminRole adminRole;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    private Map<String, Object> metadata;

    @Column(name = "timestamp", nullable = false)
    private LocalDateTime timestamp;
}
