package com.clapgrow.content.api.entity;

import com.clapgrow.content.api.enums.JobStatus;
import com.clapgrow.content.common.retry.ErrorCategory;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "content_jobs", indexes = {
    @Index(name = "idx_content_jobs_status", columnList = "status"),
    @Index(name = "idx_content_jobs_created_at", columnList = "created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ContentJob extends BaseAuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "topic", nullable = false, length = 500)
    private String topic;

    /**
     * Current lifecycle status.
     *
     * Only mutated through JobStatusManager, which validates the transition and appends
     * a row to job_status_transitions in the same transaction.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status = JobStatus.PENDING;

    /**
     * Number of failed attempts recorded by RetryTracker.
     * Never exceeds max_retries unless an admin override raised max_retries.
     */
    @Column(name = "retry_count", nullable = false)
    private Integer retryCount = 0;

    @Column(name = "max_retries", nullable = false)
    private Integer maxRetries = 3;

    @Column(name = "max_retries_overridden", nullable = false)
    private Boolean maxRetriesOverridden = false;

    @Column(name = "generated_title", length = 500)
    private String generatedTitle;

    @Column(name = "generated_content", columnDefinition = "TEXT")
    private String generatedContent;

    @Column(name = "published_post_id", length = 100)
    private String publishedPostId;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_error_category", length = 30)
    private ErrorCategory lastErrorCategory;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "failed_at")
    private LocalDateTime failedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "next_retry_at")
    private LocalDateTime nextRetryAt;

    public ContentJob(String topic, int maxRetries) {
        this.topic = topic;
        this.maxRetries = maxRetries;
        this.status = JobStatus.PENDING;
        this.retryCount = 0;
        this.maxRetriesOverridden = false;
    }
}
