package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.entity.ContentJob;
import com.clapgrow.content.api.enums.JobStatus;
import com.clapgrow.content.common.retry.ErrorCategory;

import java.time.LocalDateTime;
import java.util.UUID;

public record JobResponse(
    UUID id,
    String topic,
    JobStatus status,
    int retryCount,
    int maxRetries,
    boolean maxRetriesOverridden,
    String generatedTitle,
    String publishedPostId,
    String lastError,
    ErrorCategory lastErrorCategory,
    LocalDateTime createdAt,
    LocalDateTime updatedAt,
    LocalDateTime startedAt,
    LocalDateTime completedAt,
    LocalDateTime failedAt,
    LocalDateTime cancelledAt,
    LocalDateTime nextRetryAt
) {
    public static JobResponse from(ContentJob job) {
        return new JobResponse(
            job.getId(),
            job.getTopic(),
            job.getStatus(),
            job.getRetryCount() != null ? job.getRetryCount() : 0,
            job.getMaxRetries() != null ? job.getMaxRetries() : 0,
            Boolean.TRUE.equals(job.getMaxRetriesOverridden()),
            job.getGeneratedTitle(),
            job.getPublishedPostId(),
            job.getLastError(),
            job.getLastErrorCategory(),
            job.getCreatedAt(),
            job.getUpdatedAt(),
            job.getStartedAt(),
            job.getCompletedAt(),
            job.getFailedAt(),
            job.getCancelledAt(),
            job.getNextRetryAt()
        );
    }
}
