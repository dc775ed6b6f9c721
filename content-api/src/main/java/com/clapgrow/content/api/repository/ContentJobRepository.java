package com.clapgrow.content.api.repository;

import com.clapgrow.content.api.entity.ContentJob;
import com.clapgrow.content.api.enums.JobStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContentJobRepository extends JpaRepository<ContentJob, UUID> {

    /**
     * Lock the job row for the rest of the transaction.
     * Used by RetryTracker so attempt numbers and retry_count are derived without races.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT j FROM ContentJob j WHERE j.id = :jobId")
    Optional<ContentJob> findByIdForUpdate(@Param("jobId") UUID jobId);

    /**
     * Atomically move a job from an expected status to a new one.
     * Returns 0 when the job is no longer in the expected status (concurrent change or cancellation).
     *
     * ⚠️ Must run in the same transaction as the JobStatusTransition insert.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ContentJob j SET j.status = :toStatus, j.updatedAt = :now " +
           "WHERE j.id = :jobId AND j.status = :expectedStatus")
    int atomicallyTransitionStatus(@Param("jobId") UUID jobId,
                                   @Param("expectedStatus") JobStatus expectedStatus,
                                   @Param("toStatus") JobStatus toStatus,
                                   @Param("now") LocalDateTime now);

    List<ContentJob> findByStatusOrderByCreatedAtAsc(JobStatus status, Pageable pageable);

    long countByStatus(JobStatus status);

    @Query("SELECT j.status AS status, COUNT(j) AS count FROM ContentJob j GROUP BY j.status")
    List<StatusCount> countGroupedByStatus();

    @Query("SELECT j.startedAt AS startedAt, j.completedAt AS completedAt FROM ContentJob j " +
           "WHERE j.status = com.clapgrow.content.api.enums.JobStatus.COMPLETED " +
           "AND j.completedAt >= :since AND j.startedAt IS NOT NULL")
    List<ProcessingSpan> findCompletedSpansSince(@Param("since") LocalDateTime since);

    long countByCreatedAtBetween(LocalDateTime start, LocalDateTime end);

    long countByStatusAndCreatedAtBetween(JobStatus status, LocalDateTime start, LocalDateTime end);

    long countByRetryCountGreaterThan(int retryCount);

    long countByStatusAndRetryCountGreaterThan(JobStatus status, int retryCount);

    @Query("SELECT COUNT(j) FROM ContentJob j WHERE j.status = com.clapgrow.content.api.enums.JobStatus.FAILED " +
           "AND j.retryCount < j.maxRetries")
    long countRetryableFailedJobs();

    @Query("SELECT COUNT(j) FROM ContentJob j WHERE j.retryCount > 0 AND j.retryCount >= j.maxRetries")
    long countJobsAtMaxRetries();

    @Query("SELECT COALESCE(AVG(j.retryCount), 0) FROM ContentJob j WHERE j.retryCount > 0")
    Double averageRetryCountOfRetriedJobs();

    interface StatusCount {
        JobStatus getStatus();
        Long getCount();
    }

    interface ProcessingSpan {
        LocalDateTime getStartedAt();
        LocalDateTime getCompletedAt();
    }
}
