package com.clapgrow.content.api.repository;

import com.clapgrow.content.api.entity.RetryAttempt;
import com.clapgrow.content.api.enums.JobStatus;
import com.clapgrow.content.api.enums.TransitionActor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface RetryAttemptRepository extends JpaRepository<RetryAttempt, UUID> {

    List<RetryAttempt> findByJobIdOrderByAttemptNumberAsc(UUID jobId);

    @Query("SELECT COALESCE(MAX(a.attemptNumber), 0) FROM RetryAttempt a WHERE a.jobId = :jobId")
    int findMaxAttemptNumber(@Param("jobId") UUID jobId);

    long countByJobIdAndActorAndCreatedAtAfter(UUID jobId, TransitionActor actor, LocalDateTime since);

    /**
     * Purge attempt rows of jobs at rest in one of the given statuses.
     * Callers must never pass PENDING or PROCESSING.
     */
    @Modifying
    @Query("DELETE FROM RetryAttempt a WHERE a.createdAt < :cutoff AND a.jobId IN " +
           "(SELECT j.id FROM ContentJob j WHERE j.status IN :statuses)")
    int deleteAttemptsOlderThanForStatuses(@Param("cutoff") LocalDateTime cutoff,
                                           @Param("statuses") Collection<JobStatus> statuses);
}
