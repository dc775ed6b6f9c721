package com.clapgrow.content.api.repository;

import com.clapgrow.content.api.entity.AdminRetryAudit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface AdminRetryAuditRepository extends JpaRepository<AdminRetryAudit, UUID> {

    long countByJobId(UUID jobId);

    long countByJobIdAndCreatedAtAfter(UUID jobId, LocalDateTime since);

    boolean existsByJobIdAndNewRetryCountGreaterThan(UUID jobId, int retryCount);

    List<AdminRetryAudit> findByJobIdOrderByCreatedAtDesc(UUID jobId);

    List<AdminRetryAudit> findByCreatedAtAfterOrderByCreatedAtDesc(LocalDateTime since);
}
