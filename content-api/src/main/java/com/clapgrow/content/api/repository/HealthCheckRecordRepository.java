package com.clapgrow.content.api.repository;

import com.clapgrow.content.api.entity.HealthCheckRecord;
import com.clapgrow.content.api.enums.HealthStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface HealthCheckRecordRepository extends JpaRepository<HealthCheckRecord, UUID> {

    Optional<HealthCheckRecord> findFirstByOrderByCreatedAtDesc();

    List<HealthCheckRecord> findByOrderByCreatedAtDesc(Pageable pageable);

    long countByCreatedAtAfter(LocalDateTime since);

    long countByCreatedAtAfterAndOverallStatus(LocalDateTime since, HealthStatus status);

    @Modifying
    @Query("DELETE FROM HealthCheckRecord r WHERE r.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDateTime cutoff);
}
