package com.clapgrow.content.api.repository;

import com.clapgrow.content.api.entity.RateLimitRequestLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.UUID;

@Repository
public interface RateLimitRequestLogRepository extends JpaRepository<RateLimitRequestLog, UUID> {

    @Query("SELECT COUNT(l) AS requestCount, " +
           "COALESCE(SUM(l.tokens), 0) AS tokenCount, " +
           "COALESCE(AVG(l.responseTimeMs), 0) AS averageResponseTimeMs, " +
           "COALESCE(SUM(CASE WHEN l.success = true THEN 1 ELSE 0 END), 0) AS successCount " +
           "FROM RateLimitRequestLog l WHERE l.serviceName = :serviceName AND l.timestamp >= :since")
    UsageSummary summarizeSince(@Param("serviceName") String serviceName, @Param("since") LocalDateTime since);

    @Modifying
    @Query("DELETE FROM RateLimitRequestLog l WHERE l.timestamp < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDateTime cutoff);

    interface UsageSummary {
        Long getRequestCount();
        Long getTokenCount();
        Double getAverageResponseTimeMs();
        Long getSuccessCount();
    }
}
