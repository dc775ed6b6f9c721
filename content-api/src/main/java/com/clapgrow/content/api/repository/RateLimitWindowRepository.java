package com.clapgrow.content.api.repository;

import com.clapgrow.content.api.entity.RateLimitWindow;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RateLimitWindowRepository extends JpaRepository<RateLimitWindow, UUID> {

    /**
     * Lock all windows of a service in a stable order (by window type) so the quota
     * check and the reservation happen atomically.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT w FROM RateLimitWindow w WHERE w.serviceName = :serviceName ORDER BY w.windowType")
    List<RateLimitWindow> findForUpdate(@Param("serviceName") String serviceName);

    List<RateLimitWindow> findByServiceName(String serviceName);
}
