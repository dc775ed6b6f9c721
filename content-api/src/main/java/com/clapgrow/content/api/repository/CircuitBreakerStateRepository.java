package com.clapgrow.content.api.repository;

import com.clapgrow.content.api.entity.CircuitBreakerState;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CircuitBreakerStateRepository extends JpaRepository<CircuitBreakerState, String> {

    /**
     * Read the breaker row under a pessimistic write lock.
     * The lock is scoped to one dependency and held until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT s FROM CircuitBreakerState s WHERE s.dependencyName = :dependencyName")
    Optional<CircuitBreakerState> findForUpdate(@Param("dependencyName") String dependencyName);
}
