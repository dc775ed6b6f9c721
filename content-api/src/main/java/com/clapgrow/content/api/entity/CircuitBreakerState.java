package com.clapgrow.content.api.entity;

import com.clapgrow.content.api.enums.CircuitState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Persisted circuit breaker for one external dependency (one row per dependency).
 *
 * Shared by every process calling the dependency. Mutated only while holding
 * a pessimistic row lock (see CircuitBreakerStateRepository#findForUpdate).
 */
@Entity
@Table(name = "circuit_breaker_states")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CircuitBreakerState {

    @Id
    @Column(name = "dependency_name", length = 50)
    private String dependencyName;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private CircuitState state = CircuitState.CLOSED;

    @Column(name = "consecutive_failures", nullable = false)
    private Integer consecutiveFailures = 0;

    /**
     * Qualifying failures since window_started_at. Reset on success or when the window goes stale.
     */
    @Column(name = "window_failure_count", nullable = false)
    private Integer windowFailureCount = 0;

    @Column(name = "window_started_at")
    private LocalDateTime windowStartedAt;

    @Column(name = "opened_at")
    private LocalDateTime openedAt;

    @Column(name = "next_probe_at")
    private LocalDateTime nextProbeAt;

    @Column(name = "probe_started_at")
    private LocalDateTime probeStartedAt;

    @Column(name = "last_failure_at")
    private LocalDateTime lastFailureAt;

    @Column(name = "last_success_at")
    private LocalDateTime lastSuccessAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public CircuitBreakerState(String dependencyName) {
        this.dependencyName = dependencyName;
        this.state = CircuitState.CLOSED;
        this.consecutiveFailures = 0;
        this.windowFailureCount = 0;
    }
}
