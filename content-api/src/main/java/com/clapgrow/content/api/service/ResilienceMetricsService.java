package com.clapgrow.content.api.service;

import com.clapgrow.content.api.enums.AdminRetryType;
import com.clapgrow.content.api.enums.AlertSeverity;
import com.clapgrow.content.api.enums.CircuitState;
import com.clapgrow.content.api.enums.JobStatus;
import com.clapgrow.content.common.retry.ErrorCategory;
import com.clapgrow.content.common.service.ExternalService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

/**
 * Prometheus metrics for the resilience subsystem.
 * 
 * Tracks:
 * - Circuit breaker state changes and short-circuited calls per dependency
 * - Rate-limit denials per service
 * - Retry attempts per error category and the applied retry delay
 * - Alerts raised per severity
 * - Job transitions per target status
 * - Admin retries per type
 * 
 * Metrics are exposed at /actuator/prometheus
 * 
 * ⚠️ PERFORMANCE: All meters are created once in @PostConstruct and kept in enum maps.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResilienceMetricsService {

    private final MeterRegistry meterRegistry;

    private final Map<ExternalService, Map<CircuitState, Counter>> breakerStateCounters = new EnumMap<>(ExternalService.class);
    private final Map<ExternalService, Counter> shortCircuitCounters = new EnumMap<>(ExternalService.class);
    private final Map<ExternalService, Counter> rateLimitDeniedCounters = new EnumMap<>(ExternalService.class);
    private final Map<ErrorCategory, Counter> retryAttemptCounters = new EnumMap<>(ErrorCategory.class);
    private final Map<AlertSeverity, Counter> alertCounters = new EnumMap<>(AlertSeverity.class);
    private final Map<JobStatus, Counter> transitionCounters = new EnumMap<>(JobStatus.class);
    private final Map<AdminRetryType, Counter> adminRetryCounters = new EnumMap<>(AdminRetryType.class);
    private DistributionSummary retryDelaySummary;

    @PostConstruct
    void init() {
        for (ExternalService service : ExternalService.values()) {
            Map<CircuitState, Counter> byState = new EnumMap<>(CircuitState.class);
            for (CircuitState state : CircuitState.values()) {
                byState.put(state, Counter.builder("content.circuit_breaker.transitions")
                    .description("Circuit breaker state changes")
                    .tag("dependency", service.getKey())
                    .tag("state", state.name())
                    .register(meterRegistry));
            }
            breakerStateCounters.put(service, byState);

            shortCircuitCounters.put(service, Counter.builder("content.circuit_breaker.short_circuited")
                .description("Calls refused by an open circuit breaker (no request made)")
                .tag("dependency", service.getKey())
                .register(meterRegistry));

            rateLimitDeniedCounters.put(service, Counter.builder("content.rate_limit.denied")
                .description("Requests denied by the rate limiter")
                .tag("service", service.getKey())
                .register(meterRegistry));
        }

        for (ErrorCategory category : ErrorCategory.values()) {
            retryAttemptCounters.put(category, Counter.builder("content.retry.attempts")
                .description("Failed attempts recorded by category")
                .tag("category", category.name())
                .register(meterRegistry));
        }

        for (AlertSeverity severity : AlertSeverity.values()) {
            alertCounters.put(severity, Counter.builder("content.alerts.raised")
                .description("Failure-rate alerts raised")
                .tag("severity", severity.name())
                .register(meterRegistry));
        }

        for (JobStatus status : JobStatus.values()) {
            transitionCounters.put(status, Counter.builder("content.jobs.transitions")
                .description("Job status transitions by target status")
                .tag("status", status.name())
                .register(meterRegistry));
        }

        for (AdminRetryType type : AdminRetryType.values()) {
            adminRetryCounters.put(type, Counter.builder("content.admin.retries")
                .description("Executed admin retries")
                .tag("type", type.name())
                .register(meterRegistry));
        }

        retryDelaySummary = DistributionSummary.builder("content.retry.delay")
            .description("Delay scheduled before the next attempt")
            .baseUnit("milliseconds")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);

        log.info("Initialized resilience metrics for {} dependencies", ExternalService.values().length);
    }

    public void recordBreakerStateChange(ExternalService service, CircuitState newState) {
        breakerStateCounters.get(service).get(newState).increment();
    }

    public void recordShortCircuit(ExternalService service) {
        shortCircuitCounters.get(service).increment();
    }

    public void recordRateLimitDenied(ExternalService service) {
        rateLimitDeniedCounters.get(service).increment();
    }

    public void recordRetryAttempt(ErrorCategory category, long delayMs) {
        retryAttemptCounters.get(category).increment();
        if (delayMs > 0) {
            retryDelaySummary.record(delayMs);
        }
    }

    public void recordAlert(AlertSeverity severity) {
        alertCounters.get(severity).increment();
    }

    public void recordTransition(JobStatus toStatus) {
        transitionCounters.get(toStatus).increment();
    }

    public void recordAdminRetry(AdminRetryType type) {
        adminRetryCounters.get(type).increment();
    }
}
