package com.clapgrow.content.api.service;

import com.clapgrow.content.api.config.HealthMonitorProperties;
import com.clapgrow.content.api.dto.CircuitBreakerStatus;
import com.clapgrow.content.api.dto.ComponentHealth;
import com.clapgrow.content.api.dto.FailureRateSample;
import com.clapgrow.content.api.dto.HealthReport;
import com.clapgrow.content.api.entity.HealthCheckRecord;
import com.clapgrow.content.api.enums.CircuitState;
import com.clapgrow.content.api.enums.HealthStatus;
import com.clapgrow.content.api.enums.JobStatus;
import com.clapgrow.content.api.enums.TimeWindow;
import com.clapgrow.content.api.repository.ContentJobRepository;
import com.clapgrow.content.api.repository.HealthCheckRecordRepository;
import com.clapgrow.content.common.service.ExternalService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SystemHealthServiceTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private ContentJobRepository jobRepository;

    @Mock
    private HealthCheckRecordRepository healthCheckRecordRepository;

    @Mock
    private CircuitBreakerService circuitBreakerService;

    @Mock
    private RateLimiterService rateLimiterService;

    @Mock
    private FailureRateService failureRateService;

    private MutableClock clock;
    private SystemHealthService systemHealthService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        systemHealthService = new SystemHealthService(jdbcTemplate, jobRepository, healthCheckRecordRepository,
            circuitBreakerService, rateLimiterService, failureRateService, new HealthMonitorProperties(), clock);
    }

    private static CircuitBreakerStatus breaker(ExternalService service, CircuitState state, long retryAfterMs) {
        return new CircuitBreakerStatus(service.getKey(), state, 0, 0, null, null, null, null, null, null, retryAfterMs);
    }

    @Test
    void testCheckDatabase_SlowResponseIsWarning() {
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class)).thenAnswer(invocation -> {
            clock.advance(Duration.ofMillis(1500));
            return 1;
        });

        ComponentHealth health = systemHealthService.checkDatabase();

        assertEquals(HealthStatus.WARNING, health.status());
        assertEquals(1500L, health.details().get("responseTimeMs"));
    }

    @Test
    void testCheckDatabase_VerySlowResponseIsCritical() {
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class)).thenAnswer(invocation -> {
            clock.advance(Duration.ofMillis(2500));
            return 1;
        });

        assertEquals(HealthStatus.CRITICAL, systemHealthService.checkDatabase().status());
    }

    @Test
    void testCheckCircuitBreakers_MapsStates() {
        when(circuitBreakerService.getAllStates()).thenReturn(List.of(
            breaker(ExternalService.GENERATION_API, CircuitState.OPEN, 12_000),
            breaker(ExternalService.PUBLISHING_API, CircuitState.HALF_OPEN, 3_000)));

        List<ComponentHealth> components = systemHealthService.checkCircuitBreakers();

        assertEquals("circuit-breaker:generation-api", components.get(0).name());
        assertEquals(HealthStatus.CRITICAL, components.get(0).status());
        assertEquals("Circuit OPEN, next probe in 12000 ms", components.get(0).message());
        assertEquals(HealthStatus.WARNING, components.get(1).status());
    }

    @Test
    void testCheckRateLimiters_UsesUtilizationBands() {
        when(rateLimiterService.getUtilization(ExternalService.GENERATION_API)).thenReturn(0.96);
        when(rateLimiterService.getUtilization(ExternalService.PUBLISHING_API)).thenReturn(0.5);

        List<ComponentHealth> components = systemHealthService.checkRateLimiters();

        assertEquals(HealthStatus.CRITICAL, components.get(0).status());
        assertEquals(HealthStatus.HEALTHY, components.get(1).status());
        assertEquals("Peak window utilization 50.0%", components.get(1).message());
    }

    @Test
    void testCheckContentProcessing_FlagsFailureRateAndBacklog() {
        when(failureRateService.calculate(TimeWindow.DAILY)).thenReturn(FailureRateSample.of(TimeWindow.DAILY, 100, 17));
        when(jobRepository.countByStatus(JobStatus.PENDING)).thenReturn(150L);
        when(jobRepository.countByStatus(JobStatus.PROCESSING)).thenReturn(4L);

        ComponentHealth health = systemHealthService.checkContentProcessing();

        assertEquals(HealthStatus.WARNING, health.status());
        assertEquals("failure rate elevated, pending queue backlog", health.message());
        assertEquals(150L, health.details().get("pendingJobs"));
    }

    @Test
    void testPerformHealthCheck_WhenDatabaseDown_ReportsDownAndStillReturns() {
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class))
            .thenThrow(new DataAccessResourceFailureException("Connection refused"));
        when(circuitBreakerService.getAllStates()).thenReturn(List.of(
            breaker(ExternalService.GENERATION_API, CircuitState.CLOSED, 0),
            breaker(ExternalService.PUBLISHING_API, CircuitState.CLOSED, 0)));
        when(failureRateService.calculate(TimeWindow.DAILY)).thenReturn(FailureRateSample.of(TimeWindow.DAILY, 0, 0));
        when(healthCheckRecordRepository.save(any(HealthCheckRecord.class)))
            .thenThrow(new DataAccessResourceFailureException("Connection refused"));

        HealthReport report = systemHealthService.performHealthCheck();

        assertEquals(HealthStatus.DOWN, report.overallStatus());
        assertNull(report.uptimePercent());
        assertTrue(report.summary().startsWith("DOWN: "));
        assertTrue(report.recommendations().contains("Restore database connectivity; no job state can be recorded"));
    }

    @Test
    void testGetOverallStatus_UsesLatestSnapshot() {
        HealthCheckRecord record = new HealthCheckRecord();
        record.setOverallStatus(HealthStatus.WARNING);
        when(healthCheckRecordRepository.findFirstByOrderByCreatedAtDesc()).thenReturn(Optional.of(record));

        assertEquals(HealthStatus.WARNING, systemHealthService.getOverallStatus());
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void testBuildRecommendations_SkipsHealthyComponents() {
        List<String> recommendations = systemHealthService.buildRecommendations(List.of(
            new ComponentHealth("database", HealthStatus.HEALTHY, "ok", Map.of()),
            new ComponentHealth("rate-limiter:publishing-api", HealthStatus.WARNING, "busy", Map.of())));

        assertEquals(List.of("Reduce request volume to publishing-api or raise its quota"), recommendations);
    }
}
