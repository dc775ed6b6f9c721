package com.clapgrow.content.api.service;

import com.clapgrow.content.api.config.HealthMonitorProperties;
import com.clapgrow.content.api.dto.CircuitBreakerStatus;
import com.clapgrow.content.api.dto.ComponentHealth;
import com.clapgrow.content.api.dto.FailureRateSample;
import com.clapgrow.content.api.dto.HealthReport;
import com.clapgrow.content.api.dto.HealthSnapshotResponse;
import com.clapgrow.content.api.entity.HealthCheckRecord;
import com.clapgrow.content.api.enums.CircuitState;
import com.clapgrow.content.api.enums.HealthStatus;
import com.clapgrow.content.api.enums.JobStatus;
import com.clapgrow.content.api.enums.TimeWindow;
import com.clapgrow.content.api.repository.ContentJobRepository;
import com.clapgrow.content.api.repository.HealthCheckRecordRepository;
import com.clapgrow.content.common.service.ExternalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Aggregated health of the content pipeline.
 * 
 * Components checked:
 * - database: round-trip time of a trivial query
 * - circuit-breaker:&lt;dependency&gt;: OPEN is CRITICAL, HALF_OPEN is WARNING
 * - rate-limiter:&lt;service&gt;: utilization against the warning/critical ratios
 * - content-processing: daily failure rate and the pending queue
 * - memory: JVM heap usage
 * 
 * The overall status is the worst component status. Each full check is persisted as a
 * HealthCheckRecord; uptime is the share of the last 24 hours' records that weren't DOWN.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SystemHealthService {

    private static final Duration UPTIME_WINDOW = Duration.ofHours(24);

    private final JdbcTemplate jdbcTemplate;
    private final ContentJobRepository jobRepository;
    private final HealthCheckRecordRepository healthCheckRecordRepository;
    private final CircuitBreakerService circuitBreakerService;
    private final RateLimiterService rateLimiterService;
    private final FailureRateService failureRateService;
    private final HealthMonitorProperties properties;
    private final Clock clock;

    /**
     * Run every component check, persist the snapshot and return the report.
     * 
     * ⚠️ Not transactional: the report must still be produced when the database is down.
     */
    public HealthReport performHealthCheck() {
        long started = clock.millis();
        List<ComponentHealth> components = new ArrayList<>();
        components.add(checkDatabase());
        components.addAll(checkCircuitBreakers());
        components.addAll(checkRateLimiters());
        components.add(checkContentProcessing());
        components.add(checkMemory());

        HealthStatus overall = HealthStatus.HEALTHY;
        for (ComponentHealth component : components) {
            overall = overall.worst(component.status());
        }
        List<String> recommendations = buildRecommendations(components);
        long durationMs = clock.millis() - started;
        LocalDateTime now = LocalDateTime.now(clock);

        Double uptime = null;
        try {
            persistSnapshot(overall, components, recommendations, durationMs, now);
            uptime = calculateUptime(now);
        } catch (DataAccessException e) {
            log.error("Failed to persist health snapshot: {}", e.getMessage());
        }

        if (overall != HealthStatus.HEALTHY) {
            log.warn("Health check finished with status {} in {} ms", overall, durationMs);
        } else {
            log.debug("Health check finished with status {} in {} ms", overall, durationMs);
        }
        return new HealthReport(overall, summarize(overall, components), components, recommendations,
            uptime, durationMs, now);
    }

    /**
     * Overall status of the latest snapshot, running a fresh check when none exists.
     */
    public HealthStatus getOverallStatus() {
        try {
            return healthCheckRecordRepository.findFirstByOrderByCreatedAtDesc()
                .map(HealthCheckRecord::getOverallStatus)
                .orElseGet(() -> performHealthCheck().overallStatus());
        } catch (DataAccessException e) {
            log.error("Failed to read latest health snapshot: {}", e.getMessage());
            return HealthStatus.DOWN;
        }
    }

    @Transactional(readOnly = true)
    public List<HealthSnapshotResponse> getHistory(int limit) {
        int size = Math.max(1, Math.min(limit, 100));
        return healthCheckRecordRepository.findByOrderByCreatedAtDesc(PageRequest.of(0, size)).stream()
            .map(HealthSnapshotResponse::from)
            .toList();
    }

    @Transactional
    public int cleanupHistory() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(properties.getHistoryRetentionDays());
        int deleted = healthCheckRecordRepository.deleteOlderThan(cutoff);
        if (deleted > 0) {
            log.info("Deleted {} health check records older than {}", deleted, cutoff);
        }
        return deleted;
    }

    public Map<String, Object> getConfig() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("databaseResponseThresholdMs", properties.getDatabaseResponseThresholdMs());
        config.put("utilizationWarning", properties.getUtilizationWarning());
        config.put("utilizationCritical", properties.getUtilizationCritical());
        config.put("failureRateWarning", properties.getFailureRateWarning());
        config.put("failureRateCritical", properties.getFailureRateCritical());
        config.put("queueSizeWarning", properties.getQueueSizeWarning());
        config.put("memoryThresholdPercent", properties.getMemoryThresholdPercent());
        config.put("historyRetentionDays", properties.getHistoryRetentionDays());
        return config;
    }

    ComponentHealth checkDatabase() {
        long started = clock.millis();
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        } catch (DataAccessException e) {
            log.error("Database health check failed: {}", e.getMessage());
            return new ComponentHealth("database", HealthStatus.DOWN, "Database unreachable",
                Map.of("error", e.getClass().getSimpleName()));
        }
        long responseTimeMs = clock.millis() - started;
        long threshold = properties.getDatabaseResponseThresholdMs();
        HealthStatus status = responseTimeMs > threshold * 2
            ? HealthStatus.CRITICAL
            : responseTimeMs > threshold ? HealthStatus.WARNING : HealthStatus.HEALTHY;
        return new ComponentHealth("database", status,
            String.format("Database responded in %d ms", responseTimeMs),
            Map.of("responseTimeMs", responseTimeMs, "thresholdMs", threshold));
    }

    List<ComponentHealth> checkCircuitBreakers() {
        List<ComponentHealth> result = new ArrayList<>();
        for (CircuitBreakerStatus breaker : circuitBreakerService.getAllStates()) {
            HealthStatus status = switch (breaker.state()) {
                case OPEN -> HealthStatus.CRITICAL;
                case HALF_OPEN -> HealthStatus.WARNING;
                case CLOSED -> HealthStatus.HEALTHY;
            };
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("state", breaker.state());
            details.put("windowFailureCount", breaker.windowFailureCount());
            details.put("retryAfterMs", breaker.retryAfterMs());
            String message = breaker.state() == CircuitState.CLOSED
                ? "Circuit closed"
                : String.format("Circuit %s, next probe in %d ms", breaker.state(), breaker.retryAfterMs());
            result.add(new ComponentHealth("circuit-breaker:" + breaker.dependency(), status, message, details));
        }
        return result;
    }

    List<ComponentHealth> checkRateLimiters() {
        List<ComponentHealth> result = new ArrayList<>();
        for (ExternalService service : ExternalService.values()) {
            double utilization = rateLimiterService.getUtilization(service);
            HealthStatus status = utilization >= properties.getUtilizationCritical()
                ? HealthStatus.CRITICAL
                : utilization >= properties.getUtilizationWarning() ? HealthStatus.WARNING : HealthStatus.HEALTHY;
            result.add(new ComponentHealth("rate-limiter:" + service.getKey(), status,
                String.format(Locale.ROOT, "Peak window utilization %.1f%%", utilization * 100),
                Map.of("utilization", utilization)));
        }
        return result;
    }

    ComponentHealth checkContentProcessing() {
        FailureRateSample daily = failureRateService.calculate(TimeWindow.DAILY);
        long pending = jobRepository.countByStatus(JobStatus.PENDING);
        long processing = jobRepository.countByStatus(JobStatus.PROCESSING);

        HealthStatus status = HealthStatus.HEALTHY;
        List<String> problems = new ArrayList<>();
        if (daily.failureRate() >= properties.getFailureRateCritical()) {
            status = HealthStatus.CRITICAL;
            problems.add("failure rate critical");
        } else if (daily.failureRate() >= properties.getFailureRateWarning()) {
            status = HealthStatus.WARNING;
            problems.add("failure rate elevated");
        }
        if (pending > properties.getQueueSizeWarning()) {
            status = status.worst(HealthStatus.WARNING);
            problems.add("pending queue backlog");
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("failureRate", daily.failureRate());
        details.put("totalJobs24h", daily.totalJobs());
        details.put("failedJobs24h", daily.failedJobs());
        details.put("pendingJobs", pending);
        details.put("processingJobs", processing);
        String message = problems.isEmpty()
            ? String.format(Locale.ROOT, "Failure rate %.1f%%, %d pending", daily.failureRate() * 100, pending)
            : String.join(", ", problems);
        return new ComponentHealth("content-processing", status, message, details);
    }

    ComponentHealth checkMemory() {
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        long max = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        double usedPercent = max > 0 ? (double) heap.getUsed() * 100 / max : 0;
        int threshold = properties.getMemoryThresholdPercent();
        HealthStatus status = usedPercent >= threshold
            ? HealthStatus.CRITICAL
            : usedPercent >= threshold * 0.8 ? HealthStatus.WARNING : HealthStatus.HEALTHY;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("usedBytes", heap.getUsed());
        details.put("maxBytes", max);
        details.put("usedPercent", usedPercent);
        return new ComponentHealth("memory", status,
            String.format(Locale.ROOT, "Heap usage %.1f%%", usedPercent), details);
    }

    List<String> buildRecommendations(List<ComponentHealth> components) {
        List<String> recommendations = new ArrayList<>();
        for (ComponentHealth component : components) {
            if (component.status() == HealthStatus.HEALTHY) {
                continue;
            }
            String name = component.name();
            if (name.equals("database")) {
                recommendations.add(component.status() == HealthStatus.DOWN
                    ? "Restore database connectivity; no job state can be recorded"
                    : "Investigate slow database queries and connection pool saturation");
            } else if (name.startsWith("circuit-breaker:")) {
                recommendations.add("Check availability of " + name.substring("circuit-breaker:".length())
                    + "; calls are being short-circuited");
            } else if (name.startsWith("rate-limiter:")) {
                recommendations.add("Reduce request volume to " + name.substring("rate-limiter:".length())
                    + " or raise its quota");
            } else if (name.equals("content-processing")) {
                recommendations.add("Review recent job failures by error category and the pending backlog");
            } else if (name.equals("memory")) {
                recommendations.add("Heap usage is high; check for leaks or increase the heap size");
            }
        }
        return recommendations;
    }

    private String summarize(HealthStatus overall, List<ComponentHealth> components) {
        long unhealthy = components.stream().filter(c -> c.status() != HealthStatus.HEALTHY).count();
        if (unhealthy == 0) {
            return "All " + components.size() + " components healthy";
        }
        return String.format("%s: %d of %d components need attention", overall, unhealthy, components.size());
    }

    private void persistSnapshot(HealthStatus overall, List<ComponentHealth> components,
                                 List<String> recommendations, long durationMs, LocalDateTime now) {
        Map<String, String> componentStatuses = new LinkedHashMap<>();
        components.forEach(component -> componentStatuses.put(component.name(), component.status().name()));

        HealthCheckRecord record = new HealthCheckRecord();
        record.setOverallStatus(overall);
        record.setComponents(componentStatuses);
        record.setRecommendations(recommendations);
        record.setDurationMs(durationMs);
        record.setCreatedAt(now);
        healthCheckRecordRepository.save(record);
    }

    private Double calculateUptime(LocalDateTime now) {
        LocalDateTime since = now.minus(UPTIME_WINDOW);
        long total = healthCheckRecordRepository.countByCreatedAtAfter(since);
        if (total == 0) {
            return null;
        }
        long down = healthCheckRecordRepository.countByCreatedAtAfterAndOverallStatus(since, HealthStatus.DOWN);
        return (double) (total - down) * 100 / total;
    }
}
