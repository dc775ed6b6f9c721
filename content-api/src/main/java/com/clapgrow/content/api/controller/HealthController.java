package com.clapgrow.content.api.controller;

import com.clapgrow.content.api.dto.AlertResponse;
import com.clapgrow.content.api.dto.ApiResponse;
import com.clapgrow.content.api.dto.HealthReport;
import com.clapgrow.content.api.dto.HealthSnapshotResponse;
import com.clapgrow.content.api.enums.HealthStatus;
import com.clapgrow.content.api.service.AlertingEngine;
import com.clapgrow.content.api.service.BadRequestException;
import com.clapgrow.content.api.service.JobStatusManager;
import com.clapgrow.content.api.service.RetryTracker;
import com.clapgrow.content.api.service.SystemHealthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Tag(name = "Health", description = "Liveness and component health of the content pipeline")
public class HealthController {

    private final SystemHealthService systemHealthService;
    private final JobStatusManager jobStatusManager;
    private final RetryTracker retryTracker;
    private final AlertingEngine alertingEngine;

    @GetMapping("/health")
    @Operation(
            summary = "Liveness check",
            description = "Returns UP while the application is running. Does not touch the database."
    )
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Service is up")
    })
    public ResponseEntity<Map<String, String>> health() {
        Map<String, String> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("service", "content-api");
        return ResponseEntity.ok(response);
    }

    @GetMapping(value = "/api/health", params = "!action")
    public ResponseEntity<ApiResponse<HealthReport>> defaultCheck() {
        return check();
    }

    @GetMapping(value = "/api/health", params = "action=check")
    @Operation(
            summary = "Run a full health check",
            description = "Checks the database, circuit breakers, rate-limit utilization, content processing and JVM memory. " +
                    "The result is persisted as a health snapshot."
    )
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "System is healthy, degraded or critical"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "System is down")
    })
    public ResponseEntity<ApiResponse<HealthReport>> check() {
        HealthReport report = systemHealthService.performHealthCheck();
        if (report.overallStatus() == HealthStatus.DOWN) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiResponse.failure("check", null, report, report.summary()));
        }
        return ResponseEntity.ok(ApiResponse.success("check", report));
    }

    @GetMapping(value = "/api/health", params = "action=status")
    @Operation(summary = "Overall status of the latest health snapshot")
    public ResponseEntity<ApiResponse<Map<String, HealthStatus>>> status() {
        HealthStatus status = systemHealthService.getOverallStatus();
        ApiResponse<Map<String, HealthStatus>> body = ApiResponse.success("status", Map.of("status", status));
        if (status == HealthStatus.DOWN) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
        return ResponseEntity.ok(body);
    }

    @GetMapping(value = "/api/health", params = "action=metrics")
    @Operation(summary = "Job status and retry statistics")
    public ResponseEntity<ApiResponse<Map<String, Object>>> metrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("jobs", jobStatusManager.getStatusStatistics());
        metrics.put("retries", retryTracker.getRetryStatistics());
        return ResponseEntity.ok(ApiResponse.success("metrics", metrics));
    }

    @GetMapping(value = "/api/health", params = "action=alerts")
    @Operation(summary = "Unresolved failure-rate alerts")
    public ResponseEntity<ApiResponse<List<AlertResponse>>> alerts() {
        return ResponseEntity.ok(ApiResponse.success("alerts", alertingEngine.getActiveAlerts()));
    }

    @GetMapping(value = "/api/health", params = "action=recommendations")
    @Operation(summary = "Recommendations derived from a fresh health check")
    public ResponseEntity<ApiResponse<List<String>>> recommendations() {
        HealthReport report = systemHealthService.performHealthCheck();
        return ResponseEntity.ok(ApiResponse.success("recommendations", report.recommendations()));
    }

    @GetMapping(value = "/api/health", params = "action=config")
    @Operation(summary = "Health monitor thresholds")
    public ResponseEntity<ApiResponse<Map<String, Object>>> config() {
        return ResponseEntity.ok(ApiResponse.success("config", systemHealthService.getConfig()));
    }

    @GetMapping(value = "/api/health", params = "action=history")
    @Operation(summary = "Recent health snapshots, newest first")
    public ResponseEntity<ApiResponse<List<HealthSnapshotResponse>>> history(
            @Parameter(description = "Maximum number of snapshots", example = "20")
            @RequestParam(name = "limit", defaultValue = "20") int limit) {
        return ResponseEntity.ok(ApiResponse.success("history", systemHealthService.getHistory(limit)));
    }

    @GetMapping(value = "/api/health", params = "action")
    public ResponseEntity<ApiResponse<Void>> unknownAction(@RequestParam("action") String action) {
        throw new BadRequestException("Unknown action: " + action);
    }
}
