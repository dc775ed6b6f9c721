package com.clapgrow.content.api.controller;

import com.clapgrow.content.api.dto.AlertEvaluationResult;
import com.clapgrow.content.api.dto.AlertNotificationResponse;
import com.clapgrow.content.api.dto.AlertResponse;
import com.clapgrow.content.api.dto.AlertSimulation;
import com.clapgrow.content.api.dto.AlertThresholds;
import com.clapgrow.content.api.dto.ApiResponse;
import com.clapgrow.content.api.dto.FailureRateRequest;
import com.clapgrow.content.api.dto.FailureRateSample;
import com.clapgrow.content.api.enums.TimeWindow;
import com.clapgrow.content.api.service.AlertingEngine;
import com.clapgrow.content.api.service.BadRequestException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/alerting")
@RequiredArgsConstructor
@Tag(name = "Alerting", description = "Failure-rate alerts, escalation and notification log")
public class AlertingController {

    private final AlertingEngine alertingEngine;

    @PostMapping(params = "action=test")
    @Operation(
            summary = "Evaluate a failure-rate sample",
            description = "Classifies the sample, applies the per-severity cooldown and raises at most one alert. " +
                    "When failureRate is omitted it is derived from the job counts."
    )
    public ResponseEntity<ApiResponse<AlertEvaluationResult>> evaluate(@Valid @RequestBody FailureRateRequest request) {
        TimeWindow window = TimeWindow.fromString(request.getTimeWindow());
        FailureRateSample sample = request.getFailureRate() != null
            ? new FailureRateSample(window, request.getTotalJobs(), request.getFailedJobs(), request.getFailureRate())
            : FailureRateSample.of(window, request.getTotalJobs(), request.getFailedJobs());
        return ResponseEntity.ok(ApiResponse.success("test", alertingEngine.evaluate(sample)));
    }

    @PostMapping(params = "action=check")
    @Operation(summary = "Evaluate the daily failure rate computed from job records")
    public ResponseEntity<ApiResponse<AlertEvaluationResult>> check() {
        return ResponseEntity.ok(ApiResponse.success("check", alertingEngine.checkScheduledFailureRate()));
    }

    @GetMapping(params = "action=config")
    @Operation(summary = "Thresholds, escalation delays and channel availability")
    public ResponseEntity<ApiResponse<Map<String, Object>>> config() {
        return ResponseEntity.ok(ApiResponse.success("config", alertingEngine.getConfig()));
    }

    @GetMapping(params = "action=thresholds")
    @Operation(summary = "Severity bands with their channels and cooldowns")
    public ResponseEntity<ApiResponse<AlertThresholds>> thresholds() {
        return ResponseEntity.ok(ApiResponse.success("thresholds", alertingEngine.getThresholds()));
    }

    @GetMapping(params = "action=simulate")
    @Operation(summary = "Dry-run classification of a failure rate", description = "Nothing is persisted or sent.")
    public ResponseEntity<ApiResponse<AlertSimulation>> simulate(
            @Parameter(description = "Failure rate between 0 and 1", example = "0.22")
            @RequestParam("failureRate") double failureRate,
            @Parameter(description = "hourly, daily, weekly or monthly", example = "daily")
            @RequestParam(name = "timeWindow", required = false) String timeWindow) {
        return ResponseEntity.ok(ApiResponse.success("simulate",
            alertingEngine.simulate(failureRate, TimeWindow.fromString(timeWindow))));
    }

    @GetMapping(params = "action=notifications")
    @Operation(summary = "Notification delivery log", description = "Latest notifications, or those of one alert when alertId is given.")
    public ResponseEntity<ApiResponse<List<AlertNotificationResponse>>> notifications(
            @RequestParam(name = "alertId", required = false) UUID alertId) {
        List<AlertNotificationResponse> notifications = alertId != null
            ? alertingEngine.getNotificationsForAlert(alertId)
            : alertingEngine.getRecentNotifications();
        return ResponseEntity.ok(ApiResponse.success("notifications", notifications));
    }

    @GetMapping(params = "action=active")
    @Operation(summary = "Unresolved alerts, newest first")
    public ResponseEntity<ApiResponse<List<AlertResponse>>> active() {
        return ResponseEntity.ok(ApiResponse.success("active", alertingEngine.getActiveAlerts()));
    }

    @GetMapping(params = "action=recent")
    @Operation(summary = "Latest alerts, resolved or not")
    public ResponseEntity<ApiResponse<List<AlertResponse>>> recent() {
        return ResponseEntity.ok(ApiResponse.success("recent", alertingEngine.getRecentAlerts()));
    }

    @PostMapping(params = "action=escalation")
    @Operation(
            summary = "Run the escalation sweep",
            description = "Escalates unresolved critical and emergency alerts whose escalation delay has elapsed."
    )
    public ResponseEntity<ApiResponse<Map<String, Integer>>> escalate() {
        int escalated = alertingEngine.sweepEscalations();
        return ResponseEntity.ok(ApiResponse.success("escalation", Map.of("escalated", escalated)));
    }

    @PostMapping(params = "action=resolve")
    @Operation(summary = "Resolve an alert")
    public ResponseEntity<ApiResponse<AlertResponse>> resolve(@RequestParam("alertId") UUID alertId) {
        return ResponseEntity.ok(ApiResponse.success("resolve", alertingEngine.resolveAlert(alertId)));
    }

    @RequestMapping
    public ResponseEntity<ApiResponse<Void>> unknownAction(
            @RequestParam(name = "action", required = false) String action) {
        throw new BadRequestException(action == null ? "Action is required" : "Unknown action: " + action);
    }
}
