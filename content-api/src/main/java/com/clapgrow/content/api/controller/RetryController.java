package com.clapgrow.content.api.controller;

import com.clapgrow.content.api.config.RetryProperties;
import com.clapgrow.content.api.dto.ApiResponse;
import com.clapgrow.content.api.dto.CleanupResult;
import com.clapgrow.content.api.dto.RecordFailureRequest;
import com.clapgrow.content.api.dto.RetryEligibility;
import com.clapgrow.content.api.dto.RetryHistory;
import com.clapgrow.content.api.dto.RetryRecordResult;
import com.clapgrow.content.api.dto.RetryStatistics;
import com.clapgrow.content.api.service.BadRequestException;
import com.clapgrow.content.api.service.RetryPolicyProvider;
import com.clapgrow.content.api.service.RetryTracker;
import com.clapgrow.content.common.retry.ClassifiedError;
import com.clapgrow.content.common.retry.ErrorClassifier;
import com.clapgrow.content.common.service.ExternalService;
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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/retry")
@RequiredArgsConstructor
@Tag(name = "Retry", description = "Retry log, eligibility and retry policy")
public class RetryController {

    private final RetryTracker retryTracker;
    private final RetryPolicyProvider retryPolicyProvider;
    private final RetryProperties retryProperties;
    private final ErrorClassifier errorClassifier;

    @PostMapping(params = "action=test")
    @Operation(
            summary = "Record a failed attempt",
            description = "Classifies the raw failure and appends it to the job's retry log. " +
                    "Returns the next delay and whether the job may be retried."
    )
    public ResponseEntity<ApiResponse<RetryRecordResult>> recordAttempt(@Valid @RequestBody RecordFailureRequest request) {
        ClassifiedError error = errorClassifier.classify(request.toDescriptor());
        ExternalService service = request.getService() != null && !request.getService().isBlank()
            ? ExternalService.fromString(request.getService())
            : null;
        boolean retryable = request.getRetryable() == null || request.getRetryable();
        RetryRecordResult result = retryTracker.recordRetryAttempt(request.getJobId(), error, retryable, service);
        return ResponseEntity.ok(ApiResponse.forJob("test", request.getJobId(), result));
    }

    @PostMapping(params = "action=success")
    @Operation(summary = "Record a successful attempt", description = "Ends the current retry sequence of the job.")
    public ResponseEntity<ApiResponse<RetryRecordResult>> recordSuccess(
            @RequestParam("jobId") UUID jobId,
            @Parameter(description = "Dependency that succeeded, optional")
            @RequestParam(name = "service", required = false) String service) {
        RetryRecordResult result = service != null && !service.isBlank()
            ? retryTracker.recordSuccess(jobId, ExternalService.fromString(service))
            : retryTracker.recordSuccess(jobId);
        return ResponseEntity.ok(ApiResponse.forJob("success", jobId, result));
    }

    @GetMapping(params = "action=history")
    @Operation(summary = "Retry log of a job")
    public ResponseEntity<ApiResponse<RetryHistory>> history(@RequestParam("jobId") UUID jobId) {
        return ResponseEntity.ok(ApiResponse.forJob("history", jobId, retryTracker.getRetryHistory(jobId)));
    }

    @GetMapping(params = "action=eligibility")
    @Operation(summary = "Whether a job may be retried now")
    public ResponseEntity<ApiResponse<RetryEligibility>> eligibility(@RequestParam("jobId") UUID jobId) {
        return ResponseEntity.ok(ApiResponse.forJob("eligibility", jobId, retryTracker.canRetryJob(jobId)));
    }

    @GetMapping(params = "action=stats")
    @Operation(summary = "Aggregate retry statistics")
    public ResponseEntity<ApiResponse<RetryStatistics>> stats() {
        return ResponseEntity.ok(ApiResponse.success("stats", retryTracker.getRetryStatistics()));
    }

    @PostMapping(params = "action=cleanup")
    @Operation(
            summary = "Purge old retry data",
            description = "Deletes attempt rows of completed and cancelled jobs older than retry.retention-days."
    )
    public ResponseEntity<ApiResponse<CleanupResult>> cleanup() {
        return ResponseEntity.ok(ApiResponse.success("cleanup", retryTracker.cleanupRetryData()));
    }

    @GetMapping(params = "action=config")
    @Operation(summary = "Active retry policy and retry settings", description = "Read-only; replace the policy through PUT /admin/api/retry/config.")
    public ResponseEntity<ApiResponse<Map<String, Object>>> config() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("policy", retryPolicyProvider.getConfig());
        config.put("defaultMaxRetries", retryProperties.getDefaultMaxRetries());
        config.put("retentionDays", retryProperties.getRetentionDays());
        config.put("cleanupCron", retryProperties.getCleanupCron());
        return ResponseEntity.ok(ApiResponse.success("config", config));
    }

    @RequestMapping
    public ResponseEntity<ApiResponse<Void>> unknownAction(
            @RequestParam(name = "action", required = false) String action) {
        throw new BadRequestException(action == null ? "Action is required" : "Unknown action: " + action);
    }
}
