package com.clapgrow.content.api.controller;

import com.clapgrow.content.api.annotation.AdminApi;
import com.clapgrow.content.api.annotation.RequireAdminAuth;
import com.clapgrow.content.api.dto.AdminPermissions;
import com.clapgrow.content.api.dto.AdminRetryAuditResponse;
import com.clapgrow.content.api.dto.AdminRetryEligibility;
import com.clapgrow.content.api.dto.AdminRetryRequest;
import com.clapgrow.content.api.dto.AdminRetryResult;
import com.clapgrow.content.api.dto.AdminRetryStatistics;
import com.clapgrow.content.api.dto.ApiResponse;
import com.clapgrow.content.api.dto.RetryConfigRequest;
import com.clapgrow.content.api.enums.AdminRetryType;
import com.clapgrow.content.api.enums.AdminRole;
import com.clapgrow.content.api.service.AdminRetryManager;
import com.clapgrow.content.api.service.BadRequestException;
import com.clapgrow.content.api.service.RetryPolicyProvider;
import com.clapgrow.content.common.retry.RetryConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Privileged retry operations. Every endpoint requires the X-Admin-Key header.
 */
@RestController
@RequestMapping("/admin/api/retry")
@RequiredArgsConstructor
@Tag(name = "Admin Retry", description = "Role-checked manual retries, audit trail and retry policy replacement")
@SecurityRequirement(name = "AdminKey")
public class AdminRetryController {

    private final AdminRetryManager adminRetryManager;
    private final RetryPolicyProvider retryPolicyProvider;

    @PostMapping(params = "action=test")
    @AdminApi
    @RequireAdminAuth
    @Operation(
            summary = "Execute an admin retry",
            description = "Checks the role's permissions and the job's eligibility, then requeues the job to PENDING. " +
                    "force_override (admin and super_admin only) bypasses eligibility; the bypassed reason is audited."
    )
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job requeued"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Job not eligible or invalid request"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "401", description = "Authentication required"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "Role not permitted"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Job not found")
    })
    public ResponseEntity<ApiResponse<AdminRetryResult>> executeRetry(@Valid @RequestBody AdminRetryRequest request) {
        AdminRetryResult result = adminRetryManager.executeAdminRetry(request);
        if (!result.permissionGranted()) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(ApiResponse.failure("test", request.getJobId(), result, result.error()));
        }
        if (!result.success()) {
            return ResponseEntity.badRequest()
                .body(ApiResponse.failure("test", request.getJobId(), result, result.error()));
        }
        return ResponseEntity.ok(ApiResponse.forJob("test", request.getJobId(), result));
    }

    @GetMapping(params = "action=statistics")
    @AdminApi
    @RequireAdminAuth
    @Operation(summary = "Admin retry statistics over the last N days")
    public ResponseEntity<ApiResponse<AdminRetryStatistics>> statistics(
            @Parameter(description = "Look-back period in days", example = "30")
            @RequestParam(name = "days", defaultValue = "30") int days) {
        return ResponseEntity.ok(ApiResponse.success("statistics", adminRetryManager.getAdminRetryStatistics(days)));
    }

    @GetMapping(params = "action=history")
    @AdminApi
    @RequireAdminAuth
    @Operation(summary = "Admin retry audit trail of a job, newest first")
    public ResponseEntity<ApiResponse<List<AdminRetryAuditResponse>>> history(@RequestParam("jobId") UUID jobId) {
        return ResponseEntity.ok(ApiResponse.forJob("history", jobId, adminRetryManager.getAdminRetryHistory(jobId)));
    }

    @GetMapping(params = {"action=permissions", "role"})
    @AdminApi
    @RequireAdminAuth
    @Operation(summary = "Retry permissions of a role")
    public ResponseEntity<ApiResponse<AdminPermissions>> permissions(
            @Parameter(description = "user, content_manager, admin or super_admin", example = "admin")
            @RequestParam("role") String role) {
        return ResponseEntity.ok(ApiResponse.success("permissions",
            adminRetryManager.getPermissions(AdminRole.fromString(role))));
    }

    @GetMapping(params = {"action=permissions", "!role"})
    @AdminApi
    @RequireAdminAuth
    @Operation(summary = "Retry permissions of every role")
    public ResponseEntity<ApiResponse<Map<AdminRole, AdminPermissions>>> allPermissions() {
        return ResponseEntity.ok(ApiResponse.success("permissions", adminRetryManager.getAllPermissions()));
    }

    @GetMapping(params = "action=eligibility")
    @AdminApi
    @RequireAdminAuth
    @Operation(summary = "Whether a job may be retried by an admin, with warnings")
    public ResponseEntity<ApiResponse<AdminRetryEligibility>> eligibility(
            @RequestParam("jobId") UUID jobId,
            @Parameter(description = "Retry type to check, defaults to manual_retry", example = "manual_retry")
            @RequestParam(name = "retryType", required = false) String retryType) {
        AdminRetryType type = retryType != null ? parseRetryType(retryType) : null;
        return ResponseEntity.ok(ApiResponse.forJob("eligibility", jobId,
            adminRetryManager.checkEligibility(jobId, type)));
    }

    @PutMapping("/config")
    @AdminApi
    @RequireAdminAuth
    @Operation(
            summary = "Replace the retry policy",
            description = "Validates the new configuration and swaps it atomically. Attempts already in flight keep their decision."
    )
    public ResponseEntity<ApiResponse<Map<String, RetryConfig>>> replaceConfig(@Valid @RequestBody RetryConfigRequest request) {
        RetryConfig replacement = request.toRetryConfig();
        RetryConfig previous = retryPolicyProvider.replace(replacement);

        Map<String, RetryConfig> result = new LinkedHashMap<>();
        result.put("previous", previous);
        result.put("current", replacement);
        return ResponseEntity.ok(ApiResponse.success("config", result));
    }

    @RequestMapping
    @AdminApi
    @RequireAdminAuth
    public ResponseEntity<ApiResponse<Void>> unknownAction(
            @RequestParam(name = "action", required = false) String action) {
        throw new BadRequestException(action == null ? "Action is required" : "Unknown action: " + action);
    }

    private static AdminRetryType parseRetryType(String value) {
        try {
            return AdminRetryType.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Unknown retry type: " + value, e);
        }
    }
}
