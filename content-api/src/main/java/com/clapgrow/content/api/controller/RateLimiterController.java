package com.clapgrow.content.api.controller;

import com.clapgrow.content.api.annotation.AdminApi;
import com.clapgrow.content.api.annotation.RequireAdminAuth;
import com.clapgrow.content.api.dto.ApiResponse;
import com.clapgrow.content.api.dto.RateLimitDecision;
import com.clapgrow.content.api.dto.RateLimitInfo;
import com.clapgrow.content.api.dto.RateLimitStats;
import com.clapgrow.content.api.dto.RecordUsageRequest;
import com.clapgrow.content.api.service.BadRequestException;
import com.clapgrow.content.api.service.RateLimiterService;
import com.clapgrow.content.common.service.ExternalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rate-limiter")
@RequiredArgsConstructor
@Tag(name = "Rate Limiter", description = "Per-service request and token quotas")
public class RateLimiterController {

    private final RateLimiterService rateLimiterService;

    @GetMapping(params = "action=stats")
    @Operation(summary = "Usage statistics of a service", description = "Requests, tokens, success rate and utilization over the last minute and hour.")
    public ResponseEntity<ApiResponse<RateLimitStats>> stats(
            @Parameter(description = "Service key", example = "generation-api")
            @RequestParam("service") String service) {
        ExternalService externalService = ExternalService.fromString(service);
        return ResponseEntity.ok(ApiResponse.forService("stats", externalService.getKey(),
            rateLimiterService.getStats(externalService)));
    }

    @GetMapping(params = "action=info")
    @Operation(summary = "Limits, remaining capacity and reset times of a service")
    public ResponseEntity<ApiResponse<RateLimitInfo>> info(@RequestParam("service") String service) {
        ExternalService externalService = ExternalService.fromString(service);
        return ResponseEntity.ok(ApiResponse.forService("info", externalService.getKey(),
            rateLimiterService.getRateLimitInfo(externalService)));
    }

    @PostMapping(params = "action=test")
    @Operation(
            summary = "Check and reserve quota for one request",
            description = "Reserves one request and the estimated tokens when every window has room. " +
                    "Answers 429 with Retry-After otherwise."
    )
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Request allowed and reserved"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Rate limit reached")
    })
    public ResponseEntity<ApiResponse<RateLimitDecision>> test(
            @RequestParam("service") String service,
            @Parameter(description = "Estimated token volume (generation API only)")
            @RequestParam(name = "estimatedTokens", required = false) Long estimatedTokens) {
        ExternalService externalService = ExternalService.fromString(service);
        RateLimitDecision decision = rateLimiterService.canMakeRequest(externalService, estimatedTokens);
        ApiResponse<RateLimitDecision> body = ApiResponse.forService("test", externalService.getKey(), decision);
        if (!decision.allowed()) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1, (decision.waitTimeMs() + 999) / 1000)))
                .body(body);
        }
        return ResponseEntity.ok(body);
    }

    @PostMapping(params = "action=record")
    @Operation(summary = "Record the real usage of a completed request", description = "Reconciles reserved tokens with the actual count.")
    public ResponseEntity<ApiResponse<RateLimitStats>> record(@Valid @RequestBody RecordUsageRequest request) {
        ExternalService externalService = ExternalService.fromString(request.getService());
        rateLimiterService.recordRequest(externalService, request.getActualTokens(), request.getReservedTokens(),
            request.getResponseTimeMs(), request.getSuccess());
        return ResponseEntity.ok(ApiResponse.forService("record", externalService.getKey(),
            rateLimiterService.getStats(externalService)));
    }

    @PostMapping(params = "action=reset")
    @AdminApi
    @RequireAdminAuth
    @Operation(summary = "Reset all windows of a service", description = "Requires the X-Admin-Key header.")
    @SecurityRequirement(name = "AdminKey")
    public ResponseEntity<ApiResponse<RateLimitInfo>> reset(@RequestParam("service") String service) {
        ExternalService externalService = ExternalService.fromString(service);
        return ResponseEntity.ok(ApiResponse.forService("reset", externalService.getKey(),
            rateLimiterService.reset(externalService)));
    }

    @RequestMapping
    public ResponseEntity<ApiResponse<Void>> unknownAction(
            @RequestParam(name = "action", required = false) String action) {
        throw new BadRequestException(action == null ? "Action is required" : "Unknown action: " + action);
    }
}
