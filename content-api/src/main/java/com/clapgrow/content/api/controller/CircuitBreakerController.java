package com.clapgrow.content.api.controller;

import com.clapgrow.content.api.annotation.AdminApi;
import com.clapgrow.content.api.annotation.RequireAdminAuth;
import com.clapgrow.content.api.dto.ApiResponse;
import com.clapgrow.content.api.dto.CircuitBreakerStatus;
import com.clapgrow.content.api.service.BadRequestException;
import com.clapgrow.content.api.service.CircuitBreakerService;
import com.clapgrow.content.common.service.ExternalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Circuit Breaker", description = "Per-dependency circuit breaker state")
public class CircuitBreakerController {

    private final CircuitBreakerService circuitBreakerService;

    @GetMapping(value = "/api/circuit-breaker", params = "service")
    @Operation(summary = "State of one dependency's circuit breaker")
    public ResponseEntity<ApiResponse<CircuitBreakerStatus>> status(
            @Parameter(description = "Dependency key", example = "generation-api")
            @RequestParam("service") String service,
            @RequestParam(name = "action", defaultValue = "status") String action) {
        requireStatusAction(action);
        ExternalService dependency = ExternalService.fromString(service);
        return ResponseEntity.ok(ApiResponse.forService("status", dependency.getKey(),
            circuitBreakerService.getState(dependency)));
    }

    @GetMapping(value = "/api/circuit-breaker", params = "!service")
    @Operation(summary = "State of every circuit breaker")
    public ResponseEntity<ApiResponse<List<CircuitBreakerStatus>>> allStatuses(
            @RequestParam(name = "action", defaultValue = "status") String action) {
        requireStatusAction(action);
        return ResponseEntity.ok(ApiResponse.success("status", circuitBreakerService.getAllStates()));
    }

    @PostMapping("/admin/api/circuit-breaker/reset")
    @AdminApi
    @RequireAdminAuth
    @Operation(
            summary = "Force a circuit breaker closed",
            description = "Clears failure counters and any probe. Requires the X-Admin-Key header."
    )
    @SecurityRequirement(name = "AdminKey")
    public ResponseEntity<ApiResponse<CircuitBreakerStatus>> reset(@RequestParam("service") String service) {
        ExternalService dependency = ExternalService.fromString(service);
        log.info("Manual circuit breaker reset requested for {}", dependency.getKey());
        return ResponseEntity.ok(ApiResponse.forService("reset", dependency.getKey(),
            circuitBreakerService.reset(dependency)));
    }

    private void requireStatusAction(String action) {
        if (!"status".equals(action)) {
            throw new BadRequestException("Unknown action: " + action);
        }
    }
}
