package com.clapgrow.content.api.controller;

import com.clapgrow.content.api.dto.ApiResponse;
import com.clapgrow.content.api.dto.AttemptFailureRequest;
import com.clapgrow.content.api.dto.AttemptOutcomeResult;
import com.clapgrow.content.api.dto.AttemptPermit;
import com.clapgrow.content.api.dto.AttemptStartRequest;
import com.clapgrow.content.api.dto.AttemptSuccessRequest;
import com.clapgrow.content.api.dto.CreateJobRequest;
import com.clapgrow.content.api.dto.JobResponse;
import com.clapgrow.content.api.service.BadRequestException;
import com.clapgrow.content.api.service.JobAttemptService;
import com.clapgrow.content.api.service.JobService;
import com.clapgrow.content.common.service.ExternalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
@Tag(name = "Jobs", description = "Content job creation and attempt reporting")
public class JobController {

    private final JobService jobService;
    private final JobAttemptService jobAttemptService;

    @PostMapping
    @Operation(
            summary = "Create a content job",
            description = "Creates a job in PENDING. max_retries defaults to retry.default-max-retries."
    )
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Job created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid request data")
    })
    public ResponseEntity<ApiResponse<JobResponse>> createJob(@Valid @RequestBody CreateJobRequest request) {
        JobResponse job = jobService.createJob(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.forJob("create", job.id(), job));
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get a content job")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Job not found")
    })
    public ResponseEntity<ApiResponse<JobResponse>> getJob(@PathVariable("jobId") UUID jobId) {
        return ResponseEntity.ok(ApiResponse.forJob("get", jobId, jobService.getJob(jobId)));
    }

    @PostMapping(value = "/{jobId}/attempts", params = "action=start")
    @Operation(
            summary = "Start an attempt against an external service",
            description = "Checks the circuit breaker, then the rate limiter, then moves the job to PROCESSING. " +
                    "A short-circuited call answers 503 and a rate-limited one 429, both with Retry-After."
    )
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Attempt may proceed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Job cannot be attempted in its current status"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Rate limit reached"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Circuit breaker open")
    })
    public ResponseEntity<ApiResponse<AttemptPermit>> startAttempt(
            @PathVariable("jobId") UUID jobId,
            @Valid @RequestBody AttemptStartRequest request) {
        ExternalService service = ExternalService.fromString(request.getService());
        AttemptPermit permit = jobAttemptService.beginAttempt(jobId, service, request.getEstimatedTokens());
        if (permit.allowed()) {
            return ResponseEntity.ok(ApiResponse.forJob("start", jobId, permit));
        }

        HttpStatus status = permit.shortCircuited()
            ? HttpStatus.SERVICE_UNAVAILABLE
            : permit.rateLimited() ? HttpStatus.TOO_MANY_REQUESTS : HttpStatus.CONFLICT;
        ResponseEntity.BodyBuilder response = ResponseEntity.status(status);
        if (permit.waitTimeMs() > 0) {
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1, (permit.waitTimeMs() + 999) / 1000)));
        }
        return response.body(ApiResponse.failure("start", jobId, permit, permit.reason()));
    }

    @PostMapping(value = "/{jobId}/attempts", params = "action=success")
    @Operation(
            summary = "Report a successful attempt",
            description = "Records rate-limit usage, closes the breaker window, logs the success and completes the job " +
                    "when finalStep is true. Ignored for jobs already completed or cancelled."
    )
    public ResponseEntity<ApiResponse<AttemptOutcomeResult>> recordSuccess(
            @PathVariable("jobId") UUID jobId,
            @Valid @RequestBody AttemptSuccessRequest request) {
        AttemptOutcomeResult result = jobAttemptService.recordAttemptSuccess(jobId, request);
        return ResponseEntity.ok(ApiResponse.forJob("success", jobId, result));
    }

    @PostMapping(value = "/{jobId}/attempts", params = "action=failure")
    @Operation(
            summary = "Report a failed attempt",
            description = "Classifies the failure, feeds the circuit breaker and rate limiter, appends to the retry log, " +
                    "marks the job FAILED and requeues it when a further retry is allowed."
    )
    public ResponseEntity<ApiResponse<AttemptOutcomeResult>> recordFailure(
            @PathVariable("jobId") UUID jobId,
            @Valid @RequestBody AttemptFailureRequest request) {
        AttemptOutcomeResult result = jobAttemptService.recordAttemptFailure(jobId, request);
        return ResponseEntity.ok(ApiResponse.forJob("failure", jobId, result));
    }

    @PostMapping("/{jobId}/attempts")
    public ResponseEntity<ApiResponse<Void>> unknownAttemptAction(
            @PathVariable("jobId") UUID jobId,
            @Parameter(description = "One of start, success, failure")
            @RequestParam(name = "action", required = false) String action) {
        throw new BadRequestException(action == null ? "Action is required" : "Unknown action: " + action);
    }
}
