package com.clapgrow.content.api.controller;

import com.clapgrow.content.api.dto.ApiResponse;
import com.clapgrow.content.api.dto.ConsistencyReport;
import com.clapgrow.content.api.dto.InvalidTransition;
import com.clapgrow.content.api.dto.JobResponse;
import com.clapgrow.content.api.dto.StatusStatistics;
import com.clapgrow.content.api.dto.StatusTransitionResponse;
import com.clapgrow.content.api.dto.TransitionCommand;
import com.clapgrow.content.api.dto.TransitionRequest;
import com.clapgrow.content.api.dto.TransitionResult;
import com.clapgrow.content.api.enums.JobStatus;
import com.clapgrow.content.api.service.BadRequestException;
import com.clapgrow.content.api.service.JobStatusManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
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
import java.util.UUID;

@RestController
@RequestMapping("/api/job-status")
@RequiredArgsConstructor
@Tag(name = "Job Status", description = "Job status state machine and transition history")
public class JobStatusController {

    private final JobStatusManager jobStatusManager;

    @PostMapping(params = "action=test")
    @Operation(
            summary = "Transition a job",
            description = "Applies a status transition as the system actor. Illegal or concurrent transitions " +
                    "are rejected with 400 and leave the job unchanged."
    )
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Transition applied"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Transition rejected"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Job not found")
    })
    public ResponseEntity<ApiResponse<TransitionResult>> transition(@Valid @RequestBody TransitionRequest request) {
        String reason = request.getReason() != null ? request.getReason() : "Manual transition";
        TransitionResult result = jobStatusManager.transition(request.getJobId(),
            TransitionCommand.system(request.getToStatus(), reason));
        if (!result.success()) {
            return ResponseEntity.badRequest()
                .body(ApiResponse.failure("test", request.getJobId(), result, result.error()));
        }
        return ResponseEntity.ok(ApiResponse.forJob("test", request.getJobId(), result));
    }

    @GetMapping(params = "action=history")
    @Operation(summary = "Status transition history of a job, oldest first")
    public ResponseEntity<ApiResponse<List<StatusTransitionResponse>>> history(@RequestParam("jobId") UUID jobId) {
        return ResponseEntity.ok(ApiResponse.forJob("history", jobId, jobStatusManager.getStatusHistory(jobId)));
    }

    @GetMapping(params = "action=consistency")
    @Operation(summary = "Check a job's status against its transition history")
    public ResponseEntity<ApiResponse<ConsistencyReport>> consistency(@RequestParam("jobId") UUID jobId) {
        return ResponseEntity.ok(ApiResponse.forJob("consistency", jobId, jobStatusManager.validateConsistency(jobId)));
    }

    @GetMapping(params = "action=by-status")
    @Operation(summary = "Jobs in a status, oldest first")
    public ResponseEntity<ApiResponse<List<JobResponse>>> byStatus(
            @Parameter(description = "Job status, e.g. failed", example = "failed")
            @RequestParam("status") String status,
            @Parameter(description = "Maximum number of jobs (1-500)", example = "50")
            @RequestParam(name = "limit", defaultValue = "50") int limit) {
        return ResponseEntity.ok(ApiResponse.success("by-status", jobStatusManager.getJobsByStatus(JobStatus.fromString(status), limit)));
    }

    @GetMapping(params = "action=statistics")
    @Operation(summary = "Job counts per status and average processing time")
    public ResponseEntity<ApiResponse<StatusStatistics>> statistics() {
        return ResponseEntity.ok(ApiResponse.success("statistics", jobStatusManager.getStatusStatistics()));
    }

    @GetMapping(params = "action=invalid")
    @Operation(summary = "Status pairs the state machine refuses")
    public ResponseEntity<ApiResponse<List<InvalidTransition>>> invalidTransitions() {
        return ResponseEntity.ok(ApiResponse.success("invalid", jobStatusManager.getInvalidTransitions()));
    }

    @RequestMapping
    public ResponseEntity<ApiResponse<Void>> unknownAction(
            @RequestParam(name = "action", required = false) String action) {
        throw new BadRequestException(action == null ? "Action is required" : "Unknown action: " + action);
    }
}
