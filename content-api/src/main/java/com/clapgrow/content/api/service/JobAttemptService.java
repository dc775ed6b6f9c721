package com.clapgrow.content.api.service;

import com.clapgrow.content.api.dto.AttemptFailureRequest;
import com.clapgrow.content.api.dto.AttemptOutcomeResult;
import com.clapgrow.content.api.dto.AttemptPermit;
import com.clapgrow.content.api.dto.AttemptSuccessRequest;
import com.clapgrow.content.api.dto.CircuitDecision;
import com.clapgrow.content.api.dto.RateLimitDecision;
import com.clapgrow.content.api.dto.RetryRecordResult;
import com.clapgrow.content.api.dto.TransitionResult;
import com.clapgrow.content.api.entity.ContentJob;
import com.clapgrow.content.api.enums.JobStatus;
import com.clapgrow.content.api.exception.JobNotFoundException;
import com.clapgrow.content.api.repository.ContentJobRepository;
import com.clapgrow.content.common.retry.ClassifiedError;
import com.clapgrow.content.common.retry.ErrorClassifier;
import com.clapgrow.content.common.service.ExternalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Drives one external call of a job through the resilience layer.
 * 
 * Flow per attempt:
 * 1. beginAttempt: circuit breaker, then rate limiter, then PENDING → PROCESSING
 * 2. the worker calls the dependency
 * 3. recordAttemptSuccess or recordAttemptFailure reports the outcome to the breaker,
 *    the rate limiter, the retry log and the job FSM
 * 
 * ⚠️ Not transactional: each step commits on its own, so breaker and quota state survive a
 * failure further down the chain. Outcomes reported against a terminal job are dropped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobAttemptService {

    private final ContentJobRepository jobRepository;
    private final CircuitBreakerService circuitBreakerService;
    private final RateLimiterService rateLimiterService;
    private final RetryTracker retryTracker;
    private final JobStatusManager jobStatusManager;
    private final JobStatusTransitionValidator transitionValidator;
    private final ErrorClassifier errorClassifier;
    private final Clock clock;

    public AttemptPermit beginAttempt(UUID jobId, ExternalService service, Long estimatedTokens) {
        ContentJob job = loadJob(jobId);
        JobStatus status = job.getStatus();

        if (transitionValidator.isTerminal(status)) {
            return AttemptPermit.refused(jobId, status, "Job is " + status + " and cannot be attempted");
        }
        if (status == JobStatus.FAILED) {
            return AttemptPermit.refused(jobId, status, "Job is FAILED; it must be requeued before a new attempt");
        }

        CircuitDecision circuit = circuitBreakerService.allowRequest(service);
        if (!circuit.allowed()) {
            log.warn("Attempt for job {} short-circuited: {}", jobId, circuit.reason());
            return AttemptPermit.shortCircuited(jobId, circuit.retryAfterMs(), status, circuit.reason());
        }

        RateLimitDecision rate = rateLimiterService.canMakeRequest(service, estimatedTokens);
        if (!rate.allowed()) {
            return AttemptPermit.rateLimited(jobId, rate.waitTimeMs(), status, rate.reason());
        }

        if (status == JobStatus.PENDING) {
            TransitionResult transition = jobStatusManager.transitionToProcessing(jobId);
            if (!transition.success()) {
                return AttemptPermit.refused(jobId, transition.fromStatus(), transition.error());
            }
        }
        log.debug("Attempt granted for job {} against {} (probe={}, tokens={})",
            jobId, service.getKey(), circuit.probe(), rate.reservedTokens());
        return AttemptPermit.granted(jobId, circuit.probe(), rate.reservedTokens(), JobStatus.PROCESSING);
    }

    public AttemptOutcomeResult recordAttemptSuccess(UUID jobId, AttemptSuccessRequest request) {
        ExternalService service = ExternalService.fromString(request.getService());
        ContentJob job = loadJob(jobId);
        if (transitionValidator.isTerminal(job.getStatus())) {
            log.info("Ignoring late success for job {} already {}", jobId, job.getStatus());
            return new AttemptOutcomeResult(jobId, true, job.getStatus(), null, null);
        }

        rateLimiterService.recordRequest(service, request.getActualTokens(), request.getReservedTokens(),
            request.getResponseTimeMs(), true);
        circuitBreakerService.recordSuccess(service);
        retryTracker.recordSuccess(jobId, service);

        JobStatus finalStatus = job.getStatus();
        if (request.isFinalStep()) {
            TransitionResult transition = jobStatusManager.transitionToCompleted(jobId,
                request.getTitle(), request.getContent(), request.getPostId());
            finalStatus = transition.success() ? transition.toStatus() : currentStatus(jobId);
        }
        return new AttemptOutcomeResult(jobId, false, finalStatus, null, null);
    }

    public AttemptOutcomeResult recordAttemptFailure(UUID jobId, AttemptFailureRequest request) {
        ExternalService service = ExternalService.fromString(request.getService());
        ContentJob job = loadJob(jobId);
        if (transitionValidator.isTerminal(job.getStatus())) {
            log.info("Ignoring late failure for job {} already {}", jobId, job.getStatus());
            return new AttemptOutcomeResult(jobId, true, job.getStatus(), null, null);
        }

        ClassifiedError error = errorClassifier.classify(request.toDescriptor());
        circuitBreakerService.recordFailure(service, error);
        rateLimiterService.recordRequest(service, null, request.getReservedTokens(),
            request.getResponseTimeMs(), false);
        RetryRecordResult retry = retryTracker.recordRetryAttempt(jobId, error, true, service);

        TransitionResult failed = jobStatusManager.transitionToFailed(jobId, error.message(), error.category());
        JobStatus finalStatus = failed.success() ? JobStatus.FAILED : currentStatus(jobId);

        if (failed.success() && retry.eligibleForFurtherRetry()) {
            LocalDateTime nextRetryAt = LocalDateTime.now(clock).plus(Duration.ofMillis(retry.nextDelayMs()));
            TransitionResult requeued = jobStatusManager.transitionToPending(jobId,
                String.format("Retry %d/%d scheduled after %s", retry.retryCount(), retry.maxRetries(),
                    error.category()),
                nextRetryAt);
            if (requeued.success()) {
                finalStatus = JobStatus.PENDING;
            }
        }
        log.info("Attempt {} of job {} failed with {} against {}; job now {}",
            retry.attemptNumber(), jobId, error.category(), service.getKey(), finalStatus);
        return new AttemptOutcomeResult(jobId, false, finalStatus, retry, error.userMessage());
    }

    private ContentJob loadJob(UUID jobId) {
        return jobRepository.findById(jobId)
            .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private JobStatus currentStatus(UUID jobId) {
        return loadJob(jobId).getStatus();
    }
}
