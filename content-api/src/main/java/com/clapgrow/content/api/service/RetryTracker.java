package com.clapgrow.content.api.service;

import com.clapgrow.content.api.config.RetryProperties;
import com.clapgrow.content.api.dto.CleanupResult;
import com.clapgrow.content.api.dto.RetryAttemptResponse;
import com.clapgrow.content.api.dto.RetryEligibility;
import com.clapgrow.content.api.dto.RetryHistory;
import com.clapgrow.content.api.dto.RetryRecordResult;
import com.clapgrow.content.api.dto.RetryStatistics;
import com.clapgrow.content.api.entity.ContentJob;
import com.clapgrow.content.api.entity.RetryAttempt;
import com.clapgrow.content.api.enums.AttemptOutcome;
import com.clapgrow.content.api.enums.JobStatus;
import com.clapgrow.content.api.enums.TransitionActor;
import com.clapgrow.content.api.exception.JobNotFoundException;
import com.clapgrow.content.api.repository.ContentJobRepository;
import com.clapgrow.content.api.repository.RetryAttemptRepository;
import com.clapgrow.content.common.retry.ClassifiedError;
import com.clapgrow.content.common.retry.ErrorCategory;
import com.clapgrow.content.common.retry.RetryDecision;
import com.clapgrow.content.common.retry.RetryPolicy;
import com.clapgrow.content.common.service.ExternalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Append-only attempt log per job and the retry decisions derived from it.
 * 
 * Responsibilities:
 * - Append a RetryAttempt for every failed or successful attempt (attempt_number strictly increasing)
 * - Maintain the job's retry_count (never above max_retries)
 * - Answer "can this job retry again" from the full history and the live RetryPolicy,
 *   so configuration changes apply retroactively without rewriting rows
 * - Purge attempt rows of terminal jobs after the retention period
 * 
 * A retry sequence is the run of system failures since the last success or admin intervention.
 * Its length is the attempt number handed to RetryPolicy and its span is the elapsed time.
 * 
 * A failure reported for a COMPLETED or CANCELLED job is ignored: no row is appended and the job is
 * not touched. The status is read under the row lock, so a cancel that lands first always wins.
 * 
 * ⚠️ CONCURRENCY: Recording locks the job row, so two workers reporting at once get distinct,
 * ordered attempt numbers. The unique (job_id, attempt_number) key backs this up.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetryTracker {

    private static final Set<JobStatus> TERMINAL_STATUSES = EnumSet.of(JobStatus.COMPLETED, JobStatus.CANCELLED);

    private final ContentJobRepository jobRepository;
    private final RetryAttemptRepository attemptRepository;
    private final RetryPolicyProvider policyProvider;
    private final CircuitBreakerService circuitBreakerService;
    private final RateLimiterService rateLimiterService;
    private final RetryProperties retryProperties;
    private final ResilienceMetricsService metricsService;
    private final Clock clock;

    @Transactional
    public RetryRecordResult recordRetryAttempt(UUID jobId, ClassifiedError error) {
        return recordRetryAttempt(jobId, error, true, null);
    }

    /**
     * Append a failed attempt and decide whether the job may run again.
     * 
     * @param retryable false lets the caller veto a retry whatever the error category
     * @param service   dependency that failed; when given, an open breaker or a full rate-limit
     *                  window lengthens the returned delay
     */
    @Transactional
    public RetryRecordResult recordRetryAttempt(UUID jobId, ClassifiedError error, boolean retryable,
                                                ExternalService service) {
        if (error == null) {
            throw new BadRequestException("Classified error is required");
        }
        ContentJob job = jobRepository.findByIdForUpdate(jobId)
            .orElseThrow(() -> new JobNotFoundException(jobId));
        if (TERMINAL_STATUSES.contains(job.getStatus())) {
            log.info("Ignoring {} failure for job {} already {}", error.category(), jobId, job.getStatus());
            return RetryRecordResult.ignored(jobId, job.getRetryCount(), job.getMaxRetries(),
                String.format("Job is %s; attempt not recorded", job.getStatus()));
        }
        LocalDateTime now = LocalDateTime.now(clock);
        List<RetryAttempt> attempts = attemptRepository.findByJobIdOrderByAttemptNumberAsc(jobId);
        int attemptNumber = nextAttemptNumber(attempts);

        List<RetryAttempt> sequence = currentSequence(attempts);
        int failedAttempt = sequence.size() + 1;
        long elapsedMs = sequence.isEmpty() ? 0 : Duration.between(sequence.get(0).getCreatedAt(), now).toMillis();

        RetryPolicy policy = policyProvider.getPolicy();
        RetryDecision decision = retryable
            ? policy.evaluate(error, failedAttempt, elapsedMs)
            : RetryDecision.stop("Failure marked non-retryable by caller");

        if (job.getRetryCount() < job.getMaxRetries()) {
            job.setRetryCount(job.getRetryCount() + 1);
        }

        boolean eligible = decision.shouldRetry() && job.getRetryCount() < job.getMaxRetries();
        String reason = decision.shouldRetry() && !eligible
            ? String.format("Job reached max retries (%d)", job.getMaxRetries())
            : decision.reason();

        long delayMs = 0;
        if (eligible) {
            delayMs = decision.delayMs();
            if (service != null) {
                delayMs = Math.max(delayMs, circuitBreakerService.getRetryAfterMs(service));
                delayMs = Math.max(delayMs, rateLimiterService.peekWaitTimeMs(service));
            }
        }

        AttemptOutcome outcome = eligible ? AttemptOutcome.FAILED : AttemptOutcome.EXHAUSTED;
        String sanitizedMessage = ErrorMessageSanitizer.sanitize(error.message());

        RetryAttempt attempt = new RetryAttempt();
        attempt.setJobId(jobId);
        attempt.setAttemptNumber(attemptNumber);
        attempt.setErrorCategory(error.category());
        attempt.setRetryable(retryable && error.retryable());
        attempt.setHttpStatus(error.httpStatus());
        attempt.setErrorMessage(sanitizedMessage);
        attempt.setDelayAppliedMs(delayMs);
        attempt.setOutcome(outcome);
        attempt.setService(service);
        attempt.setActor(TransitionActor.SYSTEM);
        attempt.setReason(reason);
        attempt.setCreatedAt(now);
        attemptRepository.save(attempt);

        job.setLastError(sanitizedMessage != null ? sanitizedMessage : error.userMessage());
        job.setLastErrorCategory(error.category());
        job.setNextRetryAt(eligible ? now.plus(Duration.ofMillis(delayMs)) : null);
        jobRepository.save(job);

        metricsService.recordRetryAttempt(error.category(), delayMs);
        log.info("Recorded attempt {} for job {}: category={}, outcome={}, retryCount={}/{}, delay={} ms",
            attemptNumber, jobId, error.category(), outcome, job.getRetryCount(), job.getMaxRetries(), delayMs);

        return new RetryRecordResult(jobId, attemptNumber, outcome, job.getRetryCount(), job.getMaxRetries(),
            delayMs, eligible, error.category(), reason, error.userMessage());
    }

    /**
     * Append a SUCCEEDED attempt. retry_count is history and stays unchanged.
     * Each call appends a row; repeated calls are not deduplicated.
     */
    @Transactional
    public RetryRecordResult recordSuccess(UUID jobId) {
        return recordSuccess(jobId, null);
    }

    @Transactional
    public RetryRecordResult recordSuccess(UUID jobId, ExternalService service) {
        ContentJob job = jobRepository.findByIdForUpdate(jobId)
            .orElseThrow(() -> new JobNotFoundException(jobId));
        LocalDateTime now = LocalDateTime.now(clock);
        int attemptNumber = attemptRepository.findMaxAttemptNumber(jobId) + 1;

        RetryAttempt attempt = new RetryAttempt();
        attempt.setJobId(jobId);
        attempt.setAttemptNumber(attemptNumber);
        attempt.setRetryable(false);
        attempt.setDelayAppliedMs(0L);
        attempt.setOutcome(AttemptOutcome.SUCCEEDED);
        attempt.setService(service);
        attempt.setActor(TransitionActor.SYSTEM);
        attempt.setReason("Attempt succeeded");
        attempt.setCreatedAt(now);
        attemptRepository.save(attempt);

        job.setNextRetryAt(null);
        jobRepository.save(job);

        log.info("Recorded successful attempt {} for job {} (retryCount={})", attemptNumber, jobId, job.getRetryCount());
        return new RetryRecordResult(jobId, attemptNumber, AttemptOutcome.SUCCEEDED, job.getRetryCount(),
            job.getMaxRetries(), 0, false, null, "Attempt succeeded", null);
    }

    /**
     * Re-derive retry eligibility from the stored history and the current policy.
     */
    @Transactional(readOnly = true)
    public RetryEligibility canRetryJob(UUID jobId) {
        ContentJob job = jobRepository.findById(jobId)
            .orElseThrow(() -> new JobNotFoundException(jobId));
        int retryCount = job.getRetryCount();
        int maxRetries = job.getMaxRetries();

        if (job.getStatus() == JobStatus.COMPLETED || job.getStatus() == JobStatus.CANCELLED) {
            return new RetryEligibility(jobId, false, "Job is " + job.getStatus(), retryCount, maxRetries,
                0, 0, job.getLastErrorCategory(), 0);
        }

        List<RetryAttempt> attempts = attemptRepository.findByJobIdOrderByAttemptNumberAsc(jobId);
        if (attempts.isEmpty()) {
            return new RetryEligibility(jobId, true, "No attempts recorded", retryCount, maxRetries, 0, 0, null, 0);
        }

        RetryAttempt last = attempts.get(attempts.size() - 1);
        if (last.getOutcome() == AttemptOutcome.SUCCEEDED) {
            return new RetryEligibility(jobId, false, "Last attempt succeeded", retryCount, maxRetries,
                0, 0, null, 0);
        }

        List<RetryAttempt> sequence = currentSequence(attempts);
        if (sequence.isEmpty()) {
            boolean canRetry = retryCount < maxRetries || Boolean.TRUE.equals(job.getMaxRetriesOverridden());
            return new RetryEligibility(jobId, canRetry,
                canRetry ? "Requeued by admin" : String.format("Job reached max retries (%d)", maxRetries),
                retryCount, maxRetries, 0, 0, job.getLastErrorCategory(), 0);
        }

        RetryAttempt lastFailure = sequence.get(sequence.size() - 1);
        ErrorCategory category = lastFailure.getErrorCategory() != null ? lastFailure.getErrorCategory() : ErrorCategory.UNKNOWN;
        long elapsedMs = Duration.between(sequence.get(0).getCreatedAt(), LocalDateTime.now(clock)).toMillis();
        ClassifiedError error = new ClassifiedError(category, lastFailure.getHttpStatus(), null, null,
            lastFailure.getErrorMessage());

        RetryDecision decision = policyProvider.getPolicy().evaluate(error, sequence.size(), elapsedMs);
        boolean canRetry;
        String reason;
        if (!decision.shouldRetry()) {
            canRetry = false;
            reason = decision.reason();
        } else if (category.isRetryable() && !Boolean.TRUE.equals(lastFailure.getRetryable())) {
            canRetry = false;
            reason = "Last failure was marked non-retryable";
        } else if (retryCount >= maxRetries) {
            canRetry = false;
            reason = String.format("Job reached max retries (%d)", maxRetries);
        } else {
            canRetry = true;
            reason = decision.reason();
        }

        return new RetryEligibility(jobId, canRetry, reason, retryCount, maxRetries, sequence.size(), elapsedMs,
            category, canRetry ? decision.delayMs() : 0);
    }

    @Transactional(readOnly = true)
    public RetryHistory getRetryHistory(UUID jobId) {
        ContentJob job = jobRepository.findById(jobId)
            .orElseThrow(() -> new JobNotFoundException(jobId));
        List<RetryAttemptResponse> attempts = attemptRepository.findByJobIdOrderByAttemptNumberAsc(jobId).stream()
            .map(RetryAttemptResponse::from)
            .toList();
        return new RetryHistory(jobId, job.getStatus(), job.getRetryCount(), job.getMaxRetries(), attempts);
    }

    @Transactional(readOnly = true)
    public RetryStatistics getRetryStatistics() {
        long retried = jobRepository.countByRetryCountGreaterThan(0);
        long retriedAndCompleted = jobRepository.countByStatusAndRetryCountGreaterThan(JobStatus.COMPLETED, 0);
        Double average = jobRepository.averageRetryCountOfRetriedJobs();
        return new RetryStatistics(
            retried,
            jobRepository.countRetryableFailedJobs(),
            jobRepository.countJobsAtMaxRetries(),
            average != null ? average : 0.0,
            retried > 0 ? (double) retriedAndCompleted / retried : 0.0
        );
    }

    /**
     * Purge attempt rows of completed and cancelled jobs older than retry.retention-days.
     * Rows of pending, processing and failed jobs are never touched.
     */
    @Transactional
    public CleanupResult cleanupRetryData() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(retryProperties.getRetentionDays());
        int deleted = attemptRepository.deleteAttemptsOlderThanForStatuses(cutoff, TERMINAL_STATUSES);
        log.info("Deleted {} retry attempt rows of terminal jobs older than {}", deleted, cutoff);
        return new CleanupResult("job_retry_attempts", deleted, cutoff);
    }

    private static int nextAttemptNumber(List<RetryAttempt> attempts) {
        return attempts.stream()
            .mapToInt(RetryAttempt::getAttemptNumber)
            .max()
            .orElse(0) + 1;
    }

    /**
     * System failures recorded after the last success or admin intervention, in order.
     */
    static List<RetryAttempt> currentSequence(List<RetryAttempt> attempts) {
        List<RetryAttempt> sequence = new ArrayList<>();
        for (RetryAttempt attempt : attempts) {
            if (attempt.getActor() == TransitionActor.ADMIN || attempt.getOutcome() == AttemptOutcome.SUCCEEDED) {
                sequence.clear();
                continue;
            }
            if (attempt.getOutcome() == AttemptOutcome.FAILED || attempt.getOutcome() == AttemptOutcome.EXHAUSTED) {
                sequence.add(attempt);
            }
        }
        return sequence;
    }
}
