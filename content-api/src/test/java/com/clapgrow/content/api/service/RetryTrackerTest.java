package com.clapgrow.content.api.service;

import com.clapgrow.content.api.config.RetryProperties;
import com.clapgrow.content.api.dto.CleanupResult;
import com.clapgrow.content.api.dto.RetryEligibility;
import com.clapgrow.content.api.dto.RetryRecordResult;
import com.clapgrow.content.api.entity.ContentJob;
import com.clapgrow.content.api.entity.RetryAttempt;
import com.clapgrow.content.api.enums.AttemptOutcome;
import com.clapgrow.content.api.enums.JobStatus;
import com.clapgrow.content.api.enums.TransitionActor;
import com.clapgrow.content.api.repository.ContentJobRepository;
import com.clapgrow.content.api.repository.RetryAttemptRepository;
import com.clapgrow.content.common.retry.ClassifiedError;
import com.clapgrow.content.common.retry.ErrorCategory;
import com.clapgrow.content.common.retry.RetryConfig;
import com.clapgrow.content.common.service.ExternalService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetryTrackerTest {

    @Mock
    private ContentJobRepository jobRepository;

    @Mock
    private RetryAttemptRepository attemptRepository;

    @Mock
    private CircuitBreakerService circuitBreakerService;

    @Mock
    private RateLimiterService rateLimiterService;

    @Mock
    private ResilienceMetricsService metricsService;

    private RetryPolicyProvider policyProvider;
    private RetryTracker retryTracker;
    private UUID jobId;
    private ContentJob job;
    private LocalDateTime now;
    private final List<RetryAttempt> attempts = new ArrayList<>();

    @BeforeEach
    void setUp() {
        RetryProperties retryProperties = new RetryProperties();
        retryProperties.setJitterFactor(0.0);
        retryProperties.setRetentionDays(30);
        policyProvider = new RetryPolicyProvider(retryProperties);

        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        now = LocalDateTime.now(clock);
        retryTracker = new RetryTracker(jobRepository, attemptRepository, policyProvider, circuitBreakerService,
            rateLimiterService, retryProperties, metricsService, clock);

        jobId = UUID.randomUUID();
        job = new ContentJob("Kotlin coroutines explained", 3);
        job.setId(jobId);
    }

    private void stubLockedJob() {
        when(jobRepository.findByIdForUpdate(jobId)).thenReturn(Optional.of(job));
        when(attemptRepository.findByJobIdOrderByAttemptNumberAsc(jobId)).thenReturn(attempts);
    }

    private RetryAttempt attempt(int number, AttemptOutcome outcome, TransitionActor actor, LocalDateTime createdAt) {
        RetryAttempt attempt = new RetryAttempt();
        attempt.setJobId(jobId);
        attempt.setAttemptNumber(number);
        attempt.setOutcome(outcome);
        attempt.setActor(actor);
        attempt.setErrorCategory(outcome == AttemptOutcome.SUCCEEDED ? null : ErrorCategory.SERVER);
        attempt.setRetryable(outcome != AttemptOutcome.SUCCEEDED);
        attempt.setCreatedAt(createdAt);
        return attempt;
    }

    private static ClassifiedError serverError() {
        return new ClassifiedError(ErrorCategory.SERVER, 502, null, null, "Bad Gateway");
    }

    @Test
    void testRecordRetryAttempt_FirstFailure_SchedulesBaseDelay() {
        stubLockedJob();

        RetryRecordResult result = retryTracker.recordRetryAttempt(jobId, serverError());

        assertEquals(1, result.attemptNumber());
        assertEquals(AttemptOutcome.FAILED, result.outcome());
        assertTrue(result.eligibleForFurtherRetry());
        assertEquals(1000, result.nextDelayMs());
        assertEquals(1, job.getRetryCount());
        assertEquals(now.plusSeconds(1), job.getNextRetryAt());
        assertEquals(ErrorCategory.SERVER, job.getLastErrorCategory());

        ArgumentCaptor<RetryAttempt> captor = ArgumentCaptor.forClass(RetryAttempt.class);
        verify(attemptRepository).save(captor.capture());
        assertEquals(1, captor.getValue().getAttemptNumber());
        assertEquals(502, captor.getValue().getHttpStatus());
        assertEquals(1000L, captor.getValue().getDelayAppliedMs());
        verify(metricsService).recordRetryAttempt(ErrorCategory.SERVER, 1000L);
        verifyNoInteractions(circuitBreakerService, rateLimiterService);
    }

    @Test
    void testRecordRetryAttempt_WhenBreakerOpen_WaitsForCoolDown() {
        stubLockedJob();
        when(circuitBreakerService.getRetryAfterMs(ExternalService.GENERATION_API)).thenReturn(45_000L);
        when(rateLimiterService.peekWaitTimeMs(ExternalService.GENERATION_API)).thenReturn(2_000L);

        RetryRecordResult result = retryTracker.recordRetryAttempt(jobId, serverError(), true, ExternalService.GENERATION_API);

        assertEquals(45_000, result.nextDelayMs());
        assertEquals(now.plusSeconds(45), job.getNextRetryAt());
    }

    @Test
    void testRecordRetryAttempt_RateLimitRetryAfterWins() {
        stubLockedJob();
        ClassifiedError error = new ClassifiedError(ErrorCategory.RATE_LIMIT, 429, "rate_limit_exceeded", 7_000L, "Too Many Requests");

        RetryRecordResult result = retryTracker.recordRetryAttempt(jobId, error);

        assertEquals(7_000, result.nextDelayMs());
    }

    @Test
    void testRecordRetryAttempt_WhenMaxAttemptsReached_MarksExhausted() {
        job.setMaxRetries(5);
        job.setRetryCount(2);
        attempts.add(attempt(1, AttemptOutcome.FAILED, TransitionActor.SYSTEM, now.minusSeconds(10)));
        attempts.add(attempt(2, AttemptOutcome.FAILED, TransitionActor.SYSTEM, now.minusSeconds(5)));
        stubLockedJob();

        RetryRecordResult result = retryTracker.recordRetryAttempt(jobId, serverError());

        assertEquals(3, result.attemptNumber());
        assertEquals(AttemptOutcome.EXHAUSTED, result.outcome());
        assertFalse(result.eligibleForFurtherRetry());
        assertEquals("Attempt 4 would exceed max attempts (3)", result.reason());
        assertEquals(3, job.getRetryCount());
        assertNull(job.getNextRetryAt());
    }

    @Test
    void testRecordRetryAttempt_WhenCategoryNotRetryable_StopsImmediately() {
        stubLockedJob();

        RetryRecordResult result = retryTracker.recordRetryAttempt(jobId,
            new ClassifiedError(ErrorCategory.AUTH, 401, "invalid_api_key", null, "Incorrect API key: sk-123"));

        assertEquals(AttemptOutcome.EXHAUSTED, result.outcome());
        assertEquals("Error category AUTH is not retryable", result.reason());
        assertEquals(0, result.nextDelayMs());
        assertEquals("Incorrect API key: ***", job.getLastError());
        assertEquals(ErrorCategory.AUTH.getUserMessage(), result.userMessage());
    }

    @Test
    void testRecordRetryAttempt_NeverRaisesRetryCountAboveMax() {
        job.setRetryCount(3);
        stubLockedJob();

        RetryRecordResult result = retryTracker.recordRetryAttempt(jobId, serverError());

        assertEquals(3, result.retryCount());
        assertFalse(result.eligibleForFurtherRetry());
        assertEquals("Job reached max retries (3)", result.reason());
    }

    @Test
    void testRecordRetryAttempt_CallerVetoOverridesRetryableCategory() {
        stubLockedJob();

        RetryRecordResult result = retryTracker.recordRetryAttempt(jobId, serverError(), false, null);

        assertEquals(AttemptOutcome.EXHAUSTED, result.outcome());
        assertEquals("Failure marked non-retryable by caller", result.reason());
    }

    @ParameterizedTest
    @EnumSource(value = JobStatus.class, names = {"COMPLETED", "CANCELLED"})
    void testRecordRetryAttempt_WhenJobTerminal_WritesNothing(JobStatus status) {
        job.setStatus(status);
        when(jobRepository.findByIdForUpdate(jobId)).thenReturn(Optional.of(job));

        RetryRecordResult result = retryTracker.recordRetryAttempt(jobId, serverError(), true,
            ExternalService.GENERATION_API);

        assertEquals(0, result.attemptNumber());
        assertNull(result.outcome());
        assertFalse(result.eligibleForFurtherRetry());
        assertEquals(0, result.nextDelayMs());
        assertEquals("Job is " + status + "; attempt not recorded", result.reason());
        assertEquals(0, job.getRetryCount());
        assertNull(job.getNextRetryAt());
        verify(attemptRepository, never()).save(any());
        verify(jobRepository, never()).save(any());
        verifyNoInteractions(circuitBreakerService, rateLimiterService, metricsService);
    }

    @Test
    void testRecordRetryAttempt_WithoutError_ThrowsBadRequest() {
        assertThrows(BadRequestException.class, () -> retryTracker.recordRetryAttempt(jobId, null));
        verifyNoInteractions(jobRepository, attemptRepository);
    }

    @Test
    void testCurrentSequence_RestartsAfterSuccessOrAdminIntervention() {
        List<RetryAttempt> history = List.of(
            attempt(1, AttemptOutcome.FAILED, TransitionActor.SYSTEM, now.minusMinutes(30)),
            attempt(2, AttemptOutcome.EXHAUSTED, TransitionActor.SYSTEM, now.minusMinutes(25)),
            attempt(3, AttemptOutcome.RESET, TransitionActor.ADMIN, now.minusMinutes(20)),
            attempt(4, AttemptOutcome.FAILED, TransitionActor.SYSTEM, now.minusMinutes(10)));

        List<RetryAttempt> sequence = RetryTracker.currentSequence(history);

        assertEquals(1, sequence.size());
        assertEquals(4, sequence.get(0).getAttemptNumber());
        assertTrue(RetryTracker.currentSequence(List.of(
            attempt(1, AttemptOutcome.FAILED, TransitionActor.SYSTEM, now.minusMinutes(2)),
            attempt(2, AttemptOutcome.SUCCEEDED, TransitionActor.SYSTEM, now.minusMinutes(1)))).isEmpty());
    }

    @Test
    void testRecordSuccess_AppendsRowWithoutTouchingRetryCount() {
        job.setRetryCount(2);
        job.setNextRetryAt(now.plusMinutes(1));
        when(jobRepository.findByIdForUpdate(jobId)).thenReturn(Optional.of(job));
        when(attemptRepository.findMaxAttemptNumber(jobId)).thenReturn(2);

        RetryRecordResult result = retryTracker.recordSuccess(jobId, ExternalService.PUBLISHING_API);

        assertEquals(3, result.attemptNumber());
        assertEquals(AttemptOutcome.SUCCEEDED, result.outcome());
        assertEquals(2, result.retryCount());
        assertNull(job.getNextRetryAt());
    }

    @Test
    void testRecordSuccess_CalledTwice_AppendsOneRowPerCallAndKeepsRetryCount() {
        job.setStatus(JobStatus.PROCESSING);
        job.setRetryCount(1);
        when(jobRepository.findByIdForUpdate(jobId)).thenReturn(Optional.of(job));
        when(attemptRepository.findMaxAttemptNumber(jobId)).thenReturn(4, 5);

        RetryRecordResult first = retryTracker.recordSuccess(jobId);
        RetryRecordResult second = retryTracker.recordSuccess(jobId);

        ArgumentCaptor<RetryAttempt> captor = ArgumentCaptor.forClass(RetryAttempt.class);
        verify(attemptRepository, times(2)).save(captor.capture());
        assertEquals(List.of(5, 6), captor.getAllValues().stream().map(RetryAttempt::getAttemptNumber).toList());
        assertTrue(captor.getAllValues().stream().allMatch(a -> a.getOutcome() == AttemptOutcome.SUCCEEDED));
        assertEquals(5, first.attemptNumber());
        assertEquals(6, second.attemptNumber());
        assertEquals(1, first.retryCount());
        assertEquals(1, second.retryCount());
        assertEquals(1, job.getRetryCount());
    }

    @Test
    void testCanRetryJob_AfterSuccess_IsNotEligible() {
        attempts.add(attempt(1, AttemptOutcome.FAILED, TransitionActor.SYSTEM, now.minusMinutes(2)));
        attempts.add(attempt(2, AttemptOutcome.SUCCEEDED, TransitionActor.SYSTEM, now.minusMinutes(1)));
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));
        when(attemptRepository.findByJobIdOrderByAttemptNumberAsc(jobId)).thenReturn(attempts);

        RetryEligibility eligibility = retryTracker.canRetryJob(jobId);

        assertFalse(eligibility.canRetry());
        assertEquals("Last attempt succeeded", eligibility.reason());
    }

    @Test
    void testCanRetryJob_WhenTerminal_IsNotEligible() {
        job.setStatus(JobStatus.CANCELLED);
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));

        RetryEligibility eligibility = retryTracker.canRetryJob(jobId);

        assertFalse(eligibility.canRetry());
        assertEquals("Job is CANCELLED", eligibility.reason());
        verifyNoInteractions(attemptRepository);
    }

    @Test
    void testCanRetryJob_ReflectsReplacedPolicy() {
        job.setMaxRetries(10);
        job.setRetryCount(3);
        job.setStatus(JobStatus.FAILED);
        for (int i = 1; i <= 3; i++) {
            attempts.add(attempt(i, AttemptOutcome.FAILED, TransitionActor.SYSTEM, now.minusSeconds(30 - i)));
        }
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));
        when(attemptRepository.findByJobIdOrderByAttemptNumberAsc(jobId)).thenReturn(attempts);

        assertFalse(retryTracker.canRetryJob(jobId).canRetry());

        policyProvider.replace(new RetryConfig(500, 30_000, 2.0, 0.0, 5, 60_000));
        RetryEligibility eligibility = retryTracker.canRetryJob(jobId);

        assertTrue(eligibility.canRetry());
        assertEquals(3, eligibility.failedAttempts());
        assertEquals(2_000, eligibility.nextDelayMs());
    }

    @Test
    void testCleanupRetryData_UsesRetentionCutoff() {
        when(attemptRepository.deleteAttemptsOlderThanForStatuses(eq(now.minusDays(30)), any())).thenReturn(12);

        CleanupResult result = retryTracker.cleanupRetryData();

        assertEquals(12, result.deletedRows());
        assertEquals(now.minusDays(30), result.cutoff());
    }
}
