package com.clapgrow.content.api.service;

import com.clapgrow.content.api.dto.ConsistencyReport;
import com.clapgrow.content.api.dto.StatusStatistics;
import com.clapgrow.content.api.dto.TransitionCommand;
import com.clapgrow.content.api.dto.TransitionResult;
import com.clapgrow.content.api.entity.ContentJob;
import com.clapgrow.content.api.entity.JobStatusTransition;
import com.clapgrow.content.api.enums.AdminRole;
import com.clapgrow.content.api.enums.JobStatus;
import com.clapgrow.content.api.enums.TransitionActor;
import com.clapgrow.content.api.exception.JobNotFoundException;
import com.clapgrow.content.api.repository.ContentJobRepository;
import com.clapgrow.content.api.repository.JobStatusTransitionRepository;
import com.clapgrow.content.common.retry.ErrorCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobStatusManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private ContentJobRepository jobRepository;

    @Mock
    private JobStatusTransitionRepository transitionRepository;

    @Mock
    private ResilienceMetricsService metricsService;

    private JobStatusManager manager;
    private UUID jobId;
    private ContentJob job;
    private LocalDateTime now;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        now = LocalDateTime.now(clock);
        manager = new JobStatusManager(jobRepository, transitionRepository,
            new JobStatusTransitionValidator(), metricsService, clock);

        jobId = UUID.randomUUID();
        job = new ContentJob("Spring release notes", 3);
        job.setId(jobId);
    }

    private void stubAppliedTransition(JobStatus from, JobStatus to) {
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));
        when(jobRepository.atomicallyTransitionStatus(jobId, from, to, now)).thenAnswer(invocation -> {
            job.setStatus(to);
            return 1;
        });
        when(transitionRepository.save(any(JobStatusTransition.class))).thenAnswer(invocation -> {
            JobStatusTransition transition = invocation.getArgument(0);
            transition.setId(42L);
            return transition;
        });
    }

    @Test
    void testTransition_WhenLegal_UpdatesStatusAndAppendsAuditRow() {
        stubAppliedTransition(JobStatus.PENDING, JobStatus.PROCESSING);

        TransitionResult result = manager.transitionToProcessing(jobId);

        assertTrue(result.success());
        assertFalse(result.forced());
        assertEquals(42L, result.transitionId());
        assertEquals(JobStatus.PENDING, result.fromStatus());
        assertEquals(JobStatus.PROCESSING, result.toStatus());
        assertEquals(now, job.getStartedAt());

        ArgumentCaptor<JobStatusTransition> captor = ArgumentCaptor.forClass(JobStatusTransition.class);
        verify(transitionRepository).save(captor.capture());
        JobStatusTransition row = captor.getValue();
        assertEquals(JobStatus.PENDING, row.getFromStatus());
        assertEquals(JobStatus.PROCESSING, row.getToStatus());
        assertEquals(TransitionActor.SYSTEM, row.getActor());
        assertFalse(row.getForceOverride());
        assertEquals(now, row.getTimestamp());
        verify(jobRepository).save(job);
        verify(metricsService).recordTransition(JobStatus.PROCESSING);
    }

    @Test
    void testTransition_WhenIllegal_RejectsWithoutWriting() {
        job.setStatus(JobStatus.COMPLETED);
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));

        TransitionResult result = manager.transition(jobId,
            TransitionCommand.system(JobStatus.PROCESSING, "restart"));

        assertFalse(result.success());
        assertEquals("Invalid status transition: COMPLETED → PROCESSING", result.error());
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        verify(jobRepository, never()).atomicallyTransitionStatus(any(), any(), any(), any());
        verify(transitionRepository, never()).save(any());
        verifyNoInteractions(metricsService);
    }

    @Test
    void testTransition_WhenForceFlagWithoutAdminActor_StillRejects() {
        job.setStatus(JobStatus.COMPLETED);
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));
        TransitionCommand command = new TransitionCommand(JobStatus.PENDING, "requeue",
            TransitionActor.SYSTEM, null, null, true, null);

        TransitionResult result = manager.transition(jobId, command);

        assertFalse(result.success());
        verify(transitionRepository, never()).save(any());
    }

    @Test
    void testTransitionToCompleted_WhenAlreadyCompleted_LeavesJobUntouched() {
        LocalDateTime completedAt = now.minusMinutes(10);
        job.setStatus(JobStatus.COMPLETED);
        job.setGeneratedTitle("Original title");
        job.setCompletedAt(completedAt);
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));

        TransitionResult result = manager.transitionToCompleted(jobId, "Late title", "Late body", "post-99");

        assertFalse(result.success());
        assertEquals("Job is already COMPLETED", result.error());
        assertEquals("Original title", job.getGeneratedTitle());
        assertEquals(completedAt, job.getCompletedAt());
        verify(jobRepository, never()).atomicallyTransitionStatus(any(), any(), any(), any());
        verify(jobRepository, never()).save(any());
        verify(transitionRepository, never()).save(any());
    }

    @Test
    void testTransition_WhenSystemRequestsCurrentStatus_WritesNothing() {
        job.setStatus(JobStatus.CANCELLED);
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));

        TransitionResult result = manager.transitionToCancelled(jobId, "Cancelled twice");

        assertFalse(result.success());
        verify(transitionRepository, never()).save(any());
        verifyNoInteractions(metricsService);
    }

    @Test
    void testTransition_WhenAdminReentersTerminalStatusWithoutForce_Rejects() {
        job.setStatus(JobStatus.COMPLETED);
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));

        TransitionResult result = manager.transition(jobId, TransitionCommand.admin(JobStatus.COMPLETED,
            "Re-publish", "admin-1", AdminRole.SUPER_ADMIN, false));

        assertFalse(result.success());
        assertEquals("Invalid status transition: COMPLETED → COMPLETED", result.error());
        verify(transitionRepository, never()).save(any());
    }

    @Test
    void testTransition_WhenAdminRequeuesPendingJob_AppliesMutation() {
        stubAppliedTransition(JobStatus.PENDING, JobStatus.PENDING);

        TransitionResult result = manager.transition(jobId, TransitionCommand.admin(JobStatus.PENDING,
            "Reset retries", "admin-1", AdminRole.SUPER_ADMIN, false), current -> current.setRetryCount(0));

        assertTrue(result.success());
        assertFalse(result.forced());
        verify(transitionRepository).save(any(JobStatusTransition.class));
    }

    @Test
    void testTransition_WhenAdminForcesIllegalTransition_FlagsAuditRow() {
        job.setStatus(JobStatus.COMPLETED);
        stubAppliedTransition(JobStatus.COMPLETED, JobStatus.PENDING);

        TransitionResult result = manager.transition(jobId,
            TransitionCommand.admin(JobStatus.PENDING, "Republish", "ops@clapgrow.com", AdminRole.SUPER_ADMIN, true));

        assertTrue(result.success());
        assertTrue(result.forced());
        ArgumentCaptor<JobStatusTransition> captor = ArgumentCaptor.forClass(JobStatusTransition.class);
        verify(transitionRepository).save(captor.capture());
        assertTrue(captor.getValue().getForceOverride());
        assertEquals(TransitionActor.ADMIN, captor.getValue().getActor());
        assertEquals("ops@clapgrow.com", captor.getValue().getAdminUserId());
        assertEquals(AdminRole.SUPER_ADMIN, captor.getValue().getAdminRole());
    }

    @Test
    void testTransition_WhenStatusChangedConcurrently_ReportsConflict() {
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));
        when(jobRepository.atomicallyTransitionStatus(eq(jobId), eq(JobStatus.PENDING), eq(JobStatus.CANCELLED), any()))
            .thenReturn(0);

        TransitionResult result = manager.transitionToCancelled(jobId, "User cancelled");

        assertFalse(result.success());
        assertEquals("Job status changed concurrently", result.error());
        verify(jobRepository, never()).save(any());
        verify(transitionRepository, never()).save(any());
    }

    @Test
    void testTransition_WhenJobMissing_ThrowsNotFound() {
        when(jobRepository.findById(jobId)).thenReturn(Optional.empty());

        assertThrows(JobNotFoundException.class, () -> manager.transitionToProcessing(jobId));
    }

    @Test
    void testTransition_WhenTargetMissing_ThrowsBadRequest() {
        assertThrows(BadRequestException.class,
            () -> manager.transition(jobId, TransitionCommand.system(null, "nothing")));
        verifyNoInteractions(jobRepository);
    }

    @Test
    void testTransitionToFailed_StoresSanitizedErrorAndCategory() {
        job.setStatus(JobStatus.PROCESSING);
        stubAppliedTransition(JobStatus.PROCESSING, JobStatus.FAILED);

        TransitionResult result = manager.transitionToFailed(jobId, "401 Unauthorized token=sk-live-1", ErrorCategory.AUTH);

        assertTrue(result.success());
        assertEquals("401 Unauthorized token=***", job.getLastError());
        assertEquals(ErrorCategory.AUTH, job.getLastErrorCategory());
        assertEquals(now, job.getFailedAt());
    }

    @Test
    void testTransitionToCompleted_StoresGeneratedContent() {
        job.setStatus(JobStatus.PROCESSING);
        job.setNextRetryAt(now.plusMinutes(5));
        stubAppliedTransition(JobStatus.PROCESSING, JobStatus.COMPLETED);

        manager.transitionToCompleted(jobId, "Title", "Body", "post-17");

        assertEquals("Title", job.getGeneratedTitle());
        assertEquals("Body", job.getGeneratedContent());
        assertEquals("post-17", job.getPublishedPostId());
        assertEquals(now, job.getCompletedAt());
        assertNull(job.getNextRetryAt());
    }

    @Test
    void testTransitionToPending_SetsNextRetryAt() {
        job.setStatus(JobStatus.FAILED);
        stubAppliedTransition(JobStatus.FAILED, JobStatus.PENDING);
        LocalDateTime nextRetry = now.plusSeconds(30);

        manager.transitionToPending(jobId, "Retry 1/3", nextRetry);

        assertEquals(nextRetry, job.getNextRetryAt());
    }

    @Test
    void testValidateConsistency_WhenStatusMatchesLastTransition_IsConsistent() {
        job.setStatus(JobStatus.PROCESSING);
        job.setStartedAt(now);
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));
        when(transitionRepository.findByJobIdOrderByIdAsc(jobId))
            .thenReturn(List.of(transition(JobStatus.PENDING, JobStatus.PROCESSING)));

        ConsistencyReport report = manager.validateConsistency(jobId);

        assertTrue(report.consistent());
        assertEquals(1, report.transitionCount());
        assertTrue(report.issues().isEmpty());
    }

    @Test
    void testValidateConsistency_ReportsDriftAndUnloggedRetryOverflow() {
        job.setStatus(JobStatus.FAILED);
        job.setRetryCount(5);
        job.setMaxRetries(3);
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));
        when(transitionRepository.findByJobIdOrderByIdAsc(jobId))
            .thenReturn(List.of(transition(JobStatus.PENDING, JobStatus.PROCESSING)));

        ConsistencyReport report = manager.validateConsistency(jobId);

        assertFalse(report.consistent());
        assertEquals(JobStatus.PROCESSING, report.lastTransitionStatus());
        assertTrue(report.issues().contains("Job status FAILED does not match last transition PROCESSING"));
        assertTrue(report.issues().contains("Failed job has no failed_at timestamp"));
        assertTrue(report.issues().contains("Retry count 5 exceeds max retries 3 without a logged override"));
    }

    @Test
    void testGetStatusStatistics_FillsMissingStatusesWithZero() {
        when(jobRepository.countGroupedByStatus()).thenReturn(List.of(statusCount(JobStatus.PENDING, 4L)));
        when(jobRepository.findCompletedSpansSince(any())).thenReturn(List.of());

        StatusStatistics statistics = manager.getStatusStatistics();

        assertEquals(4L, statistics.totalJobs());
        assertEquals(4L, statistics.countsByStatus().get(JobStatus.PENDING));
        assertEquals(0L, statistics.countsByStatus().get(JobStatus.CANCELLED));
        assertNull(statistics.averageProcessingTimeMs());
    }

    @Test
    void testGetJobsByStatus_ClampsLimit() {
        when(jobRepository.findByStatusOrderByCreatedAtAsc(eq(JobStatus.FAILED), any())).thenReturn(List.of(job));

        assertEquals(1, manager.getJobsByStatus(JobStatus.FAILED, 10_000).size());
        verify(jobRepository).findByStatusOrderByCreatedAtAsc(eq(JobStatus.FAILED),
            argThat(pageable -> pageable.getPageSize() == 500));
    }

    private JobStatusTransition transition(JobStatus from, JobStatus to) {
        JobStatusTransition transition = new JobStatusTransition();
        transition.setJobId(jobId);
        transition.setFromStatus(from);
        transition.setToStatus(to);
        transition.setActor(TransitionActor.SYSTEM);
        transition.setTimestamp(now);
        return transition;
    }

    private static ContentJobRepository.StatusCount statusCount(JobStatus status, Long count) {
        return new ContentJobRepository.StatusCount() {
            @Override
            public JobStatus getStatus() {
                return status;
            }

            @Override
            public Long getCount() {
                return count;
            }
        };
    }
}
