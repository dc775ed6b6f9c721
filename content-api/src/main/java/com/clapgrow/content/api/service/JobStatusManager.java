package com.clapgrow.content.api.service;

import com.clapgrow.content.api.dto.ConsistencyReport;
import com.clapgrow.content.api.dto.InvalidTransition;
import com.clapgrow.content.api.dto.JobResponse;
import com.clapgrow.content.api.dto.StatusStatistics;
import com.clapgrow.content.api.dto.StatusTransitionResponse;
import com.clapgrow.content.api.dto.TransitionCommand;
import com.clapgrow.content.api.dto.TransitionResult;
import com.clapgrow.content.api.entity.ContentJob;
import com.clapgrow.content.api.entity.JobStatusTransition;
import com.clapgrow.content.api.enums.JobStatus;
import com.clapgrow.content.api.enums.TransitionActor;
import com.clapgrow.content.api.exception.JobNotFoundException;
import com.clapgrow.content.api.repository.ContentJobRepository;
import com.clapgrow.content.api.repository.JobStatusTransitionRepository;
import com.clapgrow.content.common.retry.ErrorCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Job lifecycle state machine.
 * 
 * Every transition:
 * 1. Validates legality against the persisted status (JobStatusTransitionValidator)
 * 2. Moves the status with a conditional UPDATE keyed by the expected prior status
 * 3. Appends a JobStatusTransition row
 * 
 * Steps 2 and 3 share one transaction, so readers see both writes or neither.
 * 
 * ⚠️ Illegal transitions are returned as {@link TransitionResult#rejected} rather than thrown.
 * A system request for the status the job already has is rejected the same way and writes nothing;
 * only an admin may re-enter a status (requeueing a PENDING job with new retry settings).
 * An admin force override executes them anyway and flags the transition row.
 * 
 * ⚠️ The conditional UPDATE clears the persistence context. Callers holding a ContentJob
 * loaded before the transition must re-read it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobStatusManager {

    private static final int MAX_PAGE_SIZE = 500;
    private static final Duration STATISTICS_WINDOW = Duration.ofDays(30);

    private final ContentJobRepository jobRepository;
    private final JobStatusTransitionRepository transitionRepository;
    private final JobStatusTransitionValidator validator;
    private final ResilienceMetricsService metricsService;
    private final Clock clock;

    @Transactional
    public TransitionResult transition(UUID jobId, TransitionCommand command) {
        return transition(jobId, command, job -> { });
    }

    /**
     * Transition and apply extra field changes to the job in the same transaction.
     * The mutation only runs when the transition is applied.
     */
    @Transactional
    public TransitionResult transition(UUID jobId, TransitionCommand command, Consumer<ContentJob> mutation) {
        if (command == null || command.toStatus() == null) {
            throw new BadRequestException("Target status is required");
        }
        ContentJob job = jobRepository.findById(jobId)
            .orElseThrow(() -> new JobNotFoundException(jobId));

        JobStatus fromStatus = job.getStatus();
        JobStatus toStatus = command.toStatus();
        boolean forced = false;

        if (fromStatus == toStatus && command.actor() != TransitionActor.ADMIN) {
            log.debug("Job {} already {}, transition ignored (actor={})", jobId, fromStatus, command.actor());
            return TransitionResult.rejected(jobId, fromStatus, toStatus,
                String.format("Job is already %s", fromStatus));
        }

        if (!validator.isValidTransition(fromStatus, toStatus)) {
            if (!command.isAdminForce()) {
                log.warn("Rejected status transition for job {}: {} → {} (actor={})",
                    jobId, fromStatus, toStatus, command.actor());
                return TransitionResult.rejected(jobId, fromStatus, toStatus,
                    String.format("Invalid status transition: %s → %s", fromStatus, toStatus));
            }
            forced = true;
            log.warn("Admin {} ({}) forcing illegal transition for job {}: {} → {}",
                command.adminUserId(), command.adminRole(), jobId, fromStatus, toStatus);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        int updated = jobRepository.atomicallyTransitionStatus(jobId, fromStatus, toStatus, now);
        if (updated == 0) {
            log.warn("Job {} changed status concurrently, transition {} → {} not applied", jobId, fromStatus, toStatus);
            return TransitionResult.rejected(jobId, fromStatus, toStatus, "Job status changed concurrently");
        }

        ContentJob current = jobRepository.findById(jobId)
            .orElseThrow(() -> new JobNotFoundException(jobId));
        applyStatusEffects(current, toStatus, now);
        mutation.accept(current);
        jobRepository.save(current);

        JobStatusTransition transition = new JobStatusTransition();
        transition.setJobId(jobId);
        transition.setFromStatus(fromStatus);
        transition.setToStatus(toStatus);
        transition.setReason(command.reason());
        transition.setActor(command.actor());
        transition.setForceOverride(forced);
        transition.setAdminUserId(command.adminUserId());
        transition.setAdminRole(command.adminRole());
        transition.setMetadata(command.metadata());
        transition.setTimestamp(now);
        JobStatusTransition saved = transitionRepository.save(transition);

        metricsService.recordTransition(toStatus);
        log.info("Job {} transitioned {} → {} (actor={}, forced={})", jobId, fromStatus, toStatus, command.actor(), forced);
        return TransitionResult.applied(jobId, fromStatus, toStatus, forced, saved.getId());
    }

    private void applyStatusEffects(ContentJob job, JobStatus toStatus, LocalDateTime now) {
        switch (toStatus) {
            case PROCESSING -> {
                if (job.getStartedAt() == null) {
                    job.setStartedAt(now);
                }
            }
            case COMPLETED -> {
                job.setCompletedAt(now);
                job.setNextRetryAt(null);
            }
            case FAILED -> job.setFailedAt(now);
            case CANCELLED -> {
                job.setCancelledAt(now);
                job.setNextRetryAt(null);
            }
            case PENDING -> {
                // next_retry_at is supplied by the caller
            }
        }
    }

    @Transactional
    public TransitionResult transitionToProcessing(UUID jobId) {
        return transition(jobId, TransitionCommand.system(JobStatus.PROCESSING, "Job processing started"));
    }

    @Transactional
    public TransitionResult transitionToCompleted(UUID jobId, String title, String content, String postId) {
        return transition(jobId, TransitionCommand.system(JobStatus.COMPLETED, "Job completed successfully"), job -> {
            if (title != null) {
                job.setGeneratedTitle(title);
            }
            if (content != null) {
                job.setGeneratedContent(content);
            }
            if (postId != null) {
                job.setPublishedPostId(postId);
            }
        });
    }

    @Transactional
    public TransitionResult transitionToFailed(UUID jobId, String errorMessage, ErrorCategory category) {
        String sanitized = ErrorMessageSanitizer.sanitize(errorMessage);
        return transition(jobId, TransitionCommand.system(JobStatus.FAILED, sanitized), job -> {
            job.setLastError(sanitized);
            if (category != null) {
                job.setLastErrorCategory(category);
            }
        });
    }

    @Transactional
    public TransitionResult transitionToPending(UUID jobId, String reason) {
        return transitionToPending(jobId, reason, null);
    }

    @Transactional
    public TransitionResult transitionToPending(UUID jobId, String reason, LocalDateTime nextRetryAt) {
        return transition(jobId, TransitionCommand.system(JobStatus.PENDING, reason),
            job -> job.setNextRetryAt(nextRetryAt));
    }

    @Transactional
    public TransitionResult transitionToCancelled(UUID jobId, String reason) {
        return transition(jobId, TransitionCommand.system(JobStatus.CANCELLED, reason));
    }

    @Transactional(readOnly = true)
    public List<StatusTransitionResponse> getStatusHistory(UUID jobId) {
        if (!jobRepository.existsById(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        return transitionRepository.findByJobIdOrderByIdAsc(jobId).stream()
            .map(StatusTransitionResponse::from)
            .toList();
    }

    /**
     * Cross-check a job against its audit trail.
     */
    @Transactional(readOnly = true)
    public ConsistencyReport validateConsistency(UUID jobId) {
        ContentJob job = jobRepository.findById(jobId)
            .orElseThrow(() -> new JobNotFoundException(jobId));
        List<JobStatusTransition> transitions = transitionRepository.findByJobIdOrderByIdAsc(jobId);
        JobStatusTransition last = transitions.isEmpty() ? null : transitions.get(transitions.size() - 1);
        List<String> issues = new ArrayList<>();

        if (last == null) {
            if (job.getStatus() != JobStatus.PENDING) {
                issues.add("No transitions recorded but job status is " + job.getStatus());
            }
        } else if (last.getToStatus() != job.getStatus()) {
            issues.add(String.format("Job status %s does not match last transition %s",
                job.getStatus(), last.getToStatus()));
        }

        if (job.getStatus() == JobStatus.COMPLETED && job.getCompletedAt() == null) {
            issues.add("Completed job has no completed_at timestamp");
        }
        if (job.getStatus() == JobStatus.CANCELLED && job.getCancelledAt() == null) {
            issues.add("Cancelled job has no cancelled_at timestamp");
        }
        if (job.getStatus() == JobStatus.FAILED && job.getFailedAt() == null) {
            issues.add("Failed job has no failed_at timestamp");
        }
        if (job.getRetryCount() > job.getMaxRetries() && !Boolean.TRUE.equals(job.getMaxRetriesOverridden())) {
            issues.add(String.format("Retry count %d exceeds max retries %d without a logged override",
                job.getRetryCount(), job.getMaxRetries()));
        }

        return new ConsistencyReport(jobId, issues.isEmpty(), job.getStatus(),
            last != null ? last.getToStatus() : null, transitions.size(), issues);
    }

    @Transactional(readOnly = true)
    public List<JobResponse> getJobsByStatus(JobStatus status, int limit) {
        int size = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        return jobRepository.findByStatusOrderByCreatedAtAsc(status, PageRequest.of(0, size)).stream()
            .map(JobResponse::from)
            .toList();
    }

    @Transactional(readOnly = true)
    public StatusStatistics getStatusStatistics() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        long total = 0;
        for (ContentJobRepository.StatusCount row : jobRepository.countGroupedByStatus()) {
            counts.put(row.getStatus(), row.getCount());
            total += row.getCount();
        }

        LocalDateTime since = LocalDateTime.now(clock).minus(STATISTICS_WINDOW);
        List<ContentJobRepository.ProcessingSpan> spans = jobRepository.findCompletedSpansSince(since);
        Double average = spans.isEmpty() ? null : spans.stream()
            .mapToLong(span -> Duration.between(span.getStartedAt(), span.getCompletedAt()).toMillis())
            .average()
            .orElse(0);

        return new StatusStatistics(counts, total, average);
    }

    public List<InvalidTransition> getInvalidTransitions() {
        return validator.getInvalidTransitions();
    }
}
