package com.clapgrow.content.api.service;

import com.clapgrow.content.api.dto.AdminPermissions;
import com.clapgrow.content.api.dto.AdminRetryAuditResponse;
import com.clapgrow.content.api.dto.AdminRetryEligibility;
import com.clapgrow.content.api.dto.AdminRetryRequest;
import com.clapgrow.content.api.dto.AdminRetryResult;
import com.clapgrow.content.api.dto.AdminRetryStatistics;
import com.clapgrow.content.api.dto.TransitionCommand;
import com.clapgrow.content.api.dto.TransitionResult;
import com.clapgrow.content.api.entity.AdminRetryAudit;
import com.clapgrow.content.api.entity.ContentJob;
import com.clapgrow.content.api.entity.RetryAttempt;
import com.clapgrow.content.api.enums.AdminRetryType;
import com.clapgrow.content.api.enums.AdminRole;
import com.clapgrow.content.api.enums.AttemptOutcome;
import com.clapgrow.content.api.enums.JobStatus;
import com.clapgrow.content.api.enums.TransitionActor;
import com.clapgrow.content.api.exception.JobNotFoundException;
import com.clapgrow.content.api.repository.AdminRetryAuditRepository;
import com.clapgrow.content.api.repository.ContentJobRepository;
import com.clapgrow.content.api.repository.RetryAttemptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Privileged retry layer on top of JobStatusManager and the attempt log.
 * 
 * Order of checks (nothing is written until all pass):
 * 1. Permission table (AdminRetryPermissions) for (role, retry type)
 * 2. force_override requires ADMIN or SUPER_ADMIN
 * 3. Job eligibility: status FAILED or PENDING, total retries < 10, admin retries < 5,
 *    manual/force retries below max_retries. force_override bypasses these and the
 *    bypassed reason is kept in the audit row
 * 
 * A permitted retry writes, in one transaction:
 * - a StatusTransition to PENDING (actor=ADMIN, force_override flagged when the FSM would refuse it)
 * - a RetryAttempt (actor=ADMIN, outcome RESET for counter resets)
 * - an AdminRetryAudit row
 * 
 * ⚠️ Denied requests have no side effects and are only logged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminRetryManager {

    static final long FORCE_RETRY_DELAY_MS = 5000;
    private static final int WARNING_RETRY_COUNT = 5;
    private static final int WARNING_MANUAL_COUNT = 3;
    private static final Duration RECENT_RETRY_WINDOW = Duration.ofHours(1);
    private static final Set<JobStatus> RETRYABLE_STATUSES = Set.of(JobStatus.FAILED, JobStatus.PENDING);

    private final ContentJobRepository jobRepository;
    private final RetryAttemptRepository attemptRepository;
    private final AdminRetryAuditRepository auditRepository;
    private final JobStatusManager jobStatusManager;
    private final JobStatusTransitionValidator transitionValidator;
    private final AdminRetryPermissions permissions;
    private final ResilienceMetricsService metricsService;
    private final Clock clock;

    @Transactional
    public AdminRetryResult executeAdminRetry(AdminRetryRequest request) {
        AdminRole role = request.getAdminRole();
        AdminRetryType retryType = request.getRetryType();

        if (!permissions.isAllowed(role, retryType)) {
            String error = String.format("Role %s is not permitted to perform %s", role, retryType);
            log.warn("Admin retry denied for job {} by {}: {}", request.getJobId(), request.getAdminUserId(), error);
            return AdminRetryResult.denied(request, error);
        }
        if (request.isForceOverride() && !permissions.canForceOverride(role)) {
            String error = String.format("Role %s is not permitted to force override", role);
            log.warn("Admin retry denied for job {} by {}: {}", request.getJobId(), request.getAdminUserId(), error);
            return AdminRetryResult.denied(request, error);
        }

        UUID jobId = request.getJobId();
        ContentJob job = jobRepository.findByIdForUpdate(jobId)
            .orElseThrow(() -> new JobNotFoundException(jobId));
        LocalDateTime now = LocalDateTime.now(clock);

        JobStatus previousStatus = job.getStatus();
        int previousRetryCount = job.getRetryCount();
        long adminRetryCount = auditRepository.countByJobId(jobId);
        String ineligibility = checkEligibility(job, retryType, adminRetryCount);
        List<String> warnings = collectWarnings(job, adminRetryCount, now);

        if (ineligibility != null && !request.isForceOverride()) {
            log.warn("Admin retry refused for job {} by {}: {}", jobId, request.getAdminUserId(), ineligibility);
            return AdminRetryResult.ineligible(request, previousStatus, previousRetryCount, job.getMaxRetries(),
                ineligibility, warnings);
        }

        int newRetryCount = retryType.incrementsRetryCount() ? previousRetryCount + 1 : 0;
        if (request.isResetRetryCount()) {
            newRetryCount = 0;
        }
        int newMaxRetries = retryType == AdminRetryType.OVERRIDE_MAX_RETRIES
            ? Math.max(job.getMaxRetries(), newRetryCount)
            : job.getMaxRetries();
        boolean maxRetriesOverridden = Boolean.TRUE.equals(job.getMaxRetriesOverridden())
            || newMaxRetries != job.getMaxRetries()
            || newRetryCount > newMaxRetries;
        long delayMs = request.getCustomDelayMs() != null
            ? request.getCustomDelayMs()
            : (retryType == AdminRetryType.FORCE_RETRY ? FORCE_RETRY_DELAY_MS : 0);
        LocalDateTime nextRetryAt = now.plus(Duration.ofMillis(delayMs));

        boolean fsmOverride = !transitionValidator.isValidTransition(previousStatus, JobStatus.PENDING);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("retryType", retryType.name());
        metadata.put("previousRetryCount", previousRetryCount);
        metadata.put("newRetryCount", newRetryCount);
        if (ineligibility != null) {
            metadata.put("ineligibilityReason", ineligibility);
        }
        TransitionCommand command = TransitionCommand.admin(JobStatus.PENDING, request.getReason(),
            request.getAdminUserId(), role, fsmOverride).withMetadata(metadata);

        int retryCountToApply = newRetryCount;
        TransitionResult transition = jobStatusManager.transition(jobId, command, current -> {
            current.setRetryCount(retryCountToApply);
            current.setMaxRetries(newMaxRetries);
            current.setMaxRetriesOverridden(maxRetriesOverridden);
            current.setNextRetryAt(nextRetryAt);
        });
        if (!transition.success()) {
            log.warn("Admin retry for job {} could not transition the job: {}", jobId, transition.error());
            return new AdminRetryResult(false, true, jobId, retryType, previousStatus, previousStatus,
                previousRetryCount, previousRetryCount, job.getMaxRetries(), 0, request.isForceOverride(),
                ineligibility, warnings, transition.error());
        }

        boolean counterReset = !retryType.incrementsRetryCount() || request.isResetRetryCount();
        RetryAttempt attempt = new RetryAttempt();
        attempt.setJobId(jobId);
        attempt.setAttemptNumber(attemptRepository.findMaxAttemptNumber(jobId) + 1);
        attempt.setErrorCategory(job.getLastErrorCategory());
        attempt.setRetryable(true);
        attempt.setDelayAppliedMs(delayMs);
        attempt.setOutcome(counterReset ? AttemptOutcome.RESET : AttemptOutcome.FAILED);
        attempt.setActor(TransitionActor.ADMIN);
        attempt.setAdminUserId(request.getAdminUserId());
        attempt.setAdminRole(role);
        attempt.setAdminRetryType(retryType);
        attempt.setReason(request.getReason());
        attempt.setCreatedAt(now);
        attemptRepository.save(attempt);

        AdminRetryAudit audit = new AdminRetryAudit();
        audit.setJobId(jobId);
        audit.setAdminUserId(request.getAdminUserId());
        audit.setAdminRole(role);
        audit.setRetryType(retryType);
        audit.setReason(request.getReason());
        audit.setForceOverride(request.isForceOverride());
        audit.setPreviousStatus(previousStatus);
        audit.setNewStatus(JobStatus.PENDING);
        audit.setPreviousRetryCount(previousRetryCount);
        audit.setNewRetryCount(newRetryCount);
        audit.setCustomDelayMs(request.getCustomDelayMs());
        audit.setIneligibilityReason(ineligibility);
        audit.setWarnings(warnings);
        audit.setCreatedAt(now);
        auditRepository.save(audit);

        metricsService.recordAdminRetry(retryType);
        log.info("Admin retry {} executed for job {} by {} ({}): {} → PENDING, retryCount {} → {}, forced={}",
            retryType, jobId, request.getAdminUserId(), role, previousStatus, previousRetryCount, newRetryCount,
            request.isForceOverride());

        return new AdminRetryResult(true, true, jobId, retryType, previousStatus, JobStatus.PENDING,
            previousRetryCount, newRetryCount, newMaxRetries, delayMs, request.isForceOverride(),
            ineligibility, warnings, null);
    }

    /**
     * @return why the job may not be retried, null when eligible
     */
    private String checkEligibility(ContentJob job, AdminRetryType retryType, long adminRetryCount) {
        if (!RETRYABLE_STATUSES.contains(job.getStatus())) {
            return String.format("Job status %s is not eligible for retry (must be FAILED or PENDING)", job.getStatus());
        }
        if (job.getRetryCount() >= AdminRetryPermissions.MAX_TOTAL_RETRIES) {
            return String.format("Job has reached the total retry limit (%d)", AdminRetryPermissions.MAX_TOTAL_RETRIES);
        }
        if (adminRetryCount >= AdminRetryPermissions.MAX_MANUAL_RETRIES) {
            return String.format("Job has reached the manual retry limit (%d)", AdminRetryPermissions.MAX_MANUAL_RETRIES);
        }
        if ((retryType == AdminRetryType.MANUAL_RETRY || retryType == AdminRetryType.FORCE_RETRY)
                && job.getRetryCount() >= job.getMaxRetries()) {
            return String.format("Job reached max retries (%d); use override_max_retries or force_override",
                job.getMaxRetries());
        }
        return null;
    }

    private List<String> collectWarnings(ContentJob job, long adminRetryCount, LocalDateTime now) {
        List<String> warnings = new ArrayList<>();
        if (job.getRetryCount() >= WARNING_RETRY_COUNT) {
            warnings.add(String.format("Job has already been retried %d times", job.getRetryCount()));
        }
        if (adminRetryCount >= WARNING_MANUAL_COUNT) {
            warnings.add(String.format("Job has %d previous admin retries", adminRetryCount));
        }
        if (auditRepository.countByJobIdAndCreatedAtAfter(job.getId(), now.minus(RECENT_RETRY_WINDOW)) > 0) {
            warnings.add("Job was retried by an admin within the last hour");
        }
        return warnings;
    }

    @Transactional(readOnly = true)
    public AdminRetryEligibility checkEligibility(UUID jobId, AdminRetryType retryType) {
        ContentJob job = jobRepository.findById(jobId)
            .orElseThrow(() -> new JobNotFoundException(jobId));
        long adminRetryCount = auditRepository.countByJobId(jobId);
        AdminRetryType type = retryType != null ? retryType : AdminRetryType.MANUAL_RETRY;
        String reason = checkEligibility(job, type, adminRetryCount);
        return new AdminRetryEligibility(jobId, reason == null, job.getStatus(), job.getRetryCount(),
            job.getMaxRetries(), adminRetryCount, reason != null ? reason : "Job is eligible for " + type,
            collectWarnings(job, adminRetryCount, LocalDateTime.now(clock)));
    }

    @Transactional(readOnly = true)
    public List<AdminRetryAuditResponse> getAdminRetryHistory(UUID jobId) {
        if (!jobRepository.existsById(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        return auditRepository.findByJobIdOrderByCreatedAtDesc(jobId).stream()
            .map(AdminRetryAuditResponse::from)
            .toList();
    }

    @Transactional(readOnly = true)
    public AdminRetryStatistics getAdminRetryStatistics(int days) {
        if (days < 1) {
            throw new BadRequestException("days must be at least 1");
        }
        List<AdminRetryAudit> audits = auditRepository.findByCreatedAtAfterOrderByCreatedAtDesc(
            LocalDateTime.now(clock).minusDays(days));

        Map<AdminRetryType, Long> byType = new EnumMap<>(AdminRetryType.class);
        audits.forEach(audit -> byType.merge(audit.getRetryType(), 1L, Long::sum));

        Map<String, Long> byAdmin = audits.stream()
            .collect(Collectors.groupingBy(AdminRetryAudit::getAdminUserId, LinkedHashMap::new, Collectors.counting()));

        long forced = audits.stream().filter(audit -> Boolean.TRUE.equals(audit.getForceOverride())).count();

        Set<UUID> jobIds = audits.stream().map(AdminRetryAudit::getJobId).collect(Collectors.toSet());
        long completed = jobIds.isEmpty() ? 0 : jobRepository.findAllById(jobIds).stream()
            .filter(job -> job.getStatus() == JobStatus.COMPLETED)
            .count();
        double successRate = jobIds.isEmpty() ? 0.0 : (double) completed / jobIds.size();

        Map<String, Long> reasons = audits.stream()
            .collect(Collectors.groupingBy(AdminRetryAudit::getReason, Collectors.counting()))
            .entrySet().stream()
            .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
            .limit(5)
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));

        List<AdminRetryAuditResponse> recent = audits.stream()
            .limit(10)
            .map(AdminRetryAuditResponse::from)
            .toList();

        return new AdminRetryStatistics(days, audits.size(), byType, byAdmin, forced, successRate, reasons, recent);
    }

    public AdminPermissions getPermissions(AdminRole role) {
        return permissions.getPermissions(role);
    }

    public Map<AdminRole, AdminPermissions> getAllPermissions() {
        Map<AdminRole, AdminPermissions> all = new EnumMap<>(AdminRole.class);
        for (AdminRole role : AdminRole.values()) {
            all.put(role, permissions.getPermissions(role));
        }
        return all;
    }
}
