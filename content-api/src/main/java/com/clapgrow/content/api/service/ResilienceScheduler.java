package com.clapgrow.content.api.service;

import com.clapgrow.content.api.dto.AlertEvaluationResult;
import com.clapgrow.content.api.dto.CleanupResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic maintenance of the resilience state.
 * 
 * Each task catches its own failure so one broken task never stops the scheduler thread
 * from running the others.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResilienceScheduler {

    private final AlertingEngine alertingEngine;
    private final RetryTracker retryTracker;
    private final RateLimiterService rateLimiterService;
    private final SystemHealthService systemHealthService;

    @Scheduled(fixedRate = 3600000, initialDelay = 60000) // Every hour
    public void checkFailureRate() {
        try {
            AlertEvaluationResult result = alertingEngine.checkScheduledFailureRate();
            log.debug("Scheduled failure-rate check: {}", result);
        } catch (Exception e) {
            log.error("Scheduled failure-rate check failed", e);
        }
    }

    @Scheduled(fixedRate = 300000, initialDelay = 120000) // Every 5 minutes
    public void escalateUnresolvedAlerts() {
        try {
            int escalated = alertingEngine.sweepEscalations();
            if (escalated > 0) {
                log.info("Escalated {} unresolved alerts", escalated);
            }
        } catch (Exception e) {
            log.error("Alert escalation sweep failed", e);
        }
    }

    @Scheduled(cron = "${retry.cleanup-cron:0 0 3 * * *}")
    public void cleanupRetryData() {
        try {
            CleanupResult result = retryTracker.cleanupRetryData();
            log.info("Retry data cleanup removed {} rows older than {}", result.deletedRows(), result.cutoff());
        } catch (Exception e) {
            log.error("Retry data cleanup failed", e);
        }
    }

    @Scheduled(fixedRate = 3600000, initialDelay = 300000) // Every hour
    public void cleanupRateLimitLog() {
        try {
            CleanupResult result = rateLimiterService.cleanupRequestLog();
            log.debug("Rate-limit log cleanup removed {} rows", result.deletedRows());
        } catch (Exception e) {
            log.error("Rate-limit request log cleanup failed", e);
        }
    }

    @Scheduled(fixedRate = 300000, initialDelay = 30000) // Every 5 minutes
    public void recordHealthSnapshot() {
        try {
            systemHealthService.performHealthCheck();
            systemHealthService.cleanupHistory();
        } catch (Exception e) {
            log.error("Scheduled health check failed", e);
        }
    }
}
