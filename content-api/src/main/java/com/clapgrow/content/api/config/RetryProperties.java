package com.clapgrow.content.api.config;

import com.clapgrow.content.common.retry.RetryConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Startup retry configuration.
 * 
 * Maps to:
 * retry:
 *   base-delay-ms: 1000
 *   max-delay-ms: 30000
 *   backoff-multiplier: 2.0
 *   jitter-factor: 0.1
 *   max-attempts: 3
 *   timeout-ms: 60000
 *   default-max-retries: 3
 *   retention-days: 30
 *   cleanup-cron: "0 0 3 * * *"
 * 
 * The live policy is held by RetryPolicyProvider and may be replaced at runtime.
 */
@Configuration
@ConfigurationProperties(prefix = "retry")
@Data
public class RetryProperties {

    private long baseDelayMs = RetryConfig.DEFAULT_BASE_DELAY_MS;

    private long maxDelayMs = RetryConfig.DEFAULT_MAX_DELAY_MS;

    private double backoffMultiplier = RetryConfig.DEFAULT_BACKOFF_MULTIPLIER;

    private double jitterFactor = RetryConfig.DEFAULT_JITTER_FACTOR;

    private int maxAttempts = RetryConfig.DEFAULT_MAX_ATTEMPTS;

    private long timeoutMs = RetryConfig.DEFAULT_TIMEOUT_MS;

    /**
     * max_retries given to new jobs when the request doesn't specify one.
     */
    private int defaultMaxRetries = 3;

    /**
     * Attempt rows of completed/cancelled jobs older than this are purged.
     */
    private int retentionDays = 30;

    /**
     * Read by ResilienceScheduler through the placeholder, exposed here for the config endpoint.
     */
    private String cleanupCron = "0 0 3 * * *";

    public RetryConfig toRetryConfig() {
        return new RetryConfig(baseDelayMs, maxDelayMs, backoffMultiplier, jitterFactor, maxAttempts, timeoutMs);
    }
}
