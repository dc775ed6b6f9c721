package com.clapgrow.content.api.service;

import com.clapgrow.content.api.config.RetryProperties;
import com.clapgrow.content.common.retry.RetryConfig;
import com.clapgrow.content.common.retry.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the live retry policy.
 * 
 * The policy is swapped as a whole, so a reader sees either the old or the new configuration,
 * never a mix of both. Stored attempt history is not rewritten: RetryTracker#canRetryJob
 * re-evaluates it against whatever policy is current.
 */
@Component
@Slf4j
public class RetryPolicyProvider {

    private final AtomicReference<RetryPolicy> current;

    public RetryPolicyProvider(RetryProperties properties) {
        this.current = new AtomicReference<>(new RetryPolicy(properties.toRetryConfig()));
    }

    public RetryPolicy getPolicy() {
        return current.get();
    }

    public RetryConfig getConfig() {
        return current.get().getConfig();
    }

    /**
     * @return the configuration that was replaced
     */
    public RetryConfig replace(RetryConfig config) {
        if (config == null) {
            throw new BadRequestException("Retry configuration is required");
        }
        RetryPolicy previous = current.getAndSet(new RetryPolicy(config));
        log.info("Retry configuration replaced: {} → {}", previous.getConfig(), config);
        return previous.getConfig();
    }
}
