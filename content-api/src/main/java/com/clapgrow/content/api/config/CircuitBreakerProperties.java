package com.clapgrow.content.api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Circuit breaker tuning shared by all protected dependencies.
 * 
 * Maps to:
 * circuit-breaker:
 *   failure-threshold: 5
 *   failure-window-ms: 60000
 *   cool-down-ms: 60000
 *   probe-timeout-ms: 30000
 */
@Configuration
@ConfigurationProperties(prefix = "circuit-breaker")
@Data
public class CircuitBreakerProperties {

    /**
     * Qualifying failures within the window that trip a closed breaker.
     */
    private int failureThreshold = 5;

    private long failureWindowMs = 60000;

    /**
     * Time an open breaker waits before allowing a half-open probe.
     */
    private long coolDownMs = 60000;

    /**
     * A probe that hasn't reported back after this long may be reclaimed by another caller.
     */
    private long probeTimeoutMs = 30000;
}
