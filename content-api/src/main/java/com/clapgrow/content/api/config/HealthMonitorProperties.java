package com.clapgrow.content.api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Health monitor thresholds.
 * 
 * Maps to:
 * health:
 *   database-response-threshold-ms: 1000
 *   utilization-warning: 0.8
 *   utilization-critical: 0.95
 *   failure-rate-warning: 0.16
 *   failure-rate-critical: 0.20
 *   queue-size-warning: 100
 *   memory-threshold-percent: 80
 *   history-retention-days: 7
 */
@Configuration
@ConfigurationProperties(prefix = "health")
@Data
public class HealthMonitorProperties {

    /**
     * Above this the database check reports WARNING; above twice this it reports CRITICAL.
     */
    private long databaseResponseThresholdMs = 1000;

    private double utilizationWarning = 0.8;

    private double utilizationCritical = 0.95;

    private double failureRateWarning = 0.16;

    private double failureRateCritical = 0.20;

    private long queueSizeWarning = 100;

    /**
     * Heap usage above this is CRITICAL; above 80% of it is WARNING.
     */
    private int memoryThresholdPercent = 80;

    private int historyRetentionDays = 7;
}
