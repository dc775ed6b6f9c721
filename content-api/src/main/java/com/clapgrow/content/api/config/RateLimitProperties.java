package com.clapgrow.content.api.config;

import com.clapgrow.content.common.service.ExternalService;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Per-service quotas.
 * 
 * Maps to:
 * rate-limit:
 *   request-log-retention-hours: 24
 *   services:
 *     generation-api:
 *       requests-per-minute: 60
 *       requests-per-hour: 3600
 *       tokens-per-minute: 150000
 *       tokens-per-hour: 9000000
 *       burst-limit: 10
 *       burst-window-ms: 10000
 *     publishing-api:
 *       requests-per-minute: 100
 *       requests-per-hour: 1000
 *       burst-limit: 20
 *       burst-window-ms: 5000
 */
@Configuration
@ConfigurationProperties(prefix = "rate-limit")
@Data
public class RateLimitProperties {

    private int requestLogRetentionHours = 24;

    private Services services = new Services();

    public ServiceLimits forService(ExternalService service) {
        return switch (service) {
            case GENERATION_API -> services.getGenerationApi();
            case PUBLISHING_API -> services.getPublishingApi();
        };
    }

    @Data
    public static class Services {
        private ServiceLimits generationApi = new ServiceLimits(60, 3600, 150_000L, 9_000_000L, 10, 10_000);
        private ServiceLimits publishingApi = new ServiceLimits(100, 1000, null, null, 20, 5_000);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ServiceLimits {
        private int requestsPerMinute;
        private int requestsPerHour;
        /**
         * Null when the service isn't token metered.
         */
        private Long tokensPerMinute;
        private Long tokensPerHour;
        private int burstLimit;
        private long burstWindowMs;
    }
}
