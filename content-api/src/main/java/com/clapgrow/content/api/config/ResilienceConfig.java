package com.clapgrow.content.api.config;

import com.clapgrow.content.common.retry.ErrorClassifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared building blocks of the resilience services.
 * 
 * ⚠️ All persisted timestamps are UTC LocalDateTime derived from this Clock, so tests can drive time.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ErrorClassifier errorClassifier(Clock clock) {
        return new ErrorClassifier(clock);
    }
}
