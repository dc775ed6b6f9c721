package com.clapgrow.content.api.enums;

import java.time.Duration;

/**
 * Fixed windows tracked per rate-limited service.
 * Burst length is configured per service; minute and hour are fixed.
 */
public enum RateLimitWindowType {
    BURST(null),
    MINUTE(Duration.ofMinutes(1)),
    HOUR(Duration.ofHours(1));

    private final Duration fixedLength;

    RateLimitWindowType(Duration fixedLength) {
        this.fixedLength = fixedLength;
    }

    public Duration getFixedLength() {
        return fixedLength;
    }
}
