package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.CircuitState;

import java.time.LocalDateTime;

public record CircuitBreakerStatus(
    String dependency,
    CircuitState state,
    int consecutiveFailures,
    int windowFailureCount,
    LocalDateTime windowStartedAt,
    LocalDateTime openedAt,
    LocalDateTime nextProbeAt,
    LocalDateTime probeStartedAt,
    LocalDateTime lastFailureAt,
    LocalDateTime lastSuccessAt,
    long retryAfterMs
) {
}
