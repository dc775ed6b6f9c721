package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.CircuitState;

/**
 * Whether a call to a protected dependency may proceed.
 *
 * @param probe        true when this caller holds the single half-open probe
 * @param retryAfterMs time until the breaker may admit a call, 0 when allowed
 */
public record CircuitDecision(
    boolean allowed,
    CircuitState state,
    boolean probe,
    long retryAfterMs,
    String reason
) {
    public static CircuitDecision allow(CircuitState state, boolean probe, String reason) {
        return new CircuitDecision(true, state, probe, 0, reason);
    }

    public static CircuitDecision reject(CircuitState state, long retryAfterMs, String reason) {
        return new CircuitDecision(false, state, false, Math.max(0, retryAfterMs), reason);
    }
}
