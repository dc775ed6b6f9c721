package com.clapgrow.content.api.dto;

/**
 * @param waitTimeMs     time until enough capacity frees up, 0 when allowed
 * @param reservedTokens tokens reserved against the token windows; pass back to recordRequest
 */
public record RateLimitDecision(
    boolean allowed,
    long waitTimeMs,
    String reason,
    long reservedTokens
) {
    public static RateLimitDecision allow(long reservedTokens) {
        return new RateLimitDecision(true, 0, "Within rate limits", reservedTokens);
    }

    public static RateLimitDecision deny(long waitTimeMs, String reason) {
        return new RateLimitDecision(false, Math.max(1, waitTimeMs), reason, 0);
    }
}
