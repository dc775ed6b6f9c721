package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.RateLimitWindowType;

import java.time.LocalDateTime;
import java.util.List;

public record RateLimitInfo(String service, boolean tokenMetered, List<WindowInfo> windows) {

    public record WindowInfo(
        RateLimitWindowType type,
        long lengthMs,
        LocalDateTime windowStart,
        LocalDateTime resetsAt,
        int requestCount,
        int requestLimit,
        int remainingRequests,
        Long tokenCount,
        Long tokenLimit,
        Long remainingTokens
    ) {
    }
}
