package com.clapgrow.content.api.dto;

/**
 * Usage derived from the request log plus utilization of the live windows (0..1).
 * Token fields are null for services that aren't token metered.
 */
public record RateLimitStats(
    String service,
    long requestsLastMinute,
    long requestsLastHour,
    Long tokensLastMinute,
    Long tokensLastHour,
    double successRate,
    double averageResponseTimeMs,
    double minuteUtilization,
    double hourUtilization,
    Double tokenMinuteUtilization,
    Double tokenHourUtilization
) {
}
