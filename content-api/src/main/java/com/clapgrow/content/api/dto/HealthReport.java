package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.HealthStatus;

import java.time.LocalDateTime;
import java.util.List;

/**
 * @param uptimePercent share of snapshots in the last 24 hours that weren't DOWN, null without history
 */
public record HealthReport(
    HealthStatus overallStatus,
    String summary,
    List<ComponentHealth> components,
    List<String> recommendations,
    Double uptimePercent,
    long durationMs,
    LocalDateTime checkedAt
) {
}
