package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.entity.HealthCheckRecord;
import com.clapgrow.content.api.enums.HealthStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record HealthSnapshotResponse(
    UUID id,
    HealthStatus overallStatus,
    Map<String, String> components,
    List<String> recommendations,
    long durationMs,
    LocalDateTime createdAt
) {
    public static HealthSnapshotResponse from(HealthCheckRecord record) {
        return new HealthSnapshotResponse(
            record.getId(),
            record.getOverallStatus(),
            record.getComponents(),
            record.getRecommendations(),
            record.getDurationMs() != null ? record.getDurationMs() : 0L,
            record.getCreatedAt()
        );
    }
}
