package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.entity.Alert;
import com.clapgrow.content.api.enums.AlertSeverity;
import com.clapgrow.content.api.enums.AlertTrend;
import com.clapgrow.content.api.enums.TimeWindow;

import java.time.LocalDateTime;
import java.util.UUID;

public record AlertResponse(
    UUID id,
    String alertType,
    AlertSeverity severity,
    String title,
    String message,
    String sourceMetric,
    double metricValue,
    double thresholdCrossed,
    TimeWindow timeWindow,
    long totalJobs,
    long failedJobs,
    AlertTrend trend,
    boolean resolved,
    LocalDateTime resolvedAt,
    int escalationLevel,
    LocalDateTime lastEscalatedAt,
    LocalDateTime createdAt
) {
    public static AlertResponse from(Alert alert) {
        return new AlertResponse(
            alert.getId(),
            alert.getAlertType(),
            alert.getSeverity(),
            alert.getTitle(),
            alert.getMessage(),
            alert.getSourceMetric(),
            alert.getMetricValue() != null ? alert.getMetricValue() : 0.0,
            alert.getThresholdCrossed() != null ? alert.getThresholdCrossed() : 0.0,
            alert.getTimeWindow(),
            alert.getTotalJobs() != null ? alert.getTotalJobs() : 0L,
            alert.getFailedJobs() != null ? alert.getFailedJobs() : 0L,
            alert.getTrend(),
            Boolean.TRUE.equals(alert.getResolved()),
            alert.getResolvedAt(),
            alert.getEscalationLevel() != null ? alert.getEscalationLevel() : 0,
            alert.getLastEscalatedAt(),
            alert.getCreatedAt()
        );
    }
}
