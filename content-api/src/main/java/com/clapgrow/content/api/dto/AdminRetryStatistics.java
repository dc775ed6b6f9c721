package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.AdminRetryType;

import java.util.List;
import java.util.Map;

/**
 * @param successRate share of admin-retried jobs that have since completed
 */
public record AdminRetryStatistics(
    int days,
    long totalAdminRetries,
    Map<AdminRetryType, Long> retriesByType,
    Map<String, Long> retriesByAdmin,
    long forcedRetries,
    double successRate,
    Map<String, Long> mostCommonReasons,
    List<AdminRetryAuditResponse> recentRetries
) {
}
