package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.AlertSeverity;

import java.util.List;

/**
 * @param severity        band the sample fell into, null below the warning threshold
 * @param suppressed      true when an alert was due but the severity cooldown was active
 * @param resolvedAlerts  open alerts of the window resolved by a healthy sample
 */
public record AlertEvaluationResult(
    FailureRateSample sample,
    AlertSeverity severity,
    int alertsGenerated,
    List<AlertResponse> alerts,
    int escalatedAlerts,
    int resolvedAlerts,
    boolean suppressed,
    String reason
) {
}
