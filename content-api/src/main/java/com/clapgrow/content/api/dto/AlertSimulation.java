package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.AlertChannelType;
import com.clapgrow.content.api.enums.AlertSeverity;
import com.clapgrow.content.api.enums.TimeWindow;

import java.util.Set;

/**
 * Dry-run classification of a failure rate. Nothing is persisted or sent.
 */
public record AlertSimulation(
    double failureRate,
    TimeWindow timeWindow,
    AlertSeverity severity,
    Double thresholdCrossed,
    Set<AlertChannelType> channels,
    boolean escalates,
    boolean wouldBeSuppressed,
    String title
) {
}
