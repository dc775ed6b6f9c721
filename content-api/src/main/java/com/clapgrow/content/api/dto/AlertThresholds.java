package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.AlertChannelType;
import com.clapgrow.content.api.enums.AlertSeverity;

import java.util.List;
import java.util.Set;

public record AlertThresholds(List<Band> bands) {

    /**
     * @param lowerBound inclusive
     * @param upperBound exclusive, null for the top band
     */
    public record Band(
        AlertSeverity severity,
        double lowerBound,
        Double upperBound,
        Set<AlertChannelType> channels,
        boolean escalates,
        long cooldownMinutes
    ) {
    }
}
