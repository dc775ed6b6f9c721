package com.clapgrow.content.api.enums;

import java.time.Duration;

/**
 * Aggregation windows for failure-rate evaluation.
 */
public enum TimeWindow {
    HOURLY(Duration.ofHours(1)),
    DAILY(Duration.ofDays(1)),
    WEEKLY(Duration.ofDays(7)),
    MONTHLY(Duration.ofDays(30));

    private final Duration length;

    TimeWindow(Duration length) {
        this.length = length;
    }

    public Duration getLength() {
        return length;
    }

    public static TimeWindow fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            return DAILY;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Unknown time window: " + value + ". Available: " + java.util.Arrays.toString(values()), e);
        }
    }
}
