package com.clapgrow.content.api.enums;

import java.util.EnumSet;
import java.util.Set;

public enum AlertSeverity {
    WARNING(EnumSet.of(AlertChannelType.EMAIL), false),
    CRITICAL(EnumSet.of(AlertChannelType.EMAIL, AlertChannelType.CHAT), true),
    EMERGENCY(EnumSet.of(AlertChannelType.EMAIL, AlertChannelType.CHAT, AlertChannelType.WEBHOOK), true);

    private final Set<AlertChannelType> channels;
    private final boolean escalating;

    AlertSeverity(Set<AlertChannelType> channels, boolean escalating) {
        this.channels = channels;
        this.escalating = escalating;
    }

    /**
     * Notification channels an alert of this severity fans out to.
     */
    public Set<AlertChannelType> getChannels() {
        return EnumSet.copyOf(channels);
    }

    /**
     * Whether alerts of this severity trigger escalation.
     */
    public boolean isEscalating() {
        return escalating;
    }

    public static AlertSeverity fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Alert severity cannot be null or empty");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Unknown alert severity: " + value + ". Available: " + java.util.Arrays.toString(values()), e);
        }
    }
}
