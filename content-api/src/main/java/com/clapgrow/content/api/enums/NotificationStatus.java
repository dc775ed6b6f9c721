package com.clapgrow.content.api.enums;

public enum NotificationStatus {
    SENT,
    FAILED,
    SKIPPED  // Channel disabled or not configured
}
