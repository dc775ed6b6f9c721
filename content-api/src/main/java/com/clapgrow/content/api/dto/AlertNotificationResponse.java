package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.entity.AlertNotification;
import com.clapgrow.content.api.enums.AlertChannelType;
import com.clapgrow.content.api.enums.NotificationStatus;

import java.time.LocalDateTime;
import java.util.UUID;

public record AlertNotificationResponse(
    UUID id,
    UUID alertId,
    AlertChannelType channel,
    NotificationStatus status,
    int escalationLevel,
    String detail,
    LocalDateTime createdAt
) {
    public static AlertNotificationResponse from(AlertNotification notification) {
        return new AlertNotificationResponse(
            notification.getId(),
            notification.getAlertId(),
            notification.getChannel(),
            notification.getStatus(),
            notification.getEscalationLevel() != null ? notification.getEscalationLevel() : 0,
            notification.getDetail(),
            notification.getCreatedAt()
        );
    }
}
