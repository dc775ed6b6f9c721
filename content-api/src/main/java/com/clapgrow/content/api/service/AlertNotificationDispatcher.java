package com.clapgrow.content.api.service;

import com.clapgrow.content.api.entity.Alert;
import com.clapgrow.content.api.entity.AlertNotification;
import com.clapgrow.content.api.enums.AlertChannelType;
import com.clapgrow.content.api.repository.AlertNotificationRepository;
import com.clapgrow.content.api.service.alert.AlertChannel;
import com.clapgrow.content.api.service.alert.ChannelDeliveryResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fans an alert out to the channels of its severity and logs one AlertNotification per channel.
 * 
 * ⚠️ A failing channel never stops the others or the alert evaluation. Its failure is logged
 * and persisted as a FAILED notification.
 */
@Service
@Slf4j
public class AlertNotificationDispatcher {

    private final Map<AlertChannelType, AlertChannel> channels = new EnumMap<>(AlertChannelType.class);
    private final AlertNotificationRepository notificationRepository;
    private final Clock clock;

    public AlertNotificationDispatcher(List<AlertChannel> channels,
                                       AlertNotificationRepository notificationRepository,
                                       Clock clock) {
        channels.forEach(channel -> this.channels.put(channel.getType(), channel));
        this.notificationRepository = notificationRepository;
        this.clock = clock;
    }

    public List<AlertNotification> dispatch(Alert alert, int escalationLevel) {
        List<AlertNotification> notifications = new ArrayList<>();
        for (AlertChannelType type : alert.getSeverity().getChannels()) {
            ChannelDeliveryResult result = deliver(type, alert, escalationLevel);

            AlertNotification notification = new AlertNotification();
            notification.setAlertId(alert.getId());
            notification.setChannel(type);
            notification.setStatus(result.status());
            notification.setEscalationLevel(escalationLevel);
            notification.setDetail(result.detail());
            notification.setCreatedAt(LocalDateTime.now(clock));
            notifications.add(notificationRepository.save(notification));
        }
        return notifications;
    }

    public boolean isChannelEnabled(AlertChannelType type) {
        AlertChannel channel = channels.get(type);
        return channel != null && channel.isEnabled();
    }

    private ChannelDeliveryResult deliver(AlertChannelType type, Alert alert, int escalationLevel) {
        AlertChannel channel = channels.get(type);
        if (channel == null || !channel.isEnabled()) {
            log.debug("Alert channel {} disabled, skipping alert {}", type, alert.getId());
            return ChannelDeliveryResult.skipped("Channel " + type + " is disabled or not configured");
        }
        try {
            return channel.send(alert, escalationLevel);
        } catch (RuntimeException e) {
            log.error("Alert channel {} failed for alert {}", type, alert.getId(), e);
            return ChannelDeliveryResult.failed("Unexpected error: " + e.getMessage());
        }
    }
}
