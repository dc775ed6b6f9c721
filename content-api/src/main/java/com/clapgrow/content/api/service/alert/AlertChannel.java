package com.clapgrow.content.api.service.alert;

import com.clapgrow.content.api.entity.Alert;
import com.clapgrow.content.api.enums.AlertChannelType;

/**
 * Outbound notification channel for alerts.
 * 
 * Implementations report delivery problems through the returned result and must not throw
 * for expected provider errors (non-2xx, timeouts). AlertNotificationDispatcher still guards
 * against unexpected runtime exceptions.
 */
public interface AlertChannel {

    AlertChannelType getType();

    /**
     * false when the channel is switched off or lacks its target (URL, recipients, credentials).
     */
    boolean isEnabled();

    /**
     * @param escalationLevel 0 for the initial notification, N for the Nth escalation
     */
    ChannelDeliveryResult send(Alert alert, int escalationLevel);
}
