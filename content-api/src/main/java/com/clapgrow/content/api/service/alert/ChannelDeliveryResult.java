package com.clapgrow.content.api.service.alert;

import com.clapgrow.content.api.enums.NotificationStatus;

public record ChannelDeliveryResult(NotificationStatus status, String detail) {

    public static ChannelDeliveryResult sent(String detail) {
        return new ChannelDeliveryResult(NotificationStatus.SENT, detail);
    }

    public static ChannelDeliveryResult failed(String detail) {
        return new ChannelDeliveryResult(NotificationStatus.FAILED, detail);
    }

    public static ChannelDeliveryResult skipped(String detail) {
        return new ChannelDeliveryResult(NotificationStatus.SKIPPED, detail);
    }
}
