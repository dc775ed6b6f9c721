package com.clapgrow.content.api.enums;

public enum AlertChannelType {
    EMAIL,
    CHAT,
    WEBHOOK
}
