package com.clapgrow.content.api.enums;

public enum AlertTrend {
    IMPROVING,
    DEGRADING,
    STABLE
}
