package com.clapgrow.content.api.enums;

public enum AdminRetryType {
    MANUAL_RETRY(true),
    FORCE_RETRY(true),
    RESET_RETRY_COUNT(false),
    OVERRIDE_MAX_RETRIES(true),
    EMERGENCY_RETRY(false);

    private final boolean incrementsRetryCount;

    AdminRetryType(boolean incrementsRetryCount) {
        this.incrementsRetryCount = incrementsRetryCount;
    }

    /**
     * true: retry count + 1; false: retry count reset to 0.
     */
    public boolean incrementsRetryCount() {
        return incrementsRetryCount;
    }
}
