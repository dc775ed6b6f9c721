package com.clapgrow.content.api.enums;

/**
 * Health levels ordered from best to worst.
 */
public enum HealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL,
    DOWN;

    public HealthStatus worst(HealthStatus other) {
        if (other == null) {
            return this;
        }
        return other.ordinal() > ordinal() ? other : this;
    }
}
