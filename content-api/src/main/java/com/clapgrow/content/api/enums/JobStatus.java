package com.clapgrow.content.api.enums;

public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /**
     * Parse a status from a request value (case-insensitive, e.g. "pending").
     *
     * @throws IllegalArgumentException if the value doesn't match any status
     */
    public static JobStatus fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Job status cannot be null or empty");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Unknown job status: " + value + ". Available: " + java.util.Arrays.toString(values()), e);
        }
    }
}
