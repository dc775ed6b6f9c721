package com.clapgrow.content.api.enums;

public enum AdminRole {
    USER,
    CONTENT_MANAGER,
    ADMIN,
    SUPER_ADMIN;

    public static AdminRole fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Admin role cannot be null or empty");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Unknown admin role: " + value + ". Available: " + java.util.Arrays.toString(values()), e);
        }
    }
}
