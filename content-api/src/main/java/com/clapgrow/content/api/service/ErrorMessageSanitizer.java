package com.clapgrow.content.api.service;

import java.util.regex.Pattern;

/**
 * Masks credentials in error messages before they are persisted.
 * 
 * Example:
 * <pre>
 * ErrorMessageSanitizer.sanitize("401 token=sk-abc123") // "401 token=***"
 * </pre>
 */
public final class ErrorMessageSanitizer {

    static final int MAX_LENGTH = 1000;

    private static final Pattern SECRET_PATTERN =
        Pattern.compile("(?i)(password|token|key|secret)(\\s*[=:]\\s*|\\s+)(\\S+)");

    private ErrorMessageSanitizer() {
    }

    public static String sanitize(String message) {
        if (message == null) {
            return null;
        }
        String masked = SECRET_PATTERN.matcher(message).replaceAll("$1$2***");
        if (masked.length() > MAX_LENGTH) {
            return masked.substring(0, MAX_LENGTH);
        }
        return masked;
    }
}
