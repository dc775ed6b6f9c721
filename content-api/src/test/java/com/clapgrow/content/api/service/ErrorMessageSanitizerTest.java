package com.clapgrow.content.api.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErrorMessageSanitizerTest {

    @Test
    void testSanitize_MasksCredentials() {
        assertEquals("401 token=***", ErrorMessageSanitizer.sanitize("401 token=sk-abc123"));
        assertEquals("bad password: *** rejected", ErrorMessageSanitizer.sanitize("bad password: hunter2 rejected"));
        assertEquals("API key *** is invalid", ErrorMessageSanitizer.sanitize("API key sk-live-999 is invalid"));
    }

    @Test
    void testSanitize_LeavesOrdinaryMessagesAlone() {
        assertEquals("Connection reset by peer", ErrorMessageSanitizer.sanitize("Connection reset by peer"));
        assertNull(ErrorMessageSanitizer.sanitize(null));
    }

    @Test
    void testSanitize_TruncatesLongMessages() {
        String sanitized = ErrorMessageSanitizer.sanitize("x".repeat(ErrorMessageSanitizer.MAX_LENGTH + 250));
        assertEquals(ErrorMessageSanitizer.MAX_LENGTH, sanitized.length());
    }
}
