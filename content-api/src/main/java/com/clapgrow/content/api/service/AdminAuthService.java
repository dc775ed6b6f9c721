package com.clapgrow.content.api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Validates the X-Admin-Key header against admin.api-key.
 * 
 * ⚠️ With no key configured every admin endpoint answers 401. There is no open fallback.
 */
@Service
@Slf4j
public class AdminAuthService {
    
    private final byte[] configuredAdminKey;
    
    public AdminAuthService(@Value("${admin.api-key:}") String adminApiKey) {
        if (adminApiKey != null && !adminApiKey.trim().isEmpty()) {
            this.configuredAdminKey = adminApiKey.getBytes(StandardCharsets.UTF_8);
        } else {
            this.configuredAdminKey = null;
            log.warn("Admin API key is not configured. Admin endpoints will be inaccessible.");
        }
    }
    
    /**
     * @throws SecurityException if the key is missing, not configured or wrong
     */
    public void validateAdminKey(String providedKey) {
        if (configuredAdminKey == null) {
            throw new SecurityException("Admin API key is not configured");
        }
        
        if (providedKey == null || providedKey.trim().isEmpty()) {
            throw new SecurityException("Admin API key is required");
        }
        
        // Constant-time comparison
        if (!MessageDigest.isEqual(providedKey.getBytes(StandardCharsets.UTF_8), configuredAdminKey)) {
            throw new SecurityException("Invalid admin API key");
        }
    }

    public boolean isConfigured() {
        return configuredAdminKey != null;
    }
}
