package com.clapgrow.content.common.service;

/**
 * External dependency protected by a circuit breaker and a rate limiter.
 *
 * Used to key breaker state, rate-limit windows and retry decisions in a type-safe manner.
 *
 * Example usage:
 * <pre>
 * ExternalService service = ExternalService.fromString("generation-api");
 * if (service.isTokenMetered()) {
 *     // account estimated token volume
 * }
 * </pre>
 */
public enum ExternalService {
    /**
     * Text generation API (metered by requests and tokens)
     */
    GENERATION_API("generation-api", true),

    /**
     * Content management publishing API (metered by requests only)
     */
    PUBLISHING_API("publishing-api", false);

    private final String key;
    private final boolean tokenMetered;

    ExternalService(String key, boolean tokenMetered) {
        this.key = key;
        this.tokenMetered = tokenMetered;
    }

    /**
     * Stable key used for persistence and configuration (e.g., "generation-api").
     */
    public String getKey() {
        return key;
    }

    public boolean isTokenMetered() {
        return tokenMetered;
    }

    /**
     * Parse a service from its key or enum name (case-insensitive).
     *
     * Accepts the legacy vendor aliases "openai" and "wordpress".
     *
     * @param name Service key, enum name or alias
     * @return ExternalService value
     * @throws IllegalArgumentException if name doesn't match any service
     */
    public static ExternalService fromString(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Service name cannot be null or empty");
        }
        String normalized = name.trim().toLowerCase();
        if ("openai".equals(normalized)) {
            return GENERATION_API;
        }
        if ("wordpress".equals(normalized)) {
            return PUBLISHING_API;
        }
        for (ExternalService service : values()) {
            if (service.key.equals(normalized) || service.name().equalsIgnoreCase(normalized)) {
                return service;
            }
        }
        throw new IllegalArgumentException(
            "Unknown service: " + name + ". Available: " + java.util.Arrays.toString(values()));
    }
}
