package com.clapgrow.content.api.service;

/**
 * Exception thrown when the system or a dependency is unavailable.
 * Mapped to HTTP 503 Service Unavailable.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
