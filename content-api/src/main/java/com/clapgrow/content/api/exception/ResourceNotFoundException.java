package com.clapgrow.content.api.exception;

/**
 * Requested entity doesn't exist. Mapped to HTTP 404.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
