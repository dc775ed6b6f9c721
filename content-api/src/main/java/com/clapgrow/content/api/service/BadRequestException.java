package com.clapgrow.content.api.service;

/**
 * Exception thrown when a bad request is made (e.g., unknown action, invalid input).
 * Mapped to HTTP 400 by GlobalExceptionHandler.
 * 
 * Example usage:
 * <pre>
 * if (jobId == null) {
 *     throw new BadRequestException("jobId is required for action 'history'");
 * }
 * </pre>
 */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }

    public BadRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
