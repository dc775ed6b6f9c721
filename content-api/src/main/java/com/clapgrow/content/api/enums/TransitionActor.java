package com.clapgrow.content.api.enums;

/**
 * Originator of a status transition or retry attempt.
 */
public enum TransitionActor {
    SYSTEM,  // Job processing pipeline, schedulers
    ADMIN    // Manual intervention through AdminRetryManager
}
