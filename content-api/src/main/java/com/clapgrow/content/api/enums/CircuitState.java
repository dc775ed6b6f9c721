package com.clapgrow.content.api.enums;

public enum CircuitState {
    CLOSED,     // Calls proceed normally
    OPEN,       // Calls short-circuited until cool-down elapses
    HALF_OPEN   // One probe call in flight
}
