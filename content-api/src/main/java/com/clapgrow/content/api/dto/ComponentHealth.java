package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.HealthStatus;

import java.util.Map;

public record ComponentHealth(String name, HealthStatus status, String message, Map<String, Object> details) {
}
