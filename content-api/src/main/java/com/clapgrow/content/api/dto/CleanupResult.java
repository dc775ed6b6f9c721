package com.clapgrow.content.api.dto;

import java.time.LocalDateTime;

public record CleanupResult(String target, int deletedRows, LocalDateTime cutoff) {
}
