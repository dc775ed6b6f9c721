package com.clapgrow.content.api.enums;

public enum AttemptOutcome {
    SUCCEEDED,  // Attempt completed the job
    FAILED,     // Attempt failed, further retry allowed
    EXHAUSTED,  // Attempt failed, no further automatic retry
    RESET       // Admin reset of the retry counter
}
