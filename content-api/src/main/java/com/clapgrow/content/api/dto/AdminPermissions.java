package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.AdminRetryType;
import com.clapgrow.content.api.enums.AdminRole;

import java.util.Set;

public record AdminPermissions(
    AdminRole role,
    Set<AdminRetryType> allowedRetryTypes,
    boolean canForceOverride,
    int maxTotalRetries,
    int maxManualRetries
) {
}
