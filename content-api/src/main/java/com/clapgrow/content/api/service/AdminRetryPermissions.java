package com.clapgrow.content.api.service;

import com.clapgrow.content.api.dto.AdminPermissions;
import com.clapgrow.content.api.enums.AdminRetryType;
import com.clapgrow.content.api.enums.AdminRole;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Declarative (role, retry type) → allowed table, evaluated once per admin retry request.
 * 
 * | Role            | Allowed retry types                   | Force override |
 * |-----------------|---------------------------------------|----------------|
 * | USER            | none                                  | no             |
 * | CONTENT_MANAGER | manual, force, reset, override        | no             |
 * | ADMIN           | manual, force, reset, override        | yes            |
 * | SUPER_ADMIN     | all five (adds emergency)             | yes            |
 */
@Component
public class AdminRetryPermissions {

    public static final int MAX_TOTAL_RETRIES = 10;
    public static final int MAX_MANUAL_RETRIES = 5;

    private static final Map<AdminRole, Set<AdminRetryType>> ALLOWED_RETRY_TYPES;
    private static final Set<AdminRole> FORCE_OVERRIDE_ROLES = EnumSet.of(AdminRole.ADMIN, AdminRole.SUPER_ADMIN);

    static {
        Set<AdminRetryType> standard = EnumSet.of(
            AdminRetryType.MANUAL_RETRY,
            AdminRetryType.FORCE_RETRY,
            AdminRetryType.RESET_RETRY_COUNT,
            AdminRetryType.OVERRIDE_MAX_RETRIES
        );
        Map<AdminRole, Set<AdminRetryType>> table = new EnumMap<>(AdminRole.class);
        table.put(AdminRole.USER, EnumSet.noneOf(AdminRetryType.class));
        table.put(AdminRole.CONTENT_MANAGER, standard);
        table.put(AdminRole.ADMIN, standard);
        table.put(AdminRole.SUPER_ADMIN, EnumSet.allOf(AdminRetryType.class));
        ALLOWED_RETRY_TYPES = Collections.unmodifiableMap(table);
    }

    public boolean isAllowed(AdminRole role, AdminRetryType retryType) {
        if (role == null || retryType == null) {
            return false;
        }
        return ALLOWED_RETRY_TYPES.getOrDefault(role, Set.of()).contains(retryType);
    }

    public boolean canForceOverride(AdminRole role) {
        return role != null && FORCE_OVERRIDE_ROLES.contains(role);
    }

    public AdminPermissions getPermissions(AdminRole role) {
        Set<AdminRetryType> allowed = EnumSet.noneOf(AdminRetryType.class);
        allowed.addAll(ALLOWED_RETRY_TYPES.getOrDefault(role, Set.of()));
        return new AdminPermissions(role, allowed, canForceOverride(role),
            MAX_TOTAL_RETRIES, MAX_MANUAL_RETRIES);
    }
}
