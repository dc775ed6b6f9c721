package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.enums.AdminRole;
import com.clapgrow.content.api.enums.JobStatus;
import com.clapgrow.content.api.enums.TransitionActor;

import java.util.Map;

/**
 * Requested status change and who is asking for it.
 * 
 * @param forceOverride only honoured for admin actors; executes an otherwise illegal transition, flagged
 */
public record TransitionCommand(
    JobStatus toStatus,
    String reason,
    TransitionActor actor,
    String adminUserId,
    AdminRole adminRole,
    boolean forceOverride,
    Map<String, Object> metadata
) {
    public static TransitionCommand system(JobStatus toStatus, String reason) {
        return new TransitionCommand(toStatus, reason, TransitionActor.SYSTEM, null, null, false, null);
    }

    public static TransitionCommand admin(JobStatus toStatus, String reason, String adminUserId,
                                          AdminRole adminRole, boolean forceOverride) {
        return new TransitionCommand(toStatus, reason, TransitionActor.ADMIN, adminUserId, adminRole, forceOverride, null);
    }

    public TransitionCommand withMetadata(Map<String, Object> metadata) {
        return new TransitionCommand(toStatus, reason, actor, adminUserId, adminRole, forceOverride, metadata);
    }

    public boolean isAdminForce() {
        return forceOverride && actor == TransitionActor.ADMIN;
    }
}
