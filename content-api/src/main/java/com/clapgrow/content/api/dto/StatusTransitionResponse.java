package com.clapgrow.content.api.dto;

import com.clapgrow.content.api.entity.JobStatusTransition;
import com.clapgrow.content.api.enums.AdminRole;
import com.clapgrow.content.api.enums.JobStatus;
import com.clapgrow.content.api.enums.TransitionActor;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

public record StatusTransitionResponse(
    Long id,
    UUID jobId,
    JobStatus fromStatus,
    JobStatus toStatus,
    String reason,
    TransitionActor actor,
    boolean forceOverride,
    String adminUserId,
    AdminRole adminRole,
    Map<String, Object> metadata,
    LocalDateTime timestamp
) {
    public static StatusTransitionResponse from(JobStatusTransition transition) {
        return new StatusTransitionResponse(
            transition.getId(),
            transition.getJobId(),
            transition.getFromStatus(),
            transition.getToStatus(),
            transition.getReason(),
            transition.getActor(),
            Boolean.TRUE.equals(transition.getForceOverride()),
            transition.getAdminUserId(),
            transition.getAdminRole(),
            transition.getMetadata(),
            transition.getTimestamp()
        );
    }
}
