package com.sprintsync.workflow.api.dto;

import com.sprintsync.workflow.model.TaskStatus;

import java.time.Instant;

public record StatusResponse(
        Long    id,
        Long    organizationId,
        String  name,
        String  displayName,
        String  color,
        int     orderIndex,
        boolean active,
        boolean defaultStatus,
        Instant createdAt,
        Instant updatedAt
) {
    public static StatusResponse from(TaskStatus s) {
        return new StatusResponse(
                s.getId(),
                s.getOrganizationId(),
                s.getName(),
                s.getDisplayName(),
                s.getColor(),
                s.getOrderIndex(),
                s.isActive(),
                s.isDefaultStatus(),
                s.getCreatedAt(),
                s.getUpdatedAt()
        );
    }
}
