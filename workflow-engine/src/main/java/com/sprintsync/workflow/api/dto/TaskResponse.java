package com.sprintsync.workflow.api.dto;

import com.sprintsync.workflow.model.Task;

import java.time.Instant;

public record TaskResponse(
        Long    id,
        Long    organizationId,
        String  title,
        Long    currentStatusId,
        long    version,
        Long    createdBy,
        Instant createdAt,
        Instant updatedAt
) {
    public static TaskResponse from(Task t) {
        return new TaskResponse(
                t.getId(),
                t.getOrganizationId(),
                t.getTitle(),
                t.getCurrentStatusId(),
                t.getVersion(),
                t.getCreatedBy(),
                t.getCreatedAt(),
                t.getUpdatedAt()
        );
    }
}
