package com.sprintsync.workflow.api.dto;

import com.sprintsync.workflow.model.TransitionEdge;

import java.time.Instant;
import java.util.Map;

public record EdgeResponse(
        Long    id,
        Long    organizationId,
        Long    fromStatusId,
        String  fromStatusName,
        Long    toStatusId,
        String  toStatusName,
        boolean active,
        Instant createdAt
) {
    public static EdgeResponse from(TransitionEdge e, Map<Long, String> displayNames) {
        return new EdgeResponse(
                e.getId(),
                e.getOrganizationId(),
                e.getFromStatusId(),
                displayNames.get(e.getFromStatusId()),
                e.getToStatusId(),
                displayNames.get(e.getToStatusId()),
                e.isActive(),
                e.getCreatedAt()
        );
    }
}
