package com.sprintsync.workflow.api.dto;

import com.sprintsync.workflow.model.Organization;

import java.time.Instant;

public record OrganizationResponse(
        Long    id,
        String  name,
        String  description,
        Instant createdAt
) {
    public static OrganizationResponse from(Organization org) {
        return new OrganizationResponse(org.getId(), org.getName(), org.getDescription(), org.getCreatedAt());
    }
}
