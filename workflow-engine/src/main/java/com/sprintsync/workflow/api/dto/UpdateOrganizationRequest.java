package com.sprintsync.workflow.api.dto;

/**
 * Request body for PATCH /organizations/{orgId}. Absent fields are left unchanged.
 */
public record UpdateOrganizationRequest(String name, String description) {}
