package com.sprintsync.workflow.api.dto;

/**
 * Request body for POST /organizations.
 * Required: name. Optional: description.
 */
public record CreateOrganizationRequest(String name, String description) {}
