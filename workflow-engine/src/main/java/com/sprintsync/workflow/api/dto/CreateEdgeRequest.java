package com.sprintsync.workflow.api.dto;

/** Request body for POST /organizations/{orgId}/transitions. */
public record CreateEdgeRequest(Long fromStatusId, Long toStatusId) {}
