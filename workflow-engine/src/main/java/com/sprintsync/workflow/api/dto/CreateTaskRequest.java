package com.sprintsync.workflow.api.dto;

/** Request body for POST /organizations/{orgId}/tasks. Both fields required. */
public record CreateTaskRequest(String title, Long createdBy) {}
