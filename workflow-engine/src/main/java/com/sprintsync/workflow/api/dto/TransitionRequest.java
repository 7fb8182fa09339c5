package com.sprintsync.workflow.api.dto;

/**
 * Request body for POST /tasks/{taskId}/transitions.
 *
 * Required: toStatusId, actorId
 * Optional: note (at most 2000 characters)
 */
public record TransitionRequest(Long toStatusId, Long actorId, String note) {}
