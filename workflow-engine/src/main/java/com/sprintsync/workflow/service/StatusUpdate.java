package com.sprintsync.workflow.service;

/**
 * Partial update of a status. Null fields are left unchanged.
 */
public record StatusUpdate(
        String  displayName,
        String  color,
        Integer orderIndex,
        Boolean active,
        Boolean defaultStatus
) {}
