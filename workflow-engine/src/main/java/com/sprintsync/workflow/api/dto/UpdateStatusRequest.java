package com.sprintsync.workflow.api.dto;

import com.sprintsync.workflow.service.StatusUpdate;

/**
 * Request body for PATCH /organizations/{orgId}/statuses/{statusId}.
 * Every field is optional; absent fields are left unchanged. The name is
 * not updatable.
 */
public record UpdateStatusRequest(String displayName, String color, Integer orderIndex,
                                  Boolean active, Boolean defaultStatus) {

    public StatusUpdate toUpdate() {
        return new StatusUpdate(displayName, color, orderIndex, active, defaultStatus);
    }
}
