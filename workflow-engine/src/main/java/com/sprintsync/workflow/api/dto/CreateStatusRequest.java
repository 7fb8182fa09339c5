package com.sprintsync.workflow.api.dto;

/**
 * Request body for POST /organizations/{orgId}/statuses.
 *
 * Required: name
 * Optional: displayName (defaults to name), color (#RGB or #RRGGBB),
 *   orderIndex (defaults to 0), defaultStatus (defaults to false)
 */
public record CreateStatusRequest(String name, String displayName, String color,
                                  Integer orderIndex, Boolean defaultStatus) {

    public CreateStatusRequest {
        if (orderIndex == null) orderIndex = 0;
        if (defaultStatus == null) defaultStatus = false;
    }
}
