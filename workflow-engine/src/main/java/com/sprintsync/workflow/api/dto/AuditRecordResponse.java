package com.sprintsync.workflow.api.dto;

import com.sprintsync.workflow.model.AuditRecord;

import java.time.Instant;
import java.util.Map;

/**
 * One entry of GET /tasks/{taskId}/history, also returned by a successful move.
 * fromStatusId and fromStatusName are null for the task's first status assignment.
 */
public record AuditRecordResponse(
        Long    id,
        Long    taskId,
        Long    fromStatusId,
        String  fromStatusName,
        Long    toStatusId,
        String  toStatusName,
        Long    changedBy,
        Instant changedAt,
        String  notes
) {
    /**
     * @param displayNames status display names of the task's organization, by id
     */
    public static AuditRecordResponse from(AuditRecord r, Map<Long, String> displayNames) {
        return new AuditRecordResponse(
                r.getId(),
                r.getTaskId(),
                r.getFromStatusId(),
                r.getFromStatusId() == null ? null : displayNames.get(r.getFromStatusId()),
                r.getToStatusId(),
                displayNames.get(r.getToStatusId()),
                r.getChangedBy(),
                r.getChangedAt(),
                r.getNotes()
        );
    }
}
