package com.sprintsync.workflow.error;

/**
 * No active edge leads from the task's current status to the requested one.
 */
public class IllegalTransitionException extends WorkflowException {

    private final Long fromStatusId;
    private final Long toStatusId;

    public IllegalTransitionException(Long taskId, Long fromStatusId, Long toStatusId) {
        super(Kind.ILLEGAL_TRANSITION,
                "That move is not allowed from the task's current status (task " + taskId
                + ": " + fromStatusId + " -> " + toStatusId + ")");
        this.fromStatusId = fromStatusId;
        this.toStatusId   = toStatusId;
    }

    public Long getFromStatusId() { return fromStatusId; }
    public Long getToStatusId()   { return toStatusId; }
}
