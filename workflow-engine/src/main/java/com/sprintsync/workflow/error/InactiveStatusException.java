package com.sprintsync.workflow.error;

public class InactiveStatusException extends WorkflowException {

    public InactiveStatusException(Long statusId, String statusName) {
        super(Kind.INACTIVE_STATUS,
                "Status '" + statusName + "' (" + statusId + ") is inactive and cannot be a target");
    }
}
