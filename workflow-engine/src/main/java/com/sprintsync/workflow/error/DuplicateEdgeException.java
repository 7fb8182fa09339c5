package com.sprintsync.workflow.error;

public class DuplicateEdgeException extends WorkflowException {

    public DuplicateEdgeException(Long organizationId, Long fromStatusId, Long toStatusId) {
        super(Kind.DUPLICATE_EDGE,
                "Transition " + fromStatusId + " -> " + toStatusId
                + " is already active in organization " + organizationId);
    }
}
