package com.sprintsync.workflow.error;

public class TransitionNotFoundException extends WorkflowException {

    public TransitionNotFoundException(Long organizationId, Long fromStatusId, Long toStatusId) {
        super(Kind.TRANSITION_NOT_FOUND,
                "No transition " + fromStatusId + " -> " + toStatusId
                + " in organization " + organizationId);
    }
}
