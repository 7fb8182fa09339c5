package com.sprintsync.workflow.error;

public class DuplicateStatusNameException extends WorkflowException {

    public DuplicateStatusNameException(Long organizationId, String name) {
        super(Kind.DUPLICATE_NAME,
                "Status '" + name + "' already exists in organization " + organizationId);
    }
}
