package com.sprintsync.workflow.error;

public class DuplicateOrganizationException extends WorkflowException {

    public DuplicateOrganizationException(String name) {
        super(Kind.DUPLICATE_ORGANIZATION, "Organization '" + name + "' already exists");
    }
}
