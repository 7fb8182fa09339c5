package com.sprintsync.workflow.error;

public class OrganizationNotFoundException extends WorkflowException {

    public OrganizationNotFoundException(Long organizationId) {
        super(Kind.ORGANIZATION_NOT_FOUND, "Organization not found: " + organizationId);
    }
}
