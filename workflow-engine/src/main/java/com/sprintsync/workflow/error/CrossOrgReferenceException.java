package com.sprintsync.workflow.error;

/**
 * A transition edge named a status that does not belong to the edge's organization.
 */
public class CrossOrgReferenceException extends WorkflowException {

    public CrossOrgReferenceException(Long organizationId, Long statusId) {
        super(Kind.CROSS_ORG_REFERENCE,
                "Status " + statusId + " does not belong to organization " + organizationId);
    }
}
