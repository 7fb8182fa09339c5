package com.sprintsync.workflow.error;

/**
 * The status does not exist, or exists only in a different organization.
 * Both cases read the same to the caller so ids of other tenants never leak.
 */
public class UnknownStatusException extends WorkflowException {

    public UnknownStatusException(Long organizationId, Long statusId) {
        super(Kind.UNKNOWN_STATUS,
                "Status " + statusId + " not found in organization " + organizationId);
    }

    public UnknownStatusException(Long organizationId, String statusName) {
        super(Kind.UNKNOWN_STATUS,
                "Status '" + statusName + "' not found in organization " + organizationId);
    }
}
