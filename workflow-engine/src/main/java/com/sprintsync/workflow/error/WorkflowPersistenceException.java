package com.sprintsync.workflow.error;

/**
 * The store failed or timed out. The transaction was rolled back, so no
 * partial change is visible; the caller may retry.
 */
public class WorkflowPersistenceException extends WorkflowException {

    public WorkflowPersistenceException(String message, Throwable cause) {
        super(Kind.PERSISTENCE, message, cause);
    }
}
