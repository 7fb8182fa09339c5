package com.sprintsync.workflow.error;

/**
 * Root of every failure the workflow engine reports to its callers.
 *
 * Unchecked, like the rest of the service layer: callers catch it only when
 * they have a recovery strategy (the HTTP layer maps it by {@link Kind}).
 * Everything except {@link Kind#CONCURRENT_MODIFICATION} and
 * {@link Kind#PERSISTENCE} is deterministic for the same input and state.
 */
public abstract class WorkflowException extends RuntimeException {

    public enum Kind {
        DUPLICATE_NAME,
        DUPLICATE_EDGE,
        DUPLICATE_ORGANIZATION,
        CROSS_ORG_REFERENCE,
        ORGANIZATION_NOT_FOUND,
        TASK_NOT_FOUND,
        UNKNOWN_STATUS,
        INACTIVE_STATUS,
        TRANSITION_NOT_FOUND,
        ILLEGAL_TRANSITION,
        CONCURRENT_MODIFICATION,
        PERSISTENCE
    }

    private final Kind kind;

    protected WorkflowException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected WorkflowException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    /** True when repeating the same call later may succeed. */
    public boolean retryable() {
        return kind == Kind.CONCURRENT_MODIFICATION || kind == Kind.PERSISTENCE;
    }
}
