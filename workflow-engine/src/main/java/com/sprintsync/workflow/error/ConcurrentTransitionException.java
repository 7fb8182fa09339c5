package com.sprintsync.workflow.error;

/**
 * The task row stayed contended for every internal attempt. Nothing was
 * applied; the caller may retry.
 */
public class ConcurrentTransitionException extends WorkflowException {

    public ConcurrentTransitionException(Long taskId, int attempts, Throwable cause) {
        super(Kind.CONCURRENT_MODIFICATION,
                "Task " + taskId + " was modified concurrently; gave up after "
                + attempts + " attempt(s)", cause);
    }
}
