package com.sprintsync.workflow.error;

public class TaskNotFoundException extends WorkflowException {

    public TaskNotFoundException(Long taskId) {
        super(Kind.TASK_NOT_FOUND, "Task not found: " + taskId);
    }
}
