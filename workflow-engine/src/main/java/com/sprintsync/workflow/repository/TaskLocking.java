package com.sprintsync.workflow.repository;

import com.sprintsync.workflow.model.Task;

import java.util.Optional;

/**
 * Row-lock fragment of {@link TaskRepository}.
 */
public interface TaskLocking {

    /**
     * Load a task with SELECT ... FOR UPDATE, waiting at most the configured
     * lock timeout. Must run inside a transaction; the lock is held until it ends.
     *
     * @return empty if no such task exists
     * @throws org.springframework.dao.CannotAcquireLockException if another
     *         transaction still holds the row when the timeout runs out
     */
    Optional<Task> lockById(Long taskId);
}
