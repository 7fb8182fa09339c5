package com.sprintsync.workflow.repository;

import com.sprintsync.workflow.config.WorkflowProperties;
import com.sprintsync.workflow.model.Task;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.CannotAcquireLockException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Spring Data picks this up as the implementation of {@link TaskLocking}
 * by its "Impl" suffix.
 *
 * SELECT FOR UPDATE SKIP LOCKED never waits on the database side:
 *   - FOR UPDATE  : lock the task row until the surrounding transaction ends
 *   - SKIP LOCKED : if another move holds it, return nothing instead of blocking
 *
 * The wait happens here instead, polling until
 * {@code sprintsync.workflow.transition.lock-timeout} runs out. No statement
 * ever fails with a lock timeout, so the connection stays usable and the
 * transaction can roll back cleanly.
 */
public class TaskLockingImpl implements TaskLocking {

    private static final Logger log = LoggerFactory.getLogger(TaskLockingImpl.class);

    private static final String LOCK_SQL =
            "SELECT * FROM tasks WHERE id = :id FOR UPDATE SKIP LOCKED";

    private static final Duration POLL_INTERVAL = Duration.ofMillis(20);

    @PersistenceContext
    private EntityManager entityManager;

    private final WorkflowProperties properties;

    public TaskLockingImpl(WorkflowProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<Task> lockById(Long taskId) {
        Duration lockTimeout = properties.getTransition().getLockTimeout();
        long deadline = System.nanoTime() + lockTimeout.toNanos();
        int polls = 0;

        while (true) {
            Optional<Task> task = tryLock(taskId);
            if (task.isPresent() || !exists(taskId)) {
                return task;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new CannotAcquireLockException(
                        "Task " + taskId + " still locked by another move after " + lockTimeout);
            }
            if (polls++ == 0) {
                log.debug("Task {} is locked by another move, waiting up to {}", taskId, lockTimeout);
            }
            pause(taskId, Math.min(POLL_INTERVAL.toNanos(), remaining));
        }
    }

    @SuppressWarnings("unchecked")
    private Optional<Task> tryLock(Long taskId) {
        List<Task> rows = entityManager.createNativeQuery(LOCK_SQL, Task.class)
                .setParameter("id", taskId)
                .getResultList();
        return rows.stream().findFirst();
    }

    // Plain read: never blocks on the row lock.
    private boolean exists(Long taskId) {
        return entityManager.createQuery("SELECT COUNT(t) FROM Task t WHERE t.id = :id", Long.class)
                .setParameter("id", taskId)
                .getSingleResult() > 0;
    }

    private static void pause(Long taskId, long nanos) {
        try {
            TimeUnit.NANOSECONDS.sleep(nanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CannotAcquireLockException("Interrupted while waiting for the lock on task " + taskId, e);
        }
    }
}
