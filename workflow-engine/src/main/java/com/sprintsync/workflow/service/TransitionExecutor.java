package com.sprintsync.workflow.service;

import com.sprintsync.workflow.config.WorkflowProperties;
import com.sprintsync.workflow.error.ConcurrentTransitionException;
import com.sprintsync.workflow.error.IllegalTransitionException;
import com.sprintsync.workflow.error.InactiveStatusException;
import com.sprintsync.workflow.error.TaskNotFoundException;
import com.sprintsync.workflow.error.WorkflowException;
import com.sprintsync.workflow.error.WorkflowPersistenceException;
import com.sprintsync.workflow.model.AuditRecord;
import com.sprintsync.workflow.model.Task;
import com.sprintsync.workflow.model.TaskStatus;
import com.sprintsync.workflow.repository.TaskRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Moves a task to a new status.
 *
 * One call is one transaction:
 * <ol>
 *   <li>lock the task row ({@code SELECT ... FOR UPDATE} with a lock timeout)</li>
 *   <li>check the target status is in the task's organization and active</li>
 *   <li>check the graph has an active edge from the current status</li>
 *   <li>update the task's current status (bumps its version)</li>
 *   <li>append the audit record</li>
 * </ol>
 * Steps 4 and 5 commit together or not at all. Validation failures are
 * deterministic and thrown as-is. Lock timeouts and version conflicts are
 * retried a bounded number of times, then reported as
 * {@link ConcurrentTransitionException}. Any other store failure becomes
 * {@link WorkflowPersistenceException}.
 *
 * Metrics:
 * <pre>
 *   sprintsync.workflow.transitions{outcome="applied|illegal_transition|...|error"}
 *   sprintsync.workflow.transition.duration
 * </pre>
 */
@Service
public class TransitionExecutor {

    private static final Logger log = LoggerFactory.getLogger(TransitionExecutor.class);

    private final TaskRepository      taskRepo;
    private final StatusCatalog       catalog;
    private final TransitionGraph     graph;
    private final AuditLog            auditLog;
    private final TransactionTemplate tx;
    private final Clock               clock;
    private final MeterRegistry       meterRegistry;
    private final int                 maxAttempts;
    private final Duration            retryBackoff;

    public TransitionExecutor(TaskRepository taskRepo,
                              StatusCatalog catalog,
                              TransitionGraph graph,
                              AuditLog auditLog,
                              PlatformTransactionManager transactionManager,
                              WorkflowProperties properties,
                              Clock clock,
                              MeterRegistry meterRegistry) {
        this.taskRepo      = taskRepo;
        this.catalog       = catalog;
        this.graph         = graph;
        this.auditLog      = auditLog;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;

        WorkflowProperties.Transition cfg = properties.getTransition();
        this.maxAttempts  = Math.max(1, cfg.getMaxAttempts());
        this.retryBackoff = cfg.getRetryBackoff();
        this.tx = new TransactionTemplate(transactionManager);
        this.tx.setTimeout((int) Math.max(1, cfg.getTxTimeout().toSeconds()));
    }

    /**
     * Move {@code taskId} to {@code toStatusId} on behalf of {@code actorId}.
     *
     * @param note optional free text kept on the audit record, at most
     *             {@value AuditRecord#MAX_NOTE_LENGTH} characters
     * @return the appended audit record
     * @throws TaskNotFoundException          if the task does not exist
     * @throws com.sprintsync.workflow.error.UnknownStatusException
     *                                        if the target is not a status of the task's organization
     * @throws InactiveStatusException        if the target status is inactive
     * @throws IllegalTransitionException     if no active edge leads from the current status to the target
     * @throws ConcurrentTransitionException  if the task stayed contended for every attempt
     * @throws WorkflowPersistenceException   if the store failed; nothing was applied
     */
    public AuditRecord applyTransition(Long taskId, Long toStatusId, Long actorId, String note) {
        Validation.requireNonNull(taskId, "taskId");
        Validation.requireNonNull(toStatusId, "toStatusId");
        Validation.requireNonNull(actorId, "actorId");
        String cleanNote = normalizeNote(note);

        MDC.put("taskId",  taskId.toString());
        MDC.put("actorId", actorId.toString());
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "applied";
        try {
            AuditRecord record = applyWithRetry(taskId, toStatusId, actorId, cleanNote);
            log.info("Task {} moved {} -> {}", taskId, record.getFromStatusId(), record.getToStatusId());
            return record;
        } catch (WorkflowException e) {
            outcome = e.getKind().name().toLowerCase();
            log.info("Move of task {} to status {} rejected: {}", taskId, toStatusId, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            outcome = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("sprintsync.workflow.transition.duration"));
            meterRegistry.counter("sprintsync.workflow.transitions", "outcome", outcome).increment();
            MDC.remove("taskId");
            MDC.remove("actorId");
        }
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private AuditRecord applyWithRetry(Long taskId, Long toStatusId, Long actorId, String note) {
        ConcurrencyFailureException lastConflict = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return tx.execute(status -> applyOnce(taskId, toStatusId, actorId, note));
            } catch (ConcurrencyFailureException e) {
                lastConflict = e;
                log.warn("Task {} contended on attempt {}/{}: {}", taskId, attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts) {
                    backOff(taskId, attempt, e);
                }
            } catch (DataAccessException | TransactionException e) {
                log.error("Store failure while moving task {} to status {}", taskId, toStatusId, e);
                throw new WorkflowPersistenceException(
                        "Could not record the status change of task " + taskId + "; nothing was applied", e);
            }
        }
        throw new ConcurrentTransitionException(taskId, maxAttempts, lastConflict);
    }

    private AuditRecord applyOnce(Long taskId, Long toStatusId, Long actorId, String note) {
        Task task = taskRepo.lockById(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));

        TaskStatus target = catalog.findInOrganization(task.getOrganizationId(), toStatusId);
        if (!target.isActive()) {
            throw new InactiveStatusException(target.getId(), target.getName());
        }

        Long fromStatusId = task.getCurrentStatusId();
        if (!graph.isAllowed(task.getOrganizationId(), fromStatusId, toStatusId)) {
            throw new IllegalTransitionException(taskId, fromStatusId, toStatusId);
        }

        task.moveTo(toStatusId);
        taskRepo.saveAndFlush(task);

        return auditLog.append(new AuditRecord(
                taskId, fromStatusId, toStatusId, actorId, changedAt(taskId), note));
    }

    // changedAt never precedes the task's previous record, even if the clock steps back.
    private Instant changedAt(Long taskId) {
        Instant now = clock.instant();
        return auditLog.latest(taskId)
                .map(AuditRecord::getChangedAt)
                .filter(previous -> previous.isAfter(now))
                .orElse(now);
    }

    private void backOff(Long taskId, int attempt, ConcurrencyFailureException cause) {
        try {
            Thread.sleep(retryBackoff.multipliedBy(attempt).toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ConcurrentTransitionException(taskId, attempt, cause);
        }
    }

    private static String normalizeNote(String note) {
        if (note == null || note.isBlank()) {
            return null;
        }
        if (note.length() > AuditRecord.MAX_NOTE_LENGTH) {
            throw new IllegalArgumentException(
                    "note must be at most " + AuditRecord.MAX_NOTE_LENGTH + " characters, got " + note.length());
        }
        return note;
    }
}
