package com.sprintsync.workflow.service;

import com.sprintsync.workflow.model.AuditRecord;
import com.sprintsync.workflow.repository.AuditRecordRepository;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Append-only history of task status changes, and the source of truth for
 * "what happened when". A task's current status is the target of its last
 * record here.
 *
 * {@link #append} joins the caller's transaction: TransitionExecutor relies on
 * the record and the task update committing together.
 */
@Service
public class AuditLog {

    private final AuditRecordRepository auditRepo;

    public AuditLog(AuditRecordRepository auditRepo) {
        this.auditRepo = auditRepo;
    }

    /** The only mutation. A record that already has an id was written before. */
    public AuditRecord append(AuditRecord record) {
        Validation.requireNonNull(record, "record");
        if (record.getId() != null) {
            throw new IllegalArgumentException(
                    "Audit record " + record.getId() + " is already written; records are never rewritten");
        }
        return auditRepo.save(record);
    }

    /** Oldest first; records with the same timestamp keep insertion order. */
    public List<AuditRecord> history(Long taskId) {
        return auditRepo.findByTaskIdOrderByChangedAtAscIdAsc(taskId);
    }

    public Optional<AuditRecord> latest(Long taskId) {
        return auditRepo.findFirstByTaskIdOrderByChangedAtDescIdDesc(taskId);
    }
}
