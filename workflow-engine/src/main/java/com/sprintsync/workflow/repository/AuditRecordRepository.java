package com.sprintsync.workflow.repository;

import com.sprintsync.workflow.model.AuditRecord;
import org.springframework.data.repository.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Insert-and-read access to task_status_transitions.
 *
 * Extends the bare {@link Repository} marker, so there is no delete or
 * update method to call.
 */
public interface AuditRecordRepository extends Repository<AuditRecord, Long> {

    AuditRecord save(AuditRecord record);

    /** Chronological history; id breaks ties between equal timestamps. */
    List<AuditRecord> findByTaskIdOrderByChangedAtAscIdAsc(Long taskId);

    Optional<AuditRecord> findFirstByTaskIdOrderByChangedAtDescIdDesc(Long taskId);
}
