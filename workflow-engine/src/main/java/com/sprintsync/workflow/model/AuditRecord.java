package com.sprintsync.workflow.model;

import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * One realized status change of a task. Written exactly once per successful
 * move and never touched again: Hibernate treats the entity as read-only and
 * there are no setters.
 *
 * The identity {@code id} doubles as the insertion sequence, which breaks
 * ties between records sharing a {@code changedAt}.
 *
 * DB table: task_status_transitions  (created by Flyway V1 migration)
 */
@Entity
@Immutable
@Table(name = "task_status_transitions")
public class AuditRecord {

    public static final int MAX_NOTE_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "task_id", nullable = false, updatable = false)
    private Long taskId;

    // Null only for a task's very first status assignment.
    @Column(name = "from_status_id", updatable = false)
    private Long fromStatusId;

    @Column(name = "to_status_id", nullable = false, updatable = false)
    private Long toStatusId;

    @Column(name = "changed_by", nullable = false, updatable = false)
    private Long changedBy;

    @Column(name = "changed_at", nullable = false, updatable = false)
    private Instant changedAt;

    @Column(length = MAX_NOTE_LENGTH, updatable = false)
    private String notes;

    protected AuditRecord() {}   // required by JPA

    public AuditRecord(Long taskId, Long fromStatusId, Long toStatusId,
                       Long changedBy, Instant changedAt, String notes) {
        this.taskId       = taskId;
        this.fromStatusId = fromStatusId;
        this.toStatusId   = toStatusId;
        this.changedBy    = changedBy;
        this.changedAt    = changedAt;
        this.notes        = notes;
    }

    public Long    getId()           { return id; }
    public Long    getTaskId()       { return taskId; }
    public Long    getFromStatusId() { return fromStatusId; }
    public Long    getToStatusId()   { return toStatusId; }
    public Long    getChangedBy()    { return changedBy; }
    public Instant getChangedAt()    { return changedAt; }
    public String  getNotes()        { return notes; }
}
