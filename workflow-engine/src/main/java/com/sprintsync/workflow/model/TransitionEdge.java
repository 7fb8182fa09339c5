package com.sprintsync.workflow.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One entry of an organization's allow-list: a task in {@code fromStatusId}
 * may move to {@code toStatusId}.
 *
 * There is at most one row per ordered pair; removing an edge only flips
 * {@code active}, and adding it again reactivates the same row.
 *
 * DB table: task_workflow_transitions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "task_workflow_transitions")
public class TransitionEdge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private Long organizationId;

    @Column(name = "from_status_id", nullable = false, updatable = false)
    private Long fromStatusId;

    @Column(name = "to_status_id", nullable = false, updatable = false)
    private Long toStatusId;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected TransitionEdge() {}   // required by JPA

    public TransitionEdge(Long organizationId, Long fromStatusId, Long toStatusId) {
        this.organizationId = organizationId;
        this.fromStatusId   = fromStatusId;
        this.toStatusId     = toStatusId;
    }

    public Long    getId()             { return id; }
    public Long    getOrganizationId() { return organizationId; }
    public Long    getFromStatusId()   { return fromStatusId; }
    public Long    getToStatusId()     { return toStatusId; }
    public boolean isActive()          { return active; }
    public Instant getCreatedAt()      { return createdAt; }
    public Instant getUpdatedAt()      { return updatedAt; }

    public void setActive(boolean active) { this.active = active; }
}
