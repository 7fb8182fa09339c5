package com.sprintsync.workflow.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * The slice of a task the workflow engine cares about: which organization
 * it lives in and which status it currently occupies.
 *
 * {@code currentStatusId} is a projection of the audit log (the target of the
 * latest record) and is only ever changed by TransitionExecutor, inside the
 * same transaction that appends that record. {@code version} is bumped on
 * every change so a write that raced past the row lock fails at flush time.
 *
 * DB table: tasks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "tasks")
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private Long organizationId;

    @Column(nullable = false, length = 500)
    private String title;

    // Null until the first status assignment.
    @Column(name = "current_status_id")
    private Long currentStatusId;

    @Version
    @Column(nullable = false)
    private long version;

    @Column(name = "created_by", nullable = false, updatable = false)
    private Long createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected Task() {}   // required by JPA

    public Task(Long organizationId, String title, Long createdBy, Long initialStatusId) {
        this.organizationId  = organizationId;
        this.title           = title;
        this.createdBy       = createdBy;
        this.currentStatusId = initialStatusId;
    }

    public Long    getId()              { return id; }
    public Long    getOrganizationId()  { return organizationId; }
    public String  getTitle()           { return title; }
    public Long    getCurrentStatusId() { return currentStatusId; }
    public long    getVersion()         { return version; }
    public Long    getCreatedBy()       { return createdBy; }
    public Instant getCreatedAt()       { return createdAt; }
    public Instant getUpdatedAt()       { return updatedAt; }

    public void moveTo(Long statusId) { this.currentStatusId = statusId; }
}
