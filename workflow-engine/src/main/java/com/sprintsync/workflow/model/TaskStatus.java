package com.sprintsync.workflow.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A named state a task can occupy, owned by one organization.
 *
 * Rows are never deleted: audit records and edges keep pointing at them, so
 * {@code active = false} is the only way to retire a status. {@code orderIndex}
 * is for display ordering and plays no part in which moves are legal.
 *
 * DB table: task_statuses  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "task_statuses")
public class TaskStatus {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private Long organizationId;

    // Machine key, unique within the organization.
    @Column(nullable = false, updatable = false, length = 100)
    private String name;

    @Column(name = "display_name", nullable = false)
    private String displayName;

    // "#RGB" or "#RRGGBB"; optional.
    @Column(length = 7)
    private String color;

    @Column(name = "order_index", nullable = false)
    private int orderIndex;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "is_default", nullable = false)
    private boolean defaultStatus;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected TaskStatus() {}   // required by JPA

    public TaskStatus(Long organizationId, String name, String displayName,
                      String color, int orderIndex) {
        this.organizationId = organizationId;
        this.name           = name;
        this.displayName    = displayName;
        this.color          = color;
        this.orderIndex     = orderIndex;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public Long    getId()             { return id; }
    public Long    getOrganizationId() { return organizationId; }
    public String  getName()           { return name; }
    public String  getDisplayName()    { return displayName; }
    public String  getColor()          { return color; }
    public int     getOrderIndex()     { return orderIndex; }
    public boolean isActive()          { return active; }
    public boolean isDefaultStatus()   { return defaultStatus; }
    public Instant getCreatedAt()      { return createdAt; }
    public Instant getUpdatedAt()      { return updatedAt; }

    public void setDisplayName(String displayName)    { this.displayName = displayName; }
    public void setColor(String color)                { this.color = color; }
    public void setOrderIndex(int orderIndex)         { this.orderIndex = orderIndex; }
    public void setActive(boolean active)             { this.active = active; }
    public void setDefaultStatus(boolean v)           { this.defaultStatus = v; }
}
