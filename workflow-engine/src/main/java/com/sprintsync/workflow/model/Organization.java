package com.sprintsync.workflow.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A tenant. Statuses, edges and tasks never cross its boundary.
 *
 * DB table: organizations  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "organizations")
public class Organization {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(length = 2000)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Organization() {}   // required by JPA

    public Organization(String name, String description) {
        this.name        = name;
        this.description = description;
    }

    public Long    getId()          { return id; }
    public String  getName()        { return name; }
    public String  getDescription() { return description; }
    public Instant getCreatedAt()   { return createdAt; }

    public void setName(String name)               { this.name = name; }
    public void setDescription(String description) { this.description = description; }
}
