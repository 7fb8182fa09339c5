package com.sprintsync.workflow.repository;

import com.sprintsync.workflow.model.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * Queries for the task_statuses table.
 *
 * Every lookup except {@link #findById} takes the organization id: a status
 * id on its own never proves tenancy.
 */
public interface TaskStatusRepository extends JpaRepository<TaskStatus, Long> {

    Optional<TaskStatus> findByIdAndOrganizationId(Long id, Long organizationId);

    Optional<TaskStatus> findByOrganizationIdAndName(Long organizationId, String name);

    boolean existsByOrganizationIdAndName(Long organizationId, String name);

    /** Normally zero or one row; a list so a violated invariant is still repairable. */
    List<TaskStatus> findByOrganizationIdAndDefaultStatusTrue(Long organizationId);

    /** Display order: order_index, then id for a deterministic tie-break. */
    List<TaskStatus> findByOrganizationIdAndActiveTrueOrderByOrderIndexAscIdAsc(Long organizationId);

    List<TaskStatus> findByOrganizationIdOrderByOrderIndexAscIdAsc(Long organizationId);
}
