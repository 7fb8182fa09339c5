package com.sprintsync.workflow.repository;

import com.sprintsync.workflow.model.TransitionEdge;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * Queries for the task_workflow_transitions table.
 */
public interface TransitionEdgeRepository extends JpaRepository<TransitionEdge, Long> {

    /** The single row for an ordered pair, active or not. */
    Optional<TransitionEdge> findByOrganizationIdAndFromStatusIdAndToStatusId(
            Long organizationId, Long fromStatusId, Long toStatusId);

    List<TransitionEdge> findByOrganizationIdAndActiveTrue(Long organizationId);

    List<TransitionEdge> findByOrganizationIdOrderByIdAsc(Long organizationId);
}
