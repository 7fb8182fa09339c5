package com.sprintsync.workflow.repository;

import com.sprintsync.workflow.model.Task;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * CRUD for the tasks table plus the per-task row lock used by moves.
 */
public interface TaskRepository extends JpaRepository<Task, Long>, TaskLocking {

    List<Task> findByOrganizationIdAndCurrentStatusIdOrderByIdAsc(Long organizationId, Long currentStatusId);
}
