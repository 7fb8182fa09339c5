package com.sprintsync.workflow.service;

import com.sprintsync.workflow.error.TaskNotFoundException;
import com.sprintsync.workflow.model.Task;
import com.sprintsync.workflow.model.TaskStatus;
import com.sprintsync.workflow.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Task registry for the workflow engine: creation seeded with the
 * organization's default status, lookup, and the "where can it go next" query.
 *
 * Status changes after creation go through {@link TransitionExecutor} only.
 */
@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskRepository      taskRepo;
    private final OrganizationService organizations;
    private final StatusCatalog       catalog;
    private final TransitionGraph     graph;

    public TaskService(TaskRepository taskRepo,
                       OrganizationService organizations,
                       StatusCatalog catalog,
                       TransitionGraph graph) {
        this.taskRepo      = taskRepo;
        this.organizations = organizations;
        this.catalog       = catalog;
        this.graph         = graph;
    }

    /**
     * Create a task in the organization's default status, or with no status
     * when none is set. Seeding writes no audit record; the first record is
     * the first realized move.
     */
    @Transactional
    public Task create(Long orgId, String title, Long createdBy) {
        organizations.require(orgId);
        String cleanTitle = Validation.requireText(title, "title");
        Validation.requireNonNull(createdBy, "createdBy");

        Long initialStatusId = catalog.getDefaultStatus(orgId)
                .map(TaskStatus::getId)
                .orElse(null);
        Task task = taskRepo.save(new Task(orgId, cleanTitle, createdBy, initialStatusId));
        log.info("Created task {} in organization {} with initial status {}",
                task.getId(), orgId, initialStatusId);
        return task;
    }

    @Transactional(readOnly = true)
    public Task get(Long taskId) {
        return taskRepo.findById(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /**
     * Statuses the task may move to right now. A task without a status may
     * enter any active status.
     */
    @Transactional(readOnly = true)
    public List<TaskStatus> nextStatuses(Long taskId) {
        Task task = get(taskId);
        if (task.getCurrentStatusId() == null) {
            return catalog.listActive(task.getOrganizationId());
        }
        return graph.listOutgoing(task.getOrganizationId(), task.getCurrentStatusId());
    }

    /**
     * @throws com.sprintsync.workflow.error.UnknownStatusException if the organization has no such status
     */
    @Transactional(readOnly = true)
    public List<Task> listByStatus(Long orgId, String statusName) {
        TaskStatus status = catalog.findByName(orgId, statusName);
        return taskRepo.findByOrganizationIdAndCurrentStatusIdOrderByIdAsc(orgId, status.getId());
    }
}
