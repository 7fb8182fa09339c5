package com.sprintsync.workflow.api;

import com.sprintsync.workflow.api.dto.AuditRecordResponse;
import com.sprintsync.workflow.api.dto.CreateTaskRequest;
import com.sprintsync.workflow.api.dto.StatusResponse;
import com.sprintsync.workflow.api.dto.TaskResponse;
import com.sprintsync.workflow.api.dto.TransitionRequest;
import com.sprintsync.workflow.model.AuditRecord;
import com.sprintsync.workflow.model.Task;
import com.sprintsync.workflow.service.AuditLog;
import com.sprintsync.workflow.service.StatusCatalog;
import com.sprintsync.workflow.service.TaskService;
import com.sprintsync.workflow.service.TransitionExecutor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for tasks and their status changes.
 *
 * POST /organizations/{orgId}/tasks             create a task in the default status
 * GET  /organizations/{orgId}/tasks?status=     tasks currently in the named status
 * GET  /tasks/{taskId}                          current state of a task
 * GET  /tasks/{taskId}/next                     statuses the task may move to
 * POST /tasks/{taskId}/transitions              move the task
 * GET  /tasks/{taskId}/history                  every move, oldest first
 */
@RestController
public class TaskController {

    private final TaskService        taskService;
    private final TransitionExecutor executor;
    private final AuditLog           auditLog;
    private final StatusCatalog      catalog;

    public TaskController(TaskService taskService, TransitionExecutor executor,
                          AuditLog auditLog, StatusCatalog catalog) {
        this.taskService = taskService;
        this.executor    = executor;
        this.auditLog    = auditLog;
        this.catalog     = catalog;
    }

    @PostMapping("/organizations/{orgId}/tasks")
    public ResponseEntity<TaskResponse> create(@PathVariable Long orgId, @RequestBody CreateTaskRequest req) {
        Task task = taskService.create(orgId, req.title(), req.createdBy());
        return ResponseEntity.status(HttpStatus.CREATED).body(TaskResponse.from(task));
    }

    @GetMapping("/organizations/{orgId}/tasks")
    public List<TaskResponse> listByStatus(@PathVariable Long orgId, @RequestParam("status") String status) {
        return taskService.listByStatus(orgId, status).stream()
                .map(TaskResponse::from)
                .toList();
    }

    @GetMapping("/tasks/{taskId}")
    public TaskResponse get(@PathVariable Long taskId) {
        return TaskResponse.from(taskService.get(taskId));
    }

    @GetMapping("/tasks/{taskId}/next")
    public List<StatusResponse> nextStatuses(@PathVariable Long taskId) {
        return taskService.nextStatuses(taskId).stream()
                .map(StatusResponse::from)
                .toList();
    }

    /**
     * Move a task. 201 with the new audit record on success; rejected moves
     * come back as an {@code ErrorResponse} with the task untouched.
     *
     * Example:
     *   curl -X POST http://localhost:8080/tasks/42/transitions \
     *     -H "Content-Type: application/json" \
     *     -d '{"toStatusId":7,"actorId":3,"note":"picked up"}'
     */
    @PostMapping("/tasks/{taskId}/transitions")
    public ResponseEntity<AuditRecordResponse> transition(@PathVariable Long taskId,
                                                          @RequestBody TransitionRequest req) {
        AuditRecord record = executor.applyTransition(taskId, req.toStatusId(), req.actorId(), req.note());
        Map<Long, String> displayNames = catalog.displayNames(taskService.get(taskId).getOrganizationId());
        return ResponseEntity.status(HttpStatus.CREATED).body(AuditRecordResponse.from(record, displayNames));
    }

    @GetMapping("/tasks/{taskId}/history")
    public List<AuditRecordResponse> history(@PathVariable Long taskId) {
        Task task = taskService.get(taskId);
        Map<Long, String> displayNames = catalog.displayNames(task.getOrganizationId());
        return auditLog.history(taskId).stream()
                .map(r -> AuditRecordResponse.from(r, displayNames))
                .toList();
    }
}
