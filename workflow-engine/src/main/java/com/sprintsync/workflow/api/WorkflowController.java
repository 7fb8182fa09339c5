package com.sprintsync.workflow.api;

import com.sprintsync.workflow.api.dto.CreateEdgeRequest;
import com.sprintsync.workflow.api.dto.CreateStatusRequest;
import com.sprintsync.workflow.api.dto.EdgeResponse;
import com.sprintsync.workflow.api.dto.StatusResponse;
import com.sprintsync.workflow.api.dto.UpdateStatusRequest;
import com.sprintsync.workflow.api.dto.WorkflowResponse;
import com.sprintsync.workflow.model.TaskStatus;
import com.sprintsync.workflow.model.TransitionEdge;
import com.sprintsync.workflow.service.StatusCatalog;
import com.sprintsync.workflow.service.TransitionGraph;
import com.sprintsync.workflow.service.WorkflowSetup;
import com.sprintsync.workflow.service.WorkflowSetupService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for an organization's workflow definition.
 *
 * POST   /organizations/{orgId}/statuses                    create a status
 * PATCH  /organizations/{orgId}/statuses/{statusId}         update display fields, active or default flag
 * DELETE /organizations/{orgId}/statuses/{statusId}         deactivate (soft delete)
 * GET    /organizations/{orgId}/statuses                    active statuses in display order
 * GET    /organizations/{orgId}/statuses/default            the default status
 * GET    /organizations/{orgId}/statuses/{statusId}/next    statuses reachable in one move
 * POST   /organizations/{orgId}/transitions                 allow a move
 * DELETE /organizations/{orgId}/transitions?from=&to=       stop allowing a move
 * GET    /organizations/{orgId}/workflow                    every status and edge
 * PUT    /organizations/{orgId}/workflow                    install statuses and edges in one transaction
 */
@RestController
@RequestMapping("/organizations/{orgId}")
public class WorkflowController {

    private final StatusCatalog        catalog;
    private final TransitionGraph      graph;
    private final WorkflowSetupService setupService;

    public WorkflowController(StatusCatalog catalog,
                              TransitionGraph graph,
                              WorkflowSetupService setupService) {
        this.catalog      = catalog;
        this.graph        = graph;
        this.setupService = setupService;
    }

    // ------------------------------------------------------------------
    // Statuses
    // ------------------------------------------------------------------

    @PostMapping("/statuses")
    public ResponseEntity<StatusResponse> createStatus(@PathVariable Long orgId,
                                                       @RequestBody CreateStatusRequest req) {
        TaskStatus status = catalog.createStatus(orgId, req.name(), req.displayName(),
                req.color(), req.orderIndex(), req.defaultStatus());
        return ResponseEntity.status(HttpStatus.CREATED).body(StatusResponse.from(status));
    }

    @PatchMapping("/statuses/{statusId}")
    public StatusResponse updateStatus(@PathVariable Long orgId,
                                       @PathVariable Long statusId,
                                       @RequestBody UpdateStatusRequest req) {
        return StatusResponse.from(catalog.updateStatus(orgId, statusId, req.toUpdate()));
    }

    /** Soft delete: the row stays so history keeps resolving. */
    @DeleteMapping("/statuses/{statusId}")
    public StatusResponse deactivateStatus(@PathVariable Long orgId, @PathVariable Long statusId) {
        catalog.findInOrganization(orgId, statusId);
        return StatusResponse.from(catalog.deactivate(statusId));
    }

    @GetMapping("/statuses")
    public List<StatusResponse> listActive(@PathVariable Long orgId) {
        return catalog.listActive(orgId).stream()
                .map(StatusResponse::from)
                .toList();
    }

    @GetMapping("/statuses/default")
    public StatusResponse getDefault(@PathVariable Long orgId) {
        return catalog.getDefaultStatus(orgId)
                .map(StatusResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Organization " + orgId + " has no active default status"));
    }

    @GetMapping("/statuses/{statusId}/next")
    public List<StatusResponse> listOutgoing(@PathVariable Long orgId, @PathVariable Long statusId) {
        return graph.listOutgoing(orgId, statusId).stream()
                .map(StatusResponse::from)
                .toList();
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    @PostMapping("/transitions")
    public ResponseEntity<EdgeResponse> addEdge(@PathVariable Long orgId,
                                                @RequestBody CreateEdgeRequest req) {
        TransitionEdge edge = graph.addEdge(orgId, req.fromStatusId(), req.toStatusId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(EdgeResponse.from(edge, catalog.displayNames(orgId)));
    }

    @DeleteMapping("/transitions")
    public EdgeResponse deactivateEdge(@PathVariable Long orgId,
                                       @RequestParam("from") Long fromStatusId,
                                       @RequestParam("to") Long toStatusId) {
        TransitionEdge edge = graph.deactivateEdge(orgId, fromStatusId, toStatusId);
        return EdgeResponse.from(edge, catalog.displayNames(orgId));
    }

    // ------------------------------------------------------------------
    // Whole workflow
    // ------------------------------------------------------------------

    @GetMapping("/workflow")
    public WorkflowResponse view(@PathVariable Long orgId) {
        return WorkflowResponse.from(setupService.view(orgId));
    }

    /**
     * Example:
     *   curl -X PUT http://localhost:8080/organizations/1/workflow \
     *     -H "Content-Type: application/json" \
     *     -d '{"statuses":[{"name":"New","orderIndex":0,"defaultStatus":true},
     *                      {"name":"Done","orderIndex":1}],
     *          "transitions":[{"from":"New","to":"Done"}]}'
     */
    @PutMapping("/workflow")
    public WorkflowResponse setup(@PathVariable Long orgId, @RequestBody WorkflowSetup setup) {
        return WorkflowResponse.from(setupService.setup(orgId, setup));
    }
}
