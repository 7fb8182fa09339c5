package com.sprintsync.workflow.service;

import com.sprintsync.workflow.error.CrossOrgReferenceException;
import com.sprintsync.workflow.error.DuplicateEdgeException;
import com.sprintsync.workflow.error.TransitionNotFoundException;
import com.sprintsync.workflow.model.TaskStatus;
import com.sprintsync.workflow.model.TransitionEdge;
import com.sprintsync.workflow.repository.TaskStatusRepository;
import com.sprintsync.workflow.repository.TransitionEdgeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Each organization's allow-list of status moves.
 *
 * The graph is a flat set of (from, to) pairs, one row per pair. Cycles,
 * branches and explicit self-loops are all valid; legality is a single-hop
 * lookup and nothing is ever computed transitively.
 */
@Service
public class TransitionGraph {

    private static final Logger log = LoggerFactory.getLogger(TransitionGraph.class);

    private final TransitionEdgeRepository edgeRepo;
    private final TaskStatusRepository     statusRepo;
    private final StatusCatalog            catalog;
    private final WorkflowCache            cache;

    public TransitionGraph(TransitionEdgeRepository edgeRepo,
                           TaskStatusRepository statusRepo,
                           StatusCatalog catalog,
                           WorkflowCache cache) {
        this.edgeRepo   = edgeRepo;
        this.statusRepo = statusRepo;
        this.catalog    = catalog;
        this.cache      = cache;
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    /**
     * Allow moves from one status to another. Re-adding an edge that was
     * deactivated reactivates the existing row.
     *
     * @throws CrossOrgReferenceException if either status is not in {@code orgId}
     * @throws DuplicateEdgeException     if the edge is already active
     */
    @Transactional
    public TransitionEdge addEdge(Long orgId, Long fromStatusId, Long toStatusId) {
        requireOwned(orgId, Validation.requireNonNull(fromStatusId, "fromStatusId"));
        requireOwned(orgId, Validation.requireNonNull(toStatusId, "toStatusId"));

        TransitionEdge edge = edgeRepo
                .findByOrganizationIdAndFromStatusIdAndToStatusId(orgId, fromStatusId, toStatusId)
                .orElse(null);

        if (edge != null) {
            if (edge.isActive()) {
                throw new DuplicateEdgeException(orgId, fromStatusId, toStatusId);
            }
            edge.setActive(true);
            edge = edgeRepo.saveAndFlush(edge);
            log.info("Reactivated transition {} -> {} in organization {}", fromStatusId, toStatusId, orgId);
        } else {
            try {
                edge = edgeRepo.saveAndFlush(new TransitionEdge(orgId, fromStatusId, toStatusId));
            } catch (DataIntegrityViolationException e) {
                // Another request inserted the same pair first.
                throw new DuplicateEdgeException(orgId, fromStatusId, toStatusId);
            }
            log.info("Added transition {} -> {} in organization {}", fromStatusId, toStatusId, orgId);
        }
        cache.invalidate(orgId);
        return edge;
    }

    /**
     * Stop allowing a move. Deactivating an inactive edge is a no-op.
     *
     * @throws TransitionNotFoundException if the organization never had this edge
     */
    @Transactional
    public TransitionEdge deactivateEdge(Long orgId, Long fromStatusId, Long toStatusId) {
        TransitionEdge edge = edgeRepo
                .findByOrganizationIdAndFromStatusIdAndToStatusId(orgId, fromStatusId, toStatusId)
                .orElseThrow(() -> new TransitionNotFoundException(orgId, fromStatusId, toStatusId));
        if (edge.isActive()) {
            edge.setActive(false);
            edge = edgeRepo.saveAndFlush(edge);
            cache.invalidate(orgId);
            log.info("Deactivated transition {} -> {} in organization {}", fromStatusId, toStatusId, orgId);
        }
        return edge;
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    /**
     * True iff an active edge {@code from -> to} exists in the organization.
     * With no {@code from} (a task's first assignment) any active status of
     * the organization is allowed.
     */
    public boolean isAllowed(Long orgId, Long fromStatusId, Long toStatusId) {
        if (toStatusId == null) {
            return false;
        }
        if (fromStatusId == null) {
            return catalog.listActive(orgId).stream()
                    .anyMatch(s -> s.getId().equals(toStatusId));
        }
        return activeAdjacency(orgId)
                .getOrDefault(fromStatusId, Set.of())
                .contains(toStatusId);
    }

    /**
     * Active statuses reachable in one move from {@code fromStatusId}, in
     * display order. Edges into inactive statuses are left out.
     *
     * @throws com.sprintsync.workflow.error.UnknownStatusException if the status is not in the organization
     */
    public List<TaskStatus> listOutgoing(Long orgId, Long fromStatusId) {
        catalog.findInOrganization(orgId, fromStatusId);
        Set<Long> targets = activeAdjacency(orgId).getOrDefault(fromStatusId, Set.of());
        if (targets.isEmpty()) {
            return List.of();
        }
        return catalog.listActive(orgId).stream()
                .filter(s -> targets.contains(s.getId()))
                .toList();
    }

    /** Every edge of the organization, active or not, in creation order. */
    @Transactional(readOnly = true)
    public List<TransitionEdge> listEdges(Long orgId) {
        return edgeRepo.findByOrganizationIdOrderByIdAsc(orgId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Map<Long, Set<Long>> activeAdjacency(Long orgId) {
        return cache.activeEdges(orgId, id -> edgeRepo.findByOrganizationIdAndActiveTrue(id).stream()
                .collect(Collectors.groupingBy(
                        TransitionEdge::getFromStatusId,
                        Collectors.mapping(TransitionEdge::getToStatusId, Collectors.toUnmodifiableSet()))));
    }

    private void requireOwned(Long orgId, Long statusId) {
        if (statusRepo.findByIdAndOrganizationId(statusId, orgId).isEmpty()) {
            throw new CrossOrgReferenceException(orgId, statusId);
        }
    }
}
