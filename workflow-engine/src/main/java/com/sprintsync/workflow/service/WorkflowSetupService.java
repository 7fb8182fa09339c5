package com.sprintsync.workflow.service;

import com.sprintsync.workflow.error.UnknownStatusException;
import com.sprintsync.workflow.model.TaskStatus;
import com.sprintsync.workflow.service.WorkflowSetup.EdgeDefinition;
import com.sprintsync.workflow.service.WorkflowSetup.StatusDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.Map;

/**
 * Bulk definition of an organization's workflow.
 *
 * {@link #setup} runs every catalog and graph call in one transaction: the
 * first failing status or edge rolls back everything created before it.
 */
@Service
public class WorkflowSetupService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowSetupService.class);

    private final OrganizationService organizations;
    private final StatusCatalog       catalog;
    private final TransitionGraph     graph;

    public WorkflowSetupService(OrganizationService organizations,
                                StatusCatalog catalog,
                                TransitionGraph graph) {
        this.organizations = organizations;
        this.catalog       = catalog;
        this.graph         = graph;
    }

    /**
     * Create all statuses, then all edges, and return the resulting workflow.
     *
     * @throws IllegalArgumentException if more than one status is marked default
     * @throws UnknownStatusException   if an edge names a status that exists neither
     *                                  in the setup nor in the organization
     */
    @Transactional
    public WorkflowView setup(Long orgId, WorkflowSetup setup) {
        organizations.require(orgId);
        long defaults = setup.statuses().stream().filter(StatusDefinition::defaultStatus).count();
        if (defaults > 1) {
            throw new IllegalArgumentException(
                    "At most one status may be marked default, got " + defaults);
        }

        Map<String, Long> idsByName = new HashMap<>();
        for (TaskStatus existing : catalog.listAll(orgId)) {
            idsByName.put(existing.getName(), existing.getId());
        }

        for (StatusDefinition def : setup.statuses()) {
            TaskStatus created = catalog.createStatus(orgId, def.name(), def.displayName(),
                    def.color(), def.orderIndex(), def.defaultStatus());
            idsByName.put(created.getName(), created.getId());
        }
        for (EdgeDefinition edge : setup.transitions()) {
            graph.addEdge(orgId,
                    resolve(orgId, idsByName, edge.from()),
                    resolve(orgId, idsByName, edge.to()));
        }

        log.info("Installed workflow for organization {}: {} status(es), {} transition(s)",
                orgId, setup.statuses().size(), setup.transitions().size());
        return view(orgId);
    }

    @Transactional(readOnly = true)
    public WorkflowView view(Long orgId) {
        organizations.require(orgId);
        return new WorkflowView(catalog.listAll(orgId), graph.listEdges(orgId));
    }

    private static Long resolve(Long orgId, Map<String, Long> idsByName, String name) {
        Long id = name == null ? null : idsByName.get(name.trim());
        if (id == null) {
            throw new UnknownStatusException(orgId, name);
        }
        return id;
    }
}
