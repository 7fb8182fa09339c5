package com.sprintsync.workflow.service;

import com.sprintsync.workflow.error.DuplicateStatusNameException;
import com.sprintsync.workflow.error.InactiveStatusException;
import com.sprintsync.workflow.error.UnknownStatusException;
import com.sprintsync.workflow.error.WorkflowPersistenceException;
import com.sprintsync.workflow.model.TaskStatus;
import com.sprintsync.workflow.repository.TaskStatusRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Owns the statuses each organization defines.
 *
 * Invariants kept here:
 * <ul>
 *   <li>{@code (organizationId, name)} is unique.</li>
 *   <li>At most one status per organization is the default, and the default
 *       is always active.</li>
 *   <li>Statuses are retired by deactivation only, never deleted.</li>
 * </ul>
 */
@Service
public class StatusCatalog {

    private static final Logger log = LoggerFactory.getLogger(StatusCatalog.class);

    private static final String NAME_CONSTRAINT = "uq_task_statuses_org_name";

    private final TaskStatusRepository statusRepo;
    private final OrganizationService  organizations;
    private final WorkflowCache        cache;

    public StatusCatalog(TaskStatusRepository statusRepo,
                         OrganizationService organizations,
                         WorkflowCache cache) {
        this.statusRepo    = statusRepo;
        this.organizations = organizations;
        this.cache         = cache;
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    /**
     * Define a new status; {@code displayName} falls back to the name. When {@code isDefault} is true every other status
     * of the organization loses its default flag in the same transaction.
     *
     * @throws DuplicateStatusNameException if the name is taken in the organization
     */
    @Transactional
    public TaskStatus createStatus(Long orgId, String name, String displayName,
                                   String color, int orderIndex, boolean isDefault) {
        organizations.require(orgId);
        String key     = Validation.requireText(name, "name");
        String display = displayName == null ? key : Validation.requireText(displayName, "displayName");
        Validation.checkColor(color);

        if (statusRepo.existsByOrganizationIdAndName(orgId, key)) {
            throw new DuplicateStatusNameException(orgId, key);
        }
        if (isDefault) {
            clearDefault(orgId);
        }

        TaskStatus status = new TaskStatus(orgId, key, display, color, orderIndex);
        status.setDefaultStatus(isDefault);
        try {
            status = statusRepo.saveAndFlush(status);
        } catch (DataIntegrityViolationException e) {
            throw translate(e, orgId, key);
        }
        cache.invalidate(orgId);
        log.info("Created status {} '{}' in organization {} (default={})",
                status.getId(), key, orgId, isDefault);
        return status;
    }

    /**
     * Apply the non-null fields of {@code update}. Reactivation goes through
     * here; making a status the default clears the previous default.
     *
     * @throws UnknownStatusException  if the status is not in the organization
     * @throws InactiveStatusException if asked to make an inactive status the default
     */
    @Transactional
    public TaskStatus updateStatus(Long orgId, Long statusId, StatusUpdate update) {
        TaskStatus status = findInOrganization(orgId, statusId);

        if (update.displayName() != null) {
            status.setDisplayName(Validation.requireText(update.displayName(), "displayName"));
        }
        if (update.color() != null) {
            status.setColor(Validation.checkColor(update.color()));
        }
        if (update.orderIndex() != null) {
            status.setOrderIndex(update.orderIndex());
        }

        boolean active = update.active() != null ? update.active() : status.isActive();
        if (Boolean.TRUE.equals(update.defaultStatus()) && !active) {
            throw new InactiveStatusException(status.getId(), status.getName());
        }
        status.setActive(active);
        if (!active) {
            status.setDefaultStatus(false);
        }

        if (Boolean.TRUE.equals(update.defaultStatus()) && !status.isDefaultStatus()) {
            clearDefault(orgId);
            status.setDefaultStatus(true);
        } else if (Boolean.FALSE.equals(update.defaultStatus())) {
            status.setDefaultStatus(false);
        }

        statusRepo.saveAndFlush(status);
        cache.invalidate(orgId);
        log.info("Updated status {} in organization {} (active={}, default={})",
                statusId, orgId, status.isActive(), status.isDefaultStatus());
        return status;
    }

    /**
     * Retire a status as a future move target. Tasks currently in it, edges
     * that mention it and audit records all stay valid. A deactivated default
     * stops being the default.
     *
     * @throws UnknownStatusException if no status has this id
     */
    @Transactional
    public TaskStatus deactivate(Long statusId) {
        TaskStatus status = statusRepo.findById(statusId)
                .orElseThrow(() -> new UnknownStatusException(null, statusId));
        if (!status.isActive()) {
            return status;
        }
        status.setActive(false);
        status.setDefaultStatus(false);
        statusRepo.saveAndFlush(status);
        cache.invalidate(status.getOrganizationId());
        log.info("Deactivated status {} '{}' in organization {}",
                status.getId(), status.getName(), status.getOrganizationId());
        return status;
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    /** The status new tasks start in, if the organization has one. */
    @Transactional(readOnly = true)
    public Optional<TaskStatus> getDefaultStatus(Long orgId) {
        return statusRepo.findByOrganizationIdAndDefaultStatusTrue(orgId).stream()
                .filter(TaskStatus::isActive)
                .findFirst();
    }

    /** Active statuses by order_index, then id. Served from the cache. */
    public List<TaskStatus> listActive(Long orgId) {
        return cache.activeStatuses(orgId,
                statusRepo::findByOrganizationIdAndActiveTrueOrderByOrderIndexAscIdAsc);
    }

    /** Active and inactive statuses, same ordering as {@link #listActive}. */
    @Transactional(readOnly = true)
    public List<TaskStatus> listAll(Long orgId) {
        return statusRepo.findByOrganizationIdOrderByOrderIndexAscIdAsc(orgId);
    }

    /** Display name of every status of the organization, inactive ones included, by id. */
    public Map<Long, String> displayNames(Long orgId) {
        return listAll(orgId).stream()
                .collect(Collectors.toMap(TaskStatus::getId, TaskStatus::getDisplayName));
    }

    /**
     * @throws UnknownStatusException if the status does not exist or belongs to another organization
     */
    @Transactional(readOnly = true)
    public TaskStatus findInOrganization(Long orgId, Long statusId) {
        return statusRepo.findByIdAndOrganizationId(statusId, orgId)
                .orElseThrow(() -> new UnknownStatusException(orgId, statusId));
    }

    /**
     * @throws UnknownStatusException if the organization has no status with this name
     */
    @Transactional(readOnly = true)
    public TaskStatus findByName(Long orgId, String name) {
        return statusRepo.findByOrganizationIdAndName(orgId, name)
                .orElseThrow(() -> new UnknownStatusException(orgId, name));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Unset the current default before a new one is written. The flush puts
     * the clearing UPDATE ahead of the write that sets the new default, which
     * the single-default index on PostgreSQL requires.
     */
    private void clearDefault(Long orgId) {
        List<TaskStatus> defaults = statusRepo.findByOrganizationIdAndDefaultStatusTrue(orgId);
        if (defaults.isEmpty()) {
            return;
        }
        defaults.forEach(s -> s.setDefaultStatus(false));
        statusRepo.flush();
        log.debug("Cleared default flag on {} status(es) in organization {}", defaults.size(), orgId);
    }

    private static RuntimeException translate(DataIntegrityViolationException e, Long orgId, String name) {
        String detail = e.getMostSpecificCause().getMessage();
        if (detail != null && detail.toLowerCase(Locale.ROOT).contains(NAME_CONSTRAINT)) {
            return new DuplicateStatusNameException(orgId, name);
        }
        return new WorkflowPersistenceException(
                "Could not store status '" + name + "' in organization " + orgId, e);
    }
}
