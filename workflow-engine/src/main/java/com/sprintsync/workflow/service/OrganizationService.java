package com.sprintsync.workflow.service;

import com.sprintsync.workflow.error.DuplicateOrganizationException;
import com.sprintsync.workflow.error.OrganizationNotFoundException;
import com.sprintsync.workflow.model.Organization;
import com.sprintsync.workflow.repository.OrganizationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Tenant registry. Every other service scopes its work by an organization id
 * that must exist here.
 */
@Service
public class OrganizationService {

    private static final Logger log = LoggerFactory.getLogger(OrganizationService.class);

    private final OrganizationRepository orgRepo;

    public OrganizationService(OrganizationRepository orgRepo) {
        this.orgRepo = orgRepo;
    }

    @Transactional
    public Organization create(String name, String description) {
        String key = Validation.requireText(name, "name");
        if (orgRepo.existsByName(key)) {
            throw new DuplicateOrganizationException(key);
        }
        Organization org;
        try {
            org = orgRepo.saveAndFlush(new Organization(key, description));
        } catch (DataIntegrityViolationException e) {
            // Lost a race with another create of the same name.
            throw new DuplicateOrganizationException(key);
        }
        log.info("Created organization {} ('{}')", org.getId(), org.getName());
        return org;
    }

    /**
     * Rename an organization and/or change its description. Null arguments
     * are left unchanged; a blank description clears it.
     *
     * @throws DuplicateOrganizationException if another organization already has the new name
     */
    @Transactional
    public Organization update(Long organizationId, String name, String description) {
        Organization org = get(organizationId);
        if (name != null) {
            String key = Validation.requireText(name, "name");
            if (!key.equals(org.getName()) && orgRepo.existsByName(key)) {
                throw new DuplicateOrganizationException(key);
            }
            org.setName(key);
        }
        if (description != null) {
            org.setDescription(description.isBlank() ? null : description);
        }
        try {
            org = orgRepo.saveAndFlush(org);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateOrganizationException(org.getName());
        }
        log.info("Updated organization {} ('{}')", org.getId(), org.getName());
        return org;
    }

    @Transactional(readOnly = true)
    public Organization get(Long organizationId) {
        return orgRepo.findById(organizationId)
                .orElseThrow(() -> new OrganizationNotFoundException(organizationId));
    }

    /** Fail fast with {@link OrganizationNotFoundException} for an unknown id. */
    @Transactional(readOnly = true)
    public void require(Long organizationId) {
        if (organizationId == null || !orgRepo.existsById(organizationId)) {
            throw new OrganizationNotFoundException(organizationId);
        }
    }
}
