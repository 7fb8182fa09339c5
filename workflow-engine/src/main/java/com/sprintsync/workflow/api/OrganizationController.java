package com.sprintsync.workflow.api;

import com.sprintsync.workflow.api.dto.CreateOrganizationRequest;
import com.sprintsync.workflow.api.dto.OrganizationResponse;
import com.sprintsync.workflow.api.dto.UpdateOrganizationRequest;
import com.sprintsync.workflow.model.Organization;
import com.sprintsync.workflow.service.OrganizationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for organizations, the scope every status, edge and task lives in.
 *
 * POST  /organizations          create an organization
 * GET   /organizations/{orgId}  look one up
 * PATCH /organizations/{orgId}  rename or re-describe it
 */
@RestController
@RequestMapping("/organizations")
public class OrganizationController {

    private final OrganizationService organizations;

    public OrganizationController(OrganizationService organizations) {
        this.organizations = organizations;
    }

    @PostMapping
    public ResponseEntity<OrganizationResponse> create(@RequestBody CreateOrganizationRequest req) {
        Organization org = organizations.create(req.name(), req.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(OrganizationResponse.from(org));
    }

    @GetMapping("/{orgId}")
    public OrganizationResponse get(@PathVariable Long orgId) {
        return OrganizationResponse.from(organizations.get(orgId));
    }

    @PatchMapping("/{orgId}")
    public OrganizationResponse update(@PathVariable Long orgId, @RequestBody UpdateOrganizationRequest req) {
        return OrganizationResponse.from(organizations.update(orgId, req.name(), req.description()));
    }
}
