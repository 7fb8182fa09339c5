package com.sprintsync.workflow.repository;

import com.sprintsync.workflow.model.Organization;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OrganizationRepository extends JpaRepository<Organization, Long> {

    boolean existsByName(String name);
}
