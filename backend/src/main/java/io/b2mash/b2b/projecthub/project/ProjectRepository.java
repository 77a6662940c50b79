package io.b2mash.b2b.projecthub.project;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

/**
 * Reads of tenant-owned projects go through {@link JpaSpecificationExecutor} with a tenant-scoped
 * specification. The derived queries below take the organization id explicitly.
 */
public interface ProjectRepository
    extends JpaRepository<Project, UUID>, JpaSpecificationExecutor<Project> {

  boolean existsByOrganizationIdAndNameIgnoreCase(UUID organizationId, String name);

  boolean existsByOrganizationIdAndNameIgnoreCaseAndIdNot(
      UUID organizationId, String name, UUID id);
}
