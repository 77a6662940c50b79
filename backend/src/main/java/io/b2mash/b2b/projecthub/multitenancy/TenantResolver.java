package io.b2mash.b2b.projecthub.multitenancy;

import io.b2mash.b2b.projecthub.exception.TenantAccessDeniedException;
import io.b2mash.b2b.projecthub.organization.Organization;
import io.b2mash.b2b.projecthub.organization.OrganizationRepository;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks the organization a request acts within: the one named by the {@code X-Organization} header
 * when present, otherwise the principal's own. Inactive organizations never resolve.
 */
@Component
public class TenantResolver {

  private static final Logger log = LoggerFactory.getLogger(TenantResolver.class);

  private final OrganizationRepository organizationRepository;

  public TenantResolver(OrganizationRepository organizationRepository) {
    this.organizationRepository = organizationRepository;
  }

  public Optional<Tenant> resolve(Principal principal, String organizationSlug) {
    if (principal == null || principal.isAnonymous()) {
      return Optional.empty();
    }

    if (organizationSlug != null && !organizationSlug.isBlank()) {
      String slug = organizationSlug.trim();
      var organization = organizationRepository.findBySlug(slug);
      if (organization.isEmpty()
          || !(principal.superuser() || principal.isMemberOf(organization.get().getId()))) {
        log.warn("User {} denied access to organization '{}'", principal.userId(), slug);
        throw new TenantAccessDeniedException(slug);
      }
      return organization.filter(Organization::isActive).map(Tenant::of);
    }

    if (principal.organizationId() == null) {
      return Optional.empty();
    }
    return organizationRepository
        .findById(principal.organizationId())
        .filter(Organization::isActive)
        .map(Tenant::of);
  }
}
