package io.b2mash.b2b.projecthub.multitenancy;

import io.b2mash.b2b.projecthub.organization.Organization;
import java.util.UUID;

/** Snapshot of the organization a request acts within. */
public record Tenant(UUID id, String slug, String name, boolean active) {

  public static Tenant of(Organization organization) {
    return new Tenant(
        organization.getId(),
        organization.getSlug(),
        organization.getName(),
        organization.isActive());
  }
}
