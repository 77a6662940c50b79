package io.b2mash.b2b.projecthub.multitenancy;

import io.b2mash.b2b.projecthub.user.User;
import java.util.UUID;

/**
 * Snapshot of the acting user, taken once per request. {@link #ANONYMOUS} stands for a request
 * without a bearer token.
 */
public record Principal(
    UUID userId, String email, UUID organizationId, boolean organizationAdmin, boolean superuser) {

  public static final Principal ANONYMOUS = new Principal(null, null, null, false, false);

  public static Principal of(User user) {
    return new Principal(
        user.getId(),
        user.getEmail(),
        user.getOrganizationId(),
        user.isOrganizationAdmin(),
        user.isSuperuser());
  }

  public boolean isAnonymous() {
    return userId == null;
  }

  public boolean isMemberOf(UUID orgId) {
    return organizationId != null && organizationId.equals(orgId);
  }
}
