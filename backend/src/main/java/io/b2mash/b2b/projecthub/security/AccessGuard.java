package io.b2mash.b2b.projecthub.security;

import io.b2mash.b2b.projecthub.exception.PermissionDeniedException;
import io.b2mash.b2b.projecthub.exception.TenantContextRequiredException;
import io.b2mash.b2b.projecthub.exception.UnauthenticatedException;
import io.b2mash.b2b.projecthub.multitenancy.RequestContext;
import io.b2mash.b2b.projecthub.multitenancy.Tenant;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry check for every protected operation.
 *
 * <ol>
 *   <li>Anonymous callers fail with {@link UnauthenticatedException} before any tenant lookup.
 *   <li>If any policy needs a tenant and none resolves, {@link TenantContextRequiredException}.
 *   <li>Policies are checked in order; the first failure raises {@link PermissionDeniedException}
 *       with that policy's message.
 * </ol>
 */
public final class AccessGuard {

  private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

  private AccessGuard() {}

  public static AccessGrant require(RequestContext context, AccessPolicy... policies) {
    return require(context, null, policies);
  }

  public static AccessGrant require(
      RequestContext context, Object target, AccessPolicy... policies) {
    var principal = context.principal();
    if (principal.isAnonymous()) {
      throw new UnauthenticatedException("Authentication required");
    }

    Tenant tenant = null;
    if (Arrays.stream(policies).anyMatch(AccessPolicy::requiresTenant)) {
      tenant = context.tenant().orElseThrow(TenantContextRequiredException::new);
    }

    for (AccessPolicy policy : policies) {
      if (!policy.check(principal, tenant, target)) {
        log.warn("Policy {} denied user {}", policy, principal.userId());
        throw new PermissionDeniedException(policy.message());
      }
    }
    return new AccessGrant(principal, tenant);
  }
}
