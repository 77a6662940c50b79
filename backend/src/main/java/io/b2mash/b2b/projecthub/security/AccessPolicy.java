package io.b2mash.b2b.projecthub.security;

import io.b2mash.b2b.projecthub.multitenancy.Principal;
import io.b2mash.b2b.projecthub.multitenancy.Tenant;

/** Named authorization rules. Policies are evaluated in the order a caller lists them. */
public enum AccessPolicy {
  AUTHENTICATED("Authentication required", false) {
    @Override
    public boolean check(Principal principal, Tenant tenant, Object target) {
      return principal != null && !principal.isAnonymous();
    }
  },

  TENANT_MEMBER("You are not a member of this organization", true) {
    @Override
    public boolean check(Principal principal, Tenant tenant, Object target) {
      if (!AUTHENTICATED.check(principal, tenant, target) || tenant == null || !tenant.active()) {
        return false;
      }
      return principal.superuser() || principal.isMemberOf(tenant.id());
    }
  },

  TENANT_ADMIN("Organization admin permission required", true) {
    @Override
    public boolean check(Principal principal, Tenant tenant, Object target) {
      return TENANT_MEMBER.check(principal, tenant, target)
          && (principal.organizationAdmin() || principal.superuser());
    }
  },

  OBJECT_OWNER_OR_ADMIN("You can only modify your own resources", true) {
    @Override
    public boolean check(Principal principal, Tenant tenant, Object target) {
      if (!TENANT_MEMBER.check(principal, tenant, target)) {
        return false;
      }
      if (principal.organizationAdmin() || principal.superuser()) {
        return true;
      }
      return target instanceof Owned owned
          && owned.getOwnerEmail() != null
          && owned.getOwnerEmail().equalsIgnoreCase(principal.email());
    }
  };

  private final String message;
  private final boolean requiresTenant;

  AccessPolicy(String message, boolean requiresTenant) {
    this.message = message;
    this.requiresTenant = requiresTenant;
  }

  public abstract boolean check(Principal principal, Tenant tenant, Object target);

  public String message() {
    return message;
  }

  public boolean requiresTenant() {
    return requiresTenant;
  }
}
