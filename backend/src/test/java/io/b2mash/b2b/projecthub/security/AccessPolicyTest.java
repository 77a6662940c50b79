package io.b2mash.b2b.projecthub.security;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.projecthub.multitenancy.Principal;
import io.b2mash.b2b.projecthub.multitenancy.Tenant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class AccessPolicyTest {

  private static final UUID ORG_ID = UUID.randomUUID();
  private static final Tenant ACME = new Tenant(ORG_ID, "acme", "Acme", true);
  private static final Tenant GLOBEX = new Tenant(UUID.randomUUID(), "globex", "Globex", true);
  private static final Tenant INACTIVE = new Tenant(ORG_ID, "acme", "Acme", false);

  private final Principal member = principal(ORG_ID, false, false);
  private final Principal admin = principal(ORG_ID, true, false);
  private final Principal superuser = principal(null, false, true);

  @Test
  void authenticatedRejectsAnonymous() {
    assertThat(AccessPolicy.AUTHENTICATED.check(Principal.ANONYMOUS, null, null)).isFalse();
    assertThat(AccessPolicy.AUTHENTICATED.check(member, null, null)).isTrue();
  }

  @Test
  void tenantMemberRequiresMembershipOfThatTenant() {
    assertThat(AccessPolicy.TENANT_MEMBER.check(member, ACME, null)).isTrue();
    assertThat(AccessPolicy.TENANT_MEMBER.check(member, GLOBEX, null)).isFalse();
    assertThat(AccessPolicy.TENANT_MEMBER.check(member, null, null)).isFalse();
  }

  @Test
  void inactiveTenantFailsMembership() {
    assertThat(AccessPolicy.TENANT_MEMBER.check(admin, INACTIVE, null)).isFalse();
  }

  @Test
  void superuserIsMemberAndAdminOfAnyTenant() {
    assertThat(AccessPolicy.TENANT_MEMBER.check(superuser, GLOBEX, null)).isTrue();
    assertThat(AccessPolicy.TENANT_ADMIN.check(superuser, GLOBEX, null)).isTrue();
  }

  @Test
  void adminOfOtherTenantIsNotAdminHere() {
    assertThat(AccessPolicy.TENANT_ADMIN.check(admin, ACME, null)).isTrue();
    assertThat(AccessPolicy.TENANT_ADMIN.check(admin, GLOBEX, null)).isFalse();
    assertThat(AccessPolicy.TENANT_ADMIN.check(member, ACME, null)).isFalse();
  }

  @Test
  void ownerOrAdminWithoutOwnedTargetAdmitsOnlyAdmins() {
    assertThat(AccessPolicy.OBJECT_OWNER_OR_ADMIN.check(member, ACME, "not owned")).isFalse();
    assertThat(AccessPolicy.OBJECT_OWNER_OR_ADMIN.check(admin, ACME, "not owned")).isTrue();
  }

  @Test
  void ownerWithNullOwnerEmailIsDenied() {
    Owned unassigned = () -> null;

    assertThat(AccessPolicy.OBJECT_OWNER_OR_ADMIN.check(member, ACME, unassigned)).isFalse();
  }

  @Test
  void onlyAuthenticatedSkipsTenant() {
    assertThat(AccessPolicy.AUTHENTICATED.requiresTenant()).isFalse();
    assertThat(AccessPolicy.TENANT_MEMBER.requiresTenant()).isTrue();
    assertThat(AccessPolicy.TENANT_ADMIN.requiresTenant()).isTrue();
    assertThat(AccessPolicy.OBJECT_OWNER_OR_ADMIN.requiresTenant()).isTrue();
  }

  private static Principal principal(UUID orgId, boolean admin, boolean superuser) {
    var id = UUID.randomUUID();
    return new Principal(id, id + "@acme.test", orgId, admin, superuser);
  }
}
