package io.b2mash.b2b.projecthub.organization;

import java.util.List;

public record OrganizationPayload(Organization organization, boolean success, List<String> errors) {

  public static OrganizationPayload ok(Organization organization) {
    return new OrganizationPayload(organization, true, List.of());
  }

  public static OrganizationPayload failed(List<String> errors) {
    return new OrganizationPayload(null, false, errors);
  }
}
