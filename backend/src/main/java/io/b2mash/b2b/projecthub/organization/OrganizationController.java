package io.b2mash.b2b.projecthub.organization;

import io.b2mash.b2b.projecthub.exception.ValidationFailedException;
import io.b2mash.b2b.projecthub.multitenancy.RequestContext;
import io.b2mash.b2b.projecthub.user.MemberPayload;
import java.util.UUID;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.ContextValue;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.graphql.data.method.annotation.SchemaMapping;
import org.springframework.stereotype.Controller;

@Controller
public class OrganizationController {

  private final OrganizationService organizationService;

  public OrganizationController(OrganizationService organizationService) {
    this.organizationService = organizationService;
  }

  @QueryMapping
  public Organization organization(
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return organizationService.getCurrentOrganization(context);
  }

  @SchemaMapping(typeName = "Organization")
  public String contactEmail(Organization organization) {
    return organization.getEmail();
  }

  @MutationMapping
  public OrganizationPayload createOrganization(
      @Argument CreateOrganizationInput input,
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    try {
      return OrganizationPayload.ok(organizationService.createOrganization(context, input));
    } catch (ValidationFailedException e) {
      return OrganizationPayload.failed(e.getMessages());
    }
  }

  @MutationMapping
  public OrganizationPayload updateOrganization(
      @Argument UUID id,
      @Argument UpdateOrganizationInput input,
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    try {
      return OrganizationPayload.ok(organizationService.updateOrganization(context, id, input));
    } catch (ValidationFailedException e) {
      return OrganizationPayload.failed(e.getMessages());
    }
  }

  @MutationMapping
  public MemberPayload addOrganizationMember(
      @Argument String email,
      @Argument Boolean admin,
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    try {
      return MemberPayload.ok(
          organizationService.addMember(context, email, Boolean.TRUE.equals(admin)));
    } catch (ValidationFailedException e) {
      return MemberPayload.failed(e.getMessages());
    }
  }
}
