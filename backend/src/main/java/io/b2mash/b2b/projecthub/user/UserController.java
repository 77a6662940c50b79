package io.b2mash.b2b.projecthub.user;

import io.b2mash.b2b.projecthub.multitenancy.RequestContext;
import io.b2mash.b2b.projecthub.organization.Organization;
import io.b2mash.b2b.projecthub.organization.OrganizationService;
import java.util.List;
import java.util.UUID;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.ContextValue;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.graphql.data.method.annotation.SchemaMapping;
import org.springframework.stereotype.Controller;

@Controller
public class UserController {

  private final UserService userService;
  private final OrganizationService organizationService;

  public UserController(UserService userService, OrganizationService organizationService) {
    this.userService = userService;
    this.organizationService = organizationService;
  }

  @QueryMapping
  public User me(@ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return userService.getCurrentUser(context);
  }

  @QueryMapping
  public List<User> users(@ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return userService.listUsers(context);
  }

  @QueryMapping
  public User user(
      @Argument UUID id, @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return userService.getUser(context, id);
  }

  @SchemaMapping(typeName = "User")
  public Organization organization(
      User user, @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return organizationService.findVisibleOrganization(context, user);
  }

  @SchemaMapping(typeName = "User")
  public String fullName(User user) {
    return user.getFullName();
  }
}
