package io.b2mash.b2b.projecthub.multitenancy;

import org.springframework.stereotype.Component;

@Component
public class RequestContextFactory {

  public static final String AUTHORIZATION_HEADER = "Authorization";
  public static final String ORGANIZATION_HEADER = "X-Organization";

  private final IdentityResolver identityResolver;
  private final TenantResolver tenantResolver;

  public RequestContextFactory(IdentityResolver identityResolver, TenantResolver tenantResolver) {
    this.identityResolver = identityResolver;
    this.tenantResolver = tenantResolver;
  }

  public RequestContext create(String authorizationHeader, String organizationSlug) {
    return new RequestContext(
        () -> identityResolver.resolve(authorizationHeader),
        principal -> tenantResolver.resolve(principal, organizationSlug));
  }
}
