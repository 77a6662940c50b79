package io.b2mash.b2b.projecthub.user;

import io.b2mash.b2b.projecthub.exception.ValidationFailedException;
import io.b2mash.b2b.projecthub.multitenancy.RequestContext;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.ContextValue;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.stereotype.Controller;

/** Account mutations. Only {@code logout} requires a bearer token. */
@Controller
public class AuthController {

  private final AuthService authService;

  public AuthController(AuthService authService) {
    this.authService = authService;
  }

  @MutationMapping
  public AuthPayload register(@Argument RegisterInput input) {
    try {
      return AuthPayload.ok(authService.register(input));
    } catch (ValidationFailedException e) {
      return AuthPayload.failed(e.getMessages());
    }
  }

  @MutationMapping
  public AuthPayload login(@Argument LoginInput input) {
    try {
      return AuthPayload.ok(authService.login(input));
    } catch (ValidationFailedException e) {
      return AuthPayload.failed(e.getMessages());
    }
  }

  @MutationMapping
  public AuthPayload refreshToken(@Argument String refreshToken) {
    try {
      return AuthPayload.ok(authService.refresh(refreshToken));
    } catch (ValidationFailedException e) {
      return AuthPayload.failed(e.getMessages());
    }
  }

  @MutationMapping
  public LogoutPayload logout(
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    authService.logout(context);
    return LogoutPayload.loggedOut();
  }
}
