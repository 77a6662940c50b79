package io.b2mash.b2b.projecthub.user;

import io.b2mash.b2b.projecthub.user.AuthService.Authenticated;
import java.util.List;

public record AuthPayload(
    User user,
    String accessToken,
    String refreshToken,
    Long expiresIn,
    boolean success,
    List<String> errors) {

  public static AuthPayload ok(Authenticated authenticated) {
    var tokens = authenticated.tokens();
    return new AuthPayload(
        authenticated.user(),
        tokens.accessToken(),
        tokens.refreshToken(),
        tokens.expiresIn(),
        true,
        List.of());
  }

  public static AuthPayload failed(List<String> errors) {
    return new AuthPayload(null, null, null, null, false, errors);
  }
}
