package io.b2mash.b2b.projecthub.multitenancy;

import io.b2mash.b2b.projecthub.exception.AccountDisabledException;
import io.b2mash.b2b.projecthub.exception.UnauthenticatedException;
import io.b2mash.b2b.projecthub.security.JwtTokenService;
import io.b2mash.b2b.projecthub.security.TokenType;
import io.b2mash.b2b.projecthub.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns the {@code Authorization} header into a {@link Principal}. A missing or non-Bearer header
 * is anonymous; a Bearer header that cannot be trusted is an error.
 */
@Component
public class IdentityResolver {

  private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);
  private static final String BEARER_PREFIX = "Bearer ";

  private final JwtTokenService jwtTokenService;
  private final UserRepository userRepository;

  public IdentityResolver(JwtTokenService jwtTokenService, UserRepository userRepository) {
    this.jwtTokenService = jwtTokenService;
    this.userRepository = userRepository;
  }

  public Principal resolve(String authorizationHeader) {
    if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
      return Principal.ANONYMOUS;
    }
    String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
    if (token.isEmpty()) {
      throw new UnauthenticatedException("Invalid token");
    }

    var claims = jwtTokenService.verifyToken(token, TokenType.ACCESS);
    var user =
        userRepository
            .findById(claims.userId())
            .orElseThrow(
                () -> {
                  log.warn("Token subject {} does not match any user", claims.userId());
                  return new UnauthenticatedException("User not found");
                });
    if (!user.isActive()) {
      log.warn("Rejected token for deactivated user {}", user.getId());
      throw new AccountDisabledException();
    }
    jwtTokenService.requireCurrent(claims, user);
    return Principal.of(user);
  }
}
