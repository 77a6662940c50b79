package io.b2mash.b2b.projecthub.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.projecthub.exception.AccountDisabledException;
import io.b2mash.b2b.projecthub.exception.UnauthenticatedException;
import io.b2mash.b2b.projecthub.security.JwtTokenService;
import io.b2mash.b2b.projecthub.security.JwtTokenService.TokenClaims;
import io.b2mash.b2b.projecthub.security.TokenType;
import io.b2mash.b2b.projecthub.user.User;
import io.b2mash.b2b.projecthub.user.UserRepository;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class IdentityResolverTest {

  @Mock private JwtTokenService jwtTokenService;
  @Mock private UserRepository userRepository;
  @InjectMocks private IdentityResolver resolver;

  @Test
  void missingHeaderIsAnonymous() {
    assertThat(resolver.resolve(null)).isEqualTo(Principal.ANONYMOUS);
    verifyNoInteractions(jwtTokenService, userRepository);
  }

  @Test
  void nonBearerHeaderIsAnonymous() {
    assertThat(resolver.resolve("Basic dXNlcjpwYXNz").isAnonymous()).isTrue();
    verifyNoInteractions(jwtTokenService, userRepository);
  }

  @Test
  void emptyBearerTokenIsRejected() {
    assertThatThrownBy(() -> resolver.resolve("Bearer   "))
        .isInstanceOf(UnauthenticatedException.class);
  }

  @Test
  void invalidTokenPropagatesUnauthenticated() {
    when(jwtTokenService.verifyToken("garbage", TokenType.ACCESS))
        .thenThrow(new UnauthenticatedException("Invalid token"));

    assertThatThrownBy(() -> resolver.resolve("Bearer garbage"))
        .isInstanceOf(UnauthenticatedException.class);
  }

  @Test
  void unknownSubjectIsUnauthenticated() {
    var userId = UUID.randomUUID();
    when(jwtTokenService.verifyToken("tok", TokenType.ACCESS))
        .thenReturn(new TokenClaims(userId, "ghost@acme.test", null, TokenType.ACCESS, 0L));
    when(userRepository.findById(userId)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> resolver.resolve("Bearer tok"))
        .isInstanceOf(UnauthenticatedException.class)
        .hasMessageContaining("User not found");
  }

  @Test
  void inactiveUserIsDisabled() {
    var user = user();
    user.deactivate();
    when(jwtTokenService.verifyToken("tok", TokenType.ACCESS))
        .thenReturn(new TokenClaims(user.getId(), user.getEmail(), null, TokenType.ACCESS, 0L));
    when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));

    assertThatThrownBy(() -> resolver.resolve("Bearer tok"))
        .isInstanceOf(AccountDisabledException.class);
  }

  @Test
  void validTokenYieldsPrincipalSnapshot() {
    var user = user();
    var orgId = UUID.randomUUID();
    user.joinOrganization(orgId, true);
    when(jwtTokenService.verifyToken("tok", TokenType.ACCESS))
        .thenReturn(new TokenClaims(user.getId(), user.getEmail(), orgId, TokenType.ACCESS, 0L));
    when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));

    var principal = resolver.resolve("Bearer tok");

    assertThat(principal.userId()).isEqualTo(user.getId());
    assertThat(principal.email()).isEqualTo("alice@acme.test");
    assertThat(principal.organizationId()).isEqualTo(orgId);
    assertThat(principal.organizationAdmin()).isTrue();
    assertThat(principal.superuser()).isFalse();
  }

  @Test
  void tokenIssuedBeforeLogoutIsRejected() {
    var user = user();
    var claims = new TokenClaims(user.getId(), user.getEmail(), null, TokenType.ACCESS, 0L);
    when(jwtTokenService.verifyToken("tok", TokenType.ACCESS)).thenReturn(claims);
    when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
    doThrow(new UnauthenticatedException("Token has been revoked"))
        .when(jwtTokenService)
        .requireCurrent(claims, user);

    assertThatThrownBy(() -> resolver.resolve("Bearer tok"))
        .isInstanceOf(UnauthenticatedException.class);
  }

  private static User user() {
    var user = new User("alice@acme.test", "Alice", "Smith", "hash");
    ReflectionTestUtils.setField(user, "id", UUID.randomUUID());
    return user;
  }
}
