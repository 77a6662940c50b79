package io.b2mash.b2b.projecthub.user;

import io.b2mash.b2b.projecthub.exception.UnauthenticatedException;
import io.b2mash.b2b.projecthub.exception.ValidationFailedException;
import io.b2mash.b2b.projecthub.multitenancy.RequestContext;
import io.b2mash.b2b.projecthub.organization.OrganizationRepository;
import io.b2mash.b2b.projecthub.security.AccessGuard;
import io.b2mash.b2b.projecthub.security.AccessPolicy;
import io.b2mash.b2b.projecthub.security.JwtTokenService;
import io.b2mash.b2b.projecthub.security.JwtTokenService.TokenPair;
import io.b2mash.b2b.projecthub.security.TokenType;
import io.b2mash.b2b.projecthub.validation.AccountRules;
import io.b2mash.b2b.projecthub.validation.InputValidator;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Account operations: registration, login, token refresh and logout. */
@Service
public class AuthService {

  private static final Logger log = LoggerFactory.getLogger(AuthService.class);

  static final String INVALID_CREDENTIALS = "Invalid email or password";

  private final UserRepository userRepository;
  private final OrganizationRepository organizationRepository;
  private final PasswordEncoder passwordEncoder;
  private final JwtTokenService jwtTokenService;
  private final InputValidator inputValidator;

  public AuthService(
      UserRepository userRepository,
      OrganizationRepository organizationRepository,
      PasswordEncoder passwordEncoder,
      JwtTokenService jwtTokenService,
      InputValidator inputValidator) {
    this.userRepository = userRepository;
    this.organizationRepository = organizationRepository;
    this.passwordEncoder = passwordEncoder;
    this.jwtTokenService = jwtTokenService;
    this.inputValidator = inputValidator;
  }

  /** A user together with a freshly issued token pair. */
  public record Authenticated(User user, TokenPair tokens) {}

  @Transactional
  public Authenticated register(RegisterInput input) {
    String email = normalizeEmail(input.email());
    var errors = inputValidator.validate(input);
    errors.addAll(AccountRules.checkPassword(input.password()));
    if (AccountRules.isBlockedDomain(email)) {
      errors.add("Email domain is not allowed");
    }
    if (errors.isEmpty() && userRepository.existsByEmailIgnoreCase(email)) {
      errors.add("User with this email already exists");
    }
    if (!errors.isEmpty()) {
      throw new ValidationFailedException(errors);
    }

    User user;
    try {
      user =
          userRepository.saveAndFlush(
              new User(
                  email,
                  input.firstName().trim(),
                  input.lastName().trim(),
                  passwordEncoder.encode(input.password())));
    } catch (DataIntegrityViolationException e) {
      throw new ValidationFailedException("User with this email already exists");
    }
    log.info("Registered user {}", user.getId());
    return new Authenticated(user, jwtTokenService.issueTokenPair(user));
  }

  @Transactional(readOnly = true)
  public Authenticated login(LoginInput input) {
    var errors = inputValidator.validate(input);
    if (!errors.isEmpty()) {
      throw new ValidationFailedException(errors);
    }

    var user =
        userRepository
            .findByEmailIgnoreCase(input.email().trim())
            .filter(u -> passwordEncoder.matches(input.password(), u.getPasswordHash()))
            .orElseThrow(
                () -> {
                  log.warn("Failed login attempt");
                  return new ValidationFailedException(INVALID_CREDENTIALS);
                });
    if (!user.isActive()) {
      throw new ValidationFailedException("Account is deactivated");
    }

    if (input.organizationSlug() != null && !input.organizationSlug().isBlank()) {
      boolean member =
          organizationRepository
              .findBySlug(input.organizationSlug().trim())
              .map(org -> user.isSuperuser() || org.getId().equals(user.getOrganizationId()))
              .orElse(false);
      if (!member) {
        throw new ValidationFailedException("User is not a member of this organization");
      }
    }

    log.info("User {} logged in", user.getId());
    return new Authenticated(user, jwtTokenService.issueTokenPair(user));
  }

  @Transactional(readOnly = true)
  public Authenticated refresh(String refreshToken) {
    if (refreshToken == null || refreshToken.isBlank()) {
      throw new ValidationFailedException("Invalid or expired refresh token");
    }
    JwtTokenService.TokenClaims claims;
    try {
      claims = jwtTokenService.verifyToken(refreshToken, TokenType.REFRESH);
    } catch (UnauthenticatedException e) {
      throw new ValidationFailedException("Invalid or expired refresh token");
    }
    var user =
        userRepository
            .findById(claims.userId())
            .filter(User::isActive)
            .orElseThrow(() -> new ValidationFailedException("Invalid user"));
    try {
      jwtTokenService.requireCurrent(claims, user);
    } catch (UnauthenticatedException e) {
      throw new ValidationFailedException("Invalid or expired refresh token");
    }
    return new Authenticated(user, jwtTokenService.issueTokenPair(user));
  }

  /** Revokes every access and refresh token the caller holds. */
  @Transactional
  public void logout(RequestContext context) {
    var principal = AccessGuard.require(context, AccessPolicy.AUTHENTICATED).principal();
    var user =
        userRepository
            .findById(principal.userId())
            .orElseThrow(() -> new UnauthenticatedException("User not found"));
    user.revokeTokens();
    userRepository.save(user);
    log.info("User {} logged out", user.getId());
  }

  private static String normalizeEmail(String email) {
    return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
  }
}
