package io.b2mash.b2b.projecthub.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.b2mash.b2b.projecthub.exception.UnauthenticatedException;
import io.b2mash.b2b.projecthub.user.User;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/** Issues and verifies the HS256 access and refresh tokens used by the GraphQL API. */
@Service
public class JwtTokenService {

  private static final Logger log = LoggerFactory.getLogger(JwtTokenService.class);

  static final String CLAIM_EMAIL = "email";
  static final String CLAIM_ORG = "org";
  static final String CLAIM_TYPE = "type";
  static final String CLAIM_VERSION = "ver";

  private final byte[] secret;
  private final Duration accessTokenTtl;
  private final Duration refreshTokenTtl;
  private final Clock clock;

  @Autowired
  public JwtTokenService(JwtProperties properties) {
    this(properties, Clock.systemUTC());
  }

  JwtTokenService(JwtProperties properties, Clock clock) {
    this.secret = properties.secret().getBytes(StandardCharsets.UTF_8);
    this.accessTokenTtl = properties.accessTokenTtl();
    this.refreshTokenTtl = properties.refreshTokenTtl();
    this.clock = clock;
  }

  /** Claims extracted from a verified token. */
  public record TokenClaims(
      UUID userId, String email, UUID organizationId, TokenType type, long tokenVersion) {}

  /** An access/refresh token pair; {@code expiresIn} is the access token lifetime in seconds. */
  public record TokenPair(String accessToken, String refreshToken, long expiresIn) {}

  public TokenPair issueTokenPair(User user) {
    return new TokenPair(
        issueToken(user, TokenType.ACCESS),
        issueToken(user, TokenType.REFRESH),
        accessTokenTtl.toSeconds());
  }

  public String issueToken(User user, TokenType type) {
    try {
      Instant now = clock.instant();
      Duration ttl = type == TokenType.ACCESS ? accessTokenTtl : refreshTokenTtl;
      var claims =
          new JWTClaimsSet.Builder()
              .jwtID(UUID.randomUUID().toString())
              .subject(user.getId().toString())
              .claim(CLAIM_EMAIL, user.getEmail())
              .claim(
                  CLAIM_ORG,
                  user.getOrganizationId() != null ? user.getOrganizationId().toString() : null)
              .claim(CLAIM_TYPE, type.claimValue())
              .claim(CLAIM_VERSION, user.getTokenVersion())
              .issueTime(Date.from(now))
              .expirationTime(Date.from(now.plus(ttl)))
              .build();

      var signedJwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
      JWSSigner signer = new MACSigner(secret);
      signedJwt.sign(signer);

      log.debug("Issued {} token for user {}", type.claimValue(), user.getId());
      return signedJwt.serialize();
    } catch (JOSEException e) {
      throw new IllegalStateException("Failed to sign token", e);
    }
  }

  /**
   * Verifies signature, expiry and token type.
   *
   * @throws UnauthenticatedException if the token cannot be trusted
   */
  public TokenClaims verifyToken(String token, TokenType expectedType) {
    try {
      var signedJwt = SignedJWT.parse(token);
      JWSVerifier verifier = new MACVerifier(secret);

      if (!signedJwt.verify(verifier)) {
        throw new UnauthenticatedException("Invalid token");
      }

      var claims = signedJwt.getJWTClaimsSet();

      if (claims.getExpirationTime() == null
          || !claims.getExpirationTime().toInstant().isAfter(clock.instant())) {
        throw new UnauthenticatedException("Token has expired");
      }

      if (!expectedType.claimValue().equals(claims.getStringClaim(CLAIM_TYPE))) {
        throw new UnauthenticatedException("Invalid token type");
      }

      if (claims.getSubject() == null) {
        throw new UnauthenticatedException("Invalid token");
      }

      String org = claims.getStringClaim(CLAIM_ORG);
      Long version = claims.getLongClaim(CLAIM_VERSION);
      return new TokenClaims(
          UUID.fromString(claims.getSubject()),
          claims.getStringClaim(CLAIM_EMAIL),
          org != null ? UUID.fromString(org) : null,
          expectedType,
          version != null ? version : 0L);
    } catch (ParseException | JOSEException | IllegalArgumentException e) {
      log.debug("Rejected token: {}", e.getMessage());
      throw new UnauthenticatedException("Invalid token");
    }
  }

  /**
   * Rejects tokens issued before the user's last logout. Every token carries the user's token
   * version at issue time; {@link User#revokeTokens()} bumps it.
   *
   * @throws UnauthenticatedException if the token has been revoked
   */
  public void requireCurrent(TokenClaims claims, User user) {
    if (claims.tokenVersion() != user.getTokenVersion()) {
      log.debug("Rejected revoked {} token for user {}", claims.type().claimValue(), user.getId());
      throw new UnauthenticatedException("Token has been revoked");
    }
  }
}
