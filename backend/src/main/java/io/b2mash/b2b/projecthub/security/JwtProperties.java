package io.b2mash.b2b.projecthub.security;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Token signing settings.
 *
 * @param secret HMAC secret, at least 32 bytes
 * @param accessTokenTtl lifetime of access tokens
 * @param refreshTokenTtl lifetime of refresh tokens
 */
@ConfigurationProperties(prefix = "projecthub.jwt")
public record JwtProperties(String secret, Duration accessTokenTtl, Duration refreshTokenTtl) {

  /** HS256 needs a key of at least 256 bits. */
  static final int MIN_SECRET_BYTES = 32;

  public JwtProperties {
    if (secret == null || secret.isBlank()) {
      throw new IllegalArgumentException("projecthub.jwt.secret must be set");
    }
    if (secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
      throw new IllegalArgumentException(
          "projecthub.jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
    if (accessTokenTtl == null) {
      accessTokenTtl = Duration.ofMinutes(60);
    }
    if (refreshTokenTtl == null) {
      refreshTokenTtl = Duration.ofDays(7);
    }
  }
}
