package com.example.pbirest.core.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * An issued access token. Immutable; a new instance replaces it on re-acquisition.
 *
 * @param accessToken raw token value
 * @param issuedAt when the token was obtained
 * @param ttl lifetime counted from {@code issuedAt}
 * @param scheme authorization scheme, always {@code Bearer} for this API
 */
public record Token(String accessToken, Instant issuedAt, Duration ttl, String scheme) {

  public static final String BEARER = "Bearer";

  /** Lifetime of tokens that never expire. */
  public static final Duration NEVER_EXPIRES = ChronoUnit.FOREVER.getDuration();

  public Token {
    if (accessToken == null || accessToken.isBlank())
      throw new IllegalArgumentException("accessToken is required");
    if (issuedAt == null) throw new IllegalArgumentException("issuedAt is required");
    if (ttl == null || ttl.isNegative()) throw new IllegalArgumentException("ttl must be >= 0");
    if (scheme == null || scheme.isBlank())
      throw new IllegalArgumentException("scheme is required");
  }

  public static Token bearer(final String accessToken, final Instant issuedAt, final Duration ttl) {
    return new Token(accessToken, issuedAt, ttl, BEARER);
  }

  public static Token permanent(final String accessToken, final Instant issuedAt) {
    return new Token(accessToken, issuedAt, NEVER_EXPIRES, BEARER);
  }

  /**
   * Expiry instant, saturating at {@link Instant#MAX}.
   *
   * @return {@code issuedAt + ttl}
   */
  public Instant expiresAt() {
    final var headroom = Duration.between(issuedAt, Instant.MAX);
    return ttl.compareTo(headroom) >= 0 ? Instant.MAX : issuedAt.plus(ttl);
  }

  public boolean isExpired(final Clock clock) {
    return !clock.instant().isBefore(expiresAt());
  }

  /**
   * Value for the {@code Authorization} header.
   *
   * @return {@code "{scheme} {accessToken}"}
   */
  public String authorizationHeader() {
    return scheme + " " + accessToken;
  }

  @Override
  public String toString() {
    return "Token[scheme=" + scheme + ", issuedAt=" + issuedAt + ", ttl=" + ttl + "]";
  }
}
