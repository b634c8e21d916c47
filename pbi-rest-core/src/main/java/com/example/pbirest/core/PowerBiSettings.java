package com.example.pbirest.core;

import java.time.Duration;
import java.util.Optional;

/**
 * Endpoint and timing settings of a {@link PowerBiClient}.
 *
 * <p>{@link #fromEnvironment()} resolves each value from a system property, then an environment
 * variable, then the default:
 *
 * <ul>
 *   <li>pbi.api.base-url / PBI_API_BASE_URL (default {@value #DEFAULT_BASE_URL})
 *   <li>pbi.authority-url / PBI_AUTHORITY_URL (default {@value #DEFAULT_AUTHORITY_URL})
 *   <li>pbi.scope / PBI_SCOPE (default {@value #DEFAULT_SCOPE})
 *   <li>pbi.token.ttl.seconds / PBI_TOKEN_TTL_SECONDS (default 1200)
 *   <li>pbi.http.timeout.seconds / PBI_HTTP_TIMEOUT_SECONDS (default 600)
 * </ul>
 *
 * @param baseUrl REST API base, relative request paths are resolved against it
 * @param authorityUrl Azure AD authority used for service principals
 * @param scope scope requested for tokens
 * @param tokenTtl lifetime assumed for exchanged tokens
 * @param responseTimeout per-request response timeout
 */
public record PowerBiSettings(
    String baseUrl,
    String authorityUrl,
    String scope,
    Duration tokenTtl,
    Duration responseTimeout) {

  public static final String DEFAULT_BASE_URL = "https://api.powerbi.com/v1.0/myorg";
  public static final String DEFAULT_AUTHORITY_URL = "https://login.microsoftonline.com";
  public static final String DEFAULT_SCOPE = "https://analysis.windows.net/powerbi/api/.default";
  public static final Duration DEFAULT_TOKEN_TTL = Duration.ofSeconds(1200);
  public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(600);

  public PowerBiSettings {
    if (baseUrl == null || baseUrl.isBlank())
      throw new IllegalArgumentException("baseUrl is required");
    if (authorityUrl == null || authorityUrl.isBlank())
      throw new IllegalArgumentException("authorityUrl is required");
    if (scope == null || scope.isBlank()) throw new IllegalArgumentException("scope is required");
    if (tokenTtl == null || tokenTtl.isZero() || tokenTtl.isNegative())
      throw new IllegalArgumentException("tokenTtl must be > 0");
    if (responseTimeout == null || responseTimeout.isZero() || responseTimeout.isNegative())
      throw new IllegalArgumentException("responseTimeout must be > 0");
    baseUrl = baseUrl.replaceAll("/+$", "");
  }

  public static PowerBiSettings defaults() {
    return new PowerBiSettings(
        DEFAULT_BASE_URL,
        DEFAULT_AUTHORITY_URL,
        DEFAULT_SCOPE,
        DEFAULT_TOKEN_TTL,
        DEFAULT_RESPONSE_TIMEOUT);
  }

  /**
   * Resolves settings from system properties and environment variables.
   *
   * @return resolved settings; unparseable numbers fall back to defaults
   */
  public static PowerBiSettings fromEnvironment() {
    return new PowerBiSettings(
        lookup("pbi.api.base-url", "PBI_API_BASE_URL").orElse(DEFAULT_BASE_URL),
        lookup("pbi.authority-url", "PBI_AUTHORITY_URL").orElse(DEFAULT_AUTHORITY_URL),
        lookup("pbi.scope", "PBI_SCOPE").orElse(DEFAULT_SCOPE),
        seconds("pbi.token.ttl.seconds", "PBI_TOKEN_TTL_SECONDS").orElse(DEFAULT_TOKEN_TTL),
        seconds("pbi.http.timeout.seconds", "PBI_HTTP_TIMEOUT_SECONDS")
            .orElse(DEFAULT_RESPONSE_TIMEOUT));
  }

  public PowerBiSettings withBaseUrl(final String newBaseUrl) {
    return new PowerBiSettings(newBaseUrl, authorityUrl, scope, tokenTtl, responseTimeout);
  }

  public PowerBiSettings withAuthorityUrl(final String newAuthorityUrl) {
    return new PowerBiSettings(baseUrl, newAuthorityUrl, scope, tokenTtl, responseTimeout);
  }

  public PowerBiSettings withTokenTtl(final Duration newTokenTtl) {
    return new PowerBiSettings(baseUrl, authorityUrl, scope, newTokenTtl, responseTimeout);
  }

  public PowerBiSettings withResponseTimeout(final Duration newResponseTimeout) {
    return new PowerBiSettings(baseUrl, authorityUrl, scope, tokenTtl, newResponseTimeout);
  }

  private static Optional<String> lookup(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .map(String::trim)
        .filter(value -> !value.isBlank());
  }

  private static Optional<Duration> seconds(final String property, final String env) {
    return lookup(property, env)
        .flatMap(
            value -> {
              try {
                return Optional.of(Long.parseLong(value));
              } catch (final NumberFormatException e) {
                return Optional.empty();
              }
            })
        .filter(parsed -> parsed > 0)
        .map(Duration::ofSeconds);
  }
}
