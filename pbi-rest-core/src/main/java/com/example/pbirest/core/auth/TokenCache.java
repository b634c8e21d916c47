package com.example.pbirest.core.auth;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import reactor.core.publisher.Mono;

/**
 * Holds the most recent {@link Token} for a {@link Credential} and re-acquires it once expired.
 *
 * <p>Concurrent callers that find the token missing or expired share one in-flight acquisition;
 * the credential exchange is never issued twice in parallel. A failed acquisition is not cached,
 * so the next call tries again.
 *
 * <pre>{@code
 * var cache = new TokenCache(
 *     Credential.servicePrincipal(tenantId, clientId, secret),
 *     new AzureAdTokenExchange("https://login.microsoftonline.com", Duration.ofSeconds(30)),
 *     PowerBiSettings.DEFAULT_SCOPE,
 *     Duration.ofMinutes(20),
 *     Clock.systemUTC());
 *
 * String header = cache.getAuthorizationHeader().block(); // "Bearer eyJ0..."
 * }</pre>
 */
public final class TokenCache {

  private static final System.Logger LOGGER = System.getLogger(TokenCache.class.getName());

  private final Credential credential;
  private final ClientCredentialsExchange exchange;
  private final String scope;
  private final Duration ttl;
  private final Clock clock;

  private final AtomicReference<Token> current = new AtomicReference<>();
  private Mono<Token> pending;

  /**
   * Creates a cache for one credential.
   *
   * @param credential credential to authenticate with
   * @param exchange client-credentials exchange used for service principals
   * @param scope scope requested from the exchange
   * @param ttl lifetime assumed for exchanged tokens; a shorter {@code expires_in} wins
   * @param clock time source for expiry checks
   */
  public TokenCache(
      final Credential credential,
      final ClientCredentialsExchange exchange,
      final String scope,
      final Duration ttl,
      final Clock clock) {
    if (credential == null) throw new IllegalArgumentException("credential is required");
    if (ttl == null || ttl.isZero() || ttl.isNegative())
      throw new IllegalArgumentException("ttl must be > 0");
    this.credential = credential;
    this.exchange = exchange;
    this.scope = scope;
    this.ttl = ttl;
    this.clock = clock == null ? Clock.systemUTC() : clock;
  }

  /**
   * Returns the {@code Authorization} header value, acquiring a token first when needed.
   *
   * @return Mono emitting {@code "Bearer <token>"}, or failing with {@link AuthException}
   */
  public Mono<String> getAuthorizationHeader() {
    return Mono.defer(
            () ->
                Optional.ofNullable(current.get())
                    .filter(token -> !token.isExpired(clock))
                    .map(Mono::just)
                    .orElseGet(this::acquire))
        .map(Token::authorizationHeader);
  }

  /**
   * Returns the cached token, expired or not.
   *
   * @return last issued token, empty before the first acquisition
   */
  public Optional<Token> currentToken() {
    return Optional.ofNullable(current.get());
  }

  private synchronized Mono<Token> acquire() {
    final var cached = current.get();
    if (cached != null && !cached.isExpired(clock)) return Mono.just(cached);

    if (pending == null) {
      LOGGER.log(DEBUG, "No valid token cached, acquiring for {0}", credential);
      pending = issue().doOnNext(current::set).doFinally(signal -> clearPending()).cache();
    }
    return pending;
  }

  private synchronized void clearPending() {
    pending = null;
  }

  private Mono<Token> issue() {
    if (credential instanceof Credential.StaticToken staticToken) {
      return Mono.fromSupplier(() -> Token.permanent(staticToken.value(), clock.instant()));
    }
    if (credential instanceof Credential.ServicePrincipal principal) {
      if (exchange == null)
        return Mono.error(new IllegalStateException("No token exchange configured"));
      return Mono.defer(() -> exchange.requestToken(principal, scope))
          .switchIfEmpty(
              Mono.error(() -> new AuthException("Failed to acquire token: empty response")))
          .map(this::toToken)
          .doOnNext(token -> LOGGER.log(INFO, "Acquired token valid until {0}", token.expiresAt()));
    }
    return Mono.error(
        new IllegalStateException("Unsupported credential type " + credential.getClass()));
  }

  private Token toToken(final TokenResponse response) {
    if (!response.hasAccessToken()) {
      throw new AuthException(
          "Failed to acquire token: "
              + Optional.ofNullable(response.errorDescription()).orElse("Unknown error"));
    }
    final var effectiveTtl =
        Optional.ofNullable(response.expiresIn())
            .filter(seconds -> seconds > 0)
            .map(Duration::ofSeconds)
            .filter(reported -> reported.compareTo(ttl) < 0)
            .orElse(ttl);
    return Token.bearer(response.accessToken(), clock.instant(), effectiveTtl);
  }
}
