package com.example.pbirest.core;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.pbirest.core.auth.AzureAdTokenExchange;
import com.example.pbirest.core.auth.ClientCredentialsExchange;
import com.example.pbirest.core.auth.Credential;
import com.example.pbirest.core.auth.TokenCache;
import com.example.pbirest.core.http.HttpRetry;
import com.example.pbirest.core.http.HttpSession;
import com.example.pbirest.core.http.HttpTransport;
import com.example.pbirest.core.http.WebClientTransport;
import com.example.pbirest.core.query.DaxQueryExecutor;
import com.example.pbirest.core.refresh.RefreshOrchestrator;
import com.example.pbirest.core.refresh.RefreshTimings;
import java.time.Clock;
import java.util.function.Function;
import java.util.function.Supplier;
import reactor.core.publisher.Mono;

/**
 * Entry point of the library.
 *
 * <p>A client holds the credential, its token cache and the retry configuration; sessions opened
 * from it share the cached token. The shortest path for a service principal:
 *
 * <pre>{@code
 * var client = PowerBiClient.fromServicePrincipal(tenantId, clientId, secret);
 * List<Dataset> datasets = client.withSession(session ->
 *     session.findGroup("Finance").flatMap(session::listDatasets)).block();
 * }</pre>
 *
 * <p>Fine-grained configuration:
 *
 * <pre>{@code
 * var client = PowerBiClient.builder()
 *     .credential(Credential.staticToken(token))
 *     .settings(PowerBiSettings.fromEnvironment())
 *     .conflictPolicy(new ConflictPolicy(3, Duration.ofSeconds(5), Duration.ofSeconds(10)))
 *     .refreshTimings(RefreshTimings.defaults())
 *     .build();
 * }</pre>
 */
public final class PowerBiClient {

  private static final System.Logger LOGGER = System.getLogger(PowerBiClient.class.getName());

  private final PowerBiSettings settings;
  private final TokenCache tokenCache;
  private final HttpRetry.ConflictPolicy conflictPolicy;
  private final HttpRetry.RateLimitPolicy rateLimitPolicy;
  private final RefreshTimings refreshTimings;
  private final Clock clock;
  private final Supplier<? extends HttpTransport> transportFactory;

  private PowerBiClient(final Builder builder) {
    this.settings = builder.settings;
    this.clock = builder.clock;
    this.conflictPolicy = builder.conflictPolicy;
    this.rateLimitPolicy = builder.rateLimitPolicy;
    this.refreshTimings = builder.refreshTimings;
    this.transportFactory =
        builder.transportFactory != null
            ? builder.transportFactory
            : () -> new WebClientTransport(settings.responseTimeout());
    final ClientCredentialsExchange exchange;
    if (builder.tokenExchange != null) {
      exchange = builder.tokenExchange;
    } else if (builder.credential instanceof Credential.ServicePrincipal) {
      exchange = new AzureAdTokenExchange(settings.authorityUrl(), settings.responseTimeout());
    } else {
      exchange = null;
    }
    this.tokenCache =
        new TokenCache(builder.credential, exchange, settings.scope(), settings.tokenTtl(), clock);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Client authenticating as a service principal, configured from the environment.
   *
   * @param tenantId directory (tenant) id
   * @param clientId application (client) id
   * @param clientSecret client secret
   * @return client
   */
  public static PowerBiClient fromServicePrincipal(
      final String tenantId, final String clientId, final String clientSecret) {
    return builder()
        .credential(Credential.servicePrincipal(tenantId, clientId, clientSecret))
        .settings(PowerBiSettings.fromEnvironment())
        .build();
  }

  /**
   * Client sending a pre-issued bearer token, configured from the environment.
   *
   * @param token raw access token
   * @return client
   */
  public static PowerBiClient fromStaticToken(final String token) {
    return builder()
        .credential(Credential.staticToken(token))
        .settings(PowerBiSettings.fromEnvironment())
        .build();
  }

  /**
   * Opens a session. The caller closes it.
   *
   * @return new session; no connection is made until its first request
   */
  public PowerBiSession openSession() {
    LOGGER.log(DEBUG, "Opening session against {0}", settings.baseUrl());
    final var http =
        new HttpSession(settings.baseUrl(), tokenCache, transportFactory, rateLimitPolicy);
    return new PowerBiSession(
        http,
        new RefreshOrchestrator(http, conflictPolicy, refreshTimings, clock),
        new DaxQueryExecutor(http));
  }

  /**
   * Runs work against a session that is closed when the work terminates or is cancelled.
   *
   * @param work function producing the result from the session
   * @param <T> result type
   * @return Mono emitting the work's result
   */
  public <T> Mono<T> withSession(final Function<PowerBiSession, Mono<T>> work) {
    return Mono.usingWhen(
        Mono.fromSupplier(this::openSession),
        work,
        session -> Mono.fromRunnable(session::close));
  }

  public PowerBiSettings settings() {
    return settings;
  }

  public TokenCache tokenCache() {
    return tokenCache;
  }

  /** Builder for {@link PowerBiClient}. Only the credential is required. */
  public static final class Builder {
    private Credential credential;
    private PowerBiSettings settings = PowerBiSettings.defaults();
    private HttpRetry.ConflictPolicy conflictPolicy = HttpRetry.ConflictPolicy.defaults();
    private HttpRetry.RateLimitPolicy rateLimitPolicy = HttpRetry.RateLimitPolicy.defaults();
    private RefreshTimings refreshTimings = RefreshTimings.defaults();
    private Clock clock = Clock.systemUTC();
    private Supplier<? extends HttpTransport> transportFactory;
    private ClientCredentialsExchange tokenExchange;

    private Builder() {}

    /**
     * Sets the credential (required).
     *
     * @param credential service principal or static token
     * @return this builder
     */
    public Builder credential(final Credential credential) {
      this.credential = credential;
      return this;
    }

    /**
     * Sets endpoints and timeouts.
     *
     * <p>Default: {@link PowerBiSettings#defaults()}
     *
     * @param settings settings
     * @return this builder
     */
    public Builder settings(final PowerBiSettings settings) {
      this.settings = settings;
      return this;
    }

    /**
     * Sets the policy wrapped around refresh submissions.
     *
     * <p>Default: {@link HttpRetry.ConflictPolicy#defaults()}
     *
     * @param conflictPolicy policy for 400/409 responses
     * @return this builder
     */
    public Builder conflictPolicy(final HttpRetry.ConflictPolicy conflictPolicy) {
      this.conflictPolicy = conflictPolicy;
      return this;
    }

    /**
     * Sets the policy applied to every request.
     *
     * <p>Default: {@link HttpRetry.RateLimitPolicy#defaults()}
     *
     * @param rateLimitPolicy policy for 429 responses
     * @return this builder
     */
    public Builder rateLimitPolicy(final HttpRetry.RateLimitPolicy rateLimitPolicy) {
      this.rateLimitPolicy = rateLimitPolicy;
      return this;
    }

    public Builder refreshTimings(final RefreshTimings refreshTimings) {
      this.refreshTimings = refreshTimings;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Replaces the HTTP transport, e.g. with a stub in tests.
     *
     * <p>Default: a {@link WebClientTransport} per session
     *
     * @param transportFactory creates a transport for each session
     * @return this builder
     */
    public Builder transportFactory(final Supplier<? extends HttpTransport> transportFactory) {
      this.transportFactory = transportFactory;
      return this;
    }

    /**
     * Replaces the client-credentials exchange.
     *
     * <p>Default: {@link AzureAdTokenExchange} against {@link PowerBiSettings#authorityUrl()}
     *
     * @param tokenExchange exchange used for service principals
     * @return this builder
     */
    public Builder tokenExchange(final ClientCredentialsExchange tokenExchange) {
      this.tokenExchange = tokenExchange;
      return this;
    }

    /**
     * Builds the client. Nothing is fetched until a session makes its first request.
     *
     * @return configured client
     * @throws IllegalStateException if the credential or a required setting is missing
     */
    public PowerBiClient build() {
      if (credential == null) throw new IllegalStateException("credential is required");
      if (settings == null) throw new IllegalStateException("settings is required");
      if (conflictPolicy == null) throw new IllegalStateException("conflictPolicy is required");
      if (rateLimitPolicy == null) throw new IllegalStateException("rateLimitPolicy is required");
      if (refreshTimings == null) throw new IllegalStateException("refreshTimings is required");
      if (clock == null) throw new IllegalStateException("clock is required");
      return new PowerBiClient(this);
    }
  }
}
