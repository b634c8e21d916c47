package com.example.pbirest.core.auth;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.pbirest.core.PowerBiJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.net.URI;
import java.time.Duration;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * Client-credentials exchange against the Azure AD v2 token endpoint.
 *
 * <p>Posts {@code grant_type=client_credentials} with the principal's id, secret and the requested
 * scope to {@code {authority}/{tenantId}/oauth2/v2.0/token}. Error bodies ({@code error}, {@code
 * error_description}) are returned as a {@link TokenResponse} without access token so that {@link
 * TokenCache} can report the reason.
 */
public final class AzureAdTokenExchange implements ClientCredentialsExchange {

  private static final System.Logger LOGGER =
      System.getLogger(AzureAdTokenExchange.class.getName());

  private final String authorityUrl;
  private final WebClient webClient;

  /**
   * Creates an exchange for the given authority.
   *
   * @param authorityUrl authority base, e.g. {@code https://login.microsoftonline.com}
   * @param timeout response timeout of the token request
   */
  public AzureAdTokenExchange(final String authorityUrl, final Duration timeout) {
    if (authorityUrl == null || authorityUrl.isBlank())
      throw new IllegalArgumentException("authorityUrl is required");
    this.authorityUrl = authorityUrl.replaceAll("/+$", "");
    this.webClient =
        WebClient.builder()
            .clientConnector(
                new ReactorClientHttpConnector(HttpClient.create().responseTimeout(timeout)))
            .build();
  }

  @Override
  public Mono<TokenResponse> requestToken(
      final Credential.ServicePrincipal principal, final String scope) {
    final var uri = URI.create(authorityUrl + "/" + principal.tenantId() + "/oauth2/v2.0/token");
    LOGGER.log(DEBUG, "Requesting token for client {0} from {1}", principal.clientId(), uri);

    return webClient
        .post()
        .uri(uri)
        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
        .body(
            BodyInserters.fromFormData("grant_type", "client_credentials")
                .with("client_id", principal.clientId())
                .with("client_secret", principal.clientSecret())
                .with("scope", scope))
        .exchangeToMono(response -> response.bodyToMono(String.class).defaultIfEmpty(""))
        .onErrorMap(
            error -> !(error instanceof AuthException),
            error -> new AuthException("Token request to " + uri + " failed", error))
        .map(AzureAdTokenExchange::parse);
  }

  private static TokenResponse parse(final String body) {
    try {
      return PowerBiJson.mapper().readValue(body, TokenResponse.class);
    } catch (final JsonProcessingException e) {
      throw new AuthException("Invalid token response: " + body, e);
    }
  }
}
