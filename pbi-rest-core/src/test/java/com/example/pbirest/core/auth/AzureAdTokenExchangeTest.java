package com.example.pbirest.core.auth;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@WireMockTest
class AzureAdTokenExchangeTest {

  private static final String TOKEN_PATH = "/my-tenant/oauth2/v2.0/token";
  private static final String SCOPE = "https://analysis.windows.net/powerbi/api/.default";

  private AzureAdTokenExchange exchange;

  @BeforeEach
  void setUp(final WireMockRuntimeInfo wm) {
    exchange = new AzureAdTokenExchange(wm.getHttpBaseUrl() + "/", Duration.ofSeconds(5));
  }

  @Test
  @DisplayName("Posts the client-credentials form to the tenant token endpoint")
  void shouldPostClientCredentialsForm() {
    stubFor(
        post(urlEqualTo(TOKEN_PATH))
            .willReturn(
                okJson(
                    "{\"token_type\":\"Bearer\",\"expires_in\":3599,"
                        + "\"access_token\":\"eyJ0\"}")));

    final var response =
        exchange
            .requestToken(Credential.servicePrincipal("my-tenant", "app-id", "s3cr3t"), SCOPE)
            .block();

    assertNotNull(response);
    assertEquals("eyJ0", response.accessToken());
    assertEquals(3599L, response.expiresIn());
    verify(
        postRequestedFor(urlEqualTo(TOKEN_PATH))
            .withHeader("Content-Type", containing("application/x-www-form-urlencoded"))
            .withRequestBody(containing("grant_type=client_credentials"))
            .withRequestBody(containing("client_id=app-id"))
            .withRequestBody(containing("client_secret=s3cr3t"))
            .withRequestBody(containing("scope=https%3A%2F%2Fanalysis.windows.net")));
  }

  @Test
  @DisplayName("Error bodies are returned as a response without access token")
  void shouldReturnErrorResponse() {
    stubFor(
        post(urlEqualTo(TOKEN_PATH))
            .willReturn(
                aResponse()
                    .withStatus(401)
                    .withHeader("Content-Type", "application/json")
                    .withBody(
                        "{\"error\":\"invalid_client\",\"error_description\":\"bad secret\"}")));

    final var response =
        exchange
            .requestToken(Credential.servicePrincipal("my-tenant", "app-id", "wrong"), SCOPE)
            .block();

    assertNotNull(response);
    assertFalse(response.hasAccessToken());
    assertEquals("invalid_client", response.error());
    assertEquals("bad secret", response.errorDescription());
  }

  @Test
  @DisplayName("Non-JSON bodies fail with AuthException")
  void shouldFailOnInvalidJson() {
    stubFor(
        post(urlEqualTo(TOKEN_PATH))
            .willReturn(aResponse().withStatus(502).withBody("<html>Bad gateway</html>")));

    final var principal = Credential.servicePrincipal("my-tenant", "app-id", "s3cr3t");
    assertThrows(AuthException.class, () -> exchange.requestToken(principal, SCOPE).block());
  }
}
