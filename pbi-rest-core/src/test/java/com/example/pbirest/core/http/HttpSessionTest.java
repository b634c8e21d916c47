package com.example.pbirest.core.http;

import static com.example.pbirest.core.http.StubTransport.json;
import static com.example.pbirest.core.http.StubTransport.ok;
import static org.junit.jupiter.api.Assertions.*;

import com.example.pbirest.core.PowerBiException;
import com.example.pbirest.core.auth.Credential;
import com.example.pbirest.core.auth.TokenCache;
import com.example.pbirest.core.resources.Group;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class HttpSessionTest {

  private static final String BASE_URL = "https://api.example.test/v1.0/myorg";

  private StubTransport transport;
  private AtomicInteger transportsCreated;
  private HttpSession session;

  @BeforeEach
  void setUp() {
    transport = new StubTransport();
    transportsCreated = new AtomicInteger();
    final var tokenCache =
        new TokenCache(
            Credential.staticToken("test-token"),
            null,
            "scope",
            Duration.ofMinutes(20),
            Clock.systemUTC());
    session =
        new HttpSession(
            BASE_URL + "/",
            tokenCache,
            () -> {
              transportsCreated.incrementAndGet();
              return transport;
            },
            null);
  }

  @Nested
  @DisplayName("Request preparation")
  class RequestPreparation {

    @Test
    @DisplayName("Should resolve relative paths and send the cached bearer token")
    void shouldResolveAndAuthenticate() {
      transport.on("GET", "/groups", ok("{\"value\":[]}"));

      session.get("groups").block();

      final var request = transport.requests().get(0);
      assertEquals(BASE_URL + "/groups", request.uri().toString());
      assertEquals("Bearer test-token", request.headers().get("Authorization"));
      assertEquals("application/json", request.headers().get("Content-Type"));
    }

    @Test
    @DisplayName("Should keep an explicit Content-Type and ignore a caller Authorization")
    void shouldMergeHeaders() {
      transport.on("POST", "/upload", ok("{}"));

      session
          .request(
              "POST",
              "upload",
              "raw",
              Map.of("content-type", "text/plain", "Authorization", "Bearer forged"))
          .block();

      final var request = transport.requests().get(0);
      assertEquals("text/plain", request.headers().get("content-type"));
      assertFalse(request.headers().containsKey("Content-Type"));
      assertEquals("Bearer test-token", request.headers().get("Authorization"));
      assertEquals("raw", request.body());
    }

    @Test
    @DisplayName("Should serialize object bodies as JSON and pass absolute URLs through")
    void shouldSerializeBodies() {
      transport.on("POST", "https://other.example.test/x", ok("{}"));

      session.post("https://other.example.test/x", Map.of("retryCount", 3)).block();

      assertEquals("{\"retryCount\":3}", transport.requests().get(0).body());
    }
  }

  @Nested
  @DisplayName("Responses")
  class Responses {

    @Test
    @DisplayName("Should strip the value envelope of list responses")
    void shouldReadValues() {
      transport.on(
          "GET",
          "/groups",
          ok("{\"@odata.context\":\"x\",\"value\":[{\"id\":\"g1\",\"name\":\"Finance\"}]}"));

      final var groups = session.getValues("groups", Group.class).block();

      assertEquals(List.of("Finance"), groups.stream().map(Group::name).toList());
    }

    @Test
    @DisplayName("Should fail when the value envelope is missing")
    void shouldRejectMissingEnvelope() {
      transport.on("GET", "/groups", ok("{\"items\":[]}"));

      StepVerifier.create(session.getValues("groups", Group.class))
          .expectError(PowerBiException.class)
          .verify();
    }

    @Test
    @DisplayName("Should map non-2xx statuses to typed exceptions without retrying them")
    void shouldMapStatuses() {
      transport.on("GET", "/missing", json(404, "{\"error\":\"not found\"}"));
      transport.on("POST", "/busy", json(409, "{}"));

      StepVerifier.create(session.get("missing"))
          .expectErrorSatisfies(
              error -> {
                assertEquals(HttpStatusException.class, error.getClass());
                assertEquals(404, ((HttpStatusException) error).status());
                assertTrue(((HttpStatusException) error).body().contains("not found"));
              })
          .verify();
      StepVerifier.create(session.post("busy", null))
          .expectError(ConflictException.class)
          .verify();

      assertEquals(1, transport.requests("POST", "/busy").size());
    }

    @Test
    @DisplayName("Should retry 429 under the rate-limit policy")
    void shouldRetryRateLimits() {
      transport.on(
          "GET",
          "/groups",
          StubTransport.withHeader(429, "Retry-After", "3"),
          ok("{\"value\":[]}"));

      StepVerifier.withVirtualTime(() -> session.getValues("groups", Group.class))
          .expectSubscription()
          .thenAwait(Duration.ofSeconds(3))
          .assertNext(groups -> assertTrue(groups.isEmpty()))
          .verifyComplete();

      assertEquals(2, transport.requests("GET", "/groups").size());
    }
  }

  @Nested
  @DisplayName("Lifecycle")
  class Lifecycle {

    @Test
    @DisplayName("Should create the transport lazily and reuse it")
    void shouldReuseTransport() {
      transport.on("GET", "/groups", ok("{\"value\":[]}"));
      assertFalse(session.isOpen());

      session.get("groups").block();
      session.get("groups").block();

      assertTrue(session.isOpen());
      assertEquals(1, transportsCreated.get());
    }

    @Test
    @DisplayName("Should release the transport on close and reopen on next use")
    void shouldReopenAfterClose() {
      transport.on("GET", "/groups", ok("{\"value\":[]}"));
      session.get("groups").block();

      session.close();
      assertTrue(transport.isClosed());
      assertFalse(session.isOpen());

      session.get("groups").block();
      assertEquals(2, transportsCreated.get());
    }
  }
}
