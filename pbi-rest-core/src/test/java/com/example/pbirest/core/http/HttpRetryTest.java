package com.example.pbirest.core.http;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

class HttpRetryTest {

  private static RateLimitException throttled(final Duration retryAfter) {
    return new RateLimitException("{}", "429 Too Many Requests", retryAfter);
  }

  private static ConflictException conflict() {
    return new ConflictException(409, "{}", "409 Conflict");
  }

  @Nested
  @DisplayName("Rate limit policy")
  class RateLimit {

    @Test
    @DisplayName("Should wait the Retry-After seconds before the next attempt")
    void shouldHonorRetryAfter() {
      final var attempts = new AtomicInteger();

      StepVerifier.withVirtualTime(
              () ->
                  Mono.defer(
                          () ->
                              attempts.incrementAndGet() == 1
                                  ? Mono.<String>error(throttled(Duration.ofSeconds(5)))
                                  : Mono.just("ok"))
                      .retryWhen(HttpRetry.onRateLimit(HttpRetry.RateLimitPolicy.defaults())))
          .expectSubscription()
          .expectNoEvent(Duration.ofMillis(4999))
          .thenAwait(Duration.ofMillis(1))
          .expectNext("ok")
          .verifyComplete();

      assertEquals(2, attempts.get());
    }

    @Test
    @DisplayName("Should wait 60 seconds when Retry-After is absent")
    void shouldUseDefaultDelay() {
      final var attempts = new AtomicInteger();

      StepVerifier.withVirtualTime(
              () ->
                  Mono.defer(
                          () ->
                              attempts.incrementAndGet() == 1
                                  ? Mono.<String>error(throttled(null))
                                  : Mono.just("ok"))
                      .retryWhen(HttpRetry.onRateLimit(HttpRetry.RateLimitPolicy.defaults())))
          .expectSubscription()
          .expectNoEvent(Duration.ofSeconds(59))
          .thenAwait(Duration.ofSeconds(1))
          .expectNext("ok")
          .verifyComplete();
    }

    @Test
    @DisplayName("Should surface the 429 after 10 attempts")
    void shouldGiveUpAfterTenAttempts() {
      final var attempts = new AtomicInteger();

      StepVerifier.withVirtualTime(
              () ->
                  Mono.defer(
                          () -> {
                            attempts.incrementAndGet();
                            return Mono.<String>error(throttled(null));
                          })
                      .retryWhen(HttpRetry.onRateLimit(HttpRetry.RateLimitPolicy.defaults())))
          .expectSubscription()
          .expectNoEvent(Duration.ofSeconds(539))
          .thenAwait(Duration.ofSeconds(1))
          .expectError(RateLimitException.class)
          .verify();

      assertEquals(10, attempts.get());
    }

    @Test
    @DisplayName("Should not retry other failures")
    void shouldPropagateOtherErrorsImmediately() {
      final var attempts = new AtomicInteger();

      StepVerifier.create(
              Mono.defer(
                      () -> {
                        attempts.incrementAndGet();
                        return Mono.<String>error(new HttpStatusException(500, "", "boom"));
                      })
                  .retryWhen(HttpRetry.onRateLimit(HttpRetry.RateLimitPolicy.defaults())))
          .expectError(HttpStatusException.class)
          .verify(Duration.ofSeconds(1));

      assertEquals(1, attempts.get());
    }
  }

  @Nested
  @DisplayName("Conflict policy")
  class Conflict {

    @Test
    @DisplayName("409 three times then 200 succeeds on the 4th attempt with 10-20s waits")
    void shouldRetryConflictsWithRandomWaits() {
      final List<Long> attemptTimes = new CopyOnWriteArrayList<>();

      StepVerifier.withVirtualTime(
              () ->
                  Mono.defer(
                          () -> {
                            attemptTimes.add(Schedulers.parallel().now(TimeUnit.MILLISECONDS));
                            return attemptTimes.size() <= 3
                                ? Mono.<String>error(conflict())
                                : Mono.just("ok");
                          })
                      .retryWhen(HttpRetry.onConflict(HttpRetry.ConflictPolicy.defaults())))
          .expectSubscription()
          .expectNoEvent(Duration.ofSeconds(29))
          .thenAwait(Duration.ofSeconds(31))
          .expectNext("ok")
          .verifyComplete();

      assertEquals(4, attemptTimes.size());
      for (int i = 1; i < attemptTimes.size(); i++) {
        final var gap = attemptTimes.get(i) - attemptTimes.get(i - 1);
        assertTrue(gap >= 10_000 && gap <= 20_000, "gap was " + gap);
      }
    }

    @Test
    @DisplayName("Should surface the conflict after 5 attempts")
    void shouldGiveUpAfterFiveAttempts() {
      final var attempts = new AtomicInteger();

      StepVerifier.withVirtualTime(
              () ->
                  Mono.defer(
                          () -> {
                            attempts.incrementAndGet();
                            return Mono.<String>error(conflict());
                          })
                      .retryWhen(HttpRetry.onConflict(HttpRetry.ConflictPolicy.defaults())))
          .expectSubscription()
          .thenAwait(Duration.ofSeconds(80))
          .expectError(ConflictException.class)
          .verify();

      assertEquals(5, attempts.get());
    }

    @Test
    @DisplayName("Chained policies give each failure its own wait")
    void shouldComposeWithRateLimit() {
      final var attempts = new AtomicInteger();

      StepVerifier.withVirtualTime(
              () ->
                  Mono.defer(
                          () -> {
                            switch (attempts.incrementAndGet()) {
                              case 1:
                                return Mono.<String>error(throttled(Duration.ofSeconds(2)));
                              case 2:
                                return Mono.<String>error(conflict());
                              default:
                                return Mono.just("ok");
                            }
                          })
                      .retryWhen(HttpRetry.onRateLimit(HttpRetry.RateLimitPolicy.defaults()))
                      .retryWhen(HttpRetry.onConflict(HttpRetry.ConflictPolicy.defaults())))
          .expectSubscription()
          .expectNoEvent(Duration.ofSeconds(11))
          .thenAwait(Duration.ofSeconds(11))
          .expectNext("ok")
          .verifyComplete();

      assertEquals(3, attempts.get());
    }
  }

  @Nested
  @DisplayName("Configuration and classification")
  class Configuration {

    @Test
    @DisplayName("Retry-After accepts positive decimal seconds only")
    void shouldParseRetryAfter() {
      assertEquals(Duration.ofSeconds(5), HttpRetry.parseRetryAfter(Optional.of("5")));
      assertEquals(Duration.ofMillis(1500), HttpRetry.parseRetryAfter(Optional.of(" 1.5 ")));
      assertNull(HttpRetry.parseRetryAfter(Optional.of("0")));
      assertNull(HttpRetry.parseRetryAfter(Optional.of("-3")));
      assertNull(HttpRetry.parseRetryAfter(Optional.of("Wed, 21 Oct 2015 07:28:00 GMT")));
      assertNull(HttpRetry.parseRetryAfter(Optional.empty()));
    }

    @Test
    @DisplayName("Policies reject invalid bounds")
    void shouldValidatePolicies() {
      assertThrows(
          IllegalArgumentException.class,
          () -> new HttpRetry.ConflictPolicy(0, Duration.ZERO, Duration.ZERO));
      assertThrows(
          IllegalArgumentException.class,
          () -> new HttpRetry.ConflictPolicy(3, Duration.ofSeconds(20), Duration.ofSeconds(10)));
      assertThrows(
          IllegalArgumentException.class,
          () -> new HttpRetry.RateLimitPolicy(3, Duration.ofSeconds(-1)));
    }

    @Test
    @DisplayName("Default detectors classify by status and custom detectors compose with OR")
    void detectorComposition() {
      final var conflictDetector = HttpRetry.ErrorDetector.defaultConflict();
      final var rateLimitDetector = HttpRetry.ErrorDetector.defaultRateLimit();
      final var custom =
          HttpRetry.ErrorDetector.custom(
              t -> t instanceof HttpStatusException e && e.status() == 503);
      final var combined = conflictDetector.or(custom);

      assertTrue(conflictDetector.matches(conflict()));
      assertTrue(conflictDetector.matches(new ConflictException(400, "{}", "400")));
      assertFalse(conflictDetector.matches(throttled(null)));
      assertTrue(rateLimitDetector.matches(throttled(null)));
      assertTrue(combined.matches(new HttpStatusException(503, "", "unavailable")));
      assertFalse(combined.matches(new HttpStatusException(500, "", "boom")));
    }

    @Test
    @DisplayName("Status classification maps 400/409 to conflict and 429 to rate limit")
    void shouldClassifyStatuses() {
      final var retryAfter = new HttpResponse(429, Map.of("Retry-After", List.of("7")), "{}");

      assertInstanceOf(
          ConflictException.class,
          HttpStatusException.of("POST", "u", new HttpResponse(400, null, "")));
      assertInstanceOf(
          ConflictException.class,
          HttpStatusException.of("POST", "u", new HttpResponse(409, null, "")));
      final var throttled = HttpStatusException.of("GET", "u", retryAfter);
      assertInstanceOf(RateLimitException.class, throttled);
      assertEquals(
          Optional.of(Duration.ofSeconds(7)), ((RateLimitException) throttled).retryAfter());
      final var other = HttpStatusException.of("GET", "u", new HttpResponse(404, null, "nope"));
      assertEquals(HttpStatusException.class, other.getClass());
      assertEquals(404, other.status());
      assertEquals("nope", other.body());
    }
  }
}
