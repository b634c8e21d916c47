package com.example.pbirest.core.http;

import java.time.Duration;
import java.util.Optional;

/** HTTP 429, optionally annotated with the server-suggested wait from {@code Retry-After}. */
public class RateLimitException extends HttpStatusException {

  private final Duration retryAfter;

  public RateLimitException(final String body, final String message, final Duration retryAfter) {
    super(429, body, message);
    this.retryAfter = retryAfter;
  }

  /**
   * Returns the wait requested by the server.
   *
   * @return the parsed {@code Retry-After} value, or empty when absent or unparseable
   */
  public Optional<Duration> retryAfter() {
    return Optional.ofNullable(retryAfter);
  }
}
