package com.example.pbirest.core.http;

import com.example.pbirest.core.PowerBiException;

/**
 * A non-2xx response from the API.
 *
 * <p>Statuses 400/409 and 429 are raised as the {@link ConflictException} and {@link
 * RateLimitException} subclasses so that retry policies can classify them; everything else is
 * surfaced as this type and never retried.
 */
public class HttpStatusException extends PowerBiException {

  private final int status;
  private final String body;

  public HttpStatusException(final int status, final String body, final String message) {
    super(message);
    this.status = status;
    this.body = body;
  }

  /**
   * Maps a failed response to the most specific exception type for its status.
   *
   * @param method HTTP method of the failed request
   * @param url request URL
   * @param response the non-2xx response
   * @return typed exception, not thrown
   */
  static HttpStatusException of(
      final String method, final String url, final HttpResponse response) {
    final var message =
        "%s %s failed with status %d: %s"
            .formatted(method, url, response.status(), response.body());
    return switch (response.status()) {
      case 400, 409 -> new ConflictException(response.status(), response.body(), message);
      case 429 ->
          new RateLimitException(
              response.body(), message, HttpRetry.parseRetryAfter(response.header("Retry-After")));
      default -> new HttpStatusException(response.status(), response.body(), message);
    };
  }

  public int status() {
    return status;
  }

  public String body() {
    return body;
  }
}
