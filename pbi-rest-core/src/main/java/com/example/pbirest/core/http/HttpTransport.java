package com.example.pbirest.core.http;

import reactor.core.publisher.Mono;

/**
 * Sends a prepared request over the wire.
 *
 * <p>Implementations must emit the response for every status code, 2xx or not; classification is
 * the session's job. {@link HttpSession} creates transports lazily through a factory and calls
 * {@link #close()} when the session is closed.
 */
public interface HttpTransport extends AutoCloseable {

  Mono<HttpResponse> exchange(HttpRequest request);

  /** Releases pooled connections. The default does nothing. */
  @Override
  default void close() {}
}
