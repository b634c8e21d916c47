package com.example.pbirest.core.http;

import static java.lang.System.Logger.Level.DEBUG;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

/**
 * {@link HttpTransport} backed by Spring's {@link WebClient} on a dedicated Reactor Netty
 * connection pool.
 *
 * <p>The pool is owned by this transport and disposed on {@link #close()}.
 */
public final class WebClientTransport implements HttpTransport {

  private static final System.Logger LOGGER = System.getLogger(WebClientTransport.class.getName());

  private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

  private final ConnectionProvider connectionProvider;
  private final WebClient webClient;

  /**
   * Creates a transport with its own connection pool.
   *
   * @param responseTimeout maximum time to wait for a response once the request is sent
   */
  public WebClientTransport(final Duration responseTimeout) {
    this.connectionProvider = ConnectionProvider.builder("pbi-rest").build();
    final var httpClient = HttpClient.create(connectionProvider).responseTimeout(responseTimeout);
    this.webClient =
        WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .exchangeStrategies(
                ExchangeStrategies.builder()
                    .codecs(
                        configurer ->
                            configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                    .build())
            .build();
  }

  @Override
  public Mono<HttpResponse> exchange(final HttpRequest request) {
    final var spec =
        webClient
            .method(HttpMethod.valueOf(request.method()))
            .uri(request.uri())
            .headers(headers -> request.headers().forEach(headers::set));
    final WebClient.RequestHeadersSpec<?> withBody =
        request.body() == null ? spec : spec.bodyValue(request.body());
    return withBody
        .exchangeToMono(response -> response.toEntity(String.class))
        .map(WebClientTransport::toResponse)
        .doOnNext(
            response ->
                LOGGER.log(
                    DEBUG,
                    "{0} {1} -> {2}",
                    request.method(),
                    request.uri(),
                    String.valueOf(response.status())));
  }

  @Override
  public void close() {
    connectionProvider.dispose();
  }

  private static HttpResponse toResponse(final ResponseEntity<String> entity) {
    final Map<String, List<String>> headers = new LinkedHashMap<>();
    entity.getHeaders().forEach((name, values) -> headers.put(name, new ArrayList<>(values)));
    return new HttpResponse(entity.getStatusCode().value(), headers, entity.getBody());
  }
}
