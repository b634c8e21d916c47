package com.example.pbirest.core.http;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.pbirest.core.PowerBiException;
import com.example.pbirest.core.PowerBiJson;
import com.example.pbirest.core.auth.TokenCache;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import reactor.core.publisher.Mono;

/**
 * Authenticated, rate-limit aware request layer over one {@link HttpTransport}.
 *
 * <p>The transport is created on first use, reused by every call, and released by {@link
 * #close()}; a closed session transparently opens a new transport on its next request. Each
 * request:
 *
 * <ol>
 *   <li>takes the current {@code Authorization} header from the {@link TokenCache},
 *   <li>merges caller headers, keeping an explicit {@code Content-Type} and defaulting to {@code
 *       application/json},
 *   <li>runs under the {@link HttpRetry#onRateLimit rate-limit policy},
 *   <li>fails with a typed {@link HttpStatusException} on any non-2xx status.
 * </ol>
 *
 * <p>Relative URLs are resolved against the base URL, so resource paths such as {@code
 * groups/{id}/datasets} can be passed as-is.
 */
public final class HttpSession implements AutoCloseable {

  private static final System.Logger LOGGER = System.getLogger(HttpSession.class.getName());

  private static final String AUTHORIZATION = "Authorization";
  private static final String CONTENT_TYPE = "Content-Type";
  private static final String APPLICATION_JSON = "application/json";

  private final String baseUrl;
  private final TokenCache tokenCache;
  private final Supplier<? extends HttpTransport> transportFactory;
  private final HttpRetry.RateLimitPolicy rateLimitPolicy;
  private final ObjectMapper mapper = PowerBiJson.mapper();

  private HttpTransport transport;

  /**
   * Creates a session. No connection is opened until the first request.
   *
   * @param baseUrl base for relative URLs
   * @param tokenCache source of the bearer header
   * @param transportFactory creates the transport on first use and after close
   * @param rateLimitPolicy policy applied to every request
   */
  public HttpSession(
      final String baseUrl,
      final TokenCache tokenCache,
      final Supplier<? extends HttpTransport> transportFactory,
      final HttpRetry.RateLimitPolicy rateLimitPolicy) {
    if (baseUrl == null || baseUrl.isBlank())
      throw new IllegalArgumentException("baseUrl is required");
    if (tokenCache == null) throw new IllegalArgumentException("tokenCache is required");
    if (transportFactory == null)
      throw new IllegalArgumentException("transportFactory is required");
    this.baseUrl = baseUrl.replaceAll("/+$", "");
    this.tokenCache = tokenCache;
    this.transportFactory = transportFactory;
    this.rateLimitPolicy =
        rateLimitPolicy == null ? HttpRetry.RateLimitPolicy.defaults() : rateLimitPolicy;
  }

  /**
   * Sends a request.
   *
   * @param method HTTP method
   * @param url absolute URL or path relative to the base URL
   * @param body null, a pre-serialized {@link String}, or an object serialized as JSON
   * @param headers extra headers, may be null
   * @return Mono emitting the 2xx response, or failing with {@link HttpStatusException}
   */
  public Mono<HttpResponse> request(
      final String method, final String url, final Object body, final Map<String, String> headers) {
    return Mono.defer(() -> send(method, url, body, headers))
        .retryWhen(HttpRetry.onRateLimit(rateLimitPolicy));
  }

  public Mono<HttpResponse> get(final String url) {
    return request("GET", url, null, null);
  }

  public Mono<HttpResponse> post(final String url, final Object body) {
    return request("POST", url, body, null);
  }

  public Mono<HttpResponse> patch(final String url, final Object body) {
    return request("PATCH", url, body, null);
  }

  public Mono<HttpResponse> delete(final String url) {
    return request("DELETE", url, null, null);
  }

  /**
   * GETs a list endpoint and strips the {@code {"value": [...]}} envelope.
   *
   * @param url list endpoint
   * @param type element type
   * @param <T> element type
   * @return Mono emitting the elements in server order
   */
  public <T> Mono<List<T>> getValues(final String url, final Class<T> type) {
    return get(url).map(response -> readValues(url, response, type));
  }

  /**
   * GETs an endpoint returning a bare JSON object.
   *
   * @param url endpoint
   * @param type target type
   * @param <T> target type
   * @return Mono emitting the parsed object
   */
  public <T> Mono<T> getObject(final String url, final Class<T> type) {
    return get(url).map(response -> convert(readTree(url, response), type));
  }

  /**
   * Parses a response body as a JSON tree.
   *
   * @param url request URL, for error messages
   * @param response response to parse
   * @return parsed tree, a missing node for an empty body
   */
  public JsonNode readTree(final String url, final HttpResponse response) {
    if (response.body().isBlank()) return mapper.missingNode();
    try {
      return mapper.readTree(response.body());
    } catch (final JsonProcessingException e) {
      throw new PowerBiException("Invalid JSON returned by " + url, e);
    }
  }

  public synchronized boolean isOpen() {
    return transport != null;
  }

  @Override
  public synchronized void close() {
    if (transport != null) {
      LOGGER.log(DEBUG, "Closing transport for {0}", baseUrl);
      transport.close();
      transport = null;
    }
  }

  private Mono<HttpResponse> send(
      final String method, final String url, final Object body, final Map<String, String> headers) {
    final var uri = resolve(url);
    final var payload = serialize(body);
    return tokenCache
        .getAuthorizationHeader()
        .flatMap(
            authorization ->
                ensureTransport()
                    .exchange(
                        new HttpRequest(
                            method, uri, mergeHeaders(headers, authorization), payload)))
        .flatMap(
            response ->
                response.isSuccessful()
                    ? Mono.just(response)
                    : Mono.error(HttpStatusException.of(method, uri.toString(), response)));
  }

  private synchronized HttpTransport ensureTransport() {
    if (transport == null) {
      LOGGER.log(DEBUG, "Opening transport for {0}", baseUrl);
      transport = transportFactory.get();
    }
    return transport;
  }

  private URI resolve(final String url) {
    if (url.startsWith("http://") || url.startsWith("https://")) return URI.create(url);
    return URI.create(baseUrl + "/" + url.replaceFirst("^/+", ""));
  }

  private String serialize(final Object body) {
    if (body == null || body instanceof String) return (String) body;
    try {
      return mapper.writeValueAsString(body);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to serialize request body", e);
    }
  }

  private static Map<String, String> mergeHeaders(
      final Map<String, String> headers, final String authorization) {
    final Map<String, String> merged = new LinkedHashMap<>();
    if (headers != null) {
      headers.forEach(
          (name, value) -> {
            if (!AUTHORIZATION.equalsIgnoreCase(name)) merged.put(name, value);
          });
    }
    merged.put(AUTHORIZATION, authorization);
    if (merged.keySet().stream().noneMatch(CONTENT_TYPE::equalsIgnoreCase)) {
      merged.put(CONTENT_TYPE, APPLICATION_JSON);
    }
    return merged;
  }

  private <T> List<T> readValues(
      final String url, final HttpResponse response, final Class<T> type) {
    final var value = readTree(url, response).path("value");
    if (!value.isArray()) {
      throw new PowerBiException("Response of " + url + " has no 'value' list");
    }
    final List<T> elements = new ArrayList<>(value.size());
    value.forEach(node -> elements.add(convert(node, type)));
    return elements;
  }

  private <T> T convert(final JsonNode node, final Class<T> type) {
    try {
      return mapper.treeToValue(node, type);
    } catch (final JsonProcessingException e) {
      throw new PowerBiException("Unable to read " + type.getSimpleName() + " from " + node, e);
    }
  }
}
