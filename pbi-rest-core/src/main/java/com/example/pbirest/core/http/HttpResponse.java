package com.example.pbirest.core.http;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Raw response as seen by the session, before any status classification.
 *
 * @param status HTTP status code
 * @param headers response headers; lookups through {@link #header(String)} ignore case
 * @param body response body, empty string when there was none
 */
public record HttpResponse(int status, Map<String, List<String>> headers, String body) {

  public HttpResponse {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
    body = body == null ? "" : body;
  }

  public boolean isSuccessful() {
    return status >= 200 && status < 300;
  }

  /**
   * Returns the first value of a header.
   *
   * @param name header name, case-insensitive
   * @return first value, or empty when absent
   */
  public Optional<String> header(final String name) {
    return headers.entrySet().stream()
        .filter(entry -> entry.getKey().equalsIgnoreCase(name))
        .map(Map.Entry::getValue)
        .filter(values -> !values.isEmpty())
        .map(values -> values.get(0))
        .findFirst();
  }
}
