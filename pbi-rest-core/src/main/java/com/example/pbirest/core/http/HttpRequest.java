package com.example.pbirest.core.http;

import java.net.URI;
import java.util.Map;

/**
 * Fully resolved outbound request handed to an {@link HttpTransport}.
 *
 * @param method HTTP method name, upper case
 * @param uri absolute request URI
 * @param headers headers to send, already including {@code Authorization} and {@code
 *     Content-Type}
 * @param body serialized body, or null for none
 */
public record HttpRequest(String method, URI uri, Map<String, String> headers, String body) {

  public HttpRequest {
    headers = Map.copyOf(headers);
  }
}
