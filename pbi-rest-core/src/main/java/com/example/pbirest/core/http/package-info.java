/**
 * Request layer: {@link com.example.pbirest.core.http.HttpSession} over a pluggable {@link
 * com.example.pbirest.core.http.HttpTransport}, with status mapping to typed exceptions and
 * {@link com.example.pbirest.core.http.HttpRetry} policies.
 */
package com.example.pbirest.core.http;
