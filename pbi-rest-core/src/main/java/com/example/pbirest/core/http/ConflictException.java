package com.example.pbirest.core.http;

/** HTTP 400 or 409, typically a refresh submission clashing with one already queued. */
public class ConflictException extends HttpStatusException {

  public ConflictException(final int status, final String body, final String message) {
    super(status, body, message);
  }
}
