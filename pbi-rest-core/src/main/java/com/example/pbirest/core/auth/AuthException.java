package com.example.pbirest.core.auth;

import com.example.pbirest.core.PowerBiException;

/** Credential exchange failure. Never retried. */
public class AuthException extends PowerBiException {

  public AuthException(final String message) {
    super(message);
  }

  public AuthException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
