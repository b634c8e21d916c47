package com.example.pbirest.core;

/**
 * Root of the unchecked exception hierarchy raised by this library.
 *
 * <p>Subclasses distinguish credential failures, non-2xx responses (with dedicated types for
 * conflicts and throttling) and lookups that matched nothing.
 */
public class PowerBiException extends RuntimeException {

  public PowerBiException(final String message) {
    super(message);
  }

  public PowerBiException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
