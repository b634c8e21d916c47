package com.example.pbirest.core.resources;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Normalized state of a refresh or dataflow transaction.
 *
 * <p>The API reports {@code Unknown} for a running dataset refresh, {@code Success} for a finished
 * dataflow transaction and {@code Cancelling} while a cancel is being applied; those are mapped to
 * {@link #IN_PROGRESS}, {@link #COMPLETED} and {@link #CANCELLED}. Any other unrecognized value is
 * {@link #FAILED}.
 */
public enum RefreshStatus {
  PENDING("Pending"),
  IN_PROGRESS("InProgress"),
  COMPLETED("Completed"),
  FAILED("Failed"),
  CANCELLED("Cancelled");

  private final String label;

  RefreshStatus(final String label) {
    this.label = label;
  }

  @JsonCreator
  public static RefreshStatus fromValue(final String value) {
    if (value == null) return FAILED;
    final var normalized = value.trim().toLowerCase(Locale.ROOT);
    switch (normalized) {
      case "success":
        return COMPLETED;
      case "unknown":
        return IN_PROGRESS;
      case "cancelling":
        return CANCELLED;
      default:
        for (final var status : values()) {
          if (status.label.toLowerCase(Locale.ROOT).equals(normalized)) return status;
        }
        return FAILED;
    }
  }

  @JsonValue
  public String label() {
    return label;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  @Override
  public String toString() {
    return label;
  }
}
