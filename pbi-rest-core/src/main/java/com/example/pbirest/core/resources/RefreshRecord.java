package com.example.pbirest.core.resources;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/** One entry of a refresh history: a dataset {@link Refresh} or a dataflow {@link Transaction}. */
public sealed interface RefreshRecord extends Exportable permits Refresh, Transaction {

  String id();

  String refreshType();

  Instant startTime();

  /** Null while the refresh is running. */
  Instant endTime();

  RefreshStatus status();

  /** The dataset or dataflow that was refreshed, if attached. */
  Refreshable resource();

  /**
   * Path that cancels this refresh.
   *
   * @return path relative to the API base URL
   */
  String cancelPath();

  /** HTTP method of the cancel request. */
  String cancelMethod();

  default boolean isInProgress() {
    return status() == RefreshStatus.IN_PROGRESS;
  }

  default Optional<Duration> duration() {
    if (startTime() == null || endTime() == null) return Optional.empty();
    return Optional.of(Duration.between(startTime(), endTime()));
  }
}
