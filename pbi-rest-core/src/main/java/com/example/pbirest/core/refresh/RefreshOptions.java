package com.example.pbirest.core.refresh;

import com.example.pbirest.core.resources.Dataset;
import java.time.Duration;
import java.util.Optional;

/**
 * Per-call options of {@link RefreshOrchestrator#refresh}.
 *
 * @param force cancel a running refresh instead of skipping
 * @param waitForCompletion poll until the new refresh reaches a final state
 * @param refreshType dataset refresh type, ignored for dataflows
 * @param timeout upper bound for the whole call, null for none
 */
public record RefreshOptions(
    boolean force, boolean waitForCompletion, String refreshType, Duration timeout) {

  public RefreshOptions {
    if (refreshType == null || refreshType.isBlank()) refreshType = Dataset.DEFAULT_REFRESH_TYPE;
    if (timeout != null && (timeout.isZero() || timeout.isNegative()))
      throw new IllegalArgumentException("timeout must be > 0");
  }

  /**
   * Submit without forcing, return once accepted, full refresh, no timeout.
   *
   * @return default options
   */
  public static RefreshOptions defaults() {
    return new RefreshOptions(false, false, Dataset.DEFAULT_REFRESH_TYPE, null);
  }

  public RefreshOptions withForce(final boolean newForce) {
    return new RefreshOptions(newForce, waitForCompletion, refreshType, timeout);
  }

  public RefreshOptions withWaitForCompletion(final boolean newWait) {
    return new RefreshOptions(force, newWait, refreshType, timeout);
  }

  public RefreshOptions withRefreshType(final String newRefreshType) {
    return new RefreshOptions(force, waitForCompletion, newRefreshType, timeout);
  }

  public RefreshOptions withTimeout(final Duration newTimeout) {
    return new RefreshOptions(force, waitForCompletion, refreshType, newTimeout);
  }

  public Optional<Duration> maxDuration() {
    return Optional.ofNullable(timeout);
  }
}
