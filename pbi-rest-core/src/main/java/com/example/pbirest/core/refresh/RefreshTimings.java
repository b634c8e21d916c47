package com.example.pbirest.core.refresh;

import java.time.Duration;

/**
 * Delays used by the {@link RefreshOrchestrator}.
 *
 * @param settleDelay pause between cancelling a running refresh and submitting a new one
 * @param initialPollDelay pause between submission and the first status check
 * @param pollInterval pause between status checks
 */
public record RefreshTimings(
    Duration settleDelay, Duration initialPollDelay, Duration pollInterval) {

  public RefreshTimings {
    requireNonNegative(settleDelay, "settleDelay");
    requireNonNegative(initialPollDelay, "initialPollDelay");
    if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative())
      throw new IllegalArgumentException("pollInterval must be > 0");
  }

  /**
   * 5 seconds to settle, first check after 10 seconds, then every 10 seconds.
   *
   * @return default timings
   */
  public static RefreshTimings defaults() {
    return new RefreshTimings(
        Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(10));
  }

  private static void requireNonNegative(final Duration value, final String name) {
    if (value == null || value.isNegative())
      throw new IllegalArgumentException(name + " must be >= 0");
  }
}
