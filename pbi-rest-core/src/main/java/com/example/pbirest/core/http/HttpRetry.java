package com.example.pbirest.core.http;

import static java.lang.System.Logger.Level.WARNING;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;
import java.util.function.Predicate;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Retry policies for the two transient failure classes of the Power BI API.
 *
 * <ul>
 *   <li><b>Conflict</b> (400/409): the service rejects overlapping work, e.g. a refresh submitted
 *       while another is being queued. Retried a few times after a random pause.
 *   <li><b>Rate limit</b> (429): throttling. Retried after the server's {@code Retry-After} or a
 *       fixed default.
 * </ul>
 *
 * <p>Each policy is a Reactor {@link Retry} spec. They compose by chaining, innermost first:
 *
 * <pre>{@code
 * session.post(path, body)                                  // rate-limit retry inside
 *     .retryWhen(HttpRetry.onConflict(ConflictPolicy.defaults()));
 * }</pre>
 *
 * <p>Exhausting a policy surfaces the last failure unchanged.
 */
public final class HttpRetry {

  private static final System.Logger LOGGER = System.getLogger(HttpRetry.class.getName());

  private HttpRetry() {}

  /**
   * Conflict policy configuration: bounded attempts with a uniformly random pause.
   *
   * @param maxAttempts maximum number of attempts (including first), must be >= 1
   * @param minDelay lower bound of the pause between attempts
   * @param maxDelay upper bound of the pause between attempts, must be >= minDelay
   */
  public record ConflictPolicy(int maxAttempts, Duration minDelay, Duration maxDelay) {

    public ConflictPolicy {
      if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
      if (minDelay == null || minDelay.isNegative())
        throw new IllegalArgumentException("minDelay must be >= 0");
      if (maxDelay == null || maxDelay.compareTo(minDelay) < 0)
        throw new IllegalArgumentException("maxDelay must be >= minDelay");
    }

    /**
     * Five attempts with a pause drawn from [10s, 20s].
     *
     * @return default conflict policy
     */
    public static ConflictPolicy defaults() {
      return new ConflictPolicy(5, Duration.ofSeconds(10), Duration.ofSeconds(20));
    }

    /**
     * Draws the next pause.
     *
     * @return a duration in [minDelay, maxDelay]
     */
    Duration nextDelay() {
      final var min = minDelay.toMillis();
      final var max = maxDelay.toMillis();
      if (max == min) return minDelay;
      return Duration.ofMillis(ThreadLocalRandom.current().nextLong(min, max + 1));
    }
  }

  /**
   * Rate-limit policy configuration.
   *
   * @param maxAttempts maximum number of attempts (including first), must be >= 1
   * @param defaultDelay pause used when the response carries no usable {@code Retry-After}
   */
  public record RateLimitPolicy(int maxAttempts, Duration defaultDelay) {

    public RateLimitPolicy {
      if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
      if (defaultDelay == null || defaultDelay.isNegative())
        throw new IllegalArgumentException("defaultDelay must be >= 0");
    }

    /**
     * Ten attempts, 60 seconds when the server does not say otherwise.
     *
     * @return default rate-limit policy
     */
    public static RateLimitPolicy defaults() {
      return new RateLimitPolicy(10, Duration.ofSeconds(60));
    }
  }

  /** Classifies a failure as belonging to a retry policy. */
  @FunctionalInterface
  public interface ErrorDetector {

    boolean matches(Throwable error);

    /**
     * Matches {@link ConflictException} (400/409).
     *
     * @return default conflict detector
     */
    static ErrorDetector defaultConflict() {
      return HttpRetry::isConflict;
    }

    /**
     * Matches {@link RateLimitException} (429).
     *
     * @return default rate-limit detector
     */
    static ErrorDetector defaultRateLimit() {
      return HttpRetry::isRateLimit;
    }

    static ErrorDetector custom(final Predicate<Throwable> predicate) {
      return predicate::test;
    }

    default ErrorDetector or(final ErrorDetector other) {
      return e -> this.matches(e) || other.matches(e);
    }
  }

  public static boolean isConflict(final Throwable error) {
    return error instanceof ConflictException;
  }

  public static boolean isRateLimit(final Throwable error) {
    return error instanceof RateLimitException;
  }

  /**
   * Retry spec for 400/409 responses.
   *
   * @param policy attempts and pause bounds
   * @return Reactor retry spec
   */
  public static Retry onConflict(final ConflictPolicy policy) {
    return onConflict(policy, ErrorDetector.defaultConflict());
  }

  public static Retry onConflict(final ConflictPolicy policy, final ErrorDetector detector) {
    return classified("Conflict", detector, policy.maxAttempts(), error -> policy.nextDelay());
  }

  /**
   * Retry spec for 429 responses honoring {@code Retry-After}.
   *
   * @param policy attempts and fallback pause
   * @return Reactor retry spec
   */
  public static Retry onRateLimit(final RateLimitPolicy policy) {
    return onRateLimit(policy, ErrorDetector.defaultRateLimit());
  }

  public static Retry onRateLimit(final RateLimitPolicy policy, final ErrorDetector detector) {
    return classified(
        "RateLimit",
        detector,
        policy.maxAttempts(),
        error ->
            Optional.of(error)
                .filter(RateLimitException.class::isInstance)
                .map(RateLimitException.class::cast)
                .flatMap(RateLimitException::retryAfter)
                .orElse(policy.defaultDelay()));
  }

  /**
   * Parses a {@code Retry-After} header given in (possibly fractional) seconds.
   *
   * <p>HTTP-date values, negatives and garbage are treated as absent.
   *
   * @param header header value, if the response had one
   * @return the wait, or null when not usable
   */
  static Duration parseRetryAfter(final Optional<String> header) {
    return header
        .map(String::trim)
        .filter(value -> !value.isEmpty())
        .flatMap(
            value -> {
              try {
                return Optional.of(Double.parseDouble(value));
              } catch (final NumberFormatException e) {
                return Optional.empty();
              }
            })
        .filter(seconds -> seconds > 0 && !seconds.isInfinite())
        .map(seconds -> Duration.ofMillis(Math.round(seconds * 1000)))
        .orElse(null);
  }

  private static Retry classified(
      final String label,
      final ErrorDetector detector,
      final int maxAttempts,
      final Function<Throwable, Duration> waitFor) {
    return Retry.from(
        signals ->
            signals.concatMap(
                signal -> {
                  final var failure = signal.failure();
                  final var attempt = signal.totalRetries() + 1;
                  if (!detector.matches(failure)) return Mono.error(failure);
                  if (attempt >= maxAttempts) {
                    LOGGER.log(
                        WARNING, "[{0}] All {1} attempts failed", label, String.valueOf(attempt));
                    return Mono.error(failure);
                  }

                  final var wait = waitFor.apply(failure);
                  LOGGER.log(
                      WARNING,
                      "[{0}] Attempt #{1} failed: {2} | next wait {3}s",
                      label,
                      String.valueOf(attempt),
                      failure.getMessage(),
                      wait.toMillis() / 1000.0);
                  return Mono.delay(wait).thenReturn(attempt);
                }));
  }
}
