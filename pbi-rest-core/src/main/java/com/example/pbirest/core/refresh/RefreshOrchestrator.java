package com.example.pbirest.core.refresh;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import com.example.pbirest.core.http.HttpRetry;
import com.example.pbirest.core.http.HttpSession;
import com.example.pbirest.core.resources.Dataflow;
import com.example.pbirest.core.resources.Dataset;
import com.example.pbirest.core.resources.Refresh;
import com.example.pbirest.core.resources.RefreshRecord;
import com.example.pbirest.core.resources.Refreshable;
import com.example.pbirest.core.resources.Transaction;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import reactor.core.publisher.Mono;

/**
 * Triggers, cancels and watches refreshes of datasets and dataflows.
 *
 * <p>Every decision is taken from the server's refresh history; nothing is remembered between
 * calls. A refresh call goes through:
 *
 * <ol>
 *   <li>read the latest history entry,
 *   <li>if it is in progress: skip, or with {@code force} cancel it and wait for the service to
 *       settle,
 *   <li>submit a new refresh under the conflict policy,
 *   <li>optionally poll the history until the refresh started after the submission finishes.
 * </ol>
 *
 * <pre>{@code
 * var outcome = orchestrator
 *     .refresh(dataset, RefreshOptions.defaults().withForce(true).withWaitForCompletion(true))
 *     .block();
 * outcome.completion().ifPresent(r -> System.out.println(r.status()));
 * }</pre>
 *
 * <p>Polling has no deadline of its own; pass {@link RefreshOptions#timeout()} or dispose the
 * subscription.
 */
public final class RefreshOrchestrator {

  private static final System.Logger LOGGER = System.getLogger(RefreshOrchestrator.class.getName());

  private static final Comparator<RefreshRecord> BY_START =
      Comparator.comparing(
          RefreshRecord::startTime, Comparator.nullsFirst(Comparator.naturalOrder()));

  private final HttpSession session;
  private final HttpRetry.ConflictPolicy conflictPolicy;
  private final RefreshTimings timings;
  private final Clock clock;

  /**
   * Creates an orchestrator.
   *
   * @param session session used for every call
   * @param conflictPolicy policy wrapped around submissions, null for defaults
   * @param timings settle and poll delays, null for defaults
   * @param clock source of the submission timestamp, null for UTC system clock
   */
  public RefreshOrchestrator(
      final HttpSession session,
      final HttpRetry.ConflictPolicy conflictPolicy,
      final RefreshTimings timings,
      final Clock clock) {
    if (session == null) throw new IllegalArgumentException("session is required");
    this.session = session;
    this.conflictPolicy =
        conflictPolicy == null ? HttpRetry.ConflictPolicy.defaults() : conflictPolicy;
    this.timings = timings == null ? RefreshTimings.defaults() : timings;
    this.clock = clock == null ? Clock.systemUTC() : clock;
  }

  /**
   * Lists the refresh history of a resource, oldest first.
   *
   * @param resource dataset or dataflow attached to its group
   * @return Mono emitting the entries sorted by start time
   */
  public Mono<List<RefreshRecord>> history(final Refreshable resource) {
    final Mono<List<RefreshRecord>> records;
    if (resource instanceof Dataset dataset) {
      records =
          session
              .getValues(dataset.refreshHistoryPath(), Refresh.class)
              .map(
                  list ->
                      list.stream()
                          .map(refresh -> (RefreshRecord) refresh.withDataset(dataset))
                          .toList());
    } else {
      final var dataflow = (Dataflow) resource;
      records =
          session
              .getValues(dataflow.refreshHistoryPath(), Transaction.class)
              .map(
                  list ->
                      list.stream()
                          .map(transaction -> (RefreshRecord) transaction.withDataflow(dataflow))
                          .toList());
    }
    return records.map(list -> list.stream().sorted(BY_START).toList());
  }

  /**
   * Returns the most recently started history entry.
   *
   * @param resource dataset or dataflow
   * @return Mono emitting the latest entry, empty when the resource was never refreshed
   */
  public Mono<RefreshRecord> getLastRefresh(final Refreshable resource) {
    return history(resource)
        .flatMap(list -> list.isEmpty() ? Mono.empty() : Mono.just(list.get(list.size() - 1)));
  }

  public Mono<RefreshState> state(final Refreshable resource) {
    return getLastRefresh(resource)
        .map(Optional::of)
        .defaultIfEmpty(Optional.empty())
        .map(RefreshState::of);
  }

  /**
   * Refreshes a resource.
   *
   * @param resource dataset or dataflow
   * @param options force, wait, type and timeout
   * @return Mono emitting what was done; fails with {@link java.util.concurrent.TimeoutException}
   *     when {@code options.timeout()} elapses first
   */
  public Mono<RefreshOutcome> refresh(final Refreshable resource, final RefreshOptions options) {
    final var effective = options == null ? RefreshOptions.defaults() : options;
    final var pipeline =
        getLastRefresh(resource)
            .filter(RefreshRecord::isInProgress)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .flatMap(running -> decide(resource, running, effective));
    return effective.timeout() == null ? pipeline : pipeline.timeout(effective.timeout());
  }

  /**
   * Cancels the running refresh of a resource.
   *
   * @param resource dataset or dataflow
   * @return Mono emitting true when a cancel was sent, false when nothing was running
   */
  public Mono<Boolean> cancel(final Refreshable resource) {
    return getLastRefresh(resource)
        .filter(RefreshRecord::isInProgress)
        .flatMap(running -> sendCancel(running).thenReturn(Boolean.TRUE))
        .switchIfEmpty(
            Mono.fromSupplier(
                () -> {
                  LOGGER.log(
                      ERROR,
                      "Cannot cancel {0} ''{1}'': no refresh in progress",
                      kind(resource),
                      resource.name());
                  return Boolean.FALSE;
                }));
  }

  private Mono<RefreshOutcome> decide(
      final Refreshable resource,
      final Optional<RefreshRecord> running,
      final RefreshOptions options) {
    if (running.isEmpty()) {
      return submit(resource, options)
          .map(done -> new RefreshOutcome.Started(resource, done.orElse(null)));
    }

    final var current = running.get();
    if (!options.force()) {
      LOGGER.log(
          INFO,
          "Refresh of {0} ''{1}'' already in progress since {2}, skipping",
          kind(resource),
          resource.name(),
          current.startTime());
      return Mono.just(new RefreshOutcome.SkippedInProgress(resource, current));
    }

    return sendCancel(current)
        .then(Mono.delay(timings.settleDelay()))
        .then(submit(resource, options))
        .map(done -> new RefreshOutcome.CancelledAndStarted(resource, current, done.orElse(null)));
  }

  private Mono<Optional<RefreshRecord>> submit(
      final Refreshable resource, final RefreshOptions options) {
    return Mono.<Optional<RefreshRecord>>defer(
        () -> {
          final var submittedAt = clock.instant();
          LOGGER.log(INFO, "Submitting refresh of {0} ''{1}''", kind(resource), resource.name());
          final var body = resource.refreshRequestBody(options.refreshType());
          final var accepted =
              session
                  .post(resource.startRefreshPath(), body)
                  .retryWhen(HttpRetry.onConflict(conflictPolicy));
          if (!options.waitForCompletion()) {
            return accepted.thenReturn(Optional.<RefreshRecord>empty());
          }
          return accepted.then(awaitCompletion(resource, submittedAt)).map(Optional::of);
        });
  }

  private Mono<RefreshRecord> awaitCompletion(final Refreshable resource, final Instant since) {
    final var poll =
        Mono.defer(() -> startedSince(resource, since))
            .filter(entry -> !entry.isInProgress())
            .repeatWhenEmpty(polls -> polls.delayElements(timings.pollInterval()));
    return Mono.delay(timings.initialPollDelay())
        .then(poll)
        .doOnNext(
            entry ->
                LOGGER.log(
                    INFO,
                    "Refresh of {0} ''{1}'' finished with status {2} after {3}s",
                    kind(resource),
                    resource.name(),
                    entry.status(),
                    entry.duration().map(Duration::toSeconds).orElse(-1L)));
  }

  private Mono<RefreshRecord> startedSince(final Refreshable resource, final Instant since) {
    return history(resource)
        .flatMap(
            list ->
                Mono.justOrEmpty(
                    list.stream()
                        .filter(entry -> entry.startTime() != null)
                        .filter(entry -> entry.startTime().isAfter(since))
                        .findFirst()))
        .doOnNext(
            entry ->
                LOGGER.log(
                    DEBUG,
                    "Refresh of {0} ''{1}'' is {2}",
                    kind(resource),
                    resource.name(),
                    entry.status()))
        .switchIfEmpty(
            Mono.fromRunnable(
                () ->
                    LOGGER.log(
                        DEBUG,
                        "Refresh of {0} ''{1}'' not visible yet",
                        kind(resource),
                        resource.name())));
  }

  private Mono<Void> sendCancel(final RefreshRecord running) {
    final var resource = running.resource();
    LOGGER.log(
        INFO,
        "Cancelling refresh {0} of {1} ''{2}''",
        running.id(),
        kind(resource),
        resource.name());
    return session.request(running.cancelMethod(), running.cancelPath(), null, null).then();
  }

  private static String kind(final Refreshable resource) {
    return resource instanceof Dataset ? "dataset" : "dataflow";
  }
}
