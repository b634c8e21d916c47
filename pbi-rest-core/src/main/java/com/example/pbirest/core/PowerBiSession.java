package com.example.pbirest.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.pbirest.core.http.HttpSession;
import com.example.pbirest.core.query.DaxQueryExecutor;
import com.example.pbirest.core.query.QueryResult;
import com.example.pbirest.core.refresh.RefreshOptions;
import com.example.pbirest.core.refresh.RefreshOrchestrator;
import com.example.pbirest.core.refresh.RefreshOutcome;
import com.example.pbirest.core.resources.Dataflow;
import com.example.pbirest.core.resources.Dataset;
import com.example.pbirest.core.resources.Group;
import com.example.pbirest.core.resources.Page;
import com.example.pbirest.core.resources.Refresh;
import com.example.pbirest.core.resources.RefreshRecord;
import com.example.pbirest.core.resources.Refreshable;
import com.example.pbirest.core.resources.Report;
import com.example.pbirest.core.resources.Resource;
import com.example.pbirest.core.resources.Schedule;
import com.example.pbirest.core.resources.Transaction;
import java.util.List;
import java.util.function.Function;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Operations over the Power BI REST API, bound to one {@link HttpSession}.
 *
 * <p>List operations taking several parents query them concurrently and return the children grouped
 * by parent, in the order the parents were given, each child attached to its parent.
 *
 * <p>Obtained from {@link PowerBiClient#openSession()}; close it to release the connection pool.
 */
public final class PowerBiSession implements AutoCloseable {

  private static final System.Logger LOGGER = System.getLogger(PowerBiSession.class.getName());

  private final HttpSession http;
  private final RefreshOrchestrator orchestrator;
  private final DaxQueryExecutor queries;

  PowerBiSession(
      final HttpSession http,
      final RefreshOrchestrator orchestrator,
      final DaxQueryExecutor queries) {
    this.http = http;
    this.orchestrator = orchestrator;
    this.queries = queries;
  }

  /** Low-level access for endpoints without a typed operation. */
  public HttpSession http() {
    return http;
  }

  public RefreshOrchestrator orchestrator() {
    return orchestrator;
  }

  // Groups

  public Mono<List<Group>> listGroups() {
    return http.getValues(Group.LIST_PATH, Group.class)
        .doOnNext(groups -> LOGGER.log(DEBUG, "Found {0} groups", String.valueOf(groups.size())));
  }

  public Mono<Group> findGroup(final String name) {
    return listGroups().map(groups -> byName(groups, "group", name));
  }

  // Datasets, dataflows, reports

  public Mono<List<Dataset>> listDatasets(final List<Group> groups) {
    return fanOut(
        groups,
        group ->
            http.getValues(group.datasetsPath(), Dataset.class)
                .map(list -> list.stream().map(d -> d.withGroup(group)).toList()));
  }

  public Mono<List<Dataset>> listDatasets(final Group... groups) {
    return listDatasets(List.of(groups));
  }

  public Mono<Dataset> findDataset(final Group group, final String name) {
    return listDatasets(group).map(datasets -> byName(datasets, "dataset", name));
  }

  public Mono<List<Dataflow>> listDataflows(final List<Group> groups) {
    return fanOut(
        groups,
        group ->
            http.getValues(group.dataflowsPath(), Dataflow.class)
                .map(list -> list.stream().map(d -> d.withGroup(group)).toList()));
  }

  public Mono<List<Dataflow>> listDataflows(final Group... groups) {
    return listDataflows(List.of(groups));
  }

  public Mono<Dataflow> findDataflow(final Group group, final String name) {
    return listDataflows(group).map(dataflows -> byName(dataflows, "dataflow", name));
  }

  public Mono<List<Report>> listReports(final List<Group> groups) {
    return fanOut(
        groups,
        group ->
            http.getValues(group.reportsPath(), Report.class)
                .map(list -> list.stream().map(r -> r.withGroup(group)).toList()));
  }

  public Mono<List<Report>> listReports(final Group... groups) {
    return listReports(List.of(groups));
  }

  public Mono<Report> findReport(final Group group, final String name) {
    return listReports(group).map(reports -> byName(reports, "report", name));
  }

  public Mono<List<Page>> listPages(final List<Report> reports) {
    return fanOut(
        reports,
        report ->
            http.getValues(report.pagesPath(), Page.class)
                .map(list -> list.stream().map(p -> p.withReport(report)).toList()));
  }

  public Mono<List<Page>> listPages(final Report... reports) {
    return listPages(List.of(reports));
  }

  // Schedules

  public Mono<Schedule> getSchedule(final Dataset dataset) {
    return http.getObject(dataset.schedulePath(), Schedule.class)
        .map(schedule -> schedule.withDataset(dataset));
  }

  /**
   * Replaces the refresh schedule of a dataset.
   *
   * @param dataset target dataset
   * @param schedule new schedule; its own dataset reference is ignored
   * @return Mono completing once the service accepted the change
   */
  public Mono<Void> setSchedule(final Dataset dataset, final Schedule schedule) {
    LOGGER.log(INFO, "Updating refresh schedule of dataset ''{0}''", dataset.name());
    return http.patch(dataset.schedulePath(), schedule.toPayload()).then();
  }

  // Refresh history

  public Mono<List<Refresh>> listRefreshes(final List<Dataset> datasets) {
    return fanOut(
        datasets,
        dataset ->
            orchestrator
                .history(dataset)
                .map(list -> list.stream().map(Refresh.class::cast).toList()));
  }

  public Mono<List<Refresh>> listRefreshes(final Dataset... datasets) {
    return listRefreshes(List.of(datasets));
  }

  public Mono<List<Transaction>> listTransactions(final List<Dataflow> dataflows) {
    return fanOut(
        dataflows,
        dataflow ->
            orchestrator
                .history(dataflow)
                .map(list -> list.stream().map(Transaction.class::cast).toList()));
  }

  public Mono<List<Transaction>> listTransactions(final Dataflow... dataflows) {
    return listTransactions(List.of(dataflows));
  }

  public Mono<RefreshRecord> getLastRefresh(final Refreshable resource) {
    return orchestrator.getLastRefresh(resource);
  }

  public Mono<RefreshOutcome> refresh(final Refreshable resource, final RefreshOptions options) {
    return orchestrator.refresh(resource, options);
  }

  public Mono<RefreshOutcome> refresh(final Refreshable resource) {
    return orchestrator.refresh(resource, RefreshOptions.defaults());
  }

  public Mono<Boolean> cancel(final Refreshable resource) {
    return orchestrator.cancel(resource);
  }

  // Queries

  public Mono<List<QueryResult>> executeQueries(final Dataset dataset, final List<String> dax) {
    return queries.execute(dataset, dax);
  }

  public Mono<List<QueryResult>> executeQueries(final Dataset dataset, final String... dax) {
    return executeQueries(dataset, List.of(dax));
  }

  @Override
  public void close() {
    http.close();
  }

  private static <P, C> Mono<List<C>> fanOut(
      final List<P> parents, final Function<P, Mono<List<C>>> children) {
    return Flux.fromIterable(parents)
        .flatMapSequential(parent -> children.apply(parent).flatMapIterable(list -> list))
        .collectList();
  }

  private static <R extends Resource> R byName(
      final List<R> candidates, final String kind, final String name) {
    return candidates.stream()
        .filter(candidate -> name != null && name.equals(candidate.name()))
        .findFirst()
        .orElseThrow(() -> new NotFoundException(kind, name));
  }
}
