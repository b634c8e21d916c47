package com.example.pbirest.core.query;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.pbirest.core.PowerBiException;
import com.example.pbirest.core.PowerBiJson;
import com.example.pbirest.core.http.HttpSession;
import com.example.pbirest.core.resources.Dataset;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Runs DAX queries through the dataset {@code executeQueries} endpoint.
 *
 * <p>Each query is sent as its own request; several queries run concurrently and their results are
 * returned in query order. Only the first table of the first result is read. Column names such as
 * {@code Sales[Amount]} are reduced to {@code Amount}, and queries returning no rows are left out.
 */
public final class DaxQueryExecutor {

  private static final System.Logger LOGGER = System.getLogger(DaxQueryExecutor.class.getName());

  private static final Pattern QUALIFIED_COLUMN = Pattern.compile("^[^\\[]*\\[(.*)]$");

  private final HttpSession session;
  private final ObjectMapper mapper = PowerBiJson.mapper();

  public DaxQueryExecutor(final HttpSession session) {
    if (session == null) throw new IllegalArgumentException("session is required");
    this.session = session;
  }

  /**
   * Executes queries against one dataset.
   *
   * @param dataset target dataset, attached to its group
   * @param queries DAX statements
   * @return Mono emitting the non-empty results in query order
   */
  public Mono<List<QueryResult>> execute(final Dataset dataset, final List<String> queries) {
    if (queries == null || queries.isEmpty()) return Mono.just(List.of());
    LOGGER.log(
        INFO,
        "Executing {0} DAX queries on dataset ''{1}''",
        String.valueOf(queries.size()),
        dataset.name());
    return Flux.fromIterable(queries)
        .flatMapSequential(query -> executeOne(dataset, query))
        .filter(result -> !result.isEmpty())
        .collectList();
  }

  /**
   * Executes a single query.
   *
   * @param dataset target dataset
   * @param query DAX statement
   * @return Mono emitting the result, possibly with no rows
   */
  public Mono<QueryResult> executeOne(final Dataset dataset, final String query) {
    final var url = dataset.executeQueriesPath();
    return session
        .post(url, payload(query))
        .map(response -> new QueryResult(query, readRows(session.readTree(url, response))))
        .doOnNext(
            result ->
                LOGGER.log(DEBUG, "Query returned {0} rows", String.valueOf(result.rows().size())));
  }

  static Map<String, Object> payload(final String query) {
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("queries", List.of(Map.of("query", query)));
    body.put("serializerSettings", Map.of("includeNulls", true));
    return body;
  }

  static String normalizeColumn(final String column) {
    final var matcher = QUALIFIED_COLUMN.matcher(column);
    return matcher.matches() ? matcher.group(1) : column;
  }

  private List<Map<String, Object>> readRows(final JsonNode root) {
    final var error = root.path("error");
    if (!error.isMissingNode() && !error.isNull()) {
      throw new PowerBiException("DAX query failed: " + error);
    }
    final var rows = root.path("results").path(0).path("tables").path(0).path("rows");
    if (!rows.isArray()) return Collections.emptyList();

    final List<Map<String, Object>> converted = new ArrayList<>(rows.size());
    for (final var row : rows) {
      final Map<String, Object> values = new LinkedHashMap<>();
      row.fields()
          .forEachRemaining(
              field -> values.put(normalizeColumn(field.getKey()), toValue(field.getValue())));
      converted.add(values);
    }
    return converted;
  }

  private Object toValue(final JsonNode node) {
    try {
      return mapper.treeToValue(node, Object.class);
    } catch (final JsonProcessingException e) {
      throw new PowerBiException("Unreadable value " + node, e);
    }
  }
}
