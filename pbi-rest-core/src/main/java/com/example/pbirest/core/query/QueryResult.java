package com.example.pbirest.core.query;

import java.util.List;
import java.util.Map;

/**
 * Rows produced by one DAX query.
 *
 * @param query the DAX text that was executed
 * @param rows rows of the first result table, keyed by normalized column name
 */
public record QueryResult(String query, List<Map<String, Object>> rows) {

  public QueryResult {
    rows = rows == null ? List.of() : List.copyOf(rows);
  }

  /**
   * Column names in the order of the first row.
   *
   * @return column names, empty when there are no rows
   */
  public List<String> columns() {
    return rows.isEmpty() ? List.of() : List.copyOf(rows.get(0).keySet());
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }
}
