package com.example.pbirest.core.resources;

import com.example.pbirest.core.PowerBiJson;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/** Helpers for the flat-row export of resources. */
public final class Rows {

  private Rows() {}

  /**
   * Flattens each element with {@link Exportable#toRow()}.
   *
   * @param elements resources or refresh records
   * @return one row per element, same order
   */
  public static List<Map<String, Object>> of(final Collection<? extends Exportable> elements) {
    return elements.stream().map(Exportable::toRow).toList();
  }

  static Object json(final JsonNode node) {
    return node == null || node.isNull() || node.isMissingNode() ? null : node.toString();
  }

  static Object json(final List<?> values) {
    return values == null ? null : PowerBiJson.mapper().valueToTree(values).toString();
  }
}
