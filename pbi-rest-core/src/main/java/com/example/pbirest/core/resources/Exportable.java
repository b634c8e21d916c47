package com.example.pbirest.core.resources;

import java.util.Map;

/** Something that flattens to one row of named fields for tabular consumers. */
public interface Exportable {

  /**
   * Returns the exportable fields in a stable order. Nested references are flattened into
   * prefixed keys such as {@code group_name}; nested JSON structures are rendered as JSON text.
   *
   * @return insertion-ordered field map, values may be null
   */
  Map<String, Object> toRow();
}
