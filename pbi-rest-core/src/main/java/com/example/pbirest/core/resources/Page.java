package com.example.pbirest.core.resources;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A report page. Pages have no id of their own: {@link #id()} is the page order and {@link
 * #name()} the display name. The internal section name is kept as {@link #sectionName()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Page(
    @JsonProperty("name") String sectionName,
    String displayName,
    int order,
    @JsonIgnore Report report)
    implements Resource {

  public Page withReport(final Report owner) {
    return new Page(sectionName, displayName, order, owner);
  }

  @Override
  public String id() {
    return String.valueOf(order);
  }

  @Override
  public String name() {
    return displayName;
  }

  @Override
  public String groupId() {
    return report == null ? null : report.groupId();
  }

  @Override
  public Map<String, Object> toRow() {
    final Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", id());
    row.put("name", displayName);
    row.put("sectionName", sectionName);
    row.put("order", order);
    row.put("report_id", report == null ? null : report.id());
    row.put("report_name", report == null ? null : report.name());
    row.put("group_id", groupId());
    return row;
  }
}
