package com.example.pbirest.core.resources;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

/** A workspace. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Group(
    String id,
    String name,
    @JsonProperty("isReadOnly") boolean readOnly,
    String type,
    @JsonProperty("isOnDedicatedCapacity") boolean onDedicatedCapacity,
    String capacityId,
    String defaultDatasetStorageFormat)
    implements Resource {

  public static final String LIST_PATH = "groups";

  public Group {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("Group id is required");
  }

  @Override
  public String groupId() {
    return id;
  }

  public String datasetsPath() {
    return "groups/" + id + "/datasets";
  }

  public String dataflowsPath() {
    return "groups/" + id + "/dataflows";
  }

  public String reportsPath() {
    return "groups/" + id + "/reports";
  }

  @Override
  public Map<String, Object> toRow() {
    final Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", id);
    row.put("name", name);
    row.put("isReadOnly", readOnly);
    row.put("type", type);
    row.put("isOnDedicatedCapacity", onDedicatedCapacity);
    row.put("capacityId", capacityId);
    row.put("defaultDatasetStorageFormat", defaultDatasetStorageFormat);
    return row;
  }
}
