package com.example.pbirest.core.resources;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A dataflow. The API names its id {@code objectId}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Dataflow(
    @JsonProperty("objectId") String id,
    String name,
    String description,
    String configuredBy,
    String modelUrl,
    Integer generation,
    List<JsonNode> users,
    @JsonIgnore Group group)
    implements Refreshable {

  public Dataflow {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("Dataflow id is required");
    users = users == null ? List.of() : List.copyOf(users);
  }

  public Dataflow withGroup(final Group owner) {
    return new Dataflow(id, name, description, configuredBy, modelUrl, generation, users, owner);
  }

  @Override
  public String groupId() {
    return group == null ? null : group.id();
  }

  public String path() {
    return "groups/" + attachedGroup().id() + "/dataflows/" + id;
  }

  /** Group-level transactions root; cancellation is addressed there, not under the dataflow. */
  public String transactionsPath() {
    return "groups/" + attachedGroup().id() + "/dataflows/transactions";
  }

  @Override
  public String refreshHistoryPath() {
    return path() + "/transactions";
  }

  @Override
  public String startRefreshPath() {
    return path() + "/refreshes?processType=default";
  }

  /** Dataflow refreshes take no type; the body is an empty object. */
  @Override
  public Object refreshRequestBody(final String refreshType) {
    return Map.of();
  }

  @Override
  public Map<String, Object> toRow() {
    final Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", id);
    row.put("name", name);
    row.put("description", description);
    row.put("configuredBy", configuredBy);
    row.put("modelUrl", modelUrl);
    row.put("generation", generation);
    row.put("users", Rows.json(users));
    row.put("group_id", groupId());
    row.put("group_name", group == null ? null : group.name());
    return row;
  }

  private Group attachedGroup() {
    if (group == null) {
      throw new IllegalStateException("Dataflow " + id + " is not attached to a group");
    }
    return group;
  }
}
