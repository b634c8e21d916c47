package com.example.pbirest.core.resources;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Report(
    String id,
    String name,
    String reportType,
    String webUrl,
    String embedUrl,
    @JsonProperty("isFromPbix") boolean fromPbix,
    @JsonProperty("isOwnedByMe") boolean ownedByMe,
    String datasetId,
    String datasetWorkspaceId,
    String description,
    JsonNode reportFlags,
    List<JsonNode> users,
    List<JsonNode> subscriptions,
    @JsonIgnore Group group)
    implements Resource {

  public Report {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("Report id is required");
    users = users == null ? List.of() : List.copyOf(users);
    subscriptions = subscriptions == null ? List.of() : List.copyOf(subscriptions);
  }

  public Report withGroup(final Group owner) {
    return new Report(
        id,
        name,
        reportType,
        webUrl,
        embedUrl,
        fromPbix,
        ownedByMe,
        datasetId,
        datasetWorkspaceId,
        description,
        reportFlags,
        users,
        subscriptions,
        owner);
  }

  @Override
  public String groupId() {
    return group == null ? null : group.id();
  }

  public String path() {
    return "groups/" + attachedGroup().id() + "/reports/" + id;
  }

  public String pagesPath() {
    return path() + "/pages";
  }

  @Override
  public Map<String, Object> toRow() {
    final Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", id);
    row.put("name", name);
    row.put("reportType", reportType);
    row.put("webUrl", webUrl);
    row.put("embedUrl", embedUrl);
    row.put("isFromPbix", fromPbix);
    row.put("isOwnedByMe", ownedByMe);
    row.put("datasetId", datasetId);
    row.put("datasetWorkspaceId", datasetWorkspaceId);
    row.put("description", description);
    row.put("reportFlags", Rows.json(reportFlags));
    row.put("users", Rows.json(users));
    row.put("subscriptions", Rows.json(subscriptions));
    row.put("group_id", groupId());
    row.put("group_name", group == null ? null : group.name());
    return row;
  }

  private Group attachedGroup() {
    if (group == null) {
      throw new IllegalStateException("Report " + id + " is not attached to a group");
    }
    return group;
  }
}
