package com.example.pbirest.core.resources;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A semantic model. Parsed from the API without its {@link #group()}, which is attached with
 * {@link #withGroup(Group)} by the session that listed it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Dataset(
    String id,
    String name,
    String webUrl,
    @JsonProperty("isRefreshable") boolean refreshable,
    @JsonDeserialize(using = Timestamps.LenientInstantDeserializer.class) Instant createdDate,
    String description,
    String configuredBy,
    boolean addRowsAPIEnabled,
    @JsonProperty("isEffectiveIdentityRequired") boolean effectiveIdentityRequired,
    @JsonProperty("isEffectiveIdentityRolesRequired") boolean effectiveIdentityRolesRequired,
    @JsonProperty("isOnPremGatewayRequired") boolean onPremGatewayRequired,
    String targetStorageMode,
    String createReportEmbedURL,
    String qnaEmbedURL,
    List<JsonNode> upstreamDatasets,
    List<JsonNode> users,
    JsonNode queryScaleOutSettings,
    @JsonIgnore Group group)
    implements Refreshable {

  /** Server-side cap on the dataset refresh history request. */
  public static final int HISTORY_LIMIT = 50;

  public static final String DEFAULT_REFRESH_TYPE = "Full";

  private static final int REFRESH_RETRY_COUNT = 3;

  public Dataset {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("Dataset id is required");
    upstreamDatasets = upstreamDatasets == null ? List.of() : List.copyOf(upstreamDatasets);
    users = users == null ? List.of() : List.copyOf(users);
  }

  public Dataset withGroup(final Group owner) {
    return new Dataset(
        id,
        name,
        webUrl,
        refreshable,
        createdDate,
        description,
        configuredBy,
        addRowsAPIEnabled,
        effectiveIdentityRequired,
        effectiveIdentityRolesRequired,
        onPremGatewayRequired,
        targetStorageMode,
        createReportEmbedURL,
        qnaEmbedURL,
        upstreamDatasets,
        users,
        queryScaleOutSettings,
        owner);
  }

  @Override
  public String groupId() {
    return group == null ? null : group.id();
  }

  /**
   * @throws IllegalStateException if this dataset was not attached with {@link #withGroup(Group)}
   */
  public String path() {
    return "groups/" + attachedGroup().id() + "/datasets/" + id;
  }

  @Override
  public String refreshHistoryPath() {
    return path() + "/refreshes?$top=" + HISTORY_LIMIT;
  }

  @Override
  public String startRefreshPath() {
    return path() + "/refreshes";
  }

  @Override
  public Object refreshRequestBody(final String refreshType) {
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("retryCount", REFRESH_RETRY_COUNT);
    body.put("type", refreshType == null ? DEFAULT_REFRESH_TYPE : refreshType);
    return body;
  }

  public String schedulePath() {
    return path() + "/refreshSchedule";
  }

  public String executeQueriesPath() {
    return path() + "/executeQueries";
  }

  @Override
  public Map<String, Object> toRow() {
    final Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", id);
    row.put("name", name);
    row.put("webUrl", webUrl);
    row.put("isRefreshable", refreshable);
    row.put("createdDate", createdDate);
    row.put("description", description);
    row.put("configuredBy", configuredBy);
    row.put("addRowsAPIEnabled", addRowsAPIEnabled);
    row.put("isEffectiveIdentityRequired", effectiveIdentityRequired);
    row.put("isEffectiveIdentityRolesRequired", effectiveIdentityRolesRequired);
    row.put("isOnPremGatewayRequired", onPremGatewayRequired);
    row.put("targetStorageMode", targetStorageMode);
    row.put("createReportEmbedURL", createReportEmbedURL);
    row.put("qnaEmbedURL", qnaEmbedURL);
    row.put("upstreamDatasets", Rows.json(upstreamDatasets));
    row.put("users", Rows.json(users));
    row.put("queryScaleOutSettings", Rows.json(queryScaleOutSettings));
    row.put("group_id", groupId());
    row.put("group_name", group == null ? null : group.name());
    return row;
  }

  private Group attachedGroup() {
    if (group == null) {
      throw new IllegalStateException("Dataset " + id + " is not attached to a group");
    }
    return group;
  }
}
