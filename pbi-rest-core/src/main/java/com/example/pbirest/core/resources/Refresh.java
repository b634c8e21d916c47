package com.example.pbirest.core.resources;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** A dataset refresh. Its id is the {@code requestId} the API assigned to the submission. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Refresh(
    @JsonProperty("requestId") String id,
    String refreshType,
    @JsonDeserialize(using = Timestamps.LenientInstantDeserializer.class) Instant startTime,
    @JsonDeserialize(using = Timestamps.LenientInstantDeserializer.class) Instant endTime,
    RefreshStatus status,
    String extendedStatus,
    String serviceExceptionJson,
    JsonNode refreshAttempts,
    @JsonIgnore Dataset dataset)
    implements RefreshRecord {

  public Refresh {
    status = status == null ? RefreshStatus.FAILED : status;
  }

  public Refresh withDataset(final Dataset owner) {
    return new Refresh(
        id,
        refreshType,
        startTime,
        endTime,
        status,
        extendedStatus,
        serviceExceptionJson,
        refreshAttempts,
        owner);
  }

  @Override
  public Refreshable resource() {
    return dataset;
  }

  @Override
  public String cancelPath() {
    return dataset.path() + "/refreshes/" + id;
  }

  @Override
  public String cancelMethod() {
    return "DELETE";
  }

  @Override
  public Map<String, Object> toRow() {
    final Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", id);
    row.put("refreshType", refreshType);
    row.put("startTime", startTime);
    row.put("endTime", endTime);
    row.put("status", status.label());
    row.put("extendedStatus", extendedStatus);
    row.put("serviceExceptionJson", serviceExceptionJson);
    row.put("refreshAttempts", Rows.json(refreshAttempts));
    row.put("duration_seconds", duration().map(d -> d.toMillis() / 1000.0).orElse(null));
    row.put("dataset_id", dataset == null ? null : dataset.id());
    row.put("dataset_name", dataset == null ? null : dataset.name());
    row.put("group_id", dataset == null ? null : dataset.groupId());
    return row;
  }
}
