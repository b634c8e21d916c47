package com.example.pbirest.core.resources;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** A dataflow refresh, which the API calls a transaction. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Transaction(
    String id,
    String refreshType,
    @JsonDeserialize(using = Timestamps.LenientInstantDeserializer.class) Instant startTime,
    @JsonDeserialize(using = Timestamps.LenientInstantDeserializer.class) Instant endTime,
    RefreshStatus status,
    JsonNode errorInfo,
    @JsonIgnore Dataflow dataflow)
    implements RefreshRecord {

  public Transaction {
    status = status == null ? RefreshStatus.FAILED : status;
  }

  public Transaction withDataflow(final Dataflow owner) {
    return new Transaction(id, refreshType, startTime, endTime, status, errorInfo, owner);
  }

  @Override
  public Refreshable resource() {
    return dataflow;
  }

  @Override
  public String cancelPath() {
    return dataflow.transactionsPath() + "/" + id + "/cancel";
  }

  @Override
  public String cancelMethod() {
    return "POST";
  }

  @Override
  public Map<String, Object> toRow() {
    final Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", id);
    row.put("refreshType", refreshType);
    row.put("startTime", startTime);
    row.put("endTime", endTime);
    row.put("status", status.label());
    row.put("errorInfo", Rows.json(errorInfo));
    row.put("duration_seconds", duration().map(d -> d.toMillis() / 1000.0).orElse(null));
    row.put("dataflow_id", dataflow == null ? null : dataflow.id());
    row.put("dataflow_name", dataflow == null ? null : dataflow.name());
    row.put("group_id", dataflow == null ? null : dataflow.groupId());
    return row;
  }
}
