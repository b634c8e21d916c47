package com.example.pbirest.core.resources;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The refresh schedule of a dataset. Shares the id and name of its dataset.
 *
 * <p>{@link #toPayload()} produces the PATCH body, wrapped in the {@code value} envelope the API
 * expects.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Schedule(
    List<String> days,
    List<String> times,
    boolean enabled,
    String localTimeZoneId,
    String notifyOption,
    @JsonIgnore Dataset dataset)
    implements Resource {

  public static final String DEFAULT_TIME_ZONE = "UTC";
  public static final String DEFAULT_NOTIFY_OPTION = "MailOnFailure";

  public Schedule {
    days = days == null ? List.of() : List.copyOf(days);
    times = times == null ? List.of() : List.copyOf(times);
  }

  /**
   * Creates a detached schedule suitable for {@code setSchedule}.
   *
   * @param days weekday names, e.g. {@code Monday}
   * @param times {@code HH:mm} times of day
   * @param enabled whether the schedule is active
   * @return schedule with UTC time zone and failure-only notification
   */
  public static Schedule of(
      final List<String> days, final List<String> times, final boolean enabled) {
    return new Schedule(days, times, enabled, DEFAULT_TIME_ZONE, DEFAULT_NOTIFY_OPTION, null);
  }

  public Schedule withDataset(final Dataset owner) {
    return new Schedule(days, times, enabled, localTimeZoneId, notifyOption, owner);
  }

  @Override
  public String id() {
    return dataset == null ? null : dataset.id();
  }

  @Override
  public String name() {
    return dataset == null ? null : dataset.name();
  }

  @Override
  public String groupId() {
    return dataset == null ? null : dataset.groupId();
  }

  public Map<String, Object> toPayload() {
    final Map<String, Object> value = new LinkedHashMap<>();
    value.put("days", days);
    value.put("times", times);
    value.put("enabled", enabled);
    value.put("localTimeZoneId", localTimeZoneId == null ? DEFAULT_TIME_ZONE : localTimeZoneId);
    value.put("notifyOption", notifyOption == null ? DEFAULT_NOTIFY_OPTION : notifyOption);
    return Map.of("value", value);
  }

  @Override
  public Map<String, Object> toRow() {
    final Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", id());
    row.put("name", name());
    row.put("days", String.join(",", days));
    row.put("times", String.join(",", times));
    row.put("enabled", enabled);
    row.put("localTimeZoneId", localTimeZoneId);
    row.put("notifyOption", notifyOption);
    row.put("group_id", groupId());
    return row;
  }
}
