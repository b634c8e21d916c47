package com.example.pbirest.core.resources;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Timestamp parsing for API payloads, which mix {@code Z}, numeric offsets and zone-less values.
 * Zone-less values are UTC.
 */
public final class Timestamps {

  private Timestamps() {}

  /**
   * Parses an ISO-8601 date-time.
   *
   * @param text value to parse, may be null or blank
   * @return the instant, or null for null/blank input
   * @throws DateTimeParseException if the value is not an ISO-8601 date-time
   */
  public static Instant parse(final String text) {
    if (text == null || text.isBlank()) return null;
    final var parsed =
        DateTimeFormatter.ISO_DATE_TIME.parseBest(
            text.trim(), OffsetDateTime::from, LocalDateTime::from);
    if (parsed instanceof OffsetDateTime offsetDateTime) return offsetDateTime.toInstant();
    return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
  }

  /** Jackson binding for {@link #parse(String)}. */
  public static final class LenientInstantDeserializer extends StdDeserializer<Instant> {

    public LenientInstantDeserializer() {
      super(Instant.class);
    }

    @Override
    public Instant deserialize(final JsonParser parser, final DeserializationContext context)
        throws IOException {
      final var text = parser.getValueAsString();
      try {
        return parse(text);
      } catch (final DateTimeParseException e) {
        return (Instant) context.handleWeirdStringValue(Instant.class, text, e.getMessage());
      }
    }
  }
}
