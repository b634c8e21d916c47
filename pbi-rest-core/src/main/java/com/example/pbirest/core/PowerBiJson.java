package com.example.pbirest.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** Shared Jackson configuration for API payloads. */
public final class PowerBiJson {

  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private PowerBiJson() {}

  /**
   * Returns the process-wide mapper. {@link ObjectMapper} is thread-safe once configured.
   *
   * @return configured mapper
   */
  public static ObjectMapper mapper() {
    return MAPPER;
  }
}
