package com.gentoro.codenexus.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gentoro.codenexus.exception.SerializationException;

public class JacksonUtility {

  // Snapshots on disk are pretty-printed so they stay diff-friendly.
  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
          .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
          .enable(SerializationFeature.INDENT_OUTPUT)
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  // Tool responses travel over stdio, keep them on one line.
  private static final ObjectMapper COMPACT_MAPPER =
      JSON_MAPPER.copy().disable(SerializationFeature.INDENT_OUTPUT);

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static String toCompactJson(Object object) {
    try {
      return COMPACT_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }
}
