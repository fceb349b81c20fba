package com.recipedirectory.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** The Jackson configuration shared by the HTTP layer and the tests. */
public final class JsonUtil {

  private JsonUtil() {
    // Utility class, no instances
  }

  /**
   * Creates an ObjectMapper that writes timestamps as ISO-8601 strings and ignores unknown request
   * properties.
   */
  public static ObjectMapper newObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }
}
