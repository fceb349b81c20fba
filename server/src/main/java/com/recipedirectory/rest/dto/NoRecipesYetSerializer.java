package com.recipedirectory.rest.dto;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import java.io.IOException;

/** Writes an absent extremal recipe in the analytics response as a fixed placeholder string. */
public class NoRecipesYetSerializer extends JsonSerializer<Object> {

  public static final String PLACEHOLDER = "No recipes yet";

  @Override
  public void serialize(Object value, JsonGenerator gen, SerializerProvider serializers)
      throws IOException {
    gen.writeString(PLACEHOLDER);
  }
}
