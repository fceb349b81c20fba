package com.recipedirectory.rest.dto;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import java.io.IOException;
import java.math.BigDecimal;

/**
 * Writes the recipes-per-user average as a two-decimal string such as {@code "1.50"}. The
 * unscaled {@code 0} reported when there are no users is written as a number.
 */
public class AverageSerializer extends JsonSerializer<BigDecimal> {

  @Override
  public void serialize(BigDecimal value, JsonGenerator gen, SerializerProvider serializers)
      throws IOException {
    if (value.scale() == 0) {
      gen.writeNumber(value);
    } else {
      gen.writeString(value.toPlainString());
    }
  }
}
