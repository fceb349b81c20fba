package com.recipedirectory.rest.dto;

import io.javalin.openapi.OpenApiName;

/** Response of {@code GET /recipes/view/{recipeId}}: the counter after the increment. */
@OpenApiName("ViewCountResponse")
public record ViewCountResponse(String message, long views) {

  public static ViewCountResponse incremented(long views) {
    return new ViewCountResponse("View incremented", views);
  }
}
