package com.recipedirectory.rest.dto;

import io.javalin.openapi.OpenApiName;

/** Response of {@code POST /add-recipe}. */
@OpenApiName("CreateRecipeResponse")
public record CreateRecipeResponse(String message, RecipeResponse recipe) {

  public static CreateRecipeResponse added(RecipeResponse recipe) {
    return new CreateRecipeResponse("Recipe added successfully!", recipe);
  }
}
