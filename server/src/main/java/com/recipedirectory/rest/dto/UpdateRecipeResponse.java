package com.recipedirectory.rest.dto;

import io.javalin.openapi.OpenApiName;

/** Response of {@code PUT /update-recipe/{recipeId}}. */
@OpenApiName("UpdateRecipeResponse")
public record UpdateRecipeResponse(String message, RecipeResponse updatedRecipe) {

  public static UpdateRecipeResponse updated(RecipeResponse recipe) {
    return new UpdateRecipeResponse("Recipe updated successfully!", recipe);
  }
}
