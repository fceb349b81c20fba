package com.recipedirectory.rest.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;
import java.util.List;

/**
 * Request body for {@code PUT /update-recipe/{recipeId}}.
 *
 * <p>Every field is optional. Fields left out (or sent as null) keep their stored value; the
 * merged recipe must still pass recipe validation.
 */
@OpenApiName("UpdateRecipeRequest")
@OpenApiDescription("Partial update of a recipe. Omitted fields are left unchanged.")
public record UpdateRecipeRequest(
    @OpenApiDescription("New title. At least three characters.")
    @OpenApiExample("Dark Chocolate Cake")
    @OpenApiNullable
    String title,

    @OpenApiDescription("New description.")
    @OpenApiNullable
    String description,

    @OpenApiDescription("Replacement ingredient list.")
    @OpenApiNullable
    List<String> ingredients,

    @OpenApiDescription("New instructions.")
    @OpenApiNullable
    String instructions,

    @OpenApiDescription("New author ID.")
    @OpenApiNullable
    String author,

    @OpenApiDescription("New view count.")
    @OpenApiNullable
    Long views) {

  /** Returns true when the request carries no field to change. */
  @JsonIgnore
  public boolean isEmpty() {
    return title == null
        && description == null
        && ingredients == null
        && instructions == null
        && author == null
        && views == null;
  }
}
