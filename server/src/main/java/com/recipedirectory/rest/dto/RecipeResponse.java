package com.recipedirectory.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import java.time.Instant;
import java.util.List;

/** A recipe as returned by the API, with the author as a bare user ID. */
@OpenApiName("Recipe")
@OpenApiDescription("Recipe information with the author's ID")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecipeResponse(
    @JsonProperty("_id")
    @OpenApiDescription("The unique identifier of the recipe")
    @OpenApiExample("665f1d00b3e4d5f6a7b8c9d1")
    String id,

    @OpenApiDescription("The recipe title")
    String title,

    @OpenApiDescription("Free-text description, absent when never set")
    String description,

    @OpenApiDescription("Ingredient lines, in order")
    List<String> ingredients,

    @OpenApiDescription("Preparation instructions")
    String instructions,

    @OpenApiDescription("ID of the user who wrote the recipe")
    String author,

    @OpenApiDescription("Number of times the recipe has been viewed")
    long views,

    @OpenApiDescription("Timestamp when the recipe was created")
    Instant createdAt) {}
