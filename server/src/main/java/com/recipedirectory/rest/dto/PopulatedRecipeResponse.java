package com.recipedirectory.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;
import java.time.Instant;
import java.util.List;

/**
 * A recipe with its author resolved to user data. The author is null when the referenced user
 * does not exist.
 */
@OpenApiName("PopulatedRecipe")
@OpenApiDescription("Recipe information with the author resolved")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PopulatedRecipeResponse(
    @JsonProperty("_id") String id,
    String title,
    String description,
    List<String> ingredients,
    String instructions,

    @JsonInclude(JsonInclude.Include.ALWAYS)
    @OpenApiDescription("The author, or null if the user no longer exists")
    @OpenApiNullable
    UserResponse author,

    long views,
    Instant createdAt) {}
