package com.recipedirectory.rest.dto;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import java.math.BigDecimal;

/**
 * Response of {@code GET /analytics}.
 *
 * <p>Counts are integers. The average is a string with two fraction digits (e.g. {@code "1.50"}),
 * or the number {@code 0} when there are no users. Each extremal recipe is written as the string
 * {@value NoRecipesYetSerializer#PLACEHOLDER} when there are no recipes.
 */
@OpenApiName("Analytics")
@OpenApiDescription("Aggregate statistics over users and recipes")
public record AnalyticsResponse(
    @OpenApiDescription("Number of users")
    long totalUsers,

    @OpenApiDescription("Number of recipes")
    long totalRecipes,

    @OpenApiDescription("Recipes per user, two decimal places; 0 when there are no users")
    @OpenApiExample("1.50")
    @JsonSerialize(using = AverageSerializer.class)
    BigDecimal avgRecipesPerUser,

    @JsonSerialize(nullsUsing = NoRecipesYetSerializer.class)
    @OpenApiDescription("The recipe with the most views, or \"No recipes yet\"")
    RecipeResponse mostViewedRecipe,

    @JsonSerialize(nullsUsing = NoRecipesYetSerializer.class)
    @OpenApiDescription("The recipe with the fewest views, or \"No recipes yet\"")
    RecipeResponse leastViewedRecipe) {}
