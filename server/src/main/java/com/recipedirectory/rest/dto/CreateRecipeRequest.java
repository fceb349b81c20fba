package com.recipedirectory.rest.dto;

import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;
import io.javalin.openapi.OpenApiRequired;
import io.javalin.openapi.OpenApiStringValidation;
import java.util.List;

/**
 * Request body for {@code POST /add-recipe}. There is no separate presence check: missing or
 * invalid fields are reported by recipe validation.
 */
@OpenApiName("CreateRecipeRequest")
@OpenApiDescription("Request body for creating a recipe.")
public record CreateRecipeRequest(
    @OpenApiDescription("The recipe title. At least three characters.")
    @OpenApiExample("Chocolate Cake")
    @OpenApiRequired
    @OpenApiStringValidation(minLength = "3")
    String title,

    @OpenApiDescription("Free-text description.")
    @OpenApiExample("A rich, moist cake.")
    @OpenApiNullable
    String description,

    @OpenApiDescription("Ingredient lines, in order. May be empty.")
    @OpenApiRequired
    List<String> ingredients,

    @OpenApiDescription("Preparation instructions.")
    @OpenApiExample("Mix, pour, bake at 180C for 35 minutes.")
    @OpenApiRequired
    String instructions,

    @OpenApiDescription("ID of the user who wrote the recipe. Not checked for existence.")
    @OpenApiExample("665f1c2ab3e4d5f6a7b8c9d0")
    @OpenApiRequired
    String author) {}
