package com.recipedirectory.rest.dto;

import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiRequired;
import io.javalin.openapi.OpenApiStringValidation;

/**
 * Request body for {@code POST /add-user}.
 *
 * <p>Both fields are checked for presence by the adapter before the user is validated, so a
 * request missing either one is rejected with a fixed message.
 */
@OpenApiName("CreateUserRequest")
@OpenApiDescription("Request body for creating a user.")
public record CreateUserRequest(
    @OpenApiDescription("The user's name. At least three characters.")
    @OpenApiExample("Julia Child")
    @OpenApiRequired
    @OpenApiStringValidation(minLength = "3")
    String name,

    @OpenApiDescription("The user's email address. Must be unique.")
    @OpenApiExample("julia@example.com")
    @OpenApiRequired
    @OpenApiStringValidation(format = "email")
    String email) {}
