package com.recipedirectory.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import java.time.Instant;

/**
 * A user as returned by the API. When a user is embedded as a recipe's author in a listing only
 * the ID, name and email are filled in and {@code createdAt} is left out.
 */
@OpenApiName("User")
@OpenApiDescription("User information")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserResponse(
    @JsonProperty("_id")
    @OpenApiDescription("The unique identifier of the user")
    @OpenApiExample("665f1c2ab3e4d5f6a7b8c9d0")
    String id,

    @OpenApiDescription("The user's name")
    @OpenApiExample("Julia Child")
    String name,

    @OpenApiDescription("The user's email address")
    @OpenApiExample("julia@example.com")
    String email,

    @OpenApiDescription("Timestamp when the user was created")
    Instant createdAt) {}
