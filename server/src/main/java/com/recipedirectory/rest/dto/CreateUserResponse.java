package com.recipedirectory.rest.dto;

import io.javalin.openapi.OpenApiName;

/** Response of {@code POST /add-user}. */
@OpenApiName("CreateUserResponse")
public record CreateUserResponse(String message, UserResponse user) {

  public static CreateUserResponse created(UserResponse user) {
    return new CreateUserResponse("User successfully created!", user);
  }
}
