package com.recipedirectory.rest;

import com.google.common.base.Strings;
import com.recipedirectory.UserServiceImpl;
import com.recipedirectory.common.status.StatusOr;
import com.recipedirectory.db.User;
import com.recipedirectory.rest.dto.CreateUserRequest;
import com.recipedirectory.rest.dto.CreateUserResponse;
import com.recipedirectory.util.RestMapper;
import io.javalin.http.Context;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiRequestBody;
import io.javalin.openapi.OpenApiResponse;
import org.tinylog.Logger;

/** REST adapter for user-related endpoints. */
public class UserServiceRestAdapter implements RestAdapter {

  static final String MISSING_FIELDS_MESSAGE = "Name and Email are required.";

  private final UserServiceImpl userService;

  /**
   * Creates a new UserServiceRestAdapter.
   *
   * @param userService The service to delegate to
   */
  public UserServiceRestAdapter(UserServiceImpl userService) {
    this.userService = userService;
  }

  /**
   * Handles a REST request to create a user.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/add-user",
      methods = {HttpMethod.POST},
      summary = "Create a new user",
      description =
          "Creates a user with the given name and email. The email must be unique across users.",
      operationId = "addUser",
      tags = "Users",
      requestBody =
          @OpenApiRequestBody(
              description = "User details",
              required = true,
              content = @OpenApiContent(from = CreateUserRequest.class)),
      responses = {
        @OpenApiResponse(
            status = "201",
            description = "User created",
            content = @OpenApiContent(from = CreateUserResponse.class)),
        @OpenApiResponse(
            status = "400",
            description =
                "Missing name or email, a value that fails validation, or a duplicate email")
      })
  public void handleCreateUser(Context ctx) {
    CreateUserRequest request = readBody(ctx, CreateUserRequest.class);
    Logger.info("REST CreateUser request for email: {}", request.email());

    if (Strings.isNullOrEmpty(request.name()) || Strings.isNullOrEmpty(request.email())) {
      setMessage(ctx, 400, MISSING_FIELDS_MESSAGE);
      return;
    }

    StatusOr<User> userOr = userService.createUser(request.name(), request.email());
    if (userOr.isNotOk()) {
      setError(ctx, userOr.getStatus().getHttpCode(), userOr.getStatus().getMessage());
      return;
    }
    ctx.status(201)
        .json(CreateUserResponse.created(RestMapper.toResponse(userOr.getValue())));
  }
}
