package com.recipedirectory.rest;

import com.recipedirectory.RecipeServiceImpl;
import com.recipedirectory.common.status.Status;
import com.recipedirectory.common.status.StatusCode;
import com.recipedirectory.common.status.StatusOr;
import com.recipedirectory.db.PopulatedRecipe;
import com.recipedirectory.db.Recipe;
import com.recipedirectory.rest.dto.CreateRecipeRequest;
import com.recipedirectory.rest.dto.CreateRecipeResponse;
import com.recipedirectory.rest.dto.MessageResponse;
import com.recipedirectory.rest.dto.PopulatedRecipeResponse;
import com.recipedirectory.rest.dto.RecipeResponse;
import com.recipedirectory.rest.dto.TotalViewsResponse;
import com.recipedirectory.rest.dto.UpdateRecipeRequest;
import com.recipedirectory.rest.dto.UpdateRecipeResponse;
import com.recipedirectory.rest.dto.ViewCountResponse;
import com.recipedirectory.util.RestMapper;
import com.recipedirectory.util.RestMapper.AuthorDetail;
import io.javalin.http.Context;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiParam;
import io.javalin.openapi.OpenApiRequestBody;
import io.javalin.openapi.OpenApiResponse;
import java.util.List;
import org.bson.types.ObjectId;
import org.tinylog.Logger;

/**
 * REST adapter for recipe endpoints, including the per-user recipe views.
 *
 * <p>Identifiers in paths are 24-character hex strings; a malformed one is answered with 400
 * before the service is called.
 */
public class RecipeServiceRestAdapter implements RestAdapter {

  static final String DELETED_MESSAGE = "Recipe archived and deleted successfully.";

  private final RecipeServiceImpl recipeService;

  /**
   * Creates a new RecipeServiceRestAdapter.
   *
   * @param recipeService The service to delegate to
   */
  public RecipeServiceRestAdapter(RecipeServiceImpl recipeService) {
    this.recipeService = recipeService;
  }

  /**
   * Handles a REST request to create a recipe.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/add-recipe",
      methods = {HttpMethod.POST},
      summary = "Create a new recipe",
      description =
          "Creates a recipe with zero views. The author ID must be well formed but is not checked"
              + " against existing users.",
      operationId = "addRecipe",
      tags = "Recipes",
      requestBody =
          @OpenApiRequestBody(
              description = "Recipe details",
              required = true,
              content = @OpenApiContent(from = CreateRecipeRequest.class)),
      responses = {
        @OpenApiResponse(
            status = "201",
            description = "Recipe created",
            content = @OpenApiContent(from = CreateRecipeResponse.class)),
        @OpenApiResponse(status = "400", description = "The recipe fails validation")
      })
  public void handleCreateRecipe(Context ctx) {
    CreateRecipeRequest request = readBody(ctx, CreateRecipeRequest.class);
    Logger.info("REST CreateRecipe request: {}", request.title());

    StatusOr<Recipe> recipeOr = recipeService.createRecipe(request);
    if (recipeOr.isNotOk()) {
      setError(ctx, recipeOr.getStatus().getHttpCode(), recipeOr.getStatus().getMessage());
      return;
    }
    ctx.status(201).json(CreateRecipeResponse.added(RestMapper.toResponse(recipeOr.getValue())));
  }

  /**
   * Handles a REST request to partially update a recipe.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/update-recipe/{recipeId}",
      methods = {HttpMethod.PUT},
      summary = "Update a recipe",
      description =
          "Updates the supplied fields of a recipe and leaves the others unchanged. The merged"
              + " recipe must pass validation.",
      operationId = "updateRecipe",
      tags = "Recipes",
      pathParams = {
        @OpenApiParam(
            name = "recipeId",
            description = "The ID of the recipe to update",
            required = true,
            example = "665f1d00b3e4d5f6a7b8c9d1")
      },
      requestBody =
          @OpenApiRequestBody(
              description = "Fields to change",
              required = true,
              content = @OpenApiContent(from = UpdateRecipeRequest.class)),
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "Recipe updated",
            content = @OpenApiContent(from = UpdateRecipeResponse.class)),
        @OpenApiResponse(status = "400", description = "Malformed ID or invalid field values"),
        @OpenApiResponse(status = "404", description = "No recipe with this ID")
      })
  public void handleUpdateRecipe(Context ctx) {
    StatusOr<ObjectId> recipeIdOr = parsePathId(ctx, "recipeId", "recipe");
    if (recipeIdOr.isNotOk()) {
      return;
    }
    UpdateRecipeRequest request = readBody(ctx, UpdateRecipeRequest.class);
    Logger.info("REST UpdateRecipe request for ID: {}", recipeIdOr.getValue());

    StatusOr<Recipe> recipeOr = recipeService.updateRecipe(recipeIdOr.getValue(), request);
    if (recipeOr.isNotOk()) {
      respondWithStatus(ctx, recipeOr.getStatus());
      return;
    }
    ctx.status(200).json(UpdateRecipeResponse.updated(RestMapper.toResponse(recipeOr.getValue())));
  }

  /**
   * Handles a REST request to delete a recipe. A copy is kept in the archive.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/delete-recipe/{recipeId}",
      methods = {HttpMethod.DELETE},
      summary = "Archive and delete a recipe",
      description = "Copies the recipe into the archive collection, then deletes it.",
      operationId = "deleteRecipe",
      tags = "Recipes",
      pathParams = {
        @OpenApiParam(
            name = "recipeId",
            description = "The ID of the recipe to delete",
            required = true,
            example = "665f1d00b3e4d5f6a7b8c9d1")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "Recipe archived and deleted",
            content = @OpenApiContent(from = MessageResponse.class)),
        @OpenApiResponse(status = "400", description = "Malformed ID or the archive write failed"),
        @OpenApiResponse(status = "404", description = "No recipe with this ID")
      })
  public void handleDeleteRecipe(Context ctx) {
    StatusOr<ObjectId> recipeIdOr = parsePathId(ctx, "recipeId", "recipe");
    if (recipeIdOr.isNotOk()) {
      return;
    }
    Logger.info("REST DeleteRecipe request for ID: {}", recipeIdOr.getValue());

    Status status = recipeService.deleteRecipe(recipeIdOr.getValue());
    if (!status.isOk()) {
      respondWithStatus(ctx, status);
      return;
    }
    ctx.status(200).json(new MessageResponse(DELETED_MESSAGE));
  }

  /**
   * Handles a REST request to list recipes, optionally filtered by title.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/recipes",
      methods = {HttpMethod.GET},
      summary = "List recipes",
      description =
          "Lists all recipes with each author's ID, name and email. An optional title filter"
              + " matches a case-insensitive substring.",
      operationId = "listRecipes",
      tags = "Recipes",
      queryParams = {
        @OpenApiParam(
            name = "title",
            description = "Only return recipes whose title contains this text",
            required = false,
            example = "cake")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "Matching recipes",
            content = @OpenApiContent(from = PopulatedRecipeResponse[].class)),
        @OpenApiResponse(status = "400", description = "The store query failed")
      })
  public void handleListRecipes(Context ctx) {
    String titleFilter = ctx.queryParam("title");
    Logger.info("REST ListRecipes request with title filter: {}", titleFilter);

    StatusOr<List<PopulatedRecipe>> recipesOr = recipeService.listRecipes(titleFilter);
    if (recipesOr.isNotOk()) {
      setError(ctx, recipesOr.getStatus().getHttpCode(), recipesOr.getStatus().getMessage());
      return;
    }
    ctx.status(200).json(RestMapper.toResponses(recipesOr.getValue(), AuthorDetail.SUMMARY));
  }

  /**
   * Handles a REST request to fetch a recipe. Each fetch counts as a view.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/recipe/{recipeId}",
      methods = {HttpMethod.GET},
      summary = "Get a recipe",
      description =
          "Counts a view of the recipe and returns it with the incremented counter and its author.",
      operationId = "getRecipe",
      tags = "Recipes",
      pathParams = {
        @OpenApiParam(
            name = "recipeId",
            description = "The ID of the recipe",
            required = true,
            example = "665f1d00b3e4d5f6a7b8c9d1")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The recipe",
            content = @OpenApiContent(from = PopulatedRecipeResponse.class)),
        @OpenApiResponse(status = "400", description = "Malformed ID"),
        @OpenApiResponse(status = "404", description = "No recipe with this ID")
      })
  public void handleGetRecipe(Context ctx) {
    StatusOr<ObjectId> recipeIdOr = parsePathId(ctx, "recipeId", "recipe");
    if (recipeIdOr.isNotOk()) {
      return;
    }
    Logger.info("REST GetRecipe request for ID: {}", recipeIdOr.getValue());

    StatusOr<PopulatedRecipe> recipeOr = recipeService.getRecipe(recipeIdOr.getValue());
    if (recipeOr.isNotOk()) {
      respondWithStatus(ctx, recipeOr.getStatus());
      return;
    }
    ctx.status(200).json(RestMapper.toResponse(recipeOr.getValue(), AuthorDetail.FULL));
  }

  /**
   * Handles a REST request to count a view without returning the recipe.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/recipes/view/{recipeId}",
      methods = {HttpMethod.GET},
      summary = "Count a recipe view",
      description = "Increments the view counter of a recipe and returns the new value.",
      operationId = "incrementRecipeView",
      tags = "Recipes",
      pathParams = {
        @OpenApiParam(
            name = "recipeId",
            description = "The ID of the recipe",
            required = true,
            example = "665f1d00b3e4d5f6a7b8c9d1")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "View counted",
            content = @OpenApiContent(from = ViewCountResponse.class)),
        @OpenApiResponse(status = "400", description = "Malformed ID"),
        @OpenApiResponse(status = "404", description = "No recipe with this ID")
      })
  public void handleIncrementView(Context ctx) {
    StatusOr<ObjectId> recipeIdOr = parsePathId(ctx, "recipeId", "recipe");
    if (recipeIdOr.isNotOk()) {
      return;
    }

    StatusOr<Long> viewsOr = recipeService.incrementView(recipeIdOr.getValue());
    if (viewsOr.isNotOk()) {
      // This endpoint reports a missing recipe under "error", unlike the others.
      setError(ctx, viewsOr.getStatus().getHttpCode(), viewsOr.getStatus().getMessage());
      return;
    }
    ctx.status(200).json(ViewCountResponse.incremented(viewsOr.getValue()));
  }

  /**
   * Handles a REST request to list a user's recipes.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/user-recipes/{userId}",
      methods = {HttpMethod.GET},
      summary = "List a user's recipes",
      description = "Lists every recipe whose author is the given user. Authors are returned as IDs.",
      operationId = "listUserRecipes",
      tags = "Users",
      pathParams = {
        @OpenApiParam(
            name = "userId",
            description = "The author's user ID",
            required = true,
            example = "665f1c2ab3e4d5f6a7b8c9d0")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The user's recipes, possibly none",
            content = @OpenApiContent(from = RecipeResponse[].class)),
        @OpenApiResponse(status = "400", description = "Malformed ID")
      })
  public void handleListRecipesByUser(Context ctx) {
    StatusOr<ObjectId> userIdOr = parsePathId(ctx, "userId", "user");
    if (userIdOr.isNotOk()) {
      return;
    }

    StatusOr<List<Recipe>> recipesOr = recipeService.listRecipesByUser(userIdOr.getValue());
    if (recipesOr.isNotOk()) {
      setError(ctx, recipesOr.getStatus().getHttpCode(), recipesOr.getStatus().getMessage());
      return;
    }
    ctx.status(200).json(RestMapper.toResponses(recipesOr.getValue()));
  }

  /**
   * Handles a REST request for the total views across a user's recipes.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/user/{userId}/views",
      methods = {HttpMethod.GET},
      summary = "Total views of a user's recipes",
      description = "Sums the view counters of every recipe written by the user.",
      operationId = "getUserTotalViews",
      tags = "Users",
      pathParams = {
        @OpenApiParam(
            name = "userId",
            description = "The author's user ID",
            required = true,
            example = "665f1c2ab3e4d5f6a7b8c9d0")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The total, 0 for a user without recipes",
            content = @OpenApiContent(from = TotalViewsResponse.class)),
        @OpenApiResponse(status = "400", description = "Malformed ID")
      })
  public void handleTotalViewsByUser(Context ctx) {
    StatusOr<ObjectId> userIdOr = parsePathId(ctx, "userId", "user");
    if (userIdOr.isNotOk()) {
      return;
    }

    StatusOr<Long> totalOr = recipeService.totalViewsByUser(userIdOr.getValue());
    if (totalOr.isNotOk()) {
      setError(ctx, totalOr.getStatus().getHttpCode(), totalOr.getStatus().getMessage());
      return;
    }
    ctx.status(200).json(new TotalViewsResponse(totalOr.getValue()));
  }

  /**
   * Handles a REST request for a user's most viewed recipe.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/user/{userId}/highestviews",
      methods = {HttpMethod.GET},
      summary = "A user's most viewed recipe",
      description = "Returns the user's recipe with the highest view count. Ties are unspecified.",
      operationId = "getUserMostViewedRecipe",
      tags = "Users",
      pathParams = {
        @OpenApiParam(
            name = "userId",
            description = "The author's user ID",
            required = true,
            example = "665f1c2ab3e4d5f6a7b8c9d0")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The most viewed recipe",
            content = @OpenApiContent(from = RecipeResponse.class)),
        @OpenApiResponse(status = "400", description = "Malformed ID"),
        @OpenApiResponse(status = "404", description = "The user has no recipes")
      })
  public void handleMostViewedByUser(Context ctx) {
    StatusOr<ObjectId> userIdOr = parsePathId(ctx, "userId", "user");
    if (userIdOr.isNotOk()) {
      return;
    }

    StatusOr<Recipe> recipeOr = recipeService.mostViewedByUser(userIdOr.getValue());
    if (recipeOr.isNotOk()) {
      if (recipeOr.getStatus().getCode() == StatusCode.NOT_FOUND) {
        Logger.info("User {} has no recipes", userIdOr.getValue());
      }
      respondWithStatus(ctx, recipeOr.getStatus());
      return;
    }
    ctx.status(200).json(RestMapper.toResponse(recipeOr.getValue()));
  }
}
