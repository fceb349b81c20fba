package com.recipedirectory.rest;

import static io.javalin.apibuilder.ApiBuilder.delete;
import static io.javalin.apibuilder.ApiBuilder.get;
import static io.javalin.apibuilder.ApiBuilder.path;
import static io.javalin.apibuilder.ApiBuilder.post;
import static io.javalin.apibuilder.ApiBuilder.put;

import com.recipedirectory.AnalyticsServiceImpl;
import com.recipedirectory.RecipeServiceImpl;
import com.recipedirectory.UserServiceImpl;
import io.javalin.config.RouterConfig;

/**
 * Factory for the REST adapters of all endpoints.
 *
 * <p>Creates one adapter per service and maps the public paths onto their handlers.
 */
public class RestAdapterFactory {

  private final UserServiceRestAdapter userAdapter;
  private final RecipeServiceRestAdapter recipeAdapter;
  private final AnalyticsRestAdapter analyticsAdapter;

  /**
   * Creates a new RestAdapterFactory for the given services.
   *
   * @param userService The user service
   * @param recipeService The recipe service
   * @param analyticsService The analytics service
   */
  public RestAdapterFactory(
      UserServiceImpl userService,
      RecipeServiceImpl recipeService,
      AnalyticsServiceImpl analyticsService) {
    this.userAdapter = new UserServiceRestAdapter(userService);
    this.recipeAdapter = new RecipeServiceRestAdapter(recipeService);
    this.analyticsAdapter = new AnalyticsRestAdapter(analyticsService);
  }

  /** Configures the Javalin router to use the REST adapters. */
  public void configureRoutes(RouterConfig router) {
    router.apiBuilder(
        () -> {
          post("/add-user", userAdapter::handleCreateUser);
          post("/add-recipe", recipeAdapter::handleCreateRecipe);
          put("/update-recipe/{recipeId}", recipeAdapter::handleUpdateRecipe);
          delete("/delete-recipe/{recipeId}", recipeAdapter::handleDeleteRecipe);

          path(
              "/recipes",
              () -> {
                get(recipeAdapter::handleListRecipes);
                get("/view/{recipeId}", recipeAdapter::handleIncrementView);
              });
          get("/recipe/{recipeId}", recipeAdapter::handleGetRecipe);

          get("/user-recipes/{userId}", recipeAdapter::handleListRecipesByUser);
          path(
              "/user/{userId}",
              () -> {
                get("/views", recipeAdapter::handleTotalViewsByUser);
                get("/highestviews", recipeAdapter::handleMostViewedByUser);
              });

          get("/analytics", analyticsAdapter::handleGetAnalytics);
        });
  }
}
