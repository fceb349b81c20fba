package com.recipedirectory.util;

import com.google.common.collect.ImmutableList;
import com.recipedirectory.AnalyticsServiceImpl;
import com.recipedirectory.db.PopulatedRecipe;
import com.recipedirectory.db.Recipe;
import com.recipedirectory.db.User;
import com.recipedirectory.db.util.ObjectIds;
import com.recipedirectory.rest.dto.AnalyticsResponse;
import com.recipedirectory.rest.dto.PopulatedRecipeResponse;
import com.recipedirectory.rest.dto.RecipeResponse;
import com.recipedirectory.rest.dto.UserResponse;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Utility class for converting stored records to the response DTOs of the REST API, with
 * identifiers rendered as hex strings.
 */
public final class RestMapper {

  /** How much of an embedded author a response carries. */
  public enum AuthorDetail {
    /** ID, name and email; used in recipe listings. */
    SUMMARY,
    /** Every user field; used when a single recipe is fetched. */
    FULL
  }

  private RestMapper() {
    // Utility class, no instances
  }

  public static UserResponse toResponse(User user) {
    return new UserResponse(
        ObjectIds.toHex(user.userId()), user.name(), user.email(), user.createdAt());
  }

  public static RecipeResponse toResponse(Recipe recipe) {
    return new RecipeResponse(
        ObjectIds.toHex(recipe.recipeId()),
        recipe.title(),
        recipe.description(),
        recipe.ingredients(),
        recipe.instructions(),
        ObjectIds.toHex(recipe.authorId()),
        recipe.views(),
        recipe.createdAt());
  }

  public static List<RecipeResponse> toResponses(List<Recipe> recipes) {
    return recipes.stream().map(RestMapper::toResponse).collect(ImmutableList.toImmutableList());
  }

  public static PopulatedRecipeResponse toResponse(PopulatedRecipe populated, AuthorDetail detail) {
    Recipe recipe = populated.recipe();
    return new PopulatedRecipeResponse(
        ObjectIds.toHex(recipe.recipeId()),
        recipe.title(),
        recipe.description(),
        recipe.ingredients(),
        recipe.instructions(),
        toAuthor(populated.author(), detail),
        recipe.views(),
        recipe.createdAt());
  }

  public static List<PopulatedRecipeResponse> toResponses(
      List<PopulatedRecipe> recipes, AuthorDetail detail) {
    return recipes.stream()
        .map(recipe -> toResponse(recipe, detail))
        .collect(ImmutableList.toImmutableList());
  }

  public static AnalyticsResponse toResponse(AnalyticsServiceImpl.Analytics analytics) {
    return new AnalyticsResponse(
        analytics.totalUsers(),
        analytics.totalRecipes(),
        analytics.avgRecipesPerUser(),
        analytics.mostViewed() == null ? null : toResponse(analytics.mostViewed()),
        analytics.leastViewed() == null ? null : toResponse(analytics.leastViewed()));
  }

  @Nullable
  private static UserResponse toAuthor(@Nullable User author, AuthorDetail detail) {
    if (author == null) {
      return null;
    }
    if (detail == AuthorDetail.SUMMARY) {
      return new UserResponse(ObjectIds.toHex(author.userId()), author.name(), author.email(), null);
    }
    return toResponse(author);
  }
}
