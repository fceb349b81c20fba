package com.recipedirectory.util;

import static org.junit.jupiter.api.Assertions.*;

import com.recipedirectory.AnalyticsServiceImpl.Analytics;
import com.recipedirectory.db.PopulatedRecipe;
import com.recipedirectory.db.Recipe;
import com.recipedirectory.db.User;
import com.recipedirectory.rest.dto.AnalyticsResponse;
import com.recipedirectory.rest.dto.PopulatedRecipeResponse;
import com.recipedirectory.rest.dto.RecipeResponse;
import com.recipedirectory.util.RestMapper.AuthorDetail;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

class RestMapperTest {

  private final User author =
      new User(new ObjectId(), "Julia", "julia@example.com", Instant.parse("2024-01-01T00:00:00Z"));
  private final Recipe recipe =
      new Recipe(
          new ObjectId(),
          "Soup",
          "Warm",
          List.of("water", "salt"),
          "Boil.",
          author.userId(),
          6,
          Instant.parse("2024-05-01T10:15:30Z"));

  @Test
  void testRecipeCarriesAuthorId() {
    RecipeResponse response = RestMapper.toResponse(recipe);

    assertEquals(recipe.recipeId().toHexString(), response.id());
    assertEquals(author.userId().toHexString(), response.author());
    assertEquals("Warm", response.description());
    assertEquals(List.of("water", "salt"), response.ingredients());
    assertEquals(6L, response.views());
  }

  @Test
  void testAuthorDetail() {
    PopulatedRecipe populated = new PopulatedRecipe(recipe, author);

    PopulatedRecipeResponse summary = RestMapper.toResponse(populated, AuthorDetail.SUMMARY);
    assertEquals("Julia", summary.author().name());
    assertNull(summary.author().createdAt());

    PopulatedRecipeResponse full = RestMapper.toResponse(populated, AuthorDetail.FULL);
    assertEquals(author.createdAt(), full.author().createdAt());

    assertNull(
        RestMapper.toResponse(new PopulatedRecipe(recipe, null), AuthorDetail.FULL).author());
  }

  @Test
  void testAnalytics() {
    AnalyticsResponse response =
        RestMapper.toResponse(new Analytics(1, 1, new BigDecimal("1.00"), recipe, null));

    assertEquals(recipe.recipeId().toHexString(), response.mostViewedRecipe().id());
    assertNull(response.leastViewedRecipe());
    assertEquals(new BigDecimal("1.00"), response.avgRecipesPerUser());
  }
}
