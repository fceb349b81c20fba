package com.recipedirectory;

import com.mongodb.client.MongoDatabase;
import com.recipedirectory.common.status.StatusOr;
import com.recipedirectory.db.Recipe;
import com.recipedirectory.db.Recipes;
import com.recipedirectory.db.Users;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/** Implementation of the analytics service: aggregate statistics over users and recipes. */
public class AnalyticsServiceImpl {
  private final Config config;

  public record Config(MongoDatabase database) {}

  /**
   * Aggregate statistics.
   *
   * @param totalUsers number of users
   * @param totalRecipes number of recipes
   * @param avgRecipesPerUser recipes per user with two fraction digits, zero when there are no
   *     users
   * @param mostViewed the recipe with the most views, or null when there are no recipes
   * @param leastViewed the recipe with the fewest views, or null when there are no recipes
   */
  public record Analytics(
      long totalUsers,
      long totalRecipes,
      BigDecimal avgRecipesPerUser,
      @Nullable Recipe mostViewed,
      @Nullable Recipe leastViewed) {}

  public AnalyticsServiceImpl(Config config) {
    this.config = config;
  }

  /**
   * Computes the current statistics. The counts and the two extremal lookups are independent
   * queries, so concurrent writes can make them disagree slightly.
   */
  public StatusOr<Analytics> getAnalytics() {
    MongoDatabase database = config.database();

    StatusOr<Long> usersOr = Users.count(database);
    if (usersOr.isNotOk()) {
      return StatusOr.ofStatus(usersOr.getStatus());
    }
    StatusOr<Long> recipesOr = Recipes.count(database);
    if (recipesOr.isNotOk()) {
      return StatusOr.ofStatus(recipesOr.getStatus());
    }
    StatusOr<Optional<Recipe>> mostViewedOr = Recipes.loadMostViewed(database);
    if (mostViewedOr.isNotOk()) {
      return StatusOr.ofStatus(mostViewedOr.getStatus());
    }
    StatusOr<Optional<Recipe>> leastViewedOr = Recipes.loadLeastViewed(database);
    if (leastViewedOr.isNotOk()) {
      return StatusOr.ofStatus(leastViewedOr.getStatus());
    }

    long totalUsers = usersOr.getValue();
    long totalRecipes = recipesOr.getValue();
    Logger.debug("Analytics: {} users, {} recipes", totalUsers, totalRecipes);
    return StatusOr.ofValue(
        new Analytics(
            totalUsers,
            totalRecipes,
            averagePerUser(totalRecipes, totalUsers),
            mostViewedOr.getValue().orElse(null),
            leastViewedOr.getValue().orElse(null)));
  }

  static BigDecimal averagePerUser(long totalRecipes, long totalUsers) {
    if (totalUsers == 0) {
      return BigDecimal.ZERO;
    }
    return BigDecimal.valueOf(totalRecipes)
        .divide(BigDecimal.valueOf(totalUsers), 2, RoundingMode.HALF_UP);
  }
}
