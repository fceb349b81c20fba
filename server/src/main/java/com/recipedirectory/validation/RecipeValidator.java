package com.recipedirectory.validation;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.recipedirectory.db.Recipe;
import java.util.Objects;

/**
 * Field constraints for recipes, applied to new recipes and to the merged result of an update.
 * The author reference is required but not checked against the users collection.
 */
public final class RecipeValidator {

  public static final int MIN_TITLE_LENGTH = 3;

  private RecipeValidator() {}

  /**
   * Checks a recipe before it is written.
   *
   * @return every violated constraint; empty when the recipe is valid
   */
  public static ImmutableList<Violation> validate(Recipe recipe) {
    ImmutableList.Builder<Violation> violations = ImmutableList.builder();

    if (Strings.isNullOrEmpty(recipe.title())) {
      violations.add(new Violation("title", "is required"));
    } else if (recipe.title().length() < MIN_TITLE_LENGTH) {
      violations.add(
          new Violation(
              "title", "must be at least %d characters long".formatted(MIN_TITLE_LENGTH)));
    }

    // An empty ingredient list is allowed; a missing one is not.
    if (recipe.ingredients() == null) {
      violations.add(new Violation("ingredients", "is required"));
    } else if (recipe.ingredients().stream().anyMatch(Objects::isNull)) {
      violations.add(new Violation("ingredients", "must not contain null entries"));
    }

    if (Strings.isNullOrEmpty(recipe.instructions())) {
      violations.add(new Violation("instructions", "is required"));
    }

    if (recipe.authorId() == null) {
      violations.add(new Violation("author", "is required"));
    }

    if (recipe.createdAt() == null) {
      violations.add(new Violation("createdAt", "is required"));
    }

    return violations.build();
  }
}
