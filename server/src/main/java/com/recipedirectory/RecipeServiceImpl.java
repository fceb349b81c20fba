package com.recipedirectory;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Updates;
import com.recipedirectory.common.status.Status;
import com.recipedirectory.common.status.StatusOr;
import com.recipedirectory.db.PopulatedRecipe;
import com.recipedirectory.db.Recipe;
import com.recipedirectory.db.Recipes;
import com.recipedirectory.db.User;
import com.recipedirectory.db.Users;
import com.recipedirectory.db.util.ObjectIds;
import com.recipedirectory.operations.ArchiveRecipeOperation;
import com.recipedirectory.rest.dto.CreateRecipeRequest;
import com.recipedirectory.rest.dto.UpdateRecipeRequest;
import com.recipedirectory.validation.RecipeValidator;
import com.recipedirectory.validation.Violation;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.tinylog.Logger;

/**
 * Implementation of the recipe service.
 *
 * <p>Every operation is a single request against the store except update (load, merge, validate,
 * write) and delete (load, archive, delete). Neither of those sequences is transactional.
 *
 * <p>Possible error codes across the service:
 *
 * <ul>
 *   <li>INVALID_ARGUMENT: a malformed ID or a recipe that fails validation
 *   <li>NOT_FOUND: no recipe with the requested ID
 *   <li>ALREADY_EXISTS: a recipe with this ID was archived before
 *   <li>INTERNAL: the store rejected the request
 * </ul>
 */
public class RecipeServiceImpl {
  static final String RECIPE_NOT_FOUND = "Recipe not found";
  static final String NO_RECIPES_FOUND = "No recipes found";

  private final Config config;

  public record Config(MongoDatabase database) {}

  public RecipeServiceImpl(Config config) {
    this.config = config;
  }

  /**
   * Creates a recipe with a fresh ID, zero views and the current time as its creation timestamp.
   * The author is not checked against the users collection.
   */
  public StatusOr<Recipe> createRecipe(CreateRecipeRequest request) {
    Logger.info("Creating recipe '{}'", request.title());

    StatusOr<Optional<ObjectId>> authorOr = parseOptionalAuthor(request.author());
    if (authorOr.isNotOk()) {
      return StatusOr.ofStatus(authorOr.getStatus());
    }
    return insertValidated(newRecipe(request, authorOr.getValue().orElse(null)));
  }

  private static Recipe newRecipe(CreateRecipeRequest request, @Nullable ObjectId authorId) {
    return new Recipe(
        new ObjectId(),
        request.title(),
        request.description(),
        request.ingredients(),
        request.instructions(),
        authorId,
        0L,
        Instant.now().truncatedTo(ChronoUnit.MILLIS));
  }

  private StatusOr<Recipe> insertValidated(Recipe recipe) {
    Status invalid = validate(recipe);
    if (!invalid.isOk()) {
      return StatusOr.ofStatus(invalid);
    }
    Recipe stored = withIngredientsCopy(recipe);
    StatusOr<Recipe> insertedOr = Recipes.insert(config.database(), stored);
    if (insertedOr.isOk()) {
      Logger.info("Created recipe {}", stored.recipeId());
    } else {
      Logger.error("Failed to create recipe: {}", insertedOr.getStatus());
    }
    return insertedOr;
  }

  /**
   * Applies a partial update. Fields absent from the request keep their stored value; the merged
   * recipe must pass validation before anything is written, and only the supplied fields are
   * written.
   */
  public StatusOr<Recipe> updateRecipe(ObjectId recipeId, UpdateRecipeRequest request) {
    Logger.info("Updating recipe {}", recipeId);

    StatusOr<Optional<Recipe>> existingOr = Recipes.loadById(config.database(), recipeId);
    if (existingOr.isNotOk()) {
      return StatusOr.ofStatus(existingOr.getStatus());
    }
    if (existingOr.getValue().isEmpty()) {
      return StatusOr.ofStatus(Status.notFound(RECIPE_NOT_FOUND));
    }
    Recipe existing = existingOr.getValue().get();

    ObjectId authorId = existing.authorId();
    if (request.author() != null) {
      StatusOr<Optional<ObjectId>> authorOr = parseOptionalAuthor(request.author());
      if (authorOr.isNotOk()) {
        return StatusOr.ofStatus(authorOr.getStatus());
      }
      authorId = authorOr.getValue().orElse(null);
    }

    Recipe merged =
        new Recipe(
            existing.recipeId(),
            request.title() != null ? request.title() : existing.title(),
            request.description() != null ? request.description() : existing.description(),
            request.ingredients() != null ? request.ingredients() : existing.ingredients(),
            request.instructions() != null ? request.instructions() : existing.instructions(),
            authorId,
            request.views() != null ? request.views() : existing.views(),
            existing.createdAt());
    Status invalid = validate(merged);
    if (!invalid.isOk()) {
      return StatusOr.ofStatus(invalid);
    }
    if (request.isEmpty()) {
      return StatusOr.ofValue(existing);
    }

    StatusOr<Optional<Recipe>> updatedOr =
        Recipes.update(config.database(), recipeId, toUpdate(withIngredientsCopy(merged), request));
    if (updatedOr.isNotOk()) {
      Logger.error("Failed to update recipe {}: {}", recipeId, updatedOr.getStatus());
      return StatusOr.ofStatus(updatedOr.getStatus());
    }
    return StatusOr.fromOptional(updatedOr.getValue(), RECIPE_NOT_FOUND);
  }

  private static Bson toUpdate(Recipe merged, UpdateRecipeRequest request) {
    List<Bson> sets = new ArrayList<>();
    if (request.title() != null) {
      sets.add(Updates.set(Recipes.TITLE, merged.title()));
    }
    if (request.description() != null) {
      sets.add(Updates.set(Recipes.DESCRIPTION, merged.description()));
    }
    if (request.ingredients() != null) {
      sets.add(Updates.set(Recipes.INGREDIENTS, merged.ingredients()));
    }
    if (request.instructions() != null) {
      sets.add(Updates.set(Recipes.INSTRUCTIONS, merged.instructions()));
    }
    if (request.author() != null) {
      sets.add(Updates.set(Recipes.AUTHOR, merged.authorId()));
    }
    if (request.views() != null) {
      sets.add(Updates.set(Recipes.VIEWS, merged.views()));
    }
    return Updates.combine(sets);
  }

  /** Archives then deletes a recipe. */
  public Status deleteRecipe(ObjectId recipeId) {
    ArchiveRecipeOperation.ArchiveResult result =
        new ArchiveRecipeOperation(config.database()).execute(recipeId);
    if (!result.isSuccess()) {
      return Status.internal(result.errorMessage(), null);
    }
    if (!result.deleted()) {
      return Status.notFound(RECIPE_NOT_FOUND);
    }
    return Status.ok();
  }

  /**
   * Lists recipes, optionally only those whose title contains {@code titleFilter}
   * case-insensitively, each with its author resolved.
   */
  public StatusOr<List<PopulatedRecipe>> listRecipes(@Nullable String titleFilter) {
    StatusOr<List<Recipe>> recipesOr = Recipes.find(config.database(), titleFilter);
    if (recipesOr.isNotOk()) {
      return StatusOr.ofStatus(recipesOr.getStatus());
    }
    List<Recipe> recipes = recipesOr.getValue();

    Set<ObjectId> authorIds =
        recipes.stream()
            .map(Recipe::authorId)
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());
    StatusOr<Map<ObjectId, User>> authorsOr = Users.loadByIds(config.database(), authorIds);
    if (authorsOr.isNotOk()) {
      return StatusOr.ofStatus(authorsOr.getStatus());
    }
    Map<ObjectId, User> authors = authorsOr.getValue();

    ImmutableList.Builder<PopulatedRecipe> result = ImmutableList.builder();
    for (Recipe recipe : recipes) {
      User author = recipe.authorId() == null ? null : authors.get(recipe.authorId());
      result.add(new PopulatedRecipe(recipe, author));
    }
    return StatusOr.ofValue(result.build());
  }

  /**
   * Counts a view of the recipe and returns it, as it is after the increment, with its author
   * resolved.
   */
  public StatusOr<PopulatedRecipe> getRecipe(ObjectId recipeId) {
    StatusOr<Recipe> recipeOr = incrementViews(recipeId);
    if (recipeOr.isNotOk()) {
      return StatusOr.ofStatus(recipeOr.getStatus());
    }
    Recipe recipe = recipeOr.getValue();
    if (recipe.authorId() == null) {
      return StatusOr.ofValue(new PopulatedRecipe(recipe, null));
    }
    StatusOr<Optional<User>> authorOr = Users.loadById(config.database(), recipe.authorId());
    if (authorOr.isNotOk()) {
      return StatusOr.ofStatus(authorOr.getStatus());
    }
    return StatusOr.ofValue(new PopulatedRecipe(recipe, authorOr.getValue().orElse(null)));
  }

  /** Counts a view of the recipe and returns the new counter value. */
  public StatusOr<Long> incrementView(ObjectId recipeId) {
    return incrementViews(recipeId).map(Recipe::views);
  }

  private StatusOr<Recipe> incrementViews(ObjectId recipeId) {
    StatusOr<Optional<Recipe>> updatedOr = Recipes.incrementViews(config.database(), recipeId);
    if (updatedOr.isNotOk()) {
      Logger.error("Failed to count view of recipe {}: {}", recipeId, updatedOr.getStatus());
      return StatusOr.ofStatus(updatedOr.getStatus());
    }
    return StatusOr.fromOptional(updatedOr.getValue(), RECIPE_NOT_FOUND);
  }

  /** Lists every recipe written by the user. */
  public StatusOr<List<Recipe>> listRecipesByUser(ObjectId userId) {
    return Recipes.loadByAuthor(config.database(), userId);
  }

  /** Sums the view counters of every recipe written by the user. */
  public StatusOr<Long> totalViewsByUser(ObjectId userId) {
    return listRecipesByUser(userId)
        .map(recipes -> recipes.stream().mapToLong(Recipe::views).sum());
  }

  /** Returns the user's recipe with the most views. Ties resolve in store order. */
  public StatusOr<Recipe> mostViewedByUser(ObjectId userId) {
    StatusOr<Optional<Recipe>> recipeOr =
        Recipes.loadMostViewedByAuthor(config.database(), userId);
    if (recipeOr.isNotOk()) {
      return StatusOr.ofStatus(recipeOr.getStatus());
    }
    return StatusOr.fromOptional(recipeOr.getValue(), NO_RECIPES_FOUND);
  }

  /** An absent author reference parses to empty, so validation reports it as missing. */
  private static StatusOr<Optional<ObjectId>> parseOptionalAuthor(@Nullable String author) {
    if (Strings.isNullOrEmpty(author)) {
      return StatusOr.ofValue(Optional.empty());
    }
    return ObjectIds.parse(author, "author").map(Optional::of);
  }

  private static Status validate(Recipe recipe) {
    ImmutableList<Violation> violations = RecipeValidator.validate(recipe);
    if (violations.isEmpty()) {
      return Status.ok();
    }
    Status status = Violation.toStatus("Recipe", violations);
    Logger.warn("Rejected recipe {}: {}", recipe.recipeId(), status.getMessage());
    return status;
  }

  private static Recipe withIngredientsCopy(Recipe recipe) {
    return new Recipe(
        recipe.recipeId(),
        recipe.title(),
        recipe.description(),
        ImmutableList.copyOf(recipe.ingredients()),
        recipe.instructions(),
        recipe.authorId(),
        recipe.views(),
        recipe.createdAt());
  }
}
