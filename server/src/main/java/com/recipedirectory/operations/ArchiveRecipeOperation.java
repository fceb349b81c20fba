package com.recipedirectory.operations;

import com.mongodb.client.MongoDatabase;
import com.recipedirectory.common.status.StatusOr;
import com.recipedirectory.db.ArchivedRecipe;
import com.recipedirectory.db.ArchivedRecipes;
import com.recipedirectory.db.Recipe;
import com.recipedirectory.db.Recipes;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import org.bson.types.ObjectId;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.tinylog.Logger;

/**
 * Operation class for deleting a recipe and keeping a copy of it in the archive.
 *
 * <p>The two writes are not transactional. The archive copy is written whenever the lookup finds
 * the recipe, before the delete is attempted, so a recipe removed by a concurrent request between
 * the two steps leaves an archive copy behind while this call reports "not found". A failed delete
 * after a successful archive write is not rolled back either.
 */
public class ArchiveRecipeOperation {
  private final MongoDatabase database;

  /**
   * Creates a new ArchiveRecipeOperation.
   *
   * @param database the database holding the recipes and archive collections
   */
  public ArchiveRecipeOperation(MongoDatabase database) {
    this.database = database;
  }

  /**
   * Result of the archive-and-delete operation.
   *
   * @param archived whether an archive copy was written
   * @param deleted whether the recipe document was removed
   * @param errorMessage the failure, or null on success
   */
  public record ArchiveResult(boolean archived, boolean deleted, String errorMessage) {

    @NotNull
    @Contract(" -> new")
    public static ArchiveResult success() {
      return new ArchiveResult(true, true, null);
    }

    @NotNull
    @Contract("_ -> new")
    public static ArchiveResult notFound(boolean archived) {
      return new ArchiveResult(archived, false, null);
    }

    public static ArchiveResult error(String errorMessage) {
      return new ArchiveResult(false, false, errorMessage);
    }

    public boolean isSuccess() {
      return errorMessage == null;
    }
  }

  /**
   * Archives then deletes the recipe with the given ID.
   *
   * @param recipeId the recipe to remove
   * @return the outcome; {@code deleted()} is false when no recipe was removed
   */
  public ArchiveResult execute(ObjectId recipeId) {
    Logger.info("Archiving and deleting recipe {}", recipeId);

    StatusOr<Optional<Recipe>> recipeOr = Recipes.loadById(database, recipeId);
    if (recipeOr.isNotOk()) {
      Logger.error("Recipe lookup failed: {}", recipeOr.getStatus().getMessage());
      return ArchiveResult.error(recipeOr.getStatus().getMessage());
    }

    boolean archived = false;
    if (recipeOr.getValue().isPresent()) {
      ArchivedRecipe copy =
          new ArchivedRecipe(
              recipeOr.getValue().get(), Instant.now().truncatedTo(ChronoUnit.MILLIS));
      StatusOr<ArchivedRecipe> archiveOr = ArchivedRecipes.insert(database, copy);
      if (archiveOr.isNotOk()) {
        Logger.error("Failed to archive recipe {}: {}", recipeId, archiveOr.getStatus());
        return ArchiveResult.error(archiveOr.getStatus().getMessage());
      }
      archived = true;
    }

    StatusOr<Long> deletedOr = Recipes.delete(database, recipeId);
    if (deletedOr.isNotOk()) {
      Logger.error("Failed to delete recipe {}: {}", recipeId, deletedOr.getStatus());
      return ArchiveResult.error(deletedOr.getStatus().getMessage());
    }

    if (deletedOr.getValue() == 0) {
      if (archived) {
        Logger.warn(
            "Recipe {} was archived but removed by another request before deletion", recipeId);
      }
      return ArchiveResult.notFound(archived);
    }

    Logger.info("Recipe {} archived and deleted", recipeId);
    return ArchiveResult.success();
  }
}
