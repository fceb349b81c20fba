package com.recipedirectory.db;

import static com.mongodb.client.model.Filters.eq;

import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.recipedirectory.common.status.StatusOr;
import com.recipedirectory.db.util.DbUtil;
import java.time.Instant;
import java.util.Optional;
import javax.annotation.Nonnull;
import org.bson.Document;
import org.bson.types.ObjectId;

/**
 * DAO helper class for the 'archivedrecipes' collection. The collection is an audit trail: the
 * service only writes to it.
 */
public final class ArchivedRecipes {

  public static final String COLLECTION = "archivedrecipes";

  static final String ARCHIVED_AT = "archivedAt";

  private ArchivedRecipes() {
    // Utility class
  }

  private static MongoCollection<Document> collection(MongoDatabase database) {
    return database.getCollection(COLLECTION);
  }

  /**
   * Inserts an archive copy under the recipe's own ID.
   *
   * @param database the database handle
   * @param archivedRecipe the copy to write
   * @return StatusOr containing the archived recipe, ALREADY_EXISTS if that recipe was already
   *     archived, or an error
   */
  @Nonnull
  public static StatusOr<ArchivedRecipe> insert(
      MongoDatabase database, ArchivedRecipe archivedRecipe) {
    try {
      Document doc =
          Recipes.toDocument(archivedRecipe.recipe())
              .append(ARCHIVED_AT, DbUtil.toDate(archivedRecipe.archivedAt()));
      collection(database).insertOne(doc);
      return StatusOr.ofValue(archivedRecipe);
    } catch (MongoException e) {
      return DbUtil.fromMongoException(
          e, "Recipe " + archivedRecipe.recipe().recipeId() + " is already archived");
    }
  }

  /**
   * Loads an archive copy by the ID of the recipe it was made from.
   *
   * @param database the database handle
   * @param recipeId the ID of the deleted recipe
   * @return StatusOr containing an Optional ArchivedRecipe or an error
   */
  @Nonnull
  public static StatusOr<Optional<ArchivedRecipe>> loadById(
      MongoDatabase database, ObjectId recipeId) {
    try {
      Document doc = collection(database).find(eq(DbUtil.ID_FIELD, recipeId)).first();
      if (doc == null) {
        return StatusOr.ofValue(Optional.empty());
      }
      StatusOr<Recipe> recipeOr = Recipes.extractRecipe(doc);
      if (recipeOr.isNotOk()) {
        return StatusOr.ofStatus(recipeOr.getStatus());
      }
      StatusOr<Instant> archivedAtOr = DbUtil.getInstant(doc, ARCHIVED_AT);
      if (archivedAtOr.isNotOk()) {
        return StatusOr.ofStatus(archivedAtOr.getStatus());
      }
      return StatusOr.ofValue(
          Optional.of(new ArchivedRecipe(recipeOr.getValue(), archivedAtOr.getValue())));
    } catch (MongoException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Counts archive copies.
   *
   * @param database the database handle
   * @return StatusOr containing the number of archived recipes or an error
   */
  @Nonnull
  public static StatusOr<Long> count(MongoDatabase database) {
    try {
      return StatusOr.ofValue(collection(database).countDocuments());
    } catch (MongoException e) {
      return StatusOr.ofException(e);
    }
  }
}
