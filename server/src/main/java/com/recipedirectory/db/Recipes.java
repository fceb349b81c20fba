package com.recipedirectory.db;

import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.regex;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.mongodb.MongoException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.Updates;
import com.recipedirectory.common.status.StatusOr;
import com.recipedirectory.db.util.DbUtil;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;

/**
 * DAO helper class for the 'recipes' collection.
 */
public final class Recipes {

  public static final String COLLECTION = "recipes";

  public static final String TITLE = "title";
  public static final String DESCRIPTION = "description";
  public static final String INGREDIENTS = "ingredients";
  public static final String INSTRUCTIONS = "instructions";
  public static final String AUTHOR = "author";
  public static final String VIEWS = "views";
  static final String CREATED_AT = "createdAt";

  private static final FindOneAndUpdateOptions RETURN_UPDATED =
      new FindOneAndUpdateOptions().returnDocument(ReturnDocument.AFTER);

  private Recipes() {
    // Utility class
  }

  private static MongoCollection<Document> collection(MongoDatabase database) {
    return database.getCollection(COLLECTION);
  }

  /**
   * Counts all recipes.
   *
   * @param database the database handle
   * @return StatusOr containing the number of recipes or an error
   */
  @Nonnull
  public static StatusOr<Long> count(MongoDatabase database) {
    try {
      return StatusOr.ofValue(collection(database).countDocuments());
    } catch (MongoException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Loads a single recipe by ID.
   *
   * @param database the database handle
   * @param recipeId the ID of the recipe to load
   * @return StatusOr containing an Optional Recipe or an error
   */
  @Nonnull
  public static StatusOr<Optional<Recipe>> loadById(MongoDatabase database, ObjectId recipeId) {
    return loadFirst(collection(database).find(eq(DbUtil.ID_FIELD, recipeId)));
  }

  /**
   * Loads all recipes, optionally restricted to titles containing {@code titleFilter}. The filter
   * is matched literally and case-insensitively.
   *
   * @param database the database handle
   * @param titleFilter substring to look for in titles, or null/empty for no filter
   * @return StatusOr containing the matching recipes or an error
   */
  @Nonnull
  public static StatusOr<List<Recipe>> find(MongoDatabase database, @Nullable String titleFilter) {
    Bson query =
        Strings.isNullOrEmpty(titleFilter)
            ? new Document()
            : regex(TITLE, Pattern.quote(titleFilter), "i");
    return loadAll(collection(database).find(query));
  }

  /**
   * Loads all recipes written by the given user.
   *
   * @param database the database handle
   * @param authorId the author's user ID
   * @return StatusOr containing the recipes or an error
   */
  @Nonnull
  public static StatusOr<List<Recipe>> loadByAuthor(MongoDatabase database, ObjectId authorId) {
    return loadAll(collection(database).find(eq(AUTHOR, authorId)));
  }

  /**
   * Loads the author's recipe with the most views. Ties are broken by the store's natural order.
   *
   * @param database the database handle
   * @param authorId the author's user ID
   * @return StatusOr containing the recipe, empty when the author has none, or an error
   */
  @Nonnull
  public static StatusOr<Optional<Recipe>> loadMostViewedByAuthor(
      MongoDatabase database, ObjectId authorId) {
    return loadFirst(
        collection(database).find(eq(AUTHOR, authorId)).sort(Sorts.descending(VIEWS)).limit(1));
  }

  /** Loads the recipe with the most views across all authors. */
  @Nonnull
  public static StatusOr<Optional<Recipe>> loadMostViewed(MongoDatabase database) {
    return loadFirst(collection(database).find().sort(Sorts.descending(VIEWS)).limit(1));
  }

  /** Loads the recipe with the fewest views across all authors. */
  @Nonnull
  public static StatusOr<Optional<Recipe>> loadLeastViewed(MongoDatabase database) {
    return loadFirst(collection(database).find().sort(Sorts.ascending(VIEWS)).limit(1));
  }

  /**
   * Inserts a new recipe.
   *
   * @param database the database handle
   * @param recipe the Recipe to insert; its ID must already be set
   * @return StatusOr containing the inserted recipe or an error
   */
  @Nonnull
  public static StatusOr<Recipe> insert(MongoDatabase database, Recipe recipe) {
    try {
      collection(database).insertOne(toDocument(recipe));
      return StatusOr.ofValue(recipe);
    } catch (MongoException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Applies an update to a single recipe and returns the document as it is after the update.
   *
   * @param database the database handle
   * @param recipeId the ID of the recipe to update
   * @param update the update to apply, e.g. a combination of {@code $set} operations
   * @return StatusOr containing the updated recipe, empty when no recipe has that ID, or an error
   */
  @Nonnull
  public static StatusOr<Optional<Recipe>> update(
      MongoDatabase database, ObjectId recipeId, Bson update) {
    try {
      Document doc =
          collection(database)
              .findOneAndUpdate(eq(DbUtil.ID_FIELD, recipeId), update, RETURN_UPDATED);
      if (doc == null) {
        return StatusOr.ofValue(Optional.empty());
      }
      return extractRecipe(doc).map(Optional::of);
    } catch (MongoException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Atomically adds one to the view counter of a recipe.
   *
   * @param database the database handle
   * @param recipeId the ID of the recipe that was viewed
   * @return StatusOr containing the recipe after the increment, empty when no recipe has that ID,
   *     or an error
   */
  @Nonnull
  public static StatusOr<Optional<Recipe>> incrementViews(
      MongoDatabase database, ObjectId recipeId) {
    return update(database, recipeId, Updates.inc(VIEWS, 1));
  }

  /**
   * Deletes a recipe by ID.
   *
   * @param database the database handle
   * @param recipeId the ID of the recipe to delete
   * @return StatusOr containing the number of deleted documents (0 or 1) or an error
   */
  @Nonnull
  public static StatusOr<Long> delete(MongoDatabase database, ObjectId recipeId) {
    try {
      return StatusOr.ofValue(
          collection(database).deleteOne(eq(DbUtil.ID_FIELD, recipeId)).getDeletedCount());
    } catch (MongoException e) {
      return StatusOr.ofException(e);
    }
  }

  @Nonnull
  private static StatusOr<Optional<Recipe>> loadFirst(FindIterable<Document> query) {
    try {
      Document doc = query.first();
      if (doc == null) {
        return StatusOr.ofValue(Optional.empty());
      }
      return extractRecipe(doc).map(Optional::of);
    } catch (MongoException e) {
      return StatusOr.ofException(e);
    }
  }

  @Nonnull
  private static StatusOr<List<Recipe>> loadAll(FindIterable<Document> query) {
    try (MongoCursor<Document> cursor = query.iterator()) {
      ImmutableList.Builder<Recipe> result = ImmutableList.builder();
      while (cursor.hasNext()) {
        StatusOr<Recipe> recipeOr = extractRecipe(cursor.next());
        if (recipeOr.isNotOk()) {
          return StatusOr.ofStatus(recipeOr.getStatus());
        }
        result.add(recipeOr.getValue());
      }
      return StatusOr.ofValue(result.build());
    } catch (MongoException e) {
      return StatusOr.ofException(e);
    }
  }

  /** Converts a Recipe to its document form. An absent description is left out. */
  @Nonnull
  static Document toDocument(Recipe recipe) {
    Document doc = new Document(DbUtil.ID_FIELD, recipe.recipeId()).append(TITLE, recipe.title());
    if (recipe.description() != null) {
      doc.append(DESCRIPTION, recipe.description());
    }
    return doc.append(INGREDIENTS, recipe.ingredients())
        .append(INSTRUCTIONS, recipe.instructions())
        .append(AUTHOR, recipe.authorId())
        .append(VIEWS, recipe.views())
        .append(CREATED_AT, DbUtil.toDate(recipe.createdAt()));
  }

  /** Extracts a Recipe from a document of the 'recipes' or 'archivedrecipes' collection. */
  @Nonnull
  static StatusOr<Recipe> extractRecipe(Document doc) {
    StatusOr<ObjectId> recipeIdOr = DbUtil.getObjectId(doc, DbUtil.ID_FIELD);
    if (recipeIdOr.isNotOk()) {
      return StatusOr.ofStatus(recipeIdOr.getStatus());
    }

    StatusOr<Optional<List<String>>> ingredientsOr =
        DbUtil.getOptionalStringList(doc, INGREDIENTS);
    if (ingredientsOr.isNotOk()) {
      return StatusOr.ofStatus(ingredientsOr.getStatus());
    }

    StatusOr<Optional<ObjectId>> authorIdOr = DbUtil.getOptionalObjectId(doc, AUTHOR);
    if (authorIdOr.isNotOk()) {
      return StatusOr.ofStatus(authorIdOr.getStatus());
    }

    StatusOr<Long> viewsOr = DbUtil.getLong(doc, VIEWS, 0L);
    if (viewsOr.isNotOk()) {
      return StatusOr.ofStatus(viewsOr.getStatus());
    }

    StatusOr<Instant> createdAtOr = DbUtil.getInstant(doc, CREATED_AT);
    if (createdAtOr.isNotOk()) {
      return StatusOr.ofStatus(createdAtOr.getStatus());
    }

    return StatusOr.ofValue(
        new Recipe(
            recipeIdOr.getValue(),
            doc.getString(TITLE),
            doc.getString(DESCRIPTION),
            ingredientsOr.getValue().orElse(ImmutableList.of()),
            doc.getString(INSTRUCTIONS),
            authorIdOr.getValue().orElse(null),
            viewsOr.getValue(),
            createdAtOr.getValue()));
  }
}
