package com.recipedirectory.db;

import static org.junit.jupiter.api.Assertions.*;

import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Updates;
import com.recipedirectory.db.util.MongoTestHelper;
import com.recipedirectory.db.util.MongoTestHelper.MongoContext;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

/** Tests for the Recipes helper class against a real MongoDB. */
@Testcontainers(disabledWithoutDocker = true)
public class RecipesTest {

  private static MongoContext mongoContext;
  private static MongoDatabase database;

  @BeforeAll
  static void setUp() {
    mongoContext = MongoTestHelper.setupMongo("recipes_test");
    database = mongoContext.getDatabase();
  }

  @AfterAll
  static void tearDown() {
    if (mongoContext != null) {
      mongoContext.close();
    }
  }

  @BeforeEach
  void clearData() {
    MongoTestHelper.clearCollections(database);
  }

  static Recipe newRecipe(String title, ObjectId authorId, long views) {
    return new Recipe(
        new ObjectId(),
        title,
        null,
        List.of("flour", "eggs"),
        "Mix and bake.",
        authorId,
        views,
        Instant.now().truncatedTo(ChronoUnit.MILLIS));
  }

  private static Recipe insert(String title, ObjectId authorId, long views) {
    return Recipes.insert(database, newRecipe(title, authorId, views)).getValue();
  }

  private static List<String> titles(List<Recipe> recipes) {
    return recipes.stream().map(Recipe::title).sorted().toList();
  }

  @Test
  void testInsertAndLoadById() {
    Recipe recipe = insert("Chocolate Cake", new ObjectId(), 0);

    assertEquals(Optional.of(recipe), Recipes.loadById(database, recipe.recipeId()).getValue());
    Document stored =
        database.getCollection(Recipes.COLLECTION).find(new Document("_id", recipe.recipeId())).first();
    assertFalse(stored.containsKey(Recipes.DESCRIPTION));
  }

  @Test
  void testFind_FiltersTitleCaseInsensitively() {
    ObjectId author = new ObjectId();
    insert("Chocolate Cake", author, 0);
    insert("Bread", author, 0);
    insert("Carrot Cake", author, 0);

    assertEquals(
        List.of("Carrot Cake", "Chocolate Cake"), titles(Recipes.find(database, "cake").getValue()));
    assertEquals(3, Recipes.find(database, "").getValue().size());
    assertEquals(3, Recipes.find(database, null).getValue().size());
  }

  @Test
  void testFind_TreatsFilterLiterally() {
    ObjectId author = new ObjectId();
    insert("Cake (vegan)", author, 0);
    insert("Cake vegan", author, 0);

    assertEquals(List.of("Cake (vegan)"), titles(Recipes.find(database, "(vegan)").getValue()));
    assertTrue(Recipes.find(database, ".*").getValue().isEmpty());
  }

  @Test
  void testLoadByAuthorAndMostViewed() {
    ObjectId author = new ObjectId();
    insert("Soup", author, 3);
    Recipe top = insert("Stew", author, 5);
    insert("Salad", author, 0);
    insert("Other", new ObjectId(), 100);

    assertEquals(3, Recipes.loadByAuthor(database, author).getValue().size());
    assertEquals(Optional.of(top), Recipes.loadMostViewedByAuthor(database, author).getValue());
    assertEquals(
        Optional.empty(), Recipes.loadMostViewedByAuthor(database, new ObjectId()).getValue());
  }

  @Test
  void testGlobalExtremes() {
    assertEquals(Optional.empty(), Recipes.loadMostViewed(database).getValue());
    assertEquals(Optional.empty(), Recipes.loadLeastViewed(database).getValue());

    insert("Soup", new ObjectId(), 3);
    insert("Stew", new ObjectId(), 9);
    insert("Salad", new ObjectId(), 1);

    assertEquals("Stew", Recipes.loadMostViewed(database).getValue().orElseThrow().title());
    assertEquals("Salad", Recipes.loadLeastViewed(database).getValue().orElseThrow().title());
    assertEquals(3L, Recipes.count(database).getValue());
  }

  @Test
  void testIncrementViews() {
    Recipe recipe = insert("Soup", new ObjectId(), 0);

    assertEquals(1L, Recipes.incrementViews(database, recipe.recipeId()).getValue().orElseThrow().views());
    assertEquals(2L, Recipes.incrementViews(database, recipe.recipeId()).getValue().orElseThrow().views());
    assertEquals(Optional.empty(), Recipes.incrementViews(database, new ObjectId()).getValue());
  }

  @Test
  void testUpdateReturnsDocumentAfterUpdate() {
    Recipe recipe = insert("Soup", new ObjectId(), 0);

    Recipe updated =
        Recipes.update(database, recipe.recipeId(), Updates.set(Recipes.TITLE, "Tomato Soup"))
            .getValue()
            .orElseThrow();

    assertEquals("Tomato Soup", updated.title());
    assertEquals(recipe.ingredients(), updated.ingredients());
  }

  @Test
  void testDelete() {
    Recipe recipe = insert("Soup", new ObjectId(), 0);

    assertEquals(1L, Recipes.delete(database, recipe.recipeId()).getValue());
    assertEquals(0L, Recipes.delete(database, recipe.recipeId()).getValue());
  }

  @Test
  void testExtractRecipe_ToleratesLegacyDocuments() {
    ObjectId id = new ObjectId();
    database
        .getCollection(Recipes.COLLECTION)
        .insertOne(
            new Document("_id", id)
                .append(Recipes.TITLE, "Old Recipe")
                .append(Recipes.INSTRUCTIONS, "Cook.")
                .append(Recipes.VIEWS, 7)
                .append("createdAt", new java.util.Date()));

    Recipe recipe = Recipes.loadById(database, id).getValue().orElseThrow();

    assertEquals(List.of(), recipe.ingredients());
    assertNull(recipe.authorId());
    assertEquals(7L, recipe.views());
  }
}
