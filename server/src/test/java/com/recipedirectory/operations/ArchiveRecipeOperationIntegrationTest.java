package com.recipedirectory.operations;

import static org.junit.jupiter.api.Assertions.*;

import com.mongodb.client.MongoDatabase;
import com.recipedirectory.db.ArchivedRecipe;
import com.recipedirectory.db.ArchivedRecipes;
import com.recipedirectory.db.Recipe;
import com.recipedirectory.db.Recipes;
import com.recipedirectory.db.util.MongoTestHelper;
import com.recipedirectory.db.util.MongoTestHelper.MongoContext;
import com.recipedirectory.operations.ArchiveRecipeOperation.ArchiveResult;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

/** Runs the archive-and-delete operation against a real MongoDB. */
@Testcontainers(disabledWithoutDocker = true)
class ArchiveRecipeOperationIntegrationTest {

  private static MongoContext mongoContext;
  private static MongoDatabase database;

  private ArchiveRecipeOperation operation;

  @BeforeAll
  static void setUp() {
    mongoContext = MongoTestHelper.setupMongo("archive_operation_test");
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
    operation = new ArchiveRecipeOperation(database);
  }

  private static Recipe insertRecipe() {
    Recipe recipe =
        new Recipe(
            new ObjectId(),
            "Lemon Tart",
            "Sharp and sweet",
            List.of("lemons", "butter", "sugar"),
            "Blind bake, fill, chill.",
            new ObjectId(),
            12,
            Instant.now().truncatedTo(ChronoUnit.MILLIS));
    return Recipes.insert(database, recipe).getValue();
  }

  @Test
  void testArchivesThenDeletes() {
    Recipe recipe = insertRecipe();
    Instant before = Instant.now().truncatedTo(ChronoUnit.MILLIS);

    ArchiveResult result = operation.execute(recipe.recipeId());

    assertEquals(ArchiveResult.success(), result);
    assertEquals(Optional.empty(), Recipes.loadById(database, recipe.recipeId()).getValue());
    ArchivedRecipe archived =
        ArchivedRecipes.loadById(database, recipe.recipeId()).getValue().orElseThrow();
    assertEquals(recipe, archived.recipe());
    assertFalse(archived.archivedAt().isBefore(before));
  }

  @Test
  void testMissingRecipe_WritesNoArchive() {
    ArchiveResult result = operation.execute(new ObjectId());

    assertEquals(ArchiveResult.notFound(false), result);
    assertEquals(0L, ArchivedRecipes.count(database).getValue());
  }

  @Test
  void testAlreadyArchived_LeavesRecipeInPlace() {
    Recipe recipe = insertRecipe();
    ArchivedRecipes.insert(database, new ArchivedRecipe(recipe, Instant.now())).getValue();

    ArchiveResult result = operation.execute(recipe.recipeId());

    assertFalse(result.isSuccess());
    assertTrue(result.errorMessage().contains("already archived"));
    assertTrue(Recipes.loadById(database, recipe.recipeId()).getValue().isPresent());
  }
}
