package com.recipedirectory.db;

import static org.junit.jupiter.api.Assertions.*;

import com.recipedirectory.common.status.StatusCode;
import com.recipedirectory.common.status.StatusOr;
import com.recipedirectory.db.util.MongoTestHelper;
import com.recipedirectory.db.util.MongoTestHelper.MongoContext;
import com.mongodb.client.MongoDatabase;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

/** Tests for the Users helper class against a real MongoDB. */
@Testcontainers(disabledWithoutDocker = true)
public class UsersTest {

  private static MongoContext mongoContext;
  private static MongoDatabase database;

  @BeforeAll
  static void setUp() {
    mongoContext = MongoTestHelper.setupMongo("users_test");
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

  // BSON dates keep milliseconds only.
  private static User newUser(String name, String email) {
    return new User(new ObjectId(), name, email, Instant.now().truncatedTo(ChronoUnit.MILLIS));
  }

  @Test
  void testInsertAndLoadById() {
    User user = newUser("Julia", "julia@example.com");

    assertTrue(Users.insert(database, user).isOk());

    StatusOr<Optional<User>> loadedOr = Users.loadById(database, user.userId());
    assertEquals(Optional.of(user), loadedOr.getValue());
  }

  @Test
  void testLoadById_ReturnsEmpty_WhenMissing() {
    assertEquals(Optional.empty(), Users.loadById(database, new ObjectId()).getValue());
  }

  @Test
  void testInsert_RejectsDuplicateEmail() {
    assertTrue(Users.insert(database, newUser("Julia", "julia@example.com")).isOk());

    StatusOr<User> duplicateOr = Users.insert(database, newUser("Other", "julia@example.com"));

    assertEquals(StatusCode.ALREADY_EXISTS, duplicateOr.getStatus().getCode());
    assertEquals(
        "A user with email 'julia@example.com' already exists",
        duplicateOr.getStatus().getMessage());
    assertEquals(1L, Users.count(database).getValue());
  }

  @Test
  void testLoadByIds_SkipsUnknownIds() {
    User julia = newUser("Julia", "julia@example.com");
    User james = newUser("James", "james@example.com");
    Users.insert(database, julia).getValue();
    Users.insert(database, james).getValue();

    Map<ObjectId, User> users =
        Users.loadByIds(database, List.of(julia.userId(), new ObjectId())).getValue();

    assertEquals(Map.of(julia.userId(), julia), users);
    assertTrue(Users.loadByIds(database, List.of()).getValue().isEmpty());
  }

  @Test
  void testEnsureIndexes_IsRepeatable() {
    assertTrue(Users.ensureIndexes(database).isOk());
    assertTrue(Users.ensureIndexes(database).isOk());
  }
}
