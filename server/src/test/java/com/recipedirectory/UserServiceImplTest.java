package com.recipedirectory;

import static org.junit.jupiter.api.Assertions.*;

import com.mongodb.client.MongoDatabase;
import com.recipedirectory.common.status.StatusCode;
import com.recipedirectory.common.status.StatusOr;
import com.recipedirectory.db.User;
import com.recipedirectory.db.Users;
import com.recipedirectory.db.util.MongoTestHelper;
import com.recipedirectory.db.util.MongoTestHelper.MongoContext;
import java.util.Optional;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class UserServiceImplTest {

  private static MongoContext mongoContext;
  private static MongoDatabase database;

  private UserServiceImpl userService;

  @BeforeAll
  static void setUp() {
    mongoContext = MongoTestHelper.setupMongo("user_service_test");
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
    userService = new UserServiceImpl(new UserServiceImpl.Config(database));
  }

  @Test
  void testCreateUser_IsRetrievable() {
    StatusOr<User> userOr = userService.createUser("Julia", "julia@example.com");

    assertTrue(userOr.isOk());
    User user = userOr.getValue();
    assertNotNull(user.userId());
    assertNotNull(user.createdAt());
    Optional<User> stored = Users.loadById(database, user.userId()).getValue();
    assertEquals("julia@example.com", stored.orElseThrow().email());
  }

  @Test
  void testCreateUser_DuplicateEmailFails() {
    userService.createUser("Julia", "julia@example.com").getValue();

    StatusOr<User> duplicateOr = userService.createUser("Julia Two", "julia@example.com");

    assertEquals(StatusCode.ALREADY_EXISTS, duplicateOr.getStatus().getCode());
    assertEquals(400, duplicateOr.getStatus().getHttpCode());
  }

  @Test
  void testCreateUser_InvalidFieldsAreNotStored() {
    StatusOr<User> userOr = userService.createUser("Al", "not-an-email");

    assertEquals(StatusCode.INVALID_ARGUMENT, userOr.getStatus().getCode());
    assertEquals(
        "User validation failed: name: must be at least 3 characters long,"
            + " email: is not a valid email address",
        userOr.getStatus().getMessage());
    assertEquals(0L, Users.count(database).getValue());
  }
}
