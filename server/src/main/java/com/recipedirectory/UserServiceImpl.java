package com.recipedirectory;

import com.google.common.collect.ImmutableList;
import com.mongodb.client.MongoDatabase;
import com.recipedirectory.common.status.StatusOr;
import com.recipedirectory.db.User;
import com.recipedirectory.db.Users;
import com.recipedirectory.validation.UserValidator;
import com.recipedirectory.validation.Violation;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import org.bson.types.ObjectId;
import org.tinylog.Logger;

/**
 * Implementation of the user service.
 *
 * <p>Users are only ever created; there is no lookup, update or delete through the API. Email
 * uniqueness is enforced by the unique index created at startup.
 */
public class UserServiceImpl {
  private final Config config;

  public record Config(MongoDatabase database) {}

  public UserServiceImpl(Config config) {
    this.config = config;
  }

  /**
   * Creates a user with a fresh ID and the current time as its creation timestamp.
   *
   * <p>Possible error codes:
   *
   * <ul>
   *   <li>INVALID_ARGUMENT: the name or email fails validation
   *   <li>ALREADY_EXISTS: another user already has this email
   *   <li>INTERNAL: the store rejected the write
   * </ul>
   *
   * @param name the user's name
   * @param email the user's email address
   * @return the stored user or an error status
   */
  public StatusOr<User> createUser(String name, String email) {
    Logger.info("Creating user with email {}", email);

    // Stored dates keep milliseconds only.
    Instant createdAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    User user = new User(new ObjectId(), name, email, createdAt);
    ImmutableList<Violation> violations = UserValidator.validate(user);
    if (!violations.isEmpty()) {
      StatusOr<User> rejected = StatusOr.ofStatus(Violation.toStatus("User", violations));
      Logger.warn("Rejected user: {}", rejected.getStatus().getMessage());
      return rejected;
    }

    StatusOr<User> insertedOr = Users.insert(config.database(), user);
    if (insertedOr.isOk()) {
      Logger.info("Created user {}", user.userId());
    } else {
      Logger.error("Failed to create user: {}", insertedOr.getStatus());
    }
    return insertedOr;
  }
}
