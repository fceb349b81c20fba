package com.recipedirectory.db;

import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.in;

import com.google.common.collect.ImmutableMap;
import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.recipedirectory.common.status.StatusOr;
import com.recipedirectory.db.util.DbUtil;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nonnull;
import org.bson.Document;
import org.bson.types.ObjectId;

/**
 * DAO helper class for the 'users' collection.
 */
public final class Users {

  public static final String COLLECTION = "users";

  static final String NAME = "name";
  static final String EMAIL = "email";
  static final String CREATED_AT = "createdAt";

  private Users() {
    // Utility class
  }

  private static MongoCollection<Document> collection(MongoDatabase database) {
    return database.getCollection(COLLECTION);
  }

  /**
   * Creates the unique index on email. Safe to call on every startup.
   *
   * @param database the database handle
   * @return StatusOr containing the index name or an error
   */
  @Nonnull
  public static StatusOr<String> ensureIndexes(MongoDatabase database) {
    try {
      String indexName =
          collection(database)
              .createIndex(Indexes.ascending(EMAIL), new IndexOptions().unique(true));
      return StatusOr.ofValue(indexName);
    } catch (MongoException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Counts all users.
   *
   * @param database the database handle
   * @return StatusOr containing the number of users or an error
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
   * Loads a single user by ID.
   *
   * @param database the database handle
   * @param userId the ID of the user to load
   * @return StatusOr containing an Optional User or an error
   */
  @Nonnull
  public static StatusOr<Optional<User>> loadById(MongoDatabase database, ObjectId userId) {
    try {
      Document doc = collection(database).find(eq(DbUtil.ID_FIELD, userId)).first();
      if (doc == null) {
        return StatusOr.ofValue(Optional.empty());
      }
      return extractUser(doc).map(Optional::of);
    } catch (MongoException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Loads the users with the given IDs, keyed by ID. IDs with no matching user are absent from the
   * result.
   *
   * @param database the database handle
   * @param userIds the IDs to resolve
   * @return StatusOr containing the users found or an error
   */
  @Nonnull
  public static StatusOr<Map<ObjectId, User>> loadByIds(
      MongoDatabase database, Collection<ObjectId> userIds) {
    if (userIds.isEmpty()) {
      return StatusOr.ofValue(ImmutableMap.of());
    }
    try (MongoCursor<Document> cursor =
        collection(database).find(in(DbUtil.ID_FIELD, userIds)).iterator()) {
      ImmutableMap.Builder<ObjectId, User> result = ImmutableMap.builder();
      while (cursor.hasNext()) {
        StatusOr<User> userOr = extractUser(cursor.next());
        if (userOr.isNotOk()) {
          return StatusOr.ofStatus(userOr.getStatus());
        }
        result.put(userOr.getValue().userId(), userOr.getValue());
      }
      return StatusOr.ofValue(result.buildKeepingLast());
    } catch (MongoException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Inserts a new user. A second user with the same email is rejected by the unique index.
   *
   * @param database the database handle
   * @param user the User to insert; its ID must already be set
   * @return StatusOr containing the inserted user, ALREADY_EXISTS for a duplicate email, or an
   *     error
   */
  @Nonnull
  public static StatusOr<User> insert(MongoDatabase database, User user) {
    try {
      collection(database).insertOne(toDocument(user));
      return StatusOr.ofValue(user);
    } catch (MongoException e) {
      return DbUtil.fromMongoException(
          e, "A user with email '" + user.email() + "' already exists");
    }
  }

  /** Converts a User to its document form. */
  @Nonnull
  static Document toDocument(User user) {
    return new Document(DbUtil.ID_FIELD, user.userId())
        .append(NAME, user.name())
        .append(EMAIL, user.email())
        .append(CREATED_AT, DbUtil.toDate(user.createdAt()));
  }

  /** Extracts a User from a document of the 'users' collection. */
  @Nonnull
  static StatusOr<User> extractUser(Document doc) {
    StatusOr<ObjectId> userIdOr = DbUtil.getObjectId(doc, DbUtil.ID_FIELD);
    if (userIdOr.isNotOk()) {
      return StatusOr.ofStatus(userIdOr.getStatus());
    }

    StatusOr<Instant> createdAtOr = DbUtil.getInstant(doc, CREATED_AT);
    if (createdAtOr.isNotOk()) {
      return StatusOr.ofStatus(createdAtOr.getStatus());
    }

    return StatusOr.ofValue(
        new User(
            userIdOr.getValue(),
            doc.getString(NAME),
            doc.getString(EMAIL),
            createdAtOr.getValue()));
  }
}
