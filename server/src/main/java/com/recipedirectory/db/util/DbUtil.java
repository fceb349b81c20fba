package com.recipedirectory.db.util;

import com.google.common.collect.ImmutableList;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoWriteException;
import com.recipedirectory.common.status.Status;
import com.recipedirectory.common.status.StatusOr;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nonnull;
import org.bson.Document;
import org.bson.types.ObjectId;

/** Utility methods for reading and writing BSON documents. */
public final class DbUtil {

  /** Name of the identity field of every document. */
  public static final String ID_FIELD = "_id";

  private DbUtil() {
    // Utility class, no instances
  }

  /** Converts a BSON date (java.util.Date) to java.time.Instant. */
  @Nonnull
  public static Instant toInstant(Date date) {
    if (date == null) {
      throw new IllegalArgumentException("Date cannot be null");
    }
    return date.toInstant();
  }

  /** Converts a java.time.Instant to a BSON date (java.util.Date). */
  @Nonnull
  public static Date toDate(Instant instant) {
    if (instant == null) {
      throw new IllegalArgumentException("Instant cannot be null");
    }
    return Date.from(instant);
  }

  /** Gets a required ObjectId field from a document. */
  @Nonnull
  public static StatusOr<ObjectId> getObjectId(Document doc, String field) {
    Object value = doc.get(field);
    if (value instanceof ObjectId objectId) {
      return StatusOr.ofValue(objectId);
    }
    return StatusOr.ofStatus(
        Status.internal("Field '" + field + "' is missing or not an ObjectId", null));
  }

  /**
   * Gets an optional ObjectId field from a document, returning Optional.empty() if the field is
   * absent or null.
   */
  @Nonnull
  public static StatusOr<Optional<ObjectId>> getOptionalObjectId(Document doc, String field) {
    if (doc.get(field) == null) {
      return StatusOr.ofValue(Optional.empty());
    }
    return getObjectId(doc, field).map(Optional::of);
  }

  /** Gets a required date field from a document. */
  @Nonnull
  public static StatusOr<Instant> getInstant(Document doc, String field) {
    Object value = doc.get(field);
    if (value instanceof Date date) {
      return StatusOr.ofValue(date.toInstant());
    }
    return StatusOr.ofStatus(
        Status.internal("Field '" + field + "' is missing or not a date", null));
  }

  /**
   * Gets a numeric field as a long. Documents written by other clients may hold Int32, Int64 or
   * Double values; absent fields read as {@code defaultValue}.
   */
  @Nonnull
  public static StatusOr<Long> getLong(Document doc, String field, long defaultValue) {
    Object value = doc.get(field);
    if (value == null) {
      return StatusOr.ofValue(defaultValue);
    }
    if (value instanceof Number number) {
      return StatusOr.ofValue(number.longValue());
    }
    return StatusOr.ofStatus(Status.internal("Field '" + field + "' is not a number", null));
  }

  /**
   * Gets an array-of-strings field, returning Optional.empty() if the field is absent or null.
   * Non-string elements are rejected.
   */
  @Nonnull
  public static StatusOr<Optional<List<String>>> getOptionalStringList(Document doc, String field) {
    Object value = doc.get(field);
    if (value == null) {
      return StatusOr.ofValue(Optional.empty());
    }
    if (!(value instanceof List<?> list)) {
      return StatusOr.ofStatus(Status.internal("Field '" + field + "' is not an array", null));
    }
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (Object element : list) {
      if (!(element instanceof String string)) {
        return StatusOr.ofStatus(
            Status.internal("Field '" + field + "' contains a non-string element", null));
      }
      builder.add(string);
    }
    return StatusOr.ofValue(Optional.of(builder.build()));
  }

  /** Returns true if the exception is a write rejected by a unique index. */
  public static boolean isDuplicateKey(MongoException e) {
    return e instanceof MongoWriteException writeException
        && writeException.getError().getCategory() == ErrorCategory.DUPLICATE_KEY;
  }

  /**
   * Converts a driver exception into a status: duplicate-key writes become ALREADY_EXISTS with the
   * given message, everything else INTERNAL with the driver's message.
   */
  @Nonnull
  public static <T> StatusOr<T> fromMongoException(MongoException e, String duplicateKeyMessage) {
    if (isDuplicateKey(e)) {
      return StatusOr.ofStatus(Status.alreadyExists(duplicateKeyMessage, e));
    }
    return StatusOr.ofException(e);
  }
}
