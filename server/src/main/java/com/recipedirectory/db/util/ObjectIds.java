package com.recipedirectory.db.util;

import com.recipedirectory.common.status.Status;
import com.recipedirectory.common.status.StatusOr;
import javax.annotation.Nonnull;
import org.bson.types.ObjectId;

/** Utility methods for working with document identifiers. */
public final class ObjectIds {

  private ObjectIds() {
    // Utility class, no instances
  }

  /**
   * Parses a 24-character hexadecimal identifier.
   *
   * @param hex The identifier as received over HTTP
   * @param label What the identifier refers to, used in the error message (e.g. "recipe")
   * @return StatusOr containing the ObjectId, or INVALID_ARGUMENT when the string is malformed
   */
  @Nonnull
  public static StatusOr<ObjectId> parse(String hex, String label) {
    if (hex == null || hex.isEmpty()) {
      return StatusOr.ofStatus(Status.invalidArgument(label + " ID cannot be empty"));
    }
    if (!ObjectId.isValid(hex)) {
      return StatusOr.ofStatus(Status.invalidArgument("Invalid " + label + " ID: \"" + hex + "\""));
    }
    return StatusOr.ofValue(new ObjectId(hex));
  }

  /** Returns the hexadecimal form of the identifier, or null for a null identifier. */
  public static String toHex(ObjectId id) {
    return id == null ? null : id.toHexString();
  }
}
