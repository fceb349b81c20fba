package com.recipedirectory.validation;

import com.recipedirectory.common.status.Status;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A single failed field constraint.
 *
 * @param field The document field that failed
 * @param message What is wrong with it
 */
public record Violation(String field, String message) {

  /**
   * Folds a non-empty list of violations into an INVALID_ARGUMENT status whose message reads
   * {@code "<entity> validation failed: field: message, field: message"}.
   *
   * @param entity The entity name, e.g. "User"
   * @param violations The violations, at least one
   * @return The status describing every violation
   */
  public static Status toStatus(String entity, List<Violation> violations) {
    if (violations.isEmpty()) {
      throw new IllegalArgumentException("At least one violation is required");
    }
    String details =
        violations.stream()
            .map(v -> v.field() + ": " + v.message())
            .collect(Collectors.joining(", "));
    return Status.invalidArgument(entity + " validation failed: " + details);
  }
}
