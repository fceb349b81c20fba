package com.recipedirectory.validation;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.recipedirectory.db.User;
import java.util.regex.Pattern;

/**
 * Field constraints for users. Email uniqueness is left to the unique index on the collection.
 */
public final class UserValidator {

  public static final int MIN_NAME_LENGTH = 3;

  private static final Pattern EMAIL_PATTERN = Pattern.compile(".+@.+\\..+");

  private UserValidator() {}

  /**
   * Checks a user before it is written.
   *
   * @return every violated constraint; empty when the user is valid
   */
  public static ImmutableList<Violation> validate(User user) {
    ImmutableList.Builder<Violation> violations = ImmutableList.builder();

    if (Strings.isNullOrEmpty(user.name())) {
      violations.add(new Violation("name", "is required"));
    } else if (user.name().length() < MIN_NAME_LENGTH) {
      violations.add(
          new Violation(
              "name", "must be at least %d characters long".formatted(MIN_NAME_LENGTH)));
    }

    if (Strings.isNullOrEmpty(user.email())) {
      violations.add(new Violation("email", "is required"));
    } else if (!EMAIL_PATTERN.matcher(user.email()).find()) {
      violations.add(new Violation("email", "is not a valid email address"));
    }

    if (user.createdAt() == null) {
      violations.add(new Violation("createdAt", "is required"));
    }

    return violations.build();
  }
}
