package com.recipedirectory.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.mongodb.ConnectionString;
import com.recipedirectory.common.status.Status;
import com.recipedirectory.common.status.StatusOr;
import java.util.Map;

/**
 * Configuration record for the MongoDB connection.
 *
 * @param connectionString The MongoDB connection string (e.g., "mongodb://localhost:27017/recipes")
 * @param databaseName The database holding the users, recipes and archive collections
 */
public record MongoConfig(String connectionString, String databaseName) {

  public static final String URI_VARIABLE = "MONGO_URI";
  public static final String DATABASE_VARIABLE = "MONGO_DATABASE";
  public static final String DEFAULT_DATABASE = "recipe_directory";

  /**
   * Builds the configuration from process environment variables.
   *
   * <p>{@code MONGO_URI} is required. The database name comes from {@code MONGO_DATABASE}, then
   * from the path of the connection string, then falls back to {@value #DEFAULT_DATABASE}.
   *
   * @param env The environment, usually {@code System.getenv()}
   * @return The configuration, or INVALID_ARGUMENT when the URI is absent or malformed
   */
  public static StatusOr<MongoConfig> fromEnvironment(Map<String, String> env) {
    String uri = env.get(URI_VARIABLE);
    if (Strings.isNullOrEmpty(uri)) {
      return StatusOr.ofStatus(Status.invalidArgument(URI_VARIABLE + " is not set"));
    }

    ConnectionString parsed;
    try {
      parsed = new ConnectionString(uri);
    } catch (IllegalArgumentException e) {
      return StatusOr.ofStatus(
          Status.invalidArgument("Invalid " + URI_VARIABLE + ": " + e.getMessage()));
    }

    String databaseName = env.get(DATABASE_VARIABLE);
    if (Strings.isNullOrEmpty(databaseName)) {
      databaseName = MoreObjects.firstNonNull(parsed.getDatabase(), DEFAULT_DATABASE);
    }
    return StatusOr.ofValue(new MongoConfig(uri, databaseName));
  }

  /**
   * Returns a string representation of this object without credentials, safe to log.
   *
   * @return The hosts, database and user name of this configuration
   */
  public String toSecureString() {
    ConnectionString parsed = new ConnectionString(connectionString);
    return MoreObjects.toStringHelper(this)
        .add("hosts", parsed.getHosts())
        .add("databaseName", databaseName)
        .add("username", parsed.getUsername())
        .toString();
  }
}
