package com.recipedirectory.db.util;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import com.recipedirectory.db.ArchivedRecipes;
import com.recipedirectory.db.Recipes;
import com.recipedirectory.db.Users;
import org.bson.Document;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Helper class for setting up MongoDB test containers. Provides consistent initialization for all
 * store tests.
 */
public class MongoTestHelper {

  private static final DockerImageName MONGO_IMAGE = DockerImageName.parse("mongo:7.0");

  /**
   * Starts a MongoDB container, connects to it and creates the indexes the services expect.
   *
   * @param databaseName The name to use for the test database
   * @return A MongoContext holding the container, client and database
   */
  public static MongoContext setupMongo(String databaseName) {
    MongoDBContainer container = new MongoDBContainer(MONGO_IMAGE);
    container.start();

    MongoClient client = MongoClients.create(container.getConnectionString());
    MongoDatabase database = client.getDatabase(databaseName);
    Users.ensureIndexes(database).getValue();
    return new MongoContext(container, client, database);
  }

  /** Removes every document from the three collections, keeping their indexes. */
  public static void clearCollections(MongoDatabase database) {
    database.getCollection(Users.COLLECTION).deleteMany(new Document());
    database.getCollection(Recipes.COLLECTION).deleteMany(new Document());
    database.getCollection(ArchivedRecipes.COLLECTION).deleteMany(new Document());
  }

  /** Holds the MongoDB container, the client connected to it and the test database. */
  public static class MongoContext {
    private final MongoDBContainer container;
    private final MongoClient client;
    private final MongoDatabase database;

    public MongoContext(MongoDBContainer container, MongoClient client, MongoDatabase database) {
      this.container = container;
      this.client = client;
      this.database = database;
    }

    public MongoDBContainer getContainer() {
      return container;
    }

    public MongoDatabase getDatabase() {
      return database;
    }

    /** Closes the client and stops the container. Call from test tearDown methods. */
    public void close() {
      if (client != null) {
        client.close();
      }
      if (container != null && container.isRunning()) {
        container.stop();
      }
    }
  }
}
