package com.recipedirectory;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import com.recipedirectory.common.status.StatusOr;
import com.recipedirectory.config.MongoConfig;
import com.recipedirectory.config.ServerConfig;
import com.recipedirectory.db.Users;
import com.recipedirectory.rest.ErrorHandlers;
import com.recipedirectory.rest.RestAdapterFactory;
import com.recipedirectory.util.JsonUtil;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import io.javalin.openapi.OpenApiInfo;
import io.javalin.openapi.OpenApiServer;
import io.javalin.openapi.plugin.OpenApiPlugin;
import io.javalin.openapi.plugin.redoc.ReDocPlugin;
import io.javalin.openapi.plugin.swagger.SwaggerPlugin;
import io.javalin.plugin.bundled.CorsPluginConfig.CorsRule;
import java.util.Map;
import org.bson.Document;
import org.tinylog.Logger;

/**
 * Main server class for the Recipe Directory API.
 *
 * <p>Reads its configuration from the environment, connects to MongoDB and verifies the
 * connection before serving anything, then starts the REST server. Any failure during startup
 * ends the process with exit code 1.
 *
 * <h2>Error Handling</h2>
 *
 * <ul>
 *   <li>Validation errors and store failures return 400 with an {@code error} message
 *   <li>Missing records return 404
 *   <li>Unknown routes return 404 with {@code {"success": false, "message": ...}}
 *   <li>Uncaught exceptions return 500 with a generic message; details are only logged
 * </ul>
 */
public class Main {

  private final ServerConfig serverConfig;
  private final MongoConfig mongoConfig;
  private final MongoClient mongoClient;
  private final MongoDatabase database;

  private final UserServiceImpl userServiceImpl;
  private final RecipeServiceImpl recipeServiceImpl;
  private final AnalyticsServiceImpl analyticsServiceImpl;

  private Javalin app;

  public Main(ServerConfig serverConfig, MongoConfig mongoConfig) {
    this.serverConfig = serverConfig;
    this.mongoConfig = mongoConfig;

    Logger.info("Configured MongoDB: {}", mongoConfig.toSecureString());
    this.mongoClient = MongoClients.create(mongoConfig.connectionString());
    this.database = mongoClient.getDatabase(mongoConfig.databaseName());

    this.userServiceImpl = new UserServiceImpl(new UserServiceImpl.Config(database));
    this.recipeServiceImpl = new RecipeServiceImpl(new RecipeServiceImpl.Config(database));
    this.analyticsServiceImpl =
        new AnalyticsServiceImpl(new AnalyticsServiceImpl.Config(database));
  }

  /**
   * Pings the database and creates the indexes the services rely on.
   *
   * @throws MongoException if the database cannot be reached
   * @throws IllegalStateException if the indexes cannot be created
   */
  public void initializeDatabase() {
    database.runCommand(new Document("ping", 1));
    Logger.info("Connected to MongoDB database {}", mongoConfig.databaseName());

    StatusOr<String> indexOr = Users.ensureIndexes(database);
    if (indexOr.isNotOk()) {
      throw new IllegalStateException(
          "Could not create user indexes: " + indexOr.getStatus().getMessage());
    }
    Logger.info("Ensured index {} on {}", indexOr.getValue(), Users.COLLECTION);
  }

  /**
   * Configures the OpenAPI information for the service documentation served at /openapi.
   *
   * @param openApiInfo The OpenApiInfo object to configure
   * @return The configured OpenApiInfo instance
   */
  private OpenApiInfo getOpenApiInfo(OpenApiInfo openApiInfo) {
    return openApiInfo
        .title("Recipe Directory API")
        .description(
            "API for sharing recipes: create users and recipes, search recipes by title, track"
                + " recipe views and read aggregate statistics. Deleted recipes are kept in an"
                + " archive.")
        .version("1.0.0");
  }

  private OpenApiServer getOpenApiServer(OpenApiServer openApiServer) {
    return openApiServer
        .description("Recipe Directory REST API server endpoint")
        .url("http://localhost:{port}/")
        .variable(
            "port",
            "Server's REST port",
            String.valueOf(ServerConfig.DEFAULT_PORT),
            String.valueOf(serverConfig.port()));
  }

  /** Builds the Javalin application with all routes, plugins and handlers, without starting it. */
  public Javalin createJavalinApp() {
    RestAdapterFactory restAdapterFactory =
        new RestAdapterFactory(userServiceImpl, recipeServiceImpl, analyticsServiceImpl);

    // Note: redoc and swagger are available at /openapi
    Javalin javalin =
        Javalin.create(
            config -> {
              config.showJavalinBanner = false;
              config.jsonMapper(new JavalinJackson(JsonUtil.newObjectMapper(), false));
              config.bundledPlugins.enableCors(cors -> cors.addRule(CorsRule::anyHost));
              config.registerPlugin(
                  new OpenApiPlugin(
                      openApiConfig ->
                          openApiConfig
                              .withPrettyOutput()
                              .withDefinitionConfiguration(
                                  (version, openApiDefinition) ->
                                      openApiDefinition
                                          .withInfo(this::getOpenApiInfo)
                                          .withServer(this::getOpenApiServer))));

              config.registerPlugin(
                  new ReDocPlugin(
                      reDocConfiguration -> reDocConfiguration.setDocumentationPath("/openapi")));

              config.registerPlugin(
                  new SwaggerPlugin(
                      swaggerConfiguration ->
                          swaggerConfiguration.setDocumentationPath("/openapi")));

              restAdapterFactory.configureRoutes(config.router);
            });
    ErrorHandlers.register(javalin);
    return javalin;
  }

  public void startJavalinServer() {
    app = createJavalinApp();
    app.start(serverConfig.port());
    Logger.info("REST server started, listening on port {}.", serverConfig.port());

    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  Logger.info("Shutting down server since JVM is shutting down");
                  try {
                    Main.this.shutdown();
                  } catch (Exception e) {
                    Logger.error(e, "Error during shutdown.");
                  }
                }));
  }

  private void shutdown() {
    if (app != null) {
      app.stop();
    }
    Logger.info("Closing MongoDB client");
    mongoClient.close();
  }

  public static void main(String[] args) {
    Map<String, String> env = System.getenv();

    StatusOr<ServerConfig> serverConfigOr = ServerConfig.fromEnvironment(env);
    if (serverConfigOr.isNotOk()) {
      Logger.error("Invalid server configuration: {}", serverConfigOr.getStatus().getMessage());
      System.exit(1);
      return;
    }
    StatusOr<MongoConfig> mongoConfigOr = MongoConfig.fromEnvironment(env);
    if (mongoConfigOr.isNotOk()) {
      Logger.error("Invalid MongoDB configuration: {}", mongoConfigOr.getStatus().getMessage());
      System.exit(1);
      return;
    }

    Main server = new Main(serverConfigOr.getValue(), mongoConfigOr.getValue());
    try {
      server.initializeDatabase();
    } catch (MongoException | IllegalStateException e) {
      Logger.error(e, "MongoDB connection error");
      server.shutdown();
      System.exit(1);
      return;
    }
    server.startJavalinServer();
  }
}
