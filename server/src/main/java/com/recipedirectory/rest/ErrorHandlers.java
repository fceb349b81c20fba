package com.recipedirectory.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.base.Strings;
import io.javalin.Javalin;
import io.javalin.http.Context;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.tinylog.Logger;

/**
 * Request logging and the handlers for failures no endpoint answers itself: unmatched routes,
 * unreadable request bodies and uncaught exceptions.
 */
public final class ErrorHandlers {

  static final String ROUTE_NOT_FOUND = "Route not found. Please check the URL.";
  static final String INTERNAL_ERROR = "Internal Server Error. Please try again later.";
  static final String INVALID_JSON = "Invalid JSON request body";

  private ErrorHandlers() {
    // Utility class, no instances
  }

  /** Registers the request log, the security headers and every error handler on the app. */
  public static void register(Javalin app) {
    app.before(ErrorHandlers::logRequest);
    app.before(new SecurityHeaders());
    app.exception(JsonProcessingException.class, ErrorHandlers::handleInvalidJson);
    app.exception(Exception.class, ErrorHandlers::handleUncaught);
    app.error(404, ErrorHandlers::handleNotFound);
  }

  static void logRequest(Context ctx) {
    Logger.info("[{}] {} {}", Instant.now(), ctx.method(), requestTarget(ctx));
  }

  /** The path as requested, with its query string when there is one. */
  static String requestTarget(Context ctx) {
    String query = ctx.queryString();
    return Strings.isNullOrEmpty(query) ? ctx.path() : ctx.path() + "?" + query;
  }

  static void handleInvalidJson(JsonProcessingException e, Context ctx) {
    Logger.warn("Unreadable request body on {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
    ctx.attribute(RestAdapter.ERROR_HANDLED_ATTRIBUTE, true);
    ctx.status(400).json(Map.of("error", INVALID_JSON));
  }

  static void handleUncaught(Exception e, Context ctx) {
    Logger.error(e, "Unhandled error on {} {}", ctx.method(), ctx.path());
    ctx.status(500).json(failure(INTERNAL_ERROR));
  }

  /** Answers 404s that no handler produced itself; a handler's own 404 body is kept. */
  static void handleNotFound(Context ctx) {
    if (ctx.attribute(RestAdapter.ERROR_HANDLED_ATTRIBUTE) != null) {
      return;
    }
    Logger.warn("No route for {} {}", ctx.method(), ctx.path());
    ctx.json(failure(ROUTE_NOT_FOUND));
  }

  private static Map<String, Object> failure(String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", false);
    body.put("message", message);
    return body;
  }
}
