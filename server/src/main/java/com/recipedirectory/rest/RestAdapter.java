package com.recipedirectory.rest;

import com.recipedirectory.common.status.Status;
import com.recipedirectory.common.status.StatusCode;
import com.recipedirectory.common.status.StatusOr;
import com.recipedirectory.db.util.ObjectIds;
import io.javalin.http.Context;
import java.util.Map;
import org.bson.types.ObjectId;
import org.tinylog.Logger;

/**
 * Base interface for REST adapters that handle REST API endpoints.
 *
 * <p>Provides the helpers every handler needs: error responses in the two body shapes the API
 * uses ({@code {"error": ...}} and {@code {"message": ...}}), status-to-response mapping, and
 * parsing of path identifiers and request bodies.
 */
public interface RestAdapter {

  /**
   * Request attribute set once a handler has written an error body, so that the unmatched-route
   * handler leaves a deliberate 404 alone.
   */
  String ERROR_HANDLED_ATTRIBUTE = "recipedirectory.errorHandled";

  /**
   * Sets an error response of the form {@code {"error": message}}.
   *
   * @param ctx The Javalin context to set the error on
   * @param statusCode The HTTP status code to set
   * @param message The error message to include in the response
   */
  default void setError(Context ctx, int statusCode, String message) {
    ctx.attribute(ERROR_HANDLED_ATTRIBUTE, true);
    ctx.status(statusCode).json(Map.of("error", String.valueOf(message)));
    Logger.error("Error response: {} - {}", statusCode, message);
  }

  /**
   * Sets an error response of the form {@code {"message": message}}.
   *
   * @param ctx The Javalin context to set the error on
   * @param statusCode The HTTP status code to set
   * @param message The message to include in the response
   */
  default void setMessage(Context ctx, int statusCode, String message) {
    ctx.attribute(ERROR_HANDLED_ATTRIBUTE, true);
    ctx.status(statusCode).json(Map.of("message", String.valueOf(message)));
    Logger.warn("Message response: {} - {}", statusCode, message);
  }

  /**
   * Writes a failed status: NOT_FOUND as a 404 {@code message} body, anything else as an
   * {@code error} body with the status' HTTP code.
   */
  default void respondWithStatus(Context ctx, Status status) {
    if (status.getCode() == StatusCode.NOT_FOUND) {
      setMessage(ctx, status.getHttpCode(), status.getMessage());
    } else {
      setError(ctx, status.getHttpCode(), status.getMessage());
    }
  }

  /**
   * Parses a hex identifier from a path parameter, writing a 400 response when it is malformed.
   *
   * @param ctx The Javalin context
   * @param paramName The name of the path parameter
   * @param label What the identifier refers to, used in the error message
   * @return The parsed ID, or a failed status after the error response has been written
   */
  default StatusOr<ObjectId> parsePathId(Context ctx, String paramName, String label) {
    StatusOr<ObjectId> idOr = ObjectIds.parse(ctx.pathParam(paramName), label);
    if (idOr.isNotOk()) {
      setError(ctx, idOr.getStatus().getHttpCode(), idOr.getStatus().getMessage());
    }
    return idOr;
  }

  /**
   * Binds the JSON request body. An empty body, or a literal {@code null}, binds like an empty
   * object so that missing fields are reported by validation rather than as a parse failure.
   * Malformed JSON propagates to the exception handler registered in {@link ErrorHandlers}.
   */
  default <T> T readBody(Context ctx, Class<T> type) {
    String body = ctx.body();
    T value = body.isBlank() ? null : ctx.bodyAsClass(type);
    if (value == null) {
      value = ctx.jsonMapper().fromJsonString("{}", type);
    }
    return value;
  }
}
