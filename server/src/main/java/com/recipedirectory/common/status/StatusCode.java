package com.recipedirectory.common.status;

/**
 * Status codes used across the store helpers, services and REST adapters, each paired with the
 * HTTP status the REST layer answers with.
 *
 * <p>Store failures surface as 400 rather than 500: a handler that catches a failing store call
 * reports it as a bad request with the underlying message. Only exceptions that escape a handler
 * become 500 responses.
 */
public enum StatusCode {
  OK(200),
  INVALID_ARGUMENT(400),
  NOT_FOUND(404),
  ALREADY_EXISTS(400), // uniqueness violation reported by the store
  INTERNAL(400);       // store or driver failure caught inside a handler

  private final int httpCode;

  StatusCode(int httpCode) {
    this.httpCode = httpCode;
  }

  /** Returns the corresponding HTTP status code. */
  public int getHttpCode() {
    return httpCode;
  }

  /** Returns whether this status code represents a successful operation. */
  public boolean isSuccess() {
    return this == OK;
  }
}
