package com.recipedirectory.rest.dto;

import io.javalin.openapi.OpenApiName;

/** A response carrying only a human-readable message. */
@OpenApiName("MessageResponse")
public record MessageResponse(String message) {}
