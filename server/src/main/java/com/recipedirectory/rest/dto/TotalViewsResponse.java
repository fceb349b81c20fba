package com.recipedirectory.rest.dto;

import io.javalin.openapi.OpenApiName;

/** Response of {@code GET /user/{userId}/views}. */
@OpenApiName("TotalViewsResponse")
public record TotalViewsResponse(long totalViews) {}
