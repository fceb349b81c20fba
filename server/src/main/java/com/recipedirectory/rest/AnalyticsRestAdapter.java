package com.recipedirectory.rest;

import com.recipedirectory.AnalyticsServiceImpl;
import com.recipedirectory.common.status.StatusOr;
import com.recipedirectory.rest.dto.AnalyticsResponse;
import com.recipedirectory.util.RestMapper;
import io.javalin.http.Context;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiResponse;
import org.tinylog.Logger;

/** REST adapter for the analytics endpoint. */
public class AnalyticsRestAdapter implements RestAdapter {

  private final AnalyticsServiceImpl analyticsService;

  public AnalyticsRestAdapter(AnalyticsServiceImpl analyticsService) {
    this.analyticsService = analyticsService;
  }

  @OpenApi(
      path = "/analytics",
      methods = {HttpMethod.GET},
      summary = "Aggregate statistics",
      description =
          "Returns user and recipe counts, the average number of recipes per user, and the most"
              + " and least viewed recipes.",
      operationId = "getAnalytics",
      tags = "Analytics",
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "Current statistics",
            content = @OpenApiContent(from = AnalyticsResponse.class)),
        @OpenApiResponse(status = "400", description = "A store query failed")
      })
  public void handleGetAnalytics(Context ctx) {
    Logger.info("REST GetAnalytics request");
    StatusOr<AnalyticsServiceImpl.Analytics> analyticsOr = analyticsService.getAnalytics();
    if (analyticsOr.isNotOk()) {
      setError(ctx, analyticsOr.getStatus().getHttpCode(), analyticsOr.getStatus().getMessage());
      return;
    }
    ctx.status(200).json(RestMapper.toResponse(analyticsOr.getValue()));
  }
}
