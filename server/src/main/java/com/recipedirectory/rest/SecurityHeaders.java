package com.recipedirectory.rest;

import com.google.common.collect.ImmutableMap;
import io.javalin.http.Context;
import io.javalin.http.Handler;

/**
 * Adds the usual browser-hardening headers to every response.
 *
 * <p>The documentation pages under {@code /openapi} and {@code /webjars} run inline scripts, so
 * they get every header except the content security policy.
 */
public final class SecurityHeaders implements Handler {

  static final String CONTENT_SECURITY_POLICY = "Content-Security-Policy";

  static final String DEFAULT_CSP =
      "default-src 'self';base-uri 'self';font-src 'self' https: data:;form-action 'self';"
          + "frame-ancestors 'self';img-src 'self' data:;object-src 'none';script-src 'self';"
          + "script-src-attr 'none';style-src 'self' https: 'unsafe-inline';"
          + "upgrade-insecure-requests";

  static final ImmutableMap<String, String> HEADERS =
      ImmutableMap.<String, String>builder()
          .put("Cross-Origin-Opener-Policy", "same-origin")
          .put("Cross-Origin-Resource-Policy", "same-origin")
          .put("Origin-Agent-Cluster", "?1")
          .put("Referrer-Policy", "no-referrer")
          .put("Strict-Transport-Security", "max-age=31536000; includeSubDomains")
          .put("X-Content-Type-Options", "nosniff")
          .put("X-DNS-Prefetch-Control", "off")
          .put("X-Download-Options", "noopen")
          .put("X-Frame-Options", "SAMEORIGIN")
          .put("X-Permitted-Cross-Domain-Policies", "none")
          .put("X-XSS-Protection", "0")
          .build();

  @Override
  public void handle(Context ctx) {
    HEADERS.forEach(ctx::header);
    if (!isDocumentationPath(ctx.path())) {
      ctx.header(CONTENT_SECURITY_POLICY, DEFAULT_CSP);
    }
  }

  static boolean isDocumentationPath(String path) {
    return path.startsWith("/openapi")
        || path.startsWith("/webjars")
        || path.startsWith("/swagger")
        || path.startsWith("/redoc");
  }
}
