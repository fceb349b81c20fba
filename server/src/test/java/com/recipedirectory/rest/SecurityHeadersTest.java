package com.recipedirectory.rest;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.javalin.http.Context;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SecurityHeadersTest {

  @Mock private Context mockContext;

  private final SecurityHeaders securityHeaders = new SecurityHeaders();

  @Test
  void testApiResponsesGetAllHeaders() {
    when(mockContext.path()).thenReturn("/recipes");

    securityHeaders.handle(mockContext);

    verify(mockContext).header("X-Content-Type-Options", "nosniff");
    verify(mockContext).header("X-Frame-Options", "SAMEORIGIN");
    verify(mockContext).header("Strict-Transport-Security", "max-age=31536000; includeSubDomains");
    verify(mockContext).header("Content-Security-Policy", SecurityHeaders.DEFAULT_CSP);
  }

  @Test
  void testDocumentationSkipsContentSecurityPolicy() {
    when(mockContext.path()).thenReturn("/openapi");

    securityHeaders.handle(mockContext);

    verify(mockContext).header("Referrer-Policy", "no-referrer");
    verify(mockContext, never()).header(eq("Content-Security-Policy"), anyString());
  }

  @Test
  void testDocumentationPaths() {
    assertTrue(SecurityHeaders.isDocumentationPath("/openapi"));
    assertTrue(SecurityHeaders.isDocumentationPath("/webjars/swagger-ui/index.html"));
    assertFalse(SecurityHeaders.isDocumentationPath("/recipes"));
  }
}
