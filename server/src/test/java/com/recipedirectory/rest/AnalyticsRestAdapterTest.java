package com.recipedirectory.rest;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.recipedirectory.AnalyticsServiceImpl;
import com.recipedirectory.AnalyticsServiceImpl.Analytics;
import com.recipedirectory.common.status.Status;
import com.recipedirectory.common.status.StatusOr;
import com.recipedirectory.rest.dto.AnalyticsResponse;
import io.javalin.http.Context;
import java.math.BigDecimal;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AnalyticsRestAdapterTest {

  @Mock private Context mockContext;
  @Mock private AnalyticsServiceImpl analyticsService;

  private AnalyticsRestAdapter adapter;

  @BeforeEach
  void setUp() {
    adapter = new AnalyticsRestAdapter(analyticsService);
    lenient().when(mockContext.status(anyInt())).thenReturn(mockContext);
    lenient().when(mockContext.json(any())).thenReturn(mockContext);
  }

  private Object capturedJson() {
    ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
    verify(mockContext).json(captor.capture());
    return captor.getValue();
  }

  @Test
  void testEmptyDirectory() {
    when(analyticsService.getAnalytics())
        .thenReturn(StatusOr.ofValue(new Analytics(0, 0, BigDecimal.ZERO, null, null)));

    adapter.handleGetAnalytics(mockContext);

    verify(mockContext).status(200);
    assertEquals(new AnalyticsResponse(0, 0, BigDecimal.ZERO, null, null), capturedJson());
  }

  @Test
  void testStoreFailure() {
    when(analyticsService.getAnalytics())
        .thenReturn(StatusOr.ofStatus(Status.internal("connection refused", null)));

    adapter.handleGetAnalytics(mockContext);

    verify(mockContext).status(400);
    assertEquals(Map.of("error", "connection refused"), capturedJson());
  }
}
