package org.jbridge.observability;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MetricsTest {
  private final Metrics metrics = Metrics.getInstance();

  @BeforeEach
  void setUp() {
    metrics.reset();
  }

  @Test
  void testCallCountsPerKind() {
    metrics.recordCall(CallKind.GET_FIELD, 5, true);
    metrics.recordCall(CallKind.GET_FIELD, 50, false);
    metrics.recordCall(CallKind.NEW_OBJECT, 5, true);

    assertEquals(3, metrics.getTotalCalls());
    assertEquals(1, metrics.getTotalErrors());
    assertEquals(2, metrics.getCallCount(CallKind.GET_FIELD));
    assertEquals(1, metrics.getErrorCount(CallKind.GET_FIELD));
    assertEquals(0, metrics.getErrorCount(CallKind.NEW_OBJECT));
  }

  @Test
  void testLatencyPercentilesAreBucketed() {
    for (int i = 0; i < 99; i++) {
      metrics.recordCall(CallKind.CALL_METHOD, 3, true);
    }
    metrics.recordCall(CallKind.CALL_METHOD, 5_000, true);

    assertEquals(10, metrics.getLatencyPercentile(CallKind.CALL_METHOD, 0.50));
    assertEquals(10, metrics.getLatencyPercentile(CallKind.CALL_METHOD, 0.99));
    assertEquals(10_000, metrics.getLatencyPercentile(CallKind.CALL_METHOD, 1.0));
    assertEquals(0, metrics.getLatencyPercentile(CallKind.SET_FIELD, 0.50));
  }

  @Test
  void testPeakLiveHandles() {
    metrics.recordGlobalRefCreated();
    metrics.recordGlobalRefCreated();
    metrics.recordGlobalRefReleased();
    metrics.recordGlobalRefCreated();

    assertEquals(3, metrics.getGlobalRefsCreated());
    assertEquals(1, metrics.getGlobalRefsReleased());
    assertEquals(2, metrics.getPeakLiveHandles());
  }

  @Test
  void testReportListsOnlyUsedKinds() {
    metrics.recordCall(CallKind.CALL_STATIC_METHOD, 20, true);
    metrics.recordDeferredRelease();
    String report = metrics.report();

    assertTrue(report.startsWith("=== JBridge Metrics ==="));
    assertTrue(report.contains("CallStaticMethod: count=1 errors=0"));
    assertTrue(report.contains("deferred: "));
    assertFalse(report.contains("SetStaticField:"));
  }
}
