package org.jbridge.observability;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Collects metrics about bridge traffic and reference lifetime.
 *
 * <p>Metrics include:
 *
 * <ul>
 *   <li>Call counts, errors and latency per {@link CallKind}
 *   <li>Global references created and released, and the peak number alive
 *   <li>Handles reclaimed through the dead object queue
 *   <li>Main-thread closures and VM callbacks
 * </ul>
 *
 * <p>Uses lock-free data structures for minimal overhead on the call path.
 */
public class Metrics {
  private static final Metrics INSTANCE = new Metrics();

  private final Map<CallKind, LongAdder> callCounts = new EnumMap<>(CallKind.class);
  private final Map<CallKind, LongAdder> errorCounts = new EnumMap<>(CallKind.class);
  private final Map<CallKind, LatencyTracker> latencyTrackers = new EnumMap<>(CallKind.class);

  // Global counters
  private final LongAdder totalCalls = new LongAdder();
  private final LongAdder totalErrors = new LongAdder();
  private final LongAdder javaExceptions = new LongAdder();
  private final LongAdder globalRefsCreated = new LongAdder();
  private final LongAdder globalRefsReleased = new LongAdder();
  private final LongAdder deferredReleases = new LongAdder();
  private final LongAdder reclaimedHandles = new LongAdder();
  private final LongAdder closuresRun = new LongAdder();
  private final LongAdder callbackInvocations = new LongAdder();
  private final LongAdder callbackErrors = new LongAdder();

  // Handle tracking
  private final AtomicLong liveHandles = new AtomicLong(0);
  private final AtomicLong peakLiveHandles = new AtomicLong(0);

  private final long startTimeNanos = System.nanoTime();

  private Metrics() {
    // Filled once here, read-only afterwards
    for (CallKind kind : CallKind.values()) {
      callCounts.put(kind, new LongAdder());
      errorCounts.put(kind, new LongAdder());
      latencyTrackers.put(kind, new LatencyTracker());
    }
  }

  public static Metrics getInstance() {
    return INSTANCE;
  }

  /** Record a completed bridge call. */
  public void recordCall(CallKind kind, long latencyMicros, boolean success) {
    totalCalls.increment();
    callCounts.get(kind).increment();
    if (!success) {
      totalErrors.increment();
      errorCounts.get(kind).increment();
    }
    latencyTrackers.get(kind).record(latencyMicros);
  }

  /** Record a VM exception converted into a host exception. */
  public void recordJavaException() {
    javaExceptions.increment();
  }

  /** Record a new owned global reference. */
  public void recordGlobalRefCreated() {
    globalRefsCreated.increment();
    long newCount = liveHandles.incrementAndGet();
    long peak = peakLiveHandles.get();
    while (newCount > peak && !peakLiveHandles.compareAndSet(peak, newCount)) {
      peak = peakLiveHandles.get();
    }
  }

  /** Record a global reference deleted, inline or by a reaper. */
  public void recordGlobalRefReleased() {
    globalRefsReleased.increment();
    liveHandles.decrementAndGet();
  }

  /** Record a handle handed to the dead object queue. */
  public void recordDeferredRelease() {
    deferredReleases.increment();
  }

  /** Record handles drained from the dead object queue. */
  public void recordReap(int count) {
    reclaimedHandles.add(count);
  }

  public void recordClosure() {
    closuresRun.increment();
  }

  public void recordCallback(boolean success) {
    callbackInvocations.increment();
    if (!success) {
      callbackErrors.increment();
    }
  }

  public long getTotalCalls() {
    return totalCalls.sum();
  }

  public long getTotalErrors() {
    return totalErrors.sum();
  }

  public long getCallCount(CallKind kind) {
    return callCounts.get(kind).sum();
  }

  public long getErrorCount(CallKind kind) {
    return errorCounts.get(kind).sum();
  }

  public long getLatencyPercentile(CallKind kind, double percentile) {
    return latencyTrackers.get(kind).getPercentile(percentile);
  }

  public long getJavaExceptions() {
    return javaExceptions.sum();
  }

  public long getGlobalRefsCreated() {
    return globalRefsCreated.sum();
  }

  public long getGlobalRefsReleased() {
    return globalRefsReleased.sum();
  }

  public long getDeferredReleases() {
    return deferredReleases.sum();
  }

  public long getReclaimedHandles() {
    return reclaimedHandles.sum();
  }

  public long getLiveHandles() {
    return liveHandles.get();
  }

  public long getPeakLiveHandles() {
    return peakLiveHandles.get();
  }

  public long getClosuresRun() {
    return closuresRun.sum();
  }

  public long getCallbackInvocations() {
    return callbackInvocations.sum();
  }

  public long getCallbackErrors() {
    return callbackErrors.sum();
  }

  /** Get calls per second since start. */
  public double getCallsPerSecond() {
    long elapsedNanos = System.nanoTime() - startTimeNanos;
    if (elapsedNanos <= 0) return 0;
    return totalCalls.sum() * 1_000_000_000.0 / elapsedNanos;
  }

  /** Format all metrics as a human-readable report. */
  public String report() {
    StringBuilder sb = new StringBuilder();
    sb.append("=== JBridge Metrics ===\n");

    sb.append("\nGlobal:\n");
    sb.append(String.format("  total_calls: %d\n", getTotalCalls()));
    sb.append(String.format("  total_errors: %d\n", getTotalErrors()));
    sb.append(String.format("  java_exceptions: %d\n", getJavaExceptions()));
    sb.append(String.format("  calls_per_sec: %.2f\n", getCallsPerSecond()));

    sb.append("\nReferences:\n");
    sb.append(String.format("  global_created: %d\n", getGlobalRefsCreated()));
    sb.append(String.format("  global_released: %d\n", getGlobalRefsReleased()));
    sb.append(String.format("  live: %d\n", getLiveHandles()));
    sb.append(String.format("  peak_live: %d\n", getPeakLiveHandles()));
    sb.append(String.format("  deferred: %d\n", getDeferredReleases()));
    sb.append(String.format("  reclaimed: %d\n", getReclaimedHandles()));

    sb.append("\nThreads:\n");
    sb.append(String.format("  main_thread_closures: %d\n", getClosuresRun()));
    sb.append(String.format("  callbacks: %d\n", getCallbackInvocations()));
    sb.append(String.format("  callback_errors: %d\n", getCallbackErrors()));

    sb.append("\nPer-Kind Latency (microseconds):\n");
    for (CallKind kind : CallKind.values()) {
      long count = getCallCount(kind);
      if (count == 0) continue;
      sb.append(
          String.format(
              "  %s: count=%d errors=%d p50=%d p99=%d\n",
              kind.displayName(),
              count,
              getErrorCount(kind),
              getLatencyPercentile(kind, 0.50),
              getLatencyPercentile(kind, 0.99)));
    }

    return sb.toString();
  }

  /**
   * Simple latency tracker using bucketed histogram. Provides approximate percentiles with minimal
   * overhead.
   */
  private static class LatencyTracker {
    // Buckets: 0-10us, 10-100us, 100-1000us, 1-10ms, 10-100ms, 100ms-1s, >1s
    private static final long[] BUCKET_BOUNDS = {
      10, 100, 1000, 10_000, 100_000, 1_000_000, Long.MAX_VALUE
    };
    private final LongAdder[] buckets = new LongAdder[BUCKET_BOUNDS.length];
    private final LongAdder totalCount = new LongAdder();

    LatencyTracker() {
      for (int i = 0; i < buckets.length; i++) {
        buckets[i] = new LongAdder();
      }
    }

    void record(long latencyMicros) {
      totalCount.increment();
      for (int i = 0; i < BUCKET_BOUNDS.length; i++) {
        if (latencyMicros < BUCKET_BOUNDS[i]) {
          buckets[i].increment();
          break;
        }
      }
    }

    long getPercentile(double percentile) {
      long total = totalCount.sum();
      if (total == 0) return 0;

      long target = (long) (total * percentile);
      long cumulative = 0;
      for (int i = 0; i < buckets.length; i++) {
        cumulative += buckets[i].sum();
        if (cumulative >= target) {
          return BUCKET_BOUNDS[i];
        }
      }
      return BUCKET_BOUNDS[BUCKET_BOUNDS.length - 1];
    }

    void reset() {
      totalCount.reset();
      for (LongAdder bucket : buckets) {
        bucket.reset();
      }
    }
  }

  /** Reset all metrics (for testing). */
  public void reset() {
    totalCalls.reset();
    totalErrors.reset();
    javaExceptions.reset();
    globalRefsCreated.reset();
    globalRefsReleased.reset();
    deferredReleases.reset();
    reclaimedHandles.reset();
    closuresRun.reset();
    callbackInvocations.reset();
    callbackErrors.reset();
    for (CallKind kind : CallKind.values()) {
      callCounts.get(kind).reset();
      errorCounts.get(kind).reset();
      latencyTrackers.get(kind).reset();
    }
    liveHandles.set(0);
    peakLiveHandles.set(0);
  }
}
