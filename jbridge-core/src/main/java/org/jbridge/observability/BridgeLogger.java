package org.jbridge.observability;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Structured logger that outputs key-value pairs for easy parsing.
 *
 * <p>Log format: {@code CALL kind=X target=Y sig=Z latency_us=N status=OK}. Per-call lines are
 * written at {@code FINE}; method resolution details only in trace mode ({@code
 * -Djbridge.trace=true}) at {@code FINER}.
 */
public class BridgeLogger {
  private static final Logger LOG = Logger.getLogger("org.jbridge");

  /** Enable trace mode for verbose method resolution logging. */
  private static volatile boolean traceMode =
      Boolean.parseBoolean(System.getProperty("jbridge.trace", "false"));

  /** Enable a metrics dump when the VM shuts down. */
  private static volatile boolean metricsEnabled =
      Boolean.parseBoolean(System.getProperty("jbridge.metrics", "false"));

  public static boolean isTraceEnabled() {
    return traceMode;
  }

  public static void setTraceMode(boolean enabled) {
    traceMode = enabled;
    LOG.info("Trace mode " + (enabled ? "enabled" : "disabled"));
  }

  public static boolean isMetricsEnabled() {
    return metricsEnabled;
  }

  public static void setMetricsEnabled(boolean enabled) {
    metricsEnabled = enabled;
  }

  /** Log a completed bridge call. */
  public static void logCall(
      CallKind kind, String target, String signature, long latencyMicros, String errorType) {
    if (!LOG.isLoggable(Level.FINE)) return;

    StringBuilder sb = new StringBuilder();
    sb.append("CALL kind=").append(kind.displayName());
    if (target != null && !target.isEmpty()) {
      sb.append(" target=").append(truncate(target, 100));
    }
    if (signature != null) {
      sb.append(" sig=").append(signature);
    }
    sb.append(" latency_us=").append(latencyMicros);
    if (errorType != null) {
      sb.append(" status=ERROR errorType=").append(errorType);
    } else {
      sb.append(" status=OK");
    }
    LOG.fine(sb.toString());
  }

  /** Log a VM lifecycle transition. */
  public static void logLifecycle(String from, String to, String detail) {
    StringBuilder sb = new StringBuilder();
    sb.append("LIFECYCLE from=").append(from).append(" to=").append(to);
    if (detail != null) {
      sb.append(" detail=").append(truncate(detail, 200));
    }
    LOG.info(sb.toString());
  }

  /** Log a native attach or detach of the calling thread. */
  public static void logAttachment(String operation, boolean daemon) {
    if (!LOG.isLoggable(Level.FINE)) return;
    LOG.fine(
        "THREAD op="
            + operation
            + " thread="
            + Thread.currentThread().getName()
            + " daemon="
            + daemon);
  }

  /** Log a drain of the dead object queue. */
  public static void logReap(int reclaimed, String thread) {
    if (reclaimed == 0 || !LOG.isLoggable(Level.FINE)) return;
    LOG.fine("REAP reclaimed=" + reclaimed + " thread=" + thread);
  }

  /** Log a callback from the VM into host code. */
  public static void logCallback(
      long targetId, String methodName, int argCount, long latencyMicros, String errorMessage) {
    if (!LOG.isLoggable(Level.FINE)) return;

    StringBuilder sb = new StringBuilder();
    sb.append("CALLBACK target=").append(targetId);
    sb.append(" method=").append(methodName);
    sb.append(" args=").append(argCount);
    sb.append(" latency_us=").append(latencyMicros);
    if (errorMessage != null) {
      sb.append(" status=ERROR error=").append(truncate(errorMessage, 100));
    } else {
      sb.append(" status=OK");
    }
    LOG.fine(sb.toString());
  }

  /** Log method resolution decision (only in trace mode). */
  public static void logMethodResolution(
      String className, String methodName, int candidateCount, String chosen, int argCount) {
    if (!traceMode || !LOG.isLoggable(Level.FINER)) return;

    StringBuilder sb = new StringBuilder();
    sb.append("METHOD_RESOLUTION class=").append(className);
    sb.append(" method=").append(methodName);
    sb.append(" candidates=").append(candidateCount);
    sb.append(" chosen=").append(chosen);
    sb.append(" args=").append(argCount);
    LOG.finer(sb.toString());
  }

  /** Dump metrics to the log if enabled. */
  public static void dumpMetrics() {
    if (!metricsEnabled) return;
    LOG.info(Metrics.getInstance().report());
  }

  private static String truncate(String s, int maxLen) {
    if (s == null) return "";
    return s.length() <= maxLen ? s : s.substring(0, maxLen - 3) + "...";
  }
}
