package org.jbridge.observability;

import jdk.jfr.*;

/**
 * JFR (Java Flight Recorder) events for profiling and diagnostics.
 *
 * <p>Enable with: -XX:StartFlightRecording=filename=jbridge.jfr,settings=profile
 */
public class BridgeEvents {

  /** Base category for all bridge events. */
  private static final String CATEGORY = "JBridge";

  /** Emitted on every VM lifecycle transition. */
  @Name("org.jbridge.VmLifecycle")
  @Label("VM Lifecycle")
  @Category(CATEGORY)
  @Description("A transition of the VM lifecycle controller")
  @StackTrace(false)
  public static class VmLifecycleEvent extends Event {
    @Label("From")
    public String from;

    @Label("To")
    public String to;

    @Label("Return Code")
    public int returnCode;
  }

  /** Emitted when the reflection layer picks an overload. */
  @Name("org.jbridge.MethodResolution")
  @Label("Method Resolution")
  @Category(CATEGORY)
  @Description("First-match overload resolution decision")
  @StackTrace(false)
  public static class MethodResolutionEvent extends Event {
    @Label("Class")
    public String className;

    @Label("Method Name")
    public String methodName;

    @Label("Candidate Count")
    public int candidateCount;

    @Label("Chosen Signature")
    public String chosenSignature;
  }

  /** Emitted when the dead object queue is drained. */
  @Name("org.jbridge.Reap")
  @Label("Reap")
  @Category(CATEGORY)
  @Description("Deferred global references released by a reaping thread")
  @StackTrace(false)
  public static class ReapEvent extends Event {
    @Label("Reclaimed")
    public int reclaimed;
  }

  /** Spans the execution of one closure on the main thread. */
  @Name("org.jbridge.MainThreadClosure")
  @Label("Main Thread Closure")
  @Category(CATEGORY)
  @Description("Work submitted to run on the VM monitor thread")
  @StackTrace(false)
  public static class MainThreadClosureEvent extends Event {
    @Label("Synchronous")
    public boolean synchronous;

    @Label("Success")
    public boolean success;
  }

  // --- Static helper methods for easy event emission ---

  public static void emitLifecycle(String from, String to, int returnCode) {
    VmLifecycleEvent event = new VmLifecycleEvent();
    event.from = from;
    event.to = to;
    event.returnCode = returnCode;
    event.commit();
  }

  public static void emitMethodResolution(
      String className, String methodName, int candidateCount, String chosenSignature) {
    MethodResolutionEvent event = new MethodResolutionEvent();
    event.className = className;
    event.methodName = methodName;
    event.candidateCount = candidateCount;
    event.chosenSignature = chosenSignature;
    event.commit();
  }

  public static void emitReap(int reclaimed) {
    ReapEvent event = new ReapEvent();
    event.reclaimed = reclaimed;
    event.commit();
  }

  /** Begin a closure event; finish it with {@link #endClosure}. */
  public static MainThreadClosureEvent beginClosure(boolean synchronous) {
    MainThreadClosureEvent event = new MainThreadClosureEvent();
    event.synchronous = synchronous;
    event.begin();
    return event;
  }

  public static void endClosure(MainThreadClosureEvent event, boolean success) {
    event.success = success;
    event.end();
    event.commit();
  }
}
