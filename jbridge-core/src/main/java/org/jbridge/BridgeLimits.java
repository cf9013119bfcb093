package org.jbridge;

/**
 * Tunables of the bridge, read once from system properties.
 *
 * <p>System properties:
 *
 * <ul>
 *   <li>jbridge.limits.object_array_frame - Elements read per local frame when walking an object
 *       array (default: 256)
 *   <li>jbridge.limits.member_cache_size - Classes whose reflected member tables are kept
 *       (default: 512)
 *   <li>jbridge.limits.callback_depth - Maximum nesting of VM-to-host callbacks (default: 64)
 *   <li>jbridge.arrow.enabled - Accept Arrow vectors as array arguments (default: true)
 *   <li>jbridge.attach.daemon - Attach threads as daemons (default: false)
 * </ul>
 */
public final class BridgeLimits {

  // ========== FRAME LIMITS ==========

  /** Object array elements fetched before the local frame is reset. */
  public static final int OBJECT_ARRAY_FRAME =
      Integer.getInteger("jbridge.limits.object_array_frame", 256);

  // ========== CACHE LIMITS ==========

  /** Classes whose member tables are kept by the reflection layer. */
  public static final int MEMBER_CACHE_SIZE =
      Integer.getInteger("jbridge.limits.member_cache_size", 512);

  // ========== CALLBACK LIMITS ==========

  /** Maximum nesting of VM-to-host callbacks on one thread. */
  public static final int MAX_CALLBACK_DEPTH =
      Integer.getInteger("jbridge.limits.callback_depth", 64);

  // ========== FEATURES ==========

  public static final boolean ARROW_ENABLED =
      Boolean.parseBoolean(System.getProperty("jbridge.arrow.enabled", "true"));

  public static final boolean ATTACH_AS_DAEMON = Boolean.getBoolean("jbridge.attach.daemon");

  /** Thrown when callbacks nest deeper than {@link #MAX_CALLBACK_DEPTH}. */
  public static class CallbackDepthExceededException extends LifecycleException {
    public CallbackDepthExceededException(int depth) {
      super(
          String.format(
              "Callback nesting too deep: %d levels (max: %d). "
                  + "Increase jbridge.limits.callback_depth if needed.",
              depth, MAX_CALLBACK_DEPTH));
    }
  }

  /** Check callback nesting depth. */
  public static void checkCallbackDepth(int depth) {
    if (depth > MAX_CALLBACK_DEPTH) {
      throw new CallbackDepthExceededException(depth);
    }
  }

  /** Get a summary of current limits for logging. */
  public static String getSummary() {
    return String.format(
        "BridgeLimits: object_array_frame=%d, member_cache=%d, callback_depth=%d, arrow=%b,"
            + " daemon=%b",
        OBJECT_ARRAY_FRAME, MEMBER_CACHE_SIZE, MAX_CALLBACK_DEPTH, ARROW_ENABLED, ATTACH_AS_DAEMON);
  }

  private BridgeLimits() {} // Prevent instantiation
}
