package org.jbridge;

/**
 * The VM could not be located, created or attached to. Never retried by the bridge.
 */
public class BridgeSetupException extends RuntimeException {
  /** Marker for setup errors that did not come from a native call. */
  public static final int NO_RETURN_CODE = Integer.MIN_VALUE;

  private final int returnCode;

  public BridgeSetupException(String message) {
    super(message);
    this.returnCode = NO_RETURN_CODE;
  }

  public BridgeSetupException(String message, int returnCode) {
    super(message);
    this.returnCode = returnCode;
  }

  public BridgeSetupException(String message, Throwable cause) {
    super(message, cause);
    this.returnCode = NO_RETURN_CODE;
  }

  /** The native return code, or {@link #NO_RETURN_CODE}. */
  public int getReturnCode() {
    return returnCode;
  }
}
