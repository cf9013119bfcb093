package org.jbridge;

/**
 * The bridge was called incorrectly: a malformed signature, a wrong argument count, a missing
 * method ID or a static/instance mismatch.
 */
public class BridgeUsageException extends IllegalArgumentException {
  public BridgeUsageException(String message) {
    super(message);
  }

  public BridgeUsageException(String message, Throwable cause) {
    super(message, cause);
  }
}
