package org.jbridge.vm;

/** A failed invocation-interface call, carrying the native return code. */
public class NativeVmException extends Exception {
  private final int returnCode;

  public NativeVmException(int returnCode, String message) {
    super(message + " (" + Jni.describe(returnCode) + ")");
    this.returnCode = returnCode;
  }

  public int getReturnCode() {
    return returnCode;
  }
}
