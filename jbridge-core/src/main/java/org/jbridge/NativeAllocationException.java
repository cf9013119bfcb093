package org.jbridge;

/** The VM failed to allocate a string, array, frame or object. */
public class NativeAllocationException extends RuntimeException {
  public NativeAllocationException(String message) {
    super(message);
  }
}
