package org.jbridge;

/** No overload matched, or a value could not be cast to the required type. */
public class BridgeTypeException extends ClassCastException {
  public BridgeTypeException(String message) {
    super(message);
  }
}
