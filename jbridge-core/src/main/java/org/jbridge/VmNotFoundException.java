package org.jbridge;

/** No usable VM library was found. */
public class VmNotFoundException extends BridgeSetupException {
  public VmNotFoundException(String message) {
    super(message);
  }
}
