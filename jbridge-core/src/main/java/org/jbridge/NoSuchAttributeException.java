package org.jbridge;

/** A wrapper has no field or host attribute with the requested name. */
public class NoSuchAttributeException extends BridgeTypeException {
  private final String attribute;

  public NoSuchAttributeException(String owner, String attribute) {
    super(owner + " has no attribute '" + attribute + "'");
    this.attribute = attribute;
  }

  public String getAttribute() {
    return attribute;
  }
}
