package org.jbridge.observability;

/** The kinds of bridge call tracked by {@link Metrics}. */
public enum CallKind {
  CALL_METHOD("CallMethod"),
  CALL_STATIC_METHOD("CallStaticMethod"),
  NEW_OBJECT("NewObject"),
  GET_FIELD("GetField"),
  SET_FIELD("SetField"),
  GET_STATIC_FIELD("GetStaticField"),
  SET_STATIC_FIELD("SetStaticField"),
  ARRAY_TRANSFER("ArrayTransfer"),
  CALLBACK("Callback");

  private final String displayName;

  CallKind(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }
}
