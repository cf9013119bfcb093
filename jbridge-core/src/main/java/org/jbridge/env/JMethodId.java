package org.jbridge.env;

/**
 * A resolved method or constructor. {@code isStatic} records which lookup family produced the ID,
 * so it always agrees with the call family the ID may be used with.
 */
public record JMethodId(long id, String name, String signature, boolean isStatic) {

  public MethodSignature parsedSignature() {
    return MethodSignature.parse(signature);
  }
}
