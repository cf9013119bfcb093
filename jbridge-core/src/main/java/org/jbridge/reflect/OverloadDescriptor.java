package org.jbridge.reflect;

import java.util.List;

/**
 * One public method or constructor as discovered by reflection.
 *
 * @param parameterTypes descriptors of the declared parameters
 * @param returnType the return descriptor; {@code V} for constructors
 */
public record OverloadDescriptor(
    String name, List<String> parameterTypes, String returnType, boolean varArgs, boolean isStatic) {

  public int parameterCount() {
    return parameterTypes.size();
  }

  /** The method descriptor, e.g. {@code (ILjava/lang/String;)V}. */
  public String signature() {
    return "(" + String.join("", parameterTypes) + ")" + returnType;
  }

  @Override
  public String toString() {
    return name + signature() + (varArgs ? " (varargs)" : "");
  }
}
