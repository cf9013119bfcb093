package org.jbridge.env;

/**
 * Converts a plain host value into a VM object for an object-typed parameter. Returns null when it
 * does not know how, in which case the argument is rejected.
 */
@FunctionalInterface
public interface ArgumentBoxer {
  ArgumentBoxer NONE = (env, value, type) -> null;

  /**
   * @param type the descriptor of the parameter, e.g. {@code Ljava/lang/String;} or {@code [I}
   * @return an owned object which the caller releases after the call, or null
   */
  JObject box(BridgeEnv env, Object value, String type);
}
