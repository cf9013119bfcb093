package org.jbridge.reflect;

import org.jbridge.env.BridgeEnv;
import org.jbridge.env.JObject;

/**
 * Host implementation of one interface method of a {@link JavaProxy}.
 *
 * <p>The arguments are released when the call returns; keep one with {@link
 * BridgeEnv#newGlobalRef}. Primitive arguments arrive boxed inside the VM, as {@code
 * java.lang.reflect.Proxy} passes them. The result may be null, a {@link JObject}, or a plain
 * value that the bridge boxes.
 */
@FunctionalInterface
public interface ProxyMethod {
  Object call(BridgeEnv env, JObject[] args) throws Exception;
}
