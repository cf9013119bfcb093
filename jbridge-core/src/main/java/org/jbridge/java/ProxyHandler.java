package org.jbridge.java;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import org.jbridge.vm.inprocess.NativeBinding;

/**
 * The invocation handler behind every host-implemented proxy. Lives on the VM side; calls on the
 * proxy go to the native {@code invokeNative} method, which the bridge binds when the VM starts.
 *
 * <p>{@code Object} methods are answered here so that proxies can be hashed and printed without a
 * round trip.
 */
public class ProxyHandler implements InvocationHandler {

  /** Descriptor of the native entry point. */
  public static final String INVOKE_NATIVE_SIGNATURE =
      "(JLjava/lang/Object;Ljava/lang/reflect/Method;[Ljava/lang/Object;)Ljava/lang/Object;";

  private final long target;

  public ProxyHandler(long target) {
    this.target = target;
  }

  /** The host reference id of the object implementing the proxy. */
  public long getTarget() {
    return target;
  }

  @Override
  public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
    if (method.getDeclaringClass() == Object.class) {
      switch (method.getName()) {
        case "toString":
          return "HostProxy[" + target + "]";
        case "hashCode":
          return Long.hashCode(target);
        case "equals":
          return proxy == args[0];
        default:
          break;
      }
    }
    return invokeNative(target, proxy, method, args);
  }

  private static Object invokeNative(long target, Object proxy, Method method, Object[] args)
      throws Throwable {
    return NativeBinding.invoke(ProxyHandler.class, "invokeNative", target, proxy, method, args);
  }
}
