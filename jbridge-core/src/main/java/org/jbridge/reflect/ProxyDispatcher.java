package org.jbridge.reflect;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.jbridge.env.BridgeEnv;
import org.jbridge.env.EnvironmentRegistry;
import org.jbridge.env.JObject;
import org.jbridge.env.JObjectHolder;
import org.jbridge.java.ProxyHandler;
import org.jbridge.lifecycle.NativeRegistration;
import org.jbridge.observability.BridgeLogger;
import org.jbridge.observability.Metrics;
import org.jbridge.util.JavaCalls;
import org.jbridge.util.NiceValues;
import org.jbridge.vm.JValue;
import org.jbridge.vm.NativeEnv;
import org.jbridge.vm.NativeMethod;

/**
 * The host side of {@code ProxyHandler.invokeNative}: routes a call on a proxy to the {@link
 * JavaProxy} it was created for.
 *
 * <p>The environment supplied with the callback is made current for the duration of the call, so
 * bridge calls made by the host method run on it. A failure in the host method is thrown into the
 * VM as {@code java.lang.Error("Host exception: ...")}.
 */
public final class ProxyDispatcher implements NativeMethod {
  private static final Logger LOG = Logger.getLogger(ProxyDispatcher.class.getName());

  private final EnvironmentRegistry registry;
  private final HostReferences references;

  public ProxyDispatcher(EnvironmentRegistry registry, HostReferences references) {
    this.registry = registry;
    this.references = references;
  }

  /** The binding to register when the VM starts. */
  public NativeRegistration registration() {
    return new NativeRegistration(
        "org/jbridge/java/ProxyHandler",
        "invokeNative",
        ProxyHandler.INVOKE_NATIVE_SIGNATURE,
        this);
  }

  @Override
  public long invoke(NativeEnv nativeEnv, JValue[] args) {
    long targetId = args[0].getJ();
    long start = System.nanoTime();
    String methodName = "?";
    int argCount = 0;
    String error = null;

    BridgeEnv env;
    try {
      env = registry.enter(nativeEnv);
    } catch (RuntimeException e) {
      Metrics.getInstance().recordCallback(false);
      throwHostException(nativeEnv, e);
      return 0;
    }
    JObject[] callArgs = null;
    try {
      // --- 1. WHAT IS BEING CALLED ---
      methodName =
          (String)
              JavaCalls.call(env, env.borrow(args[2].getL()), "getName", "()Ljava/lang/String;");
      callArgs = env.getObjectArrayElements(env.borrow(args[3].getL()));
      if (callArgs == null) callArgs = new JObject[0];
      argCount = callArgs.length;

      Object target = references.redeem(targetId);
      if (!(target instanceof JavaProxy proxy)) {
        throw new IllegalStateException("No host object for proxy target " + targetId);
      }
      ProxyMethod method = proxy.method(methodName);
      if (method == null) {
        throw new UnsupportedOperationException(
            proxy.interfaceNames() + " proxy does not implement " + methodName);
      }

      // --- 2. CALL THE HOST ---
      Object result = method.call(env, callArgs);

      // --- 3. HAND THE RESULT BACK AS A LOCAL REFERENCE ---
      return toLocal(env, nativeEnv, result);
    } catch (Exception e) {
      error = e.toString();
      LOG.log(Level.FINE, "Host method " + methodName + " failed", e);
      throwHostException(nativeEnv, e);
      return 0;
    } finally {
      if (callArgs != null) {
        for (JObject a : callArgs) {
          if (a != null) a.close();
        }
      }
      registry.exit();
      long latencyMicros = (System.nanoTime() - start) / 1000;
      Metrics.getInstance().recordCallback(error == null);
      BridgeLogger.logCallback(targetId, methodName, argCount, latencyMicros, error);
    }
  }

  private static long toLocal(BridgeEnv env, NativeEnv nativeEnv, Object result) {
    if (result instanceof JObjectHolder holder) {
      result = holder.toJObject();
    }
    if (result == null) return 0;
    if (result instanceof JObject obj) {
      return nativeEnv.newLocalRef(obj.handle());
    }
    Object boxed = NiceValues.getNiceArg(env, result, "Ljava/lang/Object;");
    if (!(boxed instanceof JObject obj)) {
      throw new IllegalArgumentException(result + " is not a Java object");
    }
    try (obj) {
      return nativeEnv.newLocalRef(obj.handle());
    }
  }

  private static void throwHostException(NativeEnv nativeEnv, Exception e) {
    if (nativeEnv.exceptionCheck()) {
      nativeEnv.exceptionClear();
    }
    long errorClass = nativeEnv.findClass("java/lang/Error");
    nativeEnv.throwNew(errorClass, "Host exception: " + e);
    nativeEnv.deleteLocalRef(errorClass);
  }
}
