package org.jbridge.reflect;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.jbridge.env.BridgeEnv;
import org.jbridge.env.JClass;
import org.jbridge.env.JMethodId;
import org.jbridge.env.JObject;
import org.jbridge.env.JObjectHolder;
import org.jbridge.util.JavaCalls;

/**
 * A VM object implementing Java interfaces with host code, built on {@code
 * java.lang.reflect.Proxy}.
 *
 * <p>Each interface method is looked up by name in the method table given at construction. The
 * proxy keeps this object reachable until {@link #close()}; after that, calls on the VM proxy fail
 * with a {@code java.lang.Error}.
 */
public final class JavaProxy implements JObjectHolder, AutoCloseable {
  private static final Logger LOG = Logger.getLogger(JavaProxy.class.getName());

  private final HostReferences references;
  private final Map<String, ProxyMethod> methods;
  private final List<String> interfaceNames;
  private final long id;
  private final JObject handler;
  private final JObject proxy;

  /**
   * @param interfaceNames dotted or slashed names of the interfaces to implement
   */
  public JavaProxy(
      BridgeEnv env,
      HostReferences references,
      Map<String, ProxyMethod> methods,
      List<String> interfaceNames) {
    if (interfaceNames.isEmpty()) {
      throw new IllegalArgumentException("A proxy needs at least one interface");
    }
    this.references = references;
    this.methods = Map.copyOf(methods);
    this.interfaceNames = List.copyOf(interfaceNames);
    this.id = references.lock(this);
    try {
      this.handler = JavaCalls.makeInstance(env, "org/jbridge/java/ProxyHandler", "(J)V", id);
      this.proxy = newProxyInstance(env, handler, this.interfaceNames);
    } catch (RuntimeException e) {
      references.unlock(id);
      throw e;
    }
    LOG.fine("Created proxy " + id + " for " + this.interfaceNames);
  }

  private static JObject newProxyInstance(
      BridgeEnv env, JObject handler, List<String> interfaceNames) {
    JClass[] interfaces = new JClass[interfaceNames.size()];
    try (JClass classClass = env.findClass("java/lang/Class")) {
      for (int i = 0; i < interfaces.length; i++) {
        interfaces[i] = JavaCalls.classForName(env, interfaceNames.get(i));
      }
      try (JObject interfaceArray = env.makeObjectArray(interfaces.length, classClass);
          JObject loader = classLoaderOf(env, interfaces[0]);
          JClass proxyClass = env.findClass("java/lang/reflect/Proxy")) {
        for (int i = 0; i < interfaces.length; i++) {
          env.setObjectArrayElement(interfaceArray, i, interfaces[i]);
        }
        JMethodId newProxyInstance =
            env.getStaticMethodId(
                proxyClass,
                "newProxyInstance",
                "(Ljava/lang/ClassLoader;[Ljava/lang/Class;Ljava/lang/reflect/InvocationHandler;)"
                    + "Ljava/lang/Object;");
        return (JObject)
            env.callStaticMethod(proxyClass, newProxyInstance, loader, interfaceArray, handler);
      }
    } finally {
      for (JClass c : interfaces) {
        if (c != null) c.close();
      }
    }
  }

  /** The interface's own loader, or the system loader for bootstrap interfaces. */
  private static JObject classLoaderOf(BridgeEnv env, JClass iface) {
    JObject loader =
        (JObject) JavaCalls.call(env, iface, "getClassLoader", "()Ljava/lang/ClassLoader;");
    if (loader != null) return loader;
    return (JObject)
        JavaCalls.staticCall(
            env, "java/lang/ClassLoader", "getSystemClassLoader", "()Ljava/lang/ClassLoader;");
  }

  /** The host implementation of {@code name}, or null. */
  ProxyMethod method(String name) {
    return methods.get(name);
  }

  public List<String> interfaceNames() {
    return interfaceNames;
  }

  /** The id under which this proxy is registered in {@link HostReferences}. */
  public long id() {
    return id;
  }

  @Override
  public JObject toJObject() {
    return proxy;
  }

  /** Unregister the host side and release the VM proxy. */
  @Override
  public void close() {
    references.unlock(id);
    proxy.close();
    handler.close();
  }

  @Override
  public String toString() {
    return "JavaProxy[" + id + ", " + interfaceNames + "]";
  }
}
