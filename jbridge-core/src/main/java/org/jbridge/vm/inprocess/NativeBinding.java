package org.jbridge.vm.inprocess;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.jbridge.vm.NativeMethod;

/**
 * Bindings of native methods registered through {@code RegisterNatives}.
 *
 * <p>A Java class with a native entry point calls {@link #invoke} from that method's body. As with
 * a real VM, bindings belong to the class and therefore to the process; the most recent
 * registration wins and a destroyed VM drops its own.
 */
public final class NativeBinding {

  private record Binding(InProcessVm vm, String signature, NativeMethod method) {}

  private static final Map<String, Binding> BINDINGS = new ConcurrentHashMap<>();

  private NativeBinding() {} // Prevent instantiation

  static void register(InProcessVm vm, Class<?> owner, String name, String sig, NativeMethod m) {
    BINDINGS.put(owner.getName() + "." + name, new Binding(vm, sig, m));
  }

  static void unregisterAll(InProcessVm vm) {
    BINDINGS.values().removeIf(b -> b.vm() == vm);
  }

  /**
   * Dispatch a native method of {@code owner} to its registered host implementation.
   *
   * @throws UnsatisfiedLinkError when nothing is registered for the method
   */
  public static Object invoke(Class<?> owner, String name, Object... args) throws Throwable {
    Binding binding = BINDINGS.get(owner.getName() + "." + name);
    if (binding == null) {
      throw new UnsatisfiedLinkError("No native binding for " + owner.getName() + "." + name);
    }
    return binding.vm().invokeNative(binding.signature(), binding.method(), args);
  }
}
