package org.jbridge.vm;

/**
 * Host implementation of a method that the VM invokes natively, bound with {@link
 * NativeEnv#registerNatives}.
 *
 * <p>The arguments are the native method's parameters: primitives as raw slots and objects as
 * local references valid for the duration of the call. The return value is a reference handle
 * (local or global) or {@code 0} for object results, and the raw {@link JValue} bits for
 * primitive results. To throw into the VM, leave an exception pending on {@code env}.
 */
@FunctionalInterface
public interface NativeMethod {
  long invoke(NativeEnv env, JValue[] args);
}
