package org.jbridge.env;

import org.jbridge.NativeAllocationException;
import org.jbridge.vm.Jni;
import org.jbridge.vm.NativeEnv;

/**
 * A local reference frame: every local reference created while it is open is deleted when it
 * closes.
 */
public final class LocalFrame implements AutoCloseable {
  private final NativeEnv env;
  private boolean open;

  LocalFrame(NativeEnv env, int capacity) {
    this.env = env;
    push(capacity);
  }

  private void push(int capacity) {
    if (env.pushLocalFrame(capacity) != Jni.JNI_OK) {
      env.exceptionClear();
      throw new NativeAllocationException(
          "Failed to allocate local frame of " + capacity + " references");
    }
    open = true;
  }

  /** Delete the references gathered so far and start over with a fresh frame. */
  public void reset(int capacity) {
    close();
    push(capacity);
  }

  @Override
  public void close() {
    if (open) {
      open = false;
      env.popLocalFrame(Jni.NULL_REF);
    }
  }
}
