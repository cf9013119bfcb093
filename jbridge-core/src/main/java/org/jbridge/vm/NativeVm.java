package org.jbridge.vm;

/** The invocation interface of a running VM. */
public interface NativeVm {

  /**
   * Attach the calling thread. Attaching an already-attached thread returns its existing
   * environment.
   *
   * @param asDaemon attach as a daemon thread, which does not hold VM shutdown
   */
  NativeEnv attachCurrentThread(boolean asDaemon) throws NativeVmException;

  /** Detach the calling thread, invalidating its environment. */
  int detachCurrentThread();

  /** The environment of the calling thread, or null when it is not attached. */
  NativeEnv getEnv();

  /** Tear down the VM. Every environment becomes invalid. */
  int destroyJavaVm();
}
