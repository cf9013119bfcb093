package org.jbridge;

/**
 * The thread or VM lifecycle contract was broken: detach without attach, start after shutdown,
 * use of the bridge from a thread with no environment.
 */
public class LifecycleException extends IllegalStateException {
  public LifecycleException(String message) {
    super(message);
  }
}
