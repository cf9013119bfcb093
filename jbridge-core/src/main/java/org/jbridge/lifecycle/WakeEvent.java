package org.jbridge.lifecycle;

/**
 * An auto-resetting event: {@link #set()} wakes one pending or future {@link #await()}, and any
 * number of sets before the wait collapse into one wake.
 */
public final class WakeEvent {
  private final Object lock = new Object();
  private boolean signalled;

  public void set() {
    synchronized (lock) {
      signalled = true;
      lock.notifyAll();
    }
  }

  /** Block until set, then reset. */
  public void await() throws InterruptedException {
    synchronized (lock) {
      while (!signalled) {
        lock.wait();
      }
      signalled = false;
    }
  }

  public boolean isSet() {
    synchronized (lock) {
      return signalled;
    }
  }
}
