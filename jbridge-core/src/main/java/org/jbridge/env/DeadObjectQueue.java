package org.jbridge.env;

import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.logging.Logger;
import org.jbridge.observability.BridgeEvents;
import org.jbridge.observability.BridgeLogger;
import org.jbridge.observability.Metrics;

/**
 * Global references released on threads without an environment, waiting to be deleted.
 *
 * <p>Any thread may enqueue. {@link #reap} is called from a thread with a valid environment,
 * normally the VM monitor thread when it is woken by the enqueue listener. Each queued handle is
 * deleted exactly once.
 */
public final class DeadObjectQueue {
  private static final Logger LOG = Logger.getLogger(DeadObjectQueue.class.getName());

  private final ConcurrentLinkedQueue<Long> dead = new ConcurrentLinkedQueue<>();
  private final Runnable onEnqueue;

  /** @param onEnqueue run after every enqueue, typically to wake the reaping thread */
  public DeadObjectQueue(Runnable onEnqueue) {
    this.onEnqueue = onEnqueue;
  }

  public DeadObjectQueue() {
    this(() -> {});
  }

  public void enqueue(long handle) {
    dead.add(handle);
    Metrics.getInstance().recordDeferredRelease();
    onEnqueue.run();
  }

  /**
   * Delete every queued reference through {@code env}.
   *
   * @return the number of references deleted
   */
  public int reap(BridgeEnv env) {
    int reclaimed = 0;
    Long handle;
    while ((handle = dead.poll()) != null) {
      env.deleteGlobalRef(handle);
      reclaimed++;
    }
    if (reclaimed > 0) {
      Metrics.getInstance().recordReap(reclaimed);
      BridgeEvents.emitReap(reclaimed);
      BridgeLogger.logReap(reclaimed, Thread.currentThread().getName());
      LOG.finer("Reaped " + reclaimed + " dead references");
    }
    return reclaimed;
  }

  public boolean contains(long handle) {
    return dead.contains(handle);
  }

  public int size() {
    return dead.size();
  }

  public boolean isEmpty() {
    return dead.isEmpty();
  }
}
