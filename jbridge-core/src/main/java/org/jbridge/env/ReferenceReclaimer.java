package org.jbridge.env;

import org.jbridge.observability.Metrics;

/**
 * Deletes released global references: at once when the releasing thread has an environment,
 * otherwise through the {@link DeadObjectQueue}. References outliving the VM are dropped, since
 * the VM took them down with it.
 */
public final class ReferenceReclaimer {
  private final EnvironmentRegistry registry;
  private final DeadObjectQueue queue;

  ReferenceReclaimer(EnvironmentRegistry registry, DeadObjectQueue queue) {
    this.registry = registry;
    this.queue = queue;
  }

  void release(long handle) {
    if (!registry.isBound()) {
      return;
    }
    BridgeEnv env = registry.current();
    if (env != null) {
      env.deleteGlobalRef(handle);
    } else {
      queue.enqueue(handle);
    }
  }

  /** Counted whenever a reference is handed out as owned. */
  void created() {
    Metrics.getInstance().recordGlobalRefCreated();
  }

  public DeadObjectQueue queue() {
    return queue;
  }
}
