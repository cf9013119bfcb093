package org.jbridge.reflect;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Host objects the VM refers to by id. A locked object stays reachable until it is unlocked, so
 * that the VM can call back into it through a proxy.
 */
public final class HostReferences {
  private final Map<Long, Object> locked = new ConcurrentHashMap<>();
  private final AtomicLong nextId = new AtomicLong(1);

  /** Keep {@code target} reachable and return its id. */
  public long lock(Object target) {
    long id = nextId.getAndIncrement();
    locked.put(id, target);
    return id;
  }

  /** The object locked under {@code id}, or null. */
  public Object redeem(long id) {
    return locked.get(id);
  }

  public void unlock(long id) {
    locked.remove(id);
  }

  public int size() {
    return locked.size();
  }
}
