package org.jbridge.env;

import java.lang.ref.Cleaner;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jbridge.LifecycleException;

/**
 * A reference to an object inside the VM.
 *
 * <p>An {@link Ownership#OWNED} handle holds a global reference which is deleted once, either by
 * {@link #close()} or, when the handle becomes unreachable, from the cleaner thread. The cleaner
 * thread is never attached, so the latter always goes through the dead object queue. Equality is
 * by raw handle value.
 */
public class JObject implements AutoCloseable {
  private static final Cleaner CLEANER = Cleaner.create();

  private final long handle;
  private final Ownership ownership;
  private final Release release;
  private final Cleaner.Cleanable cleanable;

  protected JObject(long handle, Ownership ownership, ReferenceReclaimer reclaimer) {
    if (handle == 0) {
      throw new IllegalArgumentException("Null reference cannot be wrapped");
    }
    this.handle = handle;
    this.ownership = ownership;
    if (ownership == Ownership.OWNED) {
      this.release = new Release(handle, reclaimer);
      this.cleanable = CLEANER.register(this, release);
    } else {
      this.release = null;
      this.cleanable = null;
    }
  }

  /** Take ownership of a global reference. */
  public static JObject owned(long handle, ReferenceReclaimer reclaimer) {
    return new JObject(handle, Ownership.OWNED, reclaimer);
  }

  /** Alias a reference whose lifetime is managed elsewhere. */
  public static JObject borrowed(long handle) {
    return new JObject(handle, Ownership.BORROWED, null);
  }

  /** The raw handle of a possibly-null object. */
  public static long handleOf(JObject obj) {
    return obj == null ? 0 : obj.handle();
  }

  public long handle() {
    if (release != null && release.done.get()) {
      throw new LifecycleException("Handle 0x" + Long.toHexString(handle) + " has been released");
    }
    return handle;
  }

  public Ownership ownership() {
    return ownership;
  }

  public boolean isReleased() {
    return release != null && release.done.get();
  }

  /** Release the reference. Safe to call more than once; a no-op for borrowed handles. */
  @Override
  public void close() {
    if (cleanable != null) {
      cleanable.clean();
    }
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof JObject other && other.handle == handle;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(handle);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "[0x"
        + Long.toHexString(handle)
        + ", "
        + ownership
        + (isReleased() ? ", released" : "")
        + "]";
  }

  // Must not reference the JObject, or it would never become phantom reachable
  private static final class Release implements Runnable {
    private final long handle;
    private final ReferenceReclaimer reclaimer;
    private final AtomicBoolean done = new AtomicBoolean();

    Release(long handle, ReferenceReclaimer reclaimer) {
      this.handle = handle;
      this.reclaimer = reclaimer;
    }

    @Override
    public void run() {
      if (done.compareAndSet(false, true)) {
        reclaimer.release(handle);
      }
    }
  }
}
