package org.jbridge.env;

import java.util.logging.Logger;
import org.jbridge.BridgeLimits;
import org.jbridge.BridgeSetupException;
import org.jbridge.LifecycleException;
import org.jbridge.observability.BridgeLogger;
import org.jbridge.vm.NativeEnv;
import org.jbridge.vm.NativeVm;
import org.jbridge.vm.NativeVmException;

/**
 * Per-thread attachment state for one VM.
 *
 * <p>{@link #attach()} and {@link #detach()} are reference counted: only the first attach and the
 * matching last detach reach the VM. {@link #enter} and {@link #exit} bracket a callback from the
 * VM, making the environment the VM handed to the callback current without disturbing the
 * thread's own attachment.
 */
public final class EnvironmentRegistry {
  private static final Logger LOG = Logger.getLogger(EnvironmentRegistry.class.getName());

  private final ThreadLocal<ThreadEnvironment> threads =
      ThreadLocal.withInitial(ThreadEnvironment::new);
  private final ReferenceReclaimer reclaimer;
  private volatile NativeVm vm;
  private volatile ArgumentBoxer boxer = ArgumentBoxer.NONE;

  public EnvironmentRegistry(DeadObjectQueue deadObjects) {
    this.reclaimer = new ReferenceReclaimer(this, deadObjects);
  }

  // ========== BINDING ==========

  /** Start serving environments of {@code vm}. */
  public void bind(NativeVm vm) {
    this.vm = vm;
  }

  /** Stop serving environments; references released afterwards are dropped. */
  public void unbind() {
    this.vm = null;
    threads.remove();
  }

  public boolean isBound() {
    return vm != null;
  }

  public ReferenceReclaimer reclaimer() {
    return reclaimer;
  }

  /** Install the conversion applied to plain host values passed as objects. */
  public void setArgumentBoxer(ArgumentBoxer boxer) {
    this.boxer = boxer == null ? ArgumentBoxer.NONE : boxer;
  }

  /** Wrap an environment of the bound VM. */
  public BridgeEnv wrap(NativeEnv env) {
    return new BridgeEnv(env, reclaimer, boxer);
  }

  /** Record that the calling thread was attached by VM creation. */
  public BridgeEnv bindCreator(NativeEnv env) {
    ThreadEnvironment t = threads.get();
    t.env = wrap(env);
    t.attachCount = 1;
    t.creator = true;
    return t.env;
  }

  // ========== ATTACHMENT ==========

  /** Attach the calling thread, or count one more attachment if it already is. */
  public BridgeEnv attach() {
    NativeVm target = vm;
    if (target == null) {
      throw new LifecycleException("The VM is not running");
    }
    ThreadEnvironment t = threads.get();
    if (t.attachCount == 0) {
      boolean daemon = BridgeLimits.ATTACH_AS_DAEMON;
      NativeEnv raw;
      try {
        raw = target.attachCurrentThread(daemon);
      } catch (NativeVmException e) {
        throw new BridgeSetupException(
            "Failed to attach to current thread. Return code = " + e.getReturnCode(),
            e.getReturnCode());
      }
      t.env = wrap(raw);
      // Threads started outside Java have no context loader
      Thread current = Thread.currentThread();
      if (current.getContextClassLoader() == null) {
        current.setContextClassLoader(ClassLoader.getSystemClassLoader());
      }
      BridgeLogger.logAttachment("attach", daemon);
    }
    t.attachCount++;
    return t.env;
  }

  /** Undo one {@link #attach()}; the last one detaches the thread from the VM. */
  public void detach() {
    ThreadEnvironment t = threads.get();
    if (t.attachCount == 0) {
      threads.remove();
      throw new LifecycleException(
          "detach() called on thread " + Thread.currentThread().getName() + " which is not attached");
    }
    if (--t.attachCount == 0) {
      NativeVm target = vm;
      if (target != null) {
        target.detachCurrentThread();
      }
      threads.remove();
      BridgeLogger.logAttachment("detach", false);
    }
  }

  /**
   * Detach the calling thread completely.
   *
   * @return the number of attachments that were outstanding
   */
  public int detachAll() {
    ThreadEnvironment t = threads.get();
    int outstanding = t.attachCount;
    if (outstanding > 0 && !t.creator) {
      t.attachCount = 1;
      detach();
    } else {
      threads.remove();
    }
    if (outstanding > 1) {
      LOG.fine("Detached " + outstanding + " outstanding attachments");
    }
    return outstanding;
  }

  public int attachCount() {
    return threads.get().attachCount;
  }

  // ========== CALLBACKS ==========

  /** Make {@code env} current for the duration of a callback. */
  public BridgeEnv enter(NativeEnv env) {
    ThreadEnvironment t = threads.get();
    BridgeLimits.checkCallbackDepth(t.saved.size() + 1);
    t.saved.add(t.env);
    t.env = wrap(env);
    return t.env;
  }

  /** Restore the environment that was current before the matching {@link #enter}. */
  public void exit() {
    ThreadEnvironment t = threads.get();
    if (t.saved.isEmpty()) {
      throw new LifecycleException("exit() without a matching enter()");
    }
    t.env = t.saved.remove(t.saved.size() - 1);
    if (t.env == null && t.attachCount == 0 && t.saved.isEmpty()) {
      threads.remove();
    }
  }

  // ========== LOOKUP ==========

  /** The environment of the calling thread, or null. */
  public BridgeEnv current() {
    return vm == null ? null : threads.get().env;
  }

  public BridgeEnv requireCurrent() {
    BridgeEnv env = current();
    if (env == null) {
      throw new LifecycleException(
          "Thread " + Thread.currentThread().getName() + " has no environment; call attach() first");
    }
    return env;
  }
}
